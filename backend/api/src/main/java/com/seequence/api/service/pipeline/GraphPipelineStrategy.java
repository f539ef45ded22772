package com.seequence.api.service.pipeline;

import com.seequence.api.dto.SceneDto;
import com.seequence.common.enums.PipelineEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 고정 순서 단계 그래프: segment → summarize → prompts → images
 * 분기 없음. 이미지는 장면 순서대로 하나씩 생성한다.
 */
@Slf4j
@Component
public class GraphPipelineStrategy implements PipelineStrategy {

    private final List<PipelineStage> stages;

    public GraphPipelineStrategy(PipelineSteps steps) {
        this.stages = List.of(
                PipelineStage.of("segment", steps::segment),
                PipelineStage.of("summarize", steps::summarize),
                PipelineStage.of("prompts", steps::writePrompts),
                PipelineStage.of("images", run -> {
                    List<SceneDto.Scene> rendered = new ArrayList<>();
                    for (SceneDto.Scene scene : run.getScenes()) {
                        rendered.add(steps.renderImageIsolated(scene));
                    }
                    return run.withScenes(rendered);
                })
        );
    }

    @Override
    public PipelineEngine getEngine() {
        return PipelineEngine.GRAPH;
    }

    @Override
    public PipelineRun run(String text, int maxScenes) {
        PipelineRun run = PipelineRun.start(text, maxScenes);
        for (PipelineStage stage : stages) {
            long startedAt = System.currentTimeMillis();
            run = stage.apply(run);
            log.info("[PIPELINE] graph stage '{}' done in {}ms ({} scenes)",
                    stage.getName(), System.currentTimeMillis() - startedAt, run.getScenes().size());
        }
        return run;
    }

    List<String> getStageNames() {
        List<String> names = new ArrayList<>();
        for (PipelineStage stage : stages) {
            names.add(stage.getName());
        }
        return names;
    }
}
