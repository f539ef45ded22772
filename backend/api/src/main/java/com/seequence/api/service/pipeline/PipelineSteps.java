package com.seequence.api.service.pipeline;

import com.seequence.api.dto.SceneDto;
import com.seequence.api.service.image.BillingCreditException;
import com.seequence.api.service.image.ImageGeneratorService;
import com.seequence.api.service.prompt.PromptSynthesizerService;
import com.seequence.api.service.scene.SceneSegmenterService;
import com.seequence.api.util.BestEffort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 두 실행 방식이 공유하는 단계 구현
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineSteps {

    private final SceneSegmenterService sceneSegmenterService;
    private final PromptSynthesizerService promptSynthesizerService;
    private final ImageGeneratorService imageGeneratorService;

    public PipelineRun segment(PipelineRun run) {
        return run.withScenes(sceneSegmenterService.segment(run.getInputText(), run.getMaxScenes()));
    }

    public PipelineRun summarize(PipelineRun run) {
        BestEffort<String> summary = BestEffort.attempt("global summary",
                () -> promptSynthesizerService.summarizeGlobalContext(
                        run.getInputText(), PromptSynthesizerService.DEFAULT_SUMMARY_CHARS));
        return run.toBuilder().globalSummary(summary).build();
    }

    public PipelineRun title(PipelineRun run) {
        BestEffort<String> title = BestEffort.attempt("title",
                () -> promptSynthesizerService.generateTitle(
                        run.getInputText(), PromptSynthesizerService.DEFAULT_TITLE_CHARS));
        return run.toBuilder().title(title).build();
    }

    /**
     * 장면 순서대로 프롬프트 작성
     */
    public PipelineRun writePrompts(PipelineRun run) {
        List<SceneDto.Scene> prompted = new ArrayList<>();
        for (SceneDto.Scene scene : run.getScenes()) {
            prompted.add(writePrompt(scene, run.getGlobalSummary().orElse(null)));
        }
        return run.withScenes(prompted);
    }

    public SceneDto.Scene writePrompt(SceneDto.Scene scene, String globalSummary) {
        String prompt = promptSynthesizerService.generatePrompt(
                scene.getSceneSummary(), globalSummary, null, scene.getSourceSentences());
        log.debug("[PIPELINE] Scene {} prompt: {}", scene.getSceneId(), prompt);
        return scene.toBuilder().prompt(prompt).build();
    }

    /**
     * 이미지 생성. 크레딧 부족만 전파하고 나머지 실패는 image_url = null
     */
    public SceneDto.Scene renderImageIsolated(SceneDto.Scene scene) {
        try {
            return renderImage(scene);
        } catch (BillingCreditException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[PIPELINE] Scene {} image failed, continuing without image: {}",
                    scene.getSceneId(), e.getMessage());
            return scene.toBuilder().imageUrl(null).build();
        }
    }

    /**
     * 이미지 생성 (실패 그대로 전파)
     */
    public SceneDto.Scene renderImage(SceneDto.Scene scene) {
        String url = imageGeneratorService.generate(scene.getPrompt(), null);
        return scene.toBuilder().imageUrl(url).build();
    }
}
