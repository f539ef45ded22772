package com.seequence.api.service.pipeline;

import com.seequence.api.dto.SceneDto;
import com.seequence.api.util.BestEffort;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 요청 하나 동안만 존재하는 파이프라인 상태
 * 각 단계는 toBuilder()로 새 상태를 만들어 다음 단계에 넘긴다.
 */
@Getter
@Builder(toBuilder = true)
public class PipelineRun {

    private final String inputText;
    private final int maxScenes;
    @Builder.Default
    private final BestEffort<String> globalSummary = BestEffort.empty();
    @Builder.Default
    private final List<SceneDto.Scene> scenes = List.of();
    @Builder.Default
    private final BestEffort<String> title = BestEffort.empty();

    public static PipelineRun start(String inputText, int maxScenes) {
        return PipelineRun.builder().inputText(inputText).maxScenes(maxScenes).build();
    }

    public PipelineRun withScenes(List<SceneDto.Scene> scenes) {
        return toBuilder().scenes(List.copyOf(scenes)).build();
    }
}
