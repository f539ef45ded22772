package com.seequence.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.List;

/**
 * 장면 관련 DTO
 * JSON 필드는 snake_case (scene_id, image_url ...)
 */
public class SceneDto {

    /**
     * 장면 하나 (분할 → 프롬프트 → 이미지 순으로 채워진다)
     * 단계마다 toBuilder()로 새 인스턴스를 만든다.
     */
    @Getter
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Scene {
        private int sceneId;
        private String sceneSummary;
        private List<Integer> sourceSentenceIndices;
        private List<String> sourceSentences;
        private String prompt;
        private String imageUrl;
    }

    /**
     * 나레이션이 붙은 장면
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SceneWithAudio {
        private int sceneId;
        private String sceneSummary;
        private List<Integer> sourceSentenceIndices;
        private List<String> sourceSentences;
        private String prompt;
        private String imageUrl;
        private String audioUrl;
        private Double audioDurationSeconds;

        public static SceneWithAudio of(Scene scene, String audioUrl, Double audioDurationSeconds) {
            return SceneWithAudio.builder()
                    .sceneId(scene.getSceneId())
                    .sceneSummary(scene.getSceneSummary())
                    .sourceSentenceIndices(scene.getSourceSentenceIndices())
                    .sourceSentences(scene.getSourceSentences())
                    .prompt(scene.getPrompt())
                    .imageUrl(scene.getImageUrl())
                    .audioUrl(audioUrl)
                    .audioDurationSeconds(audioDurationSeconds)
                    .build();
        }
    }

    /**
     * 병합된 나레이션 트랙 내 장면 구간
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TimelineEntry {
        private int sceneId;
        private double startSec;
        private double durationSec;
    }
}
