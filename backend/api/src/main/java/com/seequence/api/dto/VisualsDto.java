package com.seequence.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.List;

/**
 * 장면 분할 / 이미지 / 비주얼 생성 API DTO
 */
public class VisualsDto {

    /**
     * 분할 및 비주얼 생성 공통 요청
     * maxScenes 미지정 시 seequence.pipeline.default-max-scenes 사용
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TextRequest {
        @NotBlank
        private String text;
        @Min(1)
        private Integer maxScenes;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SegmentResponse {
        private List<SceneDto.Scene> scenes;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class GenerateImageRequest {
        @NotBlank
        private String prompt;
        private Integer seed;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class GenerateImageResponse {
        private String imageUrl;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VisualsResponse {
        private String title;
        private List<SceneDto.Scene> scenes;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VisualsWithAudioResponse {
        private String title;
        private List<SceneDto.SceneWithAudio> scenes;
    }

    /**
     * 장면별 나레이션을 하나의 트랙으로 병합한 결과
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SingleAudioResponse {
        private String title;
        private String audioUrl;
        private double durationSeconds;
        private List<SceneDto.TimelineEntry> timeline;
        private List<SceneDto.Scene> scenes;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class HealthResponse {
        private String status;
        private boolean imageProviderConfigured;
        private String pipelineEngine;
    }
}
