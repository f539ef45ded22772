package com.seequence.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * 이미지 텍스트 추출(OCR) API DTO
 */
public class OcrDto {

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ImageUrlRequest {
        @NotBlank
        private String imageUrl;
        private String promptHint;
    }

    /**
     * 이미지 URL → 텍스트 추출 → 비주얼 생성
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VisualsFromImageUrlRequest {
        @NotBlank
        private String imageUrl;
        @Min(1)
        private Integer maxScenes;
        private String promptHint;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TextResponse {
        private String extractedText;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VisualsFromImageResponse {
        private String extractedText;
        private VisualsDto.VisualsResponse result;
    }
}
