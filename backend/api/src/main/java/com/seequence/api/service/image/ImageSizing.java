package com.seequence.api.service.image;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * 모델 계열별 크기 파라미터 결정
 * - SD3 계열: aspect_ratio 만 허용
 * - 그 외: width/height (64 배수) > aspect_ratio > 미지정
 */
@Slf4j
public final class ImageSizing {

    public static final String DEFAULT_ASPECT_RATIO = "16:9";
    static final int SIZE_STEP = 64;

    private static final List<String> ASPECT_RATIO_ONLY_MODELS = List.of(
            "stability-ai/stable-diffusion-3",
            "stability-ai/sd3",
            "stable-diffusion-3",
            "sd3"
    );

    private ImageSizing() {
    }

    /**
     * 64 미만은 64, 그 외는 64 배수로 내림 (100 → 64, 130 → 128, 0 → 64)
     */
    public static int clamp(int value) {
        return (Math.max(SIZE_STEP, value) / SIZE_STEP) * SIZE_STEP;
    }

    public static boolean isAspectRatioOnly(String modelId) {
        if (modelId == null) {
            return false;
        }
        String normalized = modelId.toLowerCase(Locale.ROOT);
        return ASPECT_RATIO_ONLY_MODELS.stream().anyMatch(normalized::contains);
    }

    public static String aspectRatioOrDefault(String aspectRatio) {
        return aspectRatio == null || aspectRatio.isBlank() ? DEFAULT_ASPECT_RATIO : aspectRatio;
    }

    /**
     * 기본 payload에 크기 파라미터 적용
     */
    public static ImageRequestPayload apply(ImageRequestPayload payload, String modelId,
                                            Integer width, Integer height, String aspectRatio) {
        if (isAspectRatioOnly(modelId)) {
            return payload.with(ImageRequestPayload.ASPECT_RATIO, aspectRatioOrDefault(aspectRatio));
        }
        if (width != null && height != null && width > 0 && height > 0) {
            int clampedWidth = clamp(width);
            int clampedHeight = clamp(height);
            if (clampedWidth != width || clampedHeight != height) {
                log.info("[IMAGE] Adjusted requested size {}x{} -> {}x{} for model {}",
                        width, height, clampedWidth, clampedHeight, modelId);
            }
            return payload.with(ImageRequestPayload.WIDTH, clampedWidth)
                    .with(ImageRequestPayload.HEIGHT, clampedHeight);
        }
        if (aspectRatio != null && !aspectRatio.isBlank()) {
            return payload.with(ImageRequestPayload.ASPECT_RATIO, aspectRatio);
        }
        return payload;
    }
}
