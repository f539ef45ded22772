package com.seequence.api.service.image;

import java.util.List;
import java.util.Locale;

/**
 * 파라미터 거부 시 재요청 규칙 목록
 * 먼저 매칭되는 규칙 하나만 적용하고, 재요청은 한 번뿐이다.
 * 크레딧 부족은 규칙이 아니라 호출 측에서 먼저 걸러낸다.
 */
public final class RetryLadder {

    public static final String COMPOSITION_HINT = "\n\n[Compose in a 16:9 aspect ratio]";
    static final int FALLBACK_WIDTH = 1280;
    static final int FALLBACK_HEIGHT = 720;

    private final List<ReshapeRule> rules;

    public RetryLadder(List<ReshapeRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * 1) aspect ratio 거부 → aspect_ratio 제거, 1280x720
     * 2) width/height/size/dimension 거부 → width/height 제거, aspect_ratio
     * 3) 그 외 → 크기 파라미터 제거, 프롬프트에 구도 힌트
     */
    public static RetryLadder standard(String configuredAspectRatio) {
        String aspectRatio = ImageSizing.aspectRatioOrDefault(configuredAspectRatio);
        return new RetryLadder(List.of(
                new ReshapeRule("aspect-ratio-to-dimensions",
                        msg -> lower(msg).contains("aspect") && lower(msg).contains("ratio"),
                        payload -> payload.without(ImageRequestPayload.ASPECT_RATIO)
                                .with(ImageRequestPayload.WIDTH, FALLBACK_WIDTH)
                                .with(ImageRequestPayload.HEIGHT, FALLBACK_HEIGHT)),
                new ReshapeRule("dimensions-to-aspect-ratio",
                        msg -> containsAny(lower(msg), "width", "height", "size", "dimension"),
                        payload -> payload.without(ImageRequestPayload.WIDTH, ImageRequestPayload.HEIGHT)
                                .with(ImageRequestPayload.ASPECT_RATIO, aspectRatio)),
                new ReshapeRule("prompt-composition-hint",
                        msg -> true,
                        payload -> payload.without(ImageRequestPayload.WIDTH, ImageRequestPayload.HEIGHT)
                                .withPrompt(payload.getPrompt() + COMPOSITION_HINT))
        ));
    }

    /**
     * @return 매칭 규칙, 없으면 null
     */
    public ReshapeRule select(String errorMessage) {
        for (ReshapeRule rule : rules) {
            if (rule.matches(errorMessage)) {
                return rule;
            }
        }
        return null;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String value, String... tokens) {
        for (String token : tokens) {
            if (value.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
