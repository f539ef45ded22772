package com.seequence.api.service.image;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * provider 거부 메시지 조건 + payload 변환 한 쌍
 */
public final class ReshapeRule {

    private final String name;
    private final Predicate<String> matcher;
    private final UnaryOperator<ImageRequestPayload> reshape;

    public ReshapeRule(String name, Predicate<String> matcher, UnaryOperator<ImageRequestPayload> reshape) {
        this.name = name;
        this.matcher = matcher;
        this.reshape = reshape;
    }

    public String getName() {
        return name;
    }

    public boolean matches(String errorMessage) {
        return matcher.test(errorMessage == null ? "" : errorMessage);
    }

    public ImageRequestPayload reshape(ImageRequestPayload payload) {
        return reshape.apply(payload);
    }
}
