package com.seequence.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * 파이프라인 실행 방식
 */
@Getter
@RequiredArgsConstructor
public enum PipelineEngine {
    GRAPH("graph", "단계 그래프 순차 실행"),
    IMPERATIVE("imperative", "이미지 병렬 생성 (동시성 제한)");

    private final String code;
    private final String description;

    /**
     * 설정 문자열에서 변환, 알 수 없는 값은 GRAPH
     */
    public static PipelineEngine fromCode(String code) {
        if (code == null) {
            return GRAPH;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (PipelineEngine engine : values()) {
            if (engine.code.equals(normalized)) {
                return engine;
            }
        }
        // "langgraph" 등 이전 설정값은 GRAPH로 취급
        return GRAPH;
    }
}
