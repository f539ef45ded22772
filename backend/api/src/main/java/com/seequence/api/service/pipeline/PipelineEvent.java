package com.seequence.api.service.pipeline;

import com.seequence.common.enums.PipelineEventType;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스트리밍 진행 이벤트 (SSE event name = type.code)
 */
@Getter
public class PipelineEvent {

    private final PipelineEventType type;
    /** key/value Map 또는 complete 이벤트의 결과 객체 */
    private final Object data;

    private PipelineEvent(PipelineEventType type, Object data) {
        this.type = type;
        this.data = data;
    }

    public static PipelineEvent withPayload(PipelineEventType type, Object payload) {
        return new PipelineEvent(type, payload);
    }

    /**
     * key/value 쌍으로 payload 구성 (null 값 허용)
     */
    public static PipelineEvent of(PipelineEventType type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new PipelineEvent(type, Collections.unmodifiableMap(data));
    }

    /**
     * Map payload의 필드 조회 (Map이 아니면 null)
     */
    public Object get(String key) {
        return data instanceof Map<?, ?> map ? map.get(key) : null;
    }

    public String getName() {
        return type.getCode();
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    @Override
    public String toString() {
        return "PipelineEvent[" + type.getCode() + "]";
    }
}
