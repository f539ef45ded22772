package com.seequence.api.service.image;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 이미지 생성 요청 입력값 (provider 형식의 key/value)
 * 불변 객체. 재시도마다 with/without 으로 새 payload를 만든다.
 */
public final class ImageRequestPayload {

    public static final String PROMPT = "prompt";
    public static final String SEED = "seed";
    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";
    public static final String ASPECT_RATIO = "aspect_ratio";

    private final Map<String, Object> values;

    private ImageRequestPayload(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ImageRequestPayload of(String prompt) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(PROMPT, Objects.requireNonNull(prompt, "prompt"));
        return new ImageRequestPayload(values);
    }

    public ImageRequestPayload with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new ImageRequestPayload(copy);
    }

    public ImageRequestPayload without(String... keys) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        for (String key : keys) {
            copy.remove(key);
        }
        return new ImageRequestPayload(copy);
    }

    public ImageRequestPayload withPrompt(String prompt) {
        return with(PROMPT, prompt);
    }

    public String getPrompt() {
        return (String) values.get(PROMPT);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> toMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageRequestPayload)) return false;
        return values.equals(((ImageRequestPayload) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        Map<String, Object> printable = new LinkedHashMap<>(values);
        String prompt = getPrompt();
        if (prompt != null && prompt.length() > 60) {
            printable.put(PROMPT, prompt.substring(0, 60) + "...");
        }
        return printable.toString();
    }
}
