package com.seequence.api.service.image;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * provider 응답(JSON)에서 이미지 URL 하나를 꺼낸다.
 *
 * 시도 순서
 * 1. 배열 첫 요소가 URL 문자열
 * 2. 배열 첫 요소가 파일 핸들 ({url} 또는 {path} → file://path)
 * 3. 배열 전체 순회 (URL 문자열, 객체 값 중 URL)
 * 4. 단일 문자열
 * 5. 객체 값 순회 (URL 문자열, 첫 요소가 URL/파일 핸들인 배열)
 * 6. 단일 파일 핸들 객체
 */
public final class ProviderOutputNormalizer {

    private ProviderOutputNormalizer() {
    }

    public static String normalize(JsonNode output) {
        if (output == null || output.isNull() || output.isMissingNode()) {
            throw new UnrecognizedProviderResponseException(describe(output));
        }

        if (output.isArray() && output.size() > 0) {
            JsonNode first = output.get(0);
            if (isUrl(first)) {
                return first.asText();
            }
            String handle = fromFileHandle(first);
            if (handle != null) {
                return handle;
            }
            for (JsonNode element : output) {
                if (isUrl(element)) {
                    return element.asText();
                }
                if (element.isObject()) {
                    String nested = firstUrlValue(element);
                    if (nested != null) {
                        return nested;
                    }
                }
            }
        }

        if (output.isTextual() && !output.asText().isBlank()) {
            return output.asText();
        }

        if (output.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = output.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (isUrl(value)) {
                    return value.asText();
                }
                if (value.isArray() && value.size() > 0) {
                    JsonNode first = value.get(0);
                    if (isUrl(first)) {
                        return first.asText();
                    }
                    if (first.isObject() && isUrl(first.get("url"))) {
                        return first.get("url").asText();
                    }
                }
            }
            String handle = fromFileHandle(output);
            if (handle != null) {
                return handle;
            }
        }

        throw new UnrecognizedProviderResponseException(describe(output));
    }

    static boolean isUrl(JsonNode node) {
        return node != null && node.isTextual() && node.asText().startsWith("http");
    }

    private static String fromFileHandle(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode url = node.get("url");
        if (url != null && url.isTextual() && !url.asText().isBlank()) {
            return url.asText();
        }
        JsonNode path = node.get("path");
        if (path != null && path.isTextual() && !path.asText().isBlank()) {
            return "file://" + path.asText();
        }
        return null;
    }

    private static String firstUrlValue(JsonNode object) {
        Iterator<JsonNode> values = object.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (isUrl(value)) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * 오류 메시지용 응답 형태 요약 (예: array[2] of object{id,status})
     */
    static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "missing";
        }
        if (node.isArray()) {
            return node.size() == 0 ? "array[0]" : "array[" + node.size() + "] of " + describe(node.get(0));
        }
        if (node.isObject()) {
            StringBuilder sb = new StringBuilder("object{");
            Iterator<String> names = node.fieldNames();
            int count = 0;
            while (names.hasNext() && count < 8) {
                if (count > 0) sb.append(',');
                sb.append(names.next());
                count++;
            }
            return sb.append('}').toString();
        }
        return node.getNodeType().name().toLowerCase();
    }
}
