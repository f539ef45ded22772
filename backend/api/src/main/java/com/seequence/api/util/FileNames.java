package com.seequence.api.util;

import java.time.Instant;
import java.util.UUID;

/**
 * 충돌 방지 파일명 조각 (타임스탬프 + 짧은 랜덤 suffix)
 */
public final class FileNames {

    private static final int MAX_COMPONENT_LENGTH = 80;

    private FileNames() {
    }

    public static long epochNanos() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    /**
     * UUID 앞 6자리 (hex)
     */
    public static String shortRandom() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 6);
    }

    /**
     * 파일명에 넣을 수 있게 [A-Za-z0-9_-] 외 문자를 _ 로 치환
     */
    public static String sanitize(String component) {
        if (component == null || component.isBlank()) {
            return "default";
        }
        String sanitized = component.trim().replaceAll("[^A-Za-z0-9_-]", "_");
        return sanitized.length() > MAX_COMPONENT_LENGTH ? sanitized.substring(0, MAX_COMPONENT_LENGTH) : sanitized;
    }
}
