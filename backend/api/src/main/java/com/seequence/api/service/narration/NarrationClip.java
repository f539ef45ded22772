package com.seequence.api.service.narration;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 장면 하나의 나레이션 결과
 * 실패 시 empty() (audioUrl, durationSeconds 모두 null)
 */
@Getter
@AllArgsConstructor
public class NarrationClip {

    private static final NarrationClip EMPTY = new NarrationClip(null, null, null);

    private final String audioUrl;
    private final Double durationSeconds;
    /** 서버 내부 파일 경로 (병합용, 응답에 노출하지 않음) */
    private final Path filePath;

    public static NarrationClip empty() {
        return EMPTY;
    }

    public boolean isPresent() {
        return audioUrl != null && filePath != null;
    }
}
