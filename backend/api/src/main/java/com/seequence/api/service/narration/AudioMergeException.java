package com.seequence.api.service.narration;

import com.seequence.api.dto.SceneDto;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.Getter;

import java.util.List;

/**
 * 나레이션 병합 실패
 * 병합 전에 계산한 타임라인을 함께 전달한다.
 */
@Getter
public class AudioMergeException extends ApiException {

    private final List<SceneDto.TimelineEntry> timeline;

    public AudioMergeException(String message, List<SceneDto.TimelineEntry> timeline, Throwable cause) {
        super(ErrorCode.AUDIO_MERGE_FAILED, message, cause);
        this.timeline = timeline == null ? List.of() : List.copyOf(timeline);
    }
}
