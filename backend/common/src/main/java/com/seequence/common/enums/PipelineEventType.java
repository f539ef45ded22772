package com.seequence.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 스트리밍 파이프라인 진행 이벤트
 * code는 SSE event 이름으로 그대로 사용된다.
 */
@Getter
@RequiredArgsConstructor
public enum PipelineEventType {

    SEGMENTED("segmented", "장면 분할 완료"),
    SUMMARIZED("summarized", "전체 요약 완료"),
    TITLE("title", "제목 생성 완료"),
    SCENE_PROMPT("scene_prompt", "장면 프롬프트 생성"),
    SCENE_IMAGE_START("scene_image_start", "장면 이미지 생성 시작"),
    SCENE_IMAGE_DONE("scene_image_done", "장면 이미지 생성 완료"),
    SCENE_AUDIO_START("scene_audio_start", "장면 나레이션 생성 시작"),
    SCENE_AUDIO_DONE("scene_audio_done", "장면 나레이션 생성 완료"),
    MERGE_START("merge_start", "나레이션 병합 시작"),
    MERGE_DONE("merge_done", "나레이션 병합 완료"),
    COMPLETE("complete", "완료"),
    ERROR("error", "실패");

    private final String code;
    private final String description;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
