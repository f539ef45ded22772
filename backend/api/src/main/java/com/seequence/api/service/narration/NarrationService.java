package com.seequence.api.service.narration;

import java.util.List;

/**
 * 장면 나레이션 생성 및 병합
 */
public interface NarrationService {

    /**
     * 장면 텍스트 음성 합성
     * 예외를 던지지 않는다. 실패 시 NarrationClip.empty()
     */
    NarrationClip synthesize(int sceneId, String text);

    /**
     * 장면 순서대로 클립 병합
     * @throws AudioMergeException 병합 도구 없음 또는 병합 실패 (타임라인 포함)
     */
    MergedNarration merge(List<SceneAudioFile> clips);
}
