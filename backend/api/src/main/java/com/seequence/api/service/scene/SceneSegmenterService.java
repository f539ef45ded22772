package com.seequence.api.service.scene;

import com.seequence.api.dto.SceneDto;

import java.util.List;

/**
 * 텍스트 → 장면(스토리 비트) 분할
 */
public interface SceneSegmenterService {

    /**
     * @param text 원문
     * @param maxScenes 최대 장면 수 (1 이상)
     * @return scene_id 1..N 순서의 장면 목록 (prompt, image_url 없음), N ≤ maxScenes
     */
    List<SceneDto.Scene> segment(String text, int maxScenes);
}
