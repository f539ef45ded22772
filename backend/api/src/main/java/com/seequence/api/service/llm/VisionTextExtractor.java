package com.seequence.api.service.llm;

/**
 * 이미지 → 텍스트 추출
 */
public interface VisionTextExtractor {

    /**
     * @param imageUrl http(s) URL 또는 data:image/...;base64, URL
     * @param instruction 추출 지시문
     */
    String extractText(String imageUrl, String instruction);
}
