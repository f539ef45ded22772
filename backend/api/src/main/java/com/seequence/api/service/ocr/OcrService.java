package com.seequence.api.service.ocr;

/**
 * 이미지 속 텍스트 추출
 */
public interface OcrService {

    String DEFAULT_HINT = "Extract all readable text from this image as plain text. Preserve line breaks.";

    /**
     * @param imageUrl http(s) URL 또는 data URL
     * @param promptHint 추출 지시문 (null/공백이면 DEFAULT_HINT)
     * @return 앞뒤 공백을 제거한 텍스트 (비어 있지 않음)
     */
    String extractFromUrl(String imageUrl, String promptHint);

    /**
     * 업로드된 이미지 바이트에서 추출 (data URL로 변환해 전달)
     */
    String extractFromBytes(byte[] data, String contentType, String promptHint);
}
