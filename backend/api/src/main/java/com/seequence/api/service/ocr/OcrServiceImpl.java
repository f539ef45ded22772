package com.seequence.api.service.ocr;

import com.seequence.api.service.llm.VisionTextExtractor;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Base64;

@Slf4j
@Service
@RequiredArgsConstructor
public class OcrServiceImpl implements OcrService {

    private static final String DEFAULT_CONTENT_TYPE = "image/png";

    private final VisionTextExtractor visionTextExtractor;

    @Override
    public String extractFromUrl(String imageUrl, String promptHint) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "image_url is required");
        }
        String hint = (promptHint == null || promptHint.isBlank()) ? DEFAULT_HINT : promptHint;

        String raw = visionTextExtractor.extractText(imageUrl, hint);
        String text = raw == null ? "" : raw.strip();
        if (text.isEmpty()) {
            throw new ApiException(ErrorCode.OCR_NO_TEXT);
        }
        log.info("[OCR] Extracted {} chars", text.length());
        return text;
    }

    @Override
    public String extractFromBytes(byte[] data, String contentType, String promptHint) {
        if (data == null || data.length == 0) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Uploaded image is empty");
        }
        return extractFromUrl(toDataUrl(data, contentType), promptHint);
    }

    static String toDataUrl(byte[] data, String contentType) {
        String type = (contentType == null || contentType.isBlank()) ? DEFAULT_CONTENT_TYPE : contentType;
        return "data:" + type + ";base64," + Base64.getEncoder().encodeToString(data);
    }
}
