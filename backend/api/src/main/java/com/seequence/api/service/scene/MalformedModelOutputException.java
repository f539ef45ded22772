package com.seequence.api.service.scene;

import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;

/**
 * 모델 응답에서 JSON 배열을 찾지 못한 경우
 */
public class MalformedModelOutputException extends ApiException {

    private static final int PREVIEW_LENGTH = 200;

    public MalformedModelOutputException(String rawOutput, Throwable cause) {
        super(ErrorCode.MALFORMED_MODEL_OUTPUT, buildMessage(rawOutput), cause);
    }

    private static String buildMessage(String rawOutput) {
        return "LLM returned non-JSON output: " + preview(rawOutput);
    }

    private static String preview(String rawOutput) {
        if (rawOutput == null) {
            return "";
        }
        return rawOutput.length() <= PREVIEW_LENGTH ? rawOutput : rawOutput.substring(0, PREVIEW_LENGTH);
    }
}
