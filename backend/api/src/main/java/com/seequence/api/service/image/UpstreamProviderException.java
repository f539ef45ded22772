package com.seequence.api.service.image;

import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;

/**
 * 재시도와 파라미터 폴백 이후에도 남은 provider 실패
 */
public class UpstreamProviderException extends ApiException {

    public UpstreamProviderException(String upstreamMessage, Throwable cause) {
        super(ErrorCode.UPSTREAM_GENERATION_FAILED, "Image generation failed: " + upstreamMessage, cause);
    }
}
