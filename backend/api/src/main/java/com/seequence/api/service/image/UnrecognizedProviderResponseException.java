package com.seequence.api.service.image;

import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.Getter;

/**
 * provider 응답에서 이미지 URL을 찾지 못함
 */
@Getter
public class UnrecognizedProviderResponseException extends ApiException {

    private final String observedShape;

    public UnrecognizedProviderResponseException(String observedShape) {
        super(ErrorCode.UNRECOGNIZED_PROVIDER_RESPONSE, "Unexpected image provider output format: " + observedShape);
        this.observedShape = observedShape;
    }
}
