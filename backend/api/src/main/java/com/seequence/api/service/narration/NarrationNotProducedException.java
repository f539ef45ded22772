package com.seequence.api.service.narration;

import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;

/**
 * 모든 장면의 나레이션 생성이 실패한 경우
 */
public class NarrationNotProducedException extends ApiException {

    public NarrationNotProducedException(int sceneCount) {
        super(ErrorCode.NARRATION_NOT_PRODUCED,
                "No narration audio was produced for any of " + sceneCount + " scenes");
    }
}
