package com.seequence.api.service.image;

import lombok.Getter;

/**
 * 이미지 provider가 요청을 거부했을 때 (HTTP 4xx/5xx 또는 prediction failed)
 * RetryLadder 판단에 쓰이며 외부로 그대로 나가지 않는다.
 */
@Getter
public class ProviderRejectedException extends RuntimeException {

    /** HTTP 상태 코드. prediction 자체가 실패한 경우 0 */
    private final int status;

    public ProviderRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }
}
