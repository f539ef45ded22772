package com.seequence.api.service.image;

import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;

import java.util.List;
import java.util.Locale;

/**
 * 이미지 provider 크레딧 부족 (HTTP 402)
 * 재시도하지 않고 요청 전체를 중단한다.
 */
public class BillingCreditException extends ApiException {

    private static final List<String> BILLING_PHRASES = List.of(
            "insufficient credit", "status: 402", "billing_hard_limit_reached", "billing hard limit");

    public BillingCreditException(String provider) {
        super(ErrorCode.PAYMENT_REQUIRED,
                provider + " billing: insufficient credit. Please add credit to your " + provider + " account.");
    }

    /**
     * 402 또는 크레딧/결제 한도 문구 포함 여부
     */
    public static boolean isBillingFailure(int status, String message) {
        if (status == 402) {
            return true;
        }
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return BILLING_PHRASES.stream().anyMatch(normalized::contains);
    }

    public static boolean isBillingFailure(ProviderRejectedException e) {
        return isBillingFailure(e.getStatus(), e.getMessage());
    }
}
