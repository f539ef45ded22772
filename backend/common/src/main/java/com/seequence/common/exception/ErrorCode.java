package com.seequence.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),
    STREAM_CAPACITY_EXCEEDED(HttpStatus.SERVICE_UNAVAILABLE, "C003", "동시 스트리밍 요청이 너무 많습니다. 잠시 후 다시 시도해주세요."),

    // Scene - 장면 분할
    MALFORMED_MODEL_OUTPUT(HttpStatus.BAD_GATEWAY, "S001", "장면 분할 결과를 해석할 수 없습니다. 다시 시도해주세요."),

    // Image - 이미지 생성
    PAYMENT_REQUIRED(HttpStatus.PAYMENT_REQUIRED, "I001", "이미지 생성 크레딧이 부족합니다. 결제 정보를 확인해주세요."),
    UPSTREAM_GENERATION_FAILED(HttpStatus.BAD_GATEWAY, "I002", "이미지 생성에 실패했습니다."),
    UNRECOGNIZED_PROVIDER_RESPONSE(HttpStatus.BAD_GATEWAY, "I003", "이미지 생성 서비스의 응답 형식을 인식할 수 없습니다."),
    IMAGE_PROVIDER_NOT_CONFIGURED(HttpStatus.SERVICE_UNAVAILABLE, "I004", "이미지 생성 서비스가 설정되지 않았습니다."),

    // Narration - 나레이션
    NARRATION_NOT_PRODUCED(HttpStatus.BAD_GATEWAY, "N001", "생성된 나레이션이 없습니다."),
    AUDIO_MERGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "N002", "나레이션 병합에 실패했습니다."),

    // OCR
    OCR_NO_TEXT(HttpStatus.UNPROCESSABLE_ENTITY, "O001", "이미지에서 텍스트를 찾지 못했습니다."),

    // AI Service
    AI_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "A001", "AI 서비스를 사용할 수 없습니다."),
    AI_API_KEY_INVALID(HttpStatus.UNAUTHORIZED, "A003", "API 키가 유효하지 않습니다. 설정을 확인해주세요.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
