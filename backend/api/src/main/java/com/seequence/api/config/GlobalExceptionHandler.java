package com.seequence.api.config;

import com.seequence.common.dto.ApiResponse;
import com.seequence.common.exception.ApiException;
import com.seequence.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 전역 예외 처리기
 * - ApiException은 ErrorCode의 HTTP 상태 그대로 반환 (크레딧 부족 402, 업스트림 실패 502 등)
 * - 요청 ID를 로그와 응답 메시지에 함께 남긴다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        log.error("=== API Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
        log.error("Error Code: {} ({})", errorCode.getCode(), errorCode.name());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("=====================");

        String userMessage = buildUserMessage(errorCode, e.getMessage(), requestId);

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, userMessage));
    }

    /**
     * 요청 본문 검증 실패
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", "));
        log.warn("[Validation] Invalid fields: {}", detail);

        return badRequest("잘못된 요청 필드: " + detail);
    }

    /**
     * JSON 파싱 실패, multipart 파트 누락
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception e) {
        log.warn("[Validation] Unreadable request: {}", e.getMessage());
        return badRequest(ErrorCode.INVALID_REQUEST.getMessage());
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Unexpected Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
        log.error("Exception Type: {}", e.getClass().getName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("============================");

        String userMessage = String.format(
            "서버 오류가 발생했습니다. [요청 ID: %s] 문제가 지속되면 관리자에게 문의해주세요.",
            requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage));
    }

    private ResponseEntity<ApiResponse<Void>> badRequest(String message) {
        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST, message));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }
}
