package com.aitimeline.api.config;

import com.aitimeline.common.dto.ApiResponse;
import com.aitimeline.common.exception.ApiException;
import com.aitimeline.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 전역 예외 처리기
 * - ApiException 은 ErrorCode 의 HTTP 상태로 변환
 * - 요청 파싱 오류는 400
 * - 그 외 예외는 요청 ID 와 함께 로그를 남기고 500 계열로 변환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     * 4xx 는 검증 실패이므로 스택 트레이스 없이 warn 으로 남긴다.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is4xxClientError()) {
            log.warn("[ApiException] requestId={} code={} ({}) uri={} message={}",
                    requestId, errorCode.getCode(), errorCode.name(), request.getDescription(false), e.getMessage());
        } else {
            log.error("=== API Exception ===");
            log.error("Request ID: {}", requestId);
            log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
            log.error("Error Code: {} ({})", errorCode.getCode(), errorCode.name());
            log.error("Message: {}", e.getMessage());
            log.error("Request URI: {}", request.getDescription(false));
            log.error("Stack Trace: ", e);
            log.error("=====================");
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, e.getMessage(), requestId)));
    }

    /**
     * 요청 본문/파라미터 파싱 실패
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[BadRequest] requestId={} uri={} type={} message={}",
                requestId, request.getDescription(false), e.getClass().getSimpleName(), e.getMessage());

        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST,
                        buildUserMessage(ErrorCode.INVALID_REQUEST, null, requestId)));
    }

    /**
     * RuntimeException 처리 - 저장소/외부 연동 예외
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse<Void>> handleRuntimeException(RuntimeException e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Runtime Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
        log.error("Exception Type: {}", e.getClass().getSimpleName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("=========================");

        ErrorCode errorCode = mapExceptionToErrorCode(e);
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, String.format("%s [요청 ID: %s]", errorCode.getMessage(), requestId)));
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

    /**
     * RuntimeException 메시지로 ErrorCode 추정
     */
    private ErrorCode mapExceptionToErrorCode(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";

        if (message.contains("ffmpeg") || message.contains("frame")) {
            return ErrorCode.FRAME_EXTRACTION_FAILED;
        }
        if (message.contains("s3") || message.contains("storage")) {
            return ErrorCode.STORAGE_FAILED;
        }
        if (message.contains("replicate") || message.contains("upscal")) {
            return ErrorCode.ENHANCEMENT_PROVIDER_FAILED;
        }
        if (message.contains("timeout") || message.contains("timed out") || message.contains("unavailable")) {
            return ErrorCode.GENERATION_PROVIDER_UNAVAILABLE;
        }
        return ErrorCode.INTERNAL_SERVER_ERROR;
    }
}
