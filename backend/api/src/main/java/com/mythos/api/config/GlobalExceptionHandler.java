package com.mythos.api.config;

import com.mythos.api.service.pipeline.GenerationRejectedException;
import com.mythos.common.dto.ApiResponse;
import com.mythos.common.exception.ApiException;
import com.mythos.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 전역 예외 처리기
 * - 모든 예외를 ApiResponse 형식으로 변환
 * - 파이프라인 거부는 사유/단계/리셋 시각 포함, 내부 오류는 요청 ID만 노출
 * - 서버 측 오류는 상세 로그 기록 (요청 ID, 타임스탬프, 스택 트레이스)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * 생성 파이프라인 거부
     */
    @ExceptionHandler(GenerationRejectedException.class)
    public ResponseEntity<ApiResponse<Void>> handleRejection(GenerationRejectedException e, WebRequest request) {
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[Rejected] {} at {} ({}) - {}", e.getReason().getCode(), e.getState(),
                    request.getDescription(false), e.getMessage());
        } else {
            log.info("[Rejected] {} at {} ({})", e.getReason().getCode(), e.getState(), request.getDescription(false));
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.rejected(errorCode, e.getMessage(), e.getErrorType(), e.getResetAt()));
    }

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        ErrorCode errorCode = e.getErrorCode();

        if (!errorCode.getStatus().is5xxServerError()) {
            log.warn("[ApiException] {} ({}) - {} [{}]", errorCode.getCode(), errorCode.name(),
                    e.getMessage(), request.getDescription(false));
            return ResponseEntity
                    .status(errorCode.getStatus())
                    .body(ApiResponse.error(errorCode, e.getMessage()));
        }

        String requestId = generateRequestId();
        log.error("=== API Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Timestamp: {}", LocalDateTime.now().format(TIMESTAMP_FORMAT));
        log.error("Error Code: {} ({})", errorCode.getCode(), errorCode.name());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("=====================");

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, String.format("%s [%s]", errorCode.getMessage(), requestId)));
    }

    /**
     * 요청 본문/경로 변수 형식 오류
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e, WebRequest request) {
        log.warn("[BadRequest] {} - {} [{}]", e.getClass().getSimpleName(), e.getMessage(), request.getDescription(false));
        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST));
    }

    /**
     * 존재하지 않는 경로 / 지원하지 않는 메서드
     */
    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ApiResponse<Void>> handleRouting(Exception e) {
        ErrorResponse errorResponse = (ErrorResponse) e;
        return ResponseEntity
                .status(errorResponse.getStatusCode())
                .body(ApiResponse.error(ErrorCode.NOT_FOUND, e.getMessage()));
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

        String userMessage = String.format("%s [Request ID: %s]", ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), requestId);

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
}
