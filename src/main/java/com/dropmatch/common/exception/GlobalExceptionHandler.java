package com.dropmatch.common.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>모든 에러 응답을 RFC 7807 ProblemDetail 형식으로 통일한다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: 엔진 거절 결과를 웹 경계에서 변환한 예외</li>
 *   <li><b>MethodArgumentNotValidException / HttpMessageNotReadableException</b>: 요청 본문 검증 실패</li>
 *   <li><b>MissingRequestHeaderException</b>: Idempotency-Key 등 필수 헤더 누락</li>
 *   <li><b>RequestNotPermitted</b>: Resilience4j Rate Limiter 초과</li>
 *   <li><b>CallNotPermittedException</b>: Resilience4j Circuit Breaker OPEN</li>
 * </ol>
 *
 * <p>권한 관련 거절은 항상 {@link ErrorCode#FORBIDDEN}의 고정 메시지로만 응답한다.
 * 내부 사유(NotOwner, NotAssigned 등)는 감사 로그에만 남는다.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://dropmatch.io/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        return problem(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse(ErrorCode.INVALID_INPUT.getMessage());
        return problem(ErrorCode.INVALID_INPUT, detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return problem(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ProblemDetail> handleMissingHeader(MissingRequestHeaderException e) {
        return problem(ErrorCode.INVALID_INPUT, "Missing required header: " + e.getHeaderName());
    }

    // ★ Resilience4j Rate Limiter 초과 → 429
    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return problem(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.getMessage());
    }

    // ★ Resilience4j Circuit Breaker OPEN → 503
    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return problem(ErrorCode.CIRCUIT_BREAKER_OPEN, ErrorCode.CIRCUIT_BREAKER_OPEN.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        HttpStatus status = errorCode.getStatus();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        // type URI: 에러 코드명을 소문자로 변환하여 에러 문서 URI 생성
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        return ResponseEntity.status(status).body(problem);
    }
}
