package com.dropmatch.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형.
 *
 * <h3>에러 코드 분류</h3>
 * <ul>
 *   <li><b>Common</b>: 입력값 오류, 인증 누락</li>
 *   <li><b>Authorization</b>: NotOwner / NotAssigned / RoleInsufficient 를 모두 {@link #FORBIDDEN}
 *       하나로 합친다. 어떤 사유로 거절됐는지 외부에 드러나면 배달 ID 열거(enumeration)가 가능해지기 때문.</li>
 *   <li><b>Lifecycle</b>: 상태 전이 거절, 동시 수정 충돌</li>
 *   <li><b>Payment</b>: 금액 검증 실패, 중복 결제, 환불 실패</li>
 *   <li><b>Traffic (Resilience4j)</b>: Rate Limiter, Circuit Breaker</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Authentication required"),

    // ── Authorization (메시지 고정, 사유 비공개) ──
    FORBIDDEN(HttpStatus.FORBIDDEN, "You are not allowed to perform this action"),

    // ── Delivery lifecycle ──
    ILLEGAL_TRANSITION(HttpStatus.CONFLICT, "Action not allowed in current state"),
    CONTENTION(HttpStatus.CONFLICT, "The delivery was modified concurrently. Please retry"),
    DRIVER_UNAVAILABLE(HttpStatus.CONFLICT, "Driver is not currently available"),

    // ── Payment ──
    PAYMENT_NOT_VERIFIED(HttpStatus.UNPROCESSABLE_ENTITY, "Payment could not be verified"),
    DUPLICATE_PAYMENT(HttpStatus.CONFLICT, "Payment already processed for this delivery"),
    PAYMENT_IN_PROGRESS(HttpStatus.CONFLICT, "Another payment request for this delivery is still in progress"),
    PAYMENT_DECLINED(HttpStatus.PAYMENT_REQUIRED, "Payment was declined by the provider"),
    REFUND_FAILED(HttpStatus.BAD_GATEWAY, "Refund could not be completed. Please retry"),
    WEBHOOK_REJECTED(HttpStatus.BAD_REQUEST, "Webhook could not be verified"),

    // ── Traffic (Resilience4j) ──
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Please try again later"),
    CIRCUIT_BREAKER_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "Service circuit breaker is open");

    private final HttpStatus status;
    private final String message;
}
