package com.dropmatch.delivery.service;

import com.dropmatch.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 엔진 거절 분류와 외부 에러 코드 매핑.
 *
 * <p>authorization 클래스(NOT_FOUND 포함)는 모두 FORBIDDEN으로 합쳐진다.
 * 존재하지 않는 ID와 남의 ID가 같은 응답을 받아야 ID 열거가 불가능하다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum RejectionKind {
    NOT_FOUND(ErrorCode.FORBIDDEN, true),
    NOT_OWNER(ErrorCode.FORBIDDEN, true),
    NOT_ASSIGNED(ErrorCode.FORBIDDEN, true),
    ROLE_INSUFFICIENT(ErrorCode.FORBIDDEN, true),
    DRIVER_UNAVAILABLE(ErrorCode.DRIVER_UNAVAILABLE, false),
    ILLEGAL_TRANSITION(ErrorCode.ILLEGAL_TRANSITION, false),
    FARE_MISMATCH(ErrorCode.PAYMENT_NOT_VERIFIED, false),
    CONTENTION(ErrorCode.CONTENTION, false),
    DUPLICATE_PAYMENT(ErrorCode.DUPLICATE_PAYMENT, false),
    PAYMENT_IN_PROGRESS(ErrorCode.PAYMENT_IN_PROGRESS, false),
    PAYMENT_DECLINED(ErrorCode.PAYMENT_DECLINED, false),
    REFUND_FAILED(ErrorCode.REFUND_FAILED, false),
    INVALID_REQUEST(ErrorCode.INVALID_INPUT, false);

    private final ErrorCode errorCode;
    private final boolean authorization;

    /** 거절 상세를 응답 메시지로 내보내도 되는지 */
    public boolean disclosesDetail() {
        return this == ILLEGAL_TRANSITION || this == INVALID_REQUEST;
    }
}
