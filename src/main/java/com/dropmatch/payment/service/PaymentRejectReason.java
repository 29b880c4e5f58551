package com.dropmatch.payment.service;

public enum PaymentRejectReason {
    /** 배달 상태상 결제 불가 (CREATED, CANCELLED) */
    ILLEGAL_STATE,
    /** 다른 키로 이미 승인/매입/환불됨 */
    DUPLICATE_PAYMENT,
    /** 다른 키의 예약이 아직 PENDING */
    PAYMENT_IN_PROGRESS,
    /** 저장 운임과 재계산 운임 불일치 */
    FARE_MISMATCH
}
