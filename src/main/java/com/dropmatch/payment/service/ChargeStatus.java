package com.dropmatch.payment.service;

public enum ChargeStatus {
    AUTHORIZED,
    CAPTURED,
    REFUNDED,
    /** 같은 키의 요청이 아직 처리 중 */
    PENDING,
    /** PG 결과 불명. 수동 대사 대상 */
    INDETERMINATE
}
