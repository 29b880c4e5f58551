package com.dropmatch.payment.service;

/** PG 응답 분류 */
public enum ProviderOutcome {
    AUTHORIZED,
    CAPTURED,
    REFUNDED,
    /** PG가 결제(환불)를 수행하지 않았다고 확정 응답 */
    DECLINED,
    /** 수행 여부를 알 수 없음. "결제됐을 수도 있음"으로 취급한다 */
    INDETERMINATE;

    public boolean isApproved() {
        return this == AUTHORIZED || this == CAPTURED || this == REFUNDED;
    }
}
