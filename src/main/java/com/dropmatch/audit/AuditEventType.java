package com.dropmatch.audit;

public enum AuditEventType {
    DELIVERY_CREATED,
    TRANSITION_ACCEPTED,
    TRANSITION_REJECTED,
    DELIVERY_READ,
    PAYMENT_AUTHORIZED,
    PAYMENT_REPLAYED,
    PAYMENT_REJECTED,
    PAYMENT_DECLINED,
    PAYMENT_CONFIRMED,
    REFUND_ISSUED,
    /** 결과를 알 수 없는 PG 응답 등, 사람이 직접 대사(reconciliation)해야 하는 건 */
    RECONCILIATION_REQUIRED,
    WEBHOOK_REJECTED
}
