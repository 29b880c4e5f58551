package com.dropmatch.delivery.entity;

/**
 * 멱등성 키별 결제 요청 상태.
 *
 * <p>PENDING은 "PG 호출 전 예약됨 또는 결과 불명"을 뜻한다. 결과를 알 수 없는 응답은
 * 예약을 그대로 남겨 두므로 같은 키로 재시도해도 이중 결제가 일어나지 않는다.</p>
 */
public enum IdempotencyState {
    PENDING,
    AUTHORIZED,
    CAPTURED,
    REFUNDED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
