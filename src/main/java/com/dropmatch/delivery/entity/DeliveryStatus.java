package com.dropmatch.delivery.entity;

/**
 * 배달 상태.
 *
 * <pre>
 * CREATED → ACCEPTED → PICKED_UP → IN_TRANSIT → DELIVERED
 *    └─────────┴───────────┴──→ CANCELLED
 * </pre>
 *
 * <p>{@code ordinal()} 순서가 진행 순서다. CANCELLED는 진행 체인 밖에 있다.</p>
 */
public enum DeliveryStatus {
    CREATED,
    ACCEPTED,
    PICKED_UP,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /** 취소가 아닌 진행 체인에서 {@code other} 이후(포함)인지 */
    public boolean isAtOrBeyond(DeliveryStatus other) {
        return this != CANCELLED && this.ordinal() >= other.ordinal();
    }
}
