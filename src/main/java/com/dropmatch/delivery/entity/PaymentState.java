package com.dropmatch.delivery.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 배달 결제 상태.
 *
 * <pre>
 * UNPAID → AUTHORIZED → CAPTURED
 *             │   ↑         │
 *             ↓   │         ↓
 *          UNPAID(PG 실패)  REFUNDED ← AUTHORIZED
 * </pre>
 */
public enum PaymentState {
    UNPAID,
    AUTHORIZED,
    CAPTURED,
    REFUNDED;

    public Set<PaymentState> nextStates() {
        return switch (this) {
            case UNPAID -> EnumSet.of(AUTHORIZED, CAPTURED);
            case AUTHORIZED -> EnumSet.of(CAPTURED, REFUNDED, UNPAID);
            case CAPTURED -> EnumSet.of(REFUNDED);
            case REFUNDED -> EnumSet.noneOf(PaymentState.class);
        };
    }

    public boolean canMoveTo(PaymentState next) {
        return nextStates().contains(next);
    }

    /** 실제로 돈이 잡혀 있어 취소 시 환불이 필요한 상태 */
    public boolean holdsFunds() {
        return this == AUTHORIZED || this == CAPTURED;
    }
}
