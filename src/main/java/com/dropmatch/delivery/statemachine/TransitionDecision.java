package com.dropmatch.delivery.statemachine;

import com.dropmatch.delivery.entity.DeliveryStatus;

/**
 * 상태 머신 판정 결과.
 *
 * @param nextStatus   허용 시 유일한 다음 상태
 * @param rejectReason 거절 사유 (허용이면 null)
 * @param detail       외부에 그대로 보여줘도 되는 거절 설명
 */
public record TransitionDecision(DeliveryStatus nextStatus, TransitionRejectReason rejectReason, String detail) {

    public static TransitionDecision allow(DeliveryStatus nextStatus) {
        return new TransitionDecision(nextStatus, null, null);
    }

    public static TransitionDecision reject(TransitionRejectReason reason, String detail) {
        return new TransitionDecision(null, reason, detail);
    }

    public boolean allowed() {
        return nextStatus != null;
    }
}
