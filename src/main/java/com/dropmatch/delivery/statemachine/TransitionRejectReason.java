package com.dropmatch.delivery.statemachine;

public enum TransitionRejectReason {
    /** DELIVERED / CANCELLED 이후 모든 요청 */
    TERMINAL_STATE,
    /** 현재 상태에서 정의되지 않은 동작 */
    ACTION_NOT_ALLOWED,
    /** 동작은 정의되어 있지만 역할이 맞지 않음 */
    ROLE_INSUFFICIENT
}
