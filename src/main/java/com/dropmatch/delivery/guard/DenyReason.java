package com.dropmatch.delivery.guard;

/**
 * 소유권 거절 사유. 감사 로그 전용이며 외부 응답에는 노출되지 않는다.
 */
public enum DenyReason {
    /** 고객 관계가 필요한데 다른 고객이 요청 */
    NOT_OWNER,
    /** 기사 관계가 필요한데 배정되지 않은 기사가 요청 */
    NOT_ASSIGNED,
    /** 역할 자체가 관계를 충족할 수 없음 (예: 고객이 기사 동작 요청) */
    ROLE_INSUFFICIENT
}
