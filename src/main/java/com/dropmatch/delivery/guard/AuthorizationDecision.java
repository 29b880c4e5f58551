package com.dropmatch.delivery.guard;

/**
 * Ownership Guard 판정 결과.
 *
 * @param allowed       허용 여부
 * @param denyReason    거절 사유 (허용이면 null)
 * @param adminOverride 관리자 권한으로 허용된 경우 true. 감사 시 상세 기록 대상
 */
public record AuthorizationDecision(boolean allowed, DenyReason denyReason, boolean adminOverride) {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null, false);
    private static final AuthorizationDecision ADMIN = new AuthorizationDecision(true, null, true);

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision allowAsAdmin() {
        return ADMIN;
    }

    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(false, reason, false);
    }
}
