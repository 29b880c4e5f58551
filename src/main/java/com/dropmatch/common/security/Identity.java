package com.dropmatch.common.security;

import java.util.Objects;

/**
 * 인증 필터가 검증을 마친 요청 주체 (actorId, role).
 *
 * @param actorId 토큰 subject
 * @param role    토큰 role 클레임
 */
public record Identity(String actorId, Role role) {

    public Identity {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(role, "role");
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean hasRole(Role expected) {
        return role == expected;
    }
}
