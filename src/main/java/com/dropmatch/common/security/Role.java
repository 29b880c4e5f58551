package com.dropmatch.common.security;

/**
 * 검증된 토큰의 role 클레임에서만 결정되는 역할.
 * 요청 본문에 담긴 role 필드는 어디에서도 읽지 않는다.
 */
public enum Role {
    CUSTOMER,
    DRIVER,
    ADMIN
}
