package com.dropmatch.common.security;

import java.util.Optional;

/**
 * 자격 증명 검증 경계. 토큰 발급(로그인) 흐름은 이 애플리케이션 밖에 있고,
 * 여기서는 이미 발급된 토큰을 {@link Identity}로 바꾸는 일만 한다.
 */
public interface IdentityContext {

    /**
     * @param token Bearer 토큰 문자열
     * @return 서명과 만료가 유효하면 Identity, 아니면 empty
     */
    Optional<Identity> verify(String token);
}
