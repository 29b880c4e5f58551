package com.dropmatch.common.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * JWT 토큰 제공자 (JWT Token Provider)
 *
 * <p>HMAC-SHA256으로 서명된 JWT를 검증하고 (actorId, role)을 꺼낸다.
 * {@link IdentityContext}의 구현체이며, 엔진은 이 클래스가 돌려준 Identity만 신뢰한다.</p>
 *
 * <h3>토큰 구조 (JWT Claims)</h3>
 * <pre>
 *   Payload: {"sub": "cust-42",      ← actorId
 *             "role": "CUSTOMER",    ← CUSTOMER | DRIVER | ADMIN
 *             "iat": 1700000000,
 *             "exp": 1700003600}
 * </pre>
 *
 * <p>role 클레임이 없거나 알 수 없는 값이면 토큰 전체를 무효로 본다.</p>
 */
@Slf4j
@Component
public class JwtTokenProvider implements IdentityContext {

    static final String ROLE_CLAIM = "role";

    private final SecretKey key;
    private final long expiration;   // 밀리초, 기본 1시간

    public JwtTokenProvider(
            @Value("${jwt.secret:dropMatchLocalDevelopmentSecretKeyThatIsLongEnough}") String secret,
            @Value("${jwt.expiration:3600000}") long expiration) {
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.expiration = expiration;
    }

    /**
     * 토큰 발급. 운영에서는 인증 서버가 같은 키로 발급하며,
     * 이 메서드는 로컬 개발과 테스트에서 사용한다.
     */
    public String createToken(String actorId, Role role) {
        Date now = new Date();
        return Jwts.builder()
                .subject(actorId)
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expiration))
                .signWith(key)
                .compact();
    }

    @Override
    public Optional<Identity> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String role = claims.get(ROLE_CLAIM, String.class);
            if (claims.getSubject() == null || role == null) {
                return Optional.empty();
            }
            return Optional.of(new Identity(claims.getSubject(), Role.valueOf(role)));
        } catch (JwtException | IllegalArgumentException e) {
            // 서명 불일치, 만료, 형식 오류, 알 수 없는 role
            log.debug("Rejected token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
