package com.dropmatch.common.security;

import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

class JwtTokenProviderTest {

    private static final String SECRET = "dropMatchTestSecretKeyThatIsLongEnoughForHmacSha256";

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 3_600_000);

    @Test
    @DisplayName("발급한 토큰에서 actorId와 role을 복원")
    void roundTrip() {
        String token = provider.createToken("drv-7", Role.DRIVER);

        assertThat(provider.verify(token)).contains(new Identity("drv-7", Role.DRIVER));
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰은 무효")
    void foreignSignature() {
        JwtTokenProvider other = new JwtTokenProvider("anotherSecretKeyThatIsAlsoLongEnoughForHmac256", 3_600_000);

        assertThat(provider.verify(other.createToken("cust-1", Role.ADMIN))).isEmpty();
    }

    @Test
    @DisplayName("만료된 토큰은 무효")
    void expired() {
        JwtTokenProvider shortLived = new JwtTokenProvider(SECRET, -1_000);

        assertThat(provider.verify(shortLived.createToken("cust-1", Role.CUSTOMER))).isEmpty();
    }

    @Test
    @DisplayName("role 클레임이 없거나 알 수 없는 값이면 무효")
    void missingOrUnknownRole() {
        SecretKeySpec key = new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        Date expiry = new Date(System.currentTimeMillis() + 60_000);
        String noRole = Jwts.builder().subject("cust-1").expiration(expiry).signWith(key).compact();
        String unknownRole = Jwts.builder().subject("cust-1").claim("role", "SUPERUSER")
                .expiration(expiry).signWith(key).compact();

        assertThat(provider.verify(noRole)).isEmpty();
        assertThat(provider.verify(unknownRole)).isEmpty();
        assertThat(provider.verify("not.a.token")).isEmpty();
    }
}
