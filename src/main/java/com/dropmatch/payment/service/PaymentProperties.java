package com.dropmatch.payment.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 결제 무결성 설정.
 *
 * @param fareToleranceMinor 저장된 운임과 재계산 운임의 허용 오차 (최소 화폐 단위). 초과 시 FARE_MISMATCH
 * @param webhookSecret      PG 웹훅 HMAC-SHA256 공유 비밀
 */
@ConfigurationProperties(prefix = "dropmatch.payment")
public record PaymentProperties(
        @DefaultValue("1") long fareToleranceMinor,
        String webhookSecret
) {
}
