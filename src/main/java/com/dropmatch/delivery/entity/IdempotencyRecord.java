package com.dropmatch.delivery.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 한 멱등성 키에 대해 기록된 결과. 금액은 요청 값이 아니라 예약 시점의 서버 운임이다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "key_state", nullable = false)
    private IdempotencyState state;

    @Column(name = "amount_minor", nullable = false)
    private long amountMinor;

    @Column(name = "provider_reference")
    private String providerReference;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    IdempotencyRecord(IdempotencyState state, long amountMinor, String providerReference, Instant recordedAt) {
        this.state = state;
        this.amountMinor = amountMinor;
        this.providerReference = providerReference;
        this.recordedAt = recordedAt;
    }

    static IdempotencyRecord pending(long amountMinor, Instant at) {
        return new IdempotencyRecord(IdempotencyState.PENDING, amountMinor, null, at);
    }

    void resolve(IdempotencyState state, String providerReference, Instant at) {
        this.state = state;
        if (providerReference != null) {
            this.providerReference = providerReference;
        }
        this.recordedAt = at;
    }
}
