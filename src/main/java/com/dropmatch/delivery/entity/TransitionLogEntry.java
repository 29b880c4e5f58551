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
 * 전이 로그 한 줄. {@code version}은 이 전이가 기록된 레코드 버전이라 버전 순으로 읽으면
 * 수락된 전이의 직렬화 순서가 된다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransitionLogEntry {

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", nullable = false)
    private DeliveryStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false)
    private DeliveryStatus toStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false)
    private DeliveryAction action;

    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @Column(name = "admin_override", nullable = false)
    private boolean adminOverride;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "record_version", nullable = false)
    private long version;

    TransitionLogEntry(DeliveryStatus fromStatus, DeliveryStatus toStatus, DeliveryAction action,
                       String actorId, boolean adminOverride, Instant occurredAt, long version) {
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.action = action;
        this.actorId = actorId;
        this.adminOverride = adminOverride;
        this.occurredAt = occurredAt;
        this.version = version;
    }
}
