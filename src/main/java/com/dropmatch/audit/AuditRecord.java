package com.dropmatch.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 감사 레코드 엔티티 - append-only.
 *
 * <p>변경 메서드가 없고 모든 컬럼이 {@code updatable = false}다. 메타데이터는 JSON 문자열로 저장한다.</p>
 */
@Entity
@Table(name = "audit_records", indexes = {
        @Index(name = "idx_audit_delivery", columnList = "deliveryId, occurredAt"),
        @Index(name = "idx_audit_severity", columnList = "severity")  // CRITICAL 건 모니터링용
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditRecord {

    @Id
    @Column(length = 36, updatable = false)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AuditEventType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AuditSeverity severity;

    @Column(updatable = false)
    private String deliveryId;

    @Column(updatable = false)
    private String actorId;

    @Column(updatable = false)
    private String actorRole;

    @Column(updatable = false)
    private String action;

    @Column(updatable = false)
    private String fromStatus;

    @Column(updatable = false)
    private String toStatus;

    @Column(updatable = false)
    private String reason;

    @Column(nullable = false, updatable = false)
    private boolean adminOverride;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(nullable = false, updatable = false)
    private Instant occurredAt;

    @Builder
    public AuditRecord(String eventId, AuditEventType type, AuditSeverity severity, String deliveryId,
                       String actorId, String actorRole, String action, String fromStatus,
                       String toStatus, String reason, boolean adminOverride, String metadata,
                       Instant occurredAt) {
        this.eventId = eventId;
        this.type = type;
        this.severity = severity;
        this.deliveryId = deliveryId;
        this.actorId = actorId;
        this.actorRole = actorRole;
        this.action = action;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.reason = reason;
        this.adminOverride = adminOverride;
        this.metadata = metadata;
        this.occurredAt = occurredAt;
    }
}
