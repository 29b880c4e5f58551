package com.dropmatch.audit;

import com.dropmatch.common.security.Identity;
import com.dropmatch.common.security.Role;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 감사 이벤트. 수락된 전이와 거절된 시도 모두 하나씩 기록된다.
 *
 * <p>{@code reason}에는 거절 사유(NOT_OWNER, NOT_ASSIGNED, ...)가 구체적으로 남는다.
 * 외부 응답은 사유를 숨기지만 감사 로그는 열거 시도와 단순 오라우팅을 구분할 수 있어야 한다.</p>
 *
 * @param adminOverride 관리자 break-glass 권한으로 통과한 경우 true (상세 메타데이터 동반)
 */
public record AuditEvent(
        String eventId,
        AuditEventType type,
        AuditSeverity severity,
        String deliveryId,
        String actorId,
        Role actorRole,
        String action,
        String fromStatus,
        String toStatus,
        String reason,
        boolean adminOverride,
        Map<String, Object> metadata,
        Instant occurredAt
) {

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Builder builder(AuditEventType type, AuditSeverity severity, Instant occurredAt) {
        return new Builder(type, severity, occurredAt);
    }

    /**
     * 호출부마다 채우는 필드가 달라서 Lombok 대신 직접 작성한 빌더.
     * null 값 metadata는 무시한다.
     */
    public static final class Builder {
        private final AuditEventType type;
        private AuditSeverity severity;
        private final Instant occurredAt;
        private String deliveryId;
        private String actorId;
        private Role actorRole;
        private String action;
        private String fromStatus;
        private String toStatus;
        private String reason;
        private boolean adminOverride;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(AuditEventType type, AuditSeverity severity, Instant occurredAt) {
            this.type = type;
            this.severity = severity;
            this.occurredAt = occurredAt;
        }

        public Builder deliveryId(String deliveryId) {
            this.deliveryId = deliveryId;
            return this;
        }

        public Builder actor(Identity identity) {
            if (identity != null) {
                this.actorId = identity.actorId();
                this.actorRole = identity.role();
            }
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder action(Object action) {
            this.action = action == null ? null : action.toString();
            return this;
        }

        public Builder transition(Object from, Object to) {
            this.fromStatus = from == null ? null : from.toString();
            this.toStatus = to == null ? null : to.toString();
            return this;
        }

        public Builder reason(Object reason) {
            this.reason = reason == null ? null : reason.toString();
            return this;
        }

        /** 관리자 통과 건은 심각도를 최소 MEDIUM으로 올린다 */
        public Builder adminOverride(boolean adminOverride) {
            this.adminOverride = adminOverride;
            if (adminOverride && severity.compareTo(AuditSeverity.MEDIUM) < 0) {
                this.severity = AuditSeverity.MEDIUM;
            }
            return this;
        }

        public Builder meta(String key, Object value) {
            if (value != null) {
                metadata.put(key, value);
            }
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(UUID.randomUUID().toString(), type, severity, deliveryId,
                    actorId, actorRole, action, fromStatus, toStatus, reason, adminOverride,
                    metadata, occurredAt);
        }
    }
}
