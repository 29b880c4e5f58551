package com.dropmatch.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * 감사 이벤트를 audit_records 테이블에 저장하고 구조화 로그로도 남긴다.
 *
 * <p>로그 레벨은 심각도에서 결정된다: CRITICAL → error, HIGH → warn, 그 외 → info.</p>
 *
 * <p>감사 저장 실패는 호출자에게 전파하지 않는다. 호출 시점에는 이미 CAS 쓰기가 커밋되어 있어서
 * 여기서 예외를 던지면 커밋된 전이를 실패로 응답하게 된다. 대신 이벤트 전체를 error 로그로 남긴다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAuditSink implements AuditSink {

    private final AuditRecordRepository auditRecordRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void record(AuditEvent event) {
        logEvent(event);
        try {
            auditRecordRepository.save(AuditRecord.builder()
                    .eventId(event.eventId())
                    .type(event.type())
                    .severity(event.severity())
                    .deliveryId(event.deliveryId())
                    .actorId(event.actorId())
                    .actorRole(event.actorRole() == null ? null : event.actorRole().name())
                    .action(event.action())
                    .fromStatus(event.fromStatus())
                    .toStatus(event.toStatus())
                    .reason(event.reason())
                    .adminOverride(event.adminOverride())
                    .metadata(serialize(event))
                    .occurredAt(event.occurredAt())
                    .build());
        } catch (DataAccessException e) {
            log.error("Failed to persist audit event: {}", event, e);
        }
    }

    private String serialize(AuditEvent event) {
        if (event.metadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.metadata());
        } catch (JsonProcessingException e) {
            log.warn("Audit metadata not serializable: eventId={}", event.eventId(), e);
            return String.valueOf(event.metadata());
        }
    }

    private void logEvent(AuditEvent event) {
        String format = "Audit {}: deliveryId={}, actor={}({}), action={}, {}->{}, reason={}, adminOverride={}, meta={}";
        Object[] args = {event.type(), event.deliveryId(), event.actorId(), event.actorRole(),
                event.action(), event.fromStatus(), event.toStatus(), event.reason(),
                event.adminOverride(), event.metadata()};
        switch (event.severity()) {
            case CRITICAL -> log.error(format, args);
            case HIGH -> log.warn(format, args);
            default -> log.info(format, args);
        }
    }
}
