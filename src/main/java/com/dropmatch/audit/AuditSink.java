package com.dropmatch.audit;

/**
 * Append-only 감사 싱크. 기록된 이벤트는 수정/삭제되지 않는다.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
