package com.dropmatch.audit;

public enum AuditSeverity {
    INFO,
    MEDIUM,
    HIGH,
    CRITICAL
}
