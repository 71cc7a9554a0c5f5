package com.cistrade.domain.audit;

public enum AuditSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
