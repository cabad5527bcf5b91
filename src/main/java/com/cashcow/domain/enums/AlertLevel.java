package com.cashcow.domain.enums;

/**
 * Severity of a KPI advisory, most severe first.
 */
public enum AlertLevel {
    CRITICAL,
    WARNING,
    INFO
}
