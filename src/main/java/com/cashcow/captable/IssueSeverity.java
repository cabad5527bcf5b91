package com.cashcow.captable;

public enum IssueSeverity {
    ERROR,
    WARNING,
    INFO
}
