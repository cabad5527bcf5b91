package com.cashcow.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the calculation engine. Configuration errors are fatal and raised
 * immediately; calculation failures of a single calculator are contained by the batch
 * runner and never surface through this enum.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CALCULATOR_CONFIGURATION("CALCULATOR_CONFIGURATION", true),
    CALCULATION_FAILED("CALCULATION_FAILED", false),
    INVALID_DATE_RANGE("INVALID_DATE_RANGE", true),
    NOT_FOUND("NOT_FOUND", true),
    VALIDATION_ERROR("VALIDATION_ERROR", true),
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", true);

    private final String code;
    private final boolean fatal;
}
