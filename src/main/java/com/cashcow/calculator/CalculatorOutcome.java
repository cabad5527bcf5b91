package com.cashcow.calculator;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a single calculator invocation: either a finite value or a failure with a
 * message and, when the calculator threw, the cause.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class CalculatorOutcome {

    private final boolean success;
    private final double value;
    private final String errorMessage;
    private final Throwable cause;

    public static CalculatorOutcome success(double value) {
        return new CalculatorOutcome(true, value, null, null);
    }

    public static CalculatorOutcome failure(String message, Throwable cause) {
        return new CalculatorOutcome(false, 0.0, message, cause);
    }

    /** The value on success, 0.0 on failure. */
    public double valueOrZero() {
        return success ? value : 0.0;
    }
}
