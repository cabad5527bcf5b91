package com.cashcow.exception;

import java.util.Map;

/**
 * Raised when the calculator graph of an entity type cannot be resolved: a declared
 * dependency is not registered, the dependencies form a cycle, or an unknown
 * calculator is requested by name.
 */
public class CalculatorConfigurationException extends BaseException {

    public CalculatorConfigurationException(String message) {
        super(ErrorCode.CALCULATOR_CONFIGURATION, message);
    }

    public CalculatorConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CALCULATOR_CONFIGURATION, message, details);
    }
}
