package com.cashcow.exception;

import java.util.Map;

public class CalculationException extends BaseException {

    public CalculationException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.CALCULATION_FAILED, message, details, cause);
    }
}
