package com.cashcow.exception;

import java.util.Map;

public class CapTableValidationException extends BaseException {

    public CapTableValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
