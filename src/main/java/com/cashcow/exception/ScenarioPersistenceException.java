package com.cashcow.exception;

public class ScenarioPersistenceException extends BaseException {

    public ScenarioPersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
