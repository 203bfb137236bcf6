package com.jobhost.exception;

public class RecordPersistenceException extends JobHostException {

    public RecordPersistenceException(String message) {
        super(message);
    }

    public RecordPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
