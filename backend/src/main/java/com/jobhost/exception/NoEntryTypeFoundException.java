package com.jobhost.exception;

public class NoEntryTypeFoundException extends JobHostException {

    public NoEntryTypeFoundException(String message) {
        super(message);
    }

    public NoEntryTypeFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
