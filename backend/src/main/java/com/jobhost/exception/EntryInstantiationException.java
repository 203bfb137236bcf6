package com.jobhost.exception;

public class EntryInstantiationException extends JobHostException {

    public EntryInstantiationException(String message) {
        super(message);
    }

    public EntryInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
