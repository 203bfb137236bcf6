package com.jobhost.exception;

public class NotFoundException extends JobHostException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
