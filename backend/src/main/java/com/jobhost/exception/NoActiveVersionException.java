package com.jobhost.exception;

public class NoActiveVersionException extends JobHostException {

    public NoActiveVersionException(String message) {
        super(message);
    }

    public NoActiveVersionException(String message, Throwable cause) {
        super(message, cause);
    }
}
