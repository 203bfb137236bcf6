package com.jobhost.exception;

public class MissingRequiredParameterException extends JobHostException {

    public MissingRequiredParameterException(String message) {
        super(message);
    }

    public MissingRequiredParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
