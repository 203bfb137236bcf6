package com.jobhost.exception;

public class InvocationCancelledException extends JobHostException {

    public InvocationCancelledException(String message) {
        super(message);
    }

    public InvocationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
