package com.jobhost.exception;

/** Wraps whatever a loaded job threw. */
public class InvocationException extends JobHostException {

    public InvocationException(String message) {
        super(message);
    }

    public InvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
