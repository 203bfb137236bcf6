package com.jobhost.exception;

/** Root of the failures a firing or an administrative action can raise. */
public class JobHostException extends RuntimeException {

    public JobHostException(String message) {
        super(message);
    }

    public JobHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
