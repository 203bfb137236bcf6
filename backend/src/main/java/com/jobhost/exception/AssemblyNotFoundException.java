package com.jobhost.exception;

public class AssemblyNotFoundException extends NotFoundException {

    public AssemblyNotFoundException(String message) {
        super(message);
    }

    public AssemblyNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
