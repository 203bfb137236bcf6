package com.jobhost.exception;

import lombok.Getter;

@Getter
public class UnsupportedParameterTypeException extends JobHostException {

    private final String typeTag;

    public UnsupportedParameterTypeException(String typeTag, String supported) {
        super("Parameter type '" + typeTag + "' is not supported. Supported types are: " + supported);
        this.typeTag = typeTag;
    }
}
