package com.jobhost.exception;

import lombok.Getter;

@Getter
public class ParameterConversionException extends JobHostException {

    private final String rawValue;
    private final String targetType;

    public ParameterConversionException(String rawValue, String targetType, Throwable cause) {
        super("Cannot convert '" + rawValue + "' to " + targetType, cause);
        this.rawValue = rawValue;
        this.targetType = targetType;
    }
}
