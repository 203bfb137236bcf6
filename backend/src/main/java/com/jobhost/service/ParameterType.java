package com.jobhost.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.function.Function;

/**
 * Closed set of parameter types a job may declare. The tag stored with a parameter definition is
 * the Java type name: primitives are the non-nullable variants, boxed types the nullable ones.
 */
public enum ParameterType {
    STRING(String.class, true, raw -> raw),
    CHAR(char.class, false, ParameterType::parseChar),
    NULLABLE_CHAR(Character.class, true, ParameterType::parseChar),
    INT(int.class, false, raw -> Integer.valueOf(raw.trim())),
    NULLABLE_INT(Integer.class, true, raw -> Integer.valueOf(raw.trim())),
    LONG(long.class, false, raw -> Long.valueOf(raw.trim())),
    NULLABLE_LONG(Long.class, true, raw -> Long.valueOf(raw.trim())),
    DOUBLE(double.class, false, raw -> Double.valueOf(raw.trim())),
    NULLABLE_DOUBLE(Double.class, true, raw -> Double.valueOf(raw.trim())),
    DATE_TIME(LocalDateTime.class, true, raw -> LocalDateTime.parse(raw.trim())),
    TIME(LocalTime.class, true, raw -> LocalTime.parse(raw.trim())),
    DATE(LocalDate.class, true, raw -> LocalDate.parse(raw.trim())),
    UUID(java.util.UUID.class, true, raw -> java.util.UUID.fromString(raw.trim()));

    private final Class<?> javaType;
    private final boolean nullable;
    private final Function<String, Object> parser;

    ParameterType(Class<?> javaType, boolean nullable, Function<String, Object> parser) {
        this.javaType = javaType;
        this.nullable = nullable;
        this.parser = parser;
    }

    public String tag() {
        return javaType.getName();
    }

    public Class<?> javaType() {
        return javaType;
    }

    public boolean isNullable() {
        return nullable;
    }

    Object parse(String raw) {
        return parser.apply(raw);
    }

    private static Character parseChar(String raw) {
        if (raw.length() != 1) {
            throw new IllegalArgumentException("Expected a single character but got " + raw.length());
        }
        return raw.charAt(0);
    }
}
