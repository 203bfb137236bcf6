package com.jobhost.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a parameter of a {@link ScheduledJob} entry type. Read once when an artifact version
 * is registered and stored as that version's parameter definitions.
 * <p>
 * Supported types: {@code String}, {@code char}, {@code int}, {@code long}, {@code double},
 * {@code LocalDateTime}, {@code LocalTime}, {@code LocalDate}, {@code UUID}. Boxed forms
 * ({@code Character}, {@code Integer}, {@code Long}, {@code Double}) declare the nullable variant.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(JobParameters.class)
public @interface JobParameter {

    String name();

    Class<?> type();

    boolean required() default false;

    /** String-encoded default; empty means no default. */
    String defaultValue() default "";

    String description() default "";
}
