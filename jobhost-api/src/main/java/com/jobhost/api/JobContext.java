package com.jobhost.api;

import org.slf4j.Logger;

import java.util.Map;
import java.util.UUID;

/**
 * Invocation context handed to a {@link ScheduledJob}. Parameters are already converted to the
 * Java type declared by the matching {@link JobParameter}; absent parameters have no entry.
 */
public interface JobContext {

    /** Scheduler-assigned identifier, unique per firing. */
    String getFireInstanceId();

    UUID getJobId();

    /** Read-only view of the resolved parameters. */
    Map<String, Object> getParameters();

    Logger getLogger();

    default boolean hasParameter(String name) {
        return getParameters().containsKey(name);
    }

    /**
     * Returns the named parameter cast to {@code type}, or {@code null} when it is absent.
     *
     * @throws ClassCastException if the resolved value is not an instance of {@code type}
     */
    default <T> T getParameter(String name, Class<T> type) {
        Object value = getParameters().get(name);
        return value == null ? null : type.cast(value);
    }

    /**
     * Returns the named parameter cast to {@code type}.
     *
     * @throws IllegalStateException if the parameter is absent
     */
    default <T> T getRequiredParameter(String name, Class<T> type) {
        T value = getParameter(name, type);
        if (value == null) {
            throw new IllegalStateException("Required parameter '" + name + "' is missing");
        }
        return value;
    }
}
