package com.jobhost.exception;

/** The scheduler engine rejected a registration change requested by an administrative action. */
public class SchedulerSyncException extends JobHostException {

    public SchedulerSyncException(String message) {
        super(message);
    }

    public SchedulerSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
