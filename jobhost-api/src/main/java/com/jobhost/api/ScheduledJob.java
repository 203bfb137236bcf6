package com.jobhost.api;

/**
 * Entry point of a job artifact. Each artifact ships exactly one concrete implementation with a
 * public no-arg constructor; a fresh instance is created for every firing.
 * <p>
 * Throwing {@link InterruptedException} or {@link java.util.concurrent.CancellationException}
 * marks the firing as cancelled; any other exception marks it as failed.
 */
public interface ScheduledJob {

    void execute(JobContext context) throws Exception;
}
