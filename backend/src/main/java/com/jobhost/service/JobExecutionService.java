package com.jobhost.service;

import com.jobhost.api.ScheduledJob;
import com.jobhost.exception.InvocationCancelledException;
import com.jobhost.exception.InvocationException;
import com.jobhost.exception.RecordPersistenceException;
import com.jobhost.model.ExecutionRecord;
import com.jobhost.model.enums.ExecutionStatus;
import com.jobhost.plugin.ArtifactStore;
import com.jobhost.plugin.LoadableUnit;
import com.jobhost.plugin.PluginContext;
import com.jobhost.plugin.PluginLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Runs one firing of a job: records it, resolves its parameters, loads the active artifact
 * version into a fresh plugin context, invokes it and records the outcome. Never throws to the
 * scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobExecutionService {

    static final String MDC_JOB_ID = "jobId";
    static final String MDC_FIRE_INSTANCE_ID = "fireInstanceId";

    private final ExecutionRecordService recordService;
    private final ExecutionPreparationService preparationService;
    private final ArtifactStore artifactStore;
    private final PluginLoader pluginLoader;

    public ExecutionStatus execute(UUID jobId, String fireInstanceId) {
        try (MDC.MDCCloseable ignoredJob = MDC.putCloseable(MDC_JOB_ID, String.valueOf(jobId));
             MDC.MDCCloseable ignoredFire = MDC.putCloseable(MDC_FIRE_INSTANCE_ID, fireInstanceId)) {

            ExecutionRecord record;
            try {
                record = recordService.open(jobId, fireInstanceId);
            } catch (RuntimeException e) {
                log.error("Could not open execution record, firing abandoned", e);
                return ExecutionStatus.FAILED;
            }

            long start = System.currentTimeMillis();
            ExecutionStatus status;
            String error = null;
            try {
                ExecutionPreparationService.PreparedExecution prepared = preparationService.prepare(jobId);
                invoke(prepared, fireInstanceId);
                status = ExecutionStatus.SUCCESS;
                log.info("Job '{}' ({}) executed successfully in {} ms",
                        prepared.jobName(), prepared.version(), System.currentTimeMillis() - start);
            } catch (InvocationCancelledException e) {
                status = ExecutionStatus.CANCELLED;
                error = e.getMessage();
                log.warn("Job run cancelled: {}", e.getMessage());
            } catch (InvocationException e) {
                status = ExecutionStatus.FAILED;
                error = e.getMessage();
                log.error("Exception during job run", e.getCause());
            } catch (RuntimeException e) {
                status = ExecutionStatus.FAILED;
                error = e.getMessage();
                log.error("Could not start job: {}", e.getMessage(), e);
            } catch (Error e) {
                log.error("Fatal error during job run", e);
                close(record, ExecutionStatus.FAILED, e.toString());
                throw e;
            }

            close(record, status, error);
            return status;
        }
    }

    private void invoke(ExecutionPreparationService.PreparedExecution prepared, String fireInstanceId) {
        LoadableUnit unit = artifactStore.load(prepared.locator(), prepared.entryHint());
        PluginContext context = pluginLoader.openContext();
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        try {
            Class<? extends ScheduledJob> entryType = pluginLoader.load(context, unit);
            ScheduledJob job = pluginLoader.instantiate(entryType);
            InvocationContext jobContext = new InvocationContext(fireInstanceId, prepared.jobId(),
                    prepared.parameters(), LoggerFactory.getLogger(entryType.getName()));

            thread.setContextClassLoader(context.getClassLoader());
            try {
                job.execute(jobContext);
            } catch (Throwable t) {
                if (t instanceof VirtualMachineError vmError && !(t instanceof StackOverflowError)) {
                    throw vmError;
                }
                throw classify(t);
            }
        } finally {
            thread.setContextClassLoader(previous);
            pluginLoader.closeContext(context);
        }
    }

    private void close(ExecutionRecord record, ExecutionStatus status, String error) {
        try {
            recordService.close(record.getId(), status, error);
        } catch (RuntimeException e) {
            log.error("Failed to persist final execution record",
                    new RecordPersistenceException("Execution record " + record.getId() + " left as "
                            + record.getStatus() + " instead of " + status, e));
        }
    }

    static RuntimeException classify(Throwable thrown) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = thrown; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof InterruptedException) {
                if (t == thrown) {
                    Thread.currentThread().interrupt();
                }
                return new InvocationCancelledException("Job was interrupted", thrown);
            }
            if (t instanceof CancellationException || t instanceof InvocationCancelledException) {
                return new InvocationCancelledException("Job was cancelled: " + t.getMessage(), thrown);
            }
        }
        return new InvocationException("Job threw " + thrown, thrown);
    }
}
