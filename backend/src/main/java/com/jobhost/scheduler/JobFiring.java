package com.jobhost.scheduler;

import com.jobhost.service.JobExecutionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.Job;
import org.quartz.JobExecutionContext;

import java.util.UUID;

/**
 * The single Quartz job class behind every registered job. Instances are built per firing by
 * Spring's job factory; concurrent firings of the same job are allowed.
 */
@RequiredArgsConstructor
@Slf4j
public class JobFiring implements Job {

    static final String JOB_ID_KEY = "jobId";

    private final JobExecutionService executionService;

    @Override
    public void execute(JobExecutionContext context) {
        String rawJobId = context.getMergedJobDataMap().getString(JOB_ID_KEY);
        UUID jobId = parseJobId(rawJobId);
        if (jobId == null) {
            log.error("Quartz job {} carries no valid job id ({}), skipping firing {}",
                    context.getJobDetail().getKey(), rawJobId, context.getFireInstanceId());
            return;
        }
        executionService.execute(jobId, context.getFireInstanceId());
    }

    private static UUID parseJobId(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
