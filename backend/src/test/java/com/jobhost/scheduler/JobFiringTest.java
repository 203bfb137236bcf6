package com.jobhost.scheduler;

import com.jobhost.service.JobExecutionService;
import org.junit.jupiter.api.Test;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;

import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;

class JobFiringTest {

    private final JobExecutionService executionService = mock(JobExecutionService.class);
    private final JobFiring firing = new JobFiring(executionService);

    @Test
    void execute_passesJobIdAndFireInstanceId() {
        UUID jobId = UUID.randomUUID();
        JobExecutionContext context = context(jobId.toString(), "fire-9");

        firing.execute(context);

        verify(executionService).execute(jobId, "fire-9");
    }

    @Test
    void execute_skipsFiringWithoutValidJobId() {
        firing.execute(context("not-a-uuid", "fire-1"));
        firing.execute(context(null, "fire-2"));

        verify(executionService, never()).execute(any(), any());
    }

    private static JobExecutionContext context(String jobId, String fireInstanceId) {
        JobExecutionContext context = mock(JobExecutionContext.class, RETURNS_DEEP_STUBS);
        JobDataMap data = jobId == null ? new JobDataMap() : new JobDataMap(Map.of(JobFiring.JOB_ID_KEY, jobId));
        when(context.getMergedJobDataMap()).thenReturn(data);
        when(context.getFireInstanceId()).thenReturn(fireInstanceId);
        return context;
    }
}
