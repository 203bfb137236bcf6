package com.jobhost.plugin.fixtures;

import com.jobhost.api.JobContext;
import com.jobhost.api.ScheduledJob;

public class FailingJob implements ScheduledJob {

    @Override
    public void execute(JobContext context) {
        throw new IllegalStateException("boom");
    }
}
