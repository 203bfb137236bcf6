package com.jobhost.plugin.fixtures;

import com.jobhost.api.JobContext;
import com.jobhost.api.JobParameter;
import com.jobhost.api.ScheduledJob;

@JobParameter(name = "target", type = String.class)
@JobParameter(name = "target", type = int.class)
public class DuplicateParameterJob implements ScheduledJob {

    @Override
    public void execute(JobContext context) {
    }
}
