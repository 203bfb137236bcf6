package com.jobhost.plugin.fixtures;

import com.jobhost.api.JobContext;
import com.jobhost.api.JobParameter;
import com.jobhost.api.ScheduledJob;

import java.math.BigDecimal;

@JobParameter(name = "amount", type = BigDecimal.class)
public class UnsupportedTypeJob implements ScheduledJob {

    @Override
    public void execute(JobContext context) {
    }
}
