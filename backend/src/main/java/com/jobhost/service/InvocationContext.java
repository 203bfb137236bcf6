package com.jobhost.service;

import com.jobhost.api.JobContext;
import lombok.Getter;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Getter
final class InvocationContext implements JobContext {

    private final String fireInstanceId;
    private final UUID jobId;
    private final Map<String, Object> parameters;
    private final Logger logger;

    InvocationContext(String fireInstanceId, UUID jobId, Map<String, Object> parameters, Logger logger) {
        this.fireInstanceId = fireInstanceId;
        this.jobId = jobId;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.logger = logger;
    }
}
