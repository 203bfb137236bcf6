package com.jobhost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "jobhost")
public record JobHostProperties(
        @DefaultValue Artifacts artifacts,
        @DefaultValue Scheduler scheduler,
        @DefaultValue Plugins plugins
) {

    public record Artifacts(@DefaultValue("./artifacts") String basePath) {
    }

    public record Scheduler(@DefaultValue("true") boolean initializeOnStartup) {
    }

    /** Package prefixes plugins may load from the host besides the JDK, the job API and SLF4J. */
    public record Plugins(@DefaultValue List<String> allowedPackages) {
    }
}
