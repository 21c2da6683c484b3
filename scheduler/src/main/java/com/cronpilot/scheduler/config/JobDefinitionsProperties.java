package com.cronpilot.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Jobs declared in application configuration under cronpilot.jobs[*].
 * JobDefinitionLoader upserts them by name at startup.
 */
@ConfigurationProperties(prefix = "cronpilot")
public record JobDefinitionsProperties(List<Declared> jobs) {

    public JobDefinitionsProperties {
        if (jobs == null) jobs = List.of();
    }

    public record Declared(
            String name,
            String description,
            String scriptPath,
            String cronExpression,
            Boolean enabled,
            Map<String, Object> config
    ) {}
}
