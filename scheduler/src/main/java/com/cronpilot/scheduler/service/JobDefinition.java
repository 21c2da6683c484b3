package com.cronpilot.scheduler.service;

import java.util.Map;

/**
 * Input to JobStore#upsertJob.
 *
 * id == null creates a new job; otherwise the job with that id is updated
 * and any null field keeps its current value.
 */
public record JobDefinition(
        Long    id,
        String  name,
        String  description,
        String  scriptPath,
        String  cronExpression,
        Boolean enabled,
        Map<String, Object> config
) {
    public static JobDefinition create(String name, String scriptPath, String cronExpression) {
        return new JobDefinition(null, name, null, scriptPath, cronExpression, null, null);
    }

    public JobDefinition withId(Long newId) {
        return new JobDefinition(newId, name, description, scriptPath, cronExpression, enabled, config);
    }
}
