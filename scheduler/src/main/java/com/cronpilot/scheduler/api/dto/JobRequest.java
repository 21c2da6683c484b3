package com.cronpilot.scheduler.api.dto;

import com.cronpilot.scheduler.service.JobDefinition;

import java.util.Map;

/**
 * Request body for POST /api/jobs and PUT /api/jobs/{id}.
 *
 * Required on create: name, scriptPath, cronExpression.
 * On update every field is optional; omitted fields keep their current value.
 */
public record JobRequest(
        String  name,
        String  description,
        String  scriptPath,
        String  cronExpression,
        Boolean enabled,
        Map<String, Object> config
) {
    public JobDefinition toDefinition(Long id) {
        return new JobDefinition(id, name, description, scriptPath, cronExpression, enabled, config);
    }
}
