package com.cronpilot.scheduler.executor.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * What the executor needs to run one job: the script and the job's config.
 */
public record ScriptInvocation(
        Long   jobId,
        String jobName,
        Long   runId,
        String scriptPath,
        Map<String, Object> config
) {
    public ScriptInvocation {
        // JSON config may hold null values, which Map.copyOf rejects.
        config = config == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(config));
    }
}
