package com.cronpilot.scheduler.executor;

import com.cronpilot.scheduler.executor.dto.ScriptInvocation;
import com.cronpilot.scheduler.executor.dto.ScriptResult;

/**
 * Runs a job's script. Called from the scheduler's worker pool, so
 * implementations may block for as long as the script runs.
 *
 * Implementations must give up promptly when the calling thread is
 * interrupted: that is how the scheduler cancels a timed-out run.
 */
public interface ScriptExecutor {

    /**
     * @throws ScriptExecutionException if the script could not be run
     */
    ScriptResult execute(ScriptInvocation invocation);
}
