package com.cronpilot.scheduler.executor;

import com.cronpilot.scheduler.executor.dto.ScriptInvocation;
import com.cronpilot.scheduler.executor.dto.ScriptResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs job scripts as local subprocesses: {@code <interpreter> <script_path>}.
 *
 * The job's identity and config reach the script through the environment:
 *   JOB_CONFIG  the job's config document as JSON
 *   JOB_ID      the job id
 *   JOB_NAME    the job name
 *   JOB_RUN_ID  the job_runs row this execution reports into
 *
 * stdout and stderr go to temp files rather than pipes, so a chatty script
 * can never block on a full pipe buffer while we wait for it.
 */
@Component
public class ProcessScriptExecutor implements ScriptExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessScriptExecutor.class);

    private final ObjectMapper json;
    private final List<String> interpreter;
    private final Path         workingDirectory;
    private final int          maxOutputChars;

    public ProcessScriptExecutor(
            ObjectMapper objectMapper,
            @Value("${cronpilot.executor.interpreter:python3}") String interpreter,
            @Value("${cronpilot.executor.working-directory:.}") String workingDirectory,
            @Value("${cronpilot.executor.max-output-chars:100000}") int maxOutputChars) {
        this.json             = objectMapper;
        this.interpreter      = interpreter.isBlank() ? List.of() : List.of(interpreter.trim().split("\\s+"));
        this.workingDirectory = Path.of(workingDirectory);
        this.maxOutputChars   = maxOutputChars;
    }

    @Override
    public ScriptResult execute(ScriptInvocation invocation) {
        Path script = workingDirectory.resolve(invocation.scriptPath());
        if (!Files.isRegularFile(script)) {
            throw new ScriptExecutionException("Script not found: " + invocation.scriptPath());
        }

        List<String> command = new ArrayList<>(interpreter);
        command.add(script.toString());

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("cronpilot-run-", ".out");
            stderrFile = Files.createTempFile("cronpilot-run-", ".err");

            ProcessBuilder pb = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            Map<String, String> env = pb.environment();
            env.put("JOB_CONFIG", toJson(invocation.config()));
            env.put("JOB_ID",     String.valueOf(invocation.jobId()));
            env.put("JOB_NAME",   invocation.jobName());
            if (invocation.runId() != null) {
                env.put("JOB_RUN_ID", String.valueOf(invocation.runId()));
            }

            log.info("Running {}", command);
            process = pb.start();
            int exitCode = process.waitFor();

            ScriptResult result = new ScriptResult(exitCode, read(stdoutFile), read(stderrFile));
            log.info("Script {} exited with code {}", invocation.scriptPath(), exitCode);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScriptExecutionException("Interrupted while running " + invocation.scriptPath(), e);
        } catch (IOException e) {
            throw new ScriptExecutionException("Could not run " + invocation.scriptPath() + ": " + e.getMessage(), e);
        } finally {
            if (process != null && process.isAlive()) {
                log.warn("Killing script {} (pid {})", invocation.scriptPath(), process.pid());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String read(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        if (text.length() > maxOutputChars) {
            return text.substring(0, maxOutputChars) + "\n[truncated]";
        }
        return text;
    }

    private String toJson(Map<String, Object> config) {
        try {
            return json.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ScriptExecutionException("Could not serialize job config", e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
