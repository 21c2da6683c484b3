package com.cronpilot.scheduler.api;

import com.cronpilot.scheduler.api.dto.JobRequest;
import com.cronpilot.scheduler.api.dto.JobResponse;
import com.cronpilot.scheduler.api.dto.JobRunResponse;
import com.cronpilot.scheduler.api.dto.RunTriggeredResponse;
import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.model.RunStatus;
import com.cronpilot.scheduler.service.JobScheduler;
import com.cronpilot.scheduler.service.JobStore;
import com.cronpilot.scheduler.service.RunRecorder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for job definitions and their history.
 *
 * GET    /api/jobs                 list all jobs
 * POST   /api/jobs                 create a job
 * GET    /api/jobs/{id}            one job
 * PUT    /api/jobs/{id}            update a job (omitted fields unchanged)
 * DELETE /api/jobs/{id}            delete a job and its runs
 * POST   /api/jobs/{id}/enable     resume scheduling
 * POST   /api/jobs/{id}/disable    stop scheduling (in-flight runs continue)
 * POST   /api/jobs/{id}/run        run now, outside the schedule
 * GET    /api/jobs/{id}/runs       run history, newest first
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private static final int MAX_RUNS_LIMIT = 1000;

    private final JobStore     jobStore;
    private final RunRecorder  runRecorder;
    private final JobScheduler scheduler;

    public JobController(JobStore jobStore, RunRecorder runRecorder, JobScheduler scheduler) {
        this.jobStore    = jobStore;
        this.runRecorder = runRecorder;
        this.scheduler   = scheduler;
    }

    @GetMapping
    public List<JobResponse> listJobs() {
        return jobStore.listJobs().stream()
                .map(JobResponse::from)
                .toList();
    }

    /**
     * Create a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"daily-backup","scriptPath":"jobs/backup.py","cronExpression":"0 2 * * *"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> createJob(@RequestBody JobRequest req) {
        Job job = jobStore.upsertJob(req.toDefinition(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable Long id) {
        return JobResponse.from(jobStore.getJob(id));
    }

    @PutMapping("/{id}")
    public JobResponse updateJob(@PathVariable Long id, @RequestBody JobRequest req) {
        return JobResponse.from(jobStore.upsertJob(req.toDefinition(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteJob(@PathVariable Long id) {
        jobStore.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enable")
    public JobResponse enableJob(@PathVariable Long id) {
        return JobResponse.from(jobStore.setEnabled(id, true));
    }

    @PostMapping("/{id}/disable")
    public JobResponse disableJob(@PathVariable Long id) {
        return JobResponse.from(jobStore.setEnabled(id, false));
    }

    /**
     * Start a run immediately. Returns 202: the script runs in the background;
     * poll GET /api/jobs/{id}/runs for its outcome.
     */
    @PostMapping("/{id}/run")
    public ResponseEntity<RunTriggeredResponse> runNow(@PathVariable Long id) {
        Long runId = scheduler.triggerNow(id);
        return ResponseEntity.accepted()
                .body(new RunTriggeredResponse(id, runId, "Job execution started"));
    }

    /**
     * Run history, newest first.
     *
     * @param limit  maximum number of runs (default 50, at most 1000)
     * @param status optional filter: pending, running, success or failed
     */
    @GetMapping("/{id}/runs")
    public List<JobRunResponse> listRuns(@PathVariable Long id,
                                         @RequestParam(defaultValue = "50") int limit,
                                         @RequestParam(required = false) String status) {
        if (limit < 1 || limit > MAX_RUNS_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_RUNS_LIMIT);
        }
        RunStatus filter = parseStatus(status);
        return runRecorder.listRuns(id, limit, filter).stream()
                .map(JobRunResponse::from)
                .toList();
    }

    private static RunStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return RunStatus.fromDbValue(status.trim());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
