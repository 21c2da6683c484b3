package com.cronpilot.scheduler.api;

import com.cronpilot.scheduler.api.dto.StatusResponse;
import com.cronpilot.scheduler.model.SchedulerState;
import com.cronpilot.scheduler.service.JobStore;
import com.cronpilot.scheduler.service.RunRecorder;
import com.cronpilot.scheduler.service.SchedulerStatus;
import com.cronpilot.scheduler.service.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operational endpoints.
 *
 * GET  /api/status                       job counts and scheduler state
 * POST /api/debug/refresh-schedules      recompute next_run_at for every job
 */
@RestController
@RequestMapping("/api")
public class StatusController {

    private static final Logger log = LoggerFactory.getLogger(StatusController.class);

    private final JobStore     jobStore;
    private final RunRecorder  runRecorder;
    private final JobScheduler scheduler;

    public StatusController(JobStore jobStore, RunRecorder runRecorder, JobScheduler scheduler) {
        this.jobStore    = jobStore;
        this.runRecorder = runRecorder;
        this.scheduler   = scheduler;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        SchedulerStatus s = scheduler.status();
        return new StatusResponse(
                jobStore.countJobs(),
                jobStore.countEnabledJobs(),
                runRecorder.countRunning(),
                s.state().name(),
                s.state() != SchedulerState.HALTED,
                s.runsInFlight());
    }

    @PostMapping("/debug/refresh-schedules")
    public Map<String, Object> refreshSchedules() {
        log.info("Manual refresh of all job schedules requested");
        int changed = jobStore.refreshSchedules();
        return Map.of(
                "message", "Refreshed schedules; " + changed + " job(s) changed",
                "jobsChanged", changed);
    }
}
