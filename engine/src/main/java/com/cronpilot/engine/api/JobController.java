package com.cronpilot.engine.api;

import com.cronpilot.engine.api.dto.JobListResponse;
import com.cronpilot.engine.api.dto.JobResponse;
import com.cronpilot.engine.api.dto.RunJobRequest;
import com.cronpilot.engine.api.dto.RunResponse;
import com.cronpilot.engine.definition.JobSpec;
import com.cronpilot.engine.driver.CronDriver;
import com.cronpilot.engine.driver.ListResult;
import com.cronpilot.engine.model.JobDefinition;
import com.cronpilot.engine.model.JobRun;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for job definitions.
 *
 * GET    /api/cron/jobs               list jobs (offset, limit)
 * POST   /api/cron/jobs               create or replace a job
 * GET    /api/cron/jobs/{id}          job definition and schedule state
 * DELETE /api/cron/jobs/{id}          delete a job and everything it owns
 * POST   /api/cron/jobs/{id}/pause    stop scheduling
 * POST   /api/cron/jobs/{id}/resume   schedule again
 * POST   /api/cron/jobs/{id}/run      run now (?dryRun=true for a dry run)
 */
@RestController
@RequestMapping("/api/cron/jobs")
public class JobController {

    private final CronDriver driver;

    public JobController(CronDriver driver) {
        this.driver = driver;
    }

    @GetMapping
    public JobListResponse list(@RequestParam(defaultValue = "0") int offset,
                                @RequestParam(defaultValue = "50") int limit) {
        ListResult<JobDefinition> page = driver.listJobs(offset, limit);
        return new JobListResponse(
                page.items().stream().map(this::toResponse).toList(),
                page.total(), page.offset(), page.limit());
    }

    /**
     * Create or replace a job. The body has the same shape as a job file.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/cron/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"id":"news","name":"News digest","schedule":"0 7 * * *","graphId":"digest"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> add(@RequestBody JobSpec spec) {
        JobDefinition job = driver.addJob(spec);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(job));
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public JobResponse get(@PathVariable String id) {
        return toResponse(driver.getJob(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        driver.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/pause")
    public JobResponse pause(@PathVariable String id) {
        return toResponse(driver.pauseJob(id));
    }

    @PostMapping("/{id}/resume")
    public JobResponse resume(@PathVariable String id) {
        return toResponse(driver.resumeJob(id));
    }

    /**
     * Run a job immediately and wait for the outcome.
     * The optional body overrides inputs for this run only.
     */
    @PostMapping("/{id}/run")
    public RunResponse run(@PathVariable String id,
                           @RequestParam(defaultValue = "false") boolean dryRun,
                           @RequestBody(required = false) RunJobRequest body) {
        Map<String, Object> overrides = body == null ? null : body.inputs();
        JobRun run = dryRun ? driver.dryRun(id, overrides) : driver.runJobNow(id, overrides);
        return RunResponse.from(run);
    }

    private JobResponse toResponse(JobDefinition job) {
        return JobResponse.from(job, driver.getSchedule(job.getId()));
    }
}
