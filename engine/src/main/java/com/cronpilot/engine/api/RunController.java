package com.cronpilot.engine.api;

import com.cronpilot.engine.api.dto.RunEventResponse;
import com.cronpilot.engine.api.dto.RunListResponse;
import com.cronpilot.engine.api.dto.RunResponse;
import com.cronpilot.engine.driver.CronDriver;
import com.cronpilot.engine.driver.ListResult;
import com.cronpilot.engine.model.JobRun;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for runs and their event logs.
 *
 * GET  /api/cron/runs               list runs, newest first (jobId, offset, limit)
 * GET  /api/cron/runs/{id}          one run
 * GET  /api/cron/runs/{id}/events   latest events of a run, oldest first (limit)
 * POST /api/cron/runs/{id}/cancel   cancel a run that has not finished
 */
@RestController
@RequestMapping("/api/cron/runs")
public class RunController {

    private final CronDriver driver;

    public RunController(CronDriver driver) {
        this.driver = driver;
    }

    @GetMapping
    public RunListResponse list(@RequestParam(required = false) String jobId,
                                @RequestParam(defaultValue = "0") int offset,
                                @RequestParam(defaultValue = "50") int limit) {
        ListResult<JobRun> page = driver.listRuns(jobId, offset, limit);
        return new RunListResponse(
                page.items().stream().map(RunResponse::from).toList(),
                page.total(), page.offset(), page.limit());
    }

    @GetMapping("/{id}")
    public RunResponse get(@PathVariable String id) {
        return RunResponse.from(driver.getRun(id));
    }

    @GetMapping("/{id}/events")
    public List<RunEventResponse> events(@PathVariable String id,
                                         @RequestParam(defaultValue = "100") int limit) {
        return driver.getRunEvents(id, limit).stream()
                .map(RunEventResponse::from)
                .toList();
    }

    /** HTTP 409 if the run had already finished. */
    @PostMapping("/{id}/cancel")
    public RunResponse cancel(@PathVariable String id) {
        if (!driver.cancelRun(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Run already finished: " + id);
        }
        return RunResponse.from(driver.getRun(id));
    }
}
