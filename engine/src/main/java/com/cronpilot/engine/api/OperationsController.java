package com.cronpilot.engine.api;

import com.cronpilot.engine.api.dto.HealthResponse;
import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.driver.CronDriver;
import com.cronpilot.engine.driver.ProcessSummary;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

/**
 * Engine-level operations.
 *
 * POST /api/cron/process            process pending runs now
 * POST /api/cron/update-schedules   recompute every schedule
 * GET  /api/cron/health             liveness plus job count
 */
@RestController
@RequestMapping("/api/cron")
public class OperationsController {

    private final CronDriver     driver;
    private final CronProperties props;
    private final Clock          clock;

    public OperationsController(CronDriver driver, CronProperties props, Clock clock) {
        this.driver = driver;
        this.props  = props;
        this.clock  = clock;
    }

    @PostMapping("/process")
    public ProcessSummary process() {
        return driver.processPendingRuns();
    }

    @PostMapping("/update-schedules")
    public Map<String, Integer> updateSchedules() {
        return Map.of("scheduled", driver.updateSchedules());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        long jobs = driver.listJobs(0, 1).total();
        return new HealthResponse("ok", jobs, props.workerId(), clock.instant());
    }
}
