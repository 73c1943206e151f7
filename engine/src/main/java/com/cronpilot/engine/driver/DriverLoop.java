package com.cronpilot.engine.driver;

import com.cronpilot.engine.config.CronProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Background loop of the long-running service.
 *
 * The database is the queue: every tick asks the scheduler for pending runs
 * and executes them through the driver. Several service instances can run
 * this loop against the same database; claim locks keep them from
 * executing the same run twice.
 *
 * Not active in the CLI, which runs single commands and exits.
 */
@Component
@Profile("!cli")
@EnableScheduling
public class DriverLoop {

    private static final Logger log = LoggerFactory.getLogger(DriverLoop.class);

    private final CronDriver     driver;
    private final CronProperties props;

    public DriverLoop(CronDriver driver, CronProperties props) {
        this.driver = driver;
        this.props  = props;
    }

    /** Create the working directories and rebuild every schedule (they are a cache). */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        try {
            Files.createDirectories(props.artifactsPath());
            Files.createDirectories(props.logsPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create working directories", e);
        }
        int scheduled = driver.updateSchedules();
        log.info("Driver loop started as {} ({} job(s) scheduled, polling every {} ms)",
                props.workerId(), scheduled, props.pollIntervalMs());
    }

    /**
     * fixedDelay: the next poll starts poll-interval-ms after the previous
     * one finished, so a slow batch never overlaps the next.
     */
    @Scheduled(fixedDelayString = "${cronpilot.poll-interval-ms:15000}",
               initialDelayString = "${cronpilot.poll-interval-ms:15000}")
    public void poll() {
        try {
            ProcessSummary summary = driver.processPendingRuns();
            if (summary.pending() > 0) {
                log.debug("Poll finished: {}", summary);
            }
        } catch (RuntimeException e) {
            log.error("Poll failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
    public void maintenance() {
        try {
            int recovered = driver.runMaintenance();
            if (recovered > 0) {
                log.warn("Recovered {} abandoned run(s)", recovered);
            }
        } catch (RuntimeException e) {
            log.error("Maintenance failed: {}", e.getMessage(), e);
        }
    }
}
