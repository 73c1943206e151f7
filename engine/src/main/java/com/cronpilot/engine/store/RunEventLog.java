package com.cronpilot.engine.store;

import com.cronpilot.engine.model.EventLevel;
import com.cronpilot.engine.model.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Writes run events to the store and mirrors each one to the application
 * log at the matching level, so the audit trail and the log never disagree.
 */
@Component
public class RunEventLog {

    private static final Logger log = LoggerFactory.getLogger("com.cronpilot.engine.runs");

    private final CronStore store;
    private final Clock     clock;

    public RunEventLog(CronStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public RunEvent info(String runId, String event, String message) {
        return append(runId, EventLevel.INFO, event, message, null);
    }

    public RunEvent warn(String runId, String event, String message) {
        return append(runId, EventLevel.WARN, event, message, null);
    }

    public RunEvent error(String runId, String event, String message) {
        return append(runId, EventLevel.ERROR, event, message, null);
    }

    public RunEvent append(String runId, EventLevel level, String event, String message, Map<String, Object> data) {
        RunEvent saved = store.appendEvent(new RunEvent(runId, clock.instant(), level, event, message, data));
        switch (level) {
            case DEBUG -> log.debug("[{}] {}: {}", runId, event, message);
            case INFO  -> log.info("[{}] {}: {}", runId, event, message);
            case WARN  -> log.warn("[{}] {}: {}", runId, event, message);
            case ERROR -> log.error("[{}] {}: {}", runId, event, message);
        }
        return saved;
    }
}
