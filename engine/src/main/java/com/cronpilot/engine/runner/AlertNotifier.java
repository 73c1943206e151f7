package com.cronpilot.engine.runner;

import com.cronpilot.engine.model.AlertConfig;
import com.cronpilot.engine.model.EventLevel;
import com.cronpilot.engine.model.JobDefinition;
import com.cronpilot.engine.model.JobRun;
import com.cronpilot.engine.store.CronStore;
import com.cronpilot.engine.store.RunEventLog;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raises the alerts a job asked for. An alert is an {@code alert} run event
 * (and the matching log line); delivery to people is left to whatever
 * watches the event stream or the log.
 */
@Component
public class AlertNotifier {

    private final CronStore   store;
    private final RunEventLog events;

    public AlertNotifier(CronStore store, RunEventLog events) {
        this.store  = store;
        this.events = events;
    }

    public void runSucceeded(JobDefinition job, JobRun run) {
        AlertConfig alerts = job.getAlerts();
        if (alerts.onSuccess()) {
            raise(run, EventLevel.INFO, "success", "Job '" + job.getName() + "' succeeded", Map.of());
        }
        if (alerts.onMaterialChange() && run.getOutputDigest() != null) {
            Optional<JobRun> previous = store.findLastSuccessfulRun(job.getId(), run.getId());
            String previousDigest = previous.map(JobRun::getOutputDigest).orElse(null);
            if (previousDigest != null && !Objects.equals(previousDigest, run.getOutputDigest())) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("previousRunId", previous.get().getId());
                data.put("previousDigest", previousDigest);
                data.put("digest", run.getOutputDigest());
                raise(run, EventLevel.WARN, "material_change",
                        "Output of job '" + job.getName() + "' changed since run " + previous.get().getId(), data);
            }
        }
    }

    public void runFailed(JobDefinition job, JobRun run) {
        if (job.getAlerts().onFailure()) {
            raise(run, EventLevel.WARN, "failure",
                    "Job '" + job.getName() + "' failed: " + run.getErrorCode() + " " + run.getErrorMessage(),
                    Map.of("state", run.getState().name()));
        }
    }

    private void raise(JobRun run, EventLevel level, String kind, String message, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>(extra);
        data.put("kind", kind);
        events.append(run.getId(), level, "alert", message, data);
    }
}
