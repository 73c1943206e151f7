package com.cronpilot.engine.scheduler;

/**
 * Outcome of admission control for one run.
 *
 * @param canRun       the run may start now
 * @param reason       why it may not; null when admitted
 * @param lockAcquired the run now holds the job's concurrency lock and must release it
 * @param deferred     not admitted yet but stays DUE for a later poll (queue policy)
 */
public record AdmissionDecision(boolean canRun, String reason, boolean lockAcquired, boolean deferred) {

    public static AdmissionDecision admitted(boolean lockAcquired) {
        return new AdmissionDecision(true, null, lockAcquired, false);
    }

    public static AdmissionDecision rejected(String reason) {
        return new AdmissionDecision(false, reason, false, false);
    }

    public static AdmissionDecision deferred(String reason) {
        return new AdmissionDecision(false, reason, false, true);
    }
}
