package com.cronpilot.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution state of a single run.
 *
 * Transitions:
 *   DUE      → STARTING (admitted by the scheduler)
 *   STARTING → RUNNING  (executor about to be invoked)
 *   RUNNING  → SUCCEEDED | FAILED_RETRYABLE | FAILED | CANCELLED
 *   DUE      → FAILED   (admission rejected)
 *
 * FAILED_RETRYABLE is followed by a fresh DUE run with attempt + 1; the
 * failed run itself is never picked up again.
 */
public enum RunState {
    DUE,
    STARTING,
    RUNNING,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED,
    CANCELLED;

    public static final Set<RunState> ACTIVE = EnumSet.of(STARTING, RUNNING);

    public static final Set<RunState> LIVE = EnumSet.of(DUE, STARTING, RUNNING);

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
