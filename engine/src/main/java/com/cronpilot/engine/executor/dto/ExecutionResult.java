package com.cronpilot.engine.executor.dto;

import java.util.List;

/**
 * Response from POST /graphs/{graphId}/execute.
 *
 * Only {@code output} is required; usage counters default to zero and the
 * step trace to empty when the executor does not report them.
 */
public record ExecutionResult(
        String          output,
        int             steps_used,
        long            tokens_used,
        long            bandwidth_bytes,
        List<StepTrace> steps
) {
    public ExecutionResult {
        if (output == null) output = "";
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static ExecutionResult of(String output, int stepsUsed, long tokensUsed) {
        return new ExecutionResult(output, stepsUsed, tokensUsed, 0L, List.of());
    }

    public boolean hasSteps() {
        return !steps.isEmpty();
    }
}
