package com.cronpilot.engine.executor;

import com.cronpilot.engine.executor.dto.ExecutionResult;
import com.cronpilot.engine.model.ResourceLimits;

import java.nio.file.Path;
import java.util.Map;

/**
 * The external capability that does a job's actual work.
 *
 * The engine knows nothing about what a graph computes: it passes the
 * job's inputs through unchanged, along with the directory the run may
 * write files into and the resource caps the executor is expected to
 * honour. Implementations must respond to thread interruption, which is
 * how the runner cancels a call that exceeded maxRunSeconds.
 */
public interface GraphExecutor {

    /**
     * @throws ExecutorException on any failure; the code and transient flag
     *                           drive retry classification
     */
    ExecutionResult execute(String graphId, Map<String, Object> inputs, Path artifactsDir, ResourceLimits caps);
}
