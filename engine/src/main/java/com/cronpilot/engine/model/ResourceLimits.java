package com.cronpilot.engine.model;

import java.util.List;
import java.util.Map;

/**
 * Resource caps attached to a job.
 *
 * Only {@code maxRunSeconds} is enforced by the runner (as a hard wall-clock
 * timeout). Everything else is handed to the executor with each call and
 * compared against the usage it reports afterwards.
 *
 * @param networkScope   how far the executor may reach on the network
 * @param allowlist      hostname patterns reachable when scope is ALLOWLIST
 * @param rateLimits     hostname → requests per minute
 * @param maxBandwidth   bytes per second, null for unlimited
 * @param maxSteps       step budget for the executor
 * @param maxRunSeconds  wall-clock timeout of one run
 * @param maxModelTokens token budget for the executor
 */
public record ResourceLimits(
        NetworkScope        networkScope,
        List<String>        allowlist,
        Map<String, Integer> rateLimits,
        Long                maxBandwidth,
        int                 maxSteps,
        int                 maxRunSeconds,
        int                 maxModelTokens
) {
    public static final int DEFAULT_MAX_STEPS        = 10;
    public static final int DEFAULT_MAX_RUN_SECONDS  = 300;
    public static final int DEFAULT_MAX_MODEL_TOKENS = 4000;

    public ResourceLimits {
        if (networkScope == null) networkScope = NetworkScope.ALL;
        allowlist  = allowlist  == null ? List.of() : List.copyOf(allowlist);
        rateLimits = rateLimits == null ? Map.of()  : Map.copyOf(rateLimits);
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(NetworkScope.ALL, List.of(), Map.of(), null,
                DEFAULT_MAX_STEPS, DEFAULT_MAX_RUN_SECONDS, DEFAULT_MAX_MODEL_TOKENS);
    }
}
