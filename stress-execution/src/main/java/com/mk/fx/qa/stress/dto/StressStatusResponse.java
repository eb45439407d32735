package com.mk.fx.qa.stress.dto;

import com.mk.fx.qa.stress.metrics.StressSnapshot;
import com.mk.fx.qa.stress.model.StressClientState;

/**
 * Current state of the stress client together with its live counters.
 *
 * @param state lifecycle state
 * @param serverUri target address
 * @param concurrency worker count
 * @param randomSeed base seed of the run
 * @param snapshot counters at the time of the request
 */
public record StressStatusResponse(
    StressClientState state,
    String serverUri,
    int concurrency,
    int randomSeed,
    StressSnapshot snapshot) {}
