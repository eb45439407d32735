package com.mk.fx.qa.stress.metrics;

import java.util.List;

/**
 * Final report of a run.
 *
 * @param latency latency distribution, {@code null} when no request completed
 * @param totalFailures failures across all operations
 * @param failureTypes distinct failure types, most frequent first
 */
public record StressRunReport(
    StressSnapshot snapshot,
    LatencyReport latency,
    long totalFailures,
    List<FailureTypeSummary> failureTypes) {}
