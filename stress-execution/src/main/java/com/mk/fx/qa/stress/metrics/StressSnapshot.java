package com.mk.fx.qa.stress.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the aggregate counters. Counters are read independently, so the view is
 * consistent enough for reporting but not linearizable across fields.
 *
 * @param stalled true when the total did not move since the previous snapshot
 */
public record StressSnapshot(
    Instant timestamp,
    Duration runtime,
    long totalRequests,
    boolean stalled,
    long reuseAddressFailures,
    List<OperationCounts> operations,
    OperationCounts totals) {}
