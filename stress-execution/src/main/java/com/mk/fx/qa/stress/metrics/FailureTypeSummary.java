package com.mk.fx.qa.stress.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Report view of one distinct failure type.
 *
 * @param errorText representative error text (the first occurrence, with stack trace)
 * @param failureCount occurrences across all operations
 * @param operations per-operation timelines, ordered by operation index
 */
public record FailureTypeSummary(
    String errorText, long failureCount, List<OperationFailures> operations) {

  /** Timeline of one failure type within one operation. */
  public record OperationFailures(String operation, List<Occurrence> occurrences) {

    public int count() {
      return occurrences.size();
    }
  }

  /** A single recorded failure. */
  public record Occurrence(Instant timestamp, Duration duration, boolean cancelled) {}
}
