package com.mk.fx.qa.stress.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All occurrences of one failure signature, grouped by operation index. Appends synchronize on the
 * record itself so distinct signatures never contend with each other.
 */
final class FailureRecord {

  private final String errorText;
  private final Map<Integer, List<FailureEvent>> failures = new TreeMap<>();

  FailureRecord(String errorText) {
    this.errorText = errorText;
  }

  String errorText() {
    return errorText;
  }

  synchronized void add(int operationIndex, FailureEvent event) {
    failures.computeIfAbsent(operationIndex, k -> new ArrayList<>()).add(event);
  }

  synchronized Map<Integer, List<FailureEvent>> failuresSnapshot() {
    Map<Integer, List<FailureEvent>> copy = new TreeMap<>();
    failures.forEach((op, events) -> copy.put(op, List.copyOf(events)));
    return copy;
  }

  /**
   * One failed invocation.
   *
   * @param timestamp when the failure was recorded
   * @param duration time spent in the invocation
   * @param cancelled whether the context had been cancelled when the error surfaced
   */
  record FailureEvent(Instant timestamp, Duration duration, boolean cancelled) {}
}
