package com.mk.fx.qa.stress.metrics;

import com.google.common.base.Throwables;
import java.net.BindException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import lombok.extern.slf4j.Slf4j;

/**
 * Run-scoped, thread-safe collector of operation outcomes.
 *
 * <p>Threading: counters are atomics and the latency samples live in a lock-free queue, so the
 * record methods never block each other. Failure types are keyed by structural {@link
 * FailureSignature} in a concurrent map; a new {@link FailureRecord} is inserted once per
 * signature and later occurrences append under that record's own lock.
 */
@Slf4j
public class StressResultAggregator {

  private final List<String> operationNames;

  private final AtomicLong totalRequests = new AtomicLong();
  private final AtomicLongArray successes;
  private final AtomicLongArray cancellations;
  private final AtomicLongArray failures;
  private final AtomicLong reuseAddressFailures = new AtomicLong();
  private final AtomicLong lastSnapshotTotal = new AtomicLong(-1);

  private final Map<FailureSignature, FailureRecord> failureTypes = new ConcurrentHashMap<>();
  private final Queue<Double> latencies = new ConcurrentLinkedQueue<>();

  public StressResultAggregator(List<String> operationNames) {
    Objects.requireNonNull(operationNames, "operationNames");
    this.operationNames = List.copyOf(operationNames);
    this.successes = new AtomicLongArray(operationNames.size());
    this.cancellations = new AtomicLongArray(operationNames.size());
    this.failures = new AtomicLongArray(operationNames.size());
  }

  public void recordSuccess(int operationIndex, Duration elapsed) {
    totalRequests.incrementAndGet();
    successes.incrementAndGet(operationIndex);
    latencies.add(toMillis(elapsed));
  }

  public void recordCancellation(int operationIndex, Duration elapsed) {
    totalRequests.incrementAndGet();
    cancellations.incrementAndGet(operationIndex);
    latencies.add(toMillis(elapsed));
  }

  /**
   * Records a failed invocation, files it under its failure type and emits a diagnostic.
   *
   * @param error the error raised by the operation
   * @param operationIndex index into the operation table
   * @param elapsed time spent in the invocation
   * @param cancelled whether the request context had been cancelled when the error surfaced
   * @param workerIndex the reporting worker
   * @param iteration the worker's iteration counter
   */
  public void recordFailure(
      Throwable error,
      int operationIndex,
      Duration elapsed,
      boolean cancelled,
      int workerIndex,
      long iteration) {
    var timestamp = Instant.now();

    totalRequests.incrementAndGet();
    failures.incrementAndGet(operationIndex);
    latencies.add(toMillis(elapsed));

    var signature = FailureClassifier.classify(error);
    var failureType =
        failureTypes.computeIfAbsent(
            signature, k -> new FailureRecord(Throwables.getStackTraceAsString(error)));
    failureType.add(operationIndex, new FailureRecord.FailureEvent(timestamp, elapsed, cancelled));

    if (isAddressReuseRace(signature)) {
      reuseAddressFailures.incrementAndGet();
    } else {
      log.warn(
          "Error from iteration {} ({}) in worker {} with {} successes / {} fails:",
          iteration,
          operationNames.get(operationIndex),
          workerIndex,
          sum(successes),
          sum(failures),
          error);
    }
  }

  public long totalRequests() {
    return totalRequests.get();
  }

  public long totalErrorCount() {
    return sum(failures);
  }

  public long reuseAddressFailures() {
    return reuseAddressFailures.get();
  }

  public long latencySampleCount() {
    return latencies.size();
  }

  public int failureTypeCount() {
    return failureTypes.size();
  }

  public List<String> operationNames() {
    return operationNames;
  }

  /** Reads the current counters without affecting stall detection. */
  public StressSnapshot snapshot(Duration runtime) {
    return buildSnapshot(runtime, false);
  }

  /**
   * Reads the current counters for the periodic report. The total is remembered so the next
   * periodic snapshot can flag a stall.
   */
  public StressSnapshot reportSnapshot(Duration runtime) {
    return buildSnapshot(runtime, true);
  }

  private StressSnapshot buildSnapshot(Duration runtime, boolean advance) {
    var total = totalRequests.get();
    var previous = advance ? lastSnapshotTotal.getAndSet(total) : lastSnapshotTotal.get();
    var stalled = previous == total;

    List<OperationCounts> perOperation = new ArrayList<>(operationNames.size());
    long s = 0;
    long c = 0;
    long f = 0;
    for (int i = 0; i < operationNames.size(); i++) {
      var counts =
          new OperationCounts(
              operationNames.get(i), successes.get(i), cancellations.get(i), failures.get(i));
      perOperation.add(counts);
      s += counts.successes();
      c += counts.cancellations();
      f += counts.failures();
    }
    return new StressSnapshot(
        Instant.now(),
        runtime,
        total,
        stalled,
        reuseAddressFailures.get(),
        List.copyOf(perOperation),
        new OperationCounts("TOTAL", s, c, f));
  }

  /** Latency percentiles over every sample so far, empty when nothing was recorded. */
  public Optional<LatencyReport> latencyReport() {
    var samples = List.copyOf(latencies);
    return samples.isEmpty()
        ? Optional.empty()
        : Optional.of(LatencyReport.from(samples));
  }

  /** Distinct failure types ranked by occurrence count, most frequent first. */
  public List<FailureTypeSummary> failureTypes() {
    List<FailureTypeSummary> result = new ArrayList<>(failureTypes.size());
    for (FailureRecord record : failureTypes.values()) {
      List<FailureTypeSummary.OperationFailures> perOperation = new ArrayList<>();
      long count = 0;
      for (var entry : record.failuresSnapshot().entrySet()) {
        var occurrences =
            entry.getValue().stream()
                .map(e -> new FailureTypeSummary.Occurrence(e.timestamp(), e.duration(), e.cancelled()))
                .toList();
        count += occurrences.size();
        perOperation.add(
            new FailureTypeSummary.OperationFailures(
                operationNames.get(entry.getKey()), occurrences));
      }
      result.add(new FailureTypeSummary(record.errorText(), count, List.copyOf(perOperation)));
    }
    // sort the copies; live records may still be growing
    result.sort(Comparator.comparingLong(FailureTypeSummary::failureCount).reversed());
    return List.copyOf(result);
  }

  public StressRunReport finalReport(Duration runtime) {
    return new StressRunReport(
        snapshot(runtime), latencyReport().orElse(null), totalErrorCount(), failureTypes());
  }

  private static boolean isAddressReuseRace(FailureSignature signature) {
    return signature.links().stream().anyMatch(l -> BindException.class.isAssignableFrom(l.kind()));
  }

  private static double toMillis(Duration elapsed) {
    return elapsed.toNanos() / 1_000_000.0;
  }

  private static long sum(AtomicLongArray counters) {
    long total = 0;
    for (int i = 0; i < counters.length(); i++) {
      total += counters.get(i);
    }
    return total;
  }
}
