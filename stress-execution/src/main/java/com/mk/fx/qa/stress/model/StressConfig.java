package com.mk.fx.qa.stress.model;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable run configuration shared by all workers.
 *
 * @param serverUri target address
 * @param concurrency number of workers
 * @param requestTimeout per-request timeout applied to every operation invocation
 * @param randomSeed base seed combined with each worker index
 * @param displayInterval interval between periodic snapshot reports
 * @param operations ordered operation table
 * @param probeRetries connectivity retries after the first failed attempt
 * @param probeRetryInterval nominal spacing between connectivity attempts
 * @param probeTimeout timeout of a single connectivity attempt
 * @param shutdownGraceSlices number of join slices granted to workers on stop
 * @param shutdownSlice duration of one join slice
 * @param trace log every outcome through the trace listener
 */
@Builder(toBuilder = true)
public record StressConfig(
    URI serverUri,
    int concurrency,
    Duration requestTimeout,
    int randomSeed,
    Duration displayInterval,
    List<NamedOperation> operations,
    int probeRetries,
    Duration probeRetryInterval,
    Duration probeTimeout,
    int shutdownGraceSlices,
    Duration shutdownSlice,
    boolean trace) {

  public static final int DEFAULT_PROBE_RETRIES = 10;
  public static final int DEFAULT_SHUTDOWN_GRACE_SLICES = 60;

  public StressConfig {
    Objects.requireNonNull(serverUri, "serverUri");
    Objects.requireNonNull(operations, "operations");
    if (operations.isEmpty()) {
      throw new IllegalArgumentException("At least one operation must be configured");
    }
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1 but was " + concurrency);
    }
    if (probeRetries < 0) {
      throw new IllegalArgumentException("probeRetries must be >= 0 but was " + probeRetries);
    }
    operations = List.copyOf(operations);
    requestTimeout = positiveOrDefault(requestTimeout, Duration.ofSeconds(10));
    displayInterval = positiveOrDefault(displayInterval, Duration.ofSeconds(5));
    probeRetryInterval = probeRetryInterval != null ? probeRetryInterval : Duration.ofSeconds(1);
    probeTimeout = positiveOrDefault(probeTimeout, Duration.ofSeconds(5));
    shutdownGraceSlices = shutdownGraceSlices > 0 ? shutdownGraceSlices : DEFAULT_SHUTDOWN_GRACE_SLICES;
    shutdownSlice = positiveOrDefault(shutdownSlice, Duration.ofSeconds(1));
  }

  public List<String> operationNames() {
    return operations.stream().map(NamedOperation::name).toList();
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback) {
    return value == null || value.isNegative() || value.isZero() ? fallback : value;
  }
}
