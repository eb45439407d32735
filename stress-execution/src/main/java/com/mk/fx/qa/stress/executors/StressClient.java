package com.mk.fx.qa.stress.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.base.Stopwatch;
import com.mk.fx.qa.stress.metrics.StressReportPrinter;
import com.mk.fx.qa.stress.metrics.StressResultAggregator;
import com.mk.fx.qa.stress.metrics.StressRunReport;
import com.mk.fx.qa.stress.metrics.StressSnapshot;
import com.mk.fx.qa.stress.model.StressClientState;
import com.mk.fx.qa.stress.model.StressConfig;
import com.mk.fx.qa.stress.rest.StressHttpClient;
import com.mk.fx.qa.stress.trace.LoggingStressEventListener;
import com.mk.fx.qa.stress.trace.StressEventListener;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a single stress run: probes the target, launches one {@link WorkerLoop} per configured
 * worker, prints a snapshot every display interval and, on {@link #stop()}, raises the stop signal
 * and joins the workers within a bounded grace window.
 *
 * <p>A client runs at most once. {@link #start()} on a running or stopped client fails with {@link
 * IllegalStateException}; {@link #stop()} may be called any number of times from any thread.
 */
@Slf4j
public class StressClient implements AutoCloseable {

  private final StressConfig config;
  private final StressHttpClient client;
  private final StressResultAggregator aggregator;
  private final StressEventListener listener;
  private final CancellationToken stopToken = new CancellationToken("stress-stop");
  private final Stopwatch stopwatch = Stopwatch.createUnstarted();

  private final Object lifecycleLock = new Object();
  private final AtomicReference<StressClientState> state =
      new AtomicReference<>(StressClientState.CREATED);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);

  private ExecutorService workers;
  private ScheduledExecutorService reporter;

  public StressClient(StressConfig config, StressHttpClient client) {
    this(config, client, config.trace() ? new LoggingStressEventListener() : StressEventListener.NONE);
  }

  public StressClient(StressConfig config, StressHttpClient client, StressEventListener listener) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.listener = listener != null ? listener : StressEventListener.NONE;
    this.aggregator = new StressResultAggregator(config.operationNames());
  }

  /**
   * Probes the target and launches the workers. Returns once every worker has been submitted.
   *
   * @throws IllegalStateException if the client is already running or has been stopped
   * @throws StressStartupException if the target stayed unreachable through every probe attempt
   */
  public void start() {
    synchronized (lifecycleLock) {
      if (stopRequested.get() || state.get() == StressClientState.STOPPED) {
        throw new IllegalStateException("Stress client has been stopped and cannot be restarted");
      }
      if (!state.compareAndSet(StressClientState.CREATED, StressClientState.PROBING)) {
        throw new IllegalStateException("Stress client is already running");
      }

      try {
        new ConnectivityProbe(
                client,
                config.probeRetries(),
                config.probeRetryInterval(),
                config.probeTimeout(),
                stopToken)
            .awaitReachable();
      } catch (RuntimeException e) {
        log.error("Stress client failed to start: {}", e.getMessage());
        state.set(StressClientState.STOPPED);
        releaseResources();
        throw e;
      }

      log.info(
          "Spinning up {} concurrent workers against {} with operations {}",
          config.concurrency(),
          client.baseUrl(),
          config.operationNames());
      synchronized (stopwatch) {
        stopwatch.start();
      }
      workers = launchWorkers();
      reporter = startReporter();
      state.set(StressClientState.RUNNING);
    }
  }

  /**
   * Raises the stop signal and waits for workers to drain, one slice at a time, up to the grace
   * window. Later calls return immediately.
   */
  public void stop() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    stopToken.cancel();

    synchronized (lifecycleLock) {
      var previous = state.getAndSet(StressClientState.STOPPING);
      if (workers != null) {
        awaitWorkers(workers);
      }
      synchronized (stopwatch) {
        if (stopwatch.isRunning()) {
          stopwatch.stop();
        }
      }
      releaseResources();
      state.set(StressClientState.STOPPED);
      log.info(
          "Stress client stopped (was {}) after {} with {} requests",
          previous,
          runtime(),
          aggregator.totalRequests());
    }
  }

  @Override
  public void close() {
    stop();
  }

  public StressClientState state() {
    return state.get();
  }

  public long totalErrorCount() {
    return aggregator.totalErrorCount();
  }

  public StressSnapshot snapshot() {
    return aggregator.snapshot(runtime());
  }

  public StressRunReport finalReport() {
    return aggregator.finalReport(runtime());
  }

  public void printFinalReport() {
    StressReportPrinter.printFinalReport(finalReport());
  }

  public Duration runtime() {
    synchronized (stopwatch) {
      return stopwatch.elapsed();
    }
  }

  public StressConfig config() {
    return config;
  }

  private ExecutorService launchWorkers() {
    var sequence = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("stress-worker-" + sequence.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(config.concurrency(), threadFactory);
    for (int i = 0; i < config.concurrency(); i++) {
      executor.execute(new WorkerLoop(i, config, client, aggregator, stopToken, listener));
    }
    return executor;
  }

  private ScheduledExecutorService startReporter() {
    var scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("stress-reporter");
              t.setDaemon(true);
              return t;
            });
    var intervalNanos = config.displayInterval().toNanos();
    scheduler.scheduleAtFixedRate(
        this::reportSnapshot, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
    return scheduler;
  }

  private void reportSnapshot() {
    try {
      StressReportPrinter.printSnapshot(aggregator.reportSnapshot(runtime()));
    } catch (RuntimeException e) {
      // an escaped exception cancels all later runs
      log.error("Failed to print stress snapshot", e);
    }
  }

  private void awaitWorkers(ExecutorService executor) {
    executor.shutdown();
    var slice = config.shutdownSlice();
    try {
      for (int i = 0; i < config.shutdownGraceSlices(); i++) {
        if (executor.awaitTermination(slice.toNanos(), TimeUnit.NANOSECONDS)) {
          return;
        }
        log.info("Client is stopping ...");
      }
      log.warn(
          "Workers did not stop within {} x {}; continuing shutdown",
          config.shutdownGraceSlices(),
          slice);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for workers to stop");
    }
  }

  private void releaseResources() {
    if (reporter != null) {
      reporter.shutdownNow();
    }
    stopToken.close();
    listener.close();
  }
}
