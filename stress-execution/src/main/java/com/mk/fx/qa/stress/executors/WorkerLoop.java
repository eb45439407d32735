package com.mk.fx.qa.stress.executors;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.mk.fx.qa.stress.metrics.StressResultAggregator;
import com.mk.fx.qa.stress.model.NamedOperation;
import com.mk.fx.qa.stress.model.OperationOutcome;
import com.mk.fx.qa.stress.model.StressConfig;
import com.mk.fx.qa.stress.rest.StressHttpClient;
import com.mk.fx.qa.stress.trace.StressEventListener;
import com.mk.fx.qa.stress.utils.StressUtils;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * One concurrent worker. Selects operations round-robin starting at its own index, invokes them
 * under a fresh {@link RequestContext} and records every outcome until the stop signal is raised.
 *
 * <p>A worker owns its random source and stopwatch; neither is shared with other threads.
 */
@Slf4j
final class WorkerLoop implements Runnable {

  private final int workerIndex;
  private final List<NamedOperation> operations;
  private final Duration requestTimeout;
  private final StressHttpClient client;
  private final StressResultAggregator aggregator;
  private final CancellationToken stopToken;
  private final StressEventListener listener;
  private final Random random;
  private final Stopwatch stopwatch = Stopwatch.createUnstarted();

  private long iteration;

  WorkerLoop(
      int workerIndex,
      StressConfig config,
      StressHttpClient client,
      StressResultAggregator aggregator,
      CancellationToken stopToken,
      StressEventListener listener) {
    this.workerIndex = workerIndex;
    this.operations = config.operations();
    this.requestTimeout = config.requestTimeout();
    this.client = client;
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.stopToken = Objects.requireNonNull(stopToken, "stopToken");
    this.listener = listener != null ? listener : StressEventListener.NONE;
    this.random = new Random(StressUtils.combine(workerIndex, config.randomSeed()));
    this.iteration = workerIndex;
  }

  @Override
  public void run() {
    log.debug("Worker {} started", workerIndex);
    try {
      while (!stopToken.isCancellationRequested() && !Thread.currentThread().isInterrupted()) {
        runIteration();
      }
    } catch (RuntimeException | Error e) {
      log.error("Worker {} terminated unexpectedly at iteration {}", workerIndex, iteration, e);
      throw e;
    }
    log.debug("Worker {} exited after iteration {}", workerIndex, iteration);
  }

  /** Runs the next operation and records its outcome. */
  @VisibleForTesting
  OperationOutcome runIteration() {
    var current = iteration++;
    var operationIndex = operationIndex(current, operations.size());
    var operation = operations.get(operationIndex);

    OperationOutcome outcome;
    stopwatch.reset().start();
    try (var context = new RequestContext(client, random, stopToken, workerIndex, requestTimeout)) {
      try {
        CompletableFuture<?> pending = operation.operation().invoke(context);
        if (pending != null) {
          context.await(pending);
        }
        outcome = OperationOutcome.success(stopwatch.stop().elapsed());
        aggregator.recordSuccess(operationIndex, outcome.duration());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        outcome = classify(e, context, operationIndex, current);
      } catch (Exception e) {
        outcome = classify(unwrap(e), context, operationIndex, current);
      } catch (VirtualMachineError e) {
        throw e;
      } catch (Error e) {
        // assertion and linkage errors from an operation are ordinary failures
        outcome = classify(e, context, operationIndex, current);
      }
    }

    listener.onOutcome(workerIndex, current, operation.name(), outcome);
    return outcome;
  }

  private OperationOutcome classify(
      Throwable error, RequestContext context, int operationIndex, long current) {
    var elapsed = stopwatch.isRunning() ? stopwatch.stop().elapsed() : stopwatch.elapsed();
    var cancelledByUs = context.isCancellationRequested() || stopToken.isCancellationRequested();
    if (isCancellation(error) && cancelledByUs) {
      aggregator.recordCancellation(operationIndex, elapsed);
      return OperationOutcome.cancelled(elapsed);
    }
    aggregator.recordFailure(
        error, operationIndex, elapsed, context.isCancellationRequested(), workerIndex, current);
    return OperationOutcome.failure(error, elapsed);
  }

  @VisibleForTesting
  static int operationIndex(long iteration, int operationCount) {
    return (int) (iteration % operationCount);
  }

  @VisibleForTesting
  long iteration() {
    return iteration;
  }

  private static boolean isCancellation(Throwable error) {
    return error instanceof CancellationException || error instanceof InterruptedException;
  }

  private static Throwable unwrap(Throwable error) {
    var current = error;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
