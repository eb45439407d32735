package com.mk.fx.qa.stress.executors;

import com.mk.fx.qa.stress.rest.StressHttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Per-invocation context handed to a {@link com.mk.fx.qa.stress.model.ClientOperation}. Owns a
 * cancellation token that fires when the shared stop signal is raised or when the per-request
 * timeout elapses inside {@link #await(CompletableFuture)}. Not shared between invocations.
 */
public final class RequestContext implements AutoCloseable {

  private static final String ALPHABET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  private final StressHttpClient client;
  private final Random random;
  private final int workerIndex;
  private final Duration timeout;
  private final CancellationToken token;
  private final CancellationToken.Registration stopLink;
  private final long deadlineNanos;

  public RequestContext(
      StressHttpClient client,
      Random random,
      CancellationToken stopToken,
      int workerIndex,
      Duration timeout) {
    this.client = client;
    this.random = Objects.requireNonNull(random, "random");
    this.workerIndex = workerIndex;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.token = new CancellationToken("worker-" + workerIndex);
    this.stopLink = Objects.requireNonNull(stopToken, "stopToken").register(token::cancel);
    this.deadlineNanos = System.nanoTime() + timeout.toNanos();
  }

  public StressHttpClient client() {
    return client;
  }

  public Random random() {
    return random;
  }

  public int workerIndex() {
    return workerIndex;
  }

  public Duration timeout() {
    return timeout;
  }

  /** Time left before the per-request timeout, never negative. */
  public Duration remaining() {
    return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
  }

  public CancellationToken cancellationToken() {
    return token;
  }

  public boolean isCancellationRequested() {
    return token.isCancellationRequested();
  }

  /**
   * Waits for the future within the per-request timeout. When the timeout elapses or the stop
   * signal is raised, the context token is cancelled, the future is cancelled and an {@link
   * OperationCancelledException} (or the future's {@link java.util.concurrent.CancellationException})
   * is thrown.
   *
   * @throws ExecutionException if the future completed exceptionally
   * @throws InterruptedException if the waiting thread was interrupted
   */
  public <T> T await(CompletableFuture<T> future) throws ExecutionException, InterruptedException {
    try (var ignored = token.register(() -> future.cancel(true))) {
      return future.get(remaining().toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      // the registration above is already closed here
      future.cancel(true);
      token.cancel();
      throw new OperationCancelledException("Request timed out after " + timeout, token);
    }
  }

  public int nextRandomInt(int originInclusive, int boundExclusive) {
    return originInclusive + random.nextInt(boundExclusive - originInclusive);
  }

  public boolean nextRandomBoolean(double probability) {
    return random.nextDouble() < probability;
  }

  /** Random alphanumeric string of length {@code [1, maxLength]}. */
  public String nextRandomString(int maxLength) {
    int length = 1 + random.nextInt(Math.max(1, maxLength));
    var sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }

  /** Detaches from the stop signal; the context must not be used afterwards. */
  @Override
  public void close() {
    stopLink.close();
    token.close();
  }
}
