package com.mk.fx.qa.stress.executors;

import com.google.common.base.Stopwatch;
import com.mk.fx.qa.stress.rest.RestClientException;
import com.mk.fx.qa.stress.rest.StressHttpClient;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies the target is reachable before any worker starts. Attempts are spaced by the retry
 * interval measured from the start of each attempt; a stop request aborts the wait.
 */
@Slf4j
final class ConnectivityProbe {

  private final StressHttpClient client;
  private final int maxRetries;
  private final Duration retryInterval;
  private final Duration attemptTimeout;
  private final CancellationToken stopToken;

  ConnectivityProbe(
      StressHttpClient client,
      int maxRetries,
      Duration retryInterval,
      Duration attemptTimeout,
      CancellationToken stopToken) {
    this.client = Objects.requireNonNull(client, "client");
    this.maxRetries = maxRetries;
    this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval");
    this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "attemptTimeout");
    this.stopToken = Objects.requireNonNull(stopToken, "stopToken");
  }

  /**
   * Blocks until one attempt succeeds.
   *
   * @throws StressStartupException when all {@code maxRetries + 1} attempts failed or a stop was
   *     requested while probing
   */
  void awaitReachable() {
    log.info("Trying to connect to the server {}", client.baseUrl());
    for (int remaining = maxRetries; ; remaining--) {
      if (stopToken.isCancellationRequested()) {
        throw new StressStartupException("Stop requested while probing " + client.baseUrl());
      }
      var attempt = Stopwatch.createStarted();
      try {
        var status = client.probe(attemptTimeout);
        log.info("Connected successfully to {} (status {})", client.baseUrl(), status);
        return;
      } catch (RestClientException e) {
        if (e.getCause() instanceof InterruptedException) {
          throw new StressStartupException("Interrupted while probing " + client.baseUrl(), e);
        }
        if (remaining <= 0) {
          throw new StressStartupException(
              "Could not connect to " + client.baseUrl() + " after " + (maxRetries + 1) + " attempts",
              e);
        }
        log.warn(
            "Stress client could not connect to host {}, {} attempts remaining: {}",
            client.baseUrl(),
            remaining,
            e.getMessage());
        waitBeforeRetry(retryInterval.minus(attempt.elapsed()));
      }
    }
  }

  private void waitBeforeRetry(Duration delay) {
    if (delay.isNegative() || delay.isZero()) {
      return;
    }
    try {
      if (stopToken.await(delay)) {
        throw new StressStartupException("Stop requested while probing " + client.baseUrl());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StressStartupException("Interrupted while probing " + client.baseUrl(), e);
    }
  }
}
