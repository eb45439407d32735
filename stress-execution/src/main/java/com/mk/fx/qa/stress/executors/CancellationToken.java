package com.mk.fx.qa.stress.executors;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Broadcast cancellation signal. Any number of readers may poll, await or register callbacks;
 * cancelling does not consume the signal. Cancellation is one-way and happens at most once.
 */
@Slf4j
public final class CancellationToken implements AutoCloseable {

  private final String name;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CountDownLatch cancelledLatch = new CountDownLatch(1);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public CancellationToken(String name) {
    this.name = name;
  }

  /** Cancels the token and runs registered callbacks. Returns false if already cancelled. */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    cancelledLatch.countDown();
    // a callback runs exactly once: whoever removes it (this loop or register) runs it
    for (Runnable callback : callbacks) {
      if (!callbacks.remove(callback)) {
        continue;
      }
      try {
        callback.run();
      } catch (RuntimeException ex) {
        log.warn("Cancellation callback on token {} failed: {}", name, ex.getMessage(), ex);
      }
    }
    return true;
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }

  public void throwIfCancellationRequested() {
    if (cancelled.get()) {
      throw new OperationCancelledException("Operation cancelled by token " + name, this);
    }
  }

  /**
   * Blocks until the token is cancelled or the timeout elapses.
   *
   * @return true if the token was cancelled
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return cancelledLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Registers a callback run on cancellation, or immediately if already cancelled. Closing the
   * returned registration detaches the callback so short-lived listeners do not accumulate on a
   * long-lived token.
   */
  public Registration register(Runnable callback) {
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      callback.run();
    }
    return () -> callbacks.remove(callback);
  }

  int registeredCallbacks() {
    return callbacks.size();
  }

  /** Releases pending callbacks without cancelling. */
  @Override
  public void close() {
    callbacks.clear();
  }

  @Override
  public String toString() {
    return "CancellationToken[" + name + (cancelled.get() ? ", cancelled]" : "]");
  }

  /** Handle for a registered callback. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
