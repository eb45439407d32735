package com.mk.fx.qa.stress.executors;

/** Raised by {@link StressClient#start()} when the target never became reachable. */
public class StressStartupException extends RuntimeException {

  public StressStartupException(String message) {
    super(message);
  }

  public StressStartupException(String message, Throwable cause) {
    super(message, cause);
  }
}
