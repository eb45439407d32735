package com.mk.fx.qa.stress.executors;

import java.util.concurrent.CancellationException;

/** Raised when work is abandoned because a {@link CancellationToken} was cancelled. */
public class OperationCancelledException extends CancellationException {

  private final transient CancellationToken token;

  public OperationCancelledException(String message, CancellationToken token) {
    super(message);
    this.token = token;
  }

  public CancellationToken getToken() {
    return token;
  }
}
