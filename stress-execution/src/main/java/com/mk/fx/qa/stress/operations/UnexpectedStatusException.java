package com.mk.fx.qa.stress.operations;

import lombok.Getter;

/** Raised when a configured REST call answers with a status it does not accept. */
@Getter
public class UnexpectedStatusException extends RuntimeException {

  private final int status;
  private final String method;
  private final String path;

  public UnexpectedStatusException(int status, String method, String path) {
    super("Unexpected status " + status + " for " + method + " " + path);
    this.status = status;
    this.method = method;
    this.path = path;
  }
}
