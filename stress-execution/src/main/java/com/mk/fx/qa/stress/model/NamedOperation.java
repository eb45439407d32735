package com.mk.fx.qa.stress.model;

import java.util.Objects;

/**
 * Entry of the operation table.
 *
 * @param name display name used in reports
 * @param operation the work to invoke
 */
public record NamedOperation(String name, ClientOperation operation) {

  public NamedOperation {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(operation, "operation");
  }
}
