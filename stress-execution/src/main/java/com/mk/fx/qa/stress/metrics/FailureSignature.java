package com.mk.fx.qa.stress.metrics;

import java.util.List;
import java.util.Objects;

/**
 * Structural fingerprint of an error's causal chain, outermost link first. Two signatures are equal
 * when every link has the same kind, message and call site, which makes this usable as a hash key.
 */
public record FailureSignature(List<Link> links) {

  public FailureSignature {
    links = List.copyOf(Objects.requireNonNull(links, "links"));
  }

  /** Simple class name of the outermost link, or empty for an empty chain. */
  public String outerKind() {
    return links.isEmpty() ? "" : links.get(0).kind().getSimpleName();
  }

  /**
   * One link of the chain.
   *
   * @param kind exception class
   * @param message exception message, empty when absent
   * @param callSite top stack frame, empty when the exception carries no stack trace
   */
  public record Link(Class<? extends Throwable> kind, String message, String callSite) {

    public Link {
      Objects.requireNonNull(kind, "kind");
      message = message != null ? message : "";
      callSite = callSite != null ? callSite : "";
    }
  }
}
