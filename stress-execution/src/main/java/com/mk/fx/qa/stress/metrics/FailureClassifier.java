package com.mk.fx.qa.stress.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reduces an error to a {@link FailureSignature} by walking its cause chain.
 *
 * <p>Every link contributes its message verbatim, so the same root cause reported with different
 * transient details (ports, timestamps) lands in separate signatures. Only exact repeats collapse.
 */
public final class FailureClassifier {

  private FailureClassifier() {
    throw new UnsupportedOperationException("FailureClassifier cannot be instantiated");
  }

  public static FailureSignature classify(Throwable error) {
    List<FailureSignature.Link> links = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable e = error; e != null && seen.add(e); e = e.getCause()) {
      links.add(new FailureSignature.Link(e.getClass(), e.getMessage(), callSite(e)));
    }
    return new FailureSignature(links);
  }

  private static String callSite(Throwable e) {
    StackTraceElement[] stack = e.getStackTrace();
    return stack.length == 0 ? "" : stack[0].toString();
  }
}
