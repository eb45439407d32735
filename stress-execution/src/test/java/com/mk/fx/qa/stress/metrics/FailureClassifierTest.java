package com.mk.fx.qa.stress.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FailureClassifierTest {

  private static RuntimeException failAt(String message) {
    return new IllegalStateException(message, new IOException("connection reset"));
  }

  @Test
  void sameChainFromSameSite_isEqual() {
    FailureSignature first = null;
    for (int i = 0; i < 2; i++) {
      var signature = FailureClassifier.classify(failAt("boom"));
      if (first == null) {
        first = signature;
      } else {
        assertEquals(first, signature);
        assertEquals(first.hashCode(), signature.hashCode());
      }
    }
  }

  @Test
  void differentMessage_isDistinct() {
    var errors = List.of(failAt("boom"), failAt("bang"));
    assertNotEquals(
        FailureClassifier.classify(errors.get(0)), FailureClassifier.classify(errors.get(1)));
  }

  @Test
  void sameOuterErrorWithDifferentCauseMessage_isDistinct() {
    var signatures = new ArrayList<FailureSignature>();
    for (String detail : List.of("connection reset", "connection refused")) {
      signatures.add(FailureClassifier.classify(new IllegalStateException("boom", new IOException(detail))));
    }

    assertEquals(signatures.get(0).links().get(0), signatures.get(1).links().get(0));
    assertNotEquals(signatures.get(0), signatures.get(1));
  }

  @Test
  void differentCallSite_isDistinct() {
    var a = new IllegalStateException("boom");
    var b = new IllegalStateException("boom");
    assertNotEquals(FailureClassifier.classify(a), FailureClassifier.classify(b));
  }

  @Test
  void chainIsRecordedOutermostFirst() {
    var signature = FailureClassifier.classify(failAt("boom"));

    assertEquals(2, signature.links().size());
    assertEquals(IllegalStateException.class, signature.links().get(0).kind());
    assertEquals(IOException.class, signature.links().get(1).kind());
    assertEquals("connection reset", signature.links().get(1).message());
    assertEquals("IllegalStateException", signature.outerKind());
  }

  @Test
  void missingMessageAndStack_becomeEmpty() {
    var error = new RuntimeException((String) null);
    error.setStackTrace(new StackTraceElement[0]);

    var link = FailureClassifier.classify(error).links().get(0);

    assertEquals("", link.message());
    assertEquals("", link.callSite());
  }

  @Test
  void causeCycle_terminates() {
    var outer = new RuntimeException("outer");
    var inner = new RuntimeException("inner", outer);
    outer.initCause(inner);

    assertEquals(2, FailureClassifier.classify(outer).links().size());
  }
}
