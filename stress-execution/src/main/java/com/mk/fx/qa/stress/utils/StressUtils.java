package com.mk.fx.qa.stress.utils;

public final class StressUtils {

  private StressUtils() {
    // Utility class, no instantiation
  }

  /**
   * Deterministic 32-bit hash combination: rotate {@code h1} left by 5, add {@code h1}, xor with
   * {@code h2}. Used to derive a per-worker seed from the worker index and the base seed.
   */
  public static int combine(int h1, int h2) {
    int rol5 = (h1 << 5) | (h1 >>> 27);
    return (rol5 + h1) ^ h2;
  }
}
