package io.hyperloglog.sketch;

import com.google.common.base.Supplier;

public final class CardinalityEstimators
{
  private static final int DEFAULT_PRECISION = 14;
  private static final String HLL_PREFIX = "hll";

  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator get(String name)
  {
    if (name.startsWith(HLL_PREFIX)) {
      String pStr = name.substring(HLL_PREFIX.length());
      int precision;
      try {
        precision = pStr.isEmpty() ? DEFAULT_PRECISION : Integer.parseInt(pStr);
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException("Unknown estimator : " + name, e);
      }
      return HyperLogLog.create(precision);
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator> lazyGet(String name)
  {
    return () -> get(name);
  }
}
