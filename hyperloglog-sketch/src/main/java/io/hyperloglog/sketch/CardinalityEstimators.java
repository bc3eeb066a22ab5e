package io.hyperloglog.sketch;

import com.google.common.base.Supplier;

public final class CardinalityEstimators
{
  public static final int DEFAULT_PRECISION = 14;

  private static final String HLL_PREFIX = "hll";

  private CardinalityEstimators()
  {
  }

  /**
   * @param name "hll" for the default precision, or "hll" followed by a precision, e.g. "hll18"
   */
  public static CardinalityEstimator get(String name)
  {
    if (name.startsWith(HLL_PREFIX)) {
      String pStr = name.substring(HLL_PREFIX.length());
      if (pStr.isEmpty()) {
        return new HyperLogLog(DEFAULT_PRECISION);
      }
      if (pStr.chars().allMatch(Character::isDigit) && pStr.length() <= 2) {
        return new HyperLogLog(Integer.parseInt(pStr));
      }
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator> lazyGet(String name)
  {
    // fail fast on unknown names instead of on first use
    get(name);
    return () -> get(name);
  }
}
