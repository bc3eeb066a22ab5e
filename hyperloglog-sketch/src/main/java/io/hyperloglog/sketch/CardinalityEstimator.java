package io.hyperloglog.sketch;

public interface CardinalityEstimator
{
  /**
   * @param hashValue a 64-bits hash, all bit patterns are valid
   */
  void add(long hashValue);

  long cardinality();
  long memoryFootprint();

  String name();
}
