package io.hyperloglog.sketch;

/**
 * Thrown when a sketch is created with a precision outside of the supported range.
 */
public class PrecisionOutOfRangeException extends IllegalArgumentException
{
  private static final long serialVersionUID = 1L;

  private final int precision;
  private final int minPrecision;
  private final int maxPrecision;

  public PrecisionOutOfRangeException(int precision, int minPrecision, int maxPrecision)
  {
    super(String.format(
        "precision out of bounds [%d] : should be in [%d, %d]",
        precision,
        minPrecision,
        maxPrecision
    ));
    this.precision = precision;
    this.minPrecision = minPrecision;
    this.maxPrecision = maxPrecision;
  }

  public int getPrecision()
  {
    return precision;
  }

  public int getMinPrecision()
  {
    return minPrecision;
  }

  public int getMaxPrecision()
  {
    return maxPrecision;
  }

  /**
   * @return the bound {@link #getPrecision()} falls outside of
   */
  public int getViolatedBound()
  {
    return precision < minPrecision ? minPrecision : maxPrecision;
  }
}
