package io.hyperloglog.sketch;

import com.google.common.base.Preconditions;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Consumes 64-bits hash values. Hashing the original values is left to the caller,
 * see {@link Hashes#hash64}.
 *
 * <p>Memory is fixed at construction: one byte per register, {@code 2^precision} registers.
 * <pre>
 * precision  7 =&gt; 128 bytes
 * precision 10 =&gt; 1 kB
 * precision 14 =&gt; 16 kB
 * precision 18 =&gt; 256 kB
 * </pre>
 *
 * <p> Differences from paper
 * <ul>
 *   <li>each register takes 8-bits instead of 5-bits
 *   <li>the run length is taken from the least-significant bit of the remainder (trailing zeros),
 *       and an all-zero remainder is ranked 64 regardless of precision
 *   <li>no small range or large range correction is applied to the raw estimate
 * </ul>
 *
 * <p>Instances are not thread-safe. Use one sketch per thread or synchronize calls to {@link #add(long)}.
 */
public class HyperLogLog implements CardinalityEstimator
{
  public static final int MIN_PRECISION = 7;
  public static final int MAX_PRECISION = 18;

  // rank given to an all-zero remainder
  static final byte ZERO_REMAINDER_RANK = 64;

  private final int p;
  private final int remainderBits;
  private final long remainderMask;
  private final double alphaTerm;

  // each register actually only needs 6-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  public HyperLogLog(int precision)
  {
    if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
      throw new PrecisionOutOfRangeException(precision, MIN_PRECISION, MAX_PRECISION);
    }
    this.p = precision;
    this.registers = new byte[1 << p];
    this.remainderBits = Long.SIZE - p;
    this.remainderMask = -1L >>> p;

    // m >= 128 for every allowed precision, so the constants for m = 16, 32, 64 are never needed
    final int m = registers.length;
    final double alpha = 0.7213 / (1 + 1.079 / m);
    this.alphaTerm = alpha * m * m;
  }

  @Override
  public void add(long hashValue)
  {
    final int bucket = (int) (hashValue >>> remainderBits);
    final byte rank = rank(hashValue & remainderMask);
    // both operands are in [0, 64], so signed comparison is fine
    if (registers[bucket] < rank) {
      registers[bucket] = rank;
    }
  }

  /**
   * Returns one plus the number of trailing zero bits of {@code remainder},
   * or {@link #ZERO_REMAINDER_RANK} if no bit is set.
   *
   * <p>Literature calls this function rho and counts leading zeros. Here the run is counted
   * from the least-significant end.
   */
  static byte rank(long remainder)
  {
    if (remainder == 0) { // very unlikely
      return ZERO_REMAINDER_RANK;
    }
    return (byte) (Long.numberOfTrailingZeros(remainder) + 1);
  }

  @Override
  public long cardinality()
  {
    double registerSum = 0.0;
    for (byte register : registers) {
      // int shift: the distance is taken modulo 32, a register holding 64 weighs like an empty one
      registerSum += 1.0 / (1 << register);
    }
    return (long) (alphaTerm / registerSum);
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers and the derived constants
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  public int precision()
  {
    return p;
  }

  public int registerCount()
  {
    return registers.length;
  }

  public int registerAt(int index)
  {
    Preconditions.checkElementIndex(index, registers.length);
    return registers[index];
  }

  /**
   * Standard error of the estimate for the given precision, as a fraction (0.02 means 2%).
   */
  public static double expectedStandardError(int precision)
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
    return 1.04 / Math.sqrt(1 << precision);
  }

  public static void main(String[] args)
  {
    for (int p = MIN_PRECISION; p <= MAX_PRECISION; p++) {
      System.out.printf("p[%,d], m[%,d] => error[%f%%]%n", p, 1 << p, 100 * expectedStandardError(p));
    }
  }
}
