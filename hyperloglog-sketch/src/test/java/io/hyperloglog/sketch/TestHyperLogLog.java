package io.hyperloglog.sketch;

import com.google.common.primitives.UnsignedLongs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

public class TestHyperLogLog
{
  private static final long EMPTY_P18_COUNT = 189083;
  private static final long SINGLE_VALUE_P18_COUNT = 189084;

  @ParameterizedTest
  @ValueSource(ints = {7, 10, 18})
  public void testValidPrecision(int precision)
  {
    HyperLogLog hll = new HyperLogLog(precision);

    assertThat(hll.precision()).isEqualTo(precision);
    assertThat(hll.registerCount()).isEqualTo(1 << precision);
    assertThat(hll.memoryFootprint()).isEqualTo(1L << precision);
    assertThat(hll.name()).isEqualTo("hll" + precision);
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, 0, 2, 6, 19, 20, 31})
  public void testInvalidPrecision(int precision)
  {
    assertThatThrownBy(() -> new HyperLogLog(precision))
        .isInstanceOf(IllegalArgumentException.class)
        .isInstanceOf(PrecisionOutOfRangeException.class)
        .hasMessageContaining("precision out of bounds")
        .hasMessageContaining(String.valueOf(precision));
  }

  @Test
  public void testPrecisionOutOfRangeCarriesBounds()
  {
    assertThatThrownBy(() -> new HyperLogLog(2))
        .isInstanceOfSatisfying(PrecisionOutOfRangeException.class, e -> {
          assertThat(e.getPrecision()).isEqualTo(2);
          assertThat(e.getMinPrecision()).isEqualTo(HyperLogLog.MIN_PRECISION);
          assertThat(e.getMaxPrecision()).isEqualTo(HyperLogLog.MAX_PRECISION);
          assertThat(e.getViolatedBound()).isEqualTo(7);
        });

    assertThatThrownBy(() -> new HyperLogLog(20))
        .isInstanceOfSatisfying(
            PrecisionOutOfRangeException.class,
            e -> assertThat(e.getViolatedBound()).isEqualTo(18)
        );
  }

  @Test
  public void testCountWithoutAdd()
  {
    HyperLogLog hll = new HyperLogLog(18);
    assertThat(hll.cardinality()).isEqualTo(EMPTY_P18_COUNT);
    // reading does not change anything
    assertThat(hll.cardinality()).isEqualTo(EMPTY_P18_COUNT);
  }

  @Test
  public void testAddZero()
  {
    // an all-zero remainder is ranked 64, which weighs like an empty register
    HyperLogLog hll = new HyperLogLog(18);
    hll.add(0);

    assertThat(hll.registerAt(0)).isEqualTo(64);
    assertThat(hll.cardinality()).isEqualTo(EMPTY_P18_COUNT);
  }

  @ParameterizedTest
  @ValueSource(strings = {"1", "2", "3", "4", "5", "9999999999999999999", "18446744073709551615"})
  public void testAddSingleValue(String unsignedValue)
  {
    HyperLogLog hll = new HyperLogLog(18);
    hll.add(UnsignedLongs.parseUnsignedLong(unsignedValue));

    assertThat(hll.cardinality()).isEqualTo(SINGLE_VALUE_P18_COUNT);
  }

  @Test
  public void testBucketAndRank()
  {
    HyperLogLog hll = new HyperLogLog(18);

    // low 46 bits: 0b1000 => three trailing zeros
    hll.add(8);
    assertThat(hll.registerAt(0)).isEqualTo(4);

    // bucket comes from the high 18 bits
    hll.add(-1L);
    assertThat(hll.registerAt((1 << 18) - 1)).isEqualTo(1);

    hll.add((5L << 46) | (1L << 45));
    assertThat(hll.registerAt(5)).isEqualTo(46);
  }

  @Test
  public void testRank()
  {
    assertThat(HyperLogLog.rank(0)).isEqualTo((byte) 64);
    assertThat(HyperLogLog.rank(1)).isEqualTo((byte) 1);
    assertThat(HyperLogLog.rank(2)).isEqualTo((byte) 2);
    assertThat(HyperLogLog.rank(3)).isEqualTo((byte) 1);
    assertThat(HyperLogLog.rank(4)).isEqualTo((byte) 3);
    assertThat(HyperLogLog.rank(1L << 56)).isEqualTo((byte) 57);
  }

  @Test
  public void testAddTwiceDoesNotChangeCount()
  {
    SplittableRandom random = new SplittableRandom(17);
    for (int precision = HyperLogLog.MIN_PRECISION; precision <= HyperLogLog.MAX_PRECISION; precision++) {
      for (int i = 0; i < 100; i++) {
        long value = random.nextLong();

        HyperLogLog once = new HyperLogLog(precision);
        once.add(value);

        HyperLogLog twice = new HyperLogLog(precision);
        twice.add(value);
        twice.add(value);

        assertThat(twice.cardinality()).isEqualTo(once.cardinality());
      }
    }

    HyperLogLog once = new HyperLogLog(18);
    once.add(-1L);
    HyperLogLog twice = new HyperLogLog(18);
    twice.add(-1L);
    twice.add(-1L);
    assertThat(twice.cardinality()).isEqualTo(once.cardinality());
  }

  @Test
  public void testRegistersNeverDecrease()
  {
    HyperLogLog hll = new HyperLogLog(7);
    int[] previous = new int[hll.registerCount()];
    SplittableRandom random = new SplittableRandom(3);

    for (int i = 0; i < 5_000; i++) {
      hll.add(random.nextLong());
      for (int r = 0; r < previous.length; r++) {
        int current = hll.registerAt(r);
        assertThat(current).isBetween(previous[r], 64);
        previous[r] = current;
      }
    }
  }

  @Test
  public void testRegisterAtOutOfBounds()
  {
    HyperLogLog hll = new HyperLogLog(7);
    assertThatThrownBy(() -> hll.registerAt(128)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> hll.registerAt(-1)).isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  public void testExpectedStandardError()
  {
    assertThat(HyperLogLog.expectedStandardError(18)).isCloseTo(1.04 / 512, offset(1e-12));
    assertThat(HyperLogLog.expectedStandardError(7))
        .isGreaterThan(HyperLogLog.expectedStandardError(18));
    assertThatThrownBy(() -> HyperLogLog.expectedStandardError(19))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
