package io.hyperloglog.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

public class CardinalityEstimatorAccuracy
{
  enum InputMode
  {
    /** uniform random 64-bits values added as is */
    RAW,
    /** random ids hashed through murmur3 before being added */
    HASHED
  }

  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality.
   *
   * @return errors for each experiment, errors[i][j] = errors of cardinality i of the j-th run.
   */
  static double[][] testDifferentCardinalities(
      Supplier<CardinalityEstimator> estimatorSupplier,
      InputMode mode,
      final int fromCard,
      final int toCard,
      final int numRuns
  )
  {
    Preconditions.checkArgument(
        fromCard > 0 && toCard >= fromCard && toCard % fromCard == 0,
        "illegal from [%s] and to [%s]",
        fromCard,
        toCard
    );
    Preconditions.checkArgument(numRuns > 0, "illegal runs [%s]", numRuns);
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      // reset estimator at the beginning of each run
      CardinalityEstimator estimator = estimatorSupplier.get();
      ValueSource source = mode == InputMode.HASHED ? new HashedSource() : newRawSource(toCard);
      final long start = System.currentTimeMillis();

      // estimate cardinality of 1*fromCard, 2*fromCard, 3*fromCard, .., toCard
      for (int card = 1; card <= toCard; card++) {
        estimator.add(source.next());

        if (card % fromCard == 0) {
          double est = estimator.cardinality();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
      System.out.printf("Finish run #%d in %,d ms%n", run, System.currentTimeMillis() - start);
    }

    return errors;
  }

  private static ValueSource newRawSource(int toCard)
  {
    if (toCard <= 100_000) {
      // for low cardinality tests, make sure every value is distinct
      return new DistinctRandomSource();
    }
    // for high cardinality tests, we can't track values due to limited memory,
    // collisions among random 64-bits values are negligible anyway
    ThreadLocalRandom random = ThreadLocalRandom.current();
    return random::nextLong;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 6) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [raw|hashed] [<outFile>]");
      System.exit(1);
    }

    Supplier<CardinalityEstimator> estimatorSupplier = CardinalityEstimators.lazyGet(args[0]);
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);
    final InputMode mode = args.length >= 5 ? parseMode(args[4]) : InputMode.RAW;

    Path outFile;
    if (args.length == 6) {
      outFile = Paths.get(args[5]);
    } else {
      outFile = Paths.get(String.format(
          "%s_%s_%d_%d_%d.tsv",
          args[0],
          mode.name().toLowerCase(),
          fromCard,
          toCard,
          numRuns
      ));
    }

    final double[][] errors = testDifferentCardinalities(estimatorSupplier, mode, fromCard, toCard, numRuns);
    // compute min, 50%, max error for each cardinality
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }

    System.out.println("Writing results to " + outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(result.toTsvLine());
      }
    }
  }

  static InputMode parseMode(String mode)
  {
    for (InputMode value : InputMode.values()) {
      if (value.name().equalsIgnoreCase(mode)) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown input mode : " + mode);
  }

  interface ValueSource
  {
    long next();
  }

  private static final class DistinctRandomSource implements ValueSource
  {
    private final ThreadLocalRandom random = ThreadLocalRandom.current();
    private final Set<Long> set = new HashSet<>();

    @Override
    public long next()
    {
      long value;
      do {
        value = random.nextLong();
      } while (!set.add(value));
      return value;
    }
  }

  private static final class HashedSource implements ValueSource
  {
    private final FastRandomIdGenerator generator = new FastRandomIdGenerator();

    @Override
    public long next()
    {
      return Hashes.hash64(HASH_FUNCTION, generator.generate());
    }
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      Arrays.sort(errors);
      return new OneResult(
          cardinality,
          errors[0],
          errors[errors.length / 2],
          errors[errors.length - 1]
      );
    }

    String toTsvLine()
    {
      return String.format("%d\t%.3f\t%.3f\t%.3f\n", cardinality, minError, medianError, maxError);
    }
  }
}
