package io.hyperloglog.sketch;

import com.google.common.base.Joiner;
import com.google.common.base.Supplier;
import com.google.common.primitives.Longs;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.SplittableRandom;

public class CardinalityEstimatorBenchmark
{
  private static final long[] DEFAULT_CARDS = {100, 1000, 10000, 100000, 1000000, 10000000};

  private final int warmUps;
  private final int runs;

  public CardinalityEstimatorBenchmark()
  {
    this(10, 20);
  }

  CardinalityEstimatorBenchmark(int warmUps, int runs)
  {
    this.warmUps = warmUps;
    this.runs = runs;
  }

  /**
   * @return average nanos per add
   */
  private long ingest(Supplier<CardinalityEstimator> estimatorSupplier, final long[] hashes)
  {
    // warm ups
    for (int i = 0; i < warmUps; i++) {
      CardinalityEstimator estimator = estimatorSupplier.get();
      for (long hash : hashes) {
        estimator.add(hash);
      }
    }

    // actual runs
    long totalNanos = 0;
    for (int i = 0; i < runs; i++) {
      CardinalityEstimator estimator = estimatorSupplier.get();
      long start = System.nanoTime();
      for (long hash : hashes) {
        estimator.add(hash);
      }
      totalNanos += System.nanoTime() - start;
    }

    return (totalNanos / runs) / hashes.length;
  }

  // hashes are generated up front so only `add` is measured
  private static long[] randomHashes(int card)
  {
    SplittableRandom random = new SplittableRandom(card);
    long[] hashes = new long[card];
    for (int i = 0; i < card; i++) {
      hashes[i] = random.nextLong();
    }
    return hashes;
  }

  public long[][] benchmarkAdd(long[] cards, String... estimatorNames)
  {
    long[][] result = new long[cards.length][]; // result[i] = [c, estimator1, estimator2, ...]
    for (int i = 0; i < result.length; i++) {
      result[i] = new long[1 + estimatorNames.length];
      result[i][0] = cards[i];
    }

    for (int i = 0; i < estimatorNames.length; i++) {
      final String name = estimatorNames[i];
      for (int j = 0; j < result.length; j++) {
        final int card = (int) result[j][0];
        System.out.format("Test estimator %s card %,d\n", name, card);
        result[j][i + 1] = ingest(CardinalityEstimators.lazyGet(name), randomHashes(card));
      }
    }

    return result;
  }

  public static void main(String[] args) throws IOException
  {
    // args: <estimatorName>..
    if (args.length < 1) {
      System.err.println("Arguments: <estimatorName>..");
      System.exit(1);
    }

    CardinalityEstimatorBenchmark benchmark = new CardinalityEstimatorBenchmark();
    long[][] result = benchmark.benchmarkAdd(DEFAULT_CARDS, args);

    Path outFile = Paths.get("speed_" + Joiner.on("_").join(args) + ".tsv");
    System.out.println("Writing results to " + outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      // header: card estimator1 estimator2
      writer.write("Card");
      for (String name : args) {
        writer.write("\t");
        writer.write(name);
      }
      writer.write("\n");

      // content
      for (long[] row : result) {
        writer.write(Joiner.on('\t').join(Longs.asList(row)));
        writer.write("\n");
      }
    }
  }
}
