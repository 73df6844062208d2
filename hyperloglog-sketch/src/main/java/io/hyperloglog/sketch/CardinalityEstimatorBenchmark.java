package io.hyperloglog.sketch;

import com.google.common.base.Joiner;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Average cost in nanoseconds of a single add(), per estimator and cardinality.
 */
public class CardinalityEstimatorBenchmark
{
  private static final Logger log = LoggerFactory.getLogger(CardinalityEstimatorBenchmark.class);

  private static final long[] DEFAULT_CARDS = {100, 1000, 10000, 100000, 1000000, 10000000};

  private final int warmUps;
  private final int runs;

  public CardinalityEstimatorBenchmark(int warmUps, int runs)
  {
    this.warmUps = warmUps;
    this.runs = runs;
  }

  long nanosPerAdd(Supplier<CardinalityEstimator> estimatorSupplier, final int card)
  {
    for (int i = 0; i < warmUps; i++) {
      fill(estimatorSupplier.get(), card);
    }

    long totalNanos = 0;
    for (int i = 0; i < runs; i++) {
      CardinalityEstimator estimator = estimatorSupplier.get();
      long start = System.nanoTime();
      fill(estimator, card);
      totalNanos += System.nanoTime() - start;
    }

    return (totalNanos / runs) / card;
  }

  private static void fill(CardinalityEstimator estimator, int card)
  {
    for (int c = 0; c < card; c++) {
      estimator.add(c);
    }
  }

  /**
   * @return result[i] = [cards[i], nanos of estimator1, nanos of estimator2, ...]
   */
  public long[][] benchmarkAdd(long[] cards, String... estimatorNames)
  {
    long[][] result = new long[cards.length][];
    for (int i = 0; i < result.length; i++) {
      result[i] = new long[1 + estimatorNames.length];
      result[i][0] = cards[i];
    }

    for (int i = 0; i < estimatorNames.length; i++) {
      final String name = estimatorNames[i];
      for (int j = 0; j < result.length; j++) {
        final int card = (int) result[j][0];
        log.info("Test estimator {} card {}", name, card);
        result[j][i + 1] = nanosPerAdd(CardinalityEstimators.lazyGet(name), card);
      }
    }

    return result;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1) {
      System.err.println("Arguments: <estimatorName>..");
      System.exit(1);
    }

    CardinalityEstimatorBenchmark benchmark = new CardinalityEstimatorBenchmark(10, 20);
    long[][] result = benchmark.benchmarkAdd(DEFAULT_CARDS, args);

    Path outFile = Paths.get("speed_" + Joiner.on("_").join(args) + ".tsv");
    log.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\t");
      writer.write(Joiner.on('\t').join(args));
      writer.write("\n");

      for (long[] row : result) {
        StringBuilder sb = new StringBuilder(String.valueOf(row[0]));
        for (int i = 1; i < row.length; i++) {
          sb.append('\t').append(row[i]);
        }
        sb.append('\n');
        writer.write(sb.toString());
      }
    }
  }
}
