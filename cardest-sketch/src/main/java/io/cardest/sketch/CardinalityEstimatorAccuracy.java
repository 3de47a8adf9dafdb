package io.cardest.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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

/**
 * Measures estimation errors of an estimator against the exact cardinality of random data.
 */
public class CardinalityEstimatorAccuracy
{
  private static final Logger log = LoggerFactory.getLogger(CardinalityEstimatorAccuracy.class);

  // above this the exact set no longer fits comfortably in memory
  private static final int MAX_SET_CARDINALITY = 100_000;

  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed();

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality.
   *
   * @return errors for each experiment, errors[i][j] = absolute error in percent of cardinality
   * (i+1)*fromCard in the j-th run.
   */
  static double[][] measureErrors(
      Supplier<CardinalityEstimator> estimatorSupplier,
      final int fromCard,
      final int toCard,
      final int numRuns
  )
  {
    Preconditions.checkArgument(
        fromCard > 0 && toCard > fromCard && toCard % fromCard == 0,
        "illegal from [%s] and to [%s]",
        fromCard,
        toCard
    );
    final int numCard = toCard / fromCard;
    double[][] errors = new double[numCard][numRuns];

    for (int run = 0; run < numRuns; run++) {
      final CardinalityEstimator estimator = estimatorSupplier.get();
      final ValueSource source = toCard <= MAX_SET_CARDINALITY ? new DistinctLongs() : new RandomIds();
      final long start = System.currentTimeMillis();

      for (int card = 1; card <= toCard; card++) {
        estimator.addHash(source.nextHash());

        if (card % fromCard == 0) {
          double est = estimator.cardinality();
          errors[card / fromCard - 1][run] = Math.abs(100.0 * (est - card) / card);
        }
      }
      log.info("Finish run #{} of {} in {} ms", run, estimator.name(), System.currentTimeMillis() - start);
    }

    return errors;
  }

  private interface ValueSource
  {
    int nextHash();
  }

  // low cardinalities: random longs, made distinct with an exact set
  private static final class DistinctLongs implements ValueSource
  {
    private final Set<Long> seen = new HashSet<>();

    @Override
    public int nextHash()
    {
      long value;
      do {
        value = ThreadLocalRandom.current().nextLong();
      } while (!seen.add(value));
      return HASH_FUNCTION.hashLong(value).asInt();
    }
  }

  private static final class RandomIds implements ValueSource
  {
    private final FastRandomIdGenerator generator = new FastRandomIdGenerator();

    @Override
    public int nextHash()
    {
      return generator.generateHash();
    }
  }

  static List<OneResult> summarize(int fromCard, double[][] errors)
  {
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      results.add(OneResult.from((long) (i + 1) * fromCard, errors[i]));
    }
    return results;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 5) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile>]");
      System.exit(1);
    }

    Supplier<CardinalityEstimator> estimatorSupplier = CardinalityEstimators.lazyGet(args[0]);
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);

    Path outFile;
    if (args.length == 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d.tsv", args[0], fromCard, toCard, numRuns));
    }

    final double[][] errors = measureErrors(estimatorSupplier, fromCard, toCard, numRuns);

    log.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : summarize(fromCard, errors)) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
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
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
