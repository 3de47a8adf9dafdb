package io.cardest.sketch;

import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CardinalityEstimators
{
  private static final Logger log = LoggerFactory.getLogger(CardinalityEstimators.class);

  public static final String REGISTERS_PROPERTY = "cardest.sketch.registers";
  private static final int DEFAULT_REGISTERS = 1024;

  private static final String HLL = "hll";
  private static final String MURMUR = "murmur";

  private CardinalityEstimators()
  {
  }

  /**
   * Register count used for names without one, from system property {@value #REGISTERS_PROPERTY}.
   */
  public static int defaultRegisterCount()
  {
    return Integer.getInteger(REGISTERS_PROPERTY, DEFAULT_REGISTERS);
  }

  /**
   * Builds an estimator from its name: {@code hll<m>} for a {@link HyperLogLog} taking pre-hashed
   * values, {@code murmur<m>} for a {@link HashedCounter} using murmur3. {@code m} may be omitted.
   */
  public static CardinalityEstimator get(String name)
  {
    if (name.startsWith(HLL)) {
      return new HyperLogLog(registerCount(name, HLL));
    }
    if (name.startsWith(MURMUR)) {
      return new HashedCounter(registerCount(name, MURMUR));
    }
    throw new InvalidConfigurationException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator> lazyGet(String name)
  {
    return () -> get(name);
  }

  private static int registerCount(String name, String prefix)
  {
    String mStr = name.substring(prefix.length());
    if (mStr.isEmpty()) {
      int m = defaultRegisterCount();
      log.debug("Estimator [{}] uses the default of {} registers", name, m);
      return m;
    }
    try {
      return Integer.parseInt(mStr);
    }
    catch (NumberFormatException e) {
      throw new InvalidConfigurationException("invalid register count in estimator name : " + name, e);
    }
  }
}
