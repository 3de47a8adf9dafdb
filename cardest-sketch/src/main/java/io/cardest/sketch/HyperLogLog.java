package io.cardest.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf
 * over caller supplied 32-bits hashes.
 *
 * <p>The number of registers m must be a power of two. Each register takes one byte and the
 * standard error of {@link #cardinality()} is about {@code 1.04 / sqrt(m)}:
 * <pre>
 * m[16] =&gt; error[26%], m[64] =&gt; error[13%], m[1,024] =&gt; error[3.25%], m[16,384] =&gt; error[0.81%]
 * </pre>
 *
 * <p>Differences from {@code HashedCounter}: no hashing is done here, so the caller owns the
 * quality of the hash. The top {@code indexBits} bits of the hash select the register, the
 * position of the leftmost 1 in the remaining bits is the rank stored in it.
 *
 * <p>Instances are not thread-safe. {@link #addHash}, {@link #merge} and {@link #reset} must be
 * serialized by the caller; concurrent {@link #cardinality()} calls are only safe while no
 * mutation is running.
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  private static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  private static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  private int registerCount;
  private int indexBits;
  private double alpha;

  // unsigned, read with `& 0xFF`
  private byte[] registers;

  public HyperLogLog(int registerCount)
  {
    if (registerCount <= 0 || (registerCount & (registerCount - 1)) != 0) {
      throw new InvalidConfigurationException(
          String.format("number of registers %d not a power of two", registerCount)
      );
    }
    this.registerCount = registerCount;
    this.indexBits = Integer.numberOfTrailingZeros(registerCount);
    this.alpha = alpha(registerCount);
    this.registers = new byte[registerCount];
  }

  private HyperLogLog(HyperLogLogSnapshot snapshot)
  {
    load(snapshot);
  }

  /**
   * Builds an estimator whose fields are taken from the snapshot as they are. No invariant is
   * checked here, see {@link HyperLogLogCodec} for validated decoding.
   */
  public static HyperLogLog fromSnapshot(HyperLogLogSnapshot snapshot)
  {
    return new HyperLogLog(snapshot);
  }

  static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1.0 + 1.079 / m);
    }
  }

  /**
   * Position of the leftmost 1 in {@code bits}, counting from 1, and never more than {@code max + 1}.
   */
  static int rank(int bits, int max)
  {
    return Math.min(Integer.numberOfLeadingZeros(bits), max) + 1;
  }

  @Override
  public void addHash(int hash)
  {
    final int rankBits = Integer.SIZE - indexBits;
    // a shift by 32 is a no-op in java, a single register takes the whole hash
    final int index = indexBits == 0 ? 0 : hash >>> rankBits;
    final int rank = rank(hash << indexBits, rankBits);

    if ((registers[index] & 0xFF) < rank) {
      registers[index] = (byte) rank;
    }
  }

  @Override
  public long cardinality()
  {
    final double m = registerCount;

    double registerSum = 0.0;
    int zeros = 0;
    for (byte register : registers) {
      final int value = register & 0xFF;
      registerSum += Math.scalb(1.0d, -value);
      if (value == 0) {
        zeros++;
      }
    }

    final double e = alpha * m * m / registerSum;
    return (long) makeCorrection(e, zeros, m);
  }

  private static double makeCorrection(double e, int zeros, double m)
  {
    if (e <= 2.5d * m) { // small range correction
      return zeros == 0 ? e : m * Math.log(m / zeros);
    }

    if (e > HIGH_CORRECTION_THRESHOLD) { // high range correction
      return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - e / TWO_TO_THE_THIRTY_TWO);
    }

    return e;
  }

  /**
   * Folds {@code that} into this estimator, which then estimates the union of both inputs.
   * {@code that} is not modified.
   *
   * @throws IncompatibleEstimatorsException if the register counts differ, this estimator is
   * left untouched in that case
   */
  @Override
  public void merge(HyperLogLog that)
  {
    checkCompatible(that);
    for (int i = 0; i < registers.length; i++) {
      // note that both operands are read unsigned
      if ((registers[i] & 0xFF) < (that.registers[i] & 0xFF)) {
        registers[i] = that.registers[i];
      }
    }
  }

  /**
   * Estimates how many distinct elements both inputs share by {@code |A| + |B| - |A u B|}.
   *
   * <p>The result carries the error of three independent estimates and is only a rough figure,
   * small overlaps in particular are lost in the noise. When the union estimate exceeds the sum of
   * the two estimates the result is clamped to 0.
   *
   * @throws IncompatibleEstimatorsException if the register counts differ
   */
  public long intersect(HyperLogLog that)
  {
    checkCompatible(that);

    HyperLogLog union = new HyperLogLog(registerCount);
    union.merge(this);
    union.merge(that);

    final long unionCount = union.cardinality();
    final long cumulativeCount = cardinality() + that.cardinality();
    if (unionCount > cumulativeCount) {
      return 0;
    }
    return cumulativeCount - unionCount;
  }

  private void checkCompatible(HyperLogLog that)
  {
    if (registerCount != that.registerCount) {
      throw new IncompatibleEstimatorsException(registerCount, that.registerCount);
    }
  }

  @Override
  public void reset()
  {
    Arrays.fill(registers, (byte) 0);
  }

  public HyperLogLog copy()
  {
    return fromSnapshot(snapshot());
  }

  public HyperLogLogSnapshot snapshot()
  {
    int[] values = new int[registers.length];
    for (int i = 0; i < registers.length; i++) {
      values[i] = registers[i] & 0xFF;
    }
    return new HyperLogLogSnapshot(registerCount, indexBits, alpha, values);
  }

  /**
   * Replaces the whole state of this estimator with the snapshot's fields. Register values are
   * truncated to their low 8 bits.
   */
  public void restore(HyperLogLogSnapshot snapshot)
  {
    load(snapshot);
  }

  private void load(HyperLogLogSnapshot snapshot)
  {
    Preconditions.checkArgument(
        snapshot.getRegisterCount() >= 0 && snapshot.getRegisterCount() <= Integer.MAX_VALUE,
        "register count [%s] does not fit a non-negative int",
        snapshot.getRegisterCount()
    );
    int[] values = snapshot.getRegisters();
    byte[] restored = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      restored[i] = (byte) values[i];
    }

    this.registerCount = (int) snapshot.getRegisterCount();
    this.indexBits = snapshot.getIndexBits();
    this.alpha = snapshot.getAlpha();
    this.registers = restored;
  }

  public int getRegisterCount()
  {
    return registerCount;
  }

  public int getIndexBits()
  {
    return indexBits;
  }

  public double getAlpha()
  {
    return alpha;
  }

  public int getRegister(int index)
  {
    Preconditions.checkElementIndex(index, registers.length);
    return registers[index] & 0xFF;
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers and the derived constants
  }

  @Override
  public String name()
  {
    return "hll" + registerCount;
  }

  @Override
  public String toString()
  {
    return "HyperLogLog{registerCount=" + registerCount + ", indexBits=" + indexBits + ", alpha=" + alpha + "}";
  }
}
