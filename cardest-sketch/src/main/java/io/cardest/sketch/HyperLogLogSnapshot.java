package io.cardest.sketch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Flat copy of the full state of a {@link HyperLogLog}.
 *
 * <p>The JSON field names are the short ones used by existing snapshots:
 * <pre>
 * {"M":16,"B":4,"A":0.673,"R":[0,2,1,...]}
 * </pre>
 */
@JsonPropertyOrder({"M", "B", "A", "R"})
public final class HyperLogLogSnapshot
{
  private static final int[] NO_REGISTERS = new int[0];

  private final long registerCount;
  private final int indexBits;
  private final double alpha;
  private final int[] registers;

  @JsonCreator
  public HyperLogLogSnapshot(
      @JsonProperty("M") long registerCount,
      @JsonProperty("B") int indexBits,
      @JsonProperty("A") double alpha,
      @JsonProperty("R") int[] registers
  )
  {
    this.registerCount = registerCount;
    this.indexBits = indexBits;
    this.alpha = alpha;
    this.registers = registers == null ? NO_REGISTERS : registers.clone();
  }

  @JsonProperty("M")
  public long getRegisterCount()
  {
    return registerCount;
  }

  @JsonProperty("B")
  public int getIndexBits()
  {
    return indexBits;
  }

  @JsonProperty("A")
  public double getAlpha()
  {
    return alpha;
  }

  /** One value per register, 0..255 for snapshots taken from a live estimator. */
  @JsonProperty("R")
  public int[] getRegisters()
  {
    return registers.clone();
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HyperLogLogSnapshot that = (HyperLogLogSnapshot) o;
    return registerCount == that.registerCount
           && indexBits == that.indexBits
           && Double.compare(that.alpha, alpha) == 0
           && Arrays.equals(registers, that.registers);
  }

  @Override
  public int hashCode()
  {
    return 31 * Objects.hash(registerCount, indexBits, alpha) + Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return "HyperLogLogSnapshot{M=" + registerCount + ", B=" + indexBits + ", A=" + alpha
           + ", R.length=" + registers.length + "}";
  }
}
