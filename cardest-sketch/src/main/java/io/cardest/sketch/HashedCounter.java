package io.cardest.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * A {@link HyperLogLog} fed with raw values, hashed to 32 bits by a Guava {@link HashFunction}.
 *
 * <p>Only the first 32 bits of the hash code are used. Two counters can only be merged when they
 * hash the same way.
 */
public class HashedCounter implements CardinalityEstimator<HashedCounter>
{
  private final HashFunction hashFunction;
  private final HyperLogLog hll;

  public HashedCounter(int registerCount)
  {
    this(registerCount, Hashing.murmur3_32_fixed());
  }

  public HashedCounter(int registerCount, HashFunction hashFunction)
  {
    this(new HyperLogLog(registerCount), hashFunction);
  }

  public HashedCounter(HyperLogLog hll, HashFunction hashFunction)
  {
    this.hll = Preconditions.checkNotNull(hll, "hll");
    this.hashFunction = Preconditions.checkNotNull(hashFunction, "hashFunction");
  }

  public void add(byte[] value)
  {
    hll.addHash(hashFunction.hashBytes(value).asInt());
  }

  public void add(long value)
  {
    hll.addHash(hashFunction.hashLong(value).asInt());
  }

  public void add(CharSequence value)
  {
    hll.addHash(hashFunction.hashString(value, StandardCharsets.UTF_8).asInt());
  }

  @Override
  public void addHash(int hash)
  {
    hll.addHash(hash);
  }

  @Override
  public void merge(HashedCounter that)
  {
    Preconditions.checkArgument(
        hashFunction.equals(that.hashFunction),
        "cannot merge counters hashed by %s and %s",
        hashFunction,
        that.hashFunction
    );
    hll.merge(that.hll);
  }

  public long intersect(HashedCounter that)
  {
    Preconditions.checkArgument(
        hashFunction.equals(that.hashFunction),
        "cannot intersect counters hashed by %s and %s",
        hashFunction,
        that.hashFunction
    );
    return hll.intersect(that.hll);
  }

  @Override
  public long cardinality()
  {
    return hll.cardinality();
  }

  @Override
  public void reset()
  {
    hll.reset();
  }

  /**
   * The underlying estimator, for snapshots. Adding to it directly bypasses the hash function.
   */
  public HyperLogLog getHyperLogLog()
  {
    return hll;
  }

  @Override
  public long memoryFootprint()
  {
    return hll.memoryFootprint(); // not counting the hash function
  }

  @Override
  public String name()
  {
    return "murmur" + hll.getRegisterCount();
  }
}
