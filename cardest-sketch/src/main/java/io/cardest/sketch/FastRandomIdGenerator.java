package io.cardest.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;

import java.nio.ByteBuffer;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A random id generator based on sha1 that is 5 times faster than UUID#randomUUID().
 *
 * <p>see http://antirez.com/news/99
 */
public class FastRandomIdGenerator
{
  private static final HashFunction SHA1 = Hashing.sha1();

  private final ByteBuffer buffer = ByteBuffer.allocate(16);
  private long counter = 0;

  public FastRandomIdGenerator()
  {
    this(ThreadLocalRandom.current().nextLong());
  }

  public FastRandomIdGenerator(long seed)
  {
    buffer.putLong(8, seed);
  }

  /**
   * @return a 20 bytes random id with a very low collision rate
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return SHA1.hashBytes(buffer.array()).asBytes();
  }

  /**
   * @return the first 32 bits of the next id, usable as a well mixed hash
   */
  public int generateHash()
  {
    return Ints.fromByteArray(generate());
  }
}
