package io.cardest.sketch;

import com.google.common.primitives.Ints;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FastRandomIdGeneratorTest
{
  @Test
  public void testSameSeedSameIds()
  {
    FastRandomIdGenerator a = new FastRandomIdGenerator(7);
    FastRandomIdGenerator b = new FastRandomIdGenerator(7);
    for (int i = 0; i < 10; i++) {
      byte[] id = a.generate();
      assertEquals(20, id.length);
      assertArrayEquals(id, b.generate());
    }
  }

  @Test
  public void testHashIsThePrefixOfTheId()
  {
    byte[] id = new FastRandomIdGenerator(7).generate();
    assertEquals(Ints.fromByteArray(id), new FastRandomIdGenerator(7).generateHash());
  }

  @Test
  public void testIdsAreDistinct()
  {
    FastRandomIdGenerator generator = new FastRandomIdGenerator();
    Set<Integer> hashes = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      hashes.add(generator.generateHash());
    }
    // 32-bits collisions among 1000 values are possible but rare
    assertTrue(hashes.size() >= 998);
  }
}
