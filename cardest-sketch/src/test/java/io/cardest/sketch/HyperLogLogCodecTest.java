package io.cardest.sketch;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HyperLogLogCodecTest
{
  private static final String EMPTY_16 =
      "{\"M\":16,\"B\":4,\"A\":0.673,\"R\":[0,0,0,0,0,0,0,0,0,0,0,0,0,0,0,0]}";

  @Test
  public void testEncodeUsesShortFieldNames()
  {
    assertEquals(EMPTY_16, HyperLogLogCodec.lenient().encode(new HyperLogLog(16)));
  }

  @Test
  public void testRoundTrip()
  {
    HyperLogLog hll = MixedHashes.fill(64, 0, 2000);
    for (HyperLogLogCodec codec : new HyperLogLogCodec[]{HyperLogLogCodec.lenient(), HyperLogLogCodec.strict()}) {
      HyperLogLog decoded = codec.decode(codec.encode(hll));

      assertEquals(hll.getRegisterCount(), decoded.getRegisterCount());
      assertEquals(hll.getIndexBits(), decoded.getIndexBits());
      assertEquals(hll.getAlpha(), decoded.getAlpha());
      assertEquals(hll.snapshot(), decoded.snapshot());
      assertEquals(hll.cardinality(), decoded.cardinality());
    }
  }

  @Test
  public void testDecodesExistingSnapshots()
  {
    String text = "{\"M\":16,\"B\":4,\"A\":0.673,\"R\":[29,0,0,1,2,0,0,0,0,0,0,2,0,0,0,0]}";
    HyperLogLog hll = HyperLogLogCodec.strict().decode(text);

    assertEquals(29, hll.getRegister(0));
    assertEquals(2, hll.getRegister(11));
    assertEquals(4, hll.cardinality());
    assertEquals(MixedHashes.fill(16, 0, 5).snapshot(), hll.snapshot());
  }

  @Test
  public void testKeysMatchIgnoringCase()
  {
    String text = "{\"m\":16,\"b\":4,\"a\":0.673,\"r\":[29,0,0,1,2,0,0,0,0,0,0,2,0,0,0,0]}";
    for (HyperLogLogCodec codec : new HyperLogLogCodec[]{HyperLogLogCodec.lenient(), HyperLogLogCodec.strict()}) {
      HyperLogLog hll = codec.decode(text);
      assertEquals(16, hll.getRegisterCount());
      assertEquals(0.673, hll.getAlpha());
      assertEquals(4, hll.cardinality());
    }
  }

  @Test
  public void testDecodeIntoReplacesState()
  {
    HyperLogLog target = MixedHashes.fill(1024, 0, 100);
    HyperLogLogCodec.lenient().decodeInto(EMPTY_16, target);

    assertEquals(16, target.getRegisterCount());
    assertEquals(4, target.getIndexBits());
    assertEquals(0, target.cardinality());
  }

  @Test
  public void testMalformedInputLeavesTargetUnmodified()
  {
    HyperLogLog target = MixedHashes.fill(64, 0, 100);
    HyperLogLogSnapshot before = target.snapshot();
    HyperLogLogCodec codec = HyperLogLogCodec.lenient();

    String[] malformed = {
        "",
        "not json",
        "[1,2,3]",
        "{\"M\":\"many\"}",
        "{\"R\":\"abc\"}",
        "null",
        "{\"M\":-1}",
        "{\"M\":16.9,\"B\":4,\"A\":0.673,\"R\":[]}",
        "{\"M\":1,\"B\":0,\"A\":0.5,\"R\":[1.7]}"
    };
    for (String text : malformed) {
      assertThrows(DeserializationException.class, () -> codec.decodeInto(text, target), text);
      assertEquals(before, target.snapshot());
    }
  }

  @Test
  public void testLenientDecodeKeepsFieldsAsTheyAre()
  {
    HyperLogLog hll = HyperLogLogCodec.lenient().decode("{\"M\":10,\"B\":4,\"A\":0.5,\"R\":[1,300,0],\"V\":2}");

    assertEquals(10, hll.getRegisterCount());
    assertEquals(4, hll.getIndexBits());
    assertEquals(0.5, hll.getAlpha());
    assertArrayEquals(new int[]{1, 44, 0}, hll.snapshot().getRegisters());
  }

  @Test
  public void testStrictDecodeValidatesInvariants()
  {
    HyperLogLogCodec strict = HyperLogLogCodec.strict();
    String zeros16 = String.join(",", Collections.nCopies(16, "0"));

    assertThrows(DeserializationException.class, () -> strict.decode("{\"M\":10,\"B\":4,\"A\":0.673,\"R\":[0,0,0,0,0,0,0,0,0,0]}"));
    assertThrows(DeserializationException.class, () -> strict.decode("{\"M\":16,\"B\":5,\"A\":0.673,\"R\":[" + zeros16 + "]}"));
    assertThrows(DeserializationException.class, () -> strict.decode("{\"M\":16,\"B\":4,\"A\":0.673,\"R\":[0,0]}"));
    assertThrows(DeserializationException.class, () -> strict.decode("{\"M\":16,\"B\":4,\"A\":0.673}"));
    assertThrows(
        DeserializationException.class,
        () -> strict.decode("{\"M\":16,\"B\":4,\"A\":0.673,\"R\":[256" + zeros16.substring(1) + "]}")
    );
    assertThrows(DeserializationException.class, () -> strict.decode("{\"M\":16.9,\"B\":4,\"A\":0.673,\"R\":[" + zeros16 + "]}"));
    assertThrows(DeserializationException.class, () -> strict.decode("{\"M\":16,\"B\":4.0,\"A\":0.673,\"R\":[" + zeros16 + "]}"));
    assertThrows(
        DeserializationException.class,
        () -> strict.decode("{\"M\":16,\"B\":4,\"A\":0.673,\"R\":[1.7" + zeros16.substring(1) + "]}")
    );
    assertEquals(16, strict.decode("{\"M\":16,\"B\":4,\"A\":0.673,\"R\":[" + zeros16 + "]}").getRegisterCount());
  }

  @Test
  public void testModes()
  {
    assertEquals(HyperLogLogCodec.DecodeMode.LENIENT, HyperLogLogCodec.lenient().getMode());
    assertEquals(HyperLogLogCodec.DecodeMode.STRICT, HyperLogLogCodec.strict().getMode());
    assertThrows(NullPointerException.class, () -> new HyperLogLogCodec(null));
  }
}
