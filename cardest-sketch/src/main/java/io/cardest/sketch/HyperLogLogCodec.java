package io.cardest.sketch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link HyperLogLog} state to and from its JSON snapshot text.
 *
 * <p>A {@link DecodeMode#LENIENT} codec loads every snapshot that parses, exactly as older writers
 * expect: a register count that is not a power of two, or a register array of another length, is
 * taken as it is. Such an estimator may fail later in {@code addHash} or {@code merge}. Use
 * {@link DecodeMode#STRICT} for snapshots that do not come from a trusted writer.
 *
 * <p>In both modes keys are matched ignoring case ({@code "m"} reads as {@code "M"}) and a number
 * with a fraction in {@code M}, {@code B} or {@code R} fails the decode.
 */
public class HyperLogLogCodec
{
  private static final Logger log = LoggerFactory.getLogger(HyperLogLogCodec.class);

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
      .build();

  public enum DecodeMode
  {
    LENIENT,
    STRICT
  }

  private final DecodeMode mode;

  public HyperLogLogCodec(DecodeMode mode)
  {
    this.mode = Preconditions.checkNotNull(mode, "mode");
  }

  public static HyperLogLogCodec lenient()
  {
    return new HyperLogLogCodec(DecodeMode.LENIENT);
  }

  public static HyperLogLogCodec strict()
  {
    return new HyperLogLogCodec(DecodeMode.STRICT);
  }

  public DecodeMode getMode()
  {
    return mode;
  }

  public String encode(HyperLogLog estimator)
  {
    try {
      return MAPPER.writeValueAsString(estimator.snapshot());
    }
    catch (JsonProcessingException e) {
      log.warn("Failed to encode {}", estimator, e);
      throw new SerializationException("cannot encode " + estimator, e);
    }
  }

  public HyperLogLog decode(String text)
  {
    return HyperLogLog.fromSnapshot(parse(text));
  }

  /**
   * Replaces the state of {@code target} with the decoded snapshot. On failure {@code target} keeps
   * its previous state.
   */
  public void decodeInto(String text, HyperLogLog target)
  {
    target.restore(parse(text));
  }

  HyperLogLogSnapshot parse(String text)
  {
    Preconditions.checkNotNull(text, "text");
    final HyperLogLogSnapshot snapshot;
    try {
      snapshot = MAPPER.readValue(text, HyperLogLogSnapshot.class);
    }
    catch (JsonProcessingException e) {
      log.warn("Failed to decode HyperLogLog snapshot: {}", e.getOriginalMessage());
      throw new DeserializationException("malformed HyperLogLog snapshot", e);
    }
    if (snapshot == null) { // the literal `null`
      throw new DeserializationException("empty HyperLogLog snapshot");
    }

    checkRepresentable(snapshot);
    if (mode == DecodeMode.STRICT) {
      validate(snapshot);
    }
    return snapshot;
  }

  private static void checkRepresentable(HyperLogLogSnapshot snapshot)
  {
    if (snapshot.getRegisterCount() < 0 || snapshot.getRegisterCount() > Integer.MAX_VALUE) {
      throw new DeserializationException("register count out of range: " + snapshot.getRegisterCount());
    }
    if (snapshot.getIndexBits() < 0) {
      throw new DeserializationException("index bits out of range: " + snapshot.getIndexBits());
    }
  }

  private static void validate(HyperLogLogSnapshot snapshot)
  {
    final long m = snapshot.getRegisterCount();
    if (m == 0 || (m & (m - 1)) != 0) {
      reject("number of registers %d not a power of two", m);
    }
    final int expectedBits = Long.numberOfTrailingZeros(m);
    if (snapshot.getIndexBits() != expectedBits) {
      reject("index bits %d do not match %d registers, expected %d", snapshot.getIndexBits(), m, expectedBits);
    }
    final int[] registers = snapshot.getRegisters();
    if (registers.length != m) {
      reject("%d register values for %d registers", registers.length, m);
    }
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < 0 || registers[i] > 0xFF) {
        reject("register %d holds %d, not an unsigned byte", i, registers[i]);
      }
    }
  }

  private static void reject(String format, Object... args)
  {
    final String message = String.format(format, args);
    log.debug("Rejected HyperLogLog snapshot: {}", message);
    throw new DeserializationException(message);
  }
}
