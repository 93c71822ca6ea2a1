package ca.gc.cra.ftrace.domain.proto;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;

/**
 * Lazy iterator over the elements of a packed repeated varint field.
 *
 * <p>The next element is decoded ahead of time so that {@link #hasNext()} reports exhaustion exactly. A malformed
 * element sets the shared {@link ParseErrorFlag} and ends the iteration; the flag lets several columns of one batch
 * report failures together.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PackedVarIntIterator implements PrimitiveIterator.OfLong {
  private final ProtoReader reader;
  private final ParseErrorFlag parseError;
  private boolean hasPending;
  private long pending;

  /**
   * Creates an iterator over {@code buffer[offset, offset + length)}.
   *
   * @param buffer owning buffer
   * @param offset absolute start of the packed payload
   * @param length payload length in bytes
   * @param parseError flag set when an element cannot be decoded; must not be {@code null}
   */
  public PackedVarIntIterator(byte[] buffer, int offset, int length, ParseErrorFlag parseError) {
    this.reader = new ProtoReader(buffer, offset, length);
    this.parseError = Objects.requireNonNull(parseError, "parseError");
    advance();
  }

  /**
   * Creates an iterator over the value of a length-delimited field.
   *
   * @param buffer owning buffer the field was read from
   * @param field packed field; must be length-delimited
   * @param parseError shared error flag
   * @return iterator over the packed elements
   */
  public static PackedVarIntIterator of(byte[] buffer, ProtoField field, ParseErrorFlag parseError) {
    if (!field.isLengthDelimited()) {
      throw new IllegalArgumentException("packed field " + field.number() + " must be length-delimited");
    }
    return new PackedVarIntIterator(buffer, field.valueOffset(), field.valueLength(), parseError);
  }

  /**
   * Creates an iterator with no elements.
   *
   * @param parseError shared error flag
   * @return exhausted iterator
   */
  public static PackedVarIntIterator empty(ParseErrorFlag parseError) {
    return new PackedVarIntIterator(new byte[0], 0, 0, parseError);
  }

  @Override
  public boolean hasNext() {
    return hasPending;
  }

  @Override
  public long nextLong() {
    if (!hasPending) {
      throw new NoSuchElementException("packed field exhausted");
    }
    long value = pending;
    advance();
    return value;
  }

  private void advance() {
    if (!reader.hasRemaining()) {
      hasPending = false;
      return;
    }
    try {
      pending = reader.readVarInt64();
      hasPending = true;
    } catch (ProtoWireException ex) {
      parseError.set();
      hasPending = false;
      reader.reset(reader.limit());
    }
  }
}
