package ca.gc.cra.ftrace.domain.proto;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Forward-only cursor over protobuf wire-format bytes.
 * <p><strong>Why:</strong> The tokenizer treats most of the trace schema as opaque, so a schema-free field walker
 * replaces generated message classes.</p>
 * <p><strong>Role:</strong> Domain support used by the bundle tokenizer, the compact scheduling decoder, and the
 * trace file source.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode base-128 varints bounded to {@value #MAX_VARINT_BYTES} bytes.</li>
 *   <li>Step through fields, reporting positions relative to the owning buffer.</li>
 *   <li>Reject truncated values, oversized lengths, group wire types, and invalid field numbers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one reader per decoding pass.</p>
 * <p><strong>Performance:</strong> No copies; nested messages are read by constructing a new reader over the
 * value range.</p>
 * <p><strong>Observability:</strong> None; malformed input surfaces as {@link ProtoWireException}.</p>
 *
 * @since 0.1.0
 */
public final class ProtoReader {
  /** Maximum number of bytes a 64-bit varint may occupy. */
  public static final int MAX_VARINT_BYTES = 10;

  private static final long MAX_FIELD_NUMBER = (1L << 29) - 1;

  private final byte[] buffer;
  private final int start;
  private final int limit;
  private int position;

  /**
   * Creates a reader over {@code buffer[offset, offset + length)}.
   *
   * @param buffer owning buffer; must not be {@code null}
   * @param offset absolute start of the message
   * @param length message length in bytes
   * @throws IndexOutOfBoundsException if the range does not fit inside {@code buffer}
   */
  public ProtoReader(byte[] buffer, int offset, int length) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    Objects.checkFromIndexSize(offset, length, buffer.length);
    this.start = offset;
    this.limit = offset + length;
    this.position = offset;
  }

  /**
   * Creates a reader over the bytes covered by {@code view}.
   *
   * @param view message bytes; must not be {@code null}
   */
  public ProtoReader(TraceBlobView view) {
    this(Objects.requireNonNull(view, "view").buffer(), view.offset(), view.length());
  }

  /**
   * Creates a reader over the value of a length-delimited field read from the same buffer.
   *
   * @param field nested message field
   * @return reader scoped to the nested message
   * @throws IllegalArgumentException if {@code field} is not length-delimited
   */
  public ProtoReader nested(ProtoField field) {
    if (!field.isLengthDelimited()) {
      throw new IllegalArgumentException("field " + field.number() + " is not length-delimited");
    }
    return new ProtoReader(buffer, field.valueOffset(), field.valueLength());
  }

  /**
   * Returns the absolute position of the next unread byte.
   *
   * @return cursor position within the owning buffer
   */
  public int position() {
    return position;
  }

  /**
   * Moves the cursor to an absolute position inside the message.
   *
   * @param newPosition absolute position in {@code [start, limit]}
   * @throws IndexOutOfBoundsException if the position falls outside the message
   */
  public void reset(int newPosition) {
    if (newPosition < start || newPosition > limit) {
      throw new IndexOutOfBoundsException(
          "position " + newPosition + " outside message [" + start + ", " + limit + "]");
    }
    position = newPosition;
  }

  /**
   * Returns the absolute end (exclusive) of the message.
   *
   * @return message limit
   */
  public int limit() {
    return limit;
  }

  /**
   * Reports whether unread bytes remain.
   *
   * @return {@code true} when the cursor is before the limit
   */
  public boolean hasRemaining() {
    return position < limit;
  }

  /**
   * Decodes a varint at the cursor and advances past it.
   *
   * @return decoded value; values above {@link Long#MAX_VALUE} wrap to negative numbers
   * @throws ProtoWireException if the varint is truncated or longer than {@value #MAX_VARINT_BYTES} bytes
   */
  public long readVarInt64() throws ProtoWireException {
    long result = 0;
    int cursor = position;
    int end = Math.min(limit, position + MAX_VARINT_BYTES);
    for (int shift = 0; cursor < end; shift += 7) {
      int b = buffer[cursor++];
      result |= (long) (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        position = cursor;
        return result;
      }
    }
    if (end == limit && cursor - position < MAX_VARINT_BYTES) {
      throw new ProtoWireException("truncated varint at " + position);
    }
    throw new ProtoWireException("varint longer than " + MAX_VARINT_BYTES + " bytes at " + position);
  }

  /**
   * Reads the next field and advances past its value.
   *
   * @return decoded field
   * @throws ProtoWireException if the tag or value is malformed or runs past the message limit
   * @throws NoSuchElementException if no bytes remain
   */
  public ProtoField readField() throws ProtoWireException {
    if (!hasRemaining()) {
      throw new NoSuchElementException("no fields remain");
    }
    long tag = readVarInt64();
    long fieldNumber = tag >>> 3;
    if (fieldNumber == 0 || fieldNumber > MAX_FIELD_NUMBER) {
      throw new ProtoWireException("invalid field number " + Long.toUnsignedString(fieldNumber));
    }
    WireType wireType = WireType.fromId((int) (tag & 0x7));
    int valueOffset = position;
    return switch (wireType) {
      case VARINT -> {
        long value = readVarInt64();
        yield new ProtoField((int) fieldNumber, wireType, value, valueOffset, position - valueOffset);
      }
      case FIXED64 -> {
        long value = readFixed(8);
        yield new ProtoField((int) fieldNumber, wireType, value, valueOffset, 8);
      }
      case FIXED32 -> {
        long value = readFixed(4);
        yield new ProtoField((int) fieldNumber, wireType, value, valueOffset, 4);
      }
      case LENGTH_DELIMITED -> {
        long size = readVarInt64();
        if (size < 0 || size > limit - position) {
          throw new ProtoWireException(
              "field " + fieldNumber + " length " + Long.toUnsignedString(size) + " exceeds message bounds");
        }
        int dataOffset = position;
        position += (int) size;
        yield new ProtoField((int) fieldNumber, wireType, 0L, dataOffset, (int) size);
      }
    };
  }

  /**
   * Scans the whole message from its first byte for the first field with {@code fieldNumber}.
   *
   * <p>The cursor position is left unchanged.</p>
   *
   * @param fieldNumber field to locate
   * @return first matching field, or empty when the message does not contain it
   * @throws ProtoWireException if malformed bytes precede the field
   */
  public Optional<ProtoField> findField(int fieldNumber) throws ProtoWireException {
    int saved = position;
    position = start;
    try {
      while (hasRemaining()) {
        ProtoField field = readField();
        if (field.number() == fieldNumber) {
          return Optional.of(field);
        }
      }
      return Optional.empty();
    } finally {
      position = saved;
    }
  }

  private long readFixed(int width) throws ProtoWireException {
    if (limit - position < width) {
      throw new ProtoWireException("truncated fixed" + (width * 8) + " at " + position);
    }
    long value = 0;
    for (int i = width - 1; i >= 0; i--) {
      value = (value << 8) | (buffer[position + i] & 0xFFL);
    }
    position += width;
    return value;
  }
}
