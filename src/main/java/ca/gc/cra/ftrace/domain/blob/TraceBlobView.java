package ca.gc.cra.ftrace.domain.blob;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Zero-copy window over a shared trace buffer.
 * <p><strong>Why:</strong> Lets the tokenizer hand individual bundles and events downstream without copying the
 * bytes captured from the tracing subsystem.</p>
 * <p><strong>Role:</strong> Domain value object shared by the trace source, the proto reader, and the event sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Address a {@code [offset, offset + length)} range of an owning {@code byte[]}.</li>
 *   <li>Produce sub-views relative to the view itself or to the owning buffer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing as long as nobody mutates the backing
 * array.</p>
 * <p><strong>Performance:</strong> Slicing allocates a small view object and never copies bytes.</p>
 * <p><strong>Observability:</strong> {@link #toString()} prints only the window coordinates, never the payload.</p>
 *
 * @implNote The backing array is exposed through {@link #buffer()} for decoders; it is shared with every other view
 * cut from the same capture and must be treated as read-only.
 * @since 0.1.0
 */
public final class TraceBlobView {
  private static final byte[] EMPTY = new byte[0];

  private final byte[] buffer;
  private final int offset;
  private final int length;

  /**
   * Creates a view over {@code buffer[offset, offset + length)}.
   *
   * @param buffer owning buffer; must not be {@code null}
   * @param offset start of the window within {@code buffer}
   * @param length number of bytes in the window
   * @throws IndexOutOfBoundsException if the window does not fit inside {@code buffer}
   */
  public TraceBlobView(byte[] buffer, int offset, int length) {
    this.buffer = Objects.requireNonNull(buffer, "buffer");
    Objects.checkFromIndexSize(offset, length, buffer.length);
    this.offset = offset;
    this.length = length;
  }

  /**
   * Wraps a whole array without copying it.
   *
   * @param buffer owning buffer; {@code null} yields an empty view
   * @return view covering the entire array
   */
  public static TraceBlobView wrap(byte[] buffer) {
    byte[] data = buffer != null ? buffer : EMPTY;
    return new TraceBlobView(data, 0, data.length);
  }

  /**
   * Returns the shared backing array.
   *
   * @return owning buffer; callers must not mutate it
   */
  public byte[] buffer() {
    return buffer;
  }

  /**
   * Returns the start of this window within {@link #buffer()}.
   *
   * @return absolute offset in the owning buffer
   */
  public int offset() {
    return offset;
  }

  /**
   * Returns the number of bytes covered by this view.
   *
   * @return window length
   */
  public int length() {
    return length;
  }

  /**
   * Returns the absolute end (exclusive) of this window within {@link #buffer()}.
   *
   * @return {@code offset() + length()}
   */
  public int end() {
    return offset + length;
  }

  /**
   * Reads one byte relative to the start of the view.
   *
   * @param index relative index in {@code [0, length())}
   * @return unsigned byte value in {@code [0, 255]}
   * @throws IndexOutOfBoundsException if {@code index} is outside the view
   */
  public int byteAt(int index) {
    Objects.checkIndex(index, length);
    return buffer[offset + index] & 0xFF;
  }

  /**
   * Returns a sub-view whose offset is relative to the start of this view.
   *
   * @param relativeOffset offset from {@link #offset()}
   * @param sliceLength number of bytes in the sub-view
   * @return zero-copy sub-view
   * @throws IndexOutOfBoundsException if the sub-view exceeds this view
   */
  public TraceBlobView slice(int relativeOffset, int sliceLength) {
    Objects.checkFromIndexSize(relativeOffset, sliceLength, length);
    return new TraceBlobView(buffer, offset + relativeOffset, sliceLength);
  }

  /**
   * Returns a sub-view addressed by its absolute position in the owning buffer.
   *
   * <p>Decoders walking {@link #buffer()} directly report absolute positions; this avoids translating them back
   * to view-relative offsets.</p>
   *
   * @param absoluteOffset start of the sub-view within {@link #buffer()}
   * @param sliceLength number of bytes in the sub-view
   * @return zero-copy sub-view
   * @throws IndexOutOfBoundsException if the sub-view is not contained in this view
   */
  public TraceBlobView sliceAbsolute(int absoluteOffset, int sliceLength) {
    return slice(offsetOf(absoluteOffset), sliceLength);
  }

  /**
   * Translates an absolute buffer position into an offset relative to this view.
   *
   * @param absolutePosition position within {@link #buffer()}
   * @return relative offset in {@code [0, length()]}
   * @throws IndexOutOfBoundsException if the position lies outside this view
   */
  public int offsetOf(int absolutePosition) {
    int relative = absolutePosition - offset;
    if (relative < 0 || relative > length) {
      throw new IndexOutOfBoundsException(
          "position " + absolutePosition + " outside view [" + offset + ", " + end() + ")");
    }
    return relative;
  }

  /**
   * Copies the window into a fresh array.
   *
   * @return copy of the covered bytes
   */
  public byte[] toByteArray() {
    return Arrays.copyOfRange(buffer, offset, offset + length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TraceBlobView that)) {
      return false;
    }
    return Arrays.equals(buffer, offset, offset + length, that.buffer, that.offset, that.offset + that.length);
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (int i = offset; i < offset + length; i++) {
      result = 31 * result + buffer[i];
    }
    return result;
  }

  @Override
  public String toString() {
    return "TraceBlobView{offset=" + offset + ", length=" + length + '}';
  }
}
