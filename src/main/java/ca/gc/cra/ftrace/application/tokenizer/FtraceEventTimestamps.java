package ca.gc.cra.ftrace.application.tokenizer;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.ftrace.FtraceWireFields;
import ca.gc.cra.ftrace.domain.proto.ProtoField;
import ca.gc.cra.ftrace.domain.proto.ProtoReader;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;
import ca.gc.cra.ftrace.domain.proto.WireType;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Extracts the timestamp field from a serialized ftrace event.
 *
 * <p>Producers almost always write the timestamp first, so {@link #fastPath(TraceBlobView)} probes the first byte
 * for its tag and decodes the varint in place. Anything else goes through {@link #slowPath(TraceBlobView)}, which
 * walks the fields.</p>
 *
 * @since 0.1.0
 */
public final class FtraceEventTimestamps {
  static final int TIMESTAMP_TAG = WireType.VARINT.tag(FtraceWireFields.Event.TIMESTAMP);

  private FtraceEventTimestamps() {}

  /**
   * Finds the timestamp using the fast path when the event qualifies, otherwise the slow path.
   *
   * <p>An event that qualifies for the fast path but fails to decode there is reported as missing; the slow path
   * is not retried.</p>
   *
   * @param event serialized event
   * @return raw timestamp, or empty when none can be read
   */
  public static OptionalLong find(TraceBlobView event) {
    if (qualifiesForFastPath(event)) {
      return fastPath(event);
    }
    return slowPath(event);
  }

  /**
   * Reports whether the event is long enough and starts with the timestamp tag.
   *
   * @param event serialized event
   * @return {@code true} when {@link #find(TraceBlobView)} takes the fast path
   */
  public static boolean qualifiesForFastPath(TraceBlobView event) {
    return event.length() > ProtoReader.MAX_VARINT_BYTES && event.byteAt(0) == TIMESTAMP_TAG;
  }

  /**
   * Decodes the varint that follows a leading timestamp tag, reading at most
   * {@value ProtoReader#MAX_VARINT_BYTES} bytes.
   *
   * @param event serialized event; must qualify for the fast path
   * @return raw timestamp, or empty when the varint does not terminate in time
   */
  public static OptionalLong fastPath(TraceBlobView event) {
    if (!qualifiesForFastPath(event)) {
      return OptionalLong.empty();
    }
    ProtoReader reader = new ProtoReader(event.buffer(), event.offset() + 1, ProtoReader.MAX_VARINT_BYTES);
    try {
      return OptionalLong.of(reader.readVarInt64());
    } catch (ProtoWireException ex) {
      return OptionalLong.empty();
    }
  }

  /**
   * Scans the event for the first field numbered like the timestamp.
   *
   * @param event serialized event
   * @return raw timestamp; empty when the field is absent, length-delimited, or preceded by malformed data
   */
  public static OptionalLong slowPath(TraceBlobView event) {
    Optional<ProtoField> field;
    try {
      field = new ProtoReader(event).findField(FtraceWireFields.Event.TIMESTAMP);
    } catch (ProtoWireException ex) {
      return OptionalLong.empty();
    }
    if (field.isEmpty() || field.get().isLengthDelimited()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(field.get().asUint64());
  }
}
