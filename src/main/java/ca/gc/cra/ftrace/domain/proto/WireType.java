package ca.gc.cra.ftrace.domain.proto;

/**
 * Protobuf wire types understood by {@link ProtoReader}.
 *
 * <p>Group wire types (3 and 4) are deprecated and rejected as malformed input.</p>
 *
 * @since 0.1.0
 */
public enum WireType {
  /** Base-128 variable-length integer. */
  VARINT(0),
  /** Little-endian 64-bit value. */
  FIXED64(1),
  /** Length-prefixed bytes: strings, nested messages, packed repeated fields. */
  LENGTH_DELIMITED(2),
  /** Little-endian 32-bit value. */
  FIXED32(5);

  private final int id;

  WireType(int id) {
    this.id = id;
  }

  /**
   * Returns the 3-bit identifier stored in the low bits of a field tag.
   *
   * @return wire type identifier
   */
  public int id() {
    return id;
  }

  /**
   * Builds the varint value of a field tag.
   *
   * @param fieldNumber protobuf field number (positive)
   * @return {@code (fieldNumber << 3) | id()}
   */
  public int tag(int fieldNumber) {
    return (fieldNumber << 3) | id;
  }

  /**
   * Maps a raw wire type identifier to the enum.
   *
   * @param id low three bits of a field tag
   * @return matching wire type
   * @throws ProtoWireException if the identifier is a group or reserved type
   */
  static WireType fromId(int id) throws ProtoWireException {
    return switch (id) {
      case 0 -> VARINT;
      case 1 -> FIXED64;
      case 2 -> LENGTH_DELIMITED;
      case 5 -> FIXED32;
      default -> throw new ProtoWireException("unsupported wire type " + id);
    };
  }
}
