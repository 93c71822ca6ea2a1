package ca.gc.cra.ftrace.domain.proto;

/**
 * One decoded protobuf field.
 *
 * <p>For {@link WireType#LENGTH_DELIMITED} fields the value lives in the owning buffer at
 * {@code [valueOffset, valueOffset + valueLength)} and {@code intValue} is zero. For the other wire types
 * {@code intValue} carries the decoded number and the offsets describe its encoded bytes.</p>
 *
 * @param number field number
 * @param wireType encoding of the value
 * @param intValue raw 64-bit value for numeric wire types
 * @param valueOffset absolute position of the value in the owning buffer
 * @param valueLength encoded length of the value
 * @since 0.1.0
 */
public record ProtoField(int number, WireType wireType, long intValue, int valueOffset, int valueLength) {

  /**
   * Returns the value as an unsigned 64-bit number stored in a {@code long}.
   *
   * @return raw value bits
   */
  public long asUint64() {
    return intValue;
  }

  /**
   * Returns the value truncated to protobuf {@code uint32} semantics.
   *
   * @return low 32 bits as an unsigned value
   */
  public long asUint32() {
    return intValue & 0xFFFF_FFFFL;
  }

  /**
   * Returns the value truncated to protobuf {@code int32} semantics.
   *
   * @return low 32 bits as a signed value
   */
  public int asInt32() {
    return (int) intValue;
  }

  /**
   * Returns the value interpreted as a protobuf {@code bool}.
   *
   * @return {@code true} for any non-zero value
   */
  public boolean asBool() {
    return intValue != 0;
  }

  /**
   * Indicates whether the value is a length-prefixed byte range.
   *
   * @return {@code true} for {@link WireType#LENGTH_DELIMITED}
   */
  public boolean isLengthDelimited() {
    return wireType == WireType.LENGTH_DELIMITED;
  }
}
