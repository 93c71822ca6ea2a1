package ca.gc.cra.ftrace.domain.proto;

/**
 * Checked exception raised when serialized protobuf bytes are truncated or malformed.
 *
 * @since 0.1.0
 */
public final class ProtoWireException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable description of the malformed input
   */
  public ProtoWireException(String msg) { super(msg); }
}
