package ca.gc.cra.ftrace.application.port;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;

/**
 * Port receiving serialized {@code ClockSnapshot} messages found in the trace.
 *
 * <p>Implemented by {@code SnapshotClockTracker}, which also serves as the {@link ClockResolverPort}.</p>
 *
 * @since 0.1.0
 */
public interface ClockSnapshotPort {
  /**
   * Records one clock snapshot.
   *
   * @param snapshot serialized snapshot
   * @throws ProtoWireException if the snapshot cannot be decoded
   */
  void addSnapshot(TraceBlobView snapshot) throws ProtoWireException;
}
