package ca.gc.cra.ftrace.application.port;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies serialized trace packets to the import pipeline.
 * <p><strong>Why:</strong> Keeps the import use case agnostic of where packets come from (trace file, ring buffer,
 * test fixture).</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code ProtoTraceFileSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and close the underlying resource.</li>
 *   <li>Yield each packet as a zero-copy view.</li>
 *   <li>Signal exhaustion so the import can stop polling.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded polling.</p>
 *
 * @implNote Callers must invoke {@link #start()} before polling and always call {@link #close()}.
 * @since 0.1.0
 */
public interface TracePacketSource extends AutoCloseable {
  /**
   * Opens the source.
   *
   * @throws Exception if the source cannot be opened
   */
  void start() throws Exception;

  /**
   * Retrieves the next packet.
   *
   * @return next packet bytes; empty when nothing is available or the source is exhausted
   * @throws Exception if reading fails
   */
  Optional<TraceBlobView> poll() throws Exception;

  /**
   * Indicates whether the source will deliver no more packets.
   *
   * @return {@code true} once drained
   */
  default boolean isExhausted() {
    return false;
  }

  /**
   * Releases source resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  void close() throws Exception;
}
