package ca.gc.cra.ftrace.infrastructure.clock;

import ca.gc.cra.ftrace.application.port.ClockResolverPort;
import ca.gc.cra.ftrace.application.port.ClockSnapshotPort;
import ca.gc.cra.ftrace.application.port.MetricsPort;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.clock.BuiltinClock;
import ca.gc.cra.ftrace.domain.ftrace.FtraceWireFields.ClockSnapshot;
import ca.gc.cra.ftrace.domain.proto.ProtoField;
import ca.gc.cra.ftrace.domain.proto.ProtoReader;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Clock resolver backed by the clock snapshots recorded in the trace.
 * <p><strong>Why:</strong> Bundles captured with {@code trace_clock=global} carry monotonic timestamps; snapshots
 * that sample several clocks at the same instant let them be rebased onto boot time.</p>
 * <p><strong>Role:</strong> {@link ClockResolverPort} adapter fed by {@code TraceImportUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode {@code ClockSnapshot} packets into per-clock readings.</li>
 *   <li>Convert a timestamp using the latest snapshot taken at or before it, or the earliest snapshot when the
 *   timestamp precedes them all.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Synchronized; snapshots may be added while other threads resolve.</p>
 * <p><strong>Observability:</strong> Increments {@code clock.sync.failure} when no snapshot relates the source
 * clock to boot time.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotClockTracker implements ClockResolverPort, ClockSnapshotPort {
  private static final Logger log = LoggerFactory.getLogger(SnapshotClockTracker.class);

  /** Conversion attempted without a usable snapshot. */
  public static final String CLOCK_SYNC_FAILURE = "clock.sync.failure";

  private final MetricsPort metrics;
  private final List<Map<Integer, Long>> snapshots = new ArrayList<>();

  /**
   * Creates an empty tracker.
   *
   * @param metrics diagnostic counters; must not be {@code null}
   */
  public SnapshotClockTracker(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Decodes and records one serialized {@code ClockSnapshot}.
   *
   * @param snapshot snapshot bytes
   * @throws ProtoWireException if the snapshot is malformed; nothing is recorded in that case
   */
  @Override
  public void addSnapshot(TraceBlobView snapshot) throws ProtoWireException {
    Map<Integer, Long> readings = new LinkedHashMap<>();
    ProtoReader reader = new ProtoReader(snapshot);
    while (reader.hasRemaining()) {
      ProtoField field = reader.readField();
      if (field.number() != ClockSnapshot.CLOCKS || !field.isLengthDelimited()) {
        continue;
      }
      ProtoReader clock = reader.nested(field);
      OptionalLong clockId = OptionalLong.empty();
      OptionalLong timestamp = OptionalLong.empty();
      while (clock.hasRemaining()) {
        ProtoField clockField = clock.readField();
        if (clockField.isLengthDelimited()) {
          continue;
        }
        if (clockField.number() == ClockSnapshot.CLOCK_ID) {
          clockId = OptionalLong.of(clockField.asUint32());
        } else if (clockField.number() == ClockSnapshot.CLOCK_TIMESTAMP) {
          timestamp = OptionalLong.of(clockField.asUint64());
        }
      }
      if (clockId.isPresent() && timestamp.isPresent()) {
        readings.put((int) clockId.getAsLong(), timestamp.getAsLong());
      }
    }
    addSnapshot(readings);
  }

  /**
   * Records one snapshot given as clock id to timestamp readings.
   *
   * @param readings clock readings taken at the same instant; must not be {@code null}
   */
  public synchronized void addSnapshot(Map<Integer, Long> readings) {
    Objects.requireNonNull(readings, "readings");
    if (readings.isEmpty()) {
      return;
    }
    snapshots.add(Map.copyOf(readings));
    log.debug("Recorded clock snapshot #{} with {} clocks", snapshots.size(), readings.size());
  }

  /**
   * Returns the number of recorded snapshots.
   *
   * @return snapshot count
   */
  public synchronized int snapshotCount() {
    return snapshots.size();
  }

  @Override
  public synchronized OptionalLong toTraceTime(int clockId, long timestamp) {
    int traceClock = BuiltinClock.TRACE_CLOCK.id();
    if (clockId == traceClock) {
      return OptionalLong.of(timestamp);
    }
    Map<Integer, Long> atOrBefore = null;
    Map<Integer, Long> earliest = null;
    for (Map<Integer, Long> snapshot : snapshots) {
      Long source = snapshot.get(clockId);
      if (source == null || !snapshot.containsKey(traceClock)) {
        continue;
      }
      if (earliest == null || source < earliest.get(clockId)) {
        earliest = snapshot;
      }
      if (source <= timestamp && (atOrBefore == null || source >= atOrBefore.get(clockId))) {
        atOrBefore = snapshot;
      }
    }
    Map<Integer, Long> chosen = atOrBefore != null ? atOrBefore : earliest;
    if (chosen == null) {
      metrics.increment(CLOCK_SYNC_FAILURE);
      log.debug("No clock snapshot relates clock {} to the trace clock", clockId);
      return OptionalLong.empty();
    }
    return OptionalLong.of(timestamp - chosen.get(clockId) + chosen.get(traceClock));
  }
}
