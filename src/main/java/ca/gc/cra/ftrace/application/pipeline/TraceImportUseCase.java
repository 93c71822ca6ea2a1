package ca.gc.cra.ftrace.application.pipeline;

import ca.gc.cra.ftrace.application.port.ClockSnapshotPort;
import ca.gc.cra.ftrace.application.port.EventSinkPort;
import ca.gc.cra.ftrace.application.port.MetricsPort;
import ca.gc.cra.ftrace.application.port.TracePacketSource;
import ca.gc.cra.ftrace.application.tokenizer.FtraceStats;
import ca.gc.cra.ftrace.application.tokenizer.FtraceTokenizer;
import ca.gc.cra.ftrace.application.tokenizer.FtraceTokenizerException;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.ftrace.FtraceWireFields;
import ca.gc.cra.ftrace.domain.proto.ProtoField;
import ca.gc.cra.ftrace.domain.proto.ProtoReader;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Imports a stream of trace packets, tokenizing every ftrace bundle.
 * <p><strong>Why:</strong> Ftrace bundles can only be converted to the trace clock once the clock snapshots that
 * precede them are known; this loop feeds both in packet order.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the {@code tokenize} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Start, drain, and close the {@link TracePacketSource}.</li>
 *   <li>Route {@code ftrace_events} to {@link FtraceTokenizer} and {@code clock_snapshot} to the
 *   {@link ClockSnapshotPort}.</li>
 *   <li>Apply the {@link UnsupportedClockPolicy}.</li>
 *   <li>Flush and close the {@link EventSinkPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run one instance per import.</p>
 * <p><strong>Observability:</strong> Counts {@code trace.packets.read}, {@code trace.bundles.tokenized} and
 * {@code trace.packets.malformed}; sets MDC key {@code cpu} while a bundle is tokenized.</p>
 *
 * @since 0.1.0
 */
public final class TraceImportUseCase {
  private static final Logger log = LoggerFactory.getLogger(TraceImportUseCase.class);

  /** Packets pulled from the source. */
  public static final String PACKETS_READ = "trace.packets.read";
  /** Bundles tokenized without an unsupported-clock error. */
  public static final String BUNDLES_TOKENIZED = "trace.bundles.tokenized";
  /** Packets whose fields could not be decoded. */
  public static final String PACKETS_MALFORMED = "trace.packets.malformed";

  private static final String MDC_CPU = "cpu";

  private final TracePacketSource source;
  private final FtraceTokenizer tokenizer;
  private final ClockSnapshotPort clockSnapshots;
  private final EventSinkPort sink;
  private final MetricsPort metrics;
  private final UnsupportedClockPolicy unsupportedClockPolicy;

  private long packetsRead;
  private long bundlesTokenized;
  private long bundlesSkipped;
  private long snapshotsRecorded;
  private long malformedPackets;

  /**
   * Creates an import use case.
   *
   * @param source packet source; must not be {@code null}
   * @param tokenizer bundle tokenizer writing into {@code sink}; must not be {@code null}
   * @param clockSnapshots receiver for clock snapshots; must not be {@code null}
   * @param sink event sink flushed and closed at the end of the run; must not be {@code null}
   * @param metrics diagnostic counters; must not be {@code null}
   * @param unsupportedClockPolicy reaction to unsupported clocks; must not be {@code null}
   */
  public TraceImportUseCase(
      TracePacketSource source,
      FtraceTokenizer tokenizer,
      ClockSnapshotPort clockSnapshots,
      EventSinkPort sink,
      MetricsPort metrics,
      UnsupportedClockPolicy unsupportedClockPolicy) {
    this.source = Objects.requireNonNull(source, "source");
    this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    this.clockSnapshots = Objects.requireNonNull(clockSnapshots, "clockSnapshots");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.unsupportedClockPolicy = Objects.requireNonNull(unsupportedClockPolicy, "unsupportedClockPolicy");
  }

  /**
   * Runs the import until the source is exhausted or the thread is interrupted.
   *
   * @return totals for the run
   * @throws FtraceTokenizerException if a bundle uses an unsupported clock under {@link UnsupportedClockPolicy#FAIL}
   * @throws java.io.IOException if the sink fails to write
   * @throws Exception if the source or sink fails to open, flush, or close
   */
  public ImportSummary run() throws Exception {
    boolean started = false;
    try {
      source.start();
      started = true;
      while (!Thread.currentThread().isInterrupted()) {
        Optional<TraceBlobView> packet = source.poll();
        if (packet.isEmpty()) {
          if (source.isExhausted()) {
            log.debug("Trace source exhausted after {} packets", packetsRead);
            break;
          }
          continue;
        }
        packetsRead++;
        metrics.increment(PACKETS_READ);
        try {
          handlePacket(packet.get());
        } catch (UncheckedIOException ex) {
          throw ex.getCause();
        }
      }
    } finally {
      try {
        sink.flush();
      } catch (Exception ex) {
        log.error("Failed to flush event sink", ex);
        throw ex;
      } finally {
        try {
          sink.close();
        } catch (Exception ex) {
          log.error("Failed to close event sink", ex);
          throw ex;
        } finally {
          if (started) {
            try {
              source.close();
            } catch (Exception ex) {
              log.error("Failed to close trace source", ex);
              throw ex;
            }
          }
        }
      }
    }
    ImportSummary summary =
        new ImportSummary(packetsRead, bundlesTokenized, bundlesSkipped, snapshotsRecorded, malformedPackets);
    log.info("Trace import finished: {}", summary);
    return summary;
  }

  private void handlePacket(TraceBlobView packet) throws FtraceTokenizerException {
    List<ProtoField> fields = new ArrayList<>();
    ProtoReader reader = new ProtoReader(packet);
    try {
      while (reader.hasRemaining()) {
        fields.add(reader.readField());
      }
    } catch (ProtoWireException ex) {
      log.warn("Skipping malformed trace packet #{}: {}", packetsRead, ex.getMessage());
      malformedPackets++;
      metrics.increment(PACKETS_MALFORMED);
      return;
    }

    for (ProtoField field : fields) {
      if (!field.isLengthDelimited()) {
        continue;
      }
      TraceBlobView value = packet.sliceAbsolute(field.valueOffset(), field.valueLength());
      if (field.number() == FtraceWireFields.TracePacket.FTRACE_EVENTS) {
        tokenize(value);
      } else if (field.number() == FtraceWireFields.TracePacket.CLOCK_SNAPSHOT) {
        recordSnapshot(value);
      }
    }
  }

  private void tokenize(TraceBlobView bundle) throws FtraceTokenizerException {
    String previousCpu = MDC.get(MDC_CPU);
    try {
      peekCpu(bundle).ifPresent(cpu -> MDC.put(MDC_CPU, cpu));
      tokenizer.tokenizeBundle(bundle);
      bundlesTokenized++;
      metrics.increment(BUNDLES_TOKENIZED);
    } catch (FtraceTokenizerException ex) {
      if (unsupportedClockPolicy == UnsupportedClockPolicy.FAIL) {
        throw ex;
      }
      log.warn("Skipping ftrace bundle: {} ({})", ex.getMessage(), ex.clock());
      bundlesSkipped++;
      metrics.increment(FtraceStats.BUNDLE_UNSUPPORTED_CLOCK);
    } finally {
      if (previousCpu == null) {
        MDC.remove(MDC_CPU);
      } else {
        MDC.put(MDC_CPU, previousCpu);
      }
    }
  }

  private void recordSnapshot(TraceBlobView snapshot) {
    try {
      clockSnapshots.addSnapshot(snapshot);
      snapshotsRecorded++;
    } catch (ProtoWireException ex) {
      log.warn("Ignoring malformed clock snapshot in packet #{}: {}", packetsRead, ex.getMessage());
      malformedPackets++;
      metrics.increment(PACKETS_MALFORMED);
    }
  }

  private static Optional<String> peekCpu(TraceBlobView bundle) {
    try {
      return new ProtoReader(bundle)
          .findField(FtraceWireFields.Bundle.CPU)
          .filter(field -> !field.isLengthDelimited())
          .map(field -> Long.toString(field.asUint32()));
    } catch (ProtoWireException ex) {
      // The tokenizer reports the malformed bundle itself.
      return Optional.empty();
    }
  }
}
