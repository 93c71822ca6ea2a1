package ca.gc.cra.ftrace.application.tokenizer;

import ca.gc.cra.ftrace.application.port.EventSinkPort;
import ca.gc.cra.ftrace.application.port.MetricsPort;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.clock.BuiltinClock;
import ca.gc.cra.ftrace.domain.ftrace.FtraceClock;
import ca.gc.cra.ftrace.domain.ftrace.FtraceWireFields.Bundle;
import ca.gc.cra.ftrace.domain.proto.ProtoField;
import ca.gc.cra.ftrace.domain.proto.ProtoReader;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tokenizer for one per-CPU ftrace bundle.
 * <p><strong>Why:</strong> Bundles arrive in capture order per CPU; before events from different CPUs can be
 * merged, each one needs a trace-clock timestamp and compact scheduling batches need to be expanded.</p>
 * <p><strong>Role:</strong> Application service called by {@code TraceImportUseCase} for every
 * {@code ftrace_events} packet.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the bundle's CPU and map its clock domain to a canonical clock.</li>
 *   <li>Delegate compact scheduling records to {@link CompactSchedDecoder}.</li>
 *   <li>Extract each event's timestamp and forward a zero-copy slice to the {@link EventSinkPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; use one instance per import.</p>
 * <p><strong>Performance:</strong> Never copies event bytes; common events take a single-byte probe plus one varint
 * decode.</p>
 * <p><strong>Observability:</strong> Malformed data is logged and counted under
 * {@code ftrace.bundle.tokenizer.errors}; only unsupported clocks raise {@link FtraceTokenizerException}.</p>
 *
 * @since 0.1.0
 */
public final class FtraceTokenizer {
  private static final Logger log = LoggerFactory.getLogger(FtraceTokenizer.class);

  /** Bundles for CPUs at or above this index are dropped. */
  public static final int MAX_CPUS = 128;

  private final TraceTimeResolver timeResolver;
  private final CompactSchedDecoder compactSchedDecoder;
  private final EventSinkPort sink;
  private final MetricsPort metrics;

  /**
   * Creates a tokenizer.
   *
   * @param timeResolver converts raw timestamps; must not be {@code null}
   * @param compactSchedDecoder expands compact scheduling records; must not be {@code null}
   * @param sink receives timestamped events; must not be {@code null}
   * @param metrics diagnostic counters; must not be {@code null}
   */
  public FtraceTokenizer(
      TraceTimeResolver timeResolver,
      CompactSchedDecoder compactSchedDecoder,
      EventSinkPort sink,
      MetricsPort metrics) {
    this.timeResolver = Objects.requireNonNull(timeResolver, "timeResolver");
    this.compactSchedDecoder = Objects.requireNonNull(compactSchedDecoder, "compactSchedDecoder");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Tokenizes one serialized {@code FtraceEventBundle}.
   *
   * <p>Compact scheduling rows are pushed first, then the bundle's events in declaration order.</p>
   *
   * @param bundle bundle bytes; event slices share its buffer
   * @throws FtraceTokenizerException if the bundle's clock domain has no conversion to the trace clock
   */
  public void tokenizeBundle(TraceBlobView bundle) throws FtraceTokenizerException {
    OptionalLong cpuField = OptionalLong.empty();
    FtraceClock clockDomain = FtraceClock.UNSPECIFIED;
    boolean lostEvents = false;
    ProtoField compactSched = null;
    List<ProtoField> events = new ArrayList<>();

    ProtoReader reader = new ProtoReader(bundle);
    try {
      while (reader.hasRemaining()) {
        ProtoField field = reader.readField();
        switch (field.number()) {
          case Bundle.CPU -> {
            if (!field.isLengthDelimited()) {
              cpuField = OptionalLong.of(field.asUint32());
            }
          }
          case Bundle.EVENT -> {
            if (field.isLengthDelimited()) {
              events.add(field);
            }
          }
          case Bundle.LOST_EVENTS -> lostEvents = !field.isLengthDelimited() && field.asBool();
          case Bundle.COMPACT_SCHED -> {
            if (field.isLengthDelimited()) {
              compactSched = field;
            }
          }
          case Bundle.FTRACE_CLOCK -> {
            if (!field.isLengthDelimited()) {
              clockDomain = FtraceClock.fromWire(field.asInt32());
            }
          }
          default -> {
            // Remaining bundle fields do not influence tokenization.
          }
        }
      }
    } catch (ProtoWireException ex) {
      log.error("Dropping malformed ftrace bundle of {} bytes: {}", bundle.length(), ex.getMessage());
      metrics.increment(FtraceStats.BUNDLE_TOKENIZER_ERRORS);
      return;
    }

    if (cpuField.isEmpty()) {
      log.error("CPU field not found in ftrace bundle");
      metrics.increment(FtraceStats.BUNDLE_TOKENIZER_ERRORS);
      return;
    }
    long cpuValue = cpuField.getAsLong();
    if (cpuValue >= MAX_CPUS) {
      log.error("CPU larger than maximum supported ({} > {})", cpuValue, MAX_CPUS);
      return;
    }
    int cpu = (int) cpuValue;

    BuiltinClock clock = toCanonicalClock(clockDomain);
    if (lostEvents) {
      metrics.increment(FtraceStats.BUNDLE_LOST_EVENTS);
    }

    if (compactSched != null) {
      compactSchedDecoder.decode(
          cpu, clock, bundle.sliceAbsolute(compactSched.valueOffset(), compactSched.valueLength()));
    }
    for (ProtoField event : events) {
      tokenizeFtraceEvent(cpu, clock, bundle.sliceAbsolute(event.valueOffset(), event.valueLength()));
    }
  }

  /**
   * Timestamps one serialized event and forwards it to the sink.
   *
   * <p>An event without a readable timestamp is counted and dropped; an event whose timestamp cannot be
   * converted is dropped silently.</p>
   *
   * @param cpu CPU owning the event
   * @param clock canonical clock of the enclosing bundle
   * @param event serialized {@code FtraceEvent}
   */
  public void tokenizeFtraceEvent(int cpu, BuiltinClock clock, TraceBlobView event) {
    OptionalLong raw = FtraceEventTimestamps.find(event);
    if (raw.isEmpty()) {
      log.debug("Timestamp field not found in ftrace event of {} bytes on cpu {}", event.length(), cpu);
      metrics.increment(FtraceStats.BUNDLE_TOKENIZER_ERRORS);
      return;
    }
    OptionalLong timestamp = timeResolver.resolve(clock, raw.getAsLong());
    if (timestamp.isEmpty()) {
      return;
    }
    sink.pushFtraceEvent(cpu, timestamp.getAsLong(), event);
  }

  static BuiltinClock toCanonicalClock(FtraceClock clockDomain) throws FtraceTokenizerException {
    Optional<BuiltinClock> clock = clockDomain.canonicalClock();
    if (clock.isPresent()) {
      return clock.get();
    }
    if (clockDomain == FtraceClock.LOCAL) {
      throw new FtraceTokenizerException("Unable to parse ftrace packets with local clock", clockDomain);
    }
    throw new FtraceTokenizerException("Unable to parse ftrace packets with unknown clock", clockDomain);
  }
}
