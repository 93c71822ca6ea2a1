package ca.gc.cra.ftrace.config;

import ca.gc.cra.ftrace.application.pipeline.TraceImportUseCase;
import ca.gc.cra.ftrace.application.port.MetricsPort;
import ca.gc.cra.ftrace.application.tokenizer.CompactSchedDecoder;
import ca.gc.cra.ftrace.application.tokenizer.FtraceTokenizer;
import ca.gc.cra.ftrace.application.tokenizer.TraceTimeResolver;
import ca.gc.cra.ftrace.infrastructure.clock.SnapshotClockTracker;
import ca.gc.cra.ftrace.infrastructure.metrics.StatsCounterAdapter;
import ca.gc.cra.ftrace.infrastructure.sink.NdjsonEventSink;
import ca.gc.cra.ftrace.infrastructure.strings.InMemoryStringPool;
import ca.gc.cra.ftrace.infrastructure.trace.ProtoTraceFileSource;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the tokenize pipeline from a {@link TokenizeConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the CLI and tests assemble identical
 * graphs.</p>
 * <p><strong>Role:</strong> Composition root; the only class that knows every adapter.</p>
 * <p><strong>Thread-safety:</strong> Build on one thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final TokenizeConfig config;
  private final StatsCounterAdapter stats;
  private final InMemoryStringPool stringPool = new InMemoryStringPool();

  /**
   * Creates a root whose counters are kept in process only.
   *
   * @param config run configuration; must not be {@code null}
   */
  public CompositionRoot(TokenizeConfig config) {
    this(config, MetricsPort.NO_OP);
  }

  /**
   * Creates a root whose counters are also forwarded to {@code exporter}.
   *
   * @param config run configuration; must not be {@code null}
   * @param exporter downstream metrics port such as the OpenTelemetry adapter; must not be {@code null}
   */
  public CompositionRoot(TokenizeConfig config, MetricsPort exporter) {
    this.config = Objects.requireNonNull(config, "config");
    this.stats = new StatsCounterAdapter(Objects.requireNonNull(exporter, "exporter"));
  }

  /**
   * Builds the import use case, opening the output file.
   *
   * @return ready-to-run use case
   * @throws IOException if the output file cannot be created
   */
  public TraceImportUseCase traceImportUseCase() throws IOException {
    SnapshotClockTracker clockTracker = new SnapshotClockTracker(stats);
    NdjsonEventSink sink =
        NdjsonEventSink.open(config.outputDirectory(), stringPool, config.includeEventPayload());
    TraceTimeResolver timeResolver = new TraceTimeResolver(clockTracker);
    CompactSchedDecoder compactSchedDecoder = new CompactSchedDecoder(
        stringPool, timeResolver, sink, stats, config.compactSchedClockFailure());
    FtraceTokenizer tokenizer = new FtraceTokenizer(timeResolver, compactSchedDecoder, sink, stats);
    log.debug("Tokenize pipeline wired: compactSchedClockFailure={}, unsupportedClock={}",
        config.compactSchedClockFailure(), config.unsupportedClock());
    return new TraceImportUseCase(
        new ProtoTraceFileSource(config.input(), stats),
        tokenizer,
        clockTracker,
        sink,
        stats,
        config.unsupportedClock());
  }

  /**
   * Returns the counters every component of this root reports into.
   *
   * @return shared counters
   */
  public StatsCounterAdapter stats() {
    return stats;
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return run configuration
   */
  public TokenizeConfig config() {
    return config;
  }
}
