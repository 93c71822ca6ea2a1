package ca.gc.cra.ftrace.application.port;

/**
 * <strong>What:</strong> Port for diagnostic counters and numeric observations.
 * <p><strong>Why:</strong> The tokenizer reports malformed input as counters instead of failing; injecting the sink
 * keeps decoding free of global state and vendor SDKs.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code StatsCounterAdapter} and
 * {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Increment named counters such as {@code ftrace.compact_sched.parse_errors}.</li>
 *   <li>Record numeric observations such as bundle sizes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates.</p>
 * <p><strong>Performance:</strong> Called on the decoding hot path; implementations must not block.</p>
 *
 * @implNote Keys use dotted lower-case names; adapters may normalize them.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted counter name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records one observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, semantics defined by the caller
   */
  void observe(String key, long value);

  /** Implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
