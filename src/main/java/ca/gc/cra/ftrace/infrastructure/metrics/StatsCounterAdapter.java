package ca.gc.cra.ftrace.infrastructure.metrics;

import ca.gc.cra.ftrace.application.port.MetricsPort;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * <strong>What:</strong> In-process diagnostic counters that can be read back after an import.
 * <p><strong>Why:</strong> Decoding anomalies are reported only as counters; the CLI summary and tests need the
 * final values, while exporters such as OpenTelemetry only push them out.</p>
 * <p><strong>Role:</strong> {@link MetricsPort} adapter; optionally tees every update into a delegate port.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent updates and reads.</p>
 * <p><strong>Performance:</strong> One {@link LongAdder} per counter name; observations keep count and sum
 * only.</p>
 *
 * @since 0.1.0
 */
public final class StatsCounterAdapter implements MetricsPort {
  private final ConcurrentMap<String, LongAdder> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongAdder> observationSums = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongAdder> observationCounts = new ConcurrentHashMap<>();
  private final MetricsPort delegate;

  /** Creates an adapter that keeps counters locally only. */
  public StatsCounterAdapter() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an adapter that also forwards every update to {@code delegate}.
   *
   * @param delegate downstream metrics port; must not be {@code null}
   */
  public StatsCounterAdapter(MetricsPort delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new LongAdder()).increment();
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    observationSums.computeIfAbsent(key, k -> new LongAdder()).add(value);
    observationCounts.computeIfAbsent(key, k -> new LongAdder()).increment();
    delegate.observe(key, value);
  }

  /**
   * Returns the current value of a counter.
   *
   * @param key counter name
   * @return number of increments so far; {@code 0} for unknown names
   */
  public long count(String key) {
    LongAdder adder = counters.get(key);
    return adder == null ? 0L : adder.sum();
  }

  /**
   * Returns the sum of all values observed under {@code key}.
   *
   * @param key metric name
   * @return observation total; {@code 0} for unknown names
   */
  public long observedTotal(String key) {
    LongAdder adder = observationSums.get(key);
    return adder == null ? 0L : adder.sum();
  }

  /**
   * Returns how many observations were recorded under {@code key}.
   *
   * @param key metric name
   * @return observation count; {@code 0} for unknown names
   */
  public long observationCount(String key) {
    LongAdder adder = observationCounts.get(key);
    return adder == null ? 0L : adder.sum();
  }

  /**
   * Returns all counters, sorted by name.
   *
   * @return unmodifiable point-in-time copy in name order
   */
  public Map<String, Long> snapshot() {
    Map<String, Long> copy = new TreeMap<>();
    counters.forEach((key, adder) -> copy.put(key, adder.sum()));
    return Collections.unmodifiableMap(copy);
  }
}
