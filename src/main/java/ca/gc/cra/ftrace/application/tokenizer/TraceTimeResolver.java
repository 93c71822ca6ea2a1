package ca.gc.cra.ftrace.application.tokenizer;

import ca.gc.cra.ftrace.application.port.ClockResolverPort;
import ca.gc.cra.ftrace.domain.clock.BuiltinClock;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Converts raw bundle timestamps into trace-clock timestamps.
 *
 * <p>Timestamps already in {@link BuiltinClock#TRACE_CLOCK} are returned as-is without consulting the resolver;
 * every other clock is delegated to the {@link ClockResolverPort}.</p>
 *
 * @since 0.1.0
 */
public final class TraceTimeResolver {
  private final ClockResolverPort resolver;

  /**
   * Creates a resolver delegating non-default clocks to {@code resolver}.
   *
   * @param resolver clock conversion port; must not be {@code null}
   */
  public TraceTimeResolver(ClockResolverPort resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /**
   * Resolves {@code timestamp} recorded against {@code clock}.
   *
   * @param clock source clock
   * @param timestamp raw timestamp in nanoseconds
   * @return trace-clock timestamp, or empty when conversion failed
   */
  public OptionalLong resolve(BuiltinClock clock, long timestamp) {
    if (clock == BuiltinClock.TRACE_CLOCK) {
      return OptionalLong.of(timestamp);
    }
    return resolver.toTraceTime(clock.id(), timestamp);
  }
}
