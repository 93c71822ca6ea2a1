package ca.gc.cra.ftrace.testutil;

import ca.gc.cra.ftrace.application.port.ClockResolverPort;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.LongPredicate;

/**
 * Clock resolver adding a fixed offset, optionally failing for selected timestamps.
 */
public final class FakeClockResolver implements ClockResolverPort {
  /** One resolver invocation. */
  public record Call(int clockId, long timestamp) {}

  private final long offset;
  private final LongPredicate fails;
  private final List<Call> calls = new ArrayList<>();

  public FakeClockResolver(long offset) {
    this(offset, ts -> false);
  }

  public FakeClockResolver(long offset, LongPredicate fails) {
    this.offset = offset;
    this.fails = fails;
  }

  public static FakeClockResolver failing() {
    return new FakeClockResolver(0, ts -> true);
  }

  @Override
  public OptionalLong toTraceTime(int clockId, long timestamp) {
    calls.add(new Call(clockId, timestamp));
    if (fails.test(timestamp)) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(timestamp + offset);
  }

  public List<Call> calls() {
    return calls;
  }
}
