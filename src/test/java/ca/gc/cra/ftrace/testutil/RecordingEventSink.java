package ca.gc.cra.ftrace.testutil;

import ca.gc.cra.ftrace.application.port.EventSinkPort;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedSwitch;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedWaking;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test double recording every pushed event in arrival order.
 */
public final class RecordingEventSink implements EventSinkPort {
  /** One recorded push; exactly one of the payload fields is set. */
  public record Pushed(
      int cpu, long timestamp, TraceBlobView ftrace, InlineSchedSwitch schedSwitch, InlineSchedWaking schedWaking) {}

  private final List<Pushed> events = new ArrayList<>();
  private int flushes;
  private boolean closed;

  @Override
  public void pushFtraceEvent(int cpu, long timestamp, TraceBlobView event) {
    events.add(new Pushed(cpu, timestamp, event, null, null));
  }

  @Override
  public void pushInlineSchedSwitch(int cpu, long timestamp, InlineSchedSwitch event) {
    events.add(new Pushed(cpu, timestamp, null, event, null));
  }

  @Override
  public void pushInlineSchedWaking(int cpu, long timestamp, InlineSchedWaking event) {
    events.add(new Pushed(cpu, timestamp, null, null, event));
  }

  @Override
  public void flush() {
    flushes++;
  }

  @Override
  public void close() {
    closed = true;
  }

  public List<Pushed> events() {
    return events;
  }

  public List<Pushed> ftraceEvents() {
    return events.stream().filter(e -> e.ftrace() != null).collect(Collectors.toList());
  }

  public List<Pushed> switches() {
    return events.stream().filter(e -> e.schedSwitch() != null).collect(Collectors.toList());
  }

  public List<Pushed> wakings() {
    return events.stream().filter(e -> e.schedWaking() != null).collect(Collectors.toList());
  }

  public List<Long> timestamps() {
    return events.stream().map(Pushed::timestamp).collect(Collectors.toList());
  }

  public int flushes() {
    return flushes;
  }

  public boolean closed() {
    return closed;
  }
}
