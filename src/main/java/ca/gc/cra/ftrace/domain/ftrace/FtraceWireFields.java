package ca.gc.cra.ftrace.domain.ftrace;

/**
 * Field numbers of the trace messages the tokenizer reads.
 *
 * @since 0.1.0
 */
public final class FtraceWireFields {
  private FtraceWireFields() {}

  /** {@code FtraceEventBundle}. */
  public static final class Bundle {
    public static final int CPU = 1;
    public static final int EVENT = 2;
    public static final int LOST_EVENTS = 3;
    public static final int COMPACT_SCHED = 4;
    public static final int FTRACE_CLOCK = 5;

    private Bundle() {}
  }

  /** {@code FtraceEvent}; everything except the timestamp is opaque here. */
  public static final class Event {
    public static final int TIMESTAMP = 1;

    private Event() {}
  }

  /** {@code FtraceEventBundle.CompactSched}; every column is a packed varint field. */
  public static final class CompactSched {
    public static final int SWITCH_TIMESTAMP = 1;
    public static final int SWITCH_PREV_STATE = 2;
    public static final int SWITCH_NEXT_PID = 3;
    public static final int SWITCH_NEXT_PRIO = 4;
    public static final int INTERN_TABLE = 5;
    public static final int SWITCH_NEXT_COMM_INDEX = 6;
    public static final int WAKING_TIMESTAMP = 7;
    public static final int WAKING_PID = 8;
    public static final int WAKING_TARGET_CPU = 9;
    public static final int WAKING_PRIO = 10;
    public static final int WAKING_COMM_INDEX = 11;

    private CompactSched() {}
  }

  /** Top-level {@code Trace} file container. */
  public static final class Trace {
    public static final int PACKET = 1;

    private Trace() {}
  }

  /** {@code TracePacket}. */
  public static final class TracePacket {
    public static final int FTRACE_EVENTS = 1;
    public static final int CLOCK_SNAPSHOT = 6;

    private TracePacket() {}
  }

  /** {@code ClockSnapshot} and its nested {@code Clock}. */
  public static final class ClockSnapshot {
    public static final int CLOCKS = 1;
    public static final int CLOCK_ID = 1;
    public static final int CLOCK_TIMESTAMP = 2;

    private ClockSnapshot() {}
  }
}
