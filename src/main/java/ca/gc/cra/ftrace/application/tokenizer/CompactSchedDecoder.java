package ca.gc.cra.ftrace.application.tokenizer;

import ca.gc.cra.ftrace.application.port.EventSinkPort;
import ca.gc.cra.ftrace.application.port.MetricsPort;
import ca.gc.cra.ftrace.application.port.StringPoolPort;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.clock.BuiltinClock;
import ca.gc.cra.ftrace.domain.ftrace.FtraceWireFields.CompactSched;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedSwitch;
import ca.gc.cra.ftrace.domain.ftrace.InlineSchedWaking;
import ca.gc.cra.ftrace.domain.proto.PackedVarIntIterator;
import ca.gc.cra.ftrace.domain.proto.ParseErrorFlag;
import ca.gc.cra.ftrace.domain.proto.ProtoField;
import ca.gc.cra.ftrace.domain.proto.ProtoReader;
import ca.gc.cra.ftrace.domain.proto.ProtoWireException;
import ca.gc.cra.ftrace.domain.strings.StringId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decoder for the compact, column-oriented encoding of {@code sched_switch} and
 * {@code sched_waking}.
 * <p><strong>Why:</strong> Scheduler events dominate ftrace volume; the capture layer stores them as packed,
 * delta-encoded columns with an intern table for command names, so they must be reassembled row by row.</p>
 * <p><strong>Role:</strong> Application service invoked by {@link FtraceTokenizer} for every bundle carrying a
 * compact record.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Intern the record's command names once, in declaration order.</li>
 *   <li>Walk the five columns of each batch in lockstep, accumulating timestamp deltas from zero.</li>
 *   <li>Push each recovered row to the {@link EventSinkPort} with a trace-clock timestamp.</li>
 *   <li>Count malformed columns, unequal column lengths, and out-of-range comm indices.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; safe to share only if its collaborators are.</p>
 * <p><strong>Performance:</strong> Columns are decoded lazily straight from the bundle buffer.</p>
 * <p><strong>Observability:</strong> {@code ftrace.compact_sched.parse_errors} is incremented at most once per
 * batch; {@code ftrace.compact_sched.comm_index_out_of_bounds} once per skipped row.</p>
 *
 * @since 0.1.0
 */
public final class CompactSchedDecoder {
  private static final Logger log = LoggerFactory.getLogger(CompactSchedDecoder.class);

  /** Column layout of one event kind; every batch has a timestamp, three payload columns and a comm index. */
  enum Batch {
    SWITCH(
        CompactSched.SWITCH_TIMESTAMP,
        CompactSched.SWITCH_PREV_STATE,
        CompactSched.SWITCH_NEXT_PID,
        CompactSched.SWITCH_NEXT_PRIO,
        CompactSched.SWITCH_NEXT_COMM_INDEX),
    WAKING(
        CompactSched.WAKING_TIMESTAMP,
        CompactSched.WAKING_PID,
        CompactSched.WAKING_TARGET_CPU,
        CompactSched.WAKING_PRIO,
        CompactSched.WAKING_COMM_INDEX);

    private final int[] columns;

    Batch(int... columns) {
      this.columns = columns;
    }

    int[] columns() {
      return columns.clone();
    }
  }

  private static final int TIMESTAMP = 0;
  private static final int COMM_INDEX = 4;

  private final StringPoolPort stringPool;
  private final TraceTimeResolver timeResolver;
  private final EventSinkPort sink;
  private final MetricsPort metrics;
  private final CompactSchedClockPolicy clockPolicy;

  /**
   * Creates a decoder.
   *
   * @param stringPool pool receiving intern-table entries; must not be {@code null}
   * @param timeResolver converts accumulated timestamps; must not be {@code null}
   * @param sink receives decoded rows; must not be {@code null}
   * @param metrics diagnostic counters; must not be {@code null}
   * @param clockPolicy reaction to clock conversion failures; must not be {@code null}
   */
  public CompactSchedDecoder(
      StringPoolPort stringPool,
      TraceTimeResolver timeResolver,
      EventSinkPort sink,
      MetricsPort metrics,
      CompactSchedClockPolicy clockPolicy) {
    this.stringPool = Objects.requireNonNull(stringPool, "stringPool");
    this.timeResolver = Objects.requireNonNull(timeResolver, "timeResolver");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clockPolicy = Objects.requireNonNull(clockPolicy, "clockPolicy");
  }

  /**
   * Decodes both batches of one compact record; switch events are pushed before waking events.
   *
   * <p>A record whose fields cannot be walked at all counts as one parse error and emits nothing.</p>
   *
   * @param cpu CPU owning the bundle
   * @param clock canonical clock of the bundle
   * @param compactSched serialized compact record
   */
  public void decode(int cpu, BuiltinClock clock, TraceBlobView compactSched) {
    Map<Integer, ProtoField> columns = new HashMap<>();
    List<ProtoField> internEntries = new ArrayList<>();
    ProtoReader reader = new ProtoReader(compactSched);
    try {
      while (reader.hasRemaining()) {
        ProtoField field = reader.readField();
        if (field.number() == CompactSched.INTERN_TABLE) {
          internEntries.add(field);
        } else {
          columns.put(field.number(), field);
        }
      }
    } catch (ProtoWireException ex) {
      log.debug("Dropping malformed compact sched record on cpu {}: {}", cpu, ex.getMessage());
      metrics.increment(FtraceStats.COMPACT_SCHED_PARSE_ERRORS);
      return;
    }

    List<StringId> internTable = intern(compactSched, internEntries);
    decodeBatch(Batch.SWITCH, cpu, clock, compactSched.buffer(), columns, internTable);
    decodeBatch(Batch.WAKING, cpu, clock, compactSched.buffer(), columns, internTable);
  }

  private List<StringId> intern(TraceBlobView compactSched, List<ProtoField> entries) {
    if (entries.isEmpty()) {
      return Collections.emptyList();
    }
    List<StringId> table = new ArrayList<>(entries.size());
    for (ProtoField entry : entries) {
      // Non-string entries keep their slot so later indices stay aligned.
      TraceBlobView bytes = entry.isLengthDelimited()
          ? compactSched.sliceAbsolute(entry.valueOffset(), entry.valueLength())
          : compactSched.slice(0, 0);
      table.add(stringPool.intern(bytes));
    }
    return table;
  }

  private void decodeBatch(
      Batch batch,
      int cpu,
      BuiltinClock clock,
      byte[] buffer,
      Map<Integer, ProtoField> fields,
      List<StringId> internTable) {
    ParseErrorFlag parseError = new ParseErrorFlag();
    int[] columnNumbers = batch.columns();
    PackedVarIntIterator[] columns = new PackedVarIntIterator[columnNumbers.length];
    for (int i = 0; i < columnNumbers.length; i++) {
      columns[i] = openColumn(buffer, fields.get(columnNumbers[i]), parseError);
    }

    long timestampAcc = 0;
    long[] row = new long[columns.length];
    while (allHaveNext(columns)) {
      for (int i = 0; i < columns.length; i++) {
        row[i] = columns[i].nextLong();
      }
      timestampAcc += row[TIMESTAMP];

      long commIndex = row[COMM_INDEX];
      if (Long.compareUnsigned(commIndex, internTable.size()) >= 0) {
        log.debug("Compact {} on cpu {} references comm index {} outside intern table of {}",
            batch, cpu, Long.toUnsignedString(commIndex), internTable.size());
        metrics.increment(FtraceStats.COMPACT_SCHED_COMM_INDEX_OUT_OF_BOUNDS);
        continue;
      }
      StringId comm = internTable.get((int) commIndex);

      OptionalLong timestamp = timeResolver.resolve(clock, timestampAcc);
      if (timestamp.isEmpty()) {
        if (clockPolicy == CompactSchedClockPolicy.ABORT_BATCH) {
          return;
        }
        continue;
      }
      emit(batch, cpu, timestamp.getAsLong(), row, comm);
    }

    if (parseError.isSet() || anyHasNext(columns)) {
      log.debug("Compact {} batch on cpu {} has malformed or unequal columns", batch, cpu);
      metrics.increment(FtraceStats.COMPACT_SCHED_PARSE_ERRORS);
    }
  }

  private void emit(Batch batch, int cpu, long timestamp, long[] row, StringId comm) {
    switch (batch) {
      case SWITCH -> sink.pushInlineSchedSwitch(
          cpu, timestamp, new InlineSchedSwitch(row[1], (int) row[2], (int) row[3], comm));
      case WAKING -> sink.pushInlineSchedWaking(
          cpu, timestamp, new InlineSchedWaking((int) row[1], (int) row[2], (int) row[3], comm));
      default -> throw new IllegalStateException("Unhandled batch " + batch);
    }
  }

  private static PackedVarIntIterator openColumn(byte[] buffer, ProtoField field, ParseErrorFlag parseError) {
    if (field == null) {
      return PackedVarIntIterator.empty(parseError);
    }
    if (!field.isLengthDelimited()) {
      parseError.set();
      return PackedVarIntIterator.empty(parseError);
    }
    return PackedVarIntIterator.of(buffer, field, parseError);
  }

  private static boolean allHaveNext(PackedVarIntIterator[] columns) {
    for (PackedVarIntIterator column : columns) {
      if (!column.hasNext()) {
        return false;
      }
    }
    return true;
  }

  private static boolean anyHasNext(PackedVarIntIterator[] columns) {
    for (PackedVarIntIterator column : columns) {
      if (column.hasNext()) {
        return true;
      }
    }
    return false;
  }
}
