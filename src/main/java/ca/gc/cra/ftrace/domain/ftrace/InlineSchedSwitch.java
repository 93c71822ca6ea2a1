package ca.gc.cra.ftrace.domain.ftrace;

import ca.gc.cra.ftrace.domain.strings.StringId;
import java.util.Objects;

/**
 * <strong>What:</strong> {@code sched_switch} event recovered from the compact scheduling encoding.
 * <p><strong>Why:</strong> Compact batches carry no per-event byte blob, so the decoded columns travel downstream
 * as a typed record instead.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param prevState scheduler state of the task leaving the CPU
 * @param nextPid pid of the task entering the CPU
 * @param nextPrio priority of the task entering the CPU
 * @param nextComm interned command name of the task entering the CPU; never {@code null}
 * @since 0.1.0
 */
public record InlineSchedSwitch(long prevState, int nextPid, int nextPrio, StringId nextComm) {
  /**
   * Validates the command handle.
   */
  public InlineSchedSwitch {
    Objects.requireNonNull(nextComm, "nextComm");
  }
}
