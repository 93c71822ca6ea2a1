package ca.gc.cra.ftrace.domain.ftrace;

import ca.gc.cra.ftrace.domain.strings.StringId;
import java.util.Objects;

/**
 * {@code sched_waking} event recovered from the compact scheduling encoding.
 *
 * @param pid pid of the task being woken
 * @param targetCpu CPU the task is expected to run on
 * @param prio priority of the woken task
 * @param comm interned command name of the woken task; never {@code null}
 * @since 0.1.0
 */
public record InlineSchedWaking(int pid, int targetCpu, int prio, StringId comm) {
  /**
   * Validates the command handle.
   */
  public InlineSchedWaking {
    Objects.requireNonNull(comm, "comm");
  }
}
