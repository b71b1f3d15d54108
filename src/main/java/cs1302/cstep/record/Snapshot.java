package cs1302.cstep.record;

import cs1302.cstep.interp.ConsoleState;
import cs1302.cstep.interp.ControlState;
import cs1302.cstep.interp.Cursor;
import cs1302.cstep.interp.Diagnostic;
import cs1302.cstep.interp.ExecutionPoint;
import cs1302.cstep.interp.ExecutionState;
import cs1302.cstep.memory.MemoryState;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One recorded step of a run.
 *
 * @param index Position in the timeline.
 * @param step Number of steps executed when the snapshot was taken.
 * @param cursor The unit that runs next, or {@code null} at the end of a run.
 * @param state The interpreter state.
 * @param memory Full capture of memory.
 * @param control The interpreter's control state.
 * @param console Output written and input consumed so far.
 * @param diagnostic Why the run failed, for the terminal snapshot of a failed run.
 * @param exitCode Exit code of a completed run.
 * @param timestamp When the snapshot was taken.
 * @param repeats How many identical snapshots were collapsed into this one.
 */
public record Snapshot(
    int index,
    long step,
    Cursor cursor,
    ExecutionState state,
    MemoryState memory,
    ControlState control,
    ConsoleState console,
    Optional<Diagnostic> diagnostic,
    int exitCode,
    Instant timestamp,
    int repeats) implements ExecutionPoint {

  /**
   * Capture a moment of a run.
   *
   * @param index The timeline position.
   * @param point The moment.
   * @param timestamp When it was captured.
   * @return The snapshot.
   */
  public static Snapshot of(int index, ExecutionPoint point, Instant timestamp) {
    return new Snapshot(index, point.step(), point.cursor(), point.state(), point.memory(),
        point.control(), point.console(), point.diagnostic(), point.exitCode(), timestamp, 0);
  }

  public Snapshot withIndex(int newIndex) {
    return new Snapshot(newIndex, step, cursor, state, memory, control, console, diagnostic,
        exitCode, timestamp, repeats);
  }

  public Snapshot withRepeats(int count) {
    return new Snapshot(index, step, cursor, state, memory, control, console, diagnostic,
        exitCode, timestamp, count);
  }

  /** The source line of the cursor, or {@code -1} when there is none. */
  public int line() {
    return cursor == null ? -1 : cursor.line();
  }

  /**
   * Returns {@code true} if the other snapshot shows the same program state: same cursor, memory
   * and control state.
   *
   * @param other The snapshot to compare with.
   * @return whether the states are the same
   */
  public boolean sameState(Snapshot other) {
    return Objects.equals(cursor, other.cursor)
        && state == other.state
        && memory.equals(other.memory)
        && control.equals(other.control);
  }
}
