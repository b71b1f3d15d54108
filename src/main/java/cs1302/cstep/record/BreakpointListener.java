package cs1302.cstep.record;

/** Notified when a recorded snapshot stops at an enabled breakpoint. */
@FunctionalInterface
public interface BreakpointListener {

  /**
   * Called after the snapshot is added to the timeline.
   *
   * @param breakpoint The breakpoint, with its hit count already updated.
   * @param snapshot The snapshot whose cursor is on the breakpoint's line.
   */
  void breakpointHit(Breakpoint breakpoint, Snapshot snapshot);
}
