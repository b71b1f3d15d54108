package cs1302.cstep.interp;

/** Lifecycle of an {@link Interpreter}. */
public enum ExecutionState {
  IDLE,
  READY,
  RUNNING,
  PAUSED,
  SUSPENDED_FOR_INPUT,
  COMPLETED,
  FAILED;

  /**
   * Returns {@code true} if no further step can be taken.
   *
   * @return whether the state is terminal
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
