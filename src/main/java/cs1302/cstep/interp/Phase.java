package cs1302.cstep.interp;

/** Which part of a statement the cursor is at. */
public enum Phase {
  /** A plain statement. */
  EXECUTE,
  /** The init clause of a {@code for}. */
  INIT,
  /** The condition of an {@code if}, {@code while}, {@code do} or {@code for}. */
  CONDITION,
  /** The update clause of a {@code for}. */
  UPDATE,
  /** The selection of a {@code switch}. */
  DISPATCH
}
