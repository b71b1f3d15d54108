package cs1302.cstep;

/** Kinds of errors that stop a simulated program. */
public enum ErrorKind {
  /** The heap cap (or the heap address range) would be exceeded. */
  OUT_OF_MEMORY,
  /** {@code free} of an address that was never returned by an allocation. */
  INVALID_FREE,
  /** {@code free} of a block that is already freed. */
  DOUBLE_FREE,
  /** Access to a heap block after it was freed. */
  USE_AFTER_FREE,
  /** Array index or byte offset outside the bounds of its object. */
  OUT_OF_BOUNDS,
  UNKNOWN_IDENTIFIER,
  REDECLARED,
  RECURSION_LIMIT_EXCEEDED,
  ENTRY_POINT_NOT_FOUND,
  DIVISION_BY_ZERO,
  CANNOT_POP_ROOT,
  /** Access through an address owned by no live object, or a write to read-only data. */
  INVALID_ADDRESS,
  /** The locals of a frame do not fit in its size budget. */
  STACK_OVERFLOW,
  /** A construct, operator or library call that the engine does not implement. */
  UNSUPPORTED;

  /**
   * Returns the display name of this kind, e.g. {@code OutOfBounds} for {@link #OUT_OF_BOUNDS}.
   *
   * @return the camel case name
   */
  public String displayName() {
    StringBuilder sb = new StringBuilder();
    for (String word : name().split("_")) {
      sb.append(word.charAt(0)).append(word.substring(1).toLowerCase());
    } // for
    return sb.toString();
  } // displayName
}
