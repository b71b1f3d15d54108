package cs1302.cstep.interp;

import cs1302.cstep.ErrorKind;

/**
 * Why and where a program failed.
 *
 * @param kind The kind of error.
 * @param message The error message.
 * @param cursor The unit that was executing.
 * @param frameId The id of the frame on top of the stack.
 * @param functionName The function that was executing.
 * @param step The index of the failing step.
 */
public record Diagnostic(
    ErrorKind kind, String message, Cursor cursor, int frameId, String functionName, long step) {

  @Override
  public String toString() {
    return String.format("%s at line %d in %s (frame %d, step %d): %s", kind.displayName(),
        cursor == null ? 0 : cursor.line(), functionName, frameId, step, message);
  }
}
