package cs1302.cstep.memory;

import java.util.Locale;

/**
 * One entry of the operation log of a {@link MemoryModel}.
 *
 * @param type What the model did.
 * @param step The step in progress.
 * @param frameId The id of the current frame when the operation ran.
 * @param address The address the operation concerned, or {@code 0}.
 * @param detail A short description, such as a variable or function name.
 */
public record MemoryOperation(Type type, long step, int frameId, long address, String detail) {

  /** The kinds of logged operations. */
  public enum Type {
    RESET,
    RESTORE,
    PUSH_FRAME,
    POP_FRAME,
    DECLARE_PARAMETER,
    DECLARE_LOCAL,
    DECLARE_GLOBAL,
    DECLARE_STATIC,
    WRITE_VARIABLE,
    ALLOCATE,
    FREE,
    REALLOCATE,
    READ_HEAP,
    WRITE_HEAP,
    INTERN_STRING;

    /** The name filters match against, e.g. {@code "write_heap"}. */
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  @Override
  public String toString() {
    return String.format("#%d %s frame=%d 0x%08x %s", step, type.label(), frameId, address,
        detail);
  }
}
