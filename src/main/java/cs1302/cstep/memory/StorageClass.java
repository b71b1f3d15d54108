package cs1302.cstep.memory;

/** Storage class of a declaration. */
public enum StorageClass {
  AUTO,
  STATIC,
  EXTERN;

  /**
   * Map a C storage class keyword.
   *
   * @param keyword {@code static}, {@code extern}, {@code auto} or {@code register}.
   * @return The storage class.
   */
  public static StorageClass fromKeyword(String keyword) {
    return switch (keyword.trim()) {
      case "static" -> STATIC;
      case "extern" -> EXTERN;
      default -> AUTO;
    };
  }
}
