package cs1302.cstep;

/**
 * Thrown when the simulated program performs an invalid operation. The exception carries the
 * {@link ErrorKind} so that callers can react to a specific kind of failure.
 */
public class EngineException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Construct an exception of the given kind.
   *
   * @param kind The kind of error.
   * @param message A description of what went wrong.
   */
  public EngineException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Construct an exception with a formatted message.
   *
   * @param kind The kind of error.
   * @param format A {@link String#format} format string.
   * @param args The format arguments.
   * @return The new exception.
   */
  public static EngineException of(ErrorKind kind, String format, Object... args) {
    return new EngineException(kind, String.format(format, args));
  }

  public ErrorKind kind() {
    return kind;
  }
}
