package cs1302.cstep.record;

/** A timeline document that cannot be imported. */
public class TimelineFormatException extends Exception {

  public TimelineFormatException(String message) {
    super(message);
  }

  public TimelineFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
