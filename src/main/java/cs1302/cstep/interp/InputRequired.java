package cs1302.cstep.interp;

/** Signals that a read needs input that has not been provided yet. */
public class InputRequired extends RuntimeException {

  public InputRequired(String message) {
    super(message);
  }
}
