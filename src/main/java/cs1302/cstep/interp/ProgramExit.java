package cs1302.cstep.interp;

/** Thrown by {@code exit} to end the program immediately. */
class ProgramExit extends RuntimeException {

  private final int code;

  ProgramExit(int code) {
    super("exit(" + code + ")", null, false, false);
    this.code = code;
  }

  int code() {
    return code;
  }
}
