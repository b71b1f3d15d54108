package cs1302.cstep.interp;

/**
 * Output written and input consumed by a program up to some step.
 *
 * @param stdout Everything written to standard output.
 * @param stderr Everything written to standard error.
 * @param inputPosition The number of input characters consumed.
 */
public record ConsoleState(String stdout, String stderr, int inputPosition) {

  public static final ConsoleState EMPTY = new ConsoleState("", "", 0);
}
