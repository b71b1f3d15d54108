package cs1302.cstep.interp;

import java.util.List;

/**
 * Everything besides memory that the interpreter needs to continue a run: the activation of every
 * active call, outermost first, and the state of the random number generator.
 *
 * @param activations One entry per function frame, outermost first.
 * @param randomState The state of {@code rand}.
 */
public record ControlState(List<ActivationState> activations, long randomState) {

  /** The control state of an interpreter that has nothing left to run. */
  public static final ControlState EMPTY = new ControlState(List.of(), 1);

  public ControlState {
    activations = List.copyOf(activations);
  }

  /**
   * Where one call is in its function.
   *
   * @param functionId Node id of the function definition.
   * @param frameId Id of the call's frame.
   * @param nodeId Node id of the unit the call executes next.
   * @param phase The part of that unit.
   * @param progress What the unit computed before it stepped into a call.
   */
  public record ActivationState(
      int functionId, int frameId, int nodeId, Phase phase, UnitProgress progress) {}
}
