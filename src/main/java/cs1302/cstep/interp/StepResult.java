package cs1302.cstep.interp;

import cs1302.cstep.memory.MemoryState;
import java.util.Optional;

/**
 * The outcome of one {@link Interpreter#step()}.
 *
 * @param step The number of steps executed so far.
 * @param state The interpreter state after the step.
 * @param executed The unit the step executed, or {@code null} if it executed nothing.
 * @param cursor The unit that runs next, or {@code null} when the run is over.
 * @param memory A capture of memory after the step.
 * @param control The control state after the step.
 * @param console The console after the step.
 * @param diagnostic Why the run failed, for a {@code FAILED} result.
 * @param exitCode The exit code of a completed run.
 */
public record StepResult(
    long step,
    ExecutionState state,
    Cursor executed,
    Cursor cursor,
    MemoryState memory,
    ControlState control,
    ConsoleState console,
    Optional<Diagnostic> diagnostic,
    int exitCode) implements ExecutionPoint {}
