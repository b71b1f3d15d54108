package cs1302.cstep.interp;

import cs1302.cstep.memory.MemoryState;
import java.util.Optional;

/** A moment of a run that an {@link Interpreter} can be put back to. */
public interface ExecutionPoint {

  /** The number of steps executed before this point. */
  long step();

  ExecutionState state();

  /** The unit that runs next, or {@code null} when nothing is left to run. */
  Cursor cursor();

  MemoryState memory();

  ControlState control();

  ConsoleState console();

  Optional<Diagnostic> diagnostic();

  /** The exit code of a completed run, {@code 0} otherwise. */
  int exitCode();
}
