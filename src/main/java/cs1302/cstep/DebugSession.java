package cs1302.cstep;

import cs1302.cstep.interp.BufferedConsole;
import cs1302.cstep.interp.ExecutionPoint;
import cs1302.cstep.interp.ExecutionState;
import cs1302.cstep.interp.Interpreter;
import cs1302.cstep.interp.StepResult;
import cs1302.cstep.memory.AllocationInfo;
import cs1302.cstep.memory.MemoryOperation;
import cs1302.cstep.record.ExecutionRecorder;
import cs1302.cstep.record.Snapshot;
import cs1302.cstep.record.TimelineMetadata;
import cs1302.cstep.tree.SyntaxNode;
import java.util.List;
import java.util.SortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A time-travel debugging session: one {@link Interpreter} whose steps are recorded by one
 * {@link ExecutionRecorder}.
 *
 * <p>Moving through the timeline ({@link #back}, {@link #forward}, {@link #jump}) loads the
 * selected snapshot into the interpreter. {@link #step()} then replays recorded snapshots until the
 * read cursor reaches the tip and only executes at the tip; {@link #stepLive()} executes from the
 * selected snapshot straight away and discards the recorded future.
 */
public class DebugSession {

  private static final Logger logger = LogManager.getLogger(DebugSession.class);

  private final BufferedConsole console = new BufferedConsole();
  private final Interpreter interpreter;
  private final ExecutionRecorder recorder;

  public DebugSession(EngineConfig config) {
    this.interpreter = new Interpreter(config, console);
    this.recorder = new ExecutionRecorder(config);
  }

  /**
   * Load a program and start a new timeline. Breakpoints are kept.
   *
   * @param tree The syntax tree of the program.
   * @param name A name for the program, stored in the timeline metadata.
   */
  public void load(SyntaxNode tree, String name) {
    interpreter.load(tree);
    recorder.start(TimelineMetadata.start(name));
  }

  public void load(SyntaxNode tree) {
    load(tree, "program");
  }

  /**
   * Advance by one step: the next recorded snapshot while the read cursor is behind the tip,
   * otherwise a live step.
   *
   * @return The moment reached.
   */
  public ExecutionPoint step() {
    if (recorder.size() > 0 && !recorder.atTip()) {
      Snapshot next = recorder.stepForward(1);
      interpreter.loadSnapshot(next);
      logger.debug("Replayed snapshot {}", next.index());
      return next;
    }
    return stepLive();
  }

  /**
   * Execute one step from the interpreter's state and record it. Snapshots after the read cursor
   * are discarded. A step that waits for input is not recorded.
   *
   * @return The recorded snapshot, or the step result while the step waits for input.
   */
  public ExecutionPoint stepLive() {
    if (interpreter.state().isTerminal()) {
      return recorder.size() > 0 ? recorder.current() : interpreter.current();
    }
    StepResult result = interpreter.step();
    if (result.state() == ExecutionState.SUSPENDED_FOR_INPUT) {
      return result;
    }
    return recorder.snapshot(recorder.record(result));
  }

  /**
   * Step until the run completes, fails or waits for input.
   *
   * @return The last moment reached.
   */
  public ExecutionPoint run() {
    return run(Long.MAX_VALUE);
  }

  /**
   * Step until the run completes, fails, waits for input, or the given number of steps ran.
   *
   * @param maxSteps The largest number of steps.
   * @return The last moment reached.
   */
  public ExecutionPoint run(long maxSteps) {
    ExecutionPoint last = position();
    for (long i = 0; i < maxSteps && !last.state().isTerminal(); i++) {
      last = step();
      if (last.state() == ExecutionState.SUSPENDED_FOR_INPUT) {
        break;
      }
    } // for
    return last;
  }

  /**
   * Step until a snapshot stops on an enabled breakpoint, or the run ends or waits for input.
   *
   * @return The last moment reached.
   */
  public ExecutionPoint continueToBreakpoint() {
    ExecutionPoint last = position();
    while (!last.state().isTerminal()) {
      last = step();
      if (last.state() == ExecutionState.SUSPENDED_FOR_INPUT) {
        break;
      } else if (last.cursor() != null
          && recorder.activeBreakpoint(last.cursor().line()).isPresent()) {
        break;
      }
    } // while
    return last;
  }

  private ExecutionPoint position() {
    return recorder.size() == 0 || recorder.atTip() ? interpreter.current() : recorder.current();
  }

  /**
   * Move back through the timeline.
   *
   * @param n The number of snapshots.
   * @return The snapshot reached, now loaded into the interpreter.
   */
  public Snapshot back(int n) {
    Snapshot snapshot = recorder.stepBack(n);
    interpreter.loadSnapshot(snapshot);
    return snapshot;
  }

  /**
   * Move forward through the timeline without executing.
   *
   * @param n The number of snapshots.
   * @return The snapshot reached, now loaded into the interpreter.
   */
  public Snapshot forward(int n) {
    Snapshot snapshot = recorder.stepForward(n);
    interpreter.loadSnapshot(snapshot);
    return snapshot;
  }

  /**
   * Move to a timeline index.
   *
   * @param index The index.
   * @return The snapshot reached, now loaded into the interpreter.
   */
  public Snapshot jump(int index) {
    Snapshot snapshot = recorder.goTo(index);
    interpreter.loadSnapshot(snapshot);
    return snapshot;
  }

  /**
   * Append text to the program's standard input. A step waiting for input runs again on the next
   * call of {@link #step()}.
   *
   * @param text The input.
   */
  public void provideInput(String text) {
    console.provideInput(text);
  }

  /** Mark the end of the program's standard input. */
  public void closeInput() {
    console.closeInput();
  }

  /** Allocations of the interpreter's current state that were never freed. */
  public List<AllocationInfo> leaks() {
    return interpreter.memory().detectLeaks();
  }

  /**
   * The newest entries of the interpreter's memory operation log.
   *
   * @param limit The largest number of entries to return.
   * @param filter Text the operation label must contain, or {@code null} for every operation.
   * @return The matching operations, oldest first.
   */
  public List<MemoryOperation> operations(int limit, String filter) {
    return interpreter.memory().operations(limit, filter);
  }

  public void clearOperations() {
    interpreter.memory().clearOperations();
  }

  public SortedSet<Integer> breakableLines() {
    return interpreter.breakableLines();
  }

  public Interpreter interpreter() {
    return interpreter;
  }

  public ExecutionRecorder recorder() {
    return recorder;
  }

  public BufferedConsole console() {
    return console;
  }
}
