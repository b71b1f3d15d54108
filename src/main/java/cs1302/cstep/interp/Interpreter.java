package cs1302.cstep.interp;

import cs1302.cstep.EngineConfig;
import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.interp.ControlFlow.Position;
import cs1302.cstep.interp.ControlState.ActivationState;
import cs1302.cstep.memory.AllocationInfo;
import cs1302.cstep.memory.Frame;
import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.memory.MemoryState;
import cs1302.cstep.memory.StorageClass;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.NodeKind;
import cs1302.cstep.tree.SyntaxNode;
import cs1302.cstep.tree.TreeIndex;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Executes a program one schedulable unit at a time.
 *
 * <p>A unit is a simple statement or the decision point of a control construct (a condition, the
 * clauses of a {@code for}, the dispatch of a {@code switch}). Each call of {@link #step()} runs
 * exactly one unit and then moves the cursor with {@link ControlFlow}. Calls of user functions
 * are stepped into: the step that reaches the call keeps what the caller's unit computed so far and
 * pushes the callee's frame. The unit resumes in the step after the callee returns and finishes
 * without evaluating its completed subexpressions again.
 */
public class Interpreter {

  private static final Logger logger = LogManager.getLogger(Interpreter.class);

  /** Where one call is inside its function. A {@code null} node means the body is exhausted. */
  private record Activation(
      SyntaxNode function, int frameId, SyntaxNode node, Phase phase, UnitProgress progress) {

    Position position() {
      return new Position(node, phase);
    }

    Activation moveTo(Position next) {
      return next == null
          ? new Activation(function, frameId, null, Phase.EXECUTE, UnitProgress.NONE)
          : new Activation(function, frameId, next.node(), next.phase(), UnitProgress.NONE);
    }

    Activation suspend(UnitProgress progress) {
      return new Activation(function, frameId, node, phase, progress);
    }

    Activation withResult(TraceValue result) {
      return suspend(progress.withResult(result));
    }
  }

  private final EngineConfig config;
  private final MemoryModel memory;
  private final IoCollaborator console;
  private final Builtins builtins;
  private final Declarations declarations = new Declarations();
  private final ExpressionEvaluator evaluator;
  private final Deque<Activation> activations = new ArrayDeque<>();

  private SyntaxNode program;
  private TreeIndex index;
  private ControlFlow flow;
  private ExecutionState state = ExecutionState.IDLE;
  private long steps;
  private Diagnostic diagnostic;
  private int exitCode;
  private MemoryState lastState;

  /**
   * Create an interpreter.
   *
   * @param config The engine settings.
   * @param console The collaborator formatted I/O goes through.
   */
  public Interpreter(EngineConfig config, IoCollaborator console) {
    this.config = config;
    this.memory = new MemoryModel(config.memory());
    this.console = console;
    this.builtins = new Builtins(memory, console, config.randomSeed());
    this.evaluator = new ExpressionEvaluator(memory, builtins, declarations);
  }

  public Interpreter(EngineConfig config) {
    this(config, new BufferedConsole());
  }

  /**
   * Load a program: reset memory, declare the globals and enter the entry function.
   *
   * @param tree The {@code TRANSLATION_UNIT} of the program.
   * @throws EngineException with {@code ENTRY_POINT_NOT_FOUND} if the entry function is missing,
   *     or any error raised by a global initializer
   */
  public void load(SyntaxNode tree) {
    if (tree.kind() != NodeKind.TRANSLATION_UNIT) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Expected a TRANSLATION_UNIT, got %s",
          tree.kind());
    }
    reset();
    program = tree;
    index = new TreeIndex(tree);
    flow = new ControlFlow(index);
    evaluator.setProgram(index);
    evaluator.begin(UnitProgress.NONE, MemoryModel.GLOBAL_SCOPE);
    try {
      declarations.defineAggregates(tree, evaluator::dimension);
      for (SyntaxNode top : tree.children()) {
        switch (top.kind()) {
          case TYPEDEF_DECL -> declarations.define(top, evaluator::dimension);
          case VAR_DECL -> declare(top);
          case DECLARATION, MULTI_VAR_DECL -> top.childrenOf(NodeKind.VAR_DECL)
              .forEach(this::declare);
          case FUNCTION_DEF, FUNCTION_DECL, STRUCT_SPECIFIER, UNION_SPECIFIER -> {}
          default -> throw EngineException.of(ErrorKind.UNSUPPORTED,
              "%s on line %d is not allowed at file scope", top.kind(), top.line());
        }
      } // for
    } catch (CallRequest call) {
      reset();
      throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Call of '%s' on line %d in a global initializer", call.function().value(), call.line());
    }
    SyntaxNode entry = index.function(config.entryPoint()).orElseThrow(() -> {
      reset();
      return EngineException.of(ErrorKind.ENTRY_POINT_NOT_FOUND,
          "Entry function '%s' is not defined", config.entryPoint());
    });
    enterFunction(entry, List.of(), 0, true);
    state = ExecutionState.READY;
    lastState = memory.snapshot();
    logger.info("Loaded program with {} function(s), entering '{}'", index.functions().size(),
        entry.value());
  } // load

  /** Discard the program and all state. */
  public void reset() {
    activations.clear();
    memory.reset();
    console.restore(ConsoleState.EMPTY);
    builtins.setRandomState(config.randomSeed());
    declarations.clear();
    program = null;
    index = null;
    flow = null;
    state = ExecutionState.IDLE;
    steps = 0;
    diagnostic = null;
    exitCode = 0;
    lastState = memory.snapshot();
  }

  /**
   * Execute one unit.
   *
   * @return The outcome. A finished run returns its final result again without executing.
   * @throws IllegalStateException if no program is loaded
   */
  public StepResult step() {
    requireLoaded();
    if (state.isTerminal()) {
      return result(null);
    }
    Activation current = activations.peek();
    Cursor executed = cursor();
    List<Activation> savedActivations = new ArrayList<>(activations);
    ConsoleState savedConsole = console.state();
    long savedRandom = builtins.randomState();
    long number = steps + 1;

    state = ExecutionState.RUNNING;
    memory.setStep(number);
    try {
      execute(current);
      steps = number;
      if (state == ExecutionState.RUNNING) {
        state = ExecutionState.PAUSED;
      }
    } catch (CallRequest call) {
      steps = number;
      activations.push(activations.pop().suspend(evaluator.progress(call.site())));
      try {
        enterFunction(call.function(), call.arguments(), call.line(), false);
        state = ExecutionState.PAUSED;
      } catch (EngineException e) {
        fail(e, executed);
      }
    } catch (InputRequired e) {
      rollback(savedActivations, savedConsole, savedRandom);
      memory.setStep(steps);
      state = ExecutionState.SUSPENDED_FOR_INPUT;
      logger.debug("Step {} waits for input at {}", number, executed);
      return result(executed);
    } catch (ProgramExit e) {
      steps = number;
      complete(e.code());
    } catch (EngineException e) {
      steps = number;
      fail(e, executed);
    }
    lastState = memory.snapshot();
    logger.debug("Step {} executed {} -> {}", steps, executed, state);
    return result(executed);
  } // step

  private void rollback(List<Activation> saved, ConsoleState savedConsole, long savedRandom) {
    memory.restore(lastState);
    console.restore(savedConsole);
    builtins.setRandomState(savedRandom);
    activations.clear();
    activations.addAll(saved);
  }

  /**
   * Step until the run completes, fails or waits for input.
   *
   * @return The last result.
   */
  public StepResult run() {
    return run(Long.MAX_VALUE);
  }

  /**
   * Step until the run completes, fails, waits for input, or the given number of steps ran.
   *
   * @param maxSteps The largest number of steps to execute.
   * @return The last result.
   */
  public StepResult run(long maxSteps) {
    requireLoaded();
    StepResult last = result(null);
    for (long i = 0; i < maxSteps && !state.isTerminal(); i++) {
      last = step();
      if (state == ExecutionState.SUSPENDED_FOR_INPUT) {
        break;
      }
    } // for
    return last;
  }

  /**
   * Put the interpreter back to an earlier moment of the same program without re-executing.
   *
   * @param point A result or snapshot of a run of the loaded program.
   */
  public void loadSnapshot(ExecutionPoint point) {
    requireLoaded();
    memory.restore(point.memory());
    console.restore(point.console());
    builtins.setRandomState(point.control().randomState());
    activations.clear();
    for (ActivationState saved : point.control().activations()) {
      activations.push(new Activation(index.node(saved.functionId()), saved.frameId(),
          saved.nodeId() < 0 ? null : index.node(saved.nodeId()), saved.phase(),
          saved.progress()));
    } // for
    steps = point.step();
    state = point.state() == ExecutionState.RUNNING ? ExecutionState.PAUSED : point.state();
    diagnostic = point.diagnostic().orElse(null);
    exitCode = point.exitCode();
    memory.setStep(steps);
    lastState = point.memory();
    logger.debug("Rewound to step {}", steps);
  }

  // ---------------------------------------------------------------- units

  private void execute(Activation current) {
    if (current.node() == null) {
      finishFunction(returnValue(current.function(), null));
      return;
    }
    evaluator.begin(current.progress(), current.function().value());
    SyntaxNode node = current.node();
    switch (current.phase()) {
      case EXECUTE -> executeStatement(node);
      case INIT -> {
        SyntaxNode init = node.child(0);
        if (init.kind() == NodeKind.VAR_DECL) {
          declare(init);
        } else if (init.kind() == NodeKind.DECLARATION
            || init.kind() == NodeKind.MULTI_VAR_DECL) {
          init.childrenOf(NodeKind.VAR_DECL).forEach(this::declare);
        } else {
          evaluator.evaluate(init);
        }
        advance(new Position(node, Phase.CONDITION));
      }
      case CONDITION -> {
        SyntaxNode condition = switch (node.kind()) {
          case DO_WHILE_STMT, FOR_STMT -> node.child(1);
          default -> node.child(0);
        };
        boolean taken = condition.isEmpty() || evaluator.evaluate(condition).isTrue();
        advance(flow.afterCondition(node, taken));
      }
      case UPDATE -> {
        evaluator.evaluate(node.child(2));
        advance(new Position(node, Phase.CONDITION));
      }
      case DISPATCH -> {
        TraceValue value = evaluator.evaluate(node.child(0));
        advance(flow.dispatch(node, value, evaluator::evaluate));
      }
    }
  } // execute

  private void executeStatement(SyntaxNode node) {
    switch (node.kind()) {
      case EXPR_STMT -> {
        if (node.childCount() > 0) {
          evaluator.evaluate(node.child(0));
        }
        advance(flow.after(node));
      }
      case VAR_DECL -> {
        declare(node);
        advance(flow.after(node));
      }
      case DECLARATION, MULTI_VAR_DECL -> {
        node.childrenOf(NodeKind.VAR_DECL).forEach(this::declare);
        advance(flow.after(node));
      }
      case RETURN_STMT -> {
        TraceValue value = node.childCount() > 0 && !node.child(0).isEmpty()
            ? evaluator.evaluate(node.child(0))
            : null;
        finishFunction(returnValue(activations.peek().function(), value));
      }
      case BREAK_STMT -> advance(flow.breakTarget(node));
      case CONTINUE_STMT -> advance(flow.continueTarget(node));
      case EMPTY_STMT -> advance(flow.after(node));
      default -> throw EngineException.of(ErrorKind.UNSUPPORTED,
          "%s on line %d is not a statement", node.kind(), node.line());
    }
  } // executeStatement

  private void declare(SyntaxNode decl) {
    StorageClass storage = Declarations.storage(decl);
    if (evaluator.declared(decl)
        || storage == StorageClass.STATIC && memory.findStatic(decl.value()).isPresent()) {
      return;
    }
    CType type = declarations.declaredType(decl, evaluator::dimension);
    SyntaxNode init = Declarations.initializer(decl);
    TraceValue value = init == null ? null : evaluator.initialValue(init, type);
    memory.declareVariable(decl.value(), type, value, storage);
    evaluator.markDeclared(decl);
  }

  /** Move the current activation to {@code next}, or return from the function if it is null. */
  private void advance(Position next) {
    if (next == null) {
      finishFunction(returnValue(activations.peek().function(), null));
      return;
    }
    moveTo(next);
  }

  private void moveTo(Position next) {
    activations.push(activations.pop().moveTo(next));
    if (next != null) {
      syncScopes(next);
    }
  }

  /** Close the block scopes the cursor left and open the ones it entered. */
  private void syncScopes(Position position) {
    List<Integer> wanted = flow.scopeOwners(position).stream().map(index::id).toList();
    List<Frame.ScopeMark> open = new ArrayList<>(memory.currentFrame().scopes());
    Collections.reverse(open);
    int common = 0;
    while (common < open.size() && common < wanted.size()
        && open.get(common).ownerId() == wanted.get(common)) {
      common++;
    } // while
    for (int i = open.size(); i > common; i--) {
      memory.exitScope();
    } // for
    for (int i = common; i < wanted.size(); i++) {
      memory.enterScope(wanted.get(i));
    } // for
  }

  private void enterFunction(SyntaxNode function, List<TraceValue> args, int line,
      boolean entry) {
    String name = function.value();
    List<SyntaxNode> parameters = Declarations.parameters(function);
    if (!entry && parameters.size() != args.size()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "'%s' expects %d argument(s), got %d",
          name, parameters.size(), args.size());
    }
    SyntaxNode body = function.firstChild(NodeKind.COMPOUND_STMT).orElseThrow(() ->
        EngineException.of(ErrorKind.UNSUPPORTED, "Function '%s' has no body", name));
    Frame frame = memory.createFrame(name, name, line);
    for (int i = 0; i < parameters.size(); i++) {
      SyntaxNode parameter = parameters.get(i);
      memory.declareParameter(parameter.value(), declarations.parameterType(parameter),
          i < args.size() ? args.get(i) : null);
    } // for
    activations.push(
        new Activation(function, frame.id(), null, Phase.EXECUTE, UnitProgress.NONE));
    Position first = flow.firstUnit(body);
    if (first != null) {
      moveTo(first);
    }
  } // enterFunction

  private TraceValue returnValue(SyntaxNode function, TraceValue value) {
    CType type = declarations.returnType(function);
    if (type.isVoid()) {
      return new TraceValue.Void();
    }
    return value == null ? type.defaultValue() : type.coerce(value);
  }

  /** Return from the current call. The entry function's frame stays so the final state shows it. */
  private void finishFunction(TraceValue value) {
    activations.pop();
    if (activations.isEmpty()) {
      complete(value instanceof TraceValue.Void ? 0 : (int) value.asLong());
      return;
    }
    memory.destroyFrame(value);
    activations.push(activations.pop().withResult(value));
  }

  private void complete(int code) {
    activations.clear();
    exitCode = code;
    state = ExecutionState.COMPLETED;
    logger.info("Program completed with exit code {} after {} step(s)", code, steps);
    List<AllocationInfo> leaks = memory.detectLeaks();
    if (!leaks.isEmpty()) {
      logger.warn("{} allocation(s) were never freed", leaks.size());
    }
  }

  private void fail(EngineException e, Cursor executed) {
    Frame top = memory.currentFrame();
    diagnostic = new Diagnostic(e.kind(), e.getMessage(), executed, top.id(),
        top.functionName(), steps);
    state = ExecutionState.FAILED;
    logger.warn("Step {} failed: {}", steps, diagnostic);
  }

  // ---------------------------------------------------------------- queries

  private void requireLoaded() {
    if (program == null) {
      throw new IllegalStateException("No program is loaded");
    }
  }

  private StepResult result(Cursor executed) {
    return new StepResult(steps, state, executed, cursor(), lastState, control(),
        console.state(), Optional.ofNullable(diagnostic), exitCode);
  }

  /** The unit that runs next, or {@code null} if nothing is left to run. */
  public Cursor cursor() {
    Activation current = activations.peek();
    if (current == null || state.isTerminal()) {
      return null;
    } else if (current.node() == null) {
      SyntaxNode function = current.function();
      return new Cursor(function.line(), function.column(), NodeKind.FUNCTION_DEF, Phase.EXECUTE);
    }
    return ControlFlow.cursorOf(current.position());
  }

  /**
   * Capture the control state: the activation of every active call, outermost first.
   *
   * @return The capture.
   */
  public ControlState control() {
    List<ActivationState> saved = new ArrayList<>();
    Iterator<Activation> outermostFirst = activations.descendingIterator();
    while (outermostFirst.hasNext()) {
      Activation a = outermostFirst.next();
      saved.add(new ActivationState(index.id(a.function()), a.frameId(),
          a.node() == null ? -1 : index.id(a.node()), a.phase(), a.progress()));
    } // while
    return new ControlState(saved, builtins.randomState());
  }

  /** The result the interpreter would report without stepping. */
  public StepResult current() {
    requireLoaded();
    return result(null);
  }

  /** Every line a breakpoint can stop at. */
  public SortedSet<Integer> breakableLines() {
    requireLoaded();
    return ControlFlow.unitLines(program);
  }

  public ExecutionState state() {
    return state;
  }

  public Optional<Diagnostic> diagnostic() {
    return Optional.ofNullable(diagnostic);
  }

  public int exitCode() {
    return exitCode;
  }

  public long stepCount() {
    return steps;
  }

  public MemoryModel memory() {
    return memory;
  }

  public IoCollaborator console() {
    return console;
  }

  public EngineConfig config() {
    return config;
  }

  /** The loaded program, or {@code null}. */
  public SyntaxNode program() {
    return program;
  }
}
