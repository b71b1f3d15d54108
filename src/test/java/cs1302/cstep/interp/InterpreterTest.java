package cs1302.cstep.interp;

import static cs1302.cstep.tree.Trees.assign;
import static cs1302.cstep.tree.Trees.aggregate;
import static cs1302.cstep.tree.Trees.array;
import static cs1302.cstep.tree.Trees.arrayField;
import static cs1302.cstep.tree.Trees.arrow;
import static cs1302.cstep.tree.Trees.block;
import static cs1302.cstep.tree.Trees.breakStmt;
import static cs1302.cstep.tree.Trees.call;
import static cs1302.cstep.tree.Trees.caseLabel;
import static cs1302.cstep.tree.Trees.continueStmt;
import static cs1302.cstep.tree.Trees.defaultLabel;
import static cs1302.cstep.tree.Trees.doWhile;
import static cs1302.cstep.tree.Trees.dot;
import static cs1302.cstep.tree.Trees.empty;
import static cs1302.cstep.tree.Trees.expr;
import static cs1302.cstep.tree.Trees.field;
import static cs1302.cstep.tree.Trees.forLoop;
import static cs1302.cstep.tree.Trees.function;
import static cs1302.cstep.tree.Trees.id;
import static cs1302.cstep.tree.Trees.ifElse;
import static cs1302.cstep.tree.Trees.increment;
import static cs1302.cstep.tree.Trees.index;
import static cs1302.cstep.tree.Trees.main;
import static cs1302.cstep.tree.Trees.num;
import static cs1302.cstep.tree.Trees.op;
import static cs1302.cstep.tree.Trees.param;
import static cs1302.cstep.tree.Trees.pointerVar;
import static cs1302.cstep.tree.Trees.program;
import static cs1302.cstep.tree.Trees.ret;
import static cs1302.cstep.tree.Trees.sizeOf;
import static cs1302.cstep.tree.Trees.sizeOfStruct;
import static cs1302.cstep.tree.Trees.staticVar;
import static cs1302.cstep.tree.Trees.str;
import static cs1302.cstep.tree.Trees.struct;
import static cs1302.cstep.tree.Trees.structPointerField;
import static cs1302.cstep.tree.Trees.structPointerVar;
import static cs1302.cstep.tree.Trees.structVar;
import static cs1302.cstep.tree.Trees.switchOn;
import static cs1302.cstep.tree.Trees.ternary;
import static cs1302.cstep.tree.Trees.unary;
import static cs1302.cstep.tree.Trees.var;
import static cs1302.cstep.tree.Trees.whileLoop;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.cstep.EngineConfig;
import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.memory.AllocationInfo;
import cs1302.cstep.memory.MemoryState;
import cs1302.cstep.memory.MemoryState.FrameState;
import cs1302.cstep.memory.MemoryState.VariableState;
import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.NodeKind;
import cs1302.cstep.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for stepping programs through the interpreter. */
public class InterpreterTest {

  /**
   * The value of the innermost visible variable of the top frame with the given name.
   *
   * @param point The moment to inspect.
   * @param name The variable name.
   * @return The value.
   */
  static TraceValue local(ExecutionPoint point, String name) {
    MemoryState memory = point.memory();
    FrameState top = memory.frames().get(memory.frames().size() - 1);
    List<Integer> ids = new ArrayList<>(top.parameters());
    ids.addAll(top.locals());
    TraceValue found = null;
    for (int id : ids) {
      VariableState variable = memory.variable(id);
      if (variable.name().equals(name)) {
        found = variable.value();
      }
    } // for
    if (found == null) {
      throw new AssertionError(name + " is not a local of " + top.functionName());
    }
    return found;
  }

  static SyntaxNode countToFive() {
    return program(main(1, block(1,
        var(2, "int", "i", num(2, 0)),
        whileLoop(3, op(3, "<", id(3, "i"), num(3, 5)), block(3,
            expr(4, assign(4, "i", op(4, "+", id(4, "i"), num(4, 1)))))))));
  }

  private static List<StepResult> runAll(Interpreter interpreter) {
    List<StepResult> results = new ArrayList<>();
    while (!interpreter.state().isTerminal()) {
      results.add(interpreter.step());
    } // while
    return results;
  }

  private static Interpreter loaded(SyntaxNode tree) {
    Interpreter interpreter = new Interpreter(EngineConfig.defaults());
    interpreter.load(tree);
    return interpreter;
  }

  /** Every unit of the counting loop is one step, and the final state shows the loop's result. */
  @Test
  public void testCountingLoop() {
    Interpreter interpreter = loaded(countToFive());
    assertEquals(ExecutionState.READY, interpreter.state());
    assertEquals(2, interpreter.cursor().line());

    List<StepResult> results = runAll(interpreter);

    // 1 declaration, 6 condition tests, 5 body statements
    assertEquals(12, results.size());
    for (int i = 0; i < results.size(); i++) {
      assertEquals(i + 1, results.get(i).step());
    } // for
    List<Integer> lines = results.stream().map(r -> r.executed().line()).toList();
    assertEquals(List.of(2, 3, 4, 3, 4, 3, 4, 3, 4, 3, 4, 3), lines);

    StepResult last = results.get(results.size() - 1);
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(new TraceValue.Int(5), local(last, "i"));
    assertEquals(0, last.exitCode());
    assertNull(last.cursor());
    assertEquals(12, interpreter.stepCount());
  }

  @Test
  public void testConditionCursorPhase() {
    Interpreter interpreter = loaded(countToFive());
    interpreter.step();
    Cursor cursor = interpreter.cursor();
    assertEquals(NodeKind.WHILE_STMT, cursor.kind());
    assertEquals(Phase.CONDITION, cursor.phase());
  }

  /** A call is stepped into, and the caller's statement completes after the return. */
  @Test
  public void testCallStepsIntoCallee() {
    SyntaxNode tree = program(
        function(1, "int", "square", List.of(param(1, "int", "n")), block(1,
            ret(2, op(2, "*", id(2, "n"), id(2, "n"))))),
        main(4, block(4,
            var(5, "int", "r", call(5, "square", num(5, 3))),
            ret(6, op(6, "+", id(6, "r"), num(6, 1))))));
    Interpreter interpreter = loaded(tree);

    StepResult enter = interpreter.step();
    assertEquals(ExecutionState.PAUSED, enter.state());
    assertEquals(2, enter.cursor().line());
    assertEquals(2, interpreter.memory().depth());
    assertEquals(new TraceValue.Int(3), local(enter, "n"));
    assertEquals(5, interpreter.memory().currentFrame().returnLine());

    StepResult back = interpreter.step();
    assertEquals(5, back.cursor().line());
    assertEquals(1, interpreter.memory().depth());

    StepResult assigned = interpreter.step();
    assertEquals(new TraceValue.Int(9), local(assigned, "r"));
    assertEquals(6, assigned.cursor().line());

    StepResult done = interpreter.step();
    assertEquals(ExecutionState.COMPLETED, done.state());
    assertEquals(10, done.exitCode());
    assertEquals(4, done.step());
  }

  /** {@code int pop() { count = count - 1; return 7; }} over a global {@code count = 1}. */
  private static List<SyntaxNode> popper() {
    return List.of(
        var(1, "int", "count", num(1, 1)),
        function(2, "int", "pop", List.of(), block(2,
            expr(3, assign(3, "count", op(3, "-", id(3, "count"), num(3, 1)))),
            ret(4, num(4, 7)))));
  }

  private static SyntaxNode withPopper(SyntaxNode main) {
    List<SyntaxNode> tops = new ArrayList<>(popper());
    tops.add(main);
    return program(tops.toArray(SyntaxNode[]::new));
  }

  /** The left operand of {@code &&} is not tested again after the callee changed it. */
  @Test
  public void testLogicalAndKeepsOperandTestedBeforeCall() {
    SyntaxNode tree = withPopper(main(6, block(6,
        var(7, "int", "r", op(7, "&&",
            op(7, ">", id(7, "count"), num(7, 0)),
            op(7, "==", call(7, "pop"), num(7, 7)))),
        ret(8, id(8, "r")))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(1, last.exitCode());
    assertEquals(new TraceValue.Int(0), interpreter.memory().globals().get("count").value());
  }

  /** The branch of {@code ?:} chosen before the call is the one that completes. */
  @Test
  public void testConditionalKeepsBranchChosenBeforeCall() {
    SyntaxNode tree = withPopper(main(6, block(6,
        var(7, "int", "r", ternary(7, id(7, "count"), call(7, "pop"), num(7, 99))),
        ret(8, id(8, "r")))));
    assertEquals(7, loaded(tree).run().exitCode());
  }

  /** Side effects that precede a call in the same statement happen once. */
  @Test
  public void testSideEffectsBeforeCallHappenOnce() {
    SyntaxNode tree = withPopper(main(6, block(6,
        array(7, "int", "a", 3, num(7, 0), num(7, 0), num(7, 0)),
        var(8, "int", "i", num(8, 0)),
        expr(9, assign(9, "=", index(9, id(9, "a"), increment(9, "i")), call(9, "pop"))),
        ret(10, op(10, "+", op(10, "*", id(10, "i"), num(10, 10)), index(10, id(10, "a"),
            num(10, 0)))))));
    StepResult last = loaded(tree).run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(17, last.exitCode());
  }

  /** An increment in an argument list is applied once, when the arguments are bound. */
  @Test
  public void testArgumentSideEffectsHappenOnce() {
    SyntaxNode tree = program(
        function(1, "int", "twice", List.of(param(1, "int", "n")), block(1,
            ret(2, op(2, "*", id(2, "n"), num(2, 2))))),
        main(4, block(4,
            var(5, "int", "i", num(5, 3)),
            var(6, "int", "r", op(6, "+", call(6, "twice", increment(6, "i")), id(6, "i"))),
            ret(7, op(7, "+", op(7, "*", id(7, "r"), num(7, 10)), id(7, "i"))))));
    StepResult last = loaded(tree).run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(104, last.exitCode());
  }

  /** A declaration completed before a later declarator calls a function is not repeated. */
  @Test
  public void testDeclarationListWithCall() {
    SyntaxNode tree = withPopper(main(6, block(6,
        SyntaxNode.of(NodeKind.DECLARATION, 7,
            var(7, "int", "a", num(7, 1)),
            var(7, "int", "b", call(7, "pop"))),
        ret(8, op(8, "+", id(8, "a"), id(8, "b"))))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(8, last.exitCode());
    assertEquals(2, last.memory().frames().get(1).locals().size());
  }

  /** Rewinding into the callee and stepping again still completes the caller's unit once. */
  @Test
  public void testLoadSnapshotInsideCallee() {
    SyntaxNode tree = withPopper(main(6, block(6,
        var(7, "int", "r", op(7, "&&",
            op(7, ">", id(7, "count"), num(7, 0)),
            op(7, "==", call(7, "pop"), num(7, 7)))),
        ret(8, id(8, "r")))));
    Interpreter interpreter = loaded(tree);
    List<StepResult> results = runAll(interpreter);
    StepResult entered = results.get(0);
    assertEquals(2, entered.memory().frames().size() - 1);

    interpreter.loadSnapshot(entered);
    StepResult last = interpreter.run();
    assertEquals(1, last.exitCode());
    assertEquals(results.size(), last.step());
  }

  @Test
  public void testRecursion() {
    SyntaxNode tree = program(
        function(1, "int", "fact", List.of(param(1, "int", "n")), block(1,
            ifElse(2, op(2, "<=", id(2, "n"), num(2, 1)), block(2, ret(3, num(3, 1))), null),
            ret(5, op(5, "*", id(5, "n"),
                call(5, "fact", op(5, "-", id(5, "n"), num(5, 1))))))),
        main(7, block(7, ret(8, call(8, "fact", num(8, 5))))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(120, last.exitCode());
    assertEquals(1, interpreter.memory().depth());
  }

  @Test
  public void testRecursionLimit() {
    SyntaxNode tree = program(
        function(1, "int", "down", List.of(param(1, "int", "n")), block(1,
            ret(2, call(2, "down", op(2, "+", id(2, "n"), num(2, 1)))))),
        main(4, block(4, ret(5, call(5, "down", num(5, 0))))));
    Interpreter interpreter = new Interpreter(EngineConfig.defaults().withRecursionLimit(10));
    interpreter.load(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.FAILED, last.state());
    Diagnostic diagnostic = last.diagnostic().orElseThrow();
    assertEquals(ErrorKind.RECURSION_LIMIT_EXCEEDED, diagnostic.kind());
    assertEquals(2, diagnostic.cursor().line());
    assertEquals("down", diagnostic.functionName());
    assertEquals(10, interpreter.memory().depth());
  }

  @Test
  public void testForWithBreakAndContinue() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "sum", num(2, 0)),
        forLoop(3, var(3, "int", "k", num(3, 0)), op(3, "<", id(3, "k"), num(3, 10)),
            increment(3, "k"), block(3,
                ifElse(4, op(4, "==", id(4, "k"), num(4, 2)), block(4, continueStmt(5)), null),
                ifElse(7, op(7, "==", id(7, "k"), num(7, 5)), block(7, breakStmt(8)), null),
                expr(10, assign(10, "+=", id(10, "sum"), id(10, "k"))))),
        ret(12, id(12, "sum")))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(0 + 1 + 3 + 4, last.exitCode());
  }

  /** The loop variable of a {@code for} is released when the loop is left. */
  @Test
  public void testForScopeClosed() {
    SyntaxNode tree = program(main(1, block(1,
        forLoop(2, var(2, "int", "k", num(2, 0)), op(2, "<", id(2, "k"), num(2, 1)),
            increment(2, "k"), block(2, expr(3, id(3, "k")))),
        var(5, "int", "after", num(5, 1)),
        ret(6, id(6, "k")))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.FAILED, last.state());
    assertEquals(ErrorKind.UNKNOWN_IDENTIFIER, last.diagnostic().orElseThrow().kind());
    assertEquals(6, last.diagnostic().orElseThrow().cursor().line());
  }

  @Test
  public void testSwitchFallsThrough() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "x", num(2, 2)),
        var(3, "int", "y", num(3, 0)),
        switchOn(4, id(4, "x"),
            caseLabel(5, 1, expr(5, assign(5, "y", num(5, 10)))),
            caseLabel(6, 2, expr(6, assign(6, "y", num(6, 20)))),
            caseLabel(7, 3, expr(7, assign(7, "y", op(7, "+", id(7, "y"), num(7, 1))))),
            breakStmt(8),
            defaultLabel(9, expr(9, assign(9, "y", unary(9, "-", num(9, 1)))))),
        ret(11, id(11, "y")))));
    Interpreter interpreter = loaded(tree);
    List<StepResult> results = runAll(interpreter);
    assertEquals(21, results.get(results.size() - 1).exitCode());
    List<Integer> lines = results.stream().map(r -> r.executed().line()).toList();
    assertEquals(List.of(2, 3, 4, 6, 7, 8, 11), lines);
  }

  @Test
  public void testSwitchDefault() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "y", num(2, 0)),
        switchOn(3, num(3, 7),
            caseLabel(4, 1, expr(4, assign(4, "y", num(4, 10)))),
            defaultLabel(5, expr(5, assign(5, "y", num(5, 4))))),
        ret(7, id(7, "y")))));
    assertEquals(4, loaded(tree).run().exitCode());
  }

  @Test
  public void testDoWhile() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "n", num(2, 0)),
        doWhile(3, block(3, expr(4, assign(4, "+=", id(4, "n"), num(4, 3)))),
            op(5, "<", id(5, "n"), num(5, 10))),
        ret(6, id(6, "n")))));
    Interpreter interpreter = loaded(tree);
    interpreter.step();
    // the body runs before the first test
    assertEquals(4, interpreter.cursor().line());
    assertEquals(12, interpreter.run().exitCode());
  }

  @Test
  public void testIfElse() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "x", num(2, 3)),
        ifElse(3, op(3, ">", id(3, "x"), num(3, 5)),
            block(3, expr(4, assign(4, "x", num(4, 1)))),
            block(5, expr(6, assign(6, "x", num(6, 2))))),
        ret(8, id(8, "x")))));
    Interpreter interpreter = loaded(tree);
    List<StepResult> results = runAll(interpreter);
    assertEquals(List.of(2, 3, 6, 8), results.stream().map(r -> r.executed().line()).toList());
    assertEquals(2, results.get(results.size() - 1).exitCode());
  }

  @Test
  public void testShortCircuit() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "x", num(2, 0)),
        var(3, "int", "y", op(3, "&&", op(3, "!=", id(3, "x"), num(3, 0)),
            op(3, ">", op(3, "/", num(3, 10), id(3, "x")), num(3, 1)))),
        ret(4, id(4, "y")))));
    StepResult last = loaded(tree).run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(0, last.exitCode());
  }

  @Test
  public void testDivisionByZero() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "a", num(2, 1)),
        var(3, "int", "b", num(3, 0)),
        var(4, "int", "c", op(4, "/", id(4, "a"), id(4, "b"))))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.FAILED, last.state());
    Diagnostic diagnostic = last.diagnostic().orElseThrow();
    assertEquals(ErrorKind.DIVISION_BY_ZERO, diagnostic.kind());
    assertEquals(4, diagnostic.cursor().line());
    assertEquals("main", diagnostic.functionName());
    assertEquals(1, diagnostic.frameId());
    assertEquals(3, diagnostic.step());

    // a failed run stays failed
    StepResult again = interpreter.step();
    assertEquals(ExecutionState.FAILED, again.state());
    assertEquals(3, again.step());
  }

  /** An out of bounds write fails the run and leaves the array unchanged. */
  @Test
  public void testArrayOutOfBounds() {
    SyntaxNode tree = program(main(1, block(1,
        array(2, "int", "a", 3),
        expr(3, assign(3, "=", index(3, id(3, "a"), num(3, 5)), num(3, 1))))));
    StepResult last = loaded(tree).run();
    assertEquals(ExecutionState.FAILED, last.state());
    assertEquals(ErrorKind.OUT_OF_BOUNDS, last.diagnostic().orElseThrow().kind());
    TraceValue.Int zero = new TraceValue.Int(0);
    assertEquals(new TraceValue.Array(List.of(zero, zero, zero)), local(last, "a"));
  }

  @Test
  public void testArrayInitializerAndSum() {
    SyntaxNode tree = program(main(1, block(1,
        array(2, "int", "a", 4, num(2, 5), num(2, 6), num(2, 7)),
        var(3, "int", "total", op(3, "+", index(3, id(3, "a"), num(3, 0)),
            op(3, "+", index(3, id(3, "a"), num(3, 2)), index(3, id(3, "a"), num(3, 3))))),
        ret(4, id(4, "total")))));
    assertEquals(12, loaded(tree).run().exitCode());
  }

  @Test
  public void testHeapThroughPointer() {
    SyntaxNode tree = program(main(1, block(1,
        pointerVar(2, "int", "p",
            call(2, "malloc", op(2, "*", num(2, 3), sizeOf(2, "int")))),
        expr(3, assign(3, "=", index(3, id(3, "p"), num(3, 0)), num(3, 7))),
        expr(4, assign(4, "=", index(4, id(4, "p"), num(4, 2)),
            op(4, "*", index(4, id(4, "p"), num(4, 0)), num(4, 2)))),
        ret(5, index(5, id(5, "p"), num(5, 2))))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(14, last.exitCode());

    List<AllocationInfo> leaks = interpreter.memory().detectLeaks();
    assertEquals(1, leaks.size());
    assertEquals(12, leaks.get(0).size());
    assertEquals("main", leaks.get(0).origin());
    assertEquals(2, leaks.get(0).line());
  }

  @Test
  public void testDoubleFreeFails() {
    SyntaxNode tree = program(main(1, block(1,
        pointerVar(2, "char", "p", call(2, "malloc", num(2, 8))),
        expr(3, call(3, "free", id(3, "p"))),
        expr(4, call(4, "free", id(4, "p"))))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ErrorKind.DOUBLE_FREE, last.diagnostic().orElseThrow().kind());
    assertTrue(interpreter.memory().detectLeaks().isEmpty());
  }

  @Test
  public void testStaticLocalPersists() {
    SyntaxNode tree = program(
        function(1, "int", "next", List.of(), block(1,
            staticVar(2, "int", "count", num(2, 0)),
            expr(3, increment(3, "count")),
            ret(4, id(4, "count")))),
        main(6, block(6,
            expr(7, call(7, "next")),
            expr(8, call(8, "next")),
            ret(9, call(9, "next")))));
    assertEquals(3, loaded(tree).run().exitCode());
  }

  @Test
  public void testGlobalsAndVoidFunctions() {
    SyntaxNode tree = program(
        var(1, "int", "total", num(1, 5)),
        function(2, "void", "add", List.of(param(2, "int", "n")), block(2,
            expr(3, assign(3, "+=", id(3, "total"), id(3, "n"))))),
        main(5, block(5,
            expr(6, call(6, "add", num(6, 2))),
            expr(7, call(7, "add", num(7, 3))),
            ret(8, id(8, "total")))));
    Interpreter interpreter = loaded(tree);
    assertEquals(new TraceValue.Int(5), interpreter.memory().globals().get("total").value());
    assertEquals(10, interpreter.run().exitCode());
  }

  @Test
  public void testStringFunctions() {
    SyntaxNode s = SyntaxNode.of(NodeKind.VAR_DECL, "s", 2,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, "char", 2),
        SyntaxNode.of(NodeKind.ARRAY_DIMENSION, 2),
        str(2, "hi"));
    SyntaxNode tree = program(main(1, block(1,
        s,
        ret(3, call(3, "strlen", id(3, "s"))))));
    assertEquals(2, loaded(tree).run().exitCode());
  }

  @Test
  public void testPrintf() {
    SyntaxNode tree = program(main(1, block(1,
        expr(2, call(2, "printf", str(2, "%d-%s\n"), num(2, 42), str(2, "ok"))),
        expr(3, call(3, "puts", str(3, "done"))))));
    BufferedConsole console = new BufferedConsole();
    Interpreter interpreter = new Interpreter(EngineConfig.defaults(), console);
    interpreter.load(tree);
    StepResult first = interpreter.step();
    assertEquals("42-ok\n", first.console().stdout());
    interpreter.run();
    assertEquals("42-ok\ndone\n", console.stdout());
  }

  /** A step that needs input is not counted and runs again once input arrives. */
  @Test
  public void testSuspendForInput() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "x", num(2, 0)),
        expr(3, call(3, "scanf", str(3, "%d"), unary(3, "&", id(3, "x")))),
        expr(4, call(4, "printf", str(4, "got %d\n"), id(4, "x"))),
        ret(5, id(5, "x")))));
    BufferedConsole console = new BufferedConsole();
    Interpreter interpreter = new Interpreter(EngineConfig.defaults(), console);
    interpreter.load(tree);
    interpreter.step();

    StepResult waiting = interpreter.step();
    assertEquals(ExecutionState.SUSPENDED_FOR_INPUT, waiting.state());
    assertEquals(1, waiting.step());
    assertEquals(3, interpreter.cursor().line());
    assertEquals(new TraceValue.Int(0), local(waiting, "x"));

    console.provideInput("42\n");
    StepResult read = interpreter.step();
    assertEquals(ExecutionState.PAUSED, read.state());
    assertEquals(2, read.step());
    assertEquals(new TraceValue.Int(42), local(read, "x"));

    StepResult last = interpreter.run();
    assertEquals(42, last.exitCode());
    assertEquals("got 42\n", console.stdout());
  }

  @Test
  public void testClosedInputGivesEof() {
    SyntaxNode tree = program(main(1, block(1,
        ret(2, call(2, "getchar")))));
    BufferedConsole console = new BufferedConsole();
    console.closeInput();
    Interpreter interpreter = new Interpreter(EngineConfig.defaults(), console);
    interpreter.load(tree);
    assertEquals(IoCollaborator.EOF, interpreter.run().exitCode());
  }

  @Test
  public void testExit() {
    SyntaxNode tree = program(main(1, block(1,
        expr(2, call(2, "exit", num(2, 3))),
        ret(3, num(3, 0)))));
    Interpreter interpreter = loaded(tree);
    StepResult result = interpreter.step();
    assertEquals(ExecutionState.COMPLETED, result.state());
    assertEquals(3, result.exitCode());
  }

  /** Loading an earlier result and stepping again reaches the same end. */
  @Test
  public void testLoadSnapshotResumes() {
    Interpreter interpreter = loaded(countToFive());
    List<StepResult> results = runAll(interpreter);

    interpreter.loadSnapshot(results.get(3));
    assertEquals(ExecutionState.PAUSED, interpreter.state());
    assertEquals(4, interpreter.stepCount());
    assertEquals(new TraceValue.Int(1), interpreter.memory().lookup("i").value());
    assertEquals(results.get(3).cursor(), interpreter.cursor());

    List<StepResult> replay = runAll(interpreter);
    assertEquals(8, replay.size());
    StepResult last = replay.get(replay.size() - 1);
    assertEquals(new TraceValue.Int(5), local(last, "i"));
    assertEquals(results.get(11).memory().variables().size(), last.memory().variables().size());
  }

  @Test
  public void testEntryPointNotFound() {
    SyntaxNode tree = program(function(1, "int", "helper", List.of(), block(1, ret(2))));
    Interpreter interpreter = new Interpreter(EngineConfig.defaults());
    EngineException e = assertThrows(EngineException.class, () -> interpreter.load(tree));
    assertEquals(ErrorKind.ENTRY_POINT_NOT_FOUND, e.kind());
    assertEquals(ExecutionState.IDLE, interpreter.state());
  }

  @Test
  public void testCustomEntryPoint() {
    SyntaxNode tree = program(function(1, "int", "start", List.of(), block(1, ret(2, num(2, 6)))));
    Interpreter interpreter = new Interpreter(EngineConfig.defaults().withEntryPoint("start"));
    interpreter.load(tree);
    assertEquals(6, interpreter.run().exitCode());
  }

  @Test
  public void testStepWithoutProgram() {
    Interpreter interpreter = new Interpreter(EngineConfig.defaults());
    assertThrows(IllegalStateException.class, interpreter::step);
  }

  @Test
  public void testResetReturnsToIdle() {
    Interpreter interpreter = loaded(countToFive());
    interpreter.step();
    interpreter.reset();
    assertEquals(ExecutionState.IDLE, interpreter.state());
    assertEquals(0, interpreter.memory().depth());
    assertNull(interpreter.program());
  }

  @Test
  public void testEmptyMainCompletesInOneStep() {
    Interpreter interpreter = loaded(program(main(1, block(1))));
    StepResult result = interpreter.step();
    assertEquals(ExecutionState.COMPLETED, result.state());
    assertEquals(1, result.step());
  }

  @Test
  public void testBreakableLines() {
    Interpreter interpreter = loaded(countToFive());
    assertEquals(List.of(2, 3, 4), List.copyOf(interpreter.breakableLines()));
  }

  @Test
  public void testForWithoutClauses() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "n", num(2, 0)),
        forLoop(3, empty(3), empty(3), empty(3), block(3,
            expr(4, increment(4, "n")),
            ifElse(5, op(5, "==", id(5, "n"), num(5, 3)), breakStmt(5), null))),
        ret(7, id(7, "n")))));
    assertEquals(3, loaded(tree).run().exitCode());
  }

  // ---------------------------------------------------------------- structs and unions

  private static SyntaxNode point() {
    return struct(1, "point", field(1, "int", "x"), field(1, "int", "y"));
  }

  @Test
  public void testStructMembers() {
    SyntaxNode tree = program(point(), main(2, block(2,
        structVar(3, "point", "p", num(3, 3), num(3, 4)),
        expr(4, assign(4, "=", dot(4, id(4, "p"), "y"), op(4, "*", dot(4, id(4, "p"), "x"),
            num(4, 10)))),
        ret(5, op(5, "+", dot(5, id(5, "p"), "x"), dot(5, id(5, "p"), "y"))))));
    Interpreter interpreter = loaded(tree);
    List<StepResult> results = runAll(interpreter);
    StepResult last = results.get(results.size() - 1);
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(33, last.exitCode());
    assertEquals(new TraceValue.Array(List.of(new TraceValue.Int(3), new TraceValue.Int(30))),
        local(results.get(1), "p"));
  }

  /** A struct parameter is a copy; the callee's writes do not reach the caller. */
  @Test
  public void testStructPassedByValue() {
    SyntaxNode tree = program(point(),
        function(2, "int", "clear", List.of(SyntaxNode.of(NodeKind.PARAMETER, "q", 2,
            struct(2, "point"))), block(2,
            expr(3, assign(3, "=", dot(3, id(3, "q"), "x"), num(3, 0))),
            ret(4, dot(4, id(4, "q"), "y")))),
        main(6, block(6,
            structVar(7, "point", "p", num(7, 5), num(7, 6)),
            var(8, "int", "y", call(8, "clear", id(8, "p"))),
            ret(9, op(9, "+", dot(9, id(9, "p"), "x"), id(9, "y"))))));
    assertEquals(11, loaded(tree).run().exitCode());
  }

  @Test
  public void testLinkedListThroughArrow() {
    SyntaxNode tree = program(
        struct(1, "node", field(1, "int", "value"), structPointerField(1, "node", "next")),
        main(2, block(2,
            structPointerVar(3, "node", "head", call(3, "malloc", sizeOfStruct(3, "node"))),
            expr(4, assign(4, "=", arrow(4, id(4, "head"), "value"), num(4, 5))),
            expr(5, assign(5, "=", arrow(5, id(5, "head"), "next"),
                call(5, "malloc", sizeOfStruct(5, "node")))),
            expr(6, assign(6, "=", arrow(6, arrow(6, id(6, "head"), "next"), "value"),
                num(6, 6))),
            expr(7, assign(7, "=", arrow(7, arrow(7, id(7, "head"), "next"), "next"),
                id(7, "NULL"))),
            var(8, "int", "total", op(8, "+", arrow(8, id(8, "head"), "value"),
                arrow(8, arrow(8, id(8, "head"), "next"), "value"))),
            expr(9, call(9, "free", arrow(9, id(9, "head"), "next"))),
            expr(10, call(10, "free", id(10, "head"))),
            ret(11, id(11, "total")))));
    Interpreter interpreter = loaded(tree);
    StepResult last = interpreter.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(11, last.exitCode());
    assertTrue(interpreter.memory().detectLeaks().isEmpty());
    assertEquals(16, interpreter.memory().heapBlocks().get(0).size());
  }

  @Test
  public void testUnionMembersShareStorage() {
    SyntaxNode tree = program(
        aggregate(1, NodeKind.UNION_SPECIFIER, "word", field(1, "int", "i"), field(1, "char", "c")),
        main(2, block(2,
            SyntaxNode.of(NodeKind.VAR_DECL, "w", 3,
                aggregate(3, NodeKind.UNION_SPECIFIER, "word")),
            expr(4, assign(4, "=", dot(4, id(4, "w"), "i"), num(4, 321))),
            ret(5, dot(5, id(5, "w"), "c")))));
    assertEquals(65, loaded(tree).run().exitCode());
  }

  @Test
  public void testTypedefOfAnonymousStruct() {
    SyntaxNode tree = program(
        SyntaxNode.of(NodeKind.TYPEDEF_DECL, "pair", 1,
            struct(1, "", field(1, "int", "a"), arrayField(1, "char", "tag", 3))),
        main(2, block(2,
            var(3, "pair", "p", null),
            expr(4, assign(4, "=", index(4, dot(4, id(4, "p"), "tag"), num(4, 2)), num(4, 9))),
            ret(5, op(5, "+", sizeOf(5, "pair"), index(5, dot(5, id(5, "p"), "tag"),
                num(5, 2)))))));
    assertEquals(17, loaded(tree).run().exitCode());
  }

  @Test
  public void testUnknownMemberFails() {
    SyntaxNode tree = program(point(), main(2, block(2,
        structVar(3, "point", "p"),
        ret(4, dot(4, id(4, "p"), "z")))));
    StepResult last = loaded(tree).run();
    assertEquals(ExecutionState.FAILED, last.state());
    assertEquals(ErrorKind.UNSUPPORTED, last.diagnostic().orElseThrow().kind());
    assertTrue(last.diagnostic().orElseThrow().message().contains("'z'"));
  }

  @Test
  public void testStructRedefinitionRejected() {
    Interpreter interpreter = new Interpreter(EngineConfig.defaults());
    SyntaxNode tree = program(point(), point(), main(2, block(2)));
    EngineException e = assertThrows(EngineException.class, () -> interpreter.load(tree));
    assertTrue(e.getMessage().contains("struct point"));
  }
}
