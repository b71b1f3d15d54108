package cs1302.cstep;

import static cs1302.cstep.tree.Trees.assign;
import static cs1302.cstep.tree.Trees.block;
import static cs1302.cstep.tree.Trees.call;
import static cs1302.cstep.tree.Trees.expr;
import static cs1302.cstep.tree.Trees.id;
import static cs1302.cstep.tree.Trees.main;
import static cs1302.cstep.tree.Trees.num;
import static cs1302.cstep.tree.Trees.op;
import static cs1302.cstep.tree.Trees.pointerVar;
import static cs1302.cstep.tree.Trees.program;
import static cs1302.cstep.tree.Trees.ret;
import static cs1302.cstep.tree.Trees.str;
import static cs1302.cstep.tree.Trees.unary;
import static cs1302.cstep.tree.Trees.var;
import static cs1302.cstep.tree.Trees.whileLoop;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.cstep.interp.ExecutionPoint;
import cs1302.cstep.interp.ExecutionState;
import cs1302.cstep.memory.AllocationInfo;
import cs1302.cstep.memory.MemoryOperation;
import cs1302.cstep.record.Snapshot;
import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.SyntaxNode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for stepping, rewinding and replaying a recorded run. */
public class DebugSessionTest {

  private DebugSession session;

  private static SyntaxNode countToFive() {
    return program(main(1, block(1,
        var(2, "int", "i", num(2, 0)),
        whileLoop(3, op(3, "<", id(3, "i"), num(3, 5)), block(3,
            expr(4, assign(4, "i", op(4, "+", id(4, "i"), num(4, 1)))))))));
  }

  @BeforeEach
  public void setUp() {
    session = new DebugSession(EngineConfig.defaults());
  }

  @Test
  public void testRunRecordsEveryStep() {
    session.load(countToFive(), "count.c");
    ExecutionPoint last = session.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(12, session.recorder().size());
    assertEquals("count.c", session.recorder().metadata().program());
  }

  /** A large block that is never written again is recorded once, not once per step. */
  @Test
  public void testUnwrittenBlockSharedAcrossRecording() {
    session.load(program(main(1, block(1,
        pointerVar(2, "char", "p", call(2, "malloc", num(2, 1_000_000))),
        var(3, "int", "i", num(3, 0)),
        whileLoop(4, op(4, "<", id(4, "i"), num(4, 3000)), block(4,
            expr(5, assign(5, "i", op(5, "+", id(5, "i"), num(5, 1)))))),
        ret(7, num(7, 0))))));
    ExecutionPoint last = session.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(1000, session.recorder().size());
    assertEquals(6004, last.step());
    Snapshot early = session.recorder().snapshot(1);
    assertSame(early.memory().heap().get(0), last.memory().heap().get(0));
    assertEquals(3001, last.memory().variables().values().stream()
        .filter(v -> v.name().equals("i"))
        .findFirst()
        .orElseThrow()
        .history()
        .size());
  }

  /** Stepping after a rewind replays the recording instead of executing. */
  @Test
  public void testStepAfterBackReplays() {
    session.load(countToFive());
    session.run();
    Snapshot recorded = session.recorder().snapshot(9);

    Snapshot back = session.back(3);
    assertEquals(8, back.index());
    assertEquals(back.step(), session.interpreter().stepCount());

    ExecutionPoint next = session.step();
    assertInstanceOf(Snapshot.class, next);
    assertEquals(9, ((Snapshot) next).index());
    assertEquals(recorded.memory(), next.memory());
    assertEquals(12, session.recorder().size());

    session.run();
    assertTrue(session.recorder().atTip());
    assertEquals(12, session.recorder().size());
    assertEquals(ExecutionState.COMPLETED, session.interpreter().state());
  }

  /** Executing from an earlier snapshot discards the recorded future and records a new one. */
  @Test
  public void testStepLiveDiverges() {
    session.load(countToFive());
    session.run();
    session.jump(5);

    ExecutionPoint live = session.stepLive();
    assertEquals(7, session.recorder().size());
    assertEquals(7, live.step());

    ExecutionPoint last = session.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(12, session.recorder().size());
    assertEquals(new TraceValue.Int(5), session.interpreter().memory().lookup("i").value());
  }

  @Test
  public void testForwardLoadsSnapshot() {
    session.load(countToFive());
    session.run();
    session.jump(0);
    Snapshot forward = session.forward(2);
    assertEquals(2, forward.index());
    assertEquals(forward.cursor(), session.interpreter().cursor());
  }

  @Test
  public void testContinueToBreakpoint() {
    session.recorder().addBreakpoint(4);
    session.load(countToFive());

    ExecutionPoint first = session.continueToBreakpoint();
    assertEquals(4, first.cursor().line());
    assertEquals(2, first.step());

    ExecutionPoint second = session.continueToBreakpoint();
    assertEquals(4, second.step());

    session.recorder().removeBreakpoint(4);
    assertEquals(ExecutionState.COMPLETED, session.continueToBreakpoint().state());
  }

  /** A step waiting for input is not recorded. */
  @Test
  public void testWaitsForInput() {
    SyntaxNode tree = program(main(1, block(1,
        var(2, "int", "x", num(2, 0)),
        expr(3, call(3, "scanf", str(3, "%d"), unary(3, "&", id(3, "x")))),
        ret(4, id(4, "x")))));
    session.load(tree);

    ExecutionPoint waiting = session.run();
    assertEquals(ExecutionState.SUSPENDED_FOR_INPUT, waiting.state());
    assertEquals(1, session.recorder().size());

    session.provideInput("5\n");
    ExecutionPoint last = session.run();
    assertEquals(ExecutionState.COMPLETED, last.state());
    assertEquals(5, last.exitCode());
    assertEquals(3, session.recorder().size());
  }

  @Test
  public void testLeaks() {
    SyntaxNode tree = program(main(1, block(1,
        pointerVar(2, "char", "p", call(2, "malloc", num(2, 16))),
        ret(3, num(3, 0)))));
    session.load(tree);
    session.run();

    List<AllocationInfo> leaks = session.leaks();
    assertEquals(1, leaks.size());
    assertEquals(16, leaks.get(0).size());
    assertEquals(2, leaks.get(0).line());
    assertEquals(List.of(2, 3), List.copyOf(session.breakableLines()));
  }

  @Test
  public void testOperationsFollowTheRun() {
    session.load(program(main(1, block(1,
        pointerVar(2, "char", "p", call(2, "malloc", num(2, 16))),
        ret(3, num(3, 0))))));
    session.run();

    List<MemoryOperation> allocations = session.operations(100, "ALLOC");
    assertEquals(1, allocations.size());
    assertEquals(MemoryOperation.Type.ALLOCATE, allocations.get(0).type());
    assertTrue(allocations.get(0).detail().startsWith("16 bytes"));
    assertEquals(MemoryOperation.Type.PUSH_FRAME,
        session.operations(1, "push").get(0).type());

    session.clearOperations();
    assertEquals(List.of(), session.operations(100, null));
  }
}
