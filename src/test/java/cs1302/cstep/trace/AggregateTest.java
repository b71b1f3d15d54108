package cs1302.cstep.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.cstep.EngineException;
import cs1302.cstep.memory.ByteCodec;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the layout of structs and unions. */
public class AggregateTest {

  private static Aggregate struct(String tag, Aggregate.Field... fields) {
    Aggregate aggregate = new Aggregate(Aggregate.Kind.STRUCT, tag);
    aggregate.define(List.of(fields));
    return aggregate;
  }

  @Test
  public void testStructPadding() {
    Aggregate mixed = struct("mixed",
        new Aggregate.Field("c", CType.CHAR),
        new Aggregate.Field("d", CType.DOUBLE),
        new Aggregate.Field("i", CType.INT));
    assertEquals(List.of(0, 8, 16),
        mixed.members().stream().map(Aggregate.Member::offset).toList());
    assertEquals(24, mixed.size());
    assertEquals(8, mixed.alignment());
    assertEquals(24, CType.of(mixed).size());
  }

  @Test
  public void testUnionSizeIsLargestMember() {
    Aggregate word = new Aggregate(Aggregate.Kind.UNION, "word");
    word.define(List.of(
        new Aggregate.Field("c", CType.CHAR),
        new Aggregate.Field("bytes", new CType("char", 0, List.of(5))),
        new Aggregate.Field("i", CType.INT)));
    assertTrue(word.members().stream().allMatch(m -> m.offset() == 0));
    assertEquals(8, word.size());
    assertEquals("union word", word.toString());
  }

  @Test
  public void testSelfReferenceThroughPointer() {
    Aggregate node = new Aggregate(Aggregate.Kind.STRUCT, "node");
    CType nodeType = CType.of(node);
    assertFalse(node.isComplete());
    node.define(List.of(
        new Aggregate.Field("value", CType.INT),
        new Aggregate.Field("next", nodeType.pointerTo())));
    assertEquals(16, node.size());
    assertEquals(node, node.member("next").orElseThrow().type().pointee().aggregate());
  }

  @Test
  public void testInvalidDefinitions() {
    Aggregate loop = new Aggregate(Aggregate.Kind.STRUCT, "loop");
    assertThrows(EngineException.class,
        () -> loop.define(List.of(new Aggregate.Field("self", CType.of(loop)))));
    assertThrows(EngineException.class, () -> struct("twice",
        new Aggregate.Field("a", CType.INT), new Aggregate.Field("a", CType.INT)));
    assertThrows(EngineException.class, () -> struct("none"));
    Aggregate pending = new Aggregate(Aggregate.Kind.STRUCT, "pending");
    assertThrows(EngineException.class, pending::size);
  }

  @Test
  public void testCoercePadsMissingMembers() {
    CType point = CType.of(struct("point",
        new Aggregate.Field("x", CType.INT),
        new Aggregate.Field("y", CType.DOUBLE)));
    TraceValue value = point.coerce(new TraceValue.Array(List.of(new TraceValue.Real(2.9))));
    assertEquals(new TraceValue.Array(List.of(new TraceValue.Int(2), new TraceValue.Real(0))),
        value);
  }

  @Test
  public void testParseAttachesLayout() {
    Aggregate node = struct("node", new Aggregate.Field("value", CType.INT));
    CType parsed = CType.parse("struct node*[2]", name -> name.equals("struct node") ? node : null);
    assertEquals(node, parsed.aggregate());
    assertEquals(List.of(2), parsed.dimensions());
    assertEquals(1, parsed.pointerDepth());
    assertEquals(CType.of(node).pointerTo().reshape(1, List.of(2)), parsed);
  }

  @Test
  public void testUnionEncodingKeepsFirstMember() {
    Aggregate number = new Aggregate(Aggregate.Kind.UNION, "number");
    number.define(List.of(
        new Aggregate.Field("small", CType.CHAR),
        new Aggregate.Field("wide", CType.LONG)));
    CType type = CType.of(number);
    TraceValue stored = type.coerce(new TraceValue.Array(List.of(new TraceValue.Int(65))));
    TraceValue decoded = ByteCodec.decode(type, ByteCodec.encode(type, stored), 0);
    assertEquals(new TraceValue.Array(List.of(new TraceValue.Int(65), new TraceValue.Int(65))),
        decoded);
  }
}
