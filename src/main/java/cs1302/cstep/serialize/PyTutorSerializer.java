package cs1302.cstep.serialize;

import cs1302.cstep.interp.ExecutionPoint;
import cs1302.cstep.interp.ExecutionState;
import cs1302.cstep.memory.ByteCodec;
import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.memory.MemoryState;
import cs1302.cstep.memory.MemoryState.ConstantState;
import cs1302.cstep.memory.MemoryState.FrameState;
import cs1302.cstep.memory.MemoryState.HeapBlockState;
import cs1302.cstep.memory.MemoryState.VariableState;
import cs1302.cstep.memory.Variable;
import cs1302.cstep.trace.Aggregate;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Container class for methods that help serialize a run into the OnlinePythonTutor trace format.
 *
 * @param inlineStrings True if {@code char} arrays and pointers to string literals should be
 *     serialized as string literals, otherwise they are serialized as lists of characters and
 *     pointers.
 * @param includeFreedBlocks True if freed heap blocks should still be listed in the heap.
 */
public record PyTutorSerializer(boolean inlineStrings, boolean includeFreedBlocks) {

  private static final CType BYTE = new CType("unsigned char", 0, List.of());

  /** Heap addresses and literals that pointers are resolved against. */
  private record Targets(Map<Long, HeapBlockState> blocks, Map<Long, String> literals) {}

  /**
   * Serialize a whole run into the OnlinePythonTutor trace format.
   *
   * @param source The source code of the program, or the empty string.
   * @param stdin The input given to the program.
   * @param points The moments of the run that should become trace entries.
   * @return The serialized trace.
   */
  public JSONObject serialize(String source, String stdin, List<? extends ExecutionPoint> points) {
    JSONArray trace = new JSONArray();
    for (ExecutionPoint point : points) {
      trace.put(serializeStep(point));
    } // for
    return new JSONObject()
        .put("code", source)
        .put("stdin", stdin)
        .put("trace", trace)
        .put("userlog", "");
  }

  /**
   * Serialize one moment of a run into an OnlinePythonTutor trace entry.
   *
   * @param point The moment that should be serialized.
   * @return The serialized trace entry.
   */
  public JSONObject serializeStep(ExecutionPoint point) {
    MemoryState memory = point.memory();
    Targets targets = targets(memory);

    List<FrameState> frames = memory.frames();
    FrameState top = frames.get(frames.size() - 1);
    int line = point.cursor() != null
        ? point.cursor().line()
        : point.diagnostic().map(d -> d.cursor() == null ? 0 : d.cursor().line()).orElse(0);

    JSONObject globals = new JSONObject();
    JSONObject globalsAttrs = new JSONObject();
    JSONArray orderedGlobals = new JSONArray();
    List<Integer> fileScope = new ArrayList<>(memory.globals());
    fileScope.addAll(memory.statics());
    for (int id : fileScope) {
      VariableState variable = memory.variable(id);
      String name = variable.kind() == Variable.Kind.STATIC
          && !variable.scope().equals(MemoryModel.GLOBAL_SCOPE)
          ? variable.scope() + "." + variable.name()
          : variable.name();
      globals.put(name, serializeTraceValue(variable.value(), variable.type(), targets));
      globalsAttrs.put(name, attributes(variable));
      orderedGlobals.put(name);
    } // for

    JSONArray stackToRender = new JSONArray();
    for (int i = 1; i < frames.size(); i++) {
      stackToRender.put(serializeFrame(memory, frames.get(i), frames.get(i) == top, targets));
    } // for

    JSONObject heap = new JSONObject();
    JSONObject heapAttrs = new JSONObject();
    for (HeapBlockState block : memory.heap()) {
      if (!block.allocated() && !includeFreedBlocks) {
        continue;
      }
      CType element = blockElementType(memory, block);
      String key = Long.toString(block.address());
      heap.put(key, serializeBlock(block, element, targets));
      heapAttrs.put(key, new JSONObject()
          .put("type", element.toString())
          .put("size", block.size())
          .put("origin", String.format("%s:%d", block.origin(), block.originLine()))
          .put("freed", !block.allocated()));
    } // for

    JSONObject entry = new JSONObject()
        .put("stdout", point.console().stdout())
        .put("stderr", point.console().stderr())
        .put("event", point.state() == ExecutionState.FAILED ? "exception" : "step_line")
        .put("func_name", top.functionName())
        .put("line", line)
        .put("stack_to_render", stackToRender)
        .put("globals", globals)
        .put("globals_attrs", globalsAttrs)
        .put("ordered_globals", orderedGlobals)
        .put("heap", heap)
        .put("heap_attrs", heapAttrs);
    point.diagnostic().ifPresent(d -> entry.put("exception_msg",
        String.format("%s: %s", d.kind().displayName(), d.message())));
    if (point.state() == ExecutionState.COMPLETED) {
      entry.put("exit_code", point.exitCode());
    }
    return entry;
  } // serializeStep

  /**
   * Serialize a frame into the OnlinePythonTutor stack frame format. Parameters come first, then
   * the locals in declaration order; a shadowed name is suffixed with the variable id.
   */
  private JSONObject serializeFrame(MemoryState memory, FrameState frame, boolean isCurrentFrame,
      Targets targets) {
    Map<String, Object> encodedLocals = new LinkedHashMap<>();
    Map<String, JSONObject> localsAttrs = new HashMap<>();
    JSONArray orderedVarnames = new JSONArray();

    List<Integer> visible = new ArrayList<>(frame.parameters());
    visible.addAll(frame.locals());
    for (int id : visible) {
      VariableState variable = memory.variable(id);
      String name = encodedLocals.containsKey(variable.name())
          ? variable.name() + "#" + variable.id()
          : variable.name();
      encodedLocals.put(name, serializeTraceValue(variable.value(), variable.type(), targets));
      localsAttrs.put(name, attributes(variable));
      orderedVarnames.put(name);
    } // for

    String funcName = String.format("%s:%d", frame.functionName(), frame.returnLine());

    return new JSONObject()
        .put("func_name", funcName)
        .put("encoded_locals", new JSONObject(encodedLocals))
        .put("locals_attrs", new JSONObject(localsAttrs))
        .put("ordered_varnames", orderedVarnames)
        .put("parent_frame_id_list", new JSONArray())
        .put("is_highlighted", isCurrentFrame)
        .put("is_zombie", false)
        .put("is_parent", false)
        .put("unique_hash", String.valueOf(frame.id()))
        .put("frame_id", frame.id());
  } // serializeFrame

  private static JSONObject attributes(VariableState variable) {
    return new JSONObject()
        .put("type", variable.type().toString())
        .put("address", String.format("0x%08x", variable.address()));
  }

  private Object serializeBlock(HeapBlockState block, CType element, Targets targets) {
    byte[] data = block.data();
    int count = (int) (block.size() / element.size());
    List<TraceValue> elements = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      elements.add(ByteCodec.decode(element, data, i * element.size()));
    } // for
    List<Integer> dimensions = new ArrayList<>(List.of(count));
    dimensions.addAll(element.dimensions());
    return serializeTraceValue(new TraceValue.Array(elements),
        element.reshape(element.pointerDepth(), dimensions), targets);
  }

  /**
   * Serialize a TraceValue into a Boolean, Double, Long, String, JSONArray, or the JSONObject.NULL
   * object.
   *
   * @param value The value to serialize.
   * @param type The declared type of the value.
   * @param targets Heap blocks and literals that pointers may refer to.
   * @return The serialization.
   */
  private Object serializeTraceValue(TraceValue value, CType type, Targets targets) {
    if (value instanceof TraceValue.Real realValue) {
      double d = realValue.value();
      if (d == Double.POSITIVE_INFINITY) {
        return new JSONArray().put("SPECIAL_FLOAT").put("Infinity");
      } else if (d == Double.NEGATIVE_INFINITY) {
        return new JSONArray().put("SPECIAL_FLOAT").put("-Infinity");
      } else if (Double.isNaN(d)) {
        return new JSONArray().put("SPECIAL_FLOAT").put("NaN");
      }
      return new JSONArray().put("NUMBER-LITERAL").put(Double.toString(d));
    } else if (value instanceof TraceValue.Int intValue) {
      if (type.isBool()) {
        return intValue.value() != 0;
      } else if (type.base().equals("char") && type.pointerDepth() == 0 && !type.isArray()) {
        return new JSONArray().put("CHAR-LITERAL")
            .put(Character.toString((char) (intValue.value() & 0xFF)));
      }
      return intValue.value();
    } else if (value instanceof TraceValue.Address address) {
      if (address.isNull()) {
        return JSONObject.NULL;
      } else if (targets.blocks().containsKey(address.value())) {
        return new JSONArray().put("REF").put(address.value());
      } else if (inlineStrings && targets.literals().containsKey(address.value())) {
        return targets.literals().get(address.value());
      }
      return new JSONArray().put("POINTER").put(String.format("0x%08x", address.value()));
    } else if (value instanceof TraceValue.Array arrayValue && type.isAggregate()) {
      JSONArray instance = new JSONArray().put("INSTANCE").put(type.toString());
      List<Aggregate.Member> members = type.aggregate().members();
      for (int i = 0; i < members.size(); i++) {
        instance.put(new JSONArray()
            .put(members.get(i).name())
            .put(serializeTraceValue(arrayValue.elements().get(i), members.get(i).type(),
                targets)));
      } // for
      return instance;
    } else if (value instanceof TraceValue.Array arrayValue) {
      CType element = type.isArray() ? type.elementType() : type;
      if (inlineStrings && element.base().equals("char") && element.pointerDepth() == 0
          && !element.isArray()) {
        return arrayValue.elements().stream()
            .mapToLong(TraceValue::asLong)
            .takeWhile(c -> c != 0)
            .mapToObj(c -> Character.toString((char) (c & 0xFF)))
            .collect(Collectors.joining());
      }
      JSONArray list = new JSONArray().put("LIST");
      for (TraceValue e : arrayValue.elements()) {
        list.put(serializeTraceValue(e, element, targets));
      } // for
      return list;
    }
    return JSONObject.NULL;
  } // serializeTraceValue

  private Targets targets(MemoryState memory) {
    Map<Long, HeapBlockState> blocks = new HashMap<>();
    for (HeapBlockState block : memory.heap()) {
      if (block.allocated() || includeFreedBlocks) {
        blocks.put(block.address(), block);
      }
    } // for
    Map<Long, String> literals = new HashMap<>();
    for (ConstantState constant : memory.constants()) {
      literals.put(constant.address(), constant.content());
    } // for
    return new Targets(blocks, literals);
  }

  /**
   * The type a heap block is shown as: the pointee of the first variable pointing at the start of
   * the block, or raw bytes when no typed pointer refers to it.
   */
  private static CType blockElementType(MemoryState memory, HeapBlockState block) {
    List<VariableState> byId = memory.variables().values().stream()
        .sorted(Comparator.comparingInt(VariableState::id))
        .toList();
    for (VariableState variable : byId) {
      if (variable.value() instanceof TraceValue.Address address
          && address.value() == block.address()) {
        CType pointee = address.pointee();
        if (!pointee.isVoid() && pointee.size() > 0 && block.size() % pointee.size() == 0) {
          return pointee;
        }
      }
    } // for
    return BYTE;
  }
}
