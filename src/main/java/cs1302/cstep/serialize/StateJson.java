package cs1302.cstep.serialize;

import cs1302.cstep.ErrorKind;
import cs1302.cstep.interp.ConsoleState;
import cs1302.cstep.interp.ControlState;
import cs1302.cstep.interp.ControlState.ActivationState;
import cs1302.cstep.interp.Cursor;
import cs1302.cstep.interp.Diagnostic;
import cs1302.cstep.interp.Phase;
import cs1302.cstep.interp.UnitProgress;
import cs1302.cstep.memory.Frame;
import cs1302.cstep.memory.MemoryState;
import cs1302.cstep.memory.MemoryState.ConstantState;
import cs1302.cstep.memory.MemoryState.Counters;
import cs1302.cstep.memory.MemoryState.FrameState;
import cs1302.cstep.memory.MemoryState.HeapBlockState;
import cs1302.cstep.memory.MemoryState.VariableState;
import cs1302.cstep.memory.Mutation;
import cs1302.cstep.memory.Variable;
import cs1302.cstep.trace.Aggregate;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.NodeKind;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Lossless JSON encoding of captured engine state: values, memory, control state, console and
 * diagnostics. Every {@code read} method accepts exactly what the matching {@code write} method
 * produces and throws {@link JSONException} for anything else.
 *
 * <p>Memory and control encodings each carry the layout of every {@code struct} and {@code union}
 * their types mention, under {@code "aggregates"}, so that either can be read on its own.
 */
public final class StateJson {

  private StateJson() {}

  // ---------------------------------------------------------------- values

  /**
   * Encode a value.
   *
   * @param value The value.
   * @return A tagged object, e.g. {@code {"kind":"int","value":5}}.
   */
  public static JSONObject writeValue(TraceValue value) {
    if (value instanceof TraceValue.Int i) {
      return new JSONObject().put("kind", "int").put("value", i.value());
    } else if (value instanceof TraceValue.Real r) {
      JSONObject json = new JSONObject().put("kind", "real");
      return Double.isFinite(r.value())
          ? json.put("value", r.value())
          : json.put("value", Double.toString(r.value()));
    } else if (value instanceof TraceValue.Address a) {
      return new JSONObject()
          .put("kind", "address")
          .put("value", a.value())
          .put("pointee", a.pointee().toString());
    } else if (value instanceof TraceValue.Array array) {
      return new JSONObject()
          .put("kind", "array")
          .put("elements", new JSONArray(array.elements().stream()
              .map(StateJson::writeValue)
              .toList()));
    }
    return new JSONObject().put("kind", "void");
  } // writeValue

  public static TraceValue readValue(JSONObject json) {
    return readValue(json, name -> null);
  }

  private static TraceValue readValue(JSONObject json, Function<String, Aggregate> types) {
    String kind = json.getString("kind");
    return switch (kind) {
      case "int" -> new TraceValue.Int(json.getLong("value"));
      case "real" -> json.get("value") instanceof String text
          ? new TraceValue.Real(Double.parseDouble(text))
          : new TraceValue.Real(json.getDouble("value"));
      case "address" ->
          new TraceValue.Address(json.getLong("value"),
              CType.parse(json.getString("pointee"), types));
      case "array" -> new TraceValue.Array(
          objects(json.getJSONArray("elements"), e -> readValue(e, types)));
      case "void" -> new TraceValue.Void();
      default -> throw new JSONException("Unknown value kind: " + kind);
    };
  }

  // ---------------------------------------------------------------- aggregates

  /**
   * Encode the layouts of the aggregates the given types and values mention, members before the
   * aggregates that contain them by value.
   */
  private static JSONArray writeAggregates(List<CType> types, List<TraceValue> values) {
    Set<Aggregate> ordered = new LinkedHashSet<>();
    Set<Aggregate> visiting = new HashSet<>();
    types.forEach(type -> collect(type, ordered, visiting));
    values.forEach(value -> collect(value, ordered, visiting));
    return new JSONArray(ordered.stream()
        .map(aggregate -> {
          JSONObject json = new JSONObject()
              .put("kind", aggregate.kind().name())
              .put("tag", aggregate.tag());
          if (aggregate.isComplete()) {
            json.put("members", new JSONArray(aggregate.fields().stream()
                .map(f -> new JSONObject().put("name", f.name()).put("type", f.type().toString()))
                .toList()));
          }
          return json;
        })
        .toList());
  } // writeAggregates

  private static void collect(CType type, Set<Aggregate> ordered, Set<Aggregate> visiting) {
    Aggregate aggregate = type.aggregate();
    if (aggregate == null || !visiting.add(aggregate)) {
      return;
    }
    List<CType> inner = aggregate.isComplete()
        ? aggregate.members().stream().map(Aggregate.Member::type).toList()
        : List.of();
    inner.stream().filter(t -> t.pointerDepth() == 0).forEach(t -> collect(t, ordered, visiting));
    ordered.add(aggregate);
    inner.stream().filter(t -> t.pointerDepth() > 0).forEach(t -> collect(t, ordered, visiting));
  }

  private static void collect(TraceValue value, Set<Aggregate> ordered, Set<Aggregate> visiting) {
    if (value instanceof TraceValue.Address address) {
      collect(address.pointee(), ordered, visiting);
    } else if (value instanceof TraceValue.Array array) {
      array.elements().forEach(element -> collect(element, ordered, visiting));
    }
  }

  /**
   * Rebuild encoded layouts.
   *
   * @param array The encoding, or {@code null}.
   * @return Finds an aggregate by base name, such as {@code "struct node"}.
   */
  private static Function<String, Aggregate> readAggregates(JSONArray array) {
    Map<String, Aggregate> byName = new HashMap<>();
    List<JSONObject> entries = array == null ? List.of() : objects(array, e -> e);
    List<Aggregate> created = new ArrayList<>();
    for (JSONObject entry : entries) {
      Aggregate aggregate = new Aggregate(Aggregate.Kind.valueOf(entry.getString("kind")),
          entry.getString("tag"));
      byName.put(aggregate.toString(), aggregate);
      created.add(aggregate);
    } // for
    for (int i = 0; i < entries.size(); i++) {
      JSONArray members = entries.get(i).optJSONArray("members");
      if (members != null) {
        created.get(i).define(objects(members, m -> new Aggregate.Field(m.getString("name"),
            CType.parse(m.getString("type"), byName::get))));
      }
    } // for
    return byName::get;
  } // readAggregates

  // ---------------------------------------------------------------- memory

  /**
   * Encode a memory capture. Variables are listed by id.
   *
   * @param state The capture.
   * @return The encoding.
   */
  public static JSONObject writeMemory(MemoryState state) {
    List<CType> types = new ArrayList<>();
    List<TraceValue> values = new ArrayList<>();
    for (VariableState variable : state.variables().values()) {
      types.add(variable.type());
      values.add(variable.value());
      variable.history().forEach(m -> values.add(m.value()));
    } // for
    state.frames().forEach(frame -> values.add(frame.returnValue()));
    return new JSONObject()
        .put("aggregates", writeAggregates(types, values))
        .put("frames", new JSONArray(state.frames().stream().map(StateJson::writeFrame).toList()))
        .put("variables", new JSONArray(state.variables().values().stream()
            .sorted(Comparator.comparingInt(VariableState::id))
            .map(StateJson::writeVariable)
            .toList()))
        .put("globals", new JSONArray(state.globals()))
        .put("statics", new JSONArray(state.statics()))
        .put("heap", new JSONArray(state.heap().stream().map(StateJson::writeBlock).toList()))
        .put("constants", new JSONArray(state.constants().stream()
            .map(c -> new JSONObject().put("address", c.address()).put("content", c.content()))
            .toList()))
        .put("counters", writeCounters(state.counters()));
  } // writeMemory

  public static MemoryState readMemory(JSONObject json) {
    Function<String, Aggregate> types = readAggregates(json.optJSONArray("aggregates"));
    Map<Integer, VariableState> variables = new HashMap<>();
    for (VariableState variable : objects(json.getJSONArray("variables"),
        v -> readVariable(v, types))) {
      variables.put(variable.id(), variable);
    } // for
    return new MemoryState(
        objects(json.getJSONArray("frames"), f -> readFrame(f, types)),
        variables,
        ints(json.getJSONArray("globals")),
        ints(json.getJSONArray("statics")),
        objects(json.getJSONArray("heap"), StateJson::readBlock),
        objects(json.getJSONArray("constants"), c ->
            new ConstantState(c.getLong("address"), c.getString("content"))),
        readCounters(json.getJSONObject("counters")));
  }

  private static JSONObject writeFrame(FrameState frame) {
    return new JSONObject()
        .put("id", frame.id())
        .put("functionName", frame.functionName())
        .put("scopeTag", frame.scopeTag())
        .put("base", frame.base())
        .put("sizeBudget", frame.sizeBudget())
        .put("stackPointer", frame.stackPointer())
        .put("locals", new JSONArray(frame.locals()))
        .put("parameters", new JSONArray(frame.parameters()))
        .put("returnValue", writeValue(frame.returnValue()))
        .put("returnLine", frame.returnLine())
        .put("callerFrameId", frame.callerFrameId())
        .put("scopes", new JSONArray(frame.scopes().stream()
            .map(s -> new JSONObject()
                .put("ownerId", s.ownerId())
                .put("localCount", s.localCount())
                .put("stackPointer", s.stackPointer()))
            .toList()));
  } // writeFrame

  private static FrameState readFrame(JSONObject json, Function<String, Aggregate> types) {
    return new FrameState(
        json.getInt("id"),
        json.getString("functionName"),
        json.getString("scopeTag"),
        json.getLong("base"),
        json.getInt("sizeBudget"),
        json.getLong("stackPointer"),
        ints(json.getJSONArray("locals")),
        ints(json.getJSONArray("parameters")),
        readValue(json.getJSONObject("returnValue"), types),
        json.getInt("returnLine"),
        json.getInt("callerFrameId"),
        objects(json.getJSONArray("scopes"), s -> new Frame.ScopeMark(s.getInt("ownerId"),
            s.getInt("localCount"), s.getLong("stackPointer"))));
  }

  private static JSONObject writeVariable(VariableState variable) {
    return new JSONObject()
        .put("id", variable.id())
        .put("name", variable.name())
        .put("type", variable.type().toString())
        .put("kind", variable.kind().name())
        .put("scope", variable.scope())
        .put("address", variable.address())
        .put("value", writeValue(variable.value()))
        .put("externOnly", variable.externOnly())
        .put("history", new JSONArray(variable.history().stream()
            .map(m -> new JSONObject().put("value", writeValue(m.value())).put("step", m.step()))
            .toList()));
  }

  private static VariableState readVariable(JSONObject json, Function<String, Aggregate> types) {
    return new VariableState(
        json.getInt("id"),
        json.getString("name"),
        CType.parse(json.getString("type"), types),
        Variable.Kind.valueOf(json.getString("kind")),
        json.getString("scope"),
        json.getLong("address"),
        readValue(json.getJSONObject("value"), types),
        json.getBoolean("externOnly"),
        objects(json.getJSONArray("history"), m ->
            new Mutation(readValue(m.getJSONObject("value"), types), m.getLong("step"))));
  }

  private static JSONObject writeBlock(HeapBlockState block) {
    return new JSONObject()
        .put("id", block.id())
        .put("address", block.address())
        .put("size", block.size())
        .put("alignedSize", block.alignedSize())
        .put("allocated", block.allocated())
        .put("allocStep", block.allocStep())
        .put("freeStep", block.freeStep())
        .put("origin", block.origin())
        .put("originLine", block.originLine())
        .put("data", Base64.getEncoder().encodeToString(block.data()));
  }

  private static HeapBlockState readBlock(JSONObject json) {
    return new HeapBlockState(
        json.getInt("id"),
        json.getLong("address"),
        json.getLong("size"),
        json.getLong("alignedSize"),
        json.getBoolean("allocated"),
        json.getLong("allocStep"),
        json.getLong("freeStep"),
        json.getString("origin"),
        json.getInt("originLine"),
        Base64.getDecoder().decode(json.getString("data")));
  }

  private static JSONObject writeCounters(Counters counters) {
    return new JSONObject()
        .put("nextHeapAddress", counters.nextHeapAddress())
        .put("globalsTop", counters.globalsTop())
        .put("staticsTop", counters.staticsTop())
        .put("nextFrameId", counters.nextFrameId())
        .put("nextVariableId", counters.nextVariableId())
        .put("nextBlockId", counters.nextBlockId());
  }

  private static Counters readCounters(JSONObject json) {
    return new Counters(
        json.getLong("nextHeapAddress"),
        json.getLong("globalsTop"),
        json.getLong("staticsTop"),
        json.getInt("nextFrameId"),
        json.getInt("nextVariableId"),
        json.getInt("nextBlockId"));
  }

  // ---------------------------------------------------------------- control

  public static JSONObject writeControl(ControlState control) {
    List<TraceValue> values = new ArrayList<>();
    for (ActivationState activation : control.activations()) {
      values.addAll(activation.progress().values().values());
      values.addAll(activation.progress().locations().values());
    } // for
    return new JSONObject()
        .put("aggregates", writeAggregates(List.of(), values))
        .put("randomState", control.randomState())
        .put("activations", new JSONArray(control.activations().stream()
            .map(a -> new JSONObject()
                .put("functionId", a.functionId())
                .put("frameId", a.frameId())
                .put("nodeId", a.nodeId())
                .put("phase", a.phase().name())
                .put("progress", writeProgress(a.progress())))
            .toList()));
  }

  public static ControlState readControl(JSONObject json) {
    Function<String, Aggregate> types = readAggregates(json.optJSONArray("aggregates"));
    return new ControlState(
        objects(json.getJSONArray("activations"), a -> new ActivationState(
            a.getInt("functionId"),
            a.getInt("frameId"),
            a.getInt("nodeId"),
            Phase.valueOf(a.getString("phase")),
            readProgress(a.getJSONObject("progress"), types))),
        json.getLong("randomState"));
  }

  private static JSONObject writeProgress(UnitProgress progress) {
    JSONObject values = new JSONObject();
    progress.values().forEach((id, value) -> values.put(id.toString(), writeValue(value)));
    JSONObject locations = new JSONObject();
    progress.locations().forEach((id, value) -> locations.put(id.toString(), writeValue(value)));
    return new JSONObject()
        .put("values", values)
        .put("locations", locations)
        .put("pendingCall", progress.pendingCall());
  }

  private static UnitProgress readProgress(JSONObject json, Function<String, Aggregate> types) {
    Map<Integer, TraceValue> values = new HashMap<>();
    JSONObject savedValues = json.getJSONObject("values");
    for (String id : savedValues.keySet()) {
      values.put(Integer.parseInt(id), readValue(savedValues.getJSONObject(id), types));
    } // for
    Map<Integer, TraceValue.Address> locations = new HashMap<>();
    JSONObject savedLocations = json.getJSONObject("locations");
    for (String id : savedLocations.keySet()) {
      TraceValue location = readValue(savedLocations.getJSONObject(id), types);
      if (!(location instanceof TraceValue.Address address)) {
        throw new JSONException("Location " + id + " is not an address");
      }
      locations.put(Integer.parseInt(id), address);
    } // for
    return new UnitProgress(values, locations, json.getInt("pendingCall"));
  }

  public static JSONObject writeConsole(ConsoleState console) {
    return new JSONObject()
        .put("stdout", console.stdout())
        .put("stderr", console.stderr())
        .put("inputPosition", console.inputPosition());
  }

  public static ConsoleState readConsole(JSONObject json) {
    return new ConsoleState(json.getString("stdout"), json.getString("stderr"),
        json.getInt("inputPosition"));
  }

  /**
   * Encode a cursor.
   *
   * @param cursor The cursor, possibly {@code null}.
   * @return The encoding, or {@link JSONObject#NULL}.
   */
  public static Object writeCursor(Cursor cursor) {
    if (cursor == null) {
      return JSONObject.NULL;
    }
    return new JSONObject()
        .put("line", cursor.line())
        .put("column", cursor.column())
        .put("kind", cursor.kind().name())
        .put("phase", cursor.phase().name());
  }

  public static Cursor readCursor(Object json) {
    if (!(json instanceof JSONObject object)) {
      return null;
    }
    return new Cursor(object.getInt("line"), object.getInt("column"),
        NodeKind.valueOf(object.getString("kind")), Phase.valueOf(object.getString("phase")));
  }

  public static Object writeDiagnostic(Diagnostic diagnostic) {
    if (diagnostic == null) {
      return JSONObject.NULL;
    }
    return new JSONObject()
        .put("kind", diagnostic.kind().name())
        .put("error", diagnostic.kind().displayName())
        .put("message", diagnostic.message())
        .put("cursor", writeCursor(diagnostic.cursor()))
        .put("frameId", diagnostic.frameId())
        .put("functionName", diagnostic.functionName())
        .put("step", diagnostic.step());
  }

  public static Diagnostic readDiagnostic(Object json) {
    if (!(json instanceof JSONObject object)) {
      return null;
    }
    return new Diagnostic(
        ErrorKind.valueOf(object.getString("kind")),
        object.getString("message"),
        readCursor(object.get("cursor")),
        object.getInt("frameId"),
        object.getString("functionName"),
        object.getLong("step"));
  }

  // ---------------------------------------------------------------- helpers

  private static List<Integer> ints(JSONArray array) {
    List<Integer> values = new ArrayList<>();
    for (int i = 0; i < array.length(); i++) {
      values.add(array.getInt(i));
    } // for
    return values;
  }

  private static <T> List<T> objects(JSONArray array, Function<JSONObject, T> reader) {
    List<T> values = new ArrayList<>();
    for (int i = 0; i < array.length(); i++) {
      values.add(reader.apply(array.getJSONObject(i)));
    } // for
    return values;
  }
}
