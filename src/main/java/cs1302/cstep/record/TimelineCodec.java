package cs1302.cstep.record;

import cs1302.cstep.interp.ExecutionState;
import cs1302.cstep.serialize.StateJson;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads and writes the exported timeline document.
 *
 * <pre>
 * {"format": "c-stepper-timeline", "version": 1,
 *  "metadata": {...}, "breakpoints": [...], "markers": [...], "cursor": 3,
 *  "snapshots": [{"type": "full", ...}, {"type": "diff", ...}]}
 * </pre>
 *
 * <p>A {@code diff} snapshot holds only the fields that differ from the snapshot before it; its
 * {@code memory} object likewise holds only the memory sections that changed.
 */
final class TimelineCodec {

  static final String FORMAT = "c-stepper-timeline";
  static final int VERSION = 1;

  private static final List<String> ALWAYS = List.of("index", "step", "timestamp", "repeats");

  /** The contents of an imported document. */
  record Decoded(
      TimelineMetadata metadata,
      List<Breakpoint> breakpoints,
      List<Marker> markers,
      List<Snapshot> snapshots) {}

  private TimelineCodec() {}

  static JSONObject encode(ExecutionRecorder recorder, boolean compact) {
    JSONArray snapshots = new JSONArray();
    JSONObject previous = null;
    for (Snapshot snapshot : recorder.snapshots()) {
      JSONObject full = writeSnapshot(snapshot);
      snapshots.put(compact && previous != null ? diff(previous, full) : full.put("type", "full"));
      previous = full;
    } // for
    return new JSONObject()
        .put("format", FORMAT)
        .put("version", VERSION)
        .put("metadata", writeMetadata(recorder.metadata()))
        .put("breakpoints", new JSONArray(recorder.breakpoints().stream()
            .map(b -> new JSONObject()
                .put("line", b.line())
                .put("enabled", b.enabled())
                .put("hitCount", b.hitCount()))
            .toList()))
        .put("markers", new JSONArray(recorder.markers().stream()
            .map(m -> new JSONObject()
                .put("index", m.index())
                .put("label", m.label())
                .put("kind", m.kind().name()))
            .toList()))
        .put("cursor", recorder.cursor())
        .put("snapshots", snapshots);
  } // encode

  static Decoded decode(String document) throws TimelineFormatException {
    try {
      JSONObject json = new JSONObject(document);
      if (!FORMAT.equals(json.optString("format"))) {
        throw new TimelineFormatException("Not a timeline document: format is '"
            + json.optString("format") + "'");
      }
      int version = json.optInt("version", -1);
      if (version != VERSION) {
        throw new TimelineFormatException("Unsupported timeline version " + version);
      }

      List<Snapshot> snapshots = new ArrayList<>();
      JSONArray array = json.getJSONArray("snapshots");
      JSONObject previous = null;
      for (int i = 0; i < array.length(); i++) {
        JSONObject entry = array.getJSONObject(i);
        String type = entry.getString("type");
        JSONObject full;
        if (type.equals("full")) {
          full = entry;
        } else if (type.equals("diff")) {
          if (previous == null) {
            throw new TimelineFormatException("Snapshot " + i + " is a diff without a base");
          }
          full = apply(previous, entry);
        } else {
          throw new TimelineFormatException("Unknown snapshot type '" + type + "'");
        }
        snapshots.add(readSnapshot(full));
        previous = full;
      } // for

      List<Breakpoint> breakpoints = new ArrayList<>();
      JSONArray lines = json.getJSONArray("breakpoints");
      for (int i = 0; i < lines.length(); i++) {
        JSONObject b = lines.getJSONObject(i);
        Breakpoint breakpoint = new Breakpoint(b.getInt("line"));
        breakpoint.setEnabled(b.getBoolean("enabled"));
        breakpoint.setHitCount(b.getInt("hitCount"));
        breakpoints.add(breakpoint);
      } // for

      List<Marker> markers = new ArrayList<>();
      JSONArray marks = json.getJSONArray("markers");
      for (int i = 0; i < marks.length(); i++) {
        JSONObject m = marks.getJSONObject(i);
        int index = m.getInt("index");
        if (index < 0 || index >= snapshots.size()) {
          throw new TimelineFormatException("Marker index " + index + " is outside the timeline");
        }
        markers.add(new Marker(index, m.getString("label"),
            Marker.Kind.valueOf(m.getString("kind"))));
      } // for

      return new Decoded(readMetadata(json.getJSONObject("metadata")), breakpoints, markers,
          snapshots);
    } catch (JSONException | IllegalArgumentException | DateTimeException e) {
      throw new TimelineFormatException("Malformed timeline document: " + e.getMessage(), e);
    }
  } // decode

  private static JSONObject writeSnapshot(Snapshot snapshot) {
    return new JSONObject()
        .put("index", snapshot.index())
        .put("step", snapshot.step())
        .put("timestamp", snapshot.timestamp().toString())
        .put("repeats", snapshot.repeats())
        .put("cursor", StateJson.writeCursor(snapshot.cursor()))
        .put("state", snapshot.state().name())
        .put("memory", StateJson.writeMemory(snapshot.memory()))
        .put("control", StateJson.writeControl(snapshot.control()))
        .put("console", StateJson.writeConsole(snapshot.console()))
        .put("diagnostic", StateJson.writeDiagnostic(snapshot.diagnostic().orElse(null)))
        .put("exitCode", snapshot.exitCode());
  }

  private static Snapshot readSnapshot(JSONObject json) {
    return new Snapshot(
        json.getInt("index"),
        json.getLong("step"),
        StateJson.readCursor(json.opt("cursor")),
        ExecutionState.valueOf(json.getString("state")),
        StateJson.readMemory(json.getJSONObject("memory")),
        StateJson.readControl(json.getJSONObject("control")),
        StateJson.readConsole(json.getJSONObject("console")),
        Optional.ofNullable(StateJson.readDiagnostic(json.opt("diagnostic"))),
        json.getInt("exitCode"),
        Instant.parse(json.getString("timestamp")),
        json.getInt("repeats"));
  }

  private static JSONObject diff(JSONObject base, JSONObject full) {
    JSONObject diff = new JSONObject().put("type", "diff");
    for (String key : full.keySet()) {
      if (key.equals("type")) {
        continue;
      }
      Object value = full.get(key);
      if (ALWAYS.contains(key)) {
        diff.put(key, value);
      } else if (key.equals("memory")) {
        JSONObject memory = changed(base.getJSONObject("memory"), (JSONObject) value);
        if (!memory.isEmpty()) {
          diff.put(key, memory);
        }
      } else if (!same(base.opt(key), value)) {
        diff.put(key, value);
      }
    } // for
    return diff;
  } // diff

  private static JSONObject changed(JSONObject base, JSONObject full) {
    JSONObject changed = new JSONObject();
    for (String key : full.keySet()) {
      if (!same(base.opt(key), full.get(key))) {
        changed.put(key, full.get(key));
      }
    } // for
    return changed;
  }

  private static JSONObject apply(JSONObject base, JSONObject diff) {
    JSONObject full = copy(base);
    JSONObject memory = copy(base.getJSONObject("memory"));
    for (String key : diff.keySet()) {
      if (key.equals("memory")) {
        JSONObject changes = diff.getJSONObject(key);
        for (String section : changes.keySet()) {
          memory.put(section, changes.get(section));
        } // for
      } else {
        full.put(key, diff.get(key));
      }
    } // for
    full.put("memory", memory);
    return full;
  }

  private static JSONObject copy(JSONObject json) {
    return new JSONObject(json, JSONObject.getNames(json));
  }

  private static boolean same(Object a, Object b) {
    if (a instanceof JSONObject object) {
      return object.similar(b);
    } else if (a instanceof JSONArray array) {
      return array.similar(b);
    }
    return Objects.equals(a, b);
  }

  private static JSONObject writeMetadata(TimelineMetadata metadata) {
    return new JSONObject()
        .put("program", metadata.program())
        .put("startedAt", metadata.startedAt().toString())
        .put("firstStep", metadata.firstStep())
        .put("lastStep", metadata.lastStep())
        .put("exitCode", metadata.exitCode())
        .put("error", metadata.error())
        .put("errorMessage", metadata.errorMessage());
  }

  private static TimelineMetadata readMetadata(JSONObject json) {
    return new TimelineMetadata(
        json.getString("program"),
        Instant.parse(json.getString("startedAt")),
        json.getLong("firstStep"),
        json.getLong("lastStep"),
        json.getInt("exitCode"),
        json.getBoolean("error"),
        json.getString("errorMessage"));
  }
}
