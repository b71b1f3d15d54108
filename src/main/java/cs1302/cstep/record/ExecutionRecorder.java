package cs1302.cstep.record;

import cs1302.cstep.EngineConfig;
import cs1302.cstep.interp.ExecutionPoint;
import cs1302.cstep.interp.ExecutionState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A linear, bounded history of the snapshots of one run with a read cursor for time travel.
 *
 * <p>Recording while the cursor is behind the tip first discards every snapshot after the cursor;
 * the timeline never branches. A failed step is recorded as a terminal snapshot carrying the
 * diagnostic, after which nothing can be appended until the read cursor moves back from the
 * failure or the next {@link #start}.
 */
public class ExecutionRecorder {

  private static final Logger logger = LogManager.getLogger(ExecutionRecorder.class);

  private final int capacity;
  private final boolean compression;
  private final List<Snapshot> timeline = new ArrayList<>();
  private final Map<Integer, Breakpoint> breakpoints = new TreeMap<>();
  private final List<Marker> markers = new ArrayList<>();
  private final List<BreakpointListener> listeners = new ArrayList<>();
  private TimelineMetadata metadata = TimelineMetadata.start("");
  private int cursor = -1;
  private boolean frozen;

  /**
   * Create a recorder.
   *
   * @param capacity The largest number of snapshots kept; older ones are evicted.
   * @param compression Whether identical consecutive snapshots are collapsed.
   */
  public ExecutionRecorder(int capacity, boolean compression) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.compression = compression;
  }

  public ExecutionRecorder(EngineConfig config) {
    this(config.historyCapacity(), config.compression());
  }

  /**
   * Clear the timeline and markers for a new run. Breakpoints are kept.
   *
   * @param runMetadata Facts about the run.
   */
  public void start(TimelineMetadata runMetadata) {
    timeline.clear();
    markers.clear();
    cursor = -1;
    frozen = false;
    metadata = runMetadata;
    breakpoints.values().forEach(b -> b.setHitCount(0));
    logger.debug("Recording started for '{}'", runMetadata.program());
  }

  /**
   * Append the snapshot of a step.
   *
   * @param point The outcome of the step.
   * @return The timeline index of the snapshot.
   * @throws IllegalStateException if the read cursor is at a failed tip
   */
  public int record(ExecutionPoint point) {
    if (cursor < timeline.size() - 1) {
      int keep = cursor + 1;
      logger.debug("Discarding {} snapshot(s) after index {}", timeline.size() - keep, cursor);
      timeline.subList(keep, timeline.size()).clear();
      markers.removeIf(m -> m.index() >= keep);
      frozen = false;
    }
    if (frozen) {
      throw new IllegalStateException("The timeline ended with a failure at index " + cursor);
    }

    Snapshot snapshot = Snapshot.of(timeline.size(), point, Instant.now());
    if (compression && !timeline.isEmpty()) {
      Snapshot last = timeline.get(timeline.size() - 1);
      if (last.sameState(snapshot)) {
        timeline.set(timeline.size() - 1, last.withRepeats(last.repeats() + 1));
        cursor = timeline.size() - 1;
        return cursor;
      }
    }
    timeline.add(snapshot);
    if (timeline.size() > capacity) {
      evictOldest();
      snapshot = timeline.get(timeline.size() - 1);
    }
    cursor = timeline.size() - 1;
    metadata = metadata.withSteps(timeline.get(0).step(), snapshot.step());

    if (snapshot.state() == ExecutionState.FAILED) {
      String message = snapshot.diagnostic().map(Object::toString).orElse("failed");
      markers.add(new Marker(cursor, message, Marker.Kind.FAILED));
      finish(snapshot);
      frozen = true;
    } else if (snapshot.state() == ExecutionState.COMPLETED) {
      markers.add(new Marker(cursor, "exit " + snapshot.exitCode(), Marker.Kind.COMPLETED));
      finish(snapshot);
    }
    checkBreakpoints(snapshot);
    return cursor;
  } // record

  private void evictOldest() {
    timeline.remove(0);
    for (int i = 0; i < timeline.size(); i++) {
      timeline.set(i, timeline.get(i).withIndex(i));
    } // for
    List<Marker> shifted = new ArrayList<>();
    for (Marker marker : markers) {
      if (marker.index() > 0) {
        shifted.add(marker.shift(1));
      } // if
    } // for
    markers.clear();
    markers.addAll(shifted);
  }

  private void checkBreakpoints(Snapshot snapshot) {
    Breakpoint breakpoint = breakpoints.get(snapshot.line());
    if (breakpoint == null || !breakpoint.enabled()) {
      return;
    }
    breakpoint.hit();
    logger.debug("Breakpoint hit: {} at index {}", breakpoint, snapshot.index());
    for (BreakpointListener listener : List.copyOf(listeners)) {
      listener.breakpointHit(breakpoint, snapshot);
    } // for
  }

  /**
   * Store the outcome of the run in the metadata.
   *
   * @param last The last moment of the run.
   */
  public void finish(ExecutionPoint last) {
    metadata = metadata.withOutcome(last.exitCode(), last.state() == ExecutionState.FAILED,
        last.diagnostic().map(d -> d.message()).orElse(""));
    logger.info("Recorded {} snapshot(s), run {}", timeline.size(),
        metadata.error() ? "failed: " + metadata.errorMessage() : "exited " + last.exitCode());
  }

  // ---------------------------------------------------------------- navigation

  /**
   * Move the read cursor back.
   *
   * @param n The number of snapshots to move; the cursor stops at the oldest snapshot.
   * @return The snapshot at the cursor.
   */
  public Snapshot stepBack(int n) {
    requireSnapshots(n);
    cursor = Math.max(0, cursor - n);
    return current();
  }

  /**
   * Move the read cursor forward.
   *
   * @param n The number of snapshots to move; the cursor stops at the tip.
   * @return The snapshot at the cursor.
   */
  public Snapshot stepForward(int n) {
    requireSnapshots(n);
    cursor = Math.min(timeline.size() - 1, cursor + n);
    return current();
  }

  /**
   * Move the read cursor to a timeline index.
   *
   * @param index The index.
   * @return The snapshot at the index.
   * @throws IllegalArgumentException if the index is outside the timeline
   */
  public Snapshot goTo(int index) {
    if (index < 0 || index >= timeline.size()) {
      throw new IllegalArgumentException(
          String.format("Index %d is outside the timeline [0, %d)", index, timeline.size()));
    }
    cursor = index;
    return current();
  }

  private void requireSnapshots(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("Cannot move a negative distance: " + n);
    }
    if (timeline.isEmpty()) {
      throw new IllegalStateException("The timeline is empty");
    }
  }

  /**
   * The snapshot at the read cursor.
   *
   * @return The snapshot.
   * @throws IllegalStateException if the timeline is empty
   */
  public Snapshot current() {
    if (timeline.isEmpty()) {
      throw new IllegalStateException("The timeline is empty");
    }
    return timeline.get(cursor);
  }

  /** The read cursor, {@code -1} for an empty timeline. */
  public int cursor() {
    return cursor;
  }

  public boolean atTip() {
    return cursor == timeline.size() - 1;
  }

  /**
   * Returns {@code true} if a new step would extend the timeline without discarding anything:
   * the cursor is at the tip and the run has not failed.
   *
   * @return whether recording is enabled
   */
  public boolean isRecording() {
    return !frozen && atTip();
  }

  public boolean isFrozen() {
    return frozen;
  }

  public int size() {
    return timeline.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean compression() {
    return compression;
  }

  public Snapshot snapshot(int index) {
    return timeline.get(index);
  }

  public List<Snapshot> snapshots() {
    return Collections.unmodifiableList(timeline);
  }

  public TimelineMetadata metadata() {
    return metadata;
  }

  // ---------------------------------------------------------------- breakpoints

  /**
   * Add (or re-enable) a breakpoint.
   *
   * @param line The source line.
   * @return The breakpoint.
   */
  public Breakpoint addBreakpoint(int line) {
    Breakpoint breakpoint = breakpoints.computeIfAbsent(line, Breakpoint::new);
    breakpoint.setEnabled(true);
    return breakpoint;
  }

  /**
   * Remove a breakpoint.
   *
   * @param line The source line.
   * @return {@code true} if there was a breakpoint on the line.
   */
  public boolean removeBreakpoint(int line) {
    return breakpoints.remove(line) != null;
  }

  /**
   * Enable or disable a breakpoint without removing it.
   *
   * @param line The source line.
   * @param enabled The new state.
   * @throws IllegalArgumentException if there is no breakpoint on the line
   */
  public void setBreakpointEnabled(int line, boolean enabled) {
    Breakpoint breakpoint = breakpoints.get(line);
    if (breakpoint == null) {
      throw new IllegalArgumentException("No breakpoint on line " + line);
    }
    breakpoint.setEnabled(enabled);
  }

  /** Breakpoints in line order. */
  public List<Breakpoint> breakpoints() {
    return List.copyOf(breakpoints.values());
  }

  /**
   * The enabled breakpoint on a line.
   *
   * @param line The source line.
   * @return The breakpoint, if one is set and enabled.
   */
  public Optional<Breakpoint> activeBreakpoint(int line) {
    return Optional.ofNullable(breakpoints.get(line)).filter(Breakpoint::enabled);
  }

  public void addBreakpointListener(BreakpointListener listener) {
    listeners.add(listener);
  }

  public void removeBreakpointListener(BreakpointListener listener) {
    listeners.remove(listener);
  }

  // ---------------------------------------------------------------- markers

  /**
   * Bookmark the snapshot at the read cursor.
   *
   * @param label A description.
   * @return The marker.
   */
  public Marker addMarker(String label) {
    current();
    Marker marker = new Marker(cursor, label, Marker.Kind.USER);
    markers.add(marker);
    return marker;
  }

  public List<Marker> markers() {
    return List.copyOf(markers);
  }

  // ---------------------------------------------------------------- export

  /**
   * Serialize the timeline, breakpoints, markers and metadata.
   *
   * @param compact {@code true} to store each snapshot after the first as a diff.
   * @return The JSON document.
   */
  public String exportTimeline(boolean compact) {
    String document = TimelineCodec.encode(this, compact).toString();
    logger.info("Exported {} snapshot(s) ({})", timeline.size(), compact ? "compact" : "full");
    return document;
  }

  /**
   * Replace the timeline with an exported one. The cursor is placed at the tip.
   *
   * @param document A document produced by {@link #exportTimeline(boolean)}.
   * @throws TimelineFormatException if the document is malformed, has an unknown version, or holds
   *     more snapshots than this recorder's capacity
   */
  public void importTimeline(String document) throws TimelineFormatException {
    TimelineCodec.Decoded decoded = TimelineCodec.decode(document);
    if (decoded.snapshots().size() > capacity) {
      throw new TimelineFormatException(String.format(
          "Timeline holds %d snapshots, capacity is %d", decoded.snapshots().size(), capacity));
    }
    timeline.clear();
    timeline.addAll(decoded.snapshots());
    markers.clear();
    markers.addAll(decoded.markers());
    breakpoints.clear();
    decoded.breakpoints().forEach(b -> breakpoints.put(b.line(), b));
    metadata = decoded.metadata();
    cursor = timeline.size() - 1;
    frozen = !timeline.isEmpty()
        && timeline.get(timeline.size() - 1).state() == ExecutionState.FAILED;
    logger.info("Imported {} snapshot(s)", timeline.size());
  }
}
