package cs1302.cstep.record;

/**
 * A labelled position in the timeline.
 *
 * @param index The timeline position.
 * @param label A description.
 * @param kind Who placed the marker.
 */
public record Marker(int index, String label, Kind kind) {

  /** Origin of a marker. */
  public enum Kind {
    /** Placed with {@link ExecutionRecorder#addMarker(String)}. */
    USER,
    /** The run completed at this snapshot. */
    COMPLETED,
    /** The run failed at this snapshot. */
    FAILED
  }

  Marker shift(int by) {
    return new Marker(index - by, label, kind);
  }
}
