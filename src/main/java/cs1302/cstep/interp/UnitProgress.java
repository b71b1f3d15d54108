package cs1302.cstep.interp;

import cs1302.cstep.trace.TraceValue;
import java.util.HashMap;
import java.util.Map;

/**
 * What a unit computed before it stepped into a user function. When the unit resumes, every
 * subexpression listed here yields its recorded result instead of being evaluated again, so
 * conditions and side effects that preceded the call are not repeated against the memory the
 * callee changed.
 *
 * @param values Results of completed expressions, by node id. Completed declarations map to
 *     {@link TraceValue.Void}.
 * @param locations Storage locations of completed assignable expressions, by node id.
 * @param pendingCall Node id of the call the unit waits for, or {@code -1}.
 */
public record UnitProgress(
    Map<Integer, TraceValue> values, Map<Integer, TraceValue.Address> locations, int pendingCall) {

  /** A unit that has not started. */
  public static final UnitProgress NONE = new UnitProgress(Map.of(), Map.of(), -1);

  public UnitProgress {
    values = Map.copyOf(values);
    locations = Map.copyOf(locations);
  }

  public boolean isEmpty() {
    return values.isEmpty() && locations.isEmpty() && pendingCall < 0;
  }

  /**
   * Record the value the pending call returned.
   *
   * @param result The returned value.
   * @return The progress of the unit after the call.
   * @throws IllegalStateException if no call is pending
   */
  public UnitProgress withResult(TraceValue result) {
    if (pendingCall < 0) {
      throw new IllegalStateException("No call is pending");
    }
    Map<Integer, TraceValue> more = new HashMap<>(values);
    more.put(pendingCall, result);
    return new UnitProgress(more, locations, -1);
  }
}
