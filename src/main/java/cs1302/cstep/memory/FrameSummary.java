package cs1302.cstep.memory;

import cs1302.cstep.trace.TraceValue;

/**
 * What remains of a frame after it is popped.
 *
 * @param frameId The id of the popped frame.
 * @param functionName The function the frame belonged to.
 * @param returnValue The value returned by the call.
 * @param returnLine The caller's line that made the call.
 * @param callerFrameId The id of the frame that is now on top.
 * @param variableCount The number of parameters and locals that were released.
 */
public record FrameSummary(
    int frameId,
    String functionName,
    TraceValue returnValue,
    int returnLine,
    int callerFrameId,
    int variableCount) {}
