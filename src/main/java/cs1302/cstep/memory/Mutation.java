package cs1302.cstep.memory;

import cs1302.cstep.trace.TraceValue;

/**
 * One entry of a variable's history.
 *
 * @param value The value the variable held after the write.
 * @param step The index of the step that performed the write.
 */
public record Mutation(TraceValue value, long step) {}
