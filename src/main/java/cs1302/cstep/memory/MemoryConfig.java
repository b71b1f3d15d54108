package cs1302.cstep.memory;

/**
 * Limits of the simulated address space.
 *
 * @param heapCapacity Maximum number of heap bytes in use at once.
 * @param frameSize The size budget of every stack frame, in bytes.
 * @param recursionLimit Maximum number of function frames on the stack.
 * @param operationLogCapacity Number of operations the log keeps; {@code 0} turns it off.
 */
public record MemoryConfig(
    long heapCapacity, int frameSize, int recursionLimit, int operationLogCapacity) {

  public static final long DEFAULT_HEAP_CAPACITY = 1_048_576L;
  public static final int DEFAULT_FRAME_SIZE = 65_536;
  public static final int DEFAULT_RECURSION_LIMIT = 1_000;
  public static final int DEFAULT_OPERATION_LOG_CAPACITY = 10_000;

  public MemoryConfig(long heapCapacity, int frameSize, int recursionLimit) {
    this(heapCapacity, frameSize, recursionLimit, DEFAULT_OPERATION_LOG_CAPACITY);
  }

  public MemoryConfig {
    if (operationLogCapacity < 0) {
      throw new IllegalArgumentException(
          "Operation log capacity must not be negative, got " + operationLogCapacity);
    }
    if (heapCapacity <= 0 || heapCapacity > Segment.HEAP.size()) {
      throw new IllegalArgumentException(
          String.format("Heap capacity must be in (0, %d], got %d", Segment.HEAP.size(),
              heapCapacity));
    }
    if (frameSize < 64 || frameSize % 8 != 0) {
      throw new IllegalArgumentException(
          "Frame size must be a multiple of 8 and at least 64 bytes, got " + frameSize);
    }
    if (recursionLimit < 1) {
      throw new IllegalArgumentException("Recursion limit must be positive, got " + recursionLimit);
    }
    if ((long) frameSize * (recursionLimit + 1) > Segment.STACK.size()) {
      throw new IllegalArgumentException(
          String.format("%d frames of %d bytes do not fit in the stack segment",
              recursionLimit + 1, frameSize));
    }
    for (Segment a : Segment.values()) {
      for (Segment b : Segment.values()) {
        if (a != b && a.overlaps(b)) {
          throw new IllegalStateException("Segments overlap: " + a + " and " + b);
        }
      } // for
    } // for
  }

  public static MemoryConfig defaults() {
    return new MemoryConfig(DEFAULT_HEAP_CAPACITY, DEFAULT_FRAME_SIZE, DEFAULT_RECURSION_LIMIT);
  }
}
