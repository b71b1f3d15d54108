package cs1302.cstep;

import cs1302.cstep.memory.MemoryConfig;

/**
 * Settings of one engine instance.
 *
 * @param heapCapacity Largest number of heap bytes in use at once.
 * @param frameSize Size budget of every stack frame, in bytes.
 * @param recursionLimit Largest number of nested calls.
 * @param historyCapacity Largest number of snapshots the recorder keeps.
 * @param compression Whether identical consecutive snapshots are collapsed.
 * @param entryPoint Name of the function a run starts in.
 * @param randomSeed Initial state of {@code rand}.
 */
public record EngineConfig(
    long heapCapacity,
    int frameSize,
    int recursionLimit,
    int historyCapacity,
    boolean compression,
    String entryPoint,
    long randomSeed) {

  public EngineConfig {
    if (historyCapacity < 1) {
      throw new IllegalArgumentException("historyCapacity must be positive: " + historyCapacity);
    }
    if (entryPoint == null || entryPoint.isBlank()) {
      throw new IllegalArgumentException("entryPoint must not be blank");
    }
  }

  public static EngineConfig defaults() {
    return new EngineConfig(1_048_576, 65_536, 1000, 1000, false, "main", 1);
  }

  public EngineConfig withHeapCapacity(long bytes) {
    return new EngineConfig(bytes, frameSize, recursionLimit, historyCapacity, compression,
        entryPoint, randomSeed);
  }

  public EngineConfig withFrameSize(int bytes) {
    return new EngineConfig(heapCapacity, bytes, recursionLimit, historyCapacity, compression,
        entryPoint, randomSeed);
  }

  public EngineConfig withRecursionLimit(int limit) {
    return new EngineConfig(heapCapacity, frameSize, limit, historyCapacity, compression,
        entryPoint, randomSeed);
  }

  public EngineConfig withHistoryCapacity(int capacity) {
    return new EngineConfig(heapCapacity, frameSize, recursionLimit, capacity, compression,
        entryPoint, randomSeed);
  }

  public EngineConfig withCompression(boolean enabled) {
    return new EngineConfig(heapCapacity, frameSize, recursionLimit, historyCapacity, enabled,
        entryPoint, randomSeed);
  }

  public EngineConfig withEntryPoint(String name) {
    return new EngineConfig(heapCapacity, frameSize, recursionLimit, historyCapacity, compression,
        name, randomSeed);
  }

  public EngineConfig withRandomSeed(long seed) {
    return new EngineConfig(heapCapacity, frameSize, recursionLimit, historyCapacity, compression,
        entryPoint, seed);
  }

  /** The limits of the Memory Model. */
  public MemoryConfig memory() {
    return new MemoryConfig(heapCapacity, frameSize, recursionLimit);
  }
}
