package cs1302.cstep.memory;

/**
 * Bytes in use per segment.
 *
 * @param constants Bytes of literal data.
 * @param globals Bytes of global variables.
 * @param statics Bytes of static variables.
 * @param stack Bytes of live locals and parameters.
 * @param heapInUse Requested bytes of allocated heap blocks.
 * @param heapAligned Aligned bytes of allocated heap blocks.
 * @param heapCapacity The configured heap cap.
 * @param liveBlocks The number of allocated heap blocks.
 * @param freedBlocks The number of freed heap blocks.
 */
public record MemoryUsage(
    long constants,
    long globals,
    long statics,
    long stack,
    long heapInUse,
    long heapAligned,
    long heapCapacity,
    int liveBlocks,
    int freedBlocks) {}
