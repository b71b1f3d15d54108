package cs1302.cstep.memory;

import cs1302.cstep.memory.MemoryState.HeapBlockState;
import java.util.Arrays;

/**
 * A dynamically allocated region. Freed blocks keep their data for leak and history reports.
 *
 * <p>The bytes are shared with the block's latest capture until the next write, which copies them
 * first; a block that is not written between two captures is captured without copying.
 */
public final class HeapBlock {

  private final int id;
  private final long address;
  private final long size;
  private final long alignedSize;
  private final long allocStep;
  private final String origin;
  private final int originLine;
  private byte[] data;
  private boolean shared;
  private boolean allocated = true;
  private long freeStep = -1;
  private HeapBlockState captured;

  HeapBlock(int id, long address, long size, long alignedSize, long allocStep, String origin,
      int originLine, byte[] data) {
    this.id = id;
    this.address = address;
    this.size = size;
    this.alignedSize = alignedSize;
    this.allocStep = allocStep;
    this.origin = origin;
    this.originLine = originLine;
    this.data = data;
  }

  /** Rebuild a block from a capture, sharing its bytes. */
  static HeapBlock restore(HeapBlockState saved) {
    HeapBlock block = new HeapBlock(saved.id(), saved.address(), saved.size(),
        saved.alignedSize(), saved.allocStep(), saved.origin(), saved.originLine(),
        saved.bytes());
    block.allocated = saved.allocated();
    block.freeStep = saved.freeStep();
    block.shared = true;
    block.captured = saved;
    return block;
  }

  /** The capture of the current state; unchanged blocks return the same instance. */
  HeapBlockState capture() {
    if (captured == null) {
      captured = new HeapBlockState(id, address, size, alignedSize, allocated, allocStep,
          freeStep, origin, originLine, data);
      shared = true;
    }
    return captured;
  }

  public int id() {
    return id;
  }

  public long address() {
    return address;
  }

  /** The number of bytes that were requested. */
  public long size() {
    return size;
  }

  /** The number of bytes the block occupies in the address space. */
  public long alignedSize() {
    return alignedSize;
  }

  public boolean allocated() {
    return allocated;
  }

  public long allocStep() {
    return allocStep;
  }

  /** Step of the {@code free}, or {@code -1} while allocated. */
  public long freeStep() {
    return freeStep;
  }

  /** Name of the function that requested the block, e.g. {@code main}. */
  public String origin() {
    return origin;
  }

  public int originLine() {
    return originLine;
  }

  public byte[] data() {
    return Arrays.copyOf(data, data.length);
  }

  /** The bytes for reading. Callers must not modify the array. */
  byte[] rawData() {
    return data;
  }

  /** The bytes for writing, unshared from any capture. */
  byte[] writableData() {
    if (shared) {
      data = data.clone();
      shared = false;
    }
    captured = null;
    return data;
  }

  void markFreed(long step) {
    allocated = false;
    freeStep = step;
    captured = null;
  }

  @Override
  public String toString() {
    return String.format("block#%d[0x%08x, %d bytes, %s]", id, address, size,
        allocated ? "allocated" : "freed");
  }
}
