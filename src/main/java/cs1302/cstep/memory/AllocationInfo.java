package cs1302.cstep.memory;

/**
 * A heap allocation that was never freed.
 *
 * @param address The address of the block.
 * @param size The requested size in bytes.
 * @param origin The function that allocated the block.
 * @param line The source line of the allocating call.
 * @param allocStep The step that allocated the block.
 * @param age The number of steps since the allocation.
 */
public record AllocationInfo(
    long address, long size, String origin, int line, long allocStep, long age) {

  @Override
  public String toString() {
    return String.format("%d bytes at 0x%08x allocated in %s (line %d), %d steps ago", size,
        address, origin, line, age);
  }
}
