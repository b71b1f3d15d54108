package cs1302.cstep.memory;

/** The regions of the simulated address space. Ranges are half open: {@code [base, limit)}. */
public enum Segment {
  CONSTANTS(0x0010_0000L, 0x0020_0000L),
  GLOBALS(0x0020_0000L, 0x0030_0000L),
  STATICS(0x0030_0000L, 0x0040_0000L),
  HEAP(0x1000_0000L, 0x5000_0000L),
  STACK(0xB000_0000L, 0xF000_0000L);

  private final long base;
  private final long limit;

  Segment(long base, long limit) {
    this.base = base;
    this.limit = limit;
  }

  public long base() {
    return base;
  }

  public long limit() {
    return limit;
  }

  public long size() {
    return limit - base;
  }

  public boolean contains(long address) {
    return address >= base && address < limit;
  }

  /**
   * Find the segment that contains an address.
   *
   * @param address The address.
   * @return The segment, or {@code null} if the address is outside every segment.
   */
  public static Segment of(long address) {
    for (Segment segment : values()) {
      if (segment.contains(address)) {
        return segment;
      }
    } // for
    return null;
  }

  /**
   * Returns {@code true} if the ranges of the two segments share an address.
   *
   * @param other The other segment.
   * @return whether they overlap
   */
  public boolean overlaps(Segment other) {
    return base < other.limit && other.base < limit;
  }
}
