package cs1302.cstep.record;

/** A source line at which stepping reports a hit. */
public final class Breakpoint {

  private final int line;
  private boolean enabled = true;
  private int hitCount;

  public Breakpoint(int line) {
    this.line = line;
  }

  public int line() {
    return line;
  }

  public boolean enabled() {
    return enabled;
  }

  public int hitCount() {
    return hitCount;
  }

  void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  void setHitCount(int hitCount) {
    this.hitCount = hitCount;
  }

  void hit() {
    hitCount++;
  }

  @Override
  public String toString() {
    return String.format("line %d%s (hits: %d)", line, enabled ? "" : " [disabled]", hitCount);
  }
}
