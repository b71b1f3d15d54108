package cs1302.cstep.interp;

import cs1302.cstep.tree.NodeKind;

/**
 * Source position of a schedulable unit.
 *
 * @param line The source line.
 * @param column The source column.
 * @param kind The kind of the statement the unit belongs to.
 * @param phase The part of the statement.
 */
public record Cursor(int line, int column, NodeKind kind, Phase phase) {

  @Override
  public String toString() {
    return phase == Phase.EXECUTE
        ? String.format("%s@%d:%d", kind, line, column)
        : String.format("%s/%s@%d:%d", kind, phase, line, column);
  }
}
