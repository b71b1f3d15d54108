package cs1302.cstep.memory;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * An immutable prefix of an append-only log of {@link Mutation}s. Captures of the same variable
 * taken at different steps share one log and differ only in their length, so capturing a variable
 * never copies its history. Appending to a prefix that is no longer the end of its log copies the
 * prefix into a new log first; entries below a published length never change.
 *
 * <p>Logs are not synchronized. A log may be shared by several models only if they are used from
 * one thread.
 */
public final class History extends AbstractList<Mutation> implements RandomAccess {

  private static final History EMPTY = new History(new ArrayList<>(), 0);

  private final ArrayList<Mutation> log;
  private final int length;

  private History(ArrayList<Mutation> log, int length) {
    this.log = log;
    this.length = length;
  }

  public static History empty() {
    return EMPTY;
  }

  /**
   * A history holding the given entries.
   *
   * @param entries The entries, oldest first. A {@code History} is returned as is.
   * @return The history.
   */
  public static History of(List<Mutation> entries) {
    if (entries instanceof History history) {
      return history;
    }
    ArrayList<Mutation> log = new ArrayList<>(entries.size());
    for (Mutation entry : entries) {
      if (entry == null) {
        throw new NullPointerException("history entry");
      }
      log.add(entry);
    } // for
    return new History(log, log.size());
  }

  /**
   * Append an entry.
   *
   * @param entry The new last entry.
   * @return A history one entry longer. This history is unchanged.
   */
  History append(Mutation entry) {
    if (log.size() == length && this != EMPTY) {
      log.add(entry);
      return new History(log, length + 1);
    }
    ArrayList<Mutation> fork = new ArrayList<>(Math.max(16, length * 2));
    fork.addAll(log.subList(0, length));
    fork.add(entry);
    return new History(fork, length + 1);
  }

  /** Returns {@code true} if both histories are prefixes of the same log. */
  boolean sharesLog(History other) {
    return log == other.log;
  }

  @Override
  public Mutation get(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException("Index " + index + " out of bounds for " + length);
    }
    return log.get(index);
  }

  @Override
  public int size() {
    return length;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof History other && other.log == log) {
      return other.length == length;
    }
    return super.equals(o);
  }

  @Override
  public int hashCode() {
    return super.hashCode();
  }
}
