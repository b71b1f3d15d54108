package cs1302.cstep.memory;

import cs1302.cstep.trace.CType;
import cs1302.cstep.memory.MemoryState.VariableState;
import cs1302.cstep.trace.TraceValue;
import java.util.List;

/** A named object of the simulated program: local, parameter, global or static. */
public final class Variable {

  /** Where a variable lives. */
  public enum Kind {
    LOCAL,
    PARAMETER,
    GLOBAL,
    STATIC
  }

  private final int id;
  private final String name;
  private final CType type;
  private final Kind kind;
  private final String scope;
  private final long address;
  private TraceValue value;
  private boolean externOnly;
  private History history;
  private VariableState captured;

  Variable(int id, String name, CType type, Kind kind, String scope, long address,
      TraceValue value, List<Mutation> history) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.kind = kind;
    this.scope = scope;
    this.address = address;
    this.value = value;
    this.history = History.of(history);
  }

  /** Rebuild a variable from a capture, which it keeps as its capture until it changes. */
  static Variable restore(VariableState saved) {
    Variable variable = new Variable(saved.id(), saved.name(), saved.type(), saved.kind(),
        saved.scope(), saved.address(), saved.value(), saved.history());
    variable.externOnly = saved.externOnly();
    variable.captured = saved;
    return variable;
  }

  /** The capture of the current state; unchanged variables return the same instance. */
  VariableState capture() {
    if (captured == null) {
      captured = new VariableState(id, name, type, kind, scope, address, value, externOnly,
          history);
    }
    return captured;
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  public CType type() {
    return type;
  }

  public Kind kind() {
    return kind;
  }

  /** The owning scope of a static; the empty string for every other kind. */
  public String scope() {
    return scope;
  }

  public long address() {
    return address;
  }

  public int size() {
    return type.size();
  }

  public int alignment() {
    return type.alignment();
  }

  public TraceValue value() {
    return value;
  }

  public List<Mutation> history() {
    return history;
  }

  boolean externOnly() {
    return externOnly;
  }

  void setExternOnly(boolean externOnly) {
    this.externOnly = externOnly;
    captured = null;
  }

  boolean contains(long candidate) {
    return candidate >= address && candidate < address + size();
  }

  void assign(TraceValue newValue, long step) {
    value = newValue;
    history = history.append(new Mutation(newValue, step));
    captured = null;
  }

  @Override
  public String toString() {
    return String.format("%s %s = %s @0x%08x", type, name, value.render(), address);
  }
}
