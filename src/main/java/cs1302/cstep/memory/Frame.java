package cs1302.cstep.memory;

import cs1302.cstep.trace.TraceValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Activation record of one function call. The frame owns the address range
 * {@code [base - sizeBudget, base)}; its variables are placed downward from {@code base}.
 */
public final class Frame {

  /**
   * Marks where a block scope started, so that leaving the block releases what it declared.
   *
   * @param ownerId The id of the syntax node that opened the scope.
   * @param localCount The number of locals declared before the scope opened.
   * @param stackPointer The stack pointer before the scope opened.
   */
  public record ScopeMark(int ownerId, int localCount, long stackPointer) {}

  private final int id;
  private final String functionName;
  private final String scopeTag;
  private final long base;
  private final int sizeBudget;
  private final int returnLine;
  private final int callerFrameId;
  private long stackPointer;
  private TraceValue returnValue = new TraceValue.Void();
  private final List<Variable> locals = new ArrayList<>();
  private final Map<String, Variable> parameters = new LinkedHashMap<>();
  private final Deque<ScopeMark> scopes = new ArrayDeque<>();

  Frame(int id, String functionName, String scopeTag, long base, int sizeBudget, int returnLine,
      int callerFrameId) {
    this.id = id;
    this.functionName = functionName;
    this.scopeTag = scopeTag;
    this.base = base;
    this.sizeBudget = sizeBudget;
    this.returnLine = returnLine;
    this.callerFrameId = callerFrameId;
    this.stackPointer = base;
  }

  public int id() {
    return id;
  }

  public String functionName() {
    return functionName;
  }

  public String scopeTag() {
    return scopeTag;
  }

  public long base() {
    return base;
  }

  public int sizeBudget() {
    return sizeBudget;
  }

  /** The lowest address owned by this frame. */
  public long limit() {
    return base - sizeBudget;
  }

  public long stackPointer() {
    return stackPointer;
  }

  public int returnLine() {
    return returnLine;
  }

  /** Id of the frame that was on top when this frame was pushed, or {@code -1} for the root. */
  public int callerFrameId() {
    return callerFrameId;
  }

  public TraceValue returnValue() {
    return returnValue;
  }

  /** Locals in declaration order. Shadowed locals of outer blocks are included. */
  public List<Variable> locals() {
    return Collections.unmodifiableList(locals);
  }

  public Map<String, Variable> parameters() {
    return Collections.unmodifiableMap(parameters);
  }

  /** Open scopes, innermost first. */
  public List<ScopeMark> scopes() {
    return List.copyOf(scopes);
  }

  /**
   * Find the innermost visible local with the given name.
   *
   * @param name The name to look for.
   * @return The local, if one is declared.
   */
  public Optional<Variable> local(String name) {
    for (int i = locals.size() - 1; i >= 0; i--) {
      if (locals.get(i).name().equals(name)) {
        return Optional.of(locals.get(i));
      }
    } // for
    return Optional.empty();
  }

  /** Returns {@code true} if the innermost open scope already declares {@code name}. */
  boolean declaredInInnermostScope(String name) {
    int from = scopes.isEmpty() ? 0 : scopes.peek().localCount();
    for (int i = from; i < locals.size(); i++) {
      if (locals.get(i).name().equals(name)) {
        return true;
      }
    } // for
    return scopes.size() <= 1 && parameters.containsKey(name);
  }

  boolean contains(long address) {
    return address >= limit() && address < base;
  }

  void setStackPointer(long stackPointer) {
    this.stackPointer = stackPointer;
  }

  void setReturnValue(TraceValue returnValue) {
    this.returnValue = returnValue;
  }

  void addLocal(Variable variable) {
    locals.add(variable);
  }

  void addParameter(Variable variable) {
    parameters.put(variable.name(), variable);
  }

  void pushScope(ScopeMark mark) {
    scopes.push(mark);
  }

  /**
   * Close the innermost scope, dropping the locals it declared.
   *
   * @return The closed scope.
   */
  ScopeMark popScope() {
    ScopeMark mark = scopes.pop();
    while (locals.size() > mark.localCount()) {
      locals.remove(locals.size() - 1);
    } // while
    stackPointer = mark.stackPointer();
    return mark;
  }

  Iterable<Variable> variables() {
    List<Variable> all = new ArrayList<>(parameters.values());
    all.addAll(locals);
    return all;
  }
}
