package cs1302.cstep.memory;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.memory.MemoryState.ConstantState;
import cs1302.cstep.memory.MemoryState.Counters;
import cs1302.cstep.memory.MemoryState.FrameState;
import cs1302.cstep.memory.MemoryState.HeapBlockState;
import cs1302.cstep.memory.MemoryState.VariableState;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Simulated address space of one program run: a stack of frames, globals, statics, a bump
 * allocated heap and a pool of string literals. Every access is validated; an operation that
 * fails throws an {@link EngineException} and leaves the model unchanged.
 *
 * <p>All tables are owned by the instance, so independent models never share state.
 *
 * <p>The model also keeps a log of the operations it performed, bounded by
 * {@link MemoryConfig#operationLogCapacity()}. The log is not part of a {@link MemoryState}:
 * {@link #restore} appends a {@code RESTORE} entry instead of rewinding it, and {@link #reset}
 * starts it over.
 */
public class MemoryModel {

  private static final Logger logger = LogManager.getLogger(MemoryModel.class);

  /** Name and scope tag of the root frame. */
  public static final String GLOBAL_SCOPE = "global";

  private static final int HEAP_ALIGNMENT = 8;
  private static final int MAX_STRING_LENGTH = 1 << 20;
  private static final byte UNINITIALIZED = (byte) 0xCD;

  private final MemoryConfig config;
  private final List<Frame> stack = new ArrayList<>();
  private final Map<String, Variable> globals = new LinkedHashMap<>();
  private final Map<String, Variable> statics = new LinkedHashMap<>();
  private final TreeMap<Long, HeapBlock> heap = new TreeMap<>();
  private final ConstantPool constants = new ConstantPool();
  private final ArrayDeque<MemoryOperation> operations = new ArrayDeque<>();

  private long nextHeapAddress;
  private long heapInUse;
  private long globalsTop;
  private long staticsTop;
  private int nextFrameId;
  private int nextVariableId;
  private int nextBlockId;
  private long step;

  /**
   * Create a model with the given limits. The model starts with only the root frame.
   *
   * @param config The limits of the address space.
   */
  public MemoryModel(MemoryConfig config) {
    this.config = config;
    reset();
  }

  public MemoryConfig config() {
    return config;
  }

  /** Discard all state and push a fresh root frame. */
  public void reset() {
    stack.clear();
    globals.clear();
    statics.clear();
    heap.clear();
    constants.clear();
    nextHeapAddress = Segment.HEAP.base();
    heapInUse = 0;
    globalsTop = Segment.GLOBALS.base();
    staticsTop = Segment.STATICS.base();
    nextFrameId = 0;
    nextVariableId = 0;
    nextBlockId = 0;
    step = 0;
    stack.add(new Frame(nextFrameId++, GLOBAL_SCOPE, GLOBAL_SCOPE, Segment.STACK.limit(),
        config.frameSize(), 0, -1));
    operations.clear();
    log(MemoryOperation.Type.RESET, 0, "");
  }

  /**
   * Set the index of the step in progress. History entries and heap lifecycle events are stamped
   * with it.
   *
   * @param step The step index.
   */
  public void setStep(long step) {
    this.step = step;
  }

  public long step() {
    return step;
  }

  // ---------------------------------------------------------------- frames

  /**
   * Push a frame for a call.
   *
   * @param name The function name.
   * @param scopeTag The scope that owns the function's statics.
   * @return The new frame.
   * @throws EngineException with {@code RECURSION_LIMIT_EXCEEDED} when the call depth limit is
   *     reached
   */
  public Frame createFrame(String name, String scopeTag) {
    return createFrame(name, scopeTag, 0);
  }

  /**
   * Push a frame for a call made from the given line.
   *
   * @param name The function name.
   * @param scopeTag The scope that owns the function's statics.
   * @param returnLine The caller's line.
   * @return The new frame.
   */
  public Frame createFrame(String name, String scopeTag, int returnLine) {
    if (depth() >= config.recursionLimit()) {
      throw EngineException.of(ErrorKind.RECURSION_LIMIT_EXCEEDED,
          "Call to '%s' exceeds the limit of %d nested calls", name, config.recursionLimit());
    }
    Frame top = currentFrame();
    long base = top.limit();
    if (base - config.frameSize() < Segment.STACK.base()) {
      throw EngineException.of(ErrorKind.STACK_OVERFLOW, "Stack segment exhausted by '%s'", name);
    }
    Frame frame =
        new Frame(nextFrameId++, name, scopeTag, base, config.frameSize(), returnLine, top.id());
    stack.add(frame);
    logger.debug("push frame {} '{}' at 0x{}", frame.id(), name, Long.toHexString(base));
    log(MemoryOperation.Type.PUSH_FRAME, base, name);
    return frame;
  }

  /**
   * Pop the top frame.
   *
   * @param returnValue The value returned by the call.
   * @return A summary of the popped frame.
   * @throws EngineException with {@code CANNOT_POP_ROOT} if only the root frame remains
   */
  public FrameSummary destroyFrame(TraceValue returnValue) {
    if (stack.size() <= 1) {
      throw EngineException.of(ErrorKind.CANNOT_POP_ROOT, "Cannot pop the global frame");
    }
    Frame frame = stack.get(stack.size() - 1);
    log(MemoryOperation.Type.POP_FRAME, frame.base(),
        frame.functionName() + " returned " + returnValue.render());
    stack.remove(stack.size() - 1);
    frame.setReturnValue(returnValue);
    logger.debug("pop frame {} '{}' returning {}", frame.id(), frame.functionName(),
        returnValue.render());
    return new FrameSummary(frame.id(), frame.functionName(), returnValue, frame.returnLine(),
        frame.callerFrameId(), frame.locals().size() + frame.parameters().size());
  }

  public Frame currentFrame() {
    return stack.get(stack.size() - 1);
  }

  public Frame rootFrame() {
    return stack.get(0);
  }

  /** The stack, root frame first. */
  public List<Frame> frames() {
    return Collections.unmodifiableList(stack);
  }

  /** The number of function frames above the root frame. */
  public int depth() {
    return stack.size() - 1;
  }

  /**
   * Open a block scope in the current frame.
   *
   * @param ownerId Id of the node that owns the scope.
   */
  public void enterScope(int ownerId) {
    Frame frame = currentFrame();
    frame.pushScope(new Frame.ScopeMark(ownerId, frame.locals().size(), frame.stackPointer()));
  }

  /**
   * Close the innermost block scope of the current frame, releasing its locals.
   *
   * @return The id of the node that owned the scope.
   */
  public int exitScope() {
    Frame frame = currentFrame();
    if (frame.scopes().isEmpty()) {
      throw new IllegalStateException("No open scope in frame " + frame.id());
    }
    return frame.popScope().ownerId();
  }

  // ---------------------------------------------------------------- variables

  /**
   * Declare a variable. At the root frame the variable becomes a global; with {@code STATIC}
   * storage it becomes a static of the current scope and is initialized only the first time;
   * with {@code EXTERN} storage the existing global of that name is returned.
   *
   * @param name The variable name.
   * @param type The declared type.
   * @param init The initial value, or {@code null} for the type's zero value.
   * @param storage The storage class.
   * @return The declared (or existing) variable.
   * @throws EngineException with {@code REDECLARED} if the scope already declares the name
   */
  public Variable declareVariable(String name, CType type, TraceValue init, StorageClass storage) {
    Frame frame = currentFrame();
    if (storage == StorageClass.EXTERN) {
      Variable existing = globals.get(name);
      if (existing != null) {
        return existing;
      }
      Variable global = placeGlobal(name, type, null);
      global.setExternOnly(true);
      return global;
    } else if (storage == StorageClass.STATIC) {
      String key = staticKey(frame.scopeTag(), name);
      Variable existing = statics.get(key);
      if (existing != null) {
        return existing;
      }
      TraceValue value = initialValue(type, init);
      long address = align(staticsTop, type.alignment());
      checkSegment(Segment.STATICS, address, type.size(), name);
      staticsTop = address + type.size();
      Variable variable =
          newVariable(name, type, Variable.Kind.STATIC, frame.scopeTag(), address, value);
      statics.put(key, variable);
      return variable;
    } else if (frame == rootFrame()) {
      Variable existing = globals.get(name);
      if (existing != null) {
        if (!existing.externOnly() || !existing.type().equals(type)) {
          throw EngineException.of(ErrorKind.REDECLARED, "Global '%s' is already declared", name);
        }
        existing.setExternOnly(false);
        if (init != null) {
          existing.assign(initialValue(type, init), step);
        }
        return existing;
      }
      return placeGlobal(name, type, init);
    }

    if (frame.declaredInInnermostScope(name)) {
      throw EngineException.of(ErrorKind.REDECLARED, "'%s' is already declared in this scope",
          name);
    }
    TraceValue value = initialValue(type, init);
    Variable local = newVariable(name, type, Variable.Kind.LOCAL, "", reserveStack(frame, type,
        name), value);
    frame.addLocal(local);
    return local;
  } // declareVariable

  /**
   * Bind a parameter of the current frame.
   *
   * @param name The parameter name.
   * @param type The parameter type.
   * @param value The argument value.
   * @return The parameter.
   */
  public Variable declareParameter(String name, CType type, TraceValue value) {
    Frame frame = currentFrame();
    if (frame.parameters().containsKey(name)) {
      throw EngineException.of(ErrorKind.REDECLARED, "Duplicate parameter '%s'", name);
    }
    Variable parameter = newVariable(name, type, Variable.Kind.PARAMETER, "",
        reserveStack(frame, type, name), initialValue(type, value));
    frame.addParameter(parameter);
    return parameter;
  }

  private Variable placeGlobal(String name, CType type, TraceValue init) {
    TraceValue value = initialValue(type, init);
    long address = align(globalsTop, type.alignment());
    checkSegment(Segment.GLOBALS, address, type.size(), name);
    globalsTop = address + type.size();
    Variable global = newVariable(name, type, Variable.Kind.GLOBAL, "", address, value);
    globals.put(name, global);
    return global;
  }

  private Variable newVariable(String name, CType type, Variable.Kind kind, String scope,
      long address, TraceValue value) {
    Variable variable = new Variable(nextVariableId++, name, type, kind, scope, address, value,
        List.of(new Mutation(value, step)));
    logger.debug("declare {} {} {} at 0x{}", kind, type, name, Long.toHexString(address));
    log(MemoryOperation.Type.valueOf("DECLARE_" + kind.name()), address, type + " " + name);
    return variable;
  }

  private long reserveStack(Frame frame, CType type, String name) {
    long address = alignDown(frame.stackPointer() - type.size(), type.alignment());
    if (address < frame.limit()) {
      throw EngineException.of(ErrorKind.STACK_OVERFLOW,
          "'%s' (%d bytes) does not fit in the %d byte frame of '%s'", name, type.size(),
          frame.sizeBudget(), frame.functionName());
    }
    frame.setStackPointer(address);
    return address;
  }

  private static void checkSegment(Segment segment, long address, long size, String name) {
    if (address + size > segment.limit()) {
      throw EngineException.of(ErrorKind.OUT_OF_MEMORY, "%s segment is full, cannot place '%s'",
          segment, name);
    }
  }

  private TraceValue initialValue(CType type, TraceValue init) {
    if (init == null) {
      return type.defaultValue();
    } else if (type.isArray()) {
      return settle(type, fitArray(type, init));
    }
    return settle(type, type.coerce(init));
  }

  /**
   * Pass a value holding {@code struct}s or {@code union}s through its bytes, so that the members
   * of a union agree with each other.
   */
  private static TraceValue settle(CType type, TraceValue value) {
    if (type.aggregate() == null || type.pointerDepth() > 0) {
      return value;
    }
    return ByteCodec.decode(type, ByteCodec.encode(type, value), 0);
  }

  /**
   * Shape an initializer to the dimensions of an array type, padding missing elements with zero
   * values.
   */
  private TraceValue fitArray(CType type, TraceValue init) {
    if (!type.isArray()) {
      return !type.isAggregate() && init instanceof TraceValue.Array a && a.elements().size() == 1
          ? type.coerce(a.elements().get(0))
          : type.coerce(init);
    }
    if (!(init instanceof TraceValue.Array array)) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Array of type %s needs an initializer list",
          type);
    }
    int length = type.dimensions().get(0);
    if (array.elements().size() > length) {
      throw EngineException.of(ErrorKind.OUT_OF_BOUNDS,
          "%d initializers for an array of length %d", array.elements().size(), length);
    }
    CType element = type.elementType();
    List<TraceValue> elements = new ArrayList<>();
    for (int i = 0; i < length; i++) {
      elements.add(i < array.elements().size()
          ? fitArray(element, array.elements().get(i))
          : element.defaultValue());
    } // for
    return new TraceValue.Array(elements);
  } // fitArray

  /**
   * Find a static of the current frame's scope that is already initialized.
   *
   * @param name The static's name.
   * @return The static, if a previous declaration created it.
   */
  public Optional<Variable> findStatic(String name) {
    return Optional.ofNullable(statics.get(staticKey(currentFrame().scopeTag(), name)));
  }

  private static String staticKey(String scope, String name) {
    return scope + "." + name;
  }

  /**
   * Find the variable a name refers to: current frame locals (innermost block first), current
   * frame parameters, statics of the current scope, file statics, then globals. Frames of callers
   * are not searched.
   *
   * @param name The name to resolve.
   * @return The variable, if the name is visible.
   */
  public Optional<Variable> resolve(String name) {
    Frame frame = currentFrame();
    Optional<Variable> local = frame.local(name);
    if (local.isPresent()) {
      return local;
    }
    Variable found = frame.parameters().get(name);
    if (found == null) {
      found = statics.get(staticKey(frame.scopeTag(), name));
    }
    if (found == null) {
      found = statics.get(staticKey(GLOBAL_SCOPE, name));
    }
    if (found == null) {
      found = globals.get(name);
    }
    return Optional.ofNullable(found);
  }

  /**
   * Like {@link #resolve} but fails for unknown names.
   *
   * @param name The name to resolve.
   * @return The variable.
   * @throws EngineException with {@code UNKNOWN_IDENTIFIER} if the name is not visible
   */
  public Variable lookup(String name) {
    return resolve(name).orElseThrow(() ->
        EngineException.of(ErrorKind.UNKNOWN_IDENTIFIER, "'%s' is not declared", name));
  }

  /**
   * Read a variable or one of its array elements.
   *
   * @param target The variable.
   * @param indices Array indices, outermost first. May select a sub-array.
   * @return The value.
   * @throws EngineException with {@code OUT_OF_BOUNDS} for an index outside its dimension
   */
  public TraceValue read(Variable target, int... indices) {
    TraceValue current = target.value();
    for (int i = 0; i < indices.length; i++) {
      current = element(target, current, indices[i], i);
    } // for
    return current;
  }

  /**
   * Write a variable or one of its array elements. The value is converted to the element type and
   * the new value of the variable is appended to its history.
   *
   * @param target The variable.
   * @param value The value to store.
   * @param indices Array indices, outermost first.
   * @return The stored (converted) value.
   * @throws EngineException with {@code OUT_OF_BOUNDS} for an index outside its dimension
   */
  public TraceValue write(Variable target, TraceValue value, int... indices) {
    CType slotType = target.type();
    for (int i = 0; i < indices.length; i++) {
      if (!slotType.isArray()) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "'%s' has only %d dimension(s)",
            target.name(), i);
      }
      slotType = slotType.elementType();
    } // for
    TraceValue stored = settle(slotType,
        slotType.isArray() ? fitArray(slotType, value) : slotType.coerce(value));
    TraceValue updated = replace(target, target.value(), indices, 0, stored);
    target.assign(updated, step);
    log(MemoryOperation.Type.WRITE_VARIABLE, target.address(),
        target.name() + " = " + stored.render());
    return stored;
  }

  private TraceValue replace(Variable target, TraceValue current, int[] indices, int depth,
      TraceValue stored) {
    if (depth == indices.length) {
      return stored;
    }
    TraceValue.Array array = (TraceValue.Array) current;
    TraceValue child = element(target, current, indices[depth], depth);
    return array.with(indices[depth], replace(target, child, indices, depth + 1, stored));
  }

  private static TraceValue element(Variable target, TraceValue current, int index, int depth) {
    if (!(current instanceof TraceValue.Array array)) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "'%s' has only %d dimension(s)",
          target.name(), depth);
    }
    if (index < 0 || index >= array.elements().size()) {
      throw EngineException.of(ErrorKind.OUT_OF_BOUNDS,
          "Index %d is out of bounds for '%s' (length %d)", index, target.name(),
          array.elements().size());
    }
    return array.elements().get(index);
  }

  /**
   * The history of the visible variable with the given name.
   *
   * @param name The variable name.
   * @return Every value it held with the step that wrote it.
   */
  public List<Mutation> variableHistory(String name) {
    return lookup(name).history();
  }

  public Map<String, Variable> globals() {
    return Collections.unmodifiableMap(globals);
  }

  /** Statics keyed by {@code scope.name}. */
  public Map<String, Variable> statics() {
    return Collections.unmodifiableMap(statics);
  }

  // ---------------------------------------------------------------- heap

  /**
   * Allocate a heap block. Blocks are placed at the heap's bump pointer, 8-byte aligned; freed
   * ranges are never reused.
   *
   * @param size The number of bytes requested.
   * @param zeroFill True to clear the block, false to fill it with a garbage pattern.
   * @param origin The allocating function.
   * @param line The line of the allocating call.
   * @return The block address, or {@code 0} if {@code size <= 0}.
   * @throws EngineException with {@code OUT_OF_MEMORY} if the heap cap would be exceeded
   */
  public long allocate(long size, boolean zeroFill, String origin, int line) {
    if (size <= 0) {
      return 0;
    }
    long alignedSize = align(size, HEAP_ALIGNMENT);
    if (heapInUse + size > config.heapCapacity()
        || nextHeapAddress + alignedSize > Segment.HEAP.limit()
        || size > Integer.MAX_VALUE) {
      throw EngineException.of(ErrorKind.OUT_OF_MEMORY,
          "Cannot allocate %d bytes: %d of %d heap bytes in use", size, heapInUse,
          config.heapCapacity());
    }
    byte[] data = new byte[(int) size];
    if (!zeroFill) {
      Arrays.fill(data, UNINITIALIZED);
    }
    HeapBlock block = new HeapBlock(nextBlockId++, nextHeapAddress, size, alignedSize, step,
        origin, line, data);
    heap.put(block.address(), block);
    nextHeapAddress += alignedSize;
    heapInUse += size;
    logger.debug("allocate {} bytes at 0x{} for {}:{}", size, Long.toHexString(block.address()),
        origin, line);
    log(MemoryOperation.Type.ALLOCATE, block.address(), size + " bytes by " + origin);
    return block.address();
  } // allocate

  /**
   * Free a heap block. Freeing the null address does nothing.
   *
   * @param address The address returned by an allocation.
   * @throws EngineException with {@code INVALID_FREE} for an address that does not start a block
   *     and {@code DOUBLE_FREE} for a block that is already freed
   */
  public void free(long address) {
    if (address == 0) {
      return;
    }
    HeapBlock block = heap.get(address);
    if (block == null) {
      throw EngineException.of(ErrorKind.INVALID_FREE,
          "0x%08x was not returned by an allocation", address);
    }
    if (!block.allocated()) {
      throw EngineException.of(ErrorKind.DOUBLE_FREE,
          "Block at 0x%08x was already freed at step %d", address, block.freeStep());
    }
    block.markFreed(step);
    heapInUse -= block.size();
    logger.debug("free {} bytes at 0x{}", block.size(), Long.toHexString(address));
    log(MemoryOperation.Type.FREE, address, block.size() + " bytes");
  }

  /**
   * Resize a heap block by allocating a new block, copying the common prefix and freeing the old
   * block.
   *
   * @param address The block to resize, or {@code 0} to allocate.
   * @param newSize The new size; {@code 0} frees the block.
   * @param origin The calling function.
   * @param line The line of the call.
   * @return The address of the resized block, or {@code 0} after a free.
   */
  public long reallocate(long address, long newSize, String origin, int line) {
    if (address == 0) {
      return allocate(newSize, false, origin, line);
    }
    if (newSize == 0) {
      free(address);
      return 0;
    }
    HeapBlock block = heap.get(address);
    if (block == null) {
      throw EngineException.of(ErrorKind.INVALID_FREE,
          "0x%08x was not returned by an allocation", address);
    }
    if (!block.allocated()) {
      throw EngineException.of(ErrorKind.USE_AFTER_FREE,
          "Cannot resize the freed block at 0x%08x", address);
    }
    if (newSize == block.size()) {
      return address;
    }
    long moved = allocate(newSize, false, origin, line);
    HeapBlock target = heap.get(moved);
    System.arraycopy(block.rawData(), 0, target.writableData(), 0,
        (int) Math.min(block.size(), newSize));
    free(address);
    log(MemoryOperation.Type.REALLOCATE, moved,
        String.format("0x%08x resized to %d bytes", address, newSize));
    return moved;
  } // reallocate

  /**
   * Find the heap block that starts at an address.
   *
   * @param address The block address.
   * @return The block, allocated or freed.
   */
  public Optional<HeapBlock> block(long address) {
    return Optional.ofNullable(heap.get(address));
  }

  /** Every block ever allocated in this run, in address order. */
  public List<HeapBlock> heapBlocks() {
    return List.copyOf(heap.values());
  }

  /** The sum of the requested sizes of all allocated blocks. */
  public long heapInUse() {
    return heapInUse;
  }

  /** The address the next allocation will start at. */
  public long heapPointer() {
    return nextHeapAddress;
  }

  /**
   * Report every allocation that has not been freed.
   *
   * @return The leaked allocations in address order.
   */
  public List<AllocationInfo> detectLeaks() {
    return heap.values().stream()
        .filter(HeapBlock::allocated)
        .map(b -> new AllocationInfo(b.address(), b.size(), b.origin(), b.originLine(),
            b.allocStep(), step - b.allocStep()))
        .toList();
  }

  /**
   * Report the bytes in use per segment.
   *
   * @return The usage report.
   */
  public MemoryUsage usage() {
    long stackBytes = 0;
    for (Frame frame : stack) {
      stackBytes += frame.base() - frame.stackPointer();
    } // for
    long aligned = 0;
    int live = 0;
    for (HeapBlock block : heap.values()) {
      if (block.allocated()) {
        aligned += block.alignedSize();
        live++;
      } // if
    } // for
    return new MemoryUsage(constants.used(), globalsTop - Segment.GLOBALS.base(),
        staticsTop - Segment.STATICS.base(), stackBytes, heapInUse, aligned,
        config.heapCapacity(), live, heap.size() - live);
  }

  // ---------------------------------------------------------------- bytes

  /**
   * Get the address of a string literal, adding it to the constant segment on first use.
   *
   * @param content The literal text.
   * @return The address of its first character.
   */
  public long internString(String content) {
    long used = constants.used();
    long address = constants.intern(content);
    if (constants.used() != used) {
      log(MemoryOperation.Type.INTERN_STRING, address, content);
    }
    return address;
  }

  /**
   * Read raw bytes.
   *
   * @param address The first address.
   * @param count The number of bytes.
   * @return A copy of the bytes.
   * @throws EngineException if the range is not inside one live object
   */
  public byte[] readBytes(long address, int count) {
    Segment segment = segmentOf(address);
    if (segment == Segment.CONSTANTS) {
      ConstantPool.Constant constant = constants.find(address).orElseThrow(() ->
          invalidAddress(address));
      int offset = (int) (address - constant.address());
      checkRange(address, count, offset, constant.size(), "string literal");
      return Arrays.copyOfRange(constant.bytes(), offset, offset + count);
    } else if (segment == Segment.HEAP) {
      HeapBlock block = liveBlock(address, count);
      int offset = (int) (address - block.address());
      log(MemoryOperation.Type.READ_HEAP, address, count + " bytes");
      return Arrays.copyOfRange(block.rawData(), offset, offset + count);
    }
    Variable variable = variableAt(address);
    int offset = (int) (address - variable.address());
    checkRange(address, count, offset, variable.size(), "'" + variable.name() + "'");
    return Arrays.copyOfRange(ByteCodec.encode(variable.type(), variable.value()), offset,
        offset + count);
  }

  /**
   * Write raw bytes. Writes into a variable update its value and history.
   *
   * @param address The first address.
   * @param bytes The bytes to write.
   * @throws EngineException if the range is not inside one live writable object
   */
  public void writeBytes(long address, byte[] bytes) {
    Segment segment = segmentOf(address);
    if (segment == Segment.CONSTANTS) {
      throw EngineException.of(ErrorKind.INVALID_ADDRESS,
          "Cannot write to read-only string literal at 0x%08x", address);
    } else if (segment == Segment.HEAP) {
      HeapBlock block = liveBlock(address, bytes.length);
      System.arraycopy(bytes, 0, block.writableData(), (int) (address - block.address()),
          bytes.length);
      log(MemoryOperation.Type.WRITE_HEAP, address, bytes.length + " bytes");
      return;
    }
    Variable variable = variableAt(address);
    int offset = (int) (address - variable.address());
    checkRange(address, bytes.length, offset, variable.size(), "'" + variable.name() + "'");
    byte[] image = ByteCodec.encode(variable.type(), variable.value());
    System.arraycopy(bytes, 0, image, offset, bytes.length);
    variable.assign(ByteCodec.decode(variable.type(), image, 0), step);
    log(MemoryOperation.Type.WRITE_VARIABLE, address, variable.name() + ", " + bytes.length
        + " bytes");
  }

  /**
   * Read a typed value.
   *
   * @param address The address of the value.
   * @param type The type to decode.
   * @return The value.
   */
  public TraceValue readValue(long address, CType type) {
    return ByteCodec.decode(type, readBytes(address, type.size()), 0);
  }

  /**
   * Write a typed value, converting it to {@code type} first.
   *
   * @param address The address of the value.
   * @param type The type to encode.
   * @param value The value.
   * @return The stored value.
   */
  public TraceValue writeValue(long address, CType type, TraceValue value) {
    TraceValue stored = type.coerce(value);
    writeBytes(address, ByteCodec.encode(type, stored));
    return stored;
  }

  /**
   * Read a NUL-terminated string.
   *
   * @param address The address of the first character.
   * @return The characters before the terminator.
   */
  public String readCString(long address) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < MAX_STRING_LENGTH; i++) {
      byte b = readBytes(address + i, 1)[0];
      if (b == 0) {
        return sb.toString();
      }
      sb.append((char) (b & 0xFF));
    } // for
    throw EngineException.of(ErrorKind.OUT_OF_BOUNDS, "Unterminated string at 0x%08x", address);
  }

  /**
   * Write a string and its terminator.
   *
   * @param address The destination.
   * @param text The characters to write.
   */
  public void writeCString(long address, String text) {
    byte[] chars = text.getBytes(StandardCharsets.ISO_8859_1);
    writeBytes(address, Arrays.copyOf(chars, chars.length + 1));
  }

  private Segment segmentOf(long address) {
    Segment segment = Segment.of(address);
    if (segment == null) {
      throw address == 0
          ? EngineException.of(ErrorKind.INVALID_ADDRESS, "Null pointer dereference")
          : invalidAddress(address);
    }
    return segment;
  }

  private HeapBlock liveBlock(long address, int count) {
    Map.Entry<Long, HeapBlock> entry = heap.floorEntry(address);
    if (entry == null) {
      throw invalidAddress(address);
    }
    HeapBlock block = entry.getValue();
    if (!block.allocated()) {
      throw EngineException.of(ErrorKind.USE_AFTER_FREE,
          "Access to 0x%08x inside a block freed at step %d", address, block.freeStep());
    }
    long offset = address - block.address();
    checkRange(address, count, offset, block.size(), "heap block at " + hex(block.address()));
    return block;
  }

  private Variable variableAt(long address) {
    for (Variable variable : liveVariables()) {
      if (variable.contains(address)) {
        return variable;
      }
    } // for
    throw invalidAddress(address);
  }

  private static void checkRange(long address, long count, long offset, long size, String what) {
    if (count < 0 || offset + count > size) {
      throw EngineException.of(ErrorKind.OUT_OF_BOUNDS,
          "Access of %d byte(s) at 0x%08x is outside %s (%d bytes)", count, address, what, size);
    }
  }

  private static EngineException invalidAddress(long address) {
    return EngineException.of(ErrorKind.INVALID_ADDRESS,
        "0x%08x does not belong to any live object", address);
  }

  private static String hex(long address) {
    return String.format("0x%08x", address);
  }

  private List<Variable> liveVariables() {
    List<Variable> all = new ArrayList<>(globals.values());
    all.addAll(statics.values());
    for (Frame frame : stack) {
      frame.variables().forEach(all::add);
    } // for
    return all;
  }

  private static long align(long value, long alignment) {
    return (value + alignment - 1) / alignment * alignment;
  }

  private static long alignDown(long value, long alignment) {
    return value / alignment * alignment;
  }

  // ---------------------------------------------------------------- operation log

  private void log(MemoryOperation.Type type, long address, String detail) {
    if (config.operationLogCapacity() == 0) {
      return;
    }
    if (operations.size() == config.operationLogCapacity()) {
      operations.removeFirst();
    }
    int frameId = stack.isEmpty() ? -1 : currentFrame().id();
    operations.addLast(new MemoryOperation(type, step, frameId, address, detail));
  }

  /** The last 100 logged operations. */
  public List<MemoryOperation> operations() {
    return operations(100, null);
  }

  /**
   * Query the operation log.
   *
   * @param limit The largest number of entries to return.
   * @param filter Only operations whose {@linkplain MemoryOperation.Type#label() label} contains
   *     this text are returned, ignoring case; {@code null} or blank for all.
   * @return The newest matching operations, oldest first.
   */
  public List<MemoryOperation> operations(int limit, String filter) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limit);
    }
    String needle = filter == null ? "" : filter.trim().toLowerCase(Locale.ROOT);
    List<MemoryOperation> matching = operations.stream()
        .filter(op -> op.type().label().contains(needle))
        .toList();
    return matching.subList(Math.max(0, matching.size() - limit), matching.size());
  }

  /** Empty the operation log. */
  public void clearOperations() {
    operations.clear();
  }

  // ---------------------------------------------------------------- capture

  /**
   * Capture the whole model. The capture shares no mutable object with the model; variables and
   * heap blocks that did not change since the previous capture are captured by the same instance.
   *
   * @return The capture.
   */
  public MemoryState snapshot() {
    Map<Integer, VariableState> variables = new HashMap<>();
    List<FrameState> frames = new ArrayList<>();
    for (Frame frame : stack) {
      List<Integer> locals = new ArrayList<>();
      for (Variable local : frame.locals()) {
        locals.add(capture(local, variables));
      } // for
      List<Integer> parameters = new ArrayList<>();
      for (Variable parameter : frame.parameters().values()) {
        parameters.add(capture(parameter, variables));
      } // for
      frames.add(new FrameState(frame.id(), frame.functionName(), frame.scopeTag(), frame.base(),
          frame.sizeBudget(), frame.stackPointer(), locals, parameters, frame.returnValue(),
          frame.returnLine(), frame.callerFrameId(), frame.scopes()));
    } // for
    List<Integer> globalIds = new ArrayList<>();
    globals.values().forEach(v -> globalIds.add(capture(v, variables)));
    List<Integer> staticIds = new ArrayList<>();
    statics.values().forEach(v -> staticIds.add(capture(v, variables)));

    List<HeapBlockState> blocks = heap.values().stream()
        .map(HeapBlock::capture)
        .toList();
    List<ConstantState> literals = constants.all().stream()
        .map(c -> new ConstantState(c.address(), c.content()))
        .toList();
    Counters counters = new Counters(nextHeapAddress, globalsTop, staticsTop, nextFrameId,
        nextVariableId, nextBlockId);
    return new MemoryState(frames, variables, globalIds, staticIds, blocks, literals, counters);
  } // snapshot

  private static int capture(Variable variable, Map<Integer, VariableState> table) {
    table.put(variable.id(), variable.capture());
    return variable.id();
  }

  /**
   * Replace the whole model with a capture.
   *
   * @param state A capture produced by {@link #snapshot()} (of this or another model with the
   *     same configuration).
   */
  public void restore(MemoryState state) {
    stack.clear();
    globals.clear();
    statics.clear();
    heap.clear();
    for (FrameState saved : state.frames()) {
      Frame frame = new Frame(saved.id(), saved.functionName(), saved.scopeTag(), saved.base(),
          saved.sizeBudget(), saved.returnLine(), saved.callerFrameId());
      frame.setStackPointer(saved.stackPointer());
      frame.setReturnValue(saved.returnValue());
      for (int id : saved.parameters()) {
        frame.addParameter(rebuild(state.variable(id)));
      } // for
      for (int id : saved.locals()) {
        frame.addLocal(rebuild(state.variable(id)));
      } // for
      List<Frame.ScopeMark> scopes = new ArrayList<>(saved.scopes());
      Collections.reverse(scopes);
      scopes.forEach(frame::pushScope);
      stack.add(frame);
    } // for
    for (int id : state.globals()) {
      Variable global = rebuild(state.variable(id));
      globals.put(global.name(), global);
    } // for
    for (int id : state.statics()) {
      Variable saved = rebuild(state.variable(id));
      statics.put(staticKey(saved.scope(), saved.name()), saved);
    } // for
    heapInUse = 0;
    for (HeapBlockState saved : state.heap()) {
      HeapBlock block = HeapBlock.restore(saved);
      heap.put(block.address(), block);
      if (block.allocated()) {
        heapInUse += block.size();
      } // if
    } // for
    constants.restore(state.constants().stream()
        .map(c -> new ConstantPool.Constant(c.address(), c.content()))
        .toList());
    Counters counters = state.counters();
    nextHeapAddress = counters.nextHeapAddress();
    globalsTop = counters.globalsTop();
    staticsTop = counters.staticsTop();
    nextFrameId = counters.nextFrameId();
    nextVariableId = counters.nextVariableId();
    nextBlockId = counters.nextBlockId();
    log(MemoryOperation.Type.RESTORE, 0, "");
  } // restore

  private static Variable rebuild(VariableState saved) {
    return Variable.restore(saved);
  }
}
