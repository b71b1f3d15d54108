package cs1302.cstep.memory;

import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reference-free capture of the whole Memory Model. Frames, variables and heap blocks are
 * stored in flat tables and refer to each other by id only, so the capture is immutable and can be
 * compared with {@code equals}. Captures taken at different steps share the variables and blocks
 * that did not change in between.
 *
 * @param frames The stack, root frame first.
 * @param variables Every live variable keyed by id.
 * @param globals Ids of global variables in declaration order.
 * @param statics Ids of static variables in declaration order.
 * @param heap Every heap block ever allocated, in address order.
 * @param constants String literals in address order.
 * @param counters Allocation pointers and id counters.
 */
public record MemoryState(
    List<FrameState> frames,
    Map<Integer, VariableState> variables,
    List<Integer> globals,
    List<Integer> statics,
    List<HeapBlockState> heap,
    List<ConstantState> constants,
    Counters counters) {

  public MemoryState {
    frames = List.copyOf(frames);
    variables = Map.copyOf(variables);
    globals = List.copyOf(globals);
    statics = List.copyOf(statics);
    heap = List.copyOf(heap);
    constants = List.copyOf(constants);
  }

  /**
   * Look up a variable of the capture.
   *
   * @param id The variable id.
   * @return The variable.
   */
  public VariableState variable(int id) {
    return variables.get(id);
  }

  /**
   * Capture of one frame.
   *
   * @param id The frame id.
   * @param functionName The function name.
   * @param scopeTag The scope tag used for statics.
   * @param base The highest address of the frame (exclusive).
   * @param sizeBudget The number of bytes the frame owns.
   * @param stackPointer The lowest address used by its variables.
   * @param locals Ids of the locals in declaration order.
   * @param parameters Ids of the parameters in order.
   * @param returnValue The pending return slot.
   * @param returnLine The caller's line.
   * @param callerFrameId The caller's frame id.
   * @param scopes Open block scopes, innermost first.
   */
  public record FrameState(
      int id,
      String functionName,
      String scopeTag,
      long base,
      int sizeBudget,
      long stackPointer,
      List<Integer> locals,
      List<Integer> parameters,
      TraceValue returnValue,
      int returnLine,
      int callerFrameId,
      List<Frame.ScopeMark> scopes) {

    public FrameState {
      locals = List.copyOf(locals);
      parameters = List.copyOf(parameters);
      scopes = List.copyOf(scopes);
    }
  }

  /**
   * Capture of one variable.
   *
   * @param id The variable id.
   * @param name The variable name.
   * @param type The declared type.
   * @param kind Local, parameter, global or static.
   * @param scope The owning scope of a static.
   * @param address The address of the variable.
   * @param value The current value.
   * @param externOnly True while a global is only declared {@code extern}.
   * @param history Every value the variable held, with the step that wrote it. Stored as a
   *     {@link History}.
   */
  public record VariableState(
      int id,
      String name,
      CType type,
      Variable.Kind kind,
      String scope,
      long address,
      TraceValue value,
      boolean externOnly,
      List<Mutation> history) {

    public VariableState {
      history = History.of(history);
    }
  }

  /**
   * Capture of one heap block.
   *
   * @param id The block id.
   * @param address The block address.
   * @param size The requested size.
   * @param alignedSize The aligned size.
   * @param allocated Whether the block is still allocated.
   * @param allocStep The allocating step.
   * @param freeStep The freeing step or {@code -1}.
   * @param origin The allocating function.
   * @param originLine The allocating line.
   * @param data The block's bytes. The array is owned by the capture and must not be modified
   *     after construction.
   */
  public record HeapBlockState(
      int id,
      long address,
      long size,
      long alignedSize,
      boolean allocated,
      long allocStep,
      long freeStep,
      String origin,
      int originLine,
      byte[] data) {

    @Override
    public byte[] data() {
      return data.clone();
    }

    /** The bytes without a copy, for sharing with a rebuilt block. */
    byte[] bytes() {
      return data;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof HeapBlockState other)) {
        return false;
      }
      return id == other.id
          && address == other.address
          && size == other.size
          && alignedSize == other.alignedSize
          && allocated == other.allocated
          && allocStep == other.allocStep
          && freeStep == other.freeStep
          && originLine == other.originLine
          && Objects.equals(origin, other.origin)
          && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, address, size, allocated, freeStep) * 31 + Arrays.hashCode(data);
    }
  }

  /**
   * Capture of a string literal.
   *
   * @param address The literal address.
   * @param content The literal text.
   */
  public record ConstantState(long address, String content) {}

  /**
   * Allocation pointers and id counters.
   *
   * @param nextHeapAddress The bump pointer of the heap.
   * @param globalsTop The next free global address.
   * @param staticsTop The next free static address.
   * @param nextFrameId The next frame id.
   * @param nextVariableId The next variable id.
   * @param nextBlockId The next heap block id.
   */
  public record Counters(
      long nextHeapAddress,
      long globalsTop,
      long staticsTop,
      int nextFrameId,
      int nextVariableId,
      int nextBlockId) {}
}
