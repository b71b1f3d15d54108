package cs1302.cstep.interp;

import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.memory.Variable;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.util.Arrays;

/** A storage location an expression designates: a variable slot or a typed address. */
sealed interface LValue {

  CType type();

  long address();

  TraceValue read(MemoryModel memory);

  /**
   * Store a value, converting it to {@link #type()}.
   *
   * @param memory The memory to write.
   * @param value The value.
   * @return The stored value.
   */
  TraceValue write(MemoryModel memory, TraceValue value);

  /**
   * A variable, or an element of an array variable. Writes go through the variable so that index
   * checks use the array's dimensions.
   */
  record VariableSlot(Variable variable, int[] indices) implements LValue {

    @Override
    public CType type() {
      CType type = variable.type();
      for (int i = 0; i < indices.length; i++) {
        type = type.elementType();
      } // for
      return type;
    }

    @Override
    public long address() {
      long address = variable.address();
      CType type = variable.type();
      for (int index : indices) {
        type = type.elementType();
        address += (long) index * type.size();
      } // for
      return address;
    }

    VariableSlot index(int index) {
      int[] more = Arrays.copyOf(indices, indices.length + 1);
      more[indices.length] = index;
      return new VariableSlot(variable, more);
    }

    @Override
    public TraceValue read(MemoryModel memory) {
      return memory.read(variable, indices);
    }

    @Override
    public TraceValue write(MemoryModel memory, TraceValue value) {
      return memory.write(variable, value, indices);
    }
  }

  /** A typed address reached through a pointer. */
  record MemorySlot(long address, CType type) implements LValue {

    @Override
    public TraceValue read(MemoryModel memory) {
      return memory.readValue(address, type);
    }

    @Override
    public TraceValue write(MemoryModel memory, TraceValue value) {
      return memory.writeValue(address, type, value);
    }
  }
}
