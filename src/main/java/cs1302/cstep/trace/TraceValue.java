package cs1302.cstep.trace;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import java.util.ArrayList;
import java.util.stream.Collectors;

/** A value of the simulated program (integer, floating point, address, array, or nothing). */
public sealed interface TraceValue {

  /**
   * An integral value. Characters and booleans are integers too.
   *
   * @param value The value, already truncated to the width of its type.
   */
  record Int(long value) implements TraceValue {}

  /**
   * A floating point value.
   *
   * @param value The value.
   */
  record Real(double value) implements TraceValue {}

  /**
   * A typed address. The pointee type scales pointer arithmetic and decides how a dereference
   * decodes memory.
   *
   * @param value The address, {@code 0} for the null address.
   * @param pointee The type stored at the address.
   */
  record Address(long value, CType pointee) implements TraceValue {

    public boolean isNull() {
      return value == 0;
    }
  }

  /**
   * The contents of an array, outermost dimension first.
   *
   * @param elements The elements. Nested arrays are themselves {@code Array} values.
   */
  record Array(java.util.List<TraceValue> elements) implements TraceValue {

    public Array {
      elements = java.util.List.copyOf(elements);
    }

    /**
     * Copy this array with one element replaced.
     *
     * @param index The index of the element to replace.
     * @param element The new element.
     * @return The new array.
     */
    public Array with(int index, TraceValue element) {
      java.util.List<TraceValue> copy = new ArrayList<>(elements);
      copy.set(index, element);
      return new Array(copy);
    }
  }

  /** The result of a {@code void} function. */
  record Void() implements TraceValue {}

  /**
   * Interpret this value as an integer.
   *
   * @return The integer value (floating values are truncated toward zero).
   * @throws EngineException if the value has no integer interpretation
   */
  default long asLong() {
    if (this instanceof Int i) {
      return i.value();
    } else if (this instanceof Real r) {
      return (long) r.value();
    } else if (this instanceof Address a) {
      return a.value();
    }
    throw EngineException.of(ErrorKind.UNSUPPORTED, "%s is not a number", render());
  }

  /**
   * Interpret this value as a floating point number.
   *
   * @return The floating point value.
   * @throws EngineException if the value has no numeric interpretation
   */
  default double asDouble() {
    if (this instanceof Real r) {
      return r.value();
    }
    return asLong();
  }

  /**
   * C truthiness: non-zero numbers and non-null addresses are true.
   *
   * @return whether the value is true
   */
  default boolean isTrue() {
    if (this instanceof Real r) {
      return r.value() != 0.0;
    }
    return asLong() != 0;
  }

  /**
   * A human readable rendering of the value.
   *
   * @return the rendering
   */
  default String render() {
    if (this instanceof Int i) {
      return Long.toString(i.value());
    } else if (this instanceof Real r) {
      return Double.toString(r.value());
    } else if (this instanceof Address a) {
      return a.isNull() ? "NULL" : String.format("0x%08x", a.value());
    } else if (this instanceof Array array) {
      return array.elements().stream()
          .map(TraceValue::render)
          .collect(Collectors.joining(", ", "[", "]"));
    }
    return "void";
  }

  /**
   * Wrap a boolean as the integer C uses for it.
   *
   * @param b The boolean.
   * @return {@code 1} or {@code 0}.
   */
  static TraceValue of(boolean b) {
    return new Int(b ? 1 : 0);
  }
}
