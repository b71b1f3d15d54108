package cs1302.cstep.trace;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A C type descriptor: a base type name, a level of pointer indirection, and the dimensions of an
 * array (outermost first). {@code int *m[2][3]} is {@code CType("int", 1, [2, 3])}. A base that
 * is a {@code struct} or {@code union} carries its layout.
 *
 * @param base The base type words, e.g. {@code "unsigned int"} or {@code "struct node"}.
 * @param pointerDepth The number of {@code *} applied to the base type.
 * @param dimensions The array dimensions, empty for scalars and pointers.
 * @param aggregate The layout of a {@code struct} or {@code union} base, otherwise {@code null}.
 */
public record CType(String base, int pointerDepth, List<Integer> dimensions, Aggregate aggregate) {

  /** Size in bytes of every pointer. */
  public static final int POINTER_SIZE = 8;

  public static final CType INT = new CType("int", 0, List.of());
  public static final CType CHAR = new CType("char", 0, List.of());
  public static final CType LONG = new CType("long", 0, List.of());
  public static final CType FLOAT = new CType("float", 0, List.of());
  public static final CType DOUBLE = new CType("double", 0, List.of());
  public static final CType VOID = new CType("void", 0, List.of());
  public static final CType VOID_POINTER = new CType("void", 1, List.of());
  public static final CType CHAR_POINTER = new CType("char", 1, List.of());

  public CType {
    base = base.trim().replaceAll("\\s+", " ");
    dimensions = List.copyOf(dimensions);
  }

  public CType(String base, int pointerDepth, List<Integer> dimensions) {
    this(base, pointerDepth, dimensions, null);
  }

  /** The type of a {@code struct} or {@code union} value. */
  public static CType of(Aggregate aggregate) {
    return new CType(aggregate.toString(), 0, List.of(), aggregate);
  }

  /**
   * The same base with other pointer depth and dimensions.
   *
   * @param depth The pointer depth.
   * @param dims The array dimensions.
   * @return The type.
   */
  public CType reshape(int depth, List<Integer> dims) {
    return new CType(base, depth, dims, aggregate);
  }

  /**
   * Parse a type written as {@link #toString()} produces it, e.g. {@code "char*"} or
   * {@code "int[2][3]"}.
   *
   * @param text The type text.
   * @return The parsed type.
   */
  public static CType parse(String text) {
    return parse(text, name -> null);
  }

  /**
   * Parse a type, attaching the layout of a {@code struct} or {@code union} base.
   *
   * @param text The type text.
   * @param aggregates Finds the aggregate with a base name such as {@code "struct node"}, or
   *     returns {@code null}.
   * @return The parsed type.
   */
  public static CType parse(String text, Function<String, Aggregate> aggregates) {
    String rest = text.trim();
    List<Integer> dims = new ArrayList<>();
    while (rest.endsWith("]")) {
      int open = rest.lastIndexOf('[');
      dims.add(0, Integer.parseInt(rest.substring(open + 1, rest.length() - 1).trim()));
      rest = rest.substring(0, open).trim();
    } // while
    int depth = 0;
    while (rest.endsWith("*")) {
      depth++;
      rest = rest.substring(0, rest.length() - 1).trim();
    } // while
    return new CType(rest, depth, dims, aggregates.apply(rest.replaceAll("\\s+", " ")));
  }

  public boolean isArray() {
    return !dimensions.isEmpty();
  }

  public boolean isPointer() {
    return !isArray() && pointerDepth > 0;
  }

  /** Returns {@code true} for a {@code struct} or {@code union} value (not a pointer or array). */
  public boolean isAggregate() {
    return aggregate != null && pointerDepth == 0 && !isArray();
  }

  public boolean isVoid() {
    return pointerDepth == 0 && !isArray() && base.equals("void");
  }

  public boolean isFloating() {
    return pointerDepth == 0 && !isArray() && aggregate == null
        && (base.contains("double") || base.contains("float"));
  }

  public boolean isUnsigned() {
    return aggregate == null && base.contains("unsigned");
  }

  public boolean isBool() {
    return pointerDepth == 0 && (base.equals("_Bool") || base.equals("bool"));
  }

  /**
   * The type of one element of this array type (the first dimension removed).
   *
   * @return the element type
   */
  public CType elementType() {
    if (!isArray()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Type %s is not an array", this);
    }
    return new CType(base, pointerDepth, dimensions.subList(1, dimensions.size()), aggregate);
  }

  /**
   * The type an address of this type points to. Arrays decay to their element type.
   *
   * @return the pointed-to type
   */
  public CType pointee() {
    if (isArray()) {
      return elementType();
    } else if (pointerDepth > 0) {
      return new CType(base, pointerDepth - 1, List.of(), aggregate);
    }
    throw EngineException.of(ErrorKind.UNSUPPORTED, "Type %s is not a pointer", this);
  }

  public CType pointerTo() {
    return new CType(base, pointerDepth + 1, List.of(), aggregate);
  }

  /**
   * Size in bytes of one scalar slot of this type. LP64 sizes are used. The slot of a
   * {@code struct} or {@code union} is the whole aggregate.
   *
   * @return the scalar size
   */
  public int scalarSize() {
    if (pointerDepth > 0) {
      return POINTER_SIZE;
    } else if (aggregate != null) {
      return aggregate.size();
    }
    if (base.contains("char") || isBool() || base.equals("void")) {
      return 1;
    } else if (base.contains("short")) {
      return 2;
    } else if (base.contains("double")) {
      return 8;
    } else if (base.contains("float")) {
      return 4;
    } else if (base.contains("long")) {
      return 8;
    }
    return 4;
  }

  /**
   * Total size of the type in bytes.
   *
   * @return the size
   */
  public int size() {
    int size = scalarSize();
    for (int dim : dimensions) {
      size *= dim;
    } // for
    return size;
  }

  public int alignment() {
    if (pointerDepth == 0 && aggregate != null) {
      return aggregate.alignment();
    }
    return Math.min(scalarSize(), 8);
  }

  /**
   * The zero value of this type; arrays become nested sequences of zero values.
   *
   * @return the default value
   */
  public TraceValue defaultValue() {
    if (isArray()) {
      CType element = elementType();
      List<TraceValue> elements = new ArrayList<>();
      for (int i = 0; i < dimensions.get(0); i++) {
        elements.add(element.defaultValue());
      } // for
      return new TraceValue.Array(elements);
    } else if (isAggregate()) {
      return new TraceValue.Array(aggregate.members().stream()
          .map(m -> m.type().defaultValue())
          .toList());
    } else if (pointerDepth > 0) {
      return new TraceValue.Address(0, pointee());
    } else if (isFloating()) {
      return new TraceValue.Real(0.0);
    }
    return new TraceValue.Int(0);
  }

  /**
   * Convert a value to this type, as an assignment in C would.
   *
   * @param value The value to convert.
   * @return The converted value.
   * @throws EngineException if the value cannot be converted
   */
  public TraceValue coerce(TraceValue value) {
    if (isArray()) {
      if (value instanceof TraceValue.Array array) {
        return array;
      }
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot assign %s to array type %s",
          value.render(), this);
    } else if (isAggregate()) {
      return coerceMembers(value);
    } else if (value instanceof TraceValue.Array || value instanceof TraceValue.Void) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot convert %s to %s",
          value.render(), this);
    } else if (pointerDepth > 0) {
      if (value instanceof TraceValue.Real) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot convert %s to pointer type %s",
            value.render(), this);
      }
      return new TraceValue.Address(value.asLong(), pointee());
    } else if (isFloating()) {
      double d = value.asDouble();
      return new TraceValue.Real(scalarSize() == 4 ? (double) (float) d : d);
    } else if (isBool()) {
      return new TraceValue.Int(value.isTrue() ? 1 : 0);
    }
    return new TraceValue.Int(truncate(value.asLong()));
  } // coerce

  /** Members missing from a brace initializer get their zero value. */
  private TraceValue coerceMembers(TraceValue value) {
    List<Aggregate.Member> members = aggregate.members();
    if (!(value instanceof TraceValue.Array array) || array.elements().size() > members.size()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot convert %s to %s", value.render(),
          this);
    }
    List<TraceValue> converted = new ArrayList<>();
    for (int i = 0; i < members.size(); i++) {
      CType type = members.get(i).type();
      converted.add(i < array.elements().size()
          ? type.coerce(array.elements().get(i))
          : type.defaultValue());
    } // for
    return new TraceValue.Array(converted);
  }

  /**
   * Truncate an integer to the width and signedness of this integral type.
   *
   * @param value The value to truncate.
   * @return The truncated value.
   */
  public long truncate(long value) {
    boolean unsigned = isUnsigned();
    return switch (scalarSize()) {
      case 1 -> unsigned ? value & 0xFFL : (byte) value;
      case 2 -> unsigned ? value & 0xFFFFL : (short) value;
      case 4 -> unsigned ? value & 0xFFFFFFFFL : (int) value;
      default -> value;
    };
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(base);
    sb.append("*".repeat(pointerDepth));
    for (int dim : dimensions) {
      sb.append('[').append(dim).append(']');
    } // for
    return sb.toString();
  }
}
