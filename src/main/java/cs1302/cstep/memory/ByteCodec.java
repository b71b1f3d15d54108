package cs1302.cstep.memory;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.trace.Aggregate;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Little-endian conversion between values and their in-memory bytes. A {@code struct} or
 * {@code union} value is a {@link TraceValue.Array} with one element per member.
 */
public final class ByteCodec {

  private ByteCodec() {}

  /**
   * Encode a value of the given type.
   *
   * @param type The type of the value.
   * @param value The value, already converted to {@code type}.
   * @return {@code type.size()} bytes.
   */
  public static byte[] encode(CType type, TraceValue value) {
    ByteBuffer buffer = ByteBuffer.allocate(type.size()).order(ByteOrder.LITTLE_ENDIAN);
    put(buffer, type, value);
    return buffer.array();
  }

  private static void put(ByteBuffer buffer, CType type, TraceValue value) {
    if (type.isArray()) {
      CType element = type.elementType();
      List<TraceValue> elements = ((TraceValue.Array) value).elements();
      for (TraceValue e : elements) {
        put(buffer, element, e);
      } // for
      return;
    } else if (type.isAggregate()) {
      putMembers(buffer, type.aggregate(), ((TraceValue.Array) value).elements());
      return;
    }
    if (type.pointerDepth() > 0) {
      buffer.putLong(value.asLong());
    } else if (type.isFloating()) {
      if (type.scalarSize() == 4) {
        buffer.putFloat((float) value.asDouble());
      } else {
        buffer.putDouble(value.asDouble());
      }
    } else {
      long raw = value.asLong();
      switch (type.scalarSize()) {
        case 1 -> buffer.put((byte) raw);
        case 2 -> buffer.putShort((short) raw);
        case 4 -> buffer.putInt((int) raw);
        default -> buffer.putLong(raw);
      }
    }
  } // put

  /**
   * Members are written at their offsets. The members of a union overlap: the larger ones are
   * written first and the first member last, so it wins where a brace initializer set only it.
   */
  private static void putMembers(ByteBuffer buffer, Aggregate aggregate,
      List<TraceValue> values) {
    int start = buffer.position();
    List<Aggregate.Member> members = aggregate.members();
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < members.size(); i++) {
      order.add(i);
    } // for
    if (aggregate.kind() == Aggregate.Kind.UNION) {
      order.sort((a, b) -> Integer.compare(members.get(b).type().size(),
          members.get(a).type().size()));
      order.add(0);
    }
    for (int i : order) {
      Aggregate.Member member = members.get(i);
      buffer.position(start + member.offset());
      put(buffer, member.type(), values.get(i));
    } // for
    buffer.position(start + aggregate.size());
  }

  /**
   * Decode a value of the given type.
   *
   * @param type The type to decode.
   * @param bytes The source bytes.
   * @param offset The offset of the first byte of the value.
   * @return The decoded value.
   */
  public static TraceValue decode(CType type, byte[] bytes, int offset) {
    if (type.isVoid()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot read a value of type void");
    }
    if (offset < 0 || offset + type.size() > bytes.length) {
      throw EngineException.of(ErrorKind.OUT_OF_BOUNDS,
          "Reading %d bytes at offset %d overruns %d bytes", type.size(), offset, bytes.length);
    }
    ByteBuffer buffer =
        ByteBuffer.wrap(bytes, offset, type.size()).slice().order(ByteOrder.LITTLE_ENDIAN);
    return get(buffer, type);
  }

  private static TraceValue get(ByteBuffer buffer, CType type) {
    if (type.isArray()) {
      CType element = type.elementType();
      List<TraceValue> elements = new ArrayList<>();
      for (int i = 0; i < type.dimensions().get(0); i++) {
        elements.add(get(buffer, element));
      } // for
      return new TraceValue.Array(elements);
    } else if (type.isAggregate()) {
      int start = buffer.position();
      List<TraceValue> members = new ArrayList<>();
      for (Aggregate.Member member : type.aggregate().members()) {
        buffer.position(start + member.offset());
        members.add(get(buffer, member.type()));
      } // for
      buffer.position(start + type.size());
      return new TraceValue.Array(members);
    }
    if (type.pointerDepth() > 0) {
      return new TraceValue.Address(buffer.getLong(), type.pointee());
    } else if (type.isFloating()) {
      return new TraceValue.Real(type.scalarSize() == 4 ? buffer.getFloat() : buffer.getDouble());
    }
    long raw = switch (type.scalarSize()) {
      case 1 -> buffer.get();
      case 2 -> buffer.getShort();
      case 4 -> buffer.getInt();
      default -> buffer.getLong();
    };
    return new TraceValue.Int(type.isBool() ? (raw != 0 ? 1 : 0) : type.truncate(raw));
  } // get
}
