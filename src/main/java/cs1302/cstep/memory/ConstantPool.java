package cs1302.cstep.memory;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Read-only literal data, deduplicated by content and placed in the constant segment. */
final class ConstantPool {

  /**
   * A string literal stored as NUL-terminated bytes.
   *
   * @param address The address of the first character.
   * @param content The literal text.
   */
  record Constant(long address, String content) {

    byte[] bytes() {
      byte[] text = content.getBytes(StandardCharsets.ISO_8859_1);
      byte[] bytes = new byte[text.length + 1];
      System.arraycopy(text, 0, bytes, 0, text.length);
      return bytes;
    }

    long size() {
      return content.getBytes(StandardCharsets.ISO_8859_1).length + 1L;
    }

    boolean contains(long candidate) {
      return candidate >= address && candidate < address + size();
    }
  }

  private final Map<String, Constant> constants = new LinkedHashMap<>();
  private long top = Segment.CONSTANTS.base();

  /**
   * Get the address of a literal, placing it on first use.
   *
   * @param content The literal text.
   * @return The stable address of the literal.
   */
  long intern(String content) {
    Constant existing = constants.get(content);
    if (existing != null) {
      return existing.address();
    }
    Constant constant = new Constant(top, content);
    if (top + constant.size() > Segment.CONSTANTS.limit()) {
      throw EngineException.of(ErrorKind.OUT_OF_MEMORY, "Constant segment is full");
    }
    constants.put(content, constant);
    top += constant.size();
    return constant.address();
  }

  Optional<Constant> find(long address) {
    return constants.values().stream().filter(c -> c.contains(address)).findFirst();
  }

  Collection<Constant> all() {
    return Collections.unmodifiableCollection(new ArrayList<>(constants.values()));
  }

  long used() {
    return top - Segment.CONSTANTS.base();
  }

  void clear() {
    constants.clear();
    top = Segment.CONSTANTS.base();
  }

  void restore(Collection<Constant> saved) {
    clear();
    for (Constant constant : saved) {
      constants.put(constant.content(), constant);
      top = Math.max(top, constant.address() + constant.size());
    } // for
  }
}
