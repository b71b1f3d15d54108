package cs1302.cstep.trace;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The layout of a {@code struct} or {@code union}. An aggregate is created incomplete when its
 * tag is first seen and completed by {@link #define}, so a member may point to the aggregate that
 * contains it. Two aggregates are equal when they have the same keyword and tag; members are not
 * compared.
 */
public final class Aggregate {

  /** {@code struct} or {@code union}. */
  public enum Kind {
    STRUCT,
    UNION;

    public String keyword() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * A member as declared.
   *
   * @param name The member name.
   * @param type The member type.
   */
  public record Field(String name, CType type) {}

  /**
   * A laid out member.
   *
   * @param name The member name.
   * @param type The member type.
   * @param offset The byte offset from the start of the aggregate; always {@code 0} in a union.
   */
  public record Member(String name, CType type, int offset) {}

  private final Kind kind;
  private final String tag;
  private List<Member> members;
  private int size;
  private int alignment = 1;

  public Aggregate(Kind kind, String tag) {
    this.kind = kind;
    this.tag = tag;
  }

  /**
   * Complete the aggregate: lay out the members in order with natural alignment (all at offset 0
   * in a union) and round the size up to the strictest member alignment.
   *
   * @param fields The members in declaration order.
   * @throws EngineException if the aggregate is already complete, has no members, declares a
   *     member twice or contains itself by value
   */
  public void define(List<Field> fields) {
    if (members != null) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Redefinition of %s", this);
    } else if (fields.isEmpty()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "%s has no members", this);
    }
    List<Member> laidOut = new ArrayList<>();
    Set<String> names = new HashSet<>();
    int end = 0;
    int strictest = 1;
    for (Field field : fields) {
      CType type = field.type();
      if (!names.add(field.name())) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "Duplicate member '%s' in %s",
            field.name(), this);
      } else if (type.pointerDepth() == 0 && this.equals(type.aggregate())) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "%s contains itself", this);
      }
      int align = type.alignment();
      int offset = kind == Kind.UNION ? 0 : (end + align - 1) / align * align;
      laidOut.add(new Member(field.name(), type, offset));
      end = Math.max(end, offset + type.size());
      strictest = Math.max(strictest, align);
    } // for
    members = List.copyOf(laidOut);
    alignment = strictest;
    size = (end + strictest - 1) / strictest * strictest;
  } // define

  public Kind kind() {
    return kind;
  }

  public String tag() {
    return tag;
  }

  public boolean isComplete() {
    return members != null;
  }

  /** The members in declaration order. */
  public List<Member> members() {
    requireComplete();
    return members;
  }

  /** The members as declared, for re-creating the aggregate elsewhere. */
  public List<Field> fields() {
    return members().stream().map(m -> new Field(m.name(), m.type())).toList();
  }

  /**
   * Find a member.
   *
   * @param name The member name.
   * @return The member, if the aggregate has one with that name.
   */
  public Optional<Member> member(String name) {
    return members().stream().filter(m -> m.name().equals(name)).findFirst();
  }

  public int indexOf(Member member) {
    return members().indexOf(member);
  }

  public int size() {
    requireComplete();
    return size;
  }

  public int alignment() {
    requireComplete();
    return alignment;
  }

  private void requireComplete() {
    if (members == null) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "%s is an incomplete type", this);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Aggregate other && kind == other.kind && tag.equals(other.tag);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + tag.hashCode();
  }

  @Override
  public String toString() {
    return kind.keyword() + " " + tag;
  }
}
