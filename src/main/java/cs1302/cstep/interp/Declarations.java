package cs1302.cstep.interp;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.memory.StorageClass;
import cs1302.cstep.trace.Aggregate;
import cs1302.cstep.trace.CType;
import cs1302.cstep.tree.NodeKind;
import cs1302.cstep.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Reads types, storage classes and initializers out of declaration nodes ({@code VAR_DECL},
 * {@code PARAMETER}, {@code FUNCTION_DEF}, and the type nodes of casts and {@code sizeof}).
 *
 * <p>{@code struct} and {@code union} tags form one namespace for the whole program.
 */
final class Declarations {

  private final Map<String, CType> typedefs = new HashMap<>();
  private final Map<String, Aggregate> aggregates = new HashMap<>();
  private final Map<SyntaxNode, Aggregate> definitions = new IdentityHashMap<>();

  void clear() {
    typedefs.clear();
    aggregates.clear();
    definitions.clear();
  }

  /**
   * Lay out every {@code struct} and {@code union} the program defines, in source order, so that
   * their tags can be used anywhere.
   *
   * @param tree The program.
   * @param dimension Evaluates the expression of an array dimension.
   */
  void defineAggregates(SyntaxNode tree, ToLongFunction<SyntaxNode> dimension) {
    if ((tree.kind() == NodeKind.STRUCT_SPECIFIER || tree.kind() == NodeKind.UNION_SPECIFIER)
        && !tree.childrenOf(NodeKind.STRUCT_MEMBER_DECL).isEmpty()) {
      aggregate(tree, dimension);
    }
    for (SyntaxNode child : tree.children()) {
      defineAggregates(child, dimension);
    } // for
  }

  /**
   * The aggregate a {@code STRUCT_SPECIFIER} or {@code UNION_SPECIFIER} names. A specifier with
   * members defines it; one without only refers to it and may leave it incomplete.
   *
   * @param specifier The specifier; its value is the tag, empty for an anonymous aggregate.
   * @param dimension Evaluates the expression of an array dimension.
   * @return The aggregate.
   * @throws EngineException if a tag is defined twice
   */
  Aggregate aggregate(SyntaxNode specifier, ToLongFunction<SyntaxNode> dimension) {
    Aggregate known = definitions.get(specifier);
    if (known != null) {
      return known;
    }
    Aggregate.Kind kind = specifier.kind() == NodeKind.UNION_SPECIFIER
        ? Aggregate.Kind.UNION
        : Aggregate.Kind.STRUCT;
    String tag = specifier.value().isBlank()
        ? String.format("anonymous#%d@%d", definitions.size() + 1, specifier.line())
        : specifier.value().trim();
    Aggregate aggregate = aggregates.computeIfAbsent(kind.keyword() + " " + tag,
        key -> new Aggregate(kind, tag));
    List<SyntaxNode> memberDecls = specifier.childrenOf(NodeKind.STRUCT_MEMBER_DECL);
    if (memberDecls.isEmpty()) {
      return aggregate;
    } else if (aggregate.isComplete()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Redefinition of %s on line %d", aggregate,
          specifier.line());
    }
    definitions.put(specifier, aggregate);
    List<Aggregate.Field> fields = new ArrayList<>();
    for (SyntaxNode memberDecl : memberDecls) {
      CType base = baseType(memberDecl.children(), dimension);
      for (SyntaxNode member : memberDecl.childrenOf(NodeKind.STRUCT_MEMBER)) {
        List<Integer> dims = new ArrayList<>();
        for (SyntaxNode dim : member.childrenOf(NodeKind.ARRAY_DIMENSION)) {
          long length = dim.childCount() == 0 ? 0 : dimension.applyAsLong(dim.child(0));
          if (length <= 0) {
            throw EngineException.of(ErrorKind.UNSUPPORTED,
                "Member '%s' on line %d needs a positive length", member.value(), member.line());
          }
          dims.add((int) length);
        } // for
        dims.addAll(base.dimensions());
        fields.add(new Aggregate.Field(member.value(),
            base.reshape(base.pointerDepth() + pointerDepth(member.children()), dims)));
      } // for
    } // for
    aggregate.define(fields);
    return aggregate;
  } // aggregate

  /**
   * Register a {@code typedef}.
   *
   * @param typedef A {@code TYPEDEF_DECL} node whose value is the new name.
   * @param dimension Evaluates the expression of an array dimension.
   */
  void define(SyntaxNode typedef, ToLongFunction<SyntaxNode> dimension) {
    typedefs.put(typedef.value(), declaredType(typedef, dimension));
  }

  /**
   * Find an aggregate by the base name of its type.
   *
   * @param base A base such as {@code "struct node"}.
   * @return The aggregate, or {@code null}.
   */
  Aggregate findAggregate(String base) {
    return aggregates.get(base);
  }

  /**
   * The type of a declared variable. An empty first dimension is sized from the initializer.
   *
   * @param decl The declaration.
   * @param dimension Evaluates the expression of an array dimension.
   * @return The type.
   */
  CType declaredType(SyntaxNode decl, ToLongFunction<SyntaxNode> dimension) {
    CType base = baseType(decl.children(), dimension);
    List<Integer> dims = new ArrayList<>();
    for (SyntaxNode dim : decl.childrenOf(NodeKind.ARRAY_DIMENSION)) {
      if (dim.childCount() == 0 || dim.child(0).isEmpty()) {
        dims.add(inferredLength(decl));
        continue;
      }
      long length = dimension.applyAsLong(dim.child(0));
      if (length <= 0) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "Array '%s' on line %d has length %d",
            decl.value(), decl.line(), length);
      }
      dims.add((int) length);
    } // for
    dims.addAll(base.dimensions());
    return base.reshape(base.pointerDepth() + pointerDepth(decl.children()), dims);
  } // declaredType

  /**
   * The type of a parameter. An array parameter decays to a pointer to its element type.
   *
   * @param parameter The {@code PARAMETER} node.
   * @return The type.
   */
  CType parameterType(SyntaxNode parameter) {
    CType base = baseType(parameter.children(), e -> {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Parameter '%s' on line %d defines a type",
          parameter.value(), parameter.line());
    });
    int depth = base.pointerDepth() + pointerDepth(parameter.children());
    if (!parameter.childrenOf(NodeKind.ARRAY_DIMENSION).isEmpty() || base.isArray()) {
      depth++;
    }
    return base.reshape(depth, List.of());
  }

  /**
   * The type named by the type nodes of a cast or {@code sizeof}.
   *
   * @param nodes The nodes; anything that is not a type node is ignored.
   * @param dimension Evaluates the expression of an array dimension.
   * @return The type.
   */
  CType typeName(List<SyntaxNode> nodes, ToLongFunction<SyntaxNode> dimension) {
    CType base = baseType(nodes, dimension);
    List<Integer> dims = new ArrayList<>();
    for (SyntaxNode node : nodes) {
      if (node.kind() == NodeKind.ARRAY_DIMENSION && node.childCount() > 0) {
        dims.add((int) dimension.applyAsLong(node.child(0)));
      }
    } // for
    dims.addAll(base.dimensions());
    return base.reshape(base.pointerDepth() + pointerDepth(nodes), dims);
  }

  /**
   * The return type of a function definition or declaration.
   *
   * @param function The function node.
   * @return The type.
   */
  CType returnType(SyntaxNode function) {
    CType base = baseType(function.children(), e -> {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Function '%s' on line %d defines a type",
          function.value(), function.line());
    });
    return base.reshape(base.pointerDepth() + pointerDepth(function.children()), List.of());
  }

  static StorageClass storage(SyntaxNode decl) {
    return decl.firstChild(NodeKind.STORAGE_CLASS)
        .map(s -> StorageClass.fromKeyword(s.value()))
        .orElse(StorageClass.AUTO);
  }

  /**
   * The initializer of a declaration.
   *
   * @param decl The declaration.
   * @return The initializer expression or list, or {@code null}.
   */
  static SyntaxNode initializer(SyntaxNode decl) {
    SyntaxNode found = null;
    for (SyntaxNode child : decl.children()) {
      if (child.kind() == NodeKind.INITIALIZER_LIST
          || (child.kind().category() == NodeKind.Category.EXPRESSION && !child.isEmpty())) {
        found = child;
      }
    } // for
    return found;
  }

  /** The parameters of a function, in order. */
  static List<SyntaxNode> parameters(SyntaxNode function) {
    return function.firstChild(NodeKind.PARAMETER_LIST)
        .map(list -> list.childrenOf(NodeKind.PARAMETER).stream()
            .filter(p -> !p.value().isEmpty())
            .toList())
        .orElse(List.of());
  }

  private CType baseType(List<SyntaxNode> nodes, ToLongFunction<SyntaxNode> dimension) {
    for (SyntaxNode node : nodes) {
      if (node.kind() == NodeKind.STRUCT_SPECIFIER || node.kind() == NodeKind.UNION_SPECIFIER) {
        return CType.of(aggregate(node, dimension));
      }
    } // for
    String words = nodes.stream()
        .filter(n -> n.kind() == NodeKind.TYPE_SPECIFIER)
        .map(SyntaxNode::value)
        .collect(Collectors.joining(" "))
        .trim();
    if (words.isEmpty()) {
      return CType.INT;
    }
    CType alias = typedefs.get(words);
    if (alias != null) {
      return alias;
    }
    if (words.equals("unsigned") || words.equals("signed")) {
      words = words + " int";
    }
    return new CType(words, 0, List.of());
  }

  private static int pointerDepth(List<SyntaxNode> nodes) {
    int depth = 0;
    for (SyntaxNode node : nodes) {
      if (node.kind() != NodeKind.POINTER) {
        continue;
      }
      String value = node.value().trim();
      if (value.isEmpty()) {
        depth++;
      } else if (value.chars().allMatch(Character::isDigit)) {
        depth += Integer.parseInt(value);
      } else {
        depth += (int) value.chars().filter(c -> c == '*').count();
      }
    } // for
    return depth;
  }

  private static int inferredLength(SyntaxNode decl) {
    SyntaxNode init = initializer(decl);
    if (init == null) {
      throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Array '%s' on line %d needs a length or an initializer", decl.value(), decl.line());
    } else if (init.kind() == NodeKind.INITIALIZER_LIST) {
      return init.childCount();
    } else if (init.kind() == NodeKind.STRING_LITERAL) {
      return init.value().length() + 1;
    }
    throw EngineException.of(ErrorKind.UNSUPPORTED,
        "Array '%s' on line %d needs an initializer list", decl.value(), decl.line());
  }
}
