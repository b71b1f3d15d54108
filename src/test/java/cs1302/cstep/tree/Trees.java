package cs1302.cstep.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shorthand for building syntax trees in tests. Every call creates fresh nodes, so a returned node
 * must be placed in a tree only once.
 */
public final class Trees {

  private static final Map<String, NodeKind> BINARY = Map.ofEntries(
      Map.entry("+", NodeKind.ADDITIVE_EXPR),
      Map.entry("-", NodeKind.ADDITIVE_EXPR),
      Map.entry("*", NodeKind.MULTIPLICATIVE_EXPR),
      Map.entry("/", NodeKind.MULTIPLICATIVE_EXPR),
      Map.entry("%", NodeKind.MULTIPLICATIVE_EXPR),
      Map.entry("<", NodeKind.RELATIONAL_EXPR),
      Map.entry(">", NodeKind.RELATIONAL_EXPR),
      Map.entry("<=", NodeKind.RELATIONAL_EXPR),
      Map.entry(">=", NodeKind.RELATIONAL_EXPR),
      Map.entry("==", NodeKind.EQUALITY_EXPR),
      Map.entry("!=", NodeKind.EQUALITY_EXPR),
      Map.entry("&&", NodeKind.LOGICAL_AND_EXPR),
      Map.entry("||", NodeKind.LOGICAL_OR_EXPR));

  private Trees() {}

  public static SyntaxNode program(SyntaxNode... tops) {
    return SyntaxNode.of(NodeKind.TRANSLATION_UNIT, 1, tops);
  }

  /**
   * A function definition.
   *
   * @param line The line of the signature.
   * @param type The return type, e.g. {@code "int"}.
   * @param name The function name.
   * @param params The {@code PARAMETER} nodes.
   * @param body The body block.
   * @return The definition.
   */
  public static SyntaxNode function(int line, String type, String name, List<SyntaxNode> params,
      SyntaxNode body) {
    return SyntaxNode.of(NodeKind.FUNCTION_DEF, name, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line),
        SyntaxNode.of(NodeKind.PARAMETER_LIST, line, params.toArray(SyntaxNode[]::new)),
        body);
  }

  public static SyntaxNode main(int line, SyntaxNode body) {
    return function(line, "int", "main", List.of(), body);
  }

  public static SyntaxNode param(int line, String type, String name) {
    return SyntaxNode.of(NodeKind.PARAMETER, name, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line));
  }

  public static SyntaxNode pointerParam(int line, String type, String name) {
    return SyntaxNode.of(NodeKind.PARAMETER, name, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line),
        SyntaxNode.of(NodeKind.POINTER, line));
  }

  public static SyntaxNode block(int line, SyntaxNode... statements) {
    return SyntaxNode.of(NodeKind.COMPOUND_STMT, line, statements);
  }

  // ---------------------------------------------------------------- declarations

  /**
   * A scalar declaration.
   *
   * @param line The line.
   * @param type The type, e.g. {@code "int"}.
   * @param name The variable name.
   * @param init The initializer, or {@code null}.
   * @return The declaration.
   */
  public static SyntaxNode var(int line, String type, String name, SyntaxNode init) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line));
    if (init != null) {
      children.add(init);
    }
    return SyntaxNode.of(NodeKind.VAR_DECL, name, line, children.toArray(SyntaxNode[]::new));
  }

  public static SyntaxNode staticVar(int line, String type, String name, SyntaxNode init) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(SyntaxNode.of(NodeKind.STORAGE_CLASS, "static", line));
    children.add(SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line));
    if (init != null) {
      children.add(init);
    }
    return SyntaxNode.of(NodeKind.VAR_DECL, name, line, children.toArray(SyntaxNode[]::new));
  }

  public static SyntaxNode pointerVar(int line, String type, String name, SyntaxNode init) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line));
    children.add(SyntaxNode.of(NodeKind.POINTER, line));
    if (init != null) {
      children.add(init);
    }
    return SyntaxNode.of(NodeKind.VAR_DECL, name, line, children.toArray(SyntaxNode[]::new));
  }

  /**
   * A one-dimensional array declaration.
   *
   * @param line The line.
   * @param type The element type.
   * @param name The variable name.
   * @param length The length.
   * @param elements The initializer list, or none.
   * @return The declaration.
   */
  public static SyntaxNode array(int line, String type, String name, int length,
      SyntaxNode... elements) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line));
    children.add(SyntaxNode.of(NodeKind.ARRAY_DIMENSION, line, num(line, length)));
    if (elements.length > 0) {
      children.add(SyntaxNode.of(NodeKind.INITIALIZER_LIST, line, elements));
    }
    return SyntaxNode.of(NodeKind.VAR_DECL, name, line, children.toArray(SyntaxNode[]::new));
  }

  /**
   * A {@code struct} or {@code union} definition.
   *
   * @param line The line.
   * @param kind {@link NodeKind#STRUCT_SPECIFIER} or {@link NodeKind#UNION_SPECIFIER}.
   * @param tag The tag, or the empty string.
   * @param members The {@code STRUCT_MEMBER_DECL} nodes.
   * @return The specifier.
   */
  public static SyntaxNode aggregate(int line, NodeKind kind, String tag, SyntaxNode... members) {
    return SyntaxNode.of(kind, tag, line, members);
  }

  public static SyntaxNode struct(int line, String tag, SyntaxNode... members) {
    return aggregate(line, NodeKind.STRUCT_SPECIFIER, tag, members);
  }

  /** A member of a scalar type. */
  public static SyntaxNode field(int line, String type, String name) {
    return SyntaxNode.of(NodeKind.STRUCT_MEMBER_DECL, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line),
        SyntaxNode.of(NodeKind.STRUCT_MEMBER, name, line));
  }

  /** A member of an array type. */
  public static SyntaxNode arrayField(int line, String type, String name, int length) {
    return SyntaxNode.of(NodeKind.STRUCT_MEMBER_DECL, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line),
        SyntaxNode.of(NodeKind.STRUCT_MEMBER, name, line,
            SyntaxNode.of(NodeKind.ARRAY_DIMENSION, line, num(line, length))));
  }

  /** A member that points to a {@code struct}. */
  public static SyntaxNode structPointerField(int line, String tag, String name) {
    return SyntaxNode.of(NodeKind.STRUCT_MEMBER_DECL, line,
        struct(line, tag),
        SyntaxNode.of(NodeKind.STRUCT_MEMBER, name, line, SyntaxNode.of(NodeKind.POINTER, line)));
  }

  /** A variable of type {@code struct tag}, optionally brace-initialized. */
  public static SyntaxNode structVar(int line, String tag, String name, SyntaxNode... init) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(struct(line, tag));
    if (init.length > 0) {
      children.add(SyntaxNode.of(NodeKind.INITIALIZER_LIST, line, init));
    }
    return SyntaxNode.of(NodeKind.VAR_DECL, name, line, children.toArray(SyntaxNode[]::new));
  }

  public static SyntaxNode structPointerVar(int line, String tag, String name, SyntaxNode init) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(struct(line, tag));
    children.add(SyntaxNode.of(NodeKind.POINTER, line));
    if (init != null) {
      children.add(init);
    }
    return SyntaxNode.of(NodeKind.VAR_DECL, name, line, children.toArray(SyntaxNode[]::new));
  }

  // ---------------------------------------------------------------- statements

  public static SyntaxNode expr(int line, SyntaxNode expression) {
    return SyntaxNode.of(NodeKind.EXPR_STMT, line, expression);
  }

  public static SyntaxNode ret(int line, SyntaxNode value) {
    return SyntaxNode.of(NodeKind.RETURN_STMT, line, value);
  }

  public static SyntaxNode ret(int line) {
    return SyntaxNode.of(NodeKind.RETURN_STMT, line);
  }

  public static SyntaxNode whileLoop(int line, SyntaxNode condition, SyntaxNode body) {
    return SyntaxNode.of(NodeKind.WHILE_STMT, line, condition, body);
  }

  public static SyntaxNode doWhile(int line, SyntaxNode body, SyntaxNode condition) {
    return SyntaxNode.of(NodeKind.DO_WHILE_STMT, line, body, condition);
  }

  /**
   * A {@code for} loop. Pass {@link #empty} for a missing clause.
   *
   * @param line The line.
   * @param init The init clause: an expression or a declaration.
   * @param condition The condition.
   * @param update The update expression.
   * @param body The body.
   * @return The loop.
   */
  public static SyntaxNode forLoop(int line, SyntaxNode init, SyntaxNode condition,
      SyntaxNode update, SyntaxNode body) {
    return SyntaxNode.of(NodeKind.FOR_STMT, line, init, condition, update, body);
  }

  public static SyntaxNode ifElse(int line, SyntaxNode condition, SyntaxNode then,
      SyntaxNode otherwise) {
    return otherwise == null
        ? SyntaxNode.of(NodeKind.IF_STMT, line, condition, then)
        : SyntaxNode.of(NodeKind.IF_STMT, line, condition, then, otherwise);
  }

  public static SyntaxNode switchOn(int line, SyntaxNode value, SyntaxNode... labels) {
    return SyntaxNode.of(NodeKind.SWITCH_STMT, line, value, block(line, labels));
  }

  public static SyntaxNode caseLabel(int line, int value, SyntaxNode statement) {
    return SyntaxNode.of(NodeKind.CASE_STMT, line, num(line, value), statement);
  }

  public static SyntaxNode defaultLabel(int line, SyntaxNode statement) {
    return SyntaxNode.of(NodeKind.DEFAULT_STMT, line, statement);
  }

  public static SyntaxNode breakStmt(int line) {
    return SyntaxNode.of(NodeKind.BREAK_STMT, line);
  }

  public static SyntaxNode continueStmt(int line) {
    return SyntaxNode.of(NodeKind.CONTINUE_STMT, line);
  }

  // ---------------------------------------------------------------- expressions

  public static SyntaxNode empty(int line) {
    return SyntaxNode.of(NodeKind.EMPTY_EXPR, line);
  }

  public static SyntaxNode num(int line, long value) {
    return SyntaxNode.of(NodeKind.INT_LITERAL, Long.toString(value), line);
  }

  public static SyntaxNode real(int line, String text) {
    return SyntaxNode.of(NodeKind.FLOAT_LITERAL, text, line);
  }

  public static SyntaxNode chr(int line, String text) {
    return SyntaxNode.of(NodeKind.CHAR_LITERAL, text, line);
  }

  public static SyntaxNode str(int line, String text) {
    return SyntaxNode.of(NodeKind.STRING_LITERAL, text, line);
  }

  public static SyntaxNode id(int line, String name) {
    return SyntaxNode.of(NodeKind.IDENTIFIER_EXPR, name, line);
  }

  /**
   * A binary operation.
   *
   * @param line The line.
   * @param op An arithmetic, relational, equality or logical operator.
   * @param left The left operand.
   * @param right The right operand.
   * @return The expression.
   */
  public static SyntaxNode op(int line, String op, SyntaxNode left, SyntaxNode right) {
    NodeKind kind = BINARY.get(op);
    if (kind == null) {
      throw new IllegalArgumentException("Unknown operator " + op);
    }
    return SyntaxNode.of(kind, op, line, left, right);
  }

  public static SyntaxNode ternary(int line, SyntaxNode condition, SyntaxNode then,
      SyntaxNode otherwise) {
    return SyntaxNode.of(NodeKind.CONDITIONAL_EXPR, line, condition, then, otherwise);
  }

  public static SyntaxNode assign(int line, String op, SyntaxNode target, SyntaxNode value) {
    return SyntaxNode.of(NodeKind.ASSIGN_EXPR, op, line, target, value);
  }

  public static SyntaxNode assign(int line, String name, SyntaxNode value) {
    return assign(line, "=", id(line, name), value);
  }

  public static SyntaxNode increment(int line, String name) {
    return SyntaxNode.of(NodeKind.POSTFIX_EXPR, "++", line, id(line, name));
  }

  public static SyntaxNode unary(int line, String op, SyntaxNode operand) {
    return SyntaxNode.of(NodeKind.UNARY_EXPR, op, line, operand);
  }

  public static SyntaxNode index(int line, SyntaxNode base, SyntaxNode subscript) {
    return SyntaxNode.of(NodeKind.ARRAY_SUBSCRIPT_EXPR, line, base, subscript);
  }

  /**
   * A call of a named function.
   *
   * @param line The line.
   * @param name The function name.
   * @param args The arguments.
   * @return The call.
   */
  public static SyntaxNode call(int line, String name, SyntaxNode... args) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(id(line, name));
    children.addAll(List.of(args));
    return SyntaxNode.of(NodeKind.CALL_EXPR, line, children.toArray(SyntaxNode[]::new));
  }

  /** A cast to a pointer of the given base type. */
  public static SyntaxNode pointerCast(int line, String type, SyntaxNode value) {
    return SyntaxNode.of(NodeKind.CAST_EXPR, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line),
        SyntaxNode.of(NodeKind.POINTER, line),
        value);
  }

  public static SyntaxNode dot(int line, SyntaxNode base, String member) {
    return SyntaxNode.of(NodeKind.MEMBER_EXPR, member, line, base);
  }

  public static SyntaxNode arrow(int line, SyntaxNode base, String member) {
    return SyntaxNode.of(NodeKind.ARROW_EXPR, member, line, base);
  }

  public static SyntaxNode sizeOfStruct(int line, String tag) {
    return SyntaxNode.of(NodeKind.SIZEOF_TYPE, line, struct(line, tag));
  }

  public static SyntaxNode sizeOf(int line, String type) {
    return SyntaxNode.of(NodeKind.SIZEOF_TYPE, line,
        SyntaxNode.of(NodeKind.TYPE_SPECIFIER, type, line));
  }
}
