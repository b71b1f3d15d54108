package cs1302.cstep.tree;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;

/** Every kind of syntax tree node the engine understands. */
public enum NodeKind {
  // structure
  TRANSLATION_UNIT(Category.STRUCTURE),
  FUNCTION_DEF(Category.STRUCTURE),
  FUNCTION_DECL(Category.DECLARATION),
  PARAMETER_LIST(Category.STRUCTURE),
  PARAMETER(Category.STRUCTURE),
  TYPEDEF_DECL(Category.DECLARATION),

  // declarations
  DECLARATION(Category.DECLARATION),
  MULTI_VAR_DECL(Category.DECLARATION),
  VAR_DECL(Category.DECLARATION),
  INITIALIZER_LIST(Category.STRUCTURE),

  // type information
  TYPE_SPECIFIER(Category.TYPE),
  STORAGE_CLASS(Category.TYPE),
  TYPE_QUALIFIER(Category.TYPE),
  POINTER(Category.TYPE),
  ARRAY_DIMENSION(Category.TYPE),
  STRUCT_SPECIFIER(Category.TYPE),
  UNION_SPECIFIER(Category.TYPE),
  STRUCT_MEMBER_DECL(Category.STRUCTURE),
  STRUCT_MEMBER(Category.STRUCTURE),

  // statements
  COMPOUND_STMT(Category.STATEMENT),
  EXPR_STMT(Category.STATEMENT),
  IF_STMT(Category.STATEMENT),
  WHILE_STMT(Category.STATEMENT),
  DO_WHILE_STMT(Category.STATEMENT),
  FOR_STMT(Category.STATEMENT),
  SWITCH_STMT(Category.STATEMENT),
  CASE_STMT(Category.STATEMENT),
  DEFAULT_STMT(Category.STATEMENT),
  BREAK_STMT(Category.STATEMENT),
  CONTINUE_STMT(Category.STATEMENT),
  RETURN_STMT(Category.STATEMENT),
  EMPTY_STMT(Category.STATEMENT),
  LABELED_STMT(Category.STATEMENT),

  // expressions
  EMPTY_EXPR(Category.EXPRESSION),
  INT_LITERAL(Category.EXPRESSION),
  FLOAT_LITERAL(Category.EXPRESSION),
  CHAR_LITERAL(Category.EXPRESSION),
  STRING_LITERAL(Category.EXPRESSION),
  IDENTIFIER_EXPR(Category.EXPRESSION),
  ADDITIVE_EXPR(Category.EXPRESSION),
  MULTIPLICATIVE_EXPR(Category.EXPRESSION),
  RELATIONAL_EXPR(Category.EXPRESSION),
  EQUALITY_EXPR(Category.EXPRESSION),
  SHIFT_EXPR(Category.EXPRESSION),
  BITWISE_AND_EXPR(Category.EXPRESSION),
  BITWISE_OR_EXPR(Category.EXPRESSION),
  BITWISE_XOR_EXPR(Category.EXPRESSION),
  LOGICAL_AND_EXPR(Category.EXPRESSION),
  LOGICAL_OR_EXPR(Category.EXPRESSION),
  UNARY_EXPR(Category.EXPRESSION),
  PREFIX_EXPR(Category.EXPRESSION),
  POSTFIX_EXPR(Category.EXPRESSION),
  ASSIGN_EXPR(Category.EXPRESSION),
  CONDITIONAL_EXPR(Category.EXPRESSION),
  COMMA_EXPR(Category.EXPRESSION),
  CALL_EXPR(Category.EXPRESSION),
  ARRAY_SUBSCRIPT_EXPR(Category.EXPRESSION),
  MEMBER_EXPR(Category.EXPRESSION),
  ARROW_EXPR(Category.EXPRESSION),
  CAST_EXPR(Category.EXPRESSION),
  SIZEOF_EXPR(Category.EXPRESSION),
  SIZEOF_TYPE(Category.EXPRESSION);

  /** Broad grouping of node kinds. */
  public enum Category {
    STRUCTURE,
    DECLARATION,
    TYPE,
    STATEMENT,
    EXPRESSION
  }

  private final Category category;

  NodeKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  /**
   * Look up the node kind with the given name.
   *
   * @param name The kind name as produced by the parser, e.g. {@code "WHILE_STMT"}.
   * @return The matching node kind.
   * @throws EngineException if no kind has that name
   */
  public static NodeKind parse(String name) {
    try {
      return NodeKind.valueOf(name.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Unsupported node kind '%s'", name);
    }
  } // parse
}
