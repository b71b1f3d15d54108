package cs1302.cstep.interp;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.memory.Variable;
import cs1302.cstep.trace.Aggregate;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.NodeKind;
import cs1302.cstep.tree.SyntaxNode;
import cs1302.cstep.tree.TreeIndex;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive evaluation of expression nodes against a {@link MemoryModel}.
 *
 * <p>Calls of user functions are not evaluated here. Reaching a call whose result is unknown throws
 * a {@link CallRequest} so that the interpreter can step into the callee. Every completed
 * subexpression of the current unit is recorded by node id; when the unit resumes after the call,
 * {@link #begin} hands the record back and those subexpressions are not evaluated again.
 */
final class ExpressionEvaluator {

  private final MemoryModel memory;
  private final Builtins builtins;
  private final Declarations declarations;
  private Map<String, SyntaxNode> functions = Map.of();
  private TreeIndex index;
  private final Map<Integer, TraceValue> values = new HashMap<>();
  private final Map<Integer, TraceValue.Address> locations = new HashMap<>();
  private String functionName = "";

  ExpressionEvaluator(MemoryModel memory, Builtins builtins, Declarations declarations) {
    this.memory = memory;
    this.builtins = builtins;
    this.declarations = declarations;
  }

  void setProgram(TreeIndex index) {
    this.index = index;
    this.functions = index.functions();
  }

  /**
   * Prepare for the evaluation of one unit.
   *
   * @param progress What the unit computed before it stepped into its last call.
   * @param function The name of the executing function, recorded as the origin of allocations.
   */
  void begin(UnitProgress progress, String function) {
    values.clear();
    values.putAll(progress.values());
    locations.clear();
    locations.putAll(progress.locations());
    this.functionName = function;
  }

  /**
   * What the current unit has computed so far.
   *
   * @param pendingCall The call the unit waits for.
   * @return The record {@link #begin} resumes from.
   */
  UnitProgress progress(SyntaxNode pendingCall) {
    return new UnitProgress(values, locations, index.id(pendingCall));
  }

  /** Returns {@code true} if the current unit already completed the declaration. */
  boolean declared(SyntaxNode decl) {
    return values.containsKey(index.id(decl));
  }

  void markDeclared(SyntaxNode decl) {
    values.put(index.id(decl), new TraceValue.Void());
  }

  /**
   * Evaluate an expression.
   *
   * @param node The expression.
   * @return Its value. Arrays decay to the address of their first element.
   */
  TraceValue evaluate(SyntaxNode node) {
    int id = index.id(node);
    TraceValue known = values.get(id);
    if (known != null) {
      return known;
    }
    TraceValue value = compute(node);
    values.put(id, value);
    return value;
  }

  private TraceValue compute(SyntaxNode node) {
    return switch (node.kind()) {
      case EMPTY_EXPR -> new TraceValue.Void();
      case INT_LITERAL -> new TraceValue.Int(integerLiteral(node));
      case FLOAT_LITERAL -> new TraceValue.Real(floatLiteral(node));
      case CHAR_LITERAL -> new TraceValue.Int(charLiteral(node.value()));
      case STRING_LITERAL -> new TraceValue.Address(memory.internString(node.value()), CType.CHAR);
      case IDENTIFIER_EXPR -> identifier(node);
      case ADDITIVE_EXPR, MULTIPLICATIVE_EXPR, RELATIONAL_EXPR, EQUALITY_EXPR, SHIFT_EXPR,
          BITWISE_AND_EXPR, BITWISE_OR_EXPR, BITWISE_XOR_EXPR ->
          arithmetic(node.value(), evaluate(node.child(0)), evaluate(node.child(1)), node);
      case LOGICAL_AND_EXPR -> TraceValue.of(
          evaluate(node.child(0)).isTrue() && evaluate(node.child(1)).isTrue());
      case LOGICAL_OR_EXPR -> TraceValue.of(
          evaluate(node.child(0)).isTrue() || evaluate(node.child(1)).isTrue());
      case UNARY_EXPR -> unary(node);
      case PREFIX_EXPR, POSTFIX_EXPR -> increment(node);
      case ASSIGN_EXPR -> assign(node);
      case CONDITIONAL_EXPR -> evaluate(node.child(0)).isTrue()
          ? evaluate(node.child(1))
          : evaluate(node.child(2));
      case COMMA_EXPR -> {
        TraceValue last = new TraceValue.Void();
        for (SyntaxNode child : node.children()) {
          last = evaluate(child);
        } // for
        yield last;
      }
      case CALL_EXPR -> call(node);
      case ARRAY_SUBSCRIPT_EXPR, ARROW_EXPR -> load(lvalue(node));
      case MEMBER_EXPR -> assignable(node.child(0))
          ? load(lvalue(node))
          : memberValue(evaluate(node.child(0)), staticType(node.child(0)), node);
      case CAST_EXPR -> cast(node);
      case SIZEOF_EXPR -> new TraceValue.Int(staticType(node.child(0)).size());
      case SIZEOF_TYPE -> new TraceValue.Int(typeName(node.children()).size());
      case TRANSLATION_UNIT, FUNCTION_DEF, FUNCTION_DECL, PARAMETER_LIST, PARAMETER, TYPEDEF_DECL,
          DECLARATION, MULTI_VAR_DECL, VAR_DECL, INITIALIZER_LIST, TYPE_SPECIFIER, STORAGE_CLASS,
          TYPE_QUALIFIER, POINTER, ARRAY_DIMENSION, COMPOUND_STMT, EXPR_STMT, IF_STMT, WHILE_STMT,
          DO_WHILE_STMT, FOR_STMT, SWITCH_STMT, CASE_STMT, DEFAULT_STMT, BREAK_STMT,
          CONTINUE_STMT, RETURN_STMT, EMPTY_STMT, LABELED_STMT, STRUCT_SPECIFIER, UNION_SPECIFIER,
          STRUCT_MEMBER_DECL, STRUCT_MEMBER ->
          throw EngineException.of(ErrorKind.UNSUPPORTED, "%s on line %d is not an expression",
              node.kind(), node.line());
    };
  } // compute

  /**
   * The value an initializer gives a variable of the given type.
   *
   * @param init An expression or an {@code INITIALIZER_LIST}.
   * @param type The declared type.
   * @return The value; arrays as nested {@link TraceValue.Array}s.
   */
  TraceValue initialValue(SyntaxNode init, CType type) {
    if (type.isArray()) {
      int length = type.dimensions().get(0);
      if (init.kind() == NodeKind.STRING_LITERAL && type.dimensions().size() == 1) {
        List<TraceValue> chars = new ArrayList<>();
        for (char c : init.value().toCharArray()) {
          chars.add(new TraceValue.Int((byte) c));
        } // for
        if (chars.size() < length) {
          chars.add(new TraceValue.Int(0));
        }
        return new TraceValue.Array(chars);
      } else if (init.kind() == NodeKind.INITIALIZER_LIST) {
        List<TraceValue> elements = new ArrayList<>();
        for (SyntaxNode child : init.children()) {
          elements.add(initialValue(child, type.elementType()));
        } // for
        return new TraceValue.Array(elements);
      }
      throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Array of type %s on line %d needs an initializer list", type, init.line());
    } else if (type.isAggregate() && init.kind() == NodeKind.INITIALIZER_LIST) {
      List<Aggregate.Member> members = type.aggregate().members();
      if (init.childCount() > members.size()) {
        throw EngineException.of(ErrorKind.OUT_OF_BOUNDS, "%d initializers for %s on line %d",
            init.childCount(), type, init.line());
      }
      List<TraceValue> values = new ArrayList<>();
      for (int i = 0; i < init.childCount(); i++) {
        values.add(initialValue(init.child(i), members.get(i).type()));
      } // for
      return new TraceValue.Array(values);
    } else if (init.kind() == NodeKind.INITIALIZER_LIST) {
      return init.childCount() == 0 ? type.defaultValue() : evaluate(init.child(0));
    }
    return evaluate(init);
  } // initialValue

  /** The length of an array dimension, which must be a positive integer expression. */
  long dimension(SyntaxNode expression) {
    return evaluate(expression).asLong();
  }

  CType typeName(List<SyntaxNode> nodes) {
    return declarations.typeName(nodes, this::dimension);
  }

  // ---------------------------------------------------------------- locations

  /**
   * Evaluate an expression that designates a storage location.
   *
   * @param node The expression.
   * @return The location.
   */
  LValue lvalue(SyntaxNode node) {
    if (node.kind() == NodeKind.IDENTIFIER_EXPR) {
      return new LValue.VariableSlot(memory.lookup(node.value()), new int[0]);
    }
    int id = index.id(node);
    TraceValue.Address known = locations.get(id);
    if (known != null) {
      return new LValue.MemorySlot(known.value(), known.pointee());
    }
    LValue location = locate(node);
    locations.put(id, new TraceValue.Address(location.address(), location.type()));
    return location;
  }

  private LValue locate(SyntaxNode node) {
    switch (node.kind()) {
      case IDENTIFIER_EXPR -> {
        return new LValue.VariableSlot(memory.lookup(node.value()), new int[0]);
      }
      case ARRAY_SUBSCRIPT_EXPR -> {
        return subscript(node);
      }
      case UNARY_EXPR -> {
        if (node.value().equals("*")) {
          return dereference(evaluate(node.child(0)), node);
        }
      }
      case MEMBER_EXPR -> {
        LValue base = lvalue(node.child(0));
        return member(base.address(), base.type(), node);
      }
      case ARROW_EXPR -> {
        TraceValue pointer = evaluate(node.child(0));
        if (!(pointer instanceof TraceValue.Address address)) {
          throw EngineException.of(ErrorKind.UNSUPPORTED,
              "Left side of '->' on line %d is not a pointer", node.line());
        }
        if (address.value() == 0) {
          throw EngineException.of(ErrorKind.INVALID_ADDRESS,
              "Null pointer dereference reading '%s' on line %d", node.value(), node.line());
        }
        return member(address.value(), address.pointee(), node);
      }
      default -> {}
    }
    throw EngineException.of(ErrorKind.UNSUPPORTED, "%s on line %d is not assignable",
        node.kind(), node.line());
  } // locate

  private static LValue member(long address, CType type, SyntaxNode node) {
    if (!type.isAggregate()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Request for member '%s' in %s on line %d",
          node.value(), type, node.line());
    }
    Aggregate.Member member = type.aggregate().member(node.value()).orElseThrow(() ->
        EngineException.of(ErrorKind.UNSUPPORTED, "%s has no member '%s' (line %d)",
            type.aggregate(), node.value(), node.line()));
    return new LValue.MemorySlot(address + member.offset(), member.type());
  }

  private LValue subscript(SyntaxNode node) {
    SyntaxNode base = node.child(0);
    long index = evaluate(node.child(1)).asLong();
    TraceValue pointer;
    if (base.kind() == NodeKind.IDENTIFIER_EXPR || base.kind() == NodeKind.ARRAY_SUBSCRIPT_EXPR) {
      LValue inner = lvalue(base);
      if (inner instanceof LValue.VariableSlot slot && slot.type().isArray()) {
        if (index < Integer.MIN_VALUE || index > Integer.MAX_VALUE) {
          throw EngineException.of(ErrorKind.OUT_OF_BOUNDS, "Index %d is out of bounds for '%s'",
              index, slot.variable().name());
        }
        return slot.index((int) index);
      }
      pointer = load(inner);
    } else {
      pointer = evaluate(base);
    }
    if (!(pointer instanceof TraceValue.Address address)) {
      throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Subscripted value on line %d is not an array or pointer", node.line());
    }
    CType element = pointee(address, node);
    return new LValue.MemorySlot(address.value() + index * element.size(), element);
  } // subscript

  private LValue dereference(TraceValue value, SyntaxNode node) {
    if (!(value instanceof TraceValue.Address address)) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot dereference %s on line %d",
          value.render(), node.line());
    }
    return new LValue.MemorySlot(address.value(), pointee(address, node));
  }

  private static boolean assignable(SyntaxNode node) {
    return switch (node.kind()) {
      case IDENTIFIER_EXPR, ARRAY_SUBSCRIPT_EXPR, MEMBER_EXPR, ARROW_EXPR -> true;
      case UNARY_EXPR -> node.value().equals("*");
      default -> false;
    };
  }

  /** A member of a {@code struct} value that has no address, such as a returned one. */
  private TraceValue memberValue(TraceValue value, CType type, SyntaxNode node) {
    LValue.MemorySlot slot = (LValue.MemorySlot) member(0, type, node);
    int position = type.aggregate().indexOf(type.aggregate().member(node.value()).orElseThrow());
    TraceValue found = ((TraceValue.Array) value).elements().get(position);
    return slot.type().isArray() ? found : slot.type().coerce(found);
  }

  private static CType pointee(TraceValue.Address address, SyntaxNode node) {
    if (address.pointee().isVoid()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Cannot dereference a void pointer on line %d", node.line());
    }
    return address.pointee();
  }

  /** Read a location; arrays decay to the address of their first element. */
  private TraceValue load(LValue location) {
    if (location.type().isArray()) {
      if (location instanceof LValue.VariableSlot) {
        location.read(memory);
      }
      return new TraceValue.Address(location.address(), location.type().elementType());
    }
    return location.read(memory);
  }

  // ---------------------------------------------------------------- operators

  private TraceValue identifier(SyntaxNode node) {
    String name = node.value();
    Optional<Variable> variable = memory.resolve(name);
    if (variable.isPresent()) {
      return load(new LValue.VariableSlot(variable.get(), new int[0]));
    }
    return switch (name) {
      case "NULL" -> new TraceValue.Address(0, CType.VOID);
      case "true" -> new TraceValue.Int(1);
      case "false" -> new TraceValue.Int(0);
      case "EOF" -> new TraceValue.Int(IoCollaborator.EOF);
      case "RAND_MAX" -> new TraceValue.Int(Builtins.RAND_MAX);
      default -> {
        if (functions.containsKey(name)) {
          throw EngineException.of(ErrorKind.UNSUPPORTED,
              "Function '%s' used as a value on line %d", name, node.line());
        }
        yield memory.lookup(name).value();
      }
    };
  } // identifier

  private TraceValue unary(SyntaxNode node) {
    String op = node.value();
    if (op.equals("&")) {
      LValue location = lvalue(node.child(0));
      return new TraceValue.Address(location.address(), location.type());
    } else if (op.equals("*")) {
      return load(lvalue(node));
    }
    TraceValue operand = evaluate(node.child(0));
    return switch (op) {
      case "+" -> operand;
      case "-" -> operand instanceof TraceValue.Real r
          ? new TraceValue.Real(-r.value())
          : new TraceValue.Int(-operand.asLong());
      case "!" -> TraceValue.of(!operand.isTrue());
      case "~" -> new TraceValue.Int(~operand.asLong());
      default -> throw EngineException.of(ErrorKind.UNSUPPORTED, "Unknown unary operator '%s'",
          op);
    };
  } // unary

  private TraceValue increment(SyntaxNode node) {
    LValue location = lvalue(node.child(0));
    TraceValue old = location.read(memory);
    int delta = switch (node.value()) {
      case "++" -> 1;
      case "--" -> -1;
      default -> throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Unknown increment operator '%s'", node.value());
    };
    TraceValue updated = arithmetic("+", old, new TraceValue.Int(delta), node);
    TraceValue stored = location.write(memory, updated);
    return node.kind() == NodeKind.PREFIX_EXPR ? stored : old;
  }

  private TraceValue assign(SyntaxNode node) {
    LValue location = lvalue(node.child(0));
    String op = node.value();
    TraceValue value = evaluate(node.child(1));
    if (!op.equals("=")) {
      if (!op.endsWith("=")) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "Unknown assignment operator '%s'", op);
      }
      value = arithmetic(op.substring(0, op.length() - 1), location.read(memory), value, node);
    }
    return location.write(memory, value);
  }

  private TraceValue cast(SyntaxNode node) {
    List<SyntaxNode> children = node.children();
    CType type = typeName(children.subList(0, children.size() - 1));
    TraceValue value = evaluate(children.get(children.size() - 1));
    if (type.isVoid()) {
      return new TraceValue.Void();
    }
    return type.coerce(value);
  }

  /**
   * Apply a binary operator.
   *
   * @param op The operator, e.g. {@code "+"} or {@code "<="}.
   * @param a The left operand.
   * @param b The right operand.
   * @param node The node being evaluated, for messages.
   * @return The result.
   */
  static TraceValue arithmetic(String op, TraceValue a, TraceValue b, SyntaxNode node) {
    if (a instanceof TraceValue.Address p && (op.equals("+") || op.equals("-"))) {
      if (b instanceof TraceValue.Address q) {
        if (op.equals("-")) {
          return new TraceValue.Int((p.value() - q.value()) / scale(p.pointee()));
        }
        throw EngineException.of(ErrorKind.UNSUPPORTED, "Cannot add two pointers on line %d",
            node.line());
      }
      long offset = b.asLong() * scale(p.pointee());
      return new TraceValue.Address(op.equals("+") ? p.value() + offset : p.value() - offset,
          p.pointee());
    } else if (b instanceof TraceValue.Address q && op.equals("+")) {
      return new TraceValue.Address(q.value() + a.asLong() * scale(q.pointee()), q.pointee());
    }

    if (a instanceof TraceValue.Real || b instanceof TraceValue.Real) {
      double x = a.asDouble();
      double y = b.asDouble();
      return switch (op) {
        case "+" -> new TraceValue.Real(x + y);
        case "-" -> new TraceValue.Real(x - y);
        case "*" -> new TraceValue.Real(x * y);
        case "/" -> new TraceValue.Real(x / y);
        case "<" -> TraceValue.of(x < y);
        case ">" -> TraceValue.of(x > y);
        case "<=" -> TraceValue.of(x <= y);
        case ">=" -> TraceValue.of(x >= y);
        case "==" -> TraceValue.of(x == y);
        case "!=" -> TraceValue.of(x != y);
        default -> throw EngineException.of(ErrorKind.UNSUPPORTED,
            "Operator '%s' on line %d needs integer operands", op, node.line());
      };
    }

    long x = a.asLong();
    long y = b.asLong();
    return switch (op) {
      case "+" -> new TraceValue.Int(x + y);
      case "-" -> new TraceValue.Int(x - y);
      case "*" -> new TraceValue.Int(x * y);
      case "/", "%" -> {
        if (y == 0) {
          throw EngineException.of(ErrorKind.DIVISION_BY_ZERO, "Division by zero on line %d",
              node.line());
        }
        yield new TraceValue.Int(op.equals("/") ? x / y : x % y);
      }
      case "<<" -> new TraceValue.Int(x << y);
      case ">>" -> new TraceValue.Int(x >> y);
      case "&" -> new TraceValue.Int(x & y);
      case "|" -> new TraceValue.Int(x | y);
      case "^" -> new TraceValue.Int(x ^ y);
      case "<" -> TraceValue.of(x < y);
      case ">" -> TraceValue.of(x > y);
      case "<=" -> TraceValue.of(x <= y);
      case ">=" -> TraceValue.of(x >= y);
      case "==" -> TraceValue.of(x == y);
      case "!=" -> TraceValue.of(x != y);
      default -> throw EngineException.of(ErrorKind.UNSUPPORTED, "Unknown operator '%s'", op);
    };
  } // arithmetic

  private static long scale(CType pointee) {
    return pointee.isVoid() ? 1 : pointee.size();
  }

  // ---------------------------------------------------------------- calls

  private TraceValue call(SyntaxNode node) {
    SyntaxNode callee = node.child(0);
    if (callee.kind() != NodeKind.IDENTIFIER_EXPR) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Indirect call on line %d", node.line());
    }
    String name = callee.value();
    List<TraceValue> args = new ArrayList<>();
    for (SyntaxNode arg : node.children().subList(1, node.childCount())) {
      args.add(evaluate(arg));
    } // for
    SyntaxNode function = functions.get(name);
    if (function != null) {
      throw new CallRequest(node, function, args);
    }
    Builtins.Builtin builtin = builtins.find(name).orElseThrow(() ->
        EngineException.of(ErrorKind.UNKNOWN_IDENTIFIER, "Function '%s' on line %d is not defined",
            name, node.line()));
    return builtin.call(args, new Builtins.CallSite(functionName, node.line()));
  } // call

  // ---------------------------------------------------------------- types

  /**
   * The type of an expression, without evaluating it.
   *
   * @param node The expression.
   * @return Its type.
   */
  CType staticType(SyntaxNode node) {
    return switch (node.kind()) {
      case IDENTIFIER_EXPR -> memory.resolve(node.value())
          .map(Variable::type)
          .orElse(node.value().equals("NULL") ? CType.VOID_POINTER : CType.INT);
      case STRING_LITERAL -> new CType("char", 0, List.of(node.value().length() + 1));
      case INT_LITERAL -> node.value().toLowerCase(Locale.ROOT).contains("l")
          ? CType.LONG
          : CType.INT;
      case FLOAT_LITERAL -> node.value().toLowerCase(Locale.ROOT).endsWith("f")
          ? CType.FLOAT
          : CType.DOUBLE;
      case ARRAY_SUBSCRIPT_EXPR -> {
        CType base = staticType(node.child(0));
        yield base.isArray() || base.isPointer() ? base.pointee() : CType.INT;
      }
      case MEMBER_EXPR, ARROW_EXPR -> {
        CType base = staticType(node.child(0));
        if (node.kind() == NodeKind.ARROW_EXPR && (base.isArray() || base.isPointer())) {
          base = base.pointee();
        }
        yield base.isAggregate()
            ? member(0, base, node).type()
            : CType.INT;
      }
      case UNARY_EXPR -> switch (node.value()) {
        case "*" -> {
          CType base = staticType(node.child(0));
          yield base.isArray() || base.isPointer() ? base.pointee() : CType.INT;
        }
        case "&" -> staticType(node.child(0)).pointerTo();
        case "!" -> CType.INT;
        default -> staticType(node.child(0));
      };
      case CAST_EXPR -> typeName(node.children().subList(0, node.childCount() - 1));
      case SIZEOF_EXPR, SIZEOF_TYPE -> CType.LONG;
      case CALL_EXPR -> {
        String name = node.child(0).value();
        SyntaxNode function = functions.get(name);
        yield function != null ? declarations.returnType(function) : builtins.returnType(name);
      }
      case ASSIGN_EXPR, PREFIX_EXPR, POSTFIX_EXPR -> staticType(node.child(0));
      case CONDITIONAL_EXPR -> staticType(node.child(1));
      case COMMA_EXPR -> staticType(node.child(node.childCount() - 1));
      case RELATIONAL_EXPR, EQUALITY_EXPR, LOGICAL_AND_EXPR, LOGICAL_OR_EXPR, CHAR_LITERAL ->
          CType.INT;
      case ADDITIVE_EXPR, MULTIPLICATIVE_EXPR, SHIFT_EXPR, BITWISE_AND_EXPR, BITWISE_OR_EXPR,
          BITWISE_XOR_EXPR -> promote(staticType(node.child(0)), staticType(node.child(1)));
      default -> CType.INT;
    };
  } // staticType

  private static CType promote(CType a, CType b) {
    if (a.isArray() || a.isPointer()) {
      return b.isArray() || b.isPointer() ? CType.LONG : a.pointee().pointerTo();
    } else if (b.isArray() || b.isPointer()) {
      return b.pointee().pointerTo();
    } else if (a.isFloating() || b.isFloating()) {
      return a.size() == 8 || b.size() == 8 ? CType.DOUBLE : CType.FLOAT;
    }
    return a.size() == 8 || b.size() == 8 ? CType.LONG : CType.INT;
  }

  // ---------------------------------------------------------------- literals

  private static long integerLiteral(SyntaxNode node) {
    String text = node.value().trim().toLowerCase(Locale.ROOT).replaceAll("[ul]+$", "");
    try {
      if (text.startsWith("0x")) {
        return Long.parseUnsignedLong(text.substring(2), 16);
      } else if (text.startsWith("0b")) {
        return Long.parseLong(text.substring(2), 2);
      } else if (text.length() > 1 && text.startsWith("0")) {
        return Long.parseLong(text.substring(1), 8);
      }
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Bad integer literal '%s' on line %d",
          node.value(), node.line());
    }
  } // integerLiteral

  private static double floatLiteral(SyntaxNode node) {
    String text = node.value().trim();
    boolean single = text.endsWith("f") || text.endsWith("F");
    try {
      double value = Double.parseDouble(text.replaceAll("[fFlL]$", ""));
      return single ? (double) (float) value : value;
    } catch (NumberFormatException e) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Bad floating literal '%s' on line %d",
          node.value(), node.line());
    }
  }

  /**
   * The value of a character literal, with or without its quotes.
   *
   * @param text The literal, e.g. {@code a}, {@code 'a'} or {@code \n}.
   * @return The character code.
   */
  static long charLiteral(String text) {
    String body = text;
    if (body.length() >= 2 && body.startsWith("'") && body.endsWith("'")) {
      body = body.substring(1, body.length() - 1);
    }
    if (body.isEmpty()) {
      return 0;
    } else if (body.charAt(0) != '\\' || body.length() == 1) {
      return (byte) body.charAt(0);
    }
    char escape = body.charAt(1);
    return switch (escape) {
      case 'n' -> '\n';
      case 't' -> '\t';
      case 'r' -> '\r';
      case 'a' -> 7;
      case 'b' -> '\b';
      case 'f' -> '\f';
      case 'v' -> 11;
      case 'x' -> (byte) Integer.parseInt(body.substring(2), 16);
      default -> Character.isDigit(escape)
          ? (byte) Integer.parseInt(body.substring(1), 8)
          : escape;
    };
  } // charLiteral
}
