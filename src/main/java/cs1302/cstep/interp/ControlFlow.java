package cs1302.cstep.interp;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.NodeKind;
import cs1302.cstep.tree.SyntaxNode;
import cs1302.cstep.tree.TreeIndex;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * The statement successor function: given the unit that just ran and how it ended, find the next
 * unit of the same function. A {@code null} position means the function body is exhausted.
 */
public final class ControlFlow {

  /**
   * A schedulable unit: a statement, or one part of a control construct.
   *
   * @param node The statement node.
   * @param phase The part of the statement.
   */
  public record Position(SyntaxNode node, Phase phase) {}

  private final TreeIndex index;

  public ControlFlow(TreeIndex index) {
    this.index = index;
  }

  /**
   * The first unit executed when control enters a statement.
   *
   * @param stmt The statement.
   * @return The unit, or {@code null} if the statement does nothing (an empty block).
   */
  public Position firstUnit(SyntaxNode stmt) {
    return switch (stmt.kind()) {
      case COMPOUND_STMT -> {
        for (SyntaxNode child : stmt.children()) {
          Position first = firstUnit(child);
          if (first != null) {
            yield first;
          }
        } // for
        yield null;
      }
      case CASE_STMT -> stmt.childCount() > 1 ? firstUnit(stmt.child(1)) : null;
      case DEFAULT_STMT -> stmt.childCount() > 0 ? firstUnit(stmt.child(0)) : null;
      case LABELED_STMT -> stmt.childCount() > 0 ? firstUnit(stmt.child(0)) : null;
      case IF_STMT, WHILE_STMT -> new Position(stmt, Phase.CONDITION);
      case DO_WHILE_STMT -> orElse(firstUnit(stmt.child(0)), new Position(stmt, Phase.CONDITION));
      case FOR_STMT -> new Position(stmt, stmt.child(0).isEmpty() ? Phase.CONDITION : Phase.INIT);
      case SWITCH_STMT -> new Position(stmt, Phase.DISPATCH);
      case EXPR_STMT, VAR_DECL, DECLARATION, MULTI_VAR_DECL, RETURN_STMT, BREAK_STMT,
          CONTINUE_STMT, EMPTY_STMT -> new Position(stmt, Phase.EXECUTE);
      case FUNCTION_DECL, TYPEDEF_DECL, STRUCT_SPECIFIER, UNION_SPECIFIER -> null;
      default -> throw EngineException.of(ErrorKind.UNSUPPORTED, "%s on line %d is not a statement",
          stmt.kind(), stmt.line());
    };
  } // firstUnit

  /**
   * The unit that follows a statement that completed normally.
   *
   * @param stmt The completed statement.
   * @return The next unit, or {@code null} if the function body is exhausted.
   */
  public Position after(SyntaxNode stmt) {
    Optional<SyntaxNode> maybeParent = index.parent(stmt);
    if (maybeParent.isEmpty()) {
      return null;
    }
    SyntaxNode parent = maybeParent.get();
    return switch (parent.kind()) {
      case COMPOUND_STMT -> {
        List<SyntaxNode> siblings = parent.children();
        for (int i = indexOf(siblings, stmt) + 1; i < siblings.size(); i++) {
          Position next = firstUnit(siblings.get(i));
          if (next != null) {
            yield next;
          }
        } // for
        yield after(parent);
      }
      case WHILE_STMT, DO_WHILE_STMT -> new Position(parent, Phase.CONDITION);
      case FOR_STMT -> loopBack(parent);
      case FUNCTION_DEF, TRANSLATION_UNIT -> null;
      default -> after(parent);
    };
  } // after

  /**
   * The unit that follows an evaluated condition.
   *
   * @param construct An {@code if}, {@code while}, {@code do} or {@code for} statement.
   * @param taken The value of the condition.
   * @return The next unit, or {@code null} if the function body is exhausted.
   */
  public Position afterCondition(SyntaxNode construct, boolean taken) {
    return switch (construct.kind()) {
      case IF_STMT -> {
        if (taken) {
          yield orElse(firstUnit(construct.child(1)), after(construct));
        } else if (construct.childCount() > 2) {
          yield orElse(firstUnit(construct.child(2)), after(construct));
        }
        yield after(construct);
      }
      case WHILE_STMT -> taken
          ? orElse(firstUnit(construct.child(1)), new Position(construct, Phase.CONDITION))
          : after(construct);
      case DO_WHILE_STMT -> taken
          ? orElse(firstUnit(construct.child(0)), new Position(construct, Phase.CONDITION))
          : after(construct);
      case FOR_STMT -> taken
          ? orElse(firstUnit(construct.child(3)), loopBack(construct))
          : after(construct);
      default -> throw new IllegalArgumentException(construct.kind() + " has no condition");
    };
  }

  /**
   * Where a {@code for} loop goes after its body or a {@code continue}.
   *
   * @param loop The {@code for} statement.
   * @return The update clause, or the condition if there is no update.
   */
  public Position loopBack(SyntaxNode loop) {
    if (loop.kind() == NodeKind.FOR_STMT && !loop.child(2).isEmpty()) {
      return new Position(loop, Phase.UPDATE);
    }
    return new Position(loop, Phase.CONDITION);
  }

  /**
   * The unit that follows a {@code break}.
   *
   * @param stmt The break statement.
   * @return The unit after the innermost enclosing loop or switch.
   */
  public Position breakTarget(SyntaxNode stmt) {
    SyntaxNode target = enclosing(stmt, true);
    return after(target);
  }

  /**
   * The unit that follows a {@code continue}.
   *
   * @param stmt The continue statement.
   * @return The condition or update of the innermost enclosing loop.
   */
  public Position continueTarget(SyntaxNode stmt) {
    SyntaxNode loop = enclosing(stmt, false);
    return loopBack(loop);
  }

  private SyntaxNode enclosing(SyntaxNode stmt, boolean acceptSwitch) {
    SyntaxNode current = stmt;
    while (true) {
      Optional<SyntaxNode> parent = index.parent(current);
      if (parent.isEmpty() || parent.get().kind() == NodeKind.FUNCTION_DEF) {
        throw EngineException.of(ErrorKind.UNSUPPORTED, "%s on line %d is not inside a %s",
            stmt.kind(), stmt.line(), acceptSwitch ? "loop or switch" : "loop");
      }
      current = parent.get();
      switch (current.kind()) {
        case WHILE_STMT, DO_WHILE_STMT, FOR_STMT -> {
          return current;
        }
        case SWITCH_STMT -> {
          if (acceptSwitch) {
            return current;
          }
        }
        default -> {}
      }
    } // while
  } // enclosing

  /**
   * Select the case of a {@code switch}.
   *
   * @param stmt The switch statement.
   * @param value The value of the controlling expression.
   * @param constants Evaluates a case label's constant expression.
   * @return The first unit of the matching case (falling through empty cases), or the unit after
   *     the switch if no case matches.
   */
  public Position dispatch(SyntaxNode stmt, TraceValue value,
      Function<SyntaxNode, TraceValue> constants) {
    SyntaxNode body = stmt.child(1);
    if (body.kind() != NodeKind.COMPOUND_STMT) {
      return after(stmt);
    }
    SyntaxNode fallback = null;
    for (SyntaxNode label : body.children()) {
      if (label.kind() == NodeKind.CASE_STMT
          && constants.apply(label.child(0)).asLong() == value.asLong()) {
        return orElse(firstUnit(label), after(label));
      } else if (label.kind() == NodeKind.DEFAULT_STMT && fallback == null) {
        fallback = label;
      } // if
    } // for
    return fallback == null ? after(stmt) : orElse(firstUnit(fallback), after(fallback));
  } // dispatch

  /**
   * The nodes that own a block scope around a position, outermost first.
   *
   * @param position A unit inside a function.
   * @return The enclosing blocks and {@code for} statements.
   */
  public List<SyntaxNode> scopeOwners(Position position) {
    List<SyntaxNode> owners = new ArrayList<>();
    SyntaxNode current = position.node();
    while (current.kind() != NodeKind.FUNCTION_DEF) {
      if (current.kind() == NodeKind.COMPOUND_STMT || current.kind() == NodeKind.FOR_STMT) {
        owners.add(current);
      }
      Optional<SyntaxNode> parent = index.parent(current);
      if (parent.isEmpty()) {
        break;
      }
      current = parent.get();
    } // while
    Collections.reverse(owners);
    return owners;
  }

  /**
   * The source position shown for a unit. Conditions and clauses point at their own expression.
   *
   * @param position The unit.
   * @return Its cursor.
   */
  public static Cursor cursorOf(Position position) {
    SyntaxNode node = position.node();
    SyntaxNode shown = switch (position.phase()) {
      case EXECUTE -> node;
      case INIT, DISPATCH -> node.child(0);
      case UPDATE -> node.child(2);
      case CONDITION -> switch (node.kind()) {
        case DO_WHILE_STMT -> node.child(1);
        case FOR_STMT -> node.child(1).isEmpty() ? node : node.child(1);
        default -> node.child(0);
      };
    };
    if (shown.line() <= 0) {
      shown = node;
    }
    return new Cursor(shown.line(), shown.column(), node.kind(), position.phase());
  }

  /**
   * Every line that holds a schedulable unit, i.e. every line a breakpoint can stop at.
   *
   * @param root The root of the program.
   * @return The lines in ascending order.
   */
  public static SortedSet<Integer> unitLines(SyntaxNode root) {
    SortedSet<Integer> lines = new TreeSet<>();
    collectUnitLines(root, false, lines);
    return lines;
  }

  private static void collectUnitLines(SyntaxNode node, boolean inFunction,
      SortedSet<Integer> lines) {
    if (inFunction) {
      switch (node.kind()) {
        case EXPR_STMT, VAR_DECL, DECLARATION, MULTI_VAR_DECL, RETURN_STMT, BREAK_STMT,
            CONTINUE_STMT, EMPTY_STMT ->
            lines.add(cursorOf(new Position(node, Phase.EXECUTE)).line());
        case IF_STMT, WHILE_STMT, DO_WHILE_STMT ->
            lines.add(cursorOf(new Position(node, Phase.CONDITION)).line());
        case FOR_STMT -> {
          lines.add(cursorOf(new Position(node, Phase.CONDITION)).line());
          if (!node.child(0).isEmpty()) {
            lines.add(cursorOf(new Position(node, Phase.INIT)).line());
          }
          if (!node.child(2).isEmpty()) {
            lines.add(cursorOf(new Position(node, Phase.UPDATE)).line());
          }
        }
        case SWITCH_STMT -> lines.add(cursorOf(new Position(node, Phase.DISPATCH)).line());
        default -> {}
      }
      // declarations inside a statement unit are not units of their own
      if (node.kind() == NodeKind.DECLARATION || node.kind() == NodeKind.MULTI_VAR_DECL
          || node.kind() == NodeKind.VAR_DECL || node.kind() == NodeKind.EXPR_STMT
          || node.kind() == NodeKind.RETURN_STMT) {
        return;
      }
    } // if
    boolean body = inFunction || node.kind() == NodeKind.FUNCTION_DEF;
    for (SyntaxNode child : node.children()) {
      if (child.kind().category() == NodeKind.Category.EXPRESSION) {
        continue;
      }
      collectUnitLines(child, body, lines);
    } // for
  } // collectUnitLines

  private static Position orElse(Position first, Position fallback) {
    return first != null ? first : fallback;
  }

  private static int indexOf(List<SyntaxNode> siblings, SyntaxNode node) {
    for (int i = 0; i < siblings.size(); i++) {
      if (siblings.get(i) == node) {
        return i;
      }
    } // for
    throw new IllegalArgumentException(node + " is not a child of its parent");
  }
}
