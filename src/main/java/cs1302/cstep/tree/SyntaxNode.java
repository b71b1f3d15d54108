package cs1302.cstep.tree;

import java.util.List;
import java.util.Optional;

/**
 * One immutable node of the syntax tree produced by the external parser.
 *
 * @param kind The kind of the node.
 * @param value The value associated with the node (an identifier, literal text, or operator), or
 *     the empty string.
 * @param line The 1-based source line of the node.
 * @param column The 1-based source column of the node, or 0 if unknown.
 * @param children The ordered children of the node.
 */
public record SyntaxNode(
    NodeKind kind, String value, int line, int column, List<SyntaxNode> children) {

  public SyntaxNode {
    value = value == null ? "" : value;
    children = List.copyOf(children);
  }

  /**
   * Create a node with an unknown column.
   *
   * @param kind The kind of the node.
   * @param value The value of the node.
   * @param line The source line of the node.
   * @param children The children of the node.
   * @return The new node.
   */
  public static SyntaxNode of(NodeKind kind, String value, int line, SyntaxNode... children) {
    return new SyntaxNode(kind, value, line, 0, List.of(children));
  }

  /**
   * Create a node without a value.
   *
   * @param kind The kind of the node.
   * @param line The source line of the node.
   * @param children The children of the node.
   * @return The new node.
   */
  public static SyntaxNode of(NodeKind kind, int line, SyntaxNode... children) {
    return of(kind, "", line, children);
  }

  public SyntaxNode child(int index) {
    return children.get(index);
  }

  public int childCount() {
    return children.size();
  }

  /**
   * Find the first child of the given kind.
   *
   * @param childKind The kind to look for.
   * @return The first matching child, if any.
   */
  public Optional<SyntaxNode> firstChild(NodeKind childKind) {
    return children.stream().filter(c -> c.kind() == childKind).findFirst();
  }

  /**
   * Collect the children of the given kind.
   *
   * @param childKind The kind to look for.
   * @return The matching children, in order.
   */
  public List<SyntaxNode> childrenOf(NodeKind childKind) {
    return children.stream().filter(c -> c.kind() == childKind).toList();
  }

  /**
   * Returns {@code true} if this node is an {@link NodeKind#EMPTY_EXPR} placeholder.
   *
   * @return whether the node is empty
   */
  public boolean isEmpty() {
    return kind == NodeKind.EMPTY_EXPR;
  }

  @Override
  public String toString() {
    return String.format("%s(%s)@%d:%d", kind, value, line, column);
  }
}
