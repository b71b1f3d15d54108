package cs1302.cstep.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns every node of a loaded tree a stable preorder id and records parent links, so that
 * execution positions can be stored as plain integers.
 */
public final class TreeIndex {

  private final SyntaxNode root;
  private final List<SyntaxNode> nodes = new ArrayList<>();
  private final List<Integer> parents = new ArrayList<>();
  private final Map<SyntaxNode, Integer> ids = new IdentityHashMap<>();
  private final Map<String, SyntaxNode> functions = new LinkedHashMap<>();

  /**
   * Index the tree rooted at {@code root}.
   *
   * @param root The root of the tree, usually a {@link NodeKind#TRANSLATION_UNIT}.
   */
  public TreeIndex(SyntaxNode root) {
    this.root = root;
    visit(root, -1);
    for (SyntaxNode top : root.children()) {
      if (top.kind() == NodeKind.FUNCTION_DEF) {
        functions.put(top.value(), top);
      } // if
    } // for
  }

  private void visit(SyntaxNode node, int parent) {
    int id = nodes.size();
    nodes.add(node);
    parents.add(parent);
    ids.put(node, id);
    for (SyntaxNode child : node.children()) {
      visit(child, id);
    } // for
  } // visit

  public SyntaxNode root() {
    return root;
  }

  public int size() {
    return nodes.size();
  }

  /**
   * Get the id of a node of this tree.
   *
   * @param node A node that belongs to this tree.
   * @return The preorder id of the node.
   * @throws IllegalArgumentException if the node is not part of this tree
   */
  public int id(SyntaxNode node) {
    Integer id = ids.get(node);
    if (id == null) {
      throw new IllegalArgumentException("Node is not part of the indexed tree: " + node);
    }
    return id;
  }

  /**
   * Get the node with the given id.
   *
   * @param id A preorder id.
   * @return The node.
   * @throws IllegalArgumentException if the id is out of range
   */
  public SyntaxNode node(int id) {
    if (id < 0 || id >= nodes.size()) {
      throw new IllegalArgumentException(
          String.format("Node id %d is outside of the tree (size %d)", id, nodes.size()));
    }
    return nodes.get(id);
  }

  /**
   * Get the parent of a node.
   *
   * @param node A node of this tree.
   * @return The parent, or empty for the root.
   */
  public Optional<SyntaxNode> parent(SyntaxNode node) {
    int parent = parents.get(id(node));
    return parent < 0 ? Optional.empty() : Optional.of(nodes.get(parent));
  }

  /**
   * Returns {@code true} if {@code ancestor} is {@code node} or one of its ancestors.
   *
   * @param ancestor The possible ancestor.
   * @param node The node whose ancestry is checked.
   * @return whether {@code ancestor} encloses {@code node}
   */
  public boolean encloses(SyntaxNode ancestor, SyntaxNode node) {
    int target = id(ancestor);
    for (int current = id(node); current >= 0; current = parents.get(current)) {
      if (current == target) {
        return true;
      }
    } // for
    return false;
  }

  /**
   * Find a function definition by name.
   *
   * @param name The function name.
   * @return The definition, if the program defines it.
   */
  public Optional<SyntaxNode> function(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public Map<String, SyntaxNode> functions() {
    return Collections.unmodifiableMap(functions);
  }
}
