package cs1302.cstep.tree;

import java.util.ArrayList;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/** Reads syntax trees from the JSON produced by the parser. */
public class SyntaxTreeReader {

  /**
   * Parse a syntax tree from its JSON text.
   *
   * @param json The JSON text of the root node.
   * @return The root node.
   * @throws IllegalArgumentException if the text is not a well-formed node
   * @throws cs1302.cstep.EngineException if a node has an unsupported kind
   */
  public static SyntaxNode read(String json) {
    try {
      return fromJson(new JSONObject(json));
    } catch (JSONException e) {
      throw new IllegalArgumentException("Malformed syntax tree: " + e.getMessage(), e);
    }
  }

  /**
   * Convert one JSON node (and its descendants) into a {@link SyntaxNode}.
   *
   * @param object The JSON node.
   * @return The converted node.
   */
  public static SyntaxNode fromJson(JSONObject object) {
    NodeKind kind = NodeKind.parse(object.getString("kind"));
    String value = object.isNull("value") ? "" : object.get("value").toString();
    int line = object.has("line") ? object.getInt("line") : object.optInt("sourceLine", 0);
    int column = object.has("column") ? object.getInt("column") : object.optInt("sourceColumn", 0);

    List<SyntaxNode> children = new ArrayList<>();
    JSONArray array = object.optJSONArray("children");
    if (array != null) {
      for (int i = 0; i < array.length(); i++) {
        children.add(fromJson(array.getJSONObject(i)));
      } // for
    } // if
    return new SyntaxNode(kind, value, line, column, children);
  }

  /**
   * Convert a node back into the JSON node shape.
   *
   * @param node The node to convert.
   * @return The JSON node.
   */
  public static JSONObject toJson(SyntaxNode node) {
    JSONArray children = new JSONArray();
    node.children().forEach(c -> children.put(toJson(c)));
    return new JSONObject()
        .put("kind", node.kind().name())
        .put("value", node.value())
        .put("line", node.line())
        .put("column", node.column())
        .put("children", children);
  }
}
