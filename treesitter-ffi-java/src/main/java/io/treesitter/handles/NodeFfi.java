package io.treesitter.handles;

import io.treesitter.handles.engine.RawNode;

/**
 * Internal FFI helper for Node.
 *
 * <p>Nodes are passed to the engine by value, so this helper is stateless.
 */
final class NodeFfi {

  private NodeFfi() {}

  static boolean isNull(RawNode node) {
    return NativeUtil.callForBoolean("Check null node", engine -> engine.nodeIsNull(node));
  }

  static boolean isNamed(RawNode node) {
    return NativeUtil.callForBoolean("Check named node", engine -> engine.nodeIsNamed(node));
  }

  static boolean isMissing(RawNode node) {
    return NativeUtil.callForBoolean("Check missing node", engine -> engine.nodeIsMissing(node));
  }

  static boolean isExtra(RawNode node) {
    return NativeUtil.callForBoolean("Check extra node", engine -> engine.nodeIsExtra(node));
  }

  static boolean hasError(RawNode node) {
    return NativeUtil.callForBoolean("Check node errors", engine -> engine.nodeHasError(node));
  }

  static boolean isError(RawNode node) {
    return NativeUtil.callForBoolean("Check error node", engine -> engine.nodeIsError(node));
  }

  static RawNode parent(RawNode node) {
    return NativeUtil.call("Get parent", engine -> engine.nodeParent(node));
  }

  static RawNode nextSibling(RawNode node) {
    return NativeUtil.call("Get next sibling", engine -> engine.nodeNextSibling(node));
  }

  static RawNode prevSibling(RawNode node) {
    return NativeUtil.call("Get previous sibling", engine -> engine.nodePrevSibling(node));
  }

  static RawNode child(RawNode node, int index) {
    return NativeUtil.call("Get child " + index, engine -> engine.nodeChild(node, index));
  }

  static int childCount(RawNode node) {
    return NativeUtil.callForInt("Get child count", engine -> engine.nodeChildCount(node));
  }

  static RawNode namedChild(RawNode node, int index) {
    return NativeUtil.call(
        "Get named child " + index, engine -> engine.nodeNamedChild(node, index));
  }

  static int namedChildCount(RawNode node) {
    return NativeUtil.callForInt(
        "Get named child count", engine -> engine.nodeNamedChildCount(node));
  }

  static String fieldNameForChild(RawNode node, int index) {
    return NativeUtil.call(
        "Get field name for child " + index, engine -> engine.nodeFieldNameForChild(node, index));
  }

  static RawNode childByFieldName(RawNode node, String fieldName) {
    return NativeUtil.call(
        "Get child by field '" + fieldName + "'",
        engine -> engine.nodeChildByFieldName(node, fieldName));
  }

  static int symbol(RawNode node) {
    return NativeUtil.callForInt("Get node symbol", engine -> engine.nodeSymbol(node));
  }

  static String type(RawNode node) {
    return NativeUtil.call("Get node type", engine -> engine.nodeType(node));
  }

  static long language(RawNode node) {
    return NativeUtil.callForPointer("Get node language", engine -> engine.nodeLanguage(node));
  }

  static int startByte(RawNode node) {
    return NativeUtil.callForInt("Get start byte", engine -> engine.nodeStartByte(node));
  }

  static int endByte(RawNode node) {
    return NativeUtil.callForInt("Get end byte", engine -> engine.nodeEndByte(node));
  }

  static Point startPoint(RawNode node) {
    return NativeUtil.call("Get start point", engine -> engine.nodeStartPoint(node));
  }

  static Point endPoint(RawNode node) {
    return NativeUtil.call("Get end point", engine -> engine.nodeEndPoint(node));
  }

  static String string(RawNode node) {
    return NativeUtil.call("Render S-expression", engine -> engine.nodeString(node));
  }
}
