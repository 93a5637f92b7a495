package io.treesitter.handles;

import io.treesitter.handles.engine.RawNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal FFI helper for TreeCursor.
 *
 * <p>Owns the engine-side cursor, including its ancestor stack, and releases it on close.
 */
final class TreeCursorFfi implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(TreeCursorFfi.class);

  private final long cursor;
  private boolean closed = false;

  private TreeCursorFfi(long cursor) {
    this.cursor = cursor;
  }

  static TreeCursorFfi create(RawNode node) {
    long cursor =
        NativeUtil.callForPointer("Create tree cursor", engine -> engine.treeCursorNew(node));
    logger.debug("Created tree cursor: {}", cursor);
    return new TreeCursorFfi(cursor);
  }

  TreeCursorFfi copy() {
    long copy =
        NativeUtil.callForPointer("Copy tree cursor", engine -> engine.treeCursorCopy(cursor));
    logger.debug("Copied tree cursor {} to {}", cursor, copy);
    return new TreeCursorFfi(copy);
  }

  void reset(RawNode node) {
    NativeUtil.run("Reset tree cursor", engine -> engine.treeCursorReset(cursor, node));
  }

  void resetTo(TreeCursorFfi source) {
    NativeUtil.run(
        "Reset tree cursor to cursor", engine -> engine.treeCursorResetTo(cursor, source.cursor));
  }

  RawNode currentNode() {
    return NativeUtil.call("Get cursor node", engine -> engine.treeCursorCurrentNode(cursor));
  }

  String currentFieldName() {
    return NativeUtil.call(
        "Get cursor field name", engine -> engine.treeCursorCurrentFieldName(cursor));
  }

  boolean gotoParent() {
    return NativeUtil.callForBoolean("Go to parent", engine -> engine.treeCursorGotoParent(cursor));
  }

  boolean gotoFirstChild() {
    return NativeUtil.callForBoolean(
        "Go to first child", engine -> engine.treeCursorGotoFirstChild(cursor));
  }

  boolean gotoLastChild() {
    return NativeUtil.callForBoolean(
        "Go to last child", engine -> engine.treeCursorGotoLastChild(cursor));
  }

  boolean gotoNextSibling() {
    return NativeUtil.callForBoolean(
        "Go to next sibling", engine -> engine.treeCursorGotoNextSibling(cursor));
  }

  boolean gotoPreviousSibling() {
    return NativeUtil.callForBoolean(
        "Go to previous sibling", engine -> engine.treeCursorGotoPreviousSibling(cursor));
  }

  int currentDepth() {
    return NativeUtil.callForInt(
        "Get cursor depth", engine -> engine.treeCursorCurrentDepth(cursor));
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      try {
        NativeUtil.run("Delete tree cursor", engine -> engine.treeCursorDelete(cursor));
        logger.debug("Closed tree cursor: {}", cursor);
      } catch (Throwable e) {
        logger.error("Error closing tree cursor", e);
      }
    }
  }
}
