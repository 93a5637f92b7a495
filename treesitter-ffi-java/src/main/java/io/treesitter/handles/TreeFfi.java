package io.treesitter.handles;

import io.treesitter.handles.engine.RawNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal FFI helper for Tree.
 *
 * <p>Owns the engine-side tree and deletes it on close.
 */
final class TreeFfi implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(TreeFfi.class);

  private final long tree;
  private boolean closed = false;

  TreeFfi(long tree) {
    this.tree = tree;
  }

  RawNode rootNode() {
    return NativeUtil.call("Get root node", engine -> engine.treeRootNode(tree));
  }

  long language() {
    return NativeUtil.callForPointer("Get tree language", engine -> engine.treeLanguage(tree));
  }

  long address() {
    return tree;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      try {
        NativeUtil.run("Delete tree", engine -> engine.treeDelete(tree));
        logger.debug("Closed tree: {}", tree);
      } catch (Throwable e) {
        logger.error("Error closing tree", e);
      }
    }
  }
}
