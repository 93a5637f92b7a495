package io.treesitter.handles;

import java.util.Optional;

/**
 * A stateful walk over a {@link Tree}.
 *
 * <p>A cursor keeps the engine-side ancestor stack of its current position, which makes deep walks
 * cheaper than repeated {@link Node#getParent()} and {@link Node#getChild(int)} lookups. Every
 * {@code goto} method reports whether the move happened; a failed move leaves the cursor where it
 * was.
 *
 * <p>A cursor owns engine memory and must be closed. It is never copied implicitly: {@link #copy()}
 * is the only way to duplicate one. Closing the tree also releases every cursor still open on it.
 *
 * <p>Example pre-order walk:
 *
 * <pre>{@code
 * try (TreeCursor cursor = tree.getRootNode().getCursor()) {
 *     do {
 *         visit(cursor.getCurrentNode());
 *         if (cursor.gotoFirstChild()) {
 *             continue;
 *         }
 *         while (!cursor.gotoNextSibling()) {
 *             if (!cursor.gotoParent()) {
 *                 return;
 *             }
 *         }
 *     } while (true);
 * }
 * }</pre>
 */
public final class TreeCursor implements AutoCloseable {
  private final TreeCursorFfi ffi;
  private Tree tree;
  private volatile boolean closed = false;

  TreeCursor(Node node) {
    this(node.getTree(), TreeCursorFfi.create(node.raw()));
  }

  private TreeCursor(Tree tree, TreeCursorFfi ffi) {
    this.tree = tree;
    this.ffi = ffi;
    tree.register(this);
  }

  /**
   * Creates an independent cursor at the same position, duplicating the ancestor stack.
   *
   * @return the new cursor, which must be closed separately
   */
  public TreeCursor copy() {
    checkUsable();
    return new TreeCursor(tree, ffi.copy());
  }

  /**
   * Moves this cursor to an arbitrary node, discarding its previous stack. The node becomes the
   * new origin for {@link #getDepthFromOrigin()}. A node from another tree rebinds the cursor to
   * that tree.
   *
   * @param node the new position
   */
  public void reset(Node node) {
    checkUsable();
    node.getTree().checkNotClosed();
    ffi.reset(node.raw());
    rebind(node.getTree());
  }

  /**
   * Moves this cursor to the position of another cursor, sharing its ancestry.
   *
   * @param other the cursor to copy the position from
   */
  public void reset(TreeCursor other) {
    checkUsable();
    other.checkUsable();
    ffi.resetTo(other.ffi);
    rebind(other.tree);
  }

  /** Returns the node at the current position without moving. */
  public Node getCurrentNode() {
    checkUsable();
    return new Node(tree, ffi.currentNode());
  }

  /** Returns the field name of the current node within its parent, if it has one. */
  public Optional<String> getCurrentFieldName() {
    checkUsable();
    return Optional.ofNullable(ffi.currentFieldName());
  }

  public boolean gotoParent() {
    checkUsable();
    return ffi.gotoParent();
  }

  public boolean gotoFirstChild() {
    checkUsable();
    return ffi.gotoFirstChild();
  }

  public boolean gotoLastChild() {
    checkUsable();
    return ffi.gotoLastChild();
  }

  public boolean gotoNextSibling() {
    checkUsable();
    return ffi.gotoNextSibling();
  }

  public boolean gotoPreviousSibling() {
    checkUsable();
    return ffi.gotoPreviousSibling();
  }

  /**
   * Returns the number of edges between the current node and the node the cursor was created at or
   * last reset to.
   */
  public int getDepthFromOrigin() {
    checkUsable();
    return ffi.currentDepth();
  }

  /** Returns the tree this cursor is currently bound to. */
  public Tree getTree() {
    return tree;
  }

  /** Returns true once this cursor, or the tree it was bound to, has been closed. */
  public boolean isClosed() {
    return closed;
  }

  private void rebind(Tree target) {
    if (target != tree) {
      tree.unregister(this);
      target.register(this);
      tree = target;
    }
  }

  private void checkUsable() {
    if (closed) {
      throw new IllegalStateException("TreeCursor has been closed");
    }
    tree.checkNotClosed();
  }

  /** Releases the engine-side state when the owning tree closes. */
  void release() {
    if (!closed) {
      closed = true;
      ffi.close();
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      tree.unregister(this);
      ffi.close();
    }
  }
}
