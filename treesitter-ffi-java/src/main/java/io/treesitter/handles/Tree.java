package io.treesitter.handles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The result of a parse, and the sole owner of the engine-side syntax tree.
 *
 * <p>Every {@link Node} and {@link TreeCursor} derived from a tree borrows it. Closing the tree
 * releases the engine memory, closes any cursor still open on it, and makes every derived node and
 * cursor throw {@link IllegalStateException} on use. Scope the tree so it outlives them:
 *
 * <pre>{@code
 * try (Parser parser = new Parser(language);
 *      Tree tree = parser.parseString(source)) {
 *     Node root = tree.getRootNode();
 *     for (Node child : root.getChildren()) {
 *         System.out.println(child.getType() + " " + child.getSourceRange(source));
 *     }
 * }
 * }</pre>
 *
 * <p>A tree does not depend on the parser that produced it. Trees are not thread-safe.
 */
public final class Tree implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Tree.class);

  private final TreeFfi ffi;
  // Cursors still holding engine state on this tree, released on close
  private final Set<TreeCursor> cursors = Collections.newSetFromMap(new IdentityHashMap<>());
  // Child iteration cursors by parent node id, at most one per parent
  private final Map<Long, ChildCursor> childCursors = new HashMap<>();
  private volatile boolean closed = false;

  Tree(long tree) {
    this.ffi = new TreeFfi(tree);
    logger.debug("Created tree: {}", tree);
  }

  /** Returns the root node, the entry point for all traversal. It is never the null node. */
  public Node getRootNode() {
    checkNotClosed();
    return new Node(this, ffi.rootNode());
  }

  /** Returns the language this tree was parsed with. */
  public Language getLanguage() {
    checkNotClosed();
    return new Language(ffi.language());
  }

  /**
   * Returns true if the parsed text contained syntax errors. Same as {@code
   * getRootNode().hasError()}.
   */
  public boolean hasError() {
    return getRootNode().hasError();
  }

  /** Returns true once this tree has been closed. */
  public boolean isClosed() {
    return closed;
  }

  void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("Tree has been closed");
    }
  }

  void register(TreeCursor cursor) {
    checkNotClosed();
    cursors.add(cursor);
  }

  void unregister(TreeCursor cursor) {
    cursors.remove(cursor);
  }

  int openCursorCount() {
    return cursors.size();
  }

  /**
   * Hands the child iteration cursor of a node to a new holder, positioned on the node. The cursor
   * is opened on first use and reused by every later iteration over the same node.
   */
  TreeCursor claimChildCursor(Node parent, ChildIterator holder) {
    checkNotClosed();
    ChildCursor lease = childCursors.get(parent.getID());
    if (lease == null || lease.cursor.isClosed()) {
      lease = new ChildCursor(parent.getCursor());
      childCursors.put(parent.getID(), lease);
    } else {
      lease.cursor.reset(parent);
    }
    lease.holder = holder;
    return lease.cursor;
  }

  boolean holdsChildCursor(Node parent, ChildIterator holder) {
    checkNotClosed();
    ChildCursor lease = childCursors.get(parent.getID());
    return lease != null && lease.holder == holder && !lease.cursor.isClosed();
  }

  void releaseChildCursor(Node parent, ChildIterator holder) {
    ChildCursor lease = childCursors.get(parent.getID());
    if (lease != null && lease.holder == holder) {
      childCursors.remove(parent.getID());
      lease.cursor.close();
    }
  }

  private static final class ChildCursor {
    final TreeCursor cursor;
    ChildIterator holder;

    ChildCursor(TreeCursor cursor) {
      this.cursor = cursor;
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      childCursors.clear();
      if (!cursors.isEmpty()) {
        logger.warn(
            "Closing {} tree cursor(s) still open on tree {}", cursors.size(), ffi.address());
        List<TreeCursor> open = new ArrayList<>(cursors);
        cursors.clear();
        for (TreeCursor cursor : open) {
          cursor.release();
        }
      }
      ffi.close();
    }
  }
}
