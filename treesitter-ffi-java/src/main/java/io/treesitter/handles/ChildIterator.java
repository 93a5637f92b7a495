package io.treesitter.handles;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only iteration over the direct children of a node, driven by the tree's cursor for that
 * node.
 *
 * <p>Iterations over the same parent share one cursor. When another iteration has taken it over,
 * the cursor is walked back to this iteration's child before moving on. The cursor is released as
 * soon as the last child has been returned.
 */
final class ChildIterator implements Iterator<Node> {
  private final Node parent;
  private final boolean namedOnly;
  private TreeCursor cursor;
  // index of the cursor's current node among all children of the parent
  private int position;
  private Node next;

  ChildIterator(Node parent, boolean namedOnly) {
    this.parent = parent;
    this.namedOnly = namedOnly;
    this.cursor = parent.getTree().claimChildCursor(parent, this);
    advance(cursor.gotoFirstChild());
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public Node next() {
    if (next == null) {
      throw new NoSuchElementException();
    }
    Node result = next;
    reclaim();
    advance(step());
    return result;
  }

  private void reclaim() {
    Tree tree = parent.getTree();
    if (tree.holdsChildCursor(parent, this)) {
      return;
    }
    cursor = tree.claimChildCursor(parent, this);
    cursor.gotoFirstChild();
    for (int i = 0; i < position; i++) {
      cursor.gotoNextSibling();
    }
  }

  private boolean step() {
    if (cursor.gotoNextSibling()) {
      position++;
      return true;
    }
    return false;
  }

  private void advance(boolean moved) {
    while (moved) {
      Node current = cursor.getCurrentNode();
      if (!namedOnly || current.isNamed()) {
        next = current;
        return;
      }
      moved = step();
    }
    next = null;
    parent.getTree().releaseChildCursor(parent, this);
  }
}
