package io.treesitter.handles;

import io.treesitter.handles.engine.RawNode;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;

/**
 * A position inside a parsed {@link Tree}.
 *
 * <p>A Node is a lightweight borrowed view: it holds the engine's node handle and a reference to
 * its tree, and asks the engine for every fact about the position. It never extends the tree's
 * lifetime. Once the tree is closed, every method except {@link #equals}, {@link #hashCode} and
 * {@link #toString} throws {@link IllegalStateException}.
 *
 * <p>Navigation never throws for a missing relative. It returns a null node instead, which callers
 * detect with {@link #isNull()}:
 *
 * <pre>{@code
 * Node parent = node.getParent();
 * if (!parent.isNull()) {
 *     System.out.println(parent.getType());
 * }
 * }</pre>
 *
 * <p>Two Node values are equal iff they denote the same position of the same tree, regardless of
 * how they were reached.
 */
public final class Node {
  private final Tree tree;
  private final RawNode raw;

  Node(Tree tree, RawNode raw) {
    this.tree = tree;
    this.raw = raw;
  }

  // ==========================================================================
  // Flag checks
  // ==========================================================================

  /** Returns true if this is the null node, signalling that a requested relative does not exist. */
  public boolean isNull() {
    tree.checkNotClosed();
    return NodeFfi.isNull(raw);
  }

  /** Returns true if this node corresponds to a named grammar rule rather than a literal token. */
  public boolean isNamed() {
    tree.checkNotClosed();
    return NodeFfi.isNamed(raw);
  }

  /** Returns true if error recovery inserted this node for a token absent from the input. */
  public boolean isMissing() {
    tree.checkNotClosed();
    return NodeFfi.isMissing(raw);
  }

  /** Returns true if this node is an extra, such as a comment, that the grammar allows anywhere. */
  public boolean isExtra() {
    tree.checkNotClosed();
    return NodeFfi.isExtra(raw);
  }

  /** Returns true if this node or any of its descendants is an error or missing node. */
  public boolean hasError() {
    tree.checkNotClosed();
    return NodeFfi.hasError(raw);
  }

  /** Returns true if this node itself is a synthetic ERROR node. */
  public boolean isError() {
    tree.checkNotClosed();
    return NodeFfi.isError(raw);
  }

  // ==========================================================================
  // Navigation
  // ==========================================================================

  public Node getParent() {
    tree.checkNotClosed();
    return wrap(NodeFfi.parent(raw));
  }

  public Node getNextSibling() {
    tree.checkNotClosed();
    return wrap(NodeFfi.nextSibling(raw));
  }

  public Node getPreviousSibling() {
    tree.checkNotClosed();
    return wrap(NodeFfi.prevSibling(raw));
  }

  /** Returns the number of children, including anonymous tokens. */
  public int getNumChildren() {
    tree.checkNotClosed();
    return NodeFfi.childCount(raw);
  }

  /**
   * Returns the child at the given position, counting all children.
   *
   * @param position the child index in {@code [0, getNumChildren())}
   * @return the child, or a null node if the position is out of range
   */
  public Node getChild(int position) {
    tree.checkNotClosed();
    return wrap(NodeFfi.child(raw, position));
  }

  /** Returns the number of named children. */
  public int getNumNamedChildren() {
    tree.checkNotClosed();
    return NodeFfi.namedChildCount(raw);
  }

  /**
   * Returns the named child at the given position, counting only named children.
   *
   * <p>Positions here are not comparable with those of {@link #getChild(int)}.
   *
   * @param position the named child index in {@code [0, getNumNamedChildren())}
   * @return the named child, or a null node if the position is out of range
   */
  public Node getNamedChild(int position) {
    tree.checkNotClosed();
    return wrap(NodeFfi.namedChild(raw, position));
  }

  /**
   * Returns the field name of the child at the given position, counting all children.
   *
   * @param childPosition the child index in {@code [0, getNumChildren())}
   * @return the field name, or an empty string if the child has no field
   */
  public String getFieldNameForChild(int childPosition) {
    tree.checkNotClosed();
    String name = NodeFfi.fieldNameForChild(raw, childPosition);
    return name == null ? "" : name;
  }

  /**
   * Returns the child assigned to the given field.
   *
   * @param name the field name, e.g. {@code "condition"}
   * @return the child, or a null node if no child has that field
   */
  public Node getChildByFieldName(String name) {
    tree.checkNotClosed();
    return wrap(NodeFfi.childByFieldName(raw, name));
  }

  /**
   * Opens a cursor positioned at this node.
   *
   * <p>The cursor owns engine-side traversal state and must be closed:
   *
   * <pre>{@code
   * try (TreeCursor cursor = node.getCursor()) {
   *     if (cursor.gotoFirstChild()) {
   *         ...
   *     }
   * }
   * }</pre>
   *
   * @return a new cursor
   * @throws IllegalStateException if this is the null node
   */
  public TreeCursor getCursor() {
    tree.checkNotClosed();
    if (NodeFfi.isNull(raw)) {
      throw new IllegalStateException("Cannot open a cursor on a null node");
    }
    return new TreeCursor(this);
  }

  /**
   * Returns the direct children of this node, anonymous tokens included.
   *
   * <p>Each call to {@code iterator()} starts again from the first child. The walk borrows the
   * tree's cursor for this node, which is released once the iteration is exhausted. A loop that
   * stops early leaves that one cursor open for the next iteration over the same node, and the tree
   * releases it on close. A null node has no children.
   */
  public Iterable<Node> getChildren() {
    tree.checkNotClosed();
    return () -> children(false);
  }

  /** Returns the named direct children of this node. Iterates like {@link #getChildren()}. */
  public Iterable<Node> getNamedChildren() {
    tree.checkNotClosed();
    return () -> children(true);
  }

  private Iterator<Node> children(boolean namedOnly) {
    tree.checkNotClosed();
    if (NodeFfi.isNull(raw)) {
      return Collections.emptyIterator();
    }
    return new ChildIterator(this, namedOnly);
  }

  // ==========================================================================
  // Attributes
  // ==========================================================================

  /**
   * Returns the identity of this node. Two nodes have equal ids iff they denote the same position
   * in the same tree.
   */
  public long getID() {
    tree.checkNotClosed();
    return raw.id();
  }

  /**
   * Renders the subtree rooted here as an S-expression, for debugging and golden output. The format
   * is defined by the engine.
   */
  public String getSExpr() {
    tree.checkNotClosed();
    return NodeFfi.string(raw);
  }

  /** Same as {@link #getSExpr()}. */
  public String getString() {
    return getSExpr();
  }

  /** Returns the numeric grammar symbol of this node. */
  public int getSymbol() {
    tree.checkNotClosed();
    return NodeFfi.symbol(raw);
  }

  /** Returns the grammar name of this node's symbol, e.g. {@code "number"} or {@code "+"}. */
  public String getType() {
    tree.checkNotClosed();
    return NodeFfi.type(raw);
  }

  /** Returns the language this node's symbols resolve against. */
  public Language getLanguage() {
    tree.checkNotClosed();
    return new Language(NodeFfi.language(raw));
  }

  /** Returns the byte offsets covered by this node. */
  public Extent<Integer> getByteRange() {
    tree.checkNotClosed();
    return new Extent<>(NodeFfi.startByte(raw), NodeFfi.endByte(raw));
  }

  /** Returns the row/column positions covered by this node. */
  public Extent<Point> getPointRange() {
    tree.checkNotClosed();
    return new Extent<>(NodeFfi.startPoint(raw), NodeFfi.endPoint(raw));
  }

  /**
   * Returns the text of this node within the parsed source.
   *
   * <p>The tree does not keep the source, so the caller must pass the exact text that was parsed.
   * The text is encoded to UTF-8 on every call; when slicing many nodes of the same source, encode
   * it once and use {@link #getSourceRange(byte[])}.
   *
   * @param sourceText the text that was parsed
   * @return the slice of {@code sourceText} covered by this node
   * @throws IndexOutOfBoundsException if the text is shorter than the node's byte range
   */
  public String getSourceRange(String sourceText) {
    byte[] slice = getSourceRange(sourceText.getBytes(StandardCharsets.UTF_8));
    return new String(slice, StandardCharsets.UTF_8);
  }

  /**
   * Returns the bytes of this node within the parsed buffer.
   *
   * @param source the buffer that was parsed
   * @return a copy of the bytes covered by this node
   * @throws IndexOutOfBoundsException if the buffer is shorter than the node's byte range
   */
  public byte[] getSourceRange(byte[] source) {
    Extent<Integer> range = getByteRange();
    if (range.end() > source.length) {
      throw new IndexOutOfBoundsException(
          "Node range "
              + range
              + " exceeds source of "
              + source.length
              + " bytes; pass the buffer that was parsed");
    }
    return Arrays.copyOfRange(source, range.start(), range.end());
  }

  /** Returns the tree this node belongs to. */
  public Tree getTree() {
    return tree;
  }

  RawNode raw() {
    return raw;
  }

  private Node wrap(RawNode node) {
    return new Node(tree, node);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node other = (Node) o;
    return tree == other.tree && raw.id() == other.raw.id();
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(tree) + Long.hashCode(raw.id());
  }

  @Override
  public String toString() {
    if (tree.isClosed()) {
      return "Node[closed tree]";
    }
    if (isNull()) {
      return "Node[null]";
    }
    return "Node[" + getType() + " " + getByteRange() + "]";
  }
}
