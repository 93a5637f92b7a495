package io.treesitter.handles.engine;

/**
 * An engine-side node handle.
 *
 * <p>Mirrors the engine's by-value node struct: the owning tree handle, a tree-relative node id and
 * one word of engine-private context. A RawNode carries no ownership and is only meaningful while
 * the tree it came from has not been deleted.
 *
 * @param tree the handle of the tree this node belongs to
 * @param id the engine's identifier for the node, 0 for the null node
 * @param context engine-private data, opaque to callers
 */
public record RawNode(long tree, long id, long context) {

  /** The null node: returned by the engine when a requested relative does not exist. */
  public static final RawNode NULL = new RawNode(0L, 0L, 0L);

  /**
   * Creates the null node for the given tree, so that absence stays tied to the tree it was asked
   * about.
   *
   * @param tree the tree handle
   * @return a null node
   */
  public static RawNode nullIn(long tree) {
    return new RawNode(tree, 0L, 0L);
  }
}
