package io.treesitter.handles.engine;

import io.treesitter.handles.Point;

/**
 * The low-level interface of a tree-sitter style parsing engine.
 *
 * <p>This is the only boundary between the handle layer and the engine that does the actual
 * parsing. It is ownership-agnostic and C-shaped: parsers, trees, cursors and
 * languages are opaque {@code long} handles where {@code 0} means NULL, nodes are {@link RawNode}
 * values, and every handle obtained from a {@code *New} or parse call must be released with the
 * matching {@code *Delete} call. The engine performs no reference counting; using a handle after
 * its release is undefined.
 *
 * <p>Application code never calls this interface directly. An implementation is located once per
 * process by the library's engine loader, either from the {@code treesitter.engine} system
 * property, the {@code TREESITTER_ENGINE} environment variable or a {@link java.util.ServiceLoader}
 * registration, and must have a public no-argument constructor.
 *
 * <p>Example registration, in {@code
 * META-INF/services/io.treesitter.handles.engine.TreeSitterEngine}:
 *
 * <pre>{@code
 * com.example.MyNativeEngine
 * }</pre>
 */
public interface TreeSitterEngine {

  // ==========================================================================
  // Parser
  // ==========================================================================

  /**
   * Allocates a new parser with no language set.
   *
   * @return the parser handle, or 0 on allocation failure
   */
  long parserNew();

  /**
   * Releases a parser. Trees produced by the parser stay valid.
   *
   * @param parser the parser handle
   */
  void parserDelete(long parser);

  /**
   * Binds a language to a parser for all subsequent parses.
   *
   * @param parser the parser handle
   * @param language the language handle
   * @return false if the language was generated for an ABI version this engine cannot load
   */
  boolean parserSetLanguage(long parser, long language);

  /**
   * Parses a source buffer from scratch.
   *
   * <p>A syntactically invalid buffer still yields a tree; errors are represented by ERROR and
   * MISSING nodes inside it.
   *
   * @param parser the parser handle
   * @param oldTree a previous tree for incremental reuse, or 0
   * @param input the source bytes
   * @param length the number of bytes of {@code input} to parse
   * @return the new tree handle, or 0 if the parser has no language
   */
  long parserParseString(long parser, long oldTree, byte[] input, int length);

  // ==========================================================================
  // Tree
  // ==========================================================================

  RawNode treeRootNode(long tree);

  long treeLanguage(long tree);

  /**
   * Releases a tree. Every node and cursor derived from it becomes invalid.
   *
   * @param tree the tree handle
   */
  void treeDelete(long tree);

  // ==========================================================================
  // Node
  // ==========================================================================

  boolean nodeIsNull(RawNode node);

  boolean nodeIsNamed(RawNode node);

  boolean nodeIsMissing(RawNode node);

  boolean nodeIsExtra(RawNode node);

  boolean nodeHasError(RawNode node);

  boolean nodeIsError(RawNode node);

  RawNode nodeParent(RawNode node);

  RawNode nodeChild(RawNode node, int index);

  int nodeChildCount(RawNode node);

  RawNode nodeNamedChild(RawNode node, int index);

  int nodeNamedChildCount(RawNode node);

  /**
   * Returns the field name of the child at the given index, counting all children.
   *
   * @param node the parent node
   * @param index the child index
   * @return the field name, or null if the child has no field
   */
  String nodeFieldNameForChild(RawNode node, int index);

  RawNode nodeChildByFieldName(RawNode node, String fieldName);

  RawNode nodeNextSibling(RawNode node);

  RawNode nodePrevSibling(RawNode node);

  int nodeSymbol(RawNode node);

  String nodeType(RawNode node);

  long nodeLanguage(RawNode node);

  int nodeStartByte(RawNode node);

  int nodeEndByte(RawNode node);

  Point nodeStartPoint(RawNode node);

  Point nodeEndPoint(RawNode node);

  /**
   * Renders the subtree rooted at the node as an S-expression.
   *
   * @param node the node
   * @return the engine-defined S-expression text
   */
  String nodeString(RawNode node);

  // ==========================================================================
  // Tree cursor
  // ==========================================================================

  long treeCursorNew(RawNode node);

  void treeCursorDelete(long cursor);

  void treeCursorReset(long cursor, RawNode node);

  void treeCursorResetTo(long destination, long source);

  long treeCursorCopy(long cursor);

  RawNode treeCursorCurrentNode(long cursor);

  /**
   * Returns the field name of the cursor's current node within its parent.
   *
   * @param cursor the cursor handle
   * @return the field name, or null if the current node has no field
   */
  String treeCursorCurrentFieldName(long cursor);

  boolean treeCursorGotoParent(long cursor);

  boolean treeCursorGotoFirstChild(long cursor);

  boolean treeCursorGotoLastChild(long cursor);

  boolean treeCursorGotoNextSibling(long cursor);

  boolean treeCursorGotoPreviousSibling(long cursor);

  int treeCursorCurrentDepth(long cursor);

  // ==========================================================================
  // Language
  // ==========================================================================

  /**
   * Resolves a grammar descriptor by name. Language handles are static and are never released.
   *
   * @param name the grammar name
   * @return the language handle, or 0 if the engine has no such grammar
   */
  long languageForName(String name);

  int languageSymbolCount(long language);

  /**
   * Returns the name of a symbol.
   *
   * @param language the language handle
   * @param symbol the symbol id
   * @return the name, or null if the id is not defined by the grammar
   */
  String languageSymbolName(long language, int symbol);

  /**
   * Looks up a symbol by name.
   *
   * @param language the language handle
   * @param name the symbol name
   * @param isNamed whether to look up a named rule or an anonymous token
   * @return the symbol id, or 0 if there is no such symbol
   */
  int languageSymbolForName(long language, String name, boolean isNamed);

  /**
   * Returns the kind of a symbol: 0 regular, 1 anonymous, 2 supertype, 3 auxiliary.
   *
   * @param language the language handle
   * @param symbol the symbol id
   * @return the symbol kind code
   */
  int languageSymbolType(long language, int symbol);

  int languageFieldCount(long language);

  String languageFieldNameForId(long language, int fieldId);

  int languageFieldIdForName(long language, String name);

  int languageVersion(long language);
}
