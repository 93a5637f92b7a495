package io.treesitter.handles.engine.jni;

import io.treesitter.handles.Point;
import io.treesitter.handles.engine.RawNode;
import io.treesitter.handles.engine.TreeSitterEngine;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSInputEncoding;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSSymbolType;
import org.treesitter.TSTree;
import org.treesitter.TSTreeCursor;

/**
 * The native tree-sitter runtime, reached through the {@code org.treesitter} JNI bindings.
 *
 * <p>Grammars are the {@code org.treesitter.TreeSitter<Name>} classes shipped as separate
 * artifacts: the language name {@code javascript} resolves to {@code TreeSitterJavascript} and
 * {@code c_sharp} or {@code c-sharp} to {@code TreeSitterCSharp}. A fully qualified class name of
 * any {@link TSLanguage} subclass is accepted too. A grammar whose artifact is not on the class
 * path is reported as unknown.
 *
 * <p>The bindings free native memory once their Java objects become unreachable, so deleting a
 * parser, tree or cursor drops it from the handle table. Nodes are interned per tree: a node
 * reached twice, by any route, gets the same id.
 */
public final class JniEngine implements TreeSitterEngine {
  private static final Logger logger = LoggerFactory.getLogger(JniEngine.class);
  private static final String GRAMMAR_PACKAGE = "org.treesitter.TreeSitter";
  private static final int READ_BUFFER_SIZE = 64 * 1024;
  private static final int ERROR_SYMBOL = 0xFFFF;

  private final AtomicLong handles = new AtomicLong(1);
  private final Map<String, Long> languagesByName = new ConcurrentHashMap<>();
  private final Map<Long, TSLanguage> languages = new ConcurrentHashMap<>();
  private final Map<Long, ParserState> parsers = new ConcurrentHashMap<>();
  private final Map<Long, TreeState> trees = new ConcurrentHashMap<>();
  private final Map<Long, CursorState> cursors = new ConcurrentHashMap<>();

  private static final class ParserState {
    final TSParser parser = new TSParser();
    long language;
  }

  private static final class TreeState {
    final TSTree tree;
    final long language;
    // node id n is nodes.get(n - 1)
    private final List<TSNode> nodes = new ArrayList<>();
    private final Map<NodeKey, List<Integer>> buckets = new HashMap<>();

    TreeState(TSTree tree, long language) {
      this.tree = tree;
      this.language = language;
    }

    synchronized long intern(TSNode node) {
      NodeKey key = new NodeKey(node.getStartByte(), node.getEndByte(), node.getSymbol());
      List<Integer> bucket = buckets.computeIfAbsent(key, k -> new ArrayList<>(1));
      for (int index : bucket) {
        if (TSNode.eq(nodes.get(index), node)) {
          return index + 1L;
        }
      }
      nodes.add(node);
      bucket.add(nodes.size() - 1);
      return nodes.size();
    }

    synchronized TSNode node(long id) {
      if (id < 1 || id > nodes.size()) {
        throw new IllegalStateException("Node " + id + " is not part of this tree");
      }
      return nodes.get((int) (id - 1));
    }
  }

  private record NodeKey(int startByte, int endByte, int symbol) {}

  private static final class CursorState {
    TSTreeCursor cursor;
    long tree;
    // child index of each step taken below the origin, innermost last
    Deque<Integer> path = new ArrayDeque<>();

    CursorState(TSTreeCursor cursor, long tree) {
      this.cursor = cursor;
      this.tree = tree;
    }
  }

  public JniEngine() {
    logger.debug(
        "tree-sitter runtime accepts language versions {} to {}",
        TSParser.TREE_SITTER_MIN_COMPATIBLE_LANGUAGE_VERSION,
        TSParser.TREE_SITTER_LANGUAGE_VERSION);
  }

  // ==========================================================================
  // Parser
  // ==========================================================================

  @Override
  public long parserNew() {
    long handle = handles.getAndIncrement();
    parsers.put(handle, new ParserState());
    return handle;
  }

  @Override
  public void parserDelete(long parser) {
    if (parsers.remove(parser) == null) {
      throw new IllegalStateException("Unknown parser handle " + parser);
    }
  }

  @Override
  public boolean parserSetLanguage(long parser, long language) {
    ParserState state = parser(parser);
    int version = languageVersion(language);
    if (version < TSParser.TREE_SITTER_MIN_COMPATIBLE_LANGUAGE_VERSION
        || version > TSParser.TREE_SITTER_LANGUAGE_VERSION
        || !state.parser.setLanguage(language(language))) {
      return false;
    }
    state.language = language;
    return true;
  }

  @Override
  public long parserParseString(long parser, long oldTree, byte[] input, int length) {
    ParserState state = parser(parser);
    if (state.language == 0L) {
      return 0L;
    }
    TSTree previous = oldTree == 0L ? null : tree(oldTree).tree;
    byte[] buffer = new byte[Math.max(1, Math.min(length, READ_BUFFER_SIZE))];
    TSTree tree =
        state.parser.parse(
            buffer,
            previous,
            (buf, offset, position) -> {
              if (offset >= length) {
                return 0;
              }
              int count = Math.min(buf.length, length - offset);
              System.arraycopy(input, offset, buf, 0, count);
              return count;
            },
            TSInputEncoding.TSInputEncodingUTF8);
    if (tree == null) {
      return 0L;
    }
    long handle = handles.getAndIncrement();
    trees.put(handle, new TreeState(tree, state.language));
    return handle;
  }

  // ==========================================================================
  // Tree
  // ==========================================================================

  @Override
  public RawNode treeRootNode(long tree) {
    TreeState state = tree(tree);
    return raw(tree, state, state.tree.getRootNode());
  }

  @Override
  public long treeLanguage(long tree) {
    return tree(tree).language;
  }

  @Override
  public void treeDelete(long tree) {
    if (trees.remove(tree) == null) {
      throw new IllegalStateException("Unknown tree handle " + tree);
    }
  }

  // ==========================================================================
  // Node
  // ==========================================================================

  @Override
  public boolean nodeIsNull(RawNode node) {
    return node.id() == 0L;
  }

  @Override
  public boolean nodeIsNamed(RawNode node) {
    TSNode n = node(node);
    return n != null && n.isNamed();
  }

  @Override
  public boolean nodeIsMissing(RawNode node) {
    TSNode n = node(node);
    return n != null && n.isMissing();
  }

  @Override
  public boolean nodeIsExtra(RawNode node) {
    TSNode n = node(node);
    return n != null && n.isExtra();
  }

  @Override
  public boolean nodeHasError(RawNode node) {
    TSNode n = node(node);
    return n != null && n.hasError();
  }

  @Override
  public boolean nodeIsError(RawNode node) {
    TSNode n = node(node);
    return n != null && n.isError();
  }

  @Override
  public RawNode nodeParent(RawNode node) {
    TSNode n = node(node);
    return n == null ? RawNode.nullIn(node.tree()) : raw(node.tree(), n.getParent());
  }

  @Override
  public RawNode nodeChild(RawNode node, int index) {
    TSNode n = node(node);
    if (n == null || index < 0 || index >= n.getChildCount()) {
      return RawNode.nullIn(node.tree());
    }
    return raw(node.tree(), n.getChild(index));
  }

  @Override
  public int nodeChildCount(RawNode node) {
    TSNode n = node(node);
    return n == null ? 0 : n.getChildCount();
  }

  @Override
  public RawNode nodeNamedChild(RawNode node, int index) {
    TSNode n = node(node);
    if (n == null || index < 0 || index >= n.getNamedChildCount()) {
      return RawNode.nullIn(node.tree());
    }
    return raw(node.tree(), n.getNamedChild(index));
  }

  @Override
  public int nodeNamedChildCount(RawNode node) {
    TSNode n = node(node);
    return n == null ? 0 : n.getNamedChildCount();
  }

  @Override
  public String nodeFieldNameForChild(RawNode node, int index) {
    TSNode n = node(node);
    if (n == null || index < 0 || index >= n.getChildCount()) {
      return null;
    }
    return n.getFieldNameForChild(index);
  }

  @Override
  public RawNode nodeChildByFieldName(RawNode node, String fieldName) {
    TSNode n = node(node);
    if (n == null || languageFieldIdForName(tree(node.tree()).language, fieldName) == 0) {
      return RawNode.nullIn(node.tree());
    }
    return raw(node.tree(), n.getChildByFieldName(fieldName));
  }

  @Override
  public RawNode nodeNextSibling(RawNode node) {
    TSNode n = node(node);
    return n == null ? RawNode.nullIn(node.tree()) : raw(node.tree(), n.getNextSibling());
  }

  @Override
  public RawNode nodePrevSibling(RawNode node) {
    TSNode n = node(node);
    return n == null ? RawNode.nullIn(node.tree()) : raw(node.tree(), n.getPrevSibling());
  }

  @Override
  public int nodeSymbol(RawNode node) {
    TSNode n = node(node);
    return n == null ? 0 : n.getSymbol();
  }

  @Override
  public String nodeType(RawNode node) {
    TSNode n = node(node);
    return n == null ? "" : n.getType();
  }

  @Override
  public long nodeLanguage(RawNode node) {
    return tree(node.tree()).language;
  }

  @Override
  public int nodeStartByte(RawNode node) {
    TSNode n = node(node);
    return n == null ? 0 : n.getStartByte();
  }

  @Override
  public int nodeEndByte(RawNode node) {
    TSNode n = node(node);
    return n == null ? 0 : n.getEndByte();
  }

  @Override
  public Point nodeStartPoint(RawNode node) {
    TSNode n = node(node);
    return n == null ? Point.ORIGIN : point(n.getStartPoint());
  }

  @Override
  public Point nodeEndPoint(RawNode node) {
    TSNode n = node(node);
    return n == null ? Point.ORIGIN : point(n.getEndPoint());
  }

  @Override
  public String nodeString(RawNode node) {
    TSNode n = node(node);
    return n == null ? "" : n.toString();
  }

  private static Point point(TSPoint point) {
    return new Point(point.getRow(), point.getColumn());
  }

  // ==========================================================================
  // Tree cursor
  //
  // The bindings only move a cursor to the parent, the first child and the next sibling. The
  // child index of every step is kept alongside so the remaining moves can be replayed from the
  // parent.
  // ==========================================================================

  @Override
  public long treeCursorNew(RawNode node) {
    TSNode n = node(node);
    if (n == null) {
      throw new IllegalArgumentException("Cannot create a cursor on the null node");
    }
    long handle = handles.getAndIncrement();
    cursors.put(handle, new CursorState(new TSTreeCursor(n), node.tree()));
    return handle;
  }

  @Override
  public void treeCursorDelete(long cursor) {
    if (cursors.remove(cursor) == null) {
      throw new IllegalStateException("Unknown cursor handle " + cursor);
    }
  }

  @Override
  public void treeCursorReset(long cursor, RawNode node) {
    CursorState state = cursor(cursor);
    TSNode n = node(node);
    if (n == null) {
      throw new IllegalArgumentException("Cannot reset a cursor to the null node");
    }
    state.cursor.reset(n);
    state.tree = node.tree();
    state.path.clear();
  }

  @Override
  public void treeCursorResetTo(long destination, long source) {
    CursorState target = cursor(destination);
    CursorState origin = cursor(source);
    target.cursor = origin.cursor.copy();
    target.tree = origin.tree;
    target.path = new ArrayDeque<>(origin.path);
  }

  @Override
  public long treeCursorCopy(long cursor) {
    CursorState origin = cursor(cursor);
    CursorState copy = new CursorState(origin.cursor.copy(), origin.tree);
    copy.path = new ArrayDeque<>(origin.path);
    long handle = handles.getAndIncrement();
    cursors.put(handle, copy);
    return handle;
  }

  @Override
  public RawNode treeCursorCurrentNode(long cursor) {
    CursorState state = cursor(cursor);
    return raw(state.tree, state.cursor.currentNode());
  }

  @Override
  public String treeCursorCurrentFieldName(long cursor) {
    CursorState state = cursor(cursor);
    if (state.path.isEmpty()) {
      return null;
    }
    return state.cursor.currentFieldName();
  }

  @Override
  public boolean treeCursorGotoParent(long cursor) {
    CursorState state = cursor(cursor);
    if (state.path.isEmpty() || !state.cursor.gotoParent()) {
      return false;
    }
    state.path.removeLast();
    return true;
  }

  @Override
  public boolean treeCursorGotoFirstChild(long cursor) {
    CursorState state = cursor(cursor);
    if (!state.cursor.gotoFirstChild()) {
      return false;
    }
    state.path.addLast(0);
    return true;
  }

  @Override
  public boolean treeCursorGotoLastChild(long cursor) {
    CursorState state = cursor(cursor);
    if (!state.cursor.gotoFirstChild()) {
      return false;
    }
    int index = 0;
    while (state.cursor.gotoNextSibling()) {
      index++;
    }
    state.path.addLast(index);
    return true;
  }

  @Override
  public boolean treeCursorGotoNextSibling(long cursor) {
    CursorState state = cursor(cursor);
    if (state.path.isEmpty() || !state.cursor.gotoNextSibling()) {
      return false;
    }
    state.path.addLast(state.path.removeLast() + 1);
    return true;
  }

  @Override
  public boolean treeCursorGotoPreviousSibling(long cursor) {
    CursorState state = cursor(cursor);
    if (state.path.isEmpty() || state.path.peekLast() == 0) {
      return false;
    }
    int target = state.path.removeLast() - 1;
    state.cursor.gotoParent();
    state.cursor.gotoFirstChild();
    for (int i = 0; i < target; i++) {
      state.cursor.gotoNextSibling();
    }
    state.path.addLast(target);
    return true;
  }

  @Override
  public int treeCursorCurrentDepth(long cursor) {
    return cursor(cursor).path.size();
  }

  // ==========================================================================
  // Language
  // ==========================================================================

  @Override
  public long languageForName(String name) {
    Long cached = languagesByName.get(name);
    if (cached != null) {
      return cached;
    }
    synchronized (languagesByName) {
      cached = languagesByName.get(name);
      if (cached != null) {
        return cached;
      }
      TSLanguage language = loadGrammar(name);
      if (language == null) {
        return 0L;
      }
      long handle = handles.getAndIncrement();
      languages.put(handle, language);
      languagesByName.put(name, handle);
      logger.debug(
          "Loaded grammar {} from {} (language version {})",
          name,
          language.getClass().getName(),
          language.version());
      return handle;
    }
  }

  private static TSLanguage loadGrammar(String name) {
    String className = name.indexOf('.') >= 0 ? name : grammarClassName(name);
    if (className == null) {
      return null;
    }
    try {
      Class<?> type = Class.forName(className, true, JniEngine.class.getClassLoader());
      if (!TSLanguage.class.isAssignableFrom(type)) {
        logger.debug("{} is not a tree-sitter language", className);
        return null;
      }
      return (TSLanguage) type.getConstructor().newInstance();
    } catch (ClassNotFoundException e) {
      logger.debug("No grammar class {} on the class path", className);
      return null;
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to load grammar " + className, e);
    }
  }

  static String grammarClassName(String name) {
    StringBuilder className = new StringBuilder(GRAMMAR_PACKAGE);
    for (String part : name.split("[-_]", -1)) {
      if (part.isEmpty() || !part.chars().allMatch(Character::isLetterOrDigit)) {
        return null;
      }
      className.append(part.substring(0, 1).toUpperCase(Locale.ROOT));
      className.append(part.substring(1).toLowerCase(Locale.ROOT));
    }
    return className.toString();
  }

  @Override
  public int languageSymbolCount(long language) {
    return language(language).symbolCount();
  }

  @Override
  public String languageSymbolName(long language, int symbol) {
    TSLanguage tsLanguage = language(language);
    if (symbol != ERROR_SYMBOL && (symbol < 0 || symbol >= tsLanguage.symbolCount())) {
      return null;
    }
    return tsLanguage.symbolName(symbol);
  }

  @Override
  public int languageSymbolForName(long language, String name, boolean isNamed) {
    return language(language).symbolForName(name, isNamed);
  }

  @Override
  public int languageSymbolType(long language, int symbol) {
    TSSymbolType type = language(language).symbolType(symbol);
    switch (type) {
      case TSSymbolTypeRegular:
        return 0;
      case TSSymbolTypeAnonymous:
        return 1;
      case TSSymbolTypeSupertype:
        return 2;
      case TSSymbolTypeAuxiliary:
        return 3;
      default:
        throw new IllegalStateException("Unknown symbol type " + type);
    }
  }

  @Override
  public int languageFieldCount(long language) {
    return language(language).fieldCount();
  }

  @Override
  public String languageFieldNameForId(long language, int fieldId) {
    TSLanguage tsLanguage = language(language);
    if (fieldId < 1 || fieldId > tsLanguage.fieldCount()) {
      return null;
    }
    return tsLanguage.fieldNameForId(fieldId);
  }

  @Override
  public int languageFieldIdForName(long language, String name) {
    return language(language).fieldIdForName(name);
  }

  @Override
  public int languageVersion(long language) {
    return language(language).version();
  }

  // ==========================================================================
  // Handle tables
  // ==========================================================================

  private TSLanguage language(long handle) {
    TSLanguage language = languages.get(handle);
    if (language == null) {
      throw new IllegalStateException("Unknown language handle " + handle);
    }
    return language;
  }

  private ParserState parser(long handle) {
    ParserState state = parsers.get(handle);
    if (state == null) {
      throw new IllegalStateException("Unknown parser handle " + handle);
    }
    return state;
  }

  private TreeState tree(long handle) {
    TreeState state = trees.get(handle);
    if (state == null) {
      throw new IllegalStateException("Unknown tree handle " + handle);
    }
    return state;
  }

  private CursorState cursor(long handle) {
    CursorState state = cursors.get(handle);
    if (state == null) {
      throw new IllegalStateException("Unknown cursor handle " + handle);
    }
    return state;
  }

  private TSNode node(RawNode node) {
    if (node.id() == 0L) {
      return null;
    }
    return tree(node.tree()).node(node.id());
  }

  private RawNode raw(long tree, TSNode node) {
    return raw(tree, tree(tree), node);
  }

  private static RawNode raw(long tree, TreeState state, TSNode node) {
    if (node == null || node.isNull()) {
      return RawNode.nullIn(tree);
    }
    return new RawNode(tree, state.intern(node), 0L);
  }
}
