package io.treesitter.handles.engine.jni;

import static org.junit.jupiter.api.Assertions.*;

import io.treesitter.handles.Extent;
import io.treesitter.handles.Language;
import io.treesitter.handles.Node;
import io.treesitter.handles.Parser;
import io.treesitter.handles.Tree;
import io.treesitter.handles.TreeCursor;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Parses JavaScript with the native runtime through the public handle types. */
public class JavascriptGrammarTest {
  private static final Language JAVASCRIPT = Language.load("javascript");

  private Parser parser;

  @BeforeEach
  void setUp() {
    parser = new Parser(JAVASCRIPT);
  }

  @AfterEach
  void tearDown() {
    parser.close();
  }

  @Test
  void testBinaryExpressionFields() {
    try (Tree tree = parser.parseString("1+2")) {
      Node root = tree.getRootNode();
      assertFalse(root.hasError());
      assertEquals("program", root.getType());
      assertEquals(1, root.getNumNamedChildren());

      Node statement = root.getNamedChild(0);
      assertEquals("expression_statement", statement.getType());
      Node sum = statement.getNamedChild(0);
      assertEquals("binary_expression", sum.getType());

      Node left = sum.getChildByFieldName("left");
      Node right = sum.getChildByFieldName("right");
      assertEquals("number", left.getType());
      assertEquals("number", right.getType());
      assertEquals(Extent.of(0, 1), left.getByteRange());
      assertEquals(Extent.of(2, 3), right.getByteRange());
      assertEquals("1", left.getSourceRange("1+2"));
      assertEquals("2", right.getSourceRange("1+2"));
      assertEquals("left", sum.getFieldNameForChild(0));
      assertEquals("+", sum.getChild(1).getType());
      assertFalse(sum.getChild(1).isNamed());

      assertTrue(
          sum.getSExpr().contains("(binary_expression left: (number) right: (number))"),
          sum.getSExpr());
    }
  }

  @Test
  void testTruncatedInputHasErrorNodes() {
    try (Tree tree = parser.parseString("1+")) {
      Node root = tree.getRootNode();
      assertTrue(root.hasError());
      assertTrue(tree.hasError());
      assertTrue(
          allNodes(root).stream().anyMatch(n -> n.isMissing() || n.isError()),
          root.getSExpr());
    }
  }

  @Test
  void testEmptyInputHasRoot() {
    try (Tree tree = parser.parseString("")) {
      Node root = tree.getRootNode();
      assertFalse(root.isNull());
      assertEquals("program", root.getType());
      assertEquals(0, root.getNumChildren());
      assertFalse(root.getChildren().iterator().hasNext());
    }
  }

  @Test
  void testUnknownSymbolIsNotFound() {
    assertEquals(Language.NO_SYMBOL, JAVASCRIPT.getSymbolForName("nonexistent_rule_xyz", true));
    assertEquals(0, JAVASCRIPT.getFieldIdForName("nonexistent_field_xyz"));

    int symbol = JAVASCRIPT.getSymbolForName("binary_expression", true);
    assertNotEquals(Language.NO_SYMBOL, symbol);
    assertEquals("binary_expression", JAVASCRIPT.getSymbolName(symbol));
    int field = JAVASCRIPT.getFieldIdForName("left");
    assertEquals("left", JAVASCRIPT.getFieldName(field).orElseThrow());
    assertTrue(JAVASCRIPT.getVersion() > 0);
  }

  @Test
  void testNodeSymbolsResolveAgainstLanguage() {
    try (Tree tree = parser.parseString("let x = a * (b - 1);")) {
      assertEquals(JAVASCRIPT, tree.getLanguage());
      for (Node node : allNodes(tree.getRootNode())) {
        assertEquals(node.getType(), JAVASCRIPT.getSymbolName(node.getSymbol()), node.toString());
        assertEquals(JAVASCRIPT, node.getLanguage());
      }
    }
  }

  @Test
  void testChildIterationMatchesIndexedAccess() {
    String source = "function f(a, b) {\n  return a + b; // sum\n}\n";
    try (Tree tree = parser.parseString(source)) {
      for (Node node : allNodes(tree.getRootNode())) {
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildren()) {
          children.add(child);
        }
        assertEquals(node.getNumChildren(), children.size());
        for (int i = 0; i < children.size(); i++) {
          assertEquals(node.getChild(i), children.get(i));
        }

        List<Node> named = new ArrayList<>();
        for (Node child : node.getNamedChildren()) {
          named.add(child);
        }
        assertEquals(node.getNumNamedChildren(), named.size());
        for (int i = 0; i < named.size(); i++) {
          assertEquals(node.getNamedChild(i), named.get(i));
          assertTrue(children.contains(named.get(i)));
        }
      }
    }
  }

  @Test
  void testSourceRangeRoundTrip() {
    String source = "const s = \"héllo\";\nconsole.log(s);\n";
    try (Tree tree = parser.parseString(source)) {
      assertFalse(tree.hasError());
      byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
      for (Node node : allNodes(tree.getRootNode())) {
        Extent<Integer> range = node.getByteRange();
        byte[] expected = Arrays.copyOfRange(bytes, range.start(), range.end());
        assertArrayEquals(expected, node.getSourceRange(bytes));
      }
      Node log = tree.getRootNode().getNamedChild(1);
      assertEquals("console.log(s);", log.getSourceRange(source));
      assertEquals(1, log.getPointRange().start().row());
      assertEquals(0, log.getPointRange().start().column());
    }
  }

  @Test
  void testCursorMoves() {
    try (Tree tree = parser.parseString("f(1, 2, 3)");
        TreeCursor cursor = tree.getRootNode().getCursor()) {
      Node root = cursor.getCurrentNode();
      assertFalse(cursor.gotoNextSibling());
      assertFalse(cursor.gotoParent());
      assertEquals(root, cursor.getCurrentNode());

      assertTrue(cursor.gotoFirstChild());
      assertTrue(cursor.gotoParent());
      assertEquals(root.getID(), cursor.getCurrentNode().getID());

      // program > expression_statement > call_expression > arguments
      assertTrue(cursor.gotoFirstChild());
      assertTrue(cursor.gotoFirstChild());
      assertEquals("call_expression", cursor.getCurrentNode().getType());
      assertTrue(cursor.gotoLastChild());
      Node arguments = cursor.getCurrentNode();
      assertEquals("arguments", arguments.getType());
      assertEquals("arguments", cursor.getCurrentFieldName().orElseThrow());
      assertEquals(3, cursor.getDepthFromOrigin());

      assertTrue(cursor.gotoLastChild());
      assertEquals(")", cursor.getCurrentNode().getType());
      Node last = cursor.getCurrentNode();
      assertFalse(cursor.gotoNextSibling());
      assertEquals(last, cursor.getCurrentNode());

      assertTrue(cursor.gotoPreviousSibling());
      assertEquals("number", cursor.getCurrentNode().getType());
      assertEquals("3", cursor.getCurrentNode().getSourceRange("f(1, 2, 3)"));
      assertEquals(arguments.getChild(arguments.getNumChildren() - 2), cursor.getCurrentNode());

      try (TreeCursor copy = cursor.copy()) {
        assertTrue(copy.gotoParent());
        assertEquals(arguments, copy.getCurrentNode());
        assertEquals("number", cursor.getCurrentNode().getType());
      }

      while (cursor.gotoPreviousSibling()) {
        // back to the opening parenthesis
      }
      assertEquals("(", cursor.getCurrentNode().getType());
      assertEquals(arguments.getChild(0), cursor.getCurrentNode());
      assertTrue(cursor.gotoParent());
      assertEquals(arguments, cursor.getCurrentNode());
      assertEquals(3, cursor.getDepthFromOrigin());
    }
  }

  @Test
  void testCursorResetToOtherCursor() {
    try (Tree tree = parser.parseString("a; b; c;");
        TreeCursor walker = tree.getRootNode().getCursor();
        TreeCursor follower = tree.getRootNode().getCursor()) {
      assertTrue(walker.gotoFirstChild());
      assertTrue(walker.gotoNextSibling());
      follower.reset(walker);
      assertEquals(walker.getCurrentNode(), follower.getCurrentNode());
      assertEquals(1, follower.getDepthFromOrigin());
      assertTrue(follower.gotoPreviousSibling());
      assertEquals(tree.getRootNode().getChild(0), follower.getCurrentNode());
      assertTrue(follower.gotoParent());
      assertEquals(tree.getRootNode(), follower.getCurrentNode());
    }
  }

  @Test
  void testNodesReachedByDifferentRoutesAreEqual() {
    try (Tree tree = parser.parseString("x = y + z;");
        TreeCursor cursor = tree.getRootNode().getCursor()) {
      Node statement = tree.getRootNode().getChild(0);
      assertTrue(cursor.gotoFirstChild());
      assertEquals(statement, cursor.getCurrentNode());
      assertEquals(statement.hashCode(), cursor.getCurrentNode().hashCode());
      Node assignment = statement.getChild(0);
      assertEquals(assignment, assignment.getChildByFieldName("left").getParent());
      assertEquals(
          assignment.getChildByFieldName("left"),
          assignment.getChildByFieldName("right").getPreviousSibling().getPreviousSibling());
      assertNotEquals(statement, assignment);
    }
  }

  @Test
  void testNodesOfSeparateParsesDiffer() {
    try (Tree first = parser.parseString("1+2");
        Tree second = parser.parseString("1+2")) {
      assertEquals(first.getRootNode().getSExpr(), second.getRootNode().getSExpr());
      assertNotEquals(first.getRootNode(), second.getRootNode());
    }
  }

  @Test
  void testClosedTreeRejectsNodes() {
    Tree tree = parser.parseString("1+2");
    Node root = tree.getRootNode();
    tree.close();
    assertThrows(IllegalStateException.class, root::getType);
    assertThrows(IllegalStateException.class, root::getChildren);
  }

  static List<Node> allNodes(Node root) {
    List<Node> nodes = new ArrayList<>();
    collect(root, nodes);
    return nodes;
  }

  private static void collect(Node node, List<Node> nodes) {
    nodes.add(node);
    for (int i = 0; i < node.getNumChildren(); i++) {
      collect(node.getChild(i), nodes);
    }
  }
}
