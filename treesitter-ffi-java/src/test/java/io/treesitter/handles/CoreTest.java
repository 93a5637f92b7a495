package io.treesitter.handles;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/** Core parsing scenarios for the tree-sitter handle layer. */
public class CoreTest {
  private static final Language ARITHMETIC = Language.load("arithmetic");

  @Test
  void testParseBinaryExpression() {
    try (Parser parser = new Parser(ARITHMETIC);
        Tree tree = parser.parseString("1+2")) {
      Node root = tree.getRootNode();
      assertFalse(root.isNull());
      assertFalse(tree.hasError());
      assertEquals("source_file", root.getType());
      assertEquals(1, root.getNumNamedChildren());

      Node sum = root.getNamedChild(0);
      assertEquals("binary_expression", sum.getType());

      Node left = sum.getChildByFieldName("left");
      Node right = sum.getChildByFieldName("right");
      assertEquals("number", left.getType());
      assertEquals("number", right.getType());
      assertEquals(Extent.of(0, 1), left.getByteRange());
      assertEquals(Extent.of(2, 3), right.getByteRange());
      assertEquals("+", sum.getChildByFieldName("operator").getType());
    }
  }

  @Test
  void testTruncatedInputHasError() {
    try (Parser parser = new Parser(ARITHMETIC);
        Tree tree = parser.parseString("1+")) {
      assertTrue(tree.hasError());
      assertTrue(containsMissingOrError(tree.getRootNode()));

      Node right = tree.getRootNode().getNamedChild(0).getChildByFieldName("right");
      assertTrue(right.isMissing());
      assertEquals("number", right.getType());
      assertEquals(Extent.of(2, 2), right.getByteRange());
    }
  }

  @Test
  void testEmptyInputYieldsRoot() {
    try (Parser parser = new Parser(ARITHMETIC);
        Tree tree = parser.parseString("")) {
      Node root = tree.getRootNode();
      assertFalse(root.isNull());
      assertFalse(tree.hasError());
      assertEquals(0, root.getNumChildren());
      assertEquals(Extent.of(0, 0), root.getByteRange());
      assertEquals(Extent.of(Point.ORIGIN, Point.ORIGIN), root.getPointRange());
    }
  }

  @Test
  void testUnknownSymbolReturnsSentinel() {
    assertEquals(Language.NO_SYMBOL, ARITHMETIC.getSymbolForName("nonexistent_rule_xyz", true));
  }

  @Test
  void testOperatorPrecedenceAndAssociativity() {
    try (Parser parser = new Parser(ARITHMETIC);
        Tree product = parser.parseString("1+2*3");
        Tree difference = parser.parseString("1-2-3")) {
      Node sum = product.getRootNode().getNamedChild(0);
      assertEquals("+", sum.getChildByFieldName("operator").getType());
      assertEquals("binary_expression", sum.getChildByFieldName("right").getType());

      Node outer = difference.getRootNode().getNamedChild(0);
      assertEquals("binary_expression", outer.getChildByFieldName("left").getType());
      assertEquals("number", outer.getChildByFieldName("right").getType());
    }
  }

  @Test
  void testSExpressions() {
    try (Parser parser = new Parser(ARITHMETIC)) {
      assertSExpr(
          parser, "1+2", "(source_file (binary_expression left: (number) right: (number)))");
      assertSExpr(
          parser, "1+", "(source_file (binary_expression left: (number) right: (MISSING number)))");
      assertSExpr(
          parser, "(1", "(source_file (parenthesized_expression (number) (MISSING \")\")))");
      assertSExpr(parser, "1 )", "(source_file (number) (ERROR))");
      assertSExpr(parser, "1 # one", "(source_file (number) (comment))");
    }
  }

  @Test
  void testUnrecognizedInputBecomesErrorNode() {
    try (Parser parser = new Parser(ARITHMETIC);
        Tree tree = parser.parseString("1+@")) {
      assertTrue(tree.hasError());
      Node right = tree.getRootNode().getNamedChild(0).getChildByFieldName("right");
      assertTrue(right.isError());
      assertEquals("ERROR", right.getType());
      assertEquals(Language.ERROR_SYMBOL, right.getSymbol());
      assertEquals(Extent.of(2, 3), right.getByteRange());
    }
  }

  @Test
  void testParserProducesManyTrees() {
    Parser parser = new Parser(ARITHMETIC);
    Tree first = parser.parseString("1");
    Tree second = parser.parseString("(2)");
    parser.close();

    // Trees stay usable after the parser that produced them is closed
    try (first;
        second) {
      assertEquals("number", first.getRootNode().getNamedChild(0).getType());
      assertEquals("parenthesized_expression", second.getRootNode().getNamedChild(0).getType());
      assertNotEquals(first.getRootNode(), second.getRootNode());
    }
  }

  @Test
  void testParseBytesHonorsLength() {
    byte[] buffer = "1+2)junk".getBytes(StandardCharsets.US_ASCII);
    try (Parser parser = new Parser(ARITHMETIC);
        Tree tree = parser.parseBytes(buffer, 3)) {
      assertFalse(tree.hasError());
      assertEquals(Extent.of(0, 3), tree.getRootNode().getByteRange());
    }
  }

  @Test
  void testParseBytesRejectsLengthBeyondBuffer() {
    try (Parser parser = new Parser(ARITHMETIC)) {
      assertThrows(IndexOutOfBoundsException.class, () -> parser.parseBytes(new byte[2], 3));
    }
  }

  @Test
  void testIncompatibleLanguageRejected() {
    Language legacy = Language.load("arithmetic-legacy");
    assertEquals(12, legacy.getVersion());

    IncompatibleLanguageException e =
        assertThrows(IncompatibleLanguageException.class, () -> new Parser(legacy));
    assertEquals(12, e.getVersion());
  }

  @Test
  void testUnknownLanguage() {
    UnknownLanguageException e =
        assertThrows(UnknownLanguageException.class, () -> Language.load("cobol"));
    assertEquals("cobol", e.getName());
  }

  @Test
  void testTreeAndNodeLanguage() {
    try (Parser parser = new Parser(ARITHMETIC);
        Tree tree = parser.parseString("1")) {
      assertEquals(ARITHMETIC, parser.getLanguage());
      assertEquals(ARITHMETIC, tree.getLanguage());
      assertEquals(ARITHMETIC, tree.getRootNode().getNamedChild(0).getLanguage());
    }
  }

  private static void assertSExpr(Parser parser, String source, String expected) {
    try (Tree tree = parser.parseString(source)) {
      assertEquals(expected, tree.getRootNode().getSExpr(), "S-expression of '" + source + "'");
    }
  }

  private static boolean containsMissingOrError(Node node) {
    if (node.isMissing() || node.isError()) {
      return true;
    }
    for (Node child : node.getChildren()) {
      if (containsMissingOrError(child)) {
        return true;
      }
    }
    return false;
  }
}
