package io.treesitter.handles;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

public class LanguageTest {
  private static final Language ARITHMETIC = Language.load("arithmetic");

  @Test
  void testSymbolNamesRoundTrip() {
    assertTrue(ARITHMETIC.getNumSymbols() > 0);
    for (int symbol = 0; symbol < ARITHMETIC.getNumSymbols(); symbol++) {
      String name = ARITHMETIC.getSymbolName(symbol);
      boolean named = ARITHMETIC.getSymbolType(symbol) != SymbolType.ANONYMOUS;
      int found = ARITHMETIC.getSymbolForName(name, named);
      if (symbol != Language.NO_SYMBOL) {
        assertEquals(symbol, found, "lookup of " + name);
      }
    }
  }

  @Test
  void testNamedAndAnonymousLookupsDiffer() {
    int number = ARITHMETIC.getSymbolForName("number", true);
    assertNotEquals(Language.NO_SYMBOL, number);
    assertEquals(Language.NO_SYMBOL, ARITHMETIC.getSymbolForName("number", false));

    int plus = ARITHMETIC.getSymbolForName("+", false);
    assertNotEquals(Language.NO_SYMBOL, plus);
    assertEquals(Language.NO_SYMBOL, ARITHMETIC.getSymbolForName("+", true));
  }

  @Test
  void testUnknownSymbolName() {
    assertEquals(Language.NO_SYMBOL, ARITHMETIC.getSymbolForName("no_such_symbol", true));
  }

  @Test
  void testInvalidSymbolRejected() {
    int invalid = ARITHMETIC.getNumSymbols();
    InvalidSymbolException e =
        assertThrows(InvalidSymbolException.class, () -> ARITHMETIC.getSymbolName(invalid));
    assertEquals(invalid, e.getSymbol());
    assertThrows(InvalidSymbolException.class, () -> ARITHMETIC.getSymbolType(-1));
    assertThrows(InvalidSymbolException.class, () -> ARITHMETIC.getSymbolType(invalid));
  }

  @Test
  void testErrorSymbol() {
    assertEquals("ERROR", ARITHMETIC.getSymbolName(Language.ERROR_SYMBOL));
    assertEquals(Language.ERROR_SYMBOL, ARITHMETIC.getSymbolForName("ERROR", true));
    assertEquals(SymbolType.REGULAR, ARITHMETIC.getSymbolType(Language.ERROR_SYMBOL));
  }

  @Test
  void testSymbolTypes() {
    assertEquals(SymbolType.REGULAR, typeOf("binary_expression", true));
    assertEquals(SymbolType.ANONYMOUS, typeOf("*", false));
    assertEquals(SymbolType.SUPERTYPE, typeOf("expression", true));
  }

  @Test
  void testFields() {
    assertEquals(3, ARITHMETIC.getNumFields());
    for (int fieldId = 1; fieldId <= ARITHMETIC.getNumFields(); fieldId++) {
      String name = ARITHMETIC.getFieldName(fieldId).orElseThrow();
      assertEquals(fieldId, ARITHMETIC.getFieldIdForName(name));
    }
    assertEquals(Optional.empty(), ARITHMETIC.getFieldName(0));
    assertEquals(Optional.empty(), ARITHMETIC.getFieldName(ARITHMETIC.getNumFields() + 1));
    assertEquals(Language.NO_FIELD, ARITHMETIC.getFieldIdForName("condition"));
  }

  @Test
  void testVersion() {
    assertEquals(14, ARITHMETIC.getVersion());
    assertEquals(12, Language.load("arithmetic-legacy").getVersion());
  }

  @Test
  void testLanguagesAreSharedReferences() {
    Language again = Language.load("arithmetic");
    assertEquals(ARITHMETIC, again);
    assertEquals(ARITHMETIC.hashCode(), again.hashCode());
    assertNotEquals(ARITHMETIC, Language.load("arithmetic-legacy"));

    // A language outlives every parser and tree that used it
    try (Parser parser = new Parser(again)) {
      parser.parseString("1").close();
    }
    assertEquals("number", again.getSymbolName(again.getSymbolForName("number", true)));
  }

  @Test
  void testUnknownLanguage() {
    UnknownLanguageException e =
        assertThrows(UnknownLanguageException.class, () -> Language.load("klingon"));
    assertEquals("klingon", e.getName());
  }

  private static SymbolType typeOf(String name, boolean named) {
    return ARITHMETIC.getSymbolType(ARITHMETIC.getSymbolForName(name, named));
  }
}
