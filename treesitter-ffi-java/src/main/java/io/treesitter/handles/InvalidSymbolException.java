package io.treesitter.handles;

/** Exception thrown when a symbol id is not defined by a grammar. */
public class InvalidSymbolException extends TreeSitterException {
  private final int symbol;

  public InvalidSymbolException(int symbol, int symbolCount) {
    super("Invalid symbol " + symbol + ": grammar defines " + symbolCount + " symbols");
    this.symbol = symbol;
  }

  public int getSymbol() {
    return symbol;
  }
}
