package io.treesitter.handles;

/** The kind of a grammar symbol. */
public enum SymbolType {
  /** A named grammar rule that appears in trees. */
  REGULAR,
  /** A literal token such as punctuation or a keyword. */
  ANONYMOUS,
  /** A hidden rule that groups other rules and never appears in trees itself. */
  SUPERTYPE,
  /** A hidden helper rule generated by the grammar compiler. */
  AUXILIARY;

  static SymbolType fromCode(int code) {
    switch (code) {
      case 0:
        return REGULAR;
      case 1:
        return ANONYMOUS;
      case 2:
        return SUPERTYPE;
      case 3:
        return AUXILIARY;
      default:
        throw new TreeSitterException("Unknown symbol type code: " + code);
    }
  }
}
