package io.treesitter.handles;

import java.util.Optional;

/**
 * A grammar that the parsing engine can parse with.
 *
 * <p>Grammar descriptors are static, immutable resources owned by the engine for the lifetime of
 * the process. A Language is only a reference to one: it has nothing to release and may be shared
 * freely between parsers and threads. Every query is answered by the engine.
 *
 * <p>Example:
 *
 * <pre>{@code
 * Language json = Language.load("json");
 * int pair = json.getSymbolForName("pair", true);
 * if (pair != Language.NO_SYMBOL) {
 *     System.out.println(json.getSymbolName(pair));
 * }
 * }</pre>
 */
public final class Language {

  /** Returned by {@link #getSymbolForName} when the grammar has no such symbol. */
  public static final int NO_SYMBOL = 0;

  /** Returned by {@link #getFieldIdForName} when the grammar has no such field. */
  public static final int NO_FIELD = 0;

  /** The built-in symbol of ERROR nodes, defined by every grammar. */
  public static final int ERROR_SYMBOL = 0xFFFF;

  private final LanguageFfi ffi;

  Language(long address) {
    this.ffi = new LanguageFfi(address);
  }

  /**
   * Resolves a grammar by name from the loaded engine.
   *
   * @param name the grammar name, e.g. {@code "json"}
   * @return the language
   * @throws UnknownLanguageException if the engine has no grammar with that name
   */
  public static Language load(String name) {
    long address = LanguageFfi.forName(name);
    if (address == 0L) {
      throw new UnknownLanguageException(name);
    }
    return new Language(address);
  }

  /** Returns the number of distinct symbol ids, named and anonymous, defined by the grammar. */
  public int getNumSymbols() {
    return ffi.symbolCount();
  }

  /**
   * Returns the grammar-defined name of a symbol.
   *
   * @param symbol the symbol id
   * @return the symbol name
   * @throws InvalidSymbolException if the grammar does not define the symbol
   */
  public String getSymbolName(int symbol) {
    String name = ffi.symbolName(symbol);
    if (name == null) {
      throw new InvalidSymbolException(symbol, getNumSymbols());
    }
    return name;
  }

  /**
   * Looks up a symbol id by name.
   *
   * @param name the symbol name
   * @param isNamed true to look up a named rule, false for an anonymous token such as {@code "+"}
   * @return the symbol id, or {@link #NO_SYMBOL} if there is no such symbol
   */
  public int getSymbolForName(String name, boolean isNamed) {
    return ffi.symbolForName(name, isNamed);
  }

  /**
   * Returns the kind of a symbol.
   *
   * @param symbol the symbol id
   * @return the symbol kind
   * @throws InvalidSymbolException if the grammar does not define the symbol
   */
  public SymbolType getSymbolType(int symbol) {
    if (symbol != ERROR_SYMBOL && (symbol < 0 || symbol >= getNumSymbols())) {
      throw new InvalidSymbolException(symbol, getNumSymbols());
    }
    return SymbolType.fromCode(ffi.symbolType(symbol));
  }

  /** Returns the number of field names declared by the grammar. Field ids start at 1. */
  public int getNumFields() {
    return ffi.fieldCount();
  }

  /**
   * Returns the name of a field.
   *
   * @param fieldId the field id
   * @return the field name, or empty if the grammar does not declare that id
   */
  public Optional<String> getFieldName(int fieldId) {
    return Optional.ofNullable(ffi.fieldNameForId(fieldId));
  }

  /**
   * Looks up a field id by name.
   *
   * @param name the field name
   * @return the field id, or {@link #NO_FIELD} if there is no such field
   */
  public int getFieldIdForName(String name) {
    return ffi.fieldIdForName(name);
  }

  /** Returns the ABI version the grammar was generated for. */
  public int getVersion() {
    return ffi.version();
  }

  long address() {
    return ffi.address();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Language)) {
      return false;
    }
    return address() == ((Language) o).address();
  }

  @Override
  public int hashCode() {
    return Long.hashCode(address());
  }

  @Override
  public String toString() {
    return "Language[0x" + Long.toHexString(address()) + "]";
  }
}
