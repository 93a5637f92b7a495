package io.treesitter.handles;

/**
 * Internal FFI helper for Language.
 *
 * <p>Wraps a static grammar descriptor handle. Language handles are never released, so this class
 * has no lifecycle of its own.
 */
final class LanguageFfi {
  private final long language;

  LanguageFfi(long language) {
    this.language = language;
  }

  static long forName(String name) {
    return NativeUtil.call("Load language '" + name + "'", engine -> engine.languageForName(name));
  }

  long address() {
    return language;
  }

  int symbolCount() {
    return NativeUtil.callForInt(
        "Get symbol count", engine -> engine.languageSymbolCount(language));
  }

  String symbolName(int symbol) {
    return NativeUtil.call(
        "Get symbol name", engine -> engine.languageSymbolName(language, symbol));
  }

  int symbolForName(String name, boolean isNamed) {
    return NativeUtil.callForInt(
        "Get symbol for name", engine -> engine.languageSymbolForName(language, name, isNamed));
  }

  int symbolType(int symbol) {
    return NativeUtil.callForInt(
        "Get symbol type", engine -> engine.languageSymbolType(language, symbol));
  }

  int fieldCount() {
    return NativeUtil.callForInt("Get field count", engine -> engine.languageFieldCount(language));
  }

  String fieldNameForId(int fieldId) {
    return NativeUtil.call(
        "Get field name", engine -> engine.languageFieldNameForId(language, fieldId));
  }

  int fieldIdForName(String name) {
    return NativeUtil.callForInt(
        "Get field id", engine -> engine.languageFieldIdForName(language, name));
  }

  int version() {
    return NativeUtil.callForInt(
        "Get language version", engine -> engine.languageVersion(language));
  }
}
