package io.treesitter.handles;

/** Exception thrown when the engine refuses a grammar compiled for an unsupported ABI version. */
public class IncompatibleLanguageException extends TreeSitterException {
  private final int version;

  public IncompatibleLanguageException(Language language) {
    super("Incompatible language version " + language.getVersion() + " for " + language);
    this.version = language.getVersion();
  }

  /** Returns the ABI version the rejected grammar was generated for. */
  public int getVersion() {
    return version;
  }
}
