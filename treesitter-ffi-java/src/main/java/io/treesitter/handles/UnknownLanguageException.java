package io.treesitter.handles;

/** Exception thrown when the engine has no grammar registered under the requested name. */
public class UnknownLanguageException extends TreeSitterException {
  private final String name;

  public UnknownLanguageException(String name) {
    super("No grammar named '" + name + "' is available from the parsing engine");
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
