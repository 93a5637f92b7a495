package io.treesitter.handles;

/**
 * Base exception class for tree-sitter binding errors.
 *
 * <p>This is the parent class for all exceptions thrown by the handle layer. Absent relatives,
 * syntax errors in parsed text and symbol lookup misses are not reported through exceptions.
 */
public class TreeSitterException extends RuntimeException {
  public TreeSitterException(String message) {
    super(message);
  }

  public TreeSitterException(String message, Throwable cause) {
    super(message, cause);
  }
}
