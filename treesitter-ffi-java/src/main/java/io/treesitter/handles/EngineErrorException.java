package io.treesitter.handles;

/**
 * Exception thrown when a call into the parsing engine fails.
 *
 * <p>Raised when the engine throws, or returns a NULL handle where the operation requires one.
 */
public class EngineErrorException extends TreeSitterException {
  private final String operation;
  private final String engineMessage;

  /**
   * Creates a new EngineErrorException.
   *
   * @param operation The operation that failed (e.g., "Create parser", "Parse string")
   * @param engineMessage The error message reported by the engine, or null if unavailable
   */
  public EngineErrorException(String operation, String engineMessage) {
    super(formatMessage(operation, engineMessage));
    this.operation = operation;
    this.engineMessage = engineMessage;
  }

  /**
   * Creates a new EngineErrorException caused by an exception thrown inside the engine.
   *
   * @param operation The operation that failed
   * @param cause The exception thrown by the engine
   */
  public EngineErrorException(String operation, Throwable cause) {
    super(formatMessage(operation, cause.getMessage()), cause);
    this.operation = operation;
    this.engineMessage = cause.getMessage();
  }

  /**
   * Gets the operation that failed.
   *
   * @return The operation name
   */
  public String getOperation() {
    return operation;
  }

  /**
   * Gets the raw error message from the engine.
   *
   * @return The engine message, or null if no message was available
   */
  public String getEngineMessage() {
    return engineMessage;
  }

  private static String formatMessage(String operation, String engineMessage) {
    if (engineMessage != null && !engineMessage.isEmpty()) {
      return operation + " failed: " + engineMessage;
    }
    return operation + " failed: unknown error";
  }
}
