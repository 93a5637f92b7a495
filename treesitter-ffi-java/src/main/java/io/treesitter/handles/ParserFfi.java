package io.treesitter.handles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal FFI helper for Parser.
 *
 * <p>Owns the engine-side parser state and deletes it on close. Trees produced by the parser are
 * owned separately.
 */
final class ParserFfi implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ParserFfi.class);

  private final long parser;
  private boolean closed = false;

  ParserFfi() {
    this.parser = NativeUtil.callForPointer("Create parser", engine -> engine.parserNew());
    logger.debug("Created parser: {}", parser);
  }

  boolean setLanguage(long language) {
    return NativeUtil.callForBoolean(
        "Set parser language", engine -> engine.parserSetLanguage(parser, language));
  }

  long parseString(byte[] input, int length) {
    return NativeUtil.callForPointer(
        "Parse string", engine -> engine.parserParseString(parser, 0L, input, length));
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      try {
        NativeUtil.run("Delete parser", engine -> engine.parserDelete(parser));
        logger.debug("Closed parser: {}", parser);
      } catch (Throwable e) {
        logger.error("Error closing parser", e);
      }
    }
  }
}
