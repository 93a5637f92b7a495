package io.treesitter.handles;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A parsing session bound to one {@link Language}.
 *
 * <p>Each parse reads the whole buffer from scratch and returns a newly owned {@link Tree}. Parsing
 * never fails because of the text itself: invalid input yields a tree whose {@link Tree#hasError()}
 * is true and which contains ERROR and MISSING nodes. One parser may produce many trees, and the
 * trees stay valid after the parser is closed.
 */
public final class Parser implements AutoCloseable {
  private final ParserFfi ffi;
  private final Language language;
  private volatile boolean closed = false;

  /**
   * Creates a parser for the given language.
   *
   * @param language the grammar to parse with
   * @throws IncompatibleLanguageException if the engine cannot load the grammar's ABI version
   */
  public Parser(Language language) {
    this.language = Objects.requireNonNull(language, "language");
    this.ffi = new ParserFfi();
    if (!ffi.setLanguage(language.address())) {
      ffi.close();
      throw new IncompatibleLanguageException(language);
    }
  }

  /**
   * Parses text encoded as UTF-8.
   *
   * @param source the source text
   * @return the new tree, which the caller must close
   */
  public Tree parseString(String source) {
    byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
    return parseBytes(bytes, bytes.length);
  }

  /**
   * Parses a whole byte buffer.
   *
   * @param buffer the source bytes
   * @return the new tree, which the caller must close
   */
  public Tree parseBytes(byte[] buffer) {
    return parseBytes(buffer, buffer.length);
  }

  /**
   * Parses the first {@code length} bytes of a buffer. The buffer is not assumed to be
   * null-terminated.
   *
   * @param buffer the source bytes
   * @param length the number of bytes to parse
   * @return the new tree, which the caller must close
   * @throws IndexOutOfBoundsException if {@code length} exceeds the buffer
   */
  public Tree parseBytes(byte[] buffer, int length) {
    checkNotClosed();
    Objects.checkFromIndexSize(0, length, buffer.length);
    return new Tree(ffi.parseString(buffer, length));
  }

  /** Returns the language this parser is bound to. */
  public Language getLanguage() {
    return language;
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("Parser has been closed");
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      ffi.close();
    }
  }
}
