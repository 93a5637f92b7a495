package io.treesitter.handles;

import io.treesitter.handles.engine.TreeSitterEngine;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.function.ToLongFunction;

/**
 * Utility class for calling the parsing engine with uniform error handling.
 *
 * <p>Every engine call made by the {@code *Ffi} classes goes through one of these methods, which
 * supply the loaded engine and translate failures:
 *
 * <pre>{@code
 * // For value-returning operations:
 * String type = NativeUtil.call("Get node type", engine -> engine.nodeType(raw));
 *
 * // For handle-returning operations (0 = failure):
 * long tree = NativeUtil.callForPointer("Parse string", engine ->
 *     engine.parserParseString(parser, 0L, bytes, length));
 * }</pre>
 *
 * <p>A {@link TreeSitterException} thrown inside the call is rethrown untouched; any other runtime
 * failure is wrapped in an {@link EngineErrorException} naming the operation.
 */
final class NativeUtil {

  private NativeUtil() {}

  /**
   * Calls an engine function that returns a value.
   *
   * @param operation a description of the operation for error messages
   * @param call the engine function to invoke
   * @return the value returned by the engine
   * @throws EngineErrorException if the engine fails
   */
  static <T> T call(String operation, Function<TreeSitterEngine, T> call) {
    TreeSitterEngine engine = EngineLoader.get();
    try {
      return call.apply(engine);
    } catch (TreeSitterException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EngineErrorException(operation, e);
    }
  }

  /**
   * Calls an engine function that returns nothing.
   *
   * @param operation a description of the operation for error messages
   * @param call the engine function to invoke
   * @throws EngineErrorException if the engine fails
   */
  static void run(String operation, Consumer<TreeSitterEngine> call) {
    TreeSitterEngine engine = EngineLoader.get();
    try {
      call.accept(engine);
    } catch (TreeSitterException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EngineErrorException(operation, e);
    }
  }

  /**
   * Calls an engine function that returns an int.
   *
   * @param operation a description of the operation for error messages
   * @param call the engine function to invoke
   * @return the int returned by the engine
   * @throws EngineErrorException if the engine fails
   */
  static int callForInt(String operation, ToIntFunction<TreeSitterEngine> call) {
    TreeSitterEngine engine = EngineLoader.get();
    try {
      return call.applyAsInt(engine);
    } catch (TreeSitterException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EngineErrorException(operation, e);
    }
  }

  /**
   * Calls an engine predicate or movement function.
   *
   * @param operation a description of the operation for error messages
   * @param call the engine function to invoke
   * @return the flag returned by the engine
   * @throws EngineErrorException if the engine fails
   */
  static boolean callForBoolean(String operation, Predicate<TreeSitterEngine> call) {
    TreeSitterEngine engine = EngineLoader.get();
    try {
      return call.test(engine);
    } catch (TreeSitterException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EngineErrorException(operation, e);
    }
  }

  /**
   * Calls an engine function that returns a handle (non-zero = success).
   *
   * @param operation a description of the operation for error messages
   * @param call the engine function to invoke
   * @return the non-zero handle returned by the engine
   * @throws EngineErrorException if the engine fails or returns a NULL handle
   */
  static long callForPointer(String operation, ToLongFunction<TreeSitterEngine> call) {
    TreeSitterEngine engine = EngineLoader.get();
    long pointer;
    try {
      pointer = call.applyAsLong(engine);
    } catch (TreeSitterException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EngineErrorException(operation, e);
    }
    checkPointer(pointer, operation);
    return pointer;
  }

  /**
   * Checks a handle and throws an exception if it is NULL.
   *
   * @param pointer The handle returned from the engine
   * @param operation A description of the operation for error messages
   * @throws EngineErrorException if pointer is 0
   */
  static void checkPointer(long pointer, String operation) {
    if (pointer == 0L) {
      throw new EngineErrorException(operation, "engine returned a NULL handle");
    }
  }
}
