package io.treesitter.handles;

import io.treesitter.handles.engine.TreeSitterEngine;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the parsing engine that backs every parser, tree and cursor in the process.
 *
 * <p>The loading strategy follows a three-tier approach:
 *
 * <ol>
 *   <li><b>treesitter.engine</b> - Check system property (development/test mode)
 *   <li><b>TREESITTER_ENGINE</b> - Check environment variable
 *   <li><b>ServiceLoader</b> - First {@link TreeSitterEngine} registered under META-INF/services
 * </ol>
 */
final class EngineLoader {
  private static final Logger logger = LoggerFactory.getLogger(EngineLoader.class);
  static final String ENGINE_PROPERTY = "treesitter.engine";
  static final String ENGINE_ENV = "TREESITTER_ENGINE";
  private static volatile TreeSitterEngine engine;

  private EngineLoader() {}

  /**
   * Get the engine instance, loading it on first use.
   *
   * @return The engine instance
   */
  static TreeSitterEngine get() {
    TreeSitterEngine result = engine;
    if (result == null) {
      synchronized (EngineLoader.class) {
        result = engine;
        if (result == null) {
          result = loadEngine();
          engine = result;
        }
      }
    }
    return result;
  }

  private static TreeSitterEngine loadEngine() {
    // Strategy 1: Try the system property (development/test mode)
    TreeSitterEngine result = tryLoadFromProperty();
    if (result != null) {
      return result;
    }

    // Strategy 2: Try the environment variable
    result = tryLoadFromEnvironment();
    if (result != null) {
      return result;
    }

    // Strategy 3: Try ServiceLoader registrations
    result = tryLoadFromServiceLoader();
    if (result != null) {
      return result;
    }

    throw new TreeSitterException(
        "Failed to load a tree-sitter engine. "
            + "Ensure an engine is either: "
            + "(1) named by the "
            + ENGINE_PROPERTY
            + " system property, "
            + "(2) named by the "
            + ENGINE_ENV
            + " environment variable, or "
            + "(3) registered in META-INF/services/"
            + TreeSitterEngine.class.getName()
            + ".");
  }

  private static TreeSitterEngine tryLoadFromProperty() {
    String className = System.getProperty(ENGINE_PROPERTY);
    if (className == null || className.isEmpty()) {
      logger.debug("{} not set, skipping", ENGINE_PROPERTY);
      return null;
    }
    TreeSitterEngine result = instantiate(className);
    logger.info("Loaded tree-sitter engine from system property: {}", className);
    return result;
  }

  private static TreeSitterEngine tryLoadFromEnvironment() {
    String className = System.getenv(ENGINE_ENV);
    if (className == null || className.isEmpty()) {
      logger.debug("{} not set, skipping", ENGINE_ENV);
      return null;
    }
    TreeSitterEngine result = instantiate(className);
    logger.info("Loaded tree-sitter engine from environment: {}", className);
    return result;
  }

  private static TreeSitterEngine tryLoadFromServiceLoader() {
    try {
      Iterator<TreeSitterEngine> providers =
          ServiceLoader.load(TreeSitterEngine.class, EngineLoader.class.getClassLoader())
              .iterator();
      if (providers.hasNext()) {
        TreeSitterEngine result = providers.next();
        logger.info("Loaded tree-sitter engine via ServiceLoader: {}", result.getClass().getName());
        return result;
      }
    } catch (ServiceConfigurationError e) {
      logger.debug("ServiceLoader lookup failed: {}", e.getMessage());
    }

    logger.debug("No engine registered with ServiceLoader");
    return null;
  }

  /**
   * Instantiates an engine from its class name.
   *
   * @param className the fully qualified name of a {@link TreeSitterEngine} implementation
   * @return the new engine
   * @throws TreeSitterException if the class cannot be found, is not an engine, or cannot be
   *     constructed
   */
  static TreeSitterEngine instantiate(String className) {
    try {
      Class<?> type = Class.forName(className, true, EngineLoader.class.getClassLoader());
      if (!TreeSitterEngine.class.isAssignableFrom(type)) {
        throw new TreeSitterException(
            className + " does not implement " + TreeSitterEngine.class.getName());
      }
      return (TreeSitterEngine) type.getConstructor().newInstance();
    } catch (TreeSitterException e) {
      throw e;
    } catch (ReflectiveOperationException | LinkageError e) {
      throw new TreeSitterException("Failed to instantiate tree-sitter engine " + className, e);
    }
  }
}
