/**
 * A {@link io.treesitter.handles.engine.TreeSitterEngine} over the native tree-sitter runtime,
 * registered with {@link java.util.ServiceLoader} so that it is picked up whenever no other engine
 * is configured.
 */
package io.treesitter.handles.engine.jni;
