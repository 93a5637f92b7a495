/**
 * The engine boundary: the raw, ownership-agnostic interface a parsing engine implements.
 *
 * <p>Nothing in this package manages lifetimes. The public types of {@code io.treesitter.handles}
 * are the safe layer on top of it.
 */
package io.treesitter.handles.engine;
