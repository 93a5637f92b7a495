/**
 * Safe, handle-based access to syntax trees produced by a tree-sitter parsing engine.
 *
 * <p>Ownership is explicit. {@link io.treesitter.handles.Parser}, {@link
 * io.treesitter.handles.Tree} and {@link io.treesitter.handles.TreeCursor} own engine memory and
 * are {@link java.lang.AutoCloseable}. {@link io.treesitter.handles.Node} and {@link
 * io.treesitter.handles.Language} are borrowed references with nothing to release.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Language language = Language.load("arithmetic");
 * try (Parser parser = new Parser(language);
 *      Tree tree = parser.parseString("1 + 2")) {
 *     Node sum = tree.getRootNode().getNamedChild(0);
 *     Node left = sum.getChildByFieldName("left");
 *     System.out.println(left.getType() + " at " + left.getByteRange());
 *     System.out.println(tree.getRootNode().getSExpr());
 * }
 * }</pre>
 *
 * <p>The engine itself is supplied through {@link io.treesitter.handles.engine.TreeSitterEngine}.
 */
package io.treesitter.handles;
