package org.stencilir.compiler.ast;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a stencil AST.
 * Instead of implementing a full {@link AstVisitor}, callers register handlers for the node
 * classes they care about; the walker descends into every child in declaration order.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Creates a walker with a single handler.
     * @param type The node class to handle.
     * @param handler The handler, invoked pre-order for every node of that class.
     * @param <T> The node type.
     * @return The walker.
     */
    public static <T extends AstNode> TreeWalker forType(Class<T> type, Consumer<? super T> handler) {
        return new TreeWalker(Map.of(type, node -> handler.accept(type.cast(node))));
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }
}
