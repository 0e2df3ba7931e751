package org.stencilir.compiler.ast;

import org.stencilir.compiler.api.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of the stencil AST.
 * <p>
 * The node set is closed: every node is either a {@link Stmt} or an {@link Expr}. Each node owns
 * its children exclusively, so a tree is acyclic and has a single root. {@code equals} and
 * {@code hashCode} of every node ignore its {@link SourceLocation}; use
 * {@link AstComparison#equalsWithLocations(AstNode, AstNode)} to compare locations as well.
 */
public sealed interface AstNode permits Stmt, Expr {

    /**
     * @return The source location of this node, {@link SourceLocation#UNKNOWN} if synthetic.
     */
    SourceLocation loc();

    /**
     * Returns a list of the direct child nodes in declaration order.
     * This allows a generic {@link TreeWalker} to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Dispatches to the visitor method of this node's variant.
     *
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(AstVisitor<R> visitor);
}
