package org.tinyscript.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes are immutable records. Consumers traverse the tree through an {@link AstVisitor},
 * which must provide a method for every node kind.
 */
public interface AstNode {

    /**
     * @return The source line on which this node starts.
     */
    int line();

    /**
     * Dispatches to the visit method of the given visitor that matches this node kind.
     *
     * @param visitor The visitor to call.
     * @param <R> The result type of the visitor.
     * @return Whatever the visitor returns for this node.
     */
    <R> R accept(AstVisitor<R> visitor);
}
