package org.tinyscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node that represents a sequence of statements separated by ';'.
 * Used for the program root and for loop or branch bodies with more than one statement.
 *
 * @param statements The statements in execution order.
 * @param line The line of the first statement.
 */
public record BlockNode(
        List<AstNode> statements,
        int line
) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
