package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for {@code for i in range(start, end): body}. The range is half-open.
 *
 * @param iterator The loop variable.
 * @param start The inclusive lower bound.
 * @param end The exclusive upper bound.
 * @param body The statement (or block) run for each value.
 * @param line The line of the {@code for} keyword.
 */
public record ForNode(
        VariableNode iterator,
        AstNode start,
        AstNode end,
        AstNode body,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
