package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for {@code while condition: body}.
 *
 * @param condition The comparison checked before every iteration.
 * @param body The statement (or block) to repeat.
 * @param line The line of the {@code while} keyword.
 */
public record WhileNode(
        AstNode condition,
        AstNode body,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
