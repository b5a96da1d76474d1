package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for {@code print(expression)}.
 *
 * @param expression The expression whose textual form is printed.
 * @param line The line of the {@code print} keyword.
 */
public record PrintNode(
        AstNode expression,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }
}
