package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for a string literal.
 *
 * @param value The content between the quotes.
 * @param line The source line.
 */
public record StringLiteralNode(
        String value,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
