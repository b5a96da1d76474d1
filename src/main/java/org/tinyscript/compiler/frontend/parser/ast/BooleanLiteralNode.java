package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for {@code True} or {@code False}.
 *
 * @param value The literal value.
 * @param line The source line.
 */
public record BooleanLiteralNode(
        boolean value,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }
}
