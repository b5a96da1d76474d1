package org.tinyscript.compiler.frontend.parser.ast;

import java.math.BigInteger;

/**
 * An AST node that represents a numeric literal.
 *
 * @param value The value, a {@link BigInteger} for integer literals or a {@link Double} for literals with a decimal point.
 * @param line The source line.
 */
public record NumberLiteralNode(
        Number value,
        int line
) implements AstNode {

    public NumberLiteralNode {
        if (!(value instanceof BigInteger) && !(value instanceof Double)) {
            throw new IllegalArgumentException("Number literal must be a BigInteger or a Double, got " + value);
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
