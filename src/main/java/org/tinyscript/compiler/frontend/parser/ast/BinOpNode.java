package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for a binary arithmetic operation or a comparison.
 *
 * @param left The left operand.
 * @param operator The operator symbol as written in the source, e.g. {@code "+"} or {@code "<="}.
 * @param right The right operand.
 * @param line The line of the operator.
 */
public record BinOpNode(
        AstNode left,
        String operator,
        AstNode right,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinOp(this);
    }
}
