package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for {@code name = value}.
 *
 * @param target The variable being bound.
 * @param value The expression or list literal whose value is bound.
 * @param line The source line.
 */
public record AssignmentNode(
        VariableNode target,
        AstNode value,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
