package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node for an {@code if} statement with an optional {@code else} branch.
 *
 * @param condition The comparison deciding the branch.
 * @param thenBody The statement (or block) run when the condition is truthy.
 * @param elseBody The statement (or block) run otherwise, or {@code null} if there is no else branch.
 * @param line The line of the {@code if} keyword.
 */
public record IfNode(
        AstNode condition,
        AstNode thenBody,
        AstNode elseBody,
        int line
) implements AstNode {

    /**
     * @return {@code true} if this statement has an else branch.
     */
    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
