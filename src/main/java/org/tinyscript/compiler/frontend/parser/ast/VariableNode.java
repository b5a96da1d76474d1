package org.tinyscript.compiler.frontend.parser.ast;

/**
 * An AST node that represents an identifier: a variable reference, an assignment target,
 * a loop iterator or the name of a called function.
 *
 * @param name The identifier text.
 * @param line The source line.
 */
public record VariableNode(
        String name,
        int line
) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
