package org.tinyscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a call such as {@code str(x)}.
 *
 * @param name The called function.
 * @param arguments The positional arguments in source order.
 * @param line The line of the function name.
 */
public record FunctionCallNode(
        VariableNode name,
        List<AstNode> arguments,
        int line
) implements AstNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
