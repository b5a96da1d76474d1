package org.tinyscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a list literal such as {@code [1, x, "a"]}.
 *
 * @param items The item expressions in source order.
 * @param line The line of the opening bracket.
 */
public record ListNode(
        List<AstNode> items,
        int line
) implements AstNode {

    public ListNode {
        items = List.copyOf(items);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
