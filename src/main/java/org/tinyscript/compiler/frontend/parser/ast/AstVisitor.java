package org.tinyscript.compiler.frontend.parser.ast;

/**
 * Visitor over every node kind the parser can produce.
 *
 * @param <R> The return type of the visit methods.
 */
public interface AstVisitor<R> {

    // Structure
    R visitBlock(BlockNode node);

    // Leaves
    R visitNumberLiteral(NumberLiteralNode node);
    R visitBooleanLiteral(BooleanLiteralNode node);
    R visitStringLiteral(StringLiteralNode node);
    R visitVariable(VariableNode node);

    // Expressions
    R visitBinOp(BinOpNode node);
    R visitList(ListNode node);
    R visitFunctionCall(FunctionCallNode node);

    // Statements
    R visitAssignment(AssignmentNode node);
    R visitIf(IfNode node);
    R visitFor(ForNode node);
    R visitWhile(WhileNode node);
    R visitPrint(PrintNode node);
}
