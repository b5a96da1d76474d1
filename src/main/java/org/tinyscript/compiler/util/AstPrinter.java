package org.tinyscript.compiler.util;

import org.tinyscript.compiler.frontend.parser.ast.*;
import org.tinyscript.runtime.Values;

/**
 * Renders an AST as indented, human-readable text, one line per node or section label.
 * Each depth level adds two spaces. The output is for display only; nothing parses it back.
 */
public final class AstPrinter implements AstVisitor<Void> {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private AstPrinter() {}

    /**
     * Renders a node and its subtree.
     * @param node The root of the subtree to render.
     * @return The rendered tree, every line terminated by a newline.
     */
    public static String render(AstNode node) {
        AstPrinter printer = new AstPrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    @Override
    public Void visitBlock(BlockNode node) {
        line("Block:");
        nested(() -> node.statements().forEach(s -> s.accept(this)));
        return null;
    }

    @Override
    public Void visitNumberLiteral(NumberLiteralNode node) {
        line("Number(" + Values.str(node.value()) + ")");
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteralNode node) {
        line("Boolean(" + Values.str(node.value()) + ")");
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteralNode node) {
        line("String(" + node.value() + ")");
        return null;
    }

    @Override
    public Void visitVariable(VariableNode node) {
        line("Variable(" + node.name() + ")");
        return null;
    }

    @Override
    public Void visitBinOp(BinOpNode node) {
        line("BinOp(op='" + node.operator() + "')");
        nested(() -> {
            node.left().accept(this);
            node.right().accept(this);
        });
        return null;
    }

    @Override
    public Void visitList(ListNode node) {
        line("List:");
        nested(() -> node.items().forEach(item -> item.accept(this)));
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallNode node) {
        line("FunctionCall: " + node.name().name());
        section("Args:", () -> node.arguments().forEach(arg -> arg.accept(this)));
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentNode node) {
        line("Assignment:");
        nested(() -> {
            node.target().accept(this);
            node.value().accept(this);
        });
        return null;
    }

    @Override
    public Void visitIf(IfNode node) {
        line("If:");
        section("Condition:", () -> node.condition().accept(this));
        section("Body:", () -> node.thenBody().accept(this));
        if (node.hasElse()) {
            section("Else:", () -> node.elseBody().accept(this));
        }
        return null;
    }

    @Override
    public Void visitFor(ForNode node) {
        line("For:");
        nested(() -> line("Iterator: " + node.iterator().name()));
        section("Range Start:", () -> node.start().accept(this));
        section("Range End:", () -> node.end().accept(this));
        section("Body:", () -> node.body().accept(this));
        return null;
    }

    @Override
    public Void visitWhile(WhileNode node) {
        line("While:");
        section("Condition:", () -> node.condition().accept(this));
        section("Body:", () -> node.body().accept(this));
        return null;
    }

    @Override
    public Void visitPrint(PrintNode node) {
        line("Print:");
        nested(() -> node.expression().accept(this));
        return null;
    }

    private void section(String label, Runnable content) {
        nested(() -> {
            line(label);
            nested(content);
        });
    }

    private void nested(Runnable content) {
        depth++;
        try {
            content.run();
        } finally {
            depth--;
        }
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
