package org.tinyscript.runtime;

import org.tinyscript.compiler.frontend.parser.ast.*;
import org.tinyscript.runtime.api.RuntimeErrorKind;
import org.tinyscript.runtime.api.ScriptRuntimeException;
import org.tinyscript.runtime.builtins.BuiltinRegistry;
import org.tinyscript.runtime.builtins.IBuiltinFunction;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tree-walking evaluator. Each visit method evaluates one node kind against the environment
 * given at construction and returns the node's value, or {@code null} for statements that
 * produce none. Text printed by the program is collected in an internal buffer.
 * <p>
 * Operands and arguments are evaluated strictly left to right. Loops are not bounded:
 * a {@code while} whose condition stays true never returns. Not thread-safe.
 */
public class Interpreter implements AstVisitor<Object> {

    private final Environment environment;
    private final BuiltinRegistry builtins;
    private final StringBuilder output = new StringBuilder();

    /**
     * Creates an interpreter with the standard built-ins.
     * @param environment The variable table to read and mutate.
     */
    public Interpreter(Environment environment) {
        this(environment, BuiltinRegistry.initialize());
    }

    /**
     * Creates an interpreter.
     * @param environment The variable table to read and mutate.
     * @param builtins The functions callable by name.
     */
    public Interpreter(Environment environment, BuiltinRegistry builtins) {
        this.environment = environment;
        this.builtins = builtins;
    }

    /**
     * Evaluates a node.
     * @param node The node to evaluate.
     * @return The value of the node, or {@code null} if it is a statement without a value.
     * @throws ScriptRuntimeException if evaluation fails; bindings made before the failure are kept.
     */
    public Object evaluate(AstNode node) {
        return node.accept(this);
    }

    /**
     * @return Everything printed so far, each print terminated by a newline.
     */
    public String getOutput() {
        return output.toString();
    }

    @Override
    public Object visitBlock(BlockNode node) {
        for (AstNode statement : node.statements()) {
            evaluate(statement);
        }
        return null;
    }

    @Override
    public Object visitNumberLiteral(NumberLiteralNode node) {
        return node.value();
    }

    @Override
    public Object visitBooleanLiteral(BooleanLiteralNode node) {
        return node.value();
    }

    @Override
    public Object visitStringLiteral(StringLiteralNode node) {
        return node.value();
    }

    @Override
    public Object visitVariable(VariableNode node) {
        return environment.lookup(node.name())
                .orElseThrow(() -> notDefined(node.name(), node.line()));
    }

    @Override
    public Object visitBinOp(BinOpNode node) {
        Object left = evaluate(node.left());
        Object right = evaluate(node.right());
        try {
            return Operators.apply(node.operator(), left, right);
        } catch (ScriptRuntimeException e) {
            throw e.atLine(node.line());
        }
    }

    @Override
    public Object visitList(ListNode node) {
        List<Object> values = new ArrayList<>(node.items().size());
        for (AstNode item : node.items()) {
            values.add(evaluate(item));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public Object visitFunctionCall(FunctionCallNode node) {
        String name = node.name().name();
        IBuiltinFunction function = builtins.get(name)
                .orElseThrow(() -> notDefined(name, node.line()));
        List<Object> arguments = new ArrayList<>(node.arguments().size());
        for (AstNode argument : node.arguments()) {
            arguments.add(evaluate(argument));
        }
        try {
            return function.invoke(arguments);
        } catch (ScriptRuntimeException e) {
            throw e.atLine(node.line());
        }
    }

    @Override
    public Object visitAssignment(AssignmentNode node) {
        Object value = evaluate(node.value());
        environment.assign(node.target().name(), value);
        return value;
    }

    @Override
    public Object visitIf(IfNode node) {
        if (Values.isTruthy(evaluate(node.condition()))) {
            evaluate(node.thenBody());
        } else if (node.hasElse()) {
            evaluate(node.elseBody());
        }
        return null;
    }

    @Override
    public Object visitFor(ForNode node) {
        BigInteger from = rangeBound(evaluate(node.start()), node.line());
        BigInteger to = rangeBound(evaluate(node.end()), node.line());
        String iterator = node.iterator().name();
        // The counter is independent of the variable, so rebinding it in the body does not skip values.
        for (BigInteger i = from; i.compareTo(to) < 0; i = i.add(BigInteger.ONE)) {
            environment.assign(iterator, i);
            evaluate(node.body());
        }
        return null;
    }

    @Override
    public Object visitWhile(WhileNode node) {
        while (Values.isTruthy(evaluate(node.condition()))) {
            evaluate(node.body());
        }
        return null;
    }

    @Override
    public Object visitPrint(PrintNode node) {
        output.append(Values.str(evaluate(node.expression()))).append('\n');
        return null;
    }

    private static BigInteger rangeBound(Object value, int line) {
        if (Values.isIntegral(value)) {
            return Values.toBigInteger(value);
        }
        throw new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR,
                "'" + Values.typeName(value) + "' object cannot be interpreted as an integer", line);
    }

    private static ScriptRuntimeException notDefined(String name, int line) {
        return new ScriptRuntimeException(RuntimeErrorKind.NAME_ERROR, "name '" + name + "' is not defined", line);
    }
}
