package org.tinyscript.runtime;

import org.tinyscript.compiler.Compiler;
import org.tinyscript.compiler.frontend.parser.ast.AstNode;
import org.tinyscript.compiler.frontend.parser.ast.BlockNode;
import org.tinyscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.tinyscript.compiler.frontend.parser.ast.VariableNode;
import org.tinyscript.runtime.api.RuntimeErrorKind;
import org.tinyscript.runtime.api.ScriptRuntimeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link Interpreter}.
 * Programs are compiled from source and evaluated against an environment owned by the test.
 */
@Tag("unit")
public class InterpreterTest {

    private Environment environment;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        environment = new Environment();
        interpreter = new Interpreter(environment);
    }

    private void exec(String source) throws Exception {
        BlockNode program = new Compiler().parse(source);
        interpreter.evaluate(program);
    }

    private Object eval(String expression) throws Exception {
        BlockNode program = new Compiler().parse(expression);
        return interpreter.evaluate(program.statements().get(0));
    }

    @Test
    void ifTakesThenBranchWhenConditionHolds() throws Exception {
        // Act
        exec("x = 10; if x > 5: print(\"big\") else: print(\"small\")");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("big\n");
    }

    @Test
    void ifTakesElseBranchOtherwise() throws Exception {
        // Act
        exec("x = 1; if x > 5: print(\"big\") else: print(\"small\")");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("small\n");
    }

    @Test
    void ifWithoutElseDoesNothingWhenFalse() throws Exception {
        // Act
        exec("x = 1; if x > 5: print(\"big\")");

        // Assert
        assertThat(interpreter.getOutput()).isEmpty();
    }

    @Test
    void whileLoopRunsAgainstExistingEnvironment() throws Exception {
        // Arrange
        environment.assign("x", BigInteger.TEN);

        // Act
        exec("while x > 8: print(str(x)); x = x - 1");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("10\n9\n");
        assertThat(environment.lookup("x")).contains(BigInteger.valueOf(8));
    }

    @Test
    void forLoopPrintsEveryValueOfTheRange() throws Exception {
        // Act
        exec("for i in range(2, 6): print(i)");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("2\n3\n4\n5\n");
        assertThat(environment.lookup("i")).contains(BigInteger.valueOf(5));
    }

    @Test
    void emptyRangeLeavesIteratorUnbound() throws Exception {
        // Act
        exec("for i in range(5, 2): print(i)");

        // Assert
        assertThat(interpreter.getOutput()).isEmpty();
        assertThat(environment.isDefined("i")).isFalse();
    }

    @Test
    void rebindingIteratorInBodyDoesNotChangeIterationCount() throws Exception {
        // Act
        exec("for i in range(0, 3): print(i); i = 100");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("0\n1\n2\n");
        assertThat(environment.lookup("i")).contains(BigInteger.valueOf(100));
    }

    @Test
    void forBoundsAcceptBooleans() throws Exception {
        // Act
        exec("for i in range(True, 3): print(i)");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("1\n2\n");
    }

    @Test
    void forWithFloatBoundIsTypeError() {
        // Act
        ScriptRuntimeException e = catchThrowableOfType(() -> exec("for i in range(1.5, 3): print(i)"),
                ScriptRuntimeException.class);

        // Assert
        assertThat(e.getKind()).isEqualTo(RuntimeErrorKind.TYPE_ERROR);
        assertThat(e.getMessage()).isEqualTo("'float' object cannot be interpreted as an integer");
        assertThat(interpreter.getOutput()).isEmpty();
    }

    @Test
    void listAssignmentEvaluatesEveryItem() throws Exception {
        // Act
        exec("a = 2; y = [1, True, \"a\", a * 2]");

        // Assert
        assertThat(environment.lookup("y")).contains(List.of(BigInteger.ONE, true, "a", BigInteger.valueOf(4)));
    }

    @Test
    void assignmentReturnsAssignedValue() throws Exception {
        // Act
        Object value = eval("x = 2.5");

        // Assert
        assertThat(value).isEqualTo(2.5);
        assertThat(environment.lookup("x")).contains(2.5);
    }

    @Test
    void printUsesTextualForm() throws Exception {
        // Act
        exec("print(\"a\"); print(1.0); print(True); print(7 / 2); l = [\"q\", 1.0]; print(l)");

        // Assert
        assertThat(interpreter.getOutput()).isEqualTo("a\n1.0\nTrue\n3.5\n['q', 1.0]\n");
    }

    @Test
    void divisionByZeroStopsBeforePrinting() {
        // Act
        ScriptRuntimeException e = catchThrowableOfType(() -> exec("print(1 / 0)"), ScriptRuntimeException.class);

        // Assert
        assertThat(e.getKind()).isEqualTo(RuntimeErrorKind.ZERO_DIVISION_ERROR);
        assertThat(e.getMessage()).isEqualTo("division by zero");
        assertThat(e.getLine()).isEqualTo(1);
        assertThat(interpreter.getOutput()).isEmpty();
    }

    @Test
    void undefinedVariableIsNameError() {
        // Act
        ScriptRuntimeException e = catchThrowableOfType(() -> exec("x = 1;\nprint(y)"), ScriptRuntimeException.class);

        // Assert
        assertThat(e.getKind()).isEqualTo(RuntimeErrorKind.NAME_ERROR);
        assertThat(e.getMessage()).isEqualTo("name 'y' is not defined");
        assertThat(e.getLine()).isEqualTo(2);
        assertThat(environment.lookup("x")).contains(BigInteger.ONE);
    }

    @Test
    void unknownFunctionIsNameErrorBeforeArgumentsAreEvaluated() {
        // Act
        ScriptRuntimeException e = catchThrowableOfType(() -> exec("foo(1 / 0)"), ScriptRuntimeException.class);

        // Assert
        assertThat(e.getKind()).isEqualTo(RuntimeErrorKind.NAME_ERROR);
        assertThat(e.getMessage()).isEqualTo("name 'foo' is not defined");
    }

    @Test
    void builtinArityErrorCarriesLine() {
        // Act
        ScriptRuntimeException e = catchThrowableOfType(() -> exec("x = 1;\n\nstr()"), ScriptRuntimeException.class);

        // Assert
        assertThat(e.toString()).isEqualTo("TypeError: str() takes exactly one argument (0 given) (line 3)");
    }

    @Test
    void variableNodeEvaluatesToBoundValue() {
        // Arrange
        environment.assign("n", BigInteger.TWO);
        AstNode node = new VariableNode("n", 1);

        // Act & Assert
        assertThat(interpreter.evaluate(node)).isEqualTo(BigInteger.TWO);
        assertThat(interpreter.evaluate(new NumberLiteralNode(BigInteger.ONE, 1))).isEqualTo(BigInteger.ONE);
    }

    @Test
    void arithmeticOnIntegersIsExact() throws Exception {
        // Arrange
        BigInteger a = new BigInteger("123456789012345678901234567890");
        BigInteger b = new BigInteger("-98765432109876543210");
        environment.assign("a", a);
        environment.assign("b", b);

        // Act & Assert
        assertThat(eval("a + b")).isEqualTo(a.add(b));
        assertThat(eval("a - b")).isEqualTo(a.subtract(b));
        assertThat(eval("a * b")).isEqualTo(a.multiply(b));
        assertThat(eval("a / b")).isInstanceOf(Double.class);
    }
}
