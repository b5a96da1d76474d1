package org.tinyscript.runtime;

import org.tinyscript.compiler.Compiler;
import org.tinyscript.runtime.api.RuntimeErrorKind;
import org.tinyscript.runtime.builtins.BuiltinRegistry;
import org.tinyscript.runtime.builtins.IBuiltinFunction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests the {@link ScriptRunner}, which turns a program run into an {@link ExecutionResult}.
 */
@Tag("unit")
public class ScriptRunnerTest {

    private final Compiler compiler = new Compiler();

    @Test
    void successfulRunReportsOutputBindingsAndLastValue() throws Exception {
        // Act
        ExecutionResult result = new ScriptRunner().run(compiler.parse("x = 2; print(x * 3); x + 1"));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.output()).isEqualTo("6\n");
        assertThat(result.variables()).containsExactly(entry("x", BigInteger.TWO));
        assertThat(result.getLastValue()).contains(BigInteger.valueOf(3));
        assertThat(result.getError()).isEmpty();
    }

    @Test
    void statementWithoutValueLeavesLastValueEmpty() throws Exception {
        // Act
        ExecutionResult result = new ScriptRunner().run(compiler.parse("x = 1; print(x)"));

        // Assert
        assertThat(result.getLastValue()).isEmpty();
    }

    @Test
    void failedRunKeepsEarlierOutputAndBindings() throws Exception {
        // Arrange
        Environment environment = new Environment();

        // Act
        ExecutionResult result = new ScriptRunner().run(
                compiler.parse("a = 1; print(a); b = a / 0; c = 3"), environment);

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.output()).isEqualTo("1\n");
        assertThat(result.variables()).containsOnlyKeys("a");
        assertThat(environment.isDefined("b")).isFalse();
        assertThat(result.getError()).get()
                .extracting(e -> e.getKind())
                .isEqualTo(RuntimeErrorKind.ZERO_DIVISION_ERROR);
        assertThat(result.getLastValue()).isEmpty();
    }

    @Test
    void divisionByZeroPrintsNothing() throws Exception {
        // Act
        ExecutionResult result = new ScriptRunner().run(compiler.parse("print(1/0)"));

        // Assert
        assertThat(result.output()).isEmpty();
        assertThat(result.error().toString()).isEqualTo("ZeroDivisionError: division by zero (line 1)");
    }

    @Test
    void hugeRepetitionEndsTheRunWithAnErrorResult() throws Exception {
        // Act
        ExecutionResult result = new ScriptRunner().run(compiler.parse("print(1); s = \"ab\" * 1500000000"));

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.output()).isEqualTo("1\n");
        assertThat(result.variables()).doesNotContainKey("s");
        assertThat(result.error().toString()).isEqualTo("TypeError: repeated string is too long (line 1)");
    }

    @Test
    void variablesAreASnapshot() throws Exception {
        // Arrange
        Environment environment = new Environment();
        ExecutionResult result = new ScriptRunner().run(compiler.parse("x = 1"), environment);

        // Act
        environment.assign("x", BigInteger.TEN);

        // Assert
        assertThat(result.variables()).containsEntry("x", BigInteger.ONE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "0 - 7", "2.5", "True", "False", "\"text\"", "[1, 2.5, \"s\", False]", "[]"})
    void assignedValueReadsBackUnchanged(String literal) throws Exception {
        // Arrange
        ScriptRunner runner = new ScriptRunner();
        Environment environment = new Environment();
        Object expected = runner.run(compiler.parse("v = " + literal), environment).lastValue();

        // Act
        ExecutionResult result = runner.run(compiler.parse("x = v; x"), environment);

        // Assert
        assertThat(result.lastValue()).isEqualTo(expected);
        assertThat(Values.equal(result.lastValue(), expected)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({"0, 5", "3, 3", "5, 2", "1, 4"})
    void forRangePrintsOneLinePerValue(int start, int end) throws Exception {
        // Act
        ExecutionResult result = new ScriptRunner().run(
                compiler.parse("for i in range(" + start + ", " + end + "): print(i)"));

        // Assert
        String[] lines = result.output().isEmpty() ? new String[0] : result.output().split("\n");
        assertThat(lines).hasSize(Math.max(0, end - start));
        for (int k = 0; k < lines.length; k++) {
            assertThat(lines[k]).isEqualTo(String.valueOf(start + k));
        }
    }

    @Test
    void customBuiltinsCanBeRegistered() throws Exception {
        // Arrange
        BuiltinRegistry registry = BuiltinRegistry.initialize();
        registry.register(new IBuiltinFunction() {
            @Override
            public String name() {
                return "len";
            }

            @Override
            public Object invoke(List<Object> arguments) {
                return BigInteger.valueOf(((List<?>) arguments.get(0)).size());
            }
        });

        // Act
        ExecutionResult result = new ScriptRunner(registry).run(compiler.parse("l = [1, 2, 3]; print(len(l))"));

        // Assert
        assertThat(result.output()).isEqualTo("3\n");
    }
}
