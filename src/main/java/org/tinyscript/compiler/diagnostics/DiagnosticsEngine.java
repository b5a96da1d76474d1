package org.tinyscript.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages that occur while lexing and parsing.
 * <p>
 * This decouples error reporting from the lexer and parser: both report into the
 * engine they were given, and the caller decides which diagnostic to surface.
 * One engine belongs to exactly one compilation and is not thread-safe.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an unrecognized character.
     *
     * @param character  The offending character.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param column     The column of the character.
     */
    public void reportLexError(char character, String fileName, int lineNumber, int column) {
        String message = String.format("Illegal character '%c' at line %d", character, lineNumber);
        diagnostics.add(new Diagnostic(Diagnostic.Kind.LEX_ERROR, message, fileName, lineNumber, column, String.valueOf(character)));
    }

    /**
     * Reports a syntax error at a token.
     *
     * @param message    The error message.
     * @param lexeme     The text of the offending token, {@code null} at end of input.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param column     The column of the offending token.
     */
    public void reportSyntaxError(String message, String lexeme, String fileName, int lineNumber, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Kind.SYNTAX_ERROR, message, fileName, lineNumber, column, lexeme));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one diagnostic exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns the diagnostic that comes first in source order.
     *
     * @return The earliest diagnostic, or empty if nothing was reported.
     */
    public Optional<Diagnostic> first() {
        Diagnostic earliest = null;
        for (Diagnostic d : diagnostics) {
            if (earliest == null || d.isBefore(earliest)) {
                earliest = d;
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Discards all collected diagnostics so the engine can serve the next compilation.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
