package org.tinyscript.compiler.diagnostics;

/**
 * Represents a single diagnostic message that occurs while turning source text into an AST.
 *
 * @param kind The kind of the diagnostic (lexical or syntactic).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param column The column (1-based) of the offending character or token, 0 when unknown.
 * @param lexeme The offending character or token text, {@code null} at end of input.
 */
public record Diagnostic(
        Kind kind,
        String message,
        String fileName,
        int lineNumber,
        int column,
        String lexeme
) {
    /**
     * The kind of a diagnostic message.
     */
    public enum Kind {
        /** An unrecognized character in the source text. */
        LEX_ERROR("LexError"),
        /** A token that does not fit the grammar, or a premature end of input. */
        SYNTAX_ERROR("SyntaxError");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        /**
         * @return The human-readable name of this kind, e.g. {@code SyntaxError}.
         */
        public String displayName() {
            return displayName;
        }
    }

    /**
     * Checks whether this diagnostic lies before another one in source order.
     * @param other The diagnostic to compare with.
     * @return {@code true} if this diagnostic starts strictly earlier.
     */
    public boolean isBefore(Diagnostic other) {
        if (lineNumber != other.lineNumber) {
            return lineNumber < other.lineNumber;
        }
        return column < other.column;
    }

    /**
     * @return The diagnostic as shown to users, e.g. {@code LexError: Illegal character '@' at line 1}.
     */
    public String describe() {
        return kind.displayName() + ": " + message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", kind.displayName(), fileName, lineNumber, message);
    }
}
