package org.tinyscript.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., NUMBER, IDENTIFIER, PLUS).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: a {@link java.math.BigInteger} or {@link Double}
 *              for numbers, the unquoted content for strings, a {@link Boolean} for
 *              {@code True}/{@code False}, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number (1-based) where the token begins.
 * @param fileName The logical file name of the source text.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
}
