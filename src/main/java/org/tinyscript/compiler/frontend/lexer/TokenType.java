package org.tinyscript.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '+' character. */
    PLUS,
    /** The '-' character. */
    MINUS,
    /** The '*' character. */
    TIMES,
    /** The '/' character. */
    DIVIDE,
    /** The '=' character, used for assignments. */
    ASSIGN,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    /** The ':' character, opening the body of a compound statement. */
    COLON,
    /** The ';' character, separating statements. */
    SEMICOLON,

    // Comparison operators.
    /** The '==' operator. */
    EQUALS,
    /** The '!=' operator. */
    NE,
    /** The '<' operator. */
    LT,
    /** The '>' operator. */
    GT,
    /** The '<=' operator. */
    LE,
    /** The '>=' operator. */
    GE,

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A numeric literal, integer or floating-point. */
    NUMBER,
    /** A string literal. */
    STRING,
    /** The 'True' literal. */
    TRUE,
    /** The 'False' literal. */
    FALSE,

    // Keywords.
    FOR,
    IN,
    RANGE,
    WHILE,
    IF,
    ELSE,
    PRINT,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE;

    /**
     * @return {@code true} if this type is one of the six comparison operators.
     */
    public boolean isComparison() {
        return this == EQUALS || this == NE || this == LT || this == GT || this == LE || this == GE;
    }
}
