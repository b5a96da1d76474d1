package org.tinyscript.compiler.frontend.lexer;

import org.tinyscript.compiler.diagnostics.CompilerLogger;
import org.tinyscript.compiler.diagnostics.DiagnosticsEngine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Unrecognized characters are reported to the {@link DiagnosticsEngine} and skipped,
 * so a single pass records every lexical problem in the source.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "for", TokenType.FOR,
            "in", TokenType.IN,
            "range", TokenType.RANGE,
            "while", TokenType.WHILE,
            "if", TokenType.IF,
            "else", TokenType.ELSE,
            "print", TokenType.PRINT,
            "True", TokenType.TRUE,
            "False", TokenType.FALSE
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being tokenized, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        start = current;
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column(), logicalFileName));
        CompilerLogger.trace("Lexer produced {} tokens for {}", tokens.size(), logicalFileName);
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '"': string(); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.TIMES); break;
            case '/': addToken(TokenType.DIVIDE); break;
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '=': addToken(match('=') ? TokenType.EQUALS : TokenType.ASSIGN); break;
            case '<': addToken(match('=') ? TokenType.LE : TokenType.LT); break;
            case '>': addToken(match('=') ? TokenType.GE : TokenType.GT); break;
            case '!':
                // Only valid as the first half of '!='.
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    reportIllegal(c);
                }
                break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            // Ignore whitespace
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                lineStart = current;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    reportIllegal(c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);

        if (type == TokenType.TRUE) {
            addToken(type, Boolean.TRUE);
        } else if (type == TokenType.FALSE) {
            addToken(type, Boolean.FALSE);
        } else {
            addToken(type);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }

        String numberString = source.substring(start, current);
        if (isFloat) {
            addToken(TokenType.NUMBER, Double.valueOf(numberString));
        } else {
            addToken(TokenType.NUMBER, new BigInteger(numberString));
        }
    }

    private void string() {
        int lookahead = current;
        while (lookahead < source.length() && source.charAt(lookahead) != '"' && source.charAt(lookahead) != '\n') {
            lookahead++;
        }

        if (lookahead >= source.length() || source.charAt(lookahead) == '\n') {
            // No closing quote on this line: the opening quote itself is the illegal character.
            reportIllegal('"');
            return;
        }

        while (current <= lookahead) advance();

        // The text of the token is the string *with* quotes, the value is the content.
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private void reportIllegal(char c) {
        diagnostics.reportLexError(c, logicalFileName, line, column());
        CompilerLogger.debug("Skipping illegal character '{}' at line {}", c, line);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line, column(), logicalFileName));
    }

    private int column() {
        return start - lineStart + 1;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
