package org.tinyscript.compiler.frontend.parser;

import org.tinyscript.compiler.diagnostics.CompilerLogger;
import org.tinyscript.compiler.diagnostics.DiagnosticsEngine;
import org.tinyscript.compiler.frontend.lexer.Token;
import org.tinyscript.compiler.frontend.lexer.TokenType;
import org.tinyscript.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive-descent parser of the language. It consumes the list of tokens produced by the
 * {@link org.tinyscript.compiler.frontend.lexer.Lexer} and builds an Abstract Syntax Tree (AST)
 * rooted in a {@link BlockNode}.
 * <p>
 * Parsing stops at the first token that does not fit the grammar: exactly one syntax error is
 * reported to the {@link DiagnosticsEngine} and {@link #parse()} returns {@code null}.
 * A parser instance is single use and not thread-safe.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting the syntax error.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream: {@code statement (';' statement)*}.
     * @return The program as a {@link BlockNode}, or {@code null} if a syntax error was reported.
     */
    public BlockNode parse() {
        try {
            int line = peek().line();
            List<AstNode> statements = new ArrayList<>();
            statements.add(statement());
            while (match(TokenType.SEMICOLON)) {
                statements.add(statement());
            }
            if (!isAtEnd()) {
                throw error(peek());
            }
            CompilerLogger.debug("Parsed program with {} top-level statement(s)", statements.size());
            return new BlockNode(statements, line);
        } catch (ParseAbort abort) {
            return null;
        }
    }

    private AstNode statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.PRINT)) return printStatement();
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            return assignment();
        }
        return expression();
    }

    private AstNode assignment() {
        Token name = advance();
        advance(); // '='
        AstNode value = check(TokenType.LBRACKET) ? listLiteral() : expression();
        return new AssignmentNode(new VariableNode(name.text(), name.line()), value, name.line());
    }

    private ListNode listLiteral() {
        Token open = consume(TokenType.LBRACKET);
        List<AstNode> items = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                items.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACKET);
        return new ListNode(items, open.line());
    }

    private IfNode ifStatement() {
        int line = previous().line();
        AstNode condition = condition();
        consume(TokenType.COLON);
        AstNode thenBody = body();
        AstNode elseBody = null;
        // The innermost open 'if' is still on the call stack, so it claims the 'else'.
        if (match(TokenType.ELSE)) {
            consume(TokenType.COLON);
            elseBody = body();
        }
        return new IfNode(condition, thenBody, elseBody, line);
    }

    private ForNode forStatement() {
        int line = previous().line();
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.IN);
        consume(TokenType.RANGE);
        consume(TokenType.LPAREN);
        AstNode start = expression();
        consume(TokenType.COMMA);
        AstNode end = expression();
        consume(TokenType.RPAREN);
        consume(TokenType.COLON);
        AstNode body = body();
        return new ForNode(new VariableNode(name.text(), name.line()), start, end, body, line);
    }

    private WhileNode whileStatement() {
        int line = previous().line();
        AstNode condition = condition();
        consume(TokenType.COLON);
        return new WhileNode(condition, body(), line);
    }

    private PrintNode printStatement() {
        int line = previous().line();
        consume(TokenType.LPAREN);
        AstNode expression = expression();
        consume(TokenType.RPAREN);
        return new PrintNode(expression, line);
    }

    /**
     * Parses the body of a compound statement. A ';'-joined sequence becomes one block,
     * a single statement is returned as is.
     */
    private AstNode body() {
        AstNode first = statement();
        if (!check(TokenType.SEMICOLON)) {
            return first;
        }
        List<AstNode> statements = new ArrayList<>();
        statements.add(first);
        while (match(TokenType.SEMICOLON)) {
            statements.add(statement());
        }
        return new BlockNode(statements, first.line());
    }

    private BinOpNode condition() {
        AstNode left = expression();
        if (!peek().type().isComparison()) {
            throw error(peek());
        }
        Token operator = advance();
        AstNode right = expression();
        return new BinOpNode(left, operator.text(), right, operator.line());
    }

    private AstNode expression() {
        AstNode left = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            left = new BinOpNode(left, operator.text(), term(), operator.line());
        }
        return left;
    }

    private AstNode term() {
        AstNode left = factor();
        while (match(TokenType.TIMES, TokenType.DIVIDE)) {
            Token operator = previous();
            left = new BinOpNode(left, operator.text(), factor(), operator.line());
        }
        return left;
    }

    private AstNode factor() {
        if (match(TokenType.NUMBER)) {
            Token number = previous();
            return new NumberLiteralNode((Number) number.value(), number.line());
        }
        if (match(TokenType.STRING)) {
            Token string = previous();
            return new StringLiteralNode((String) string.value(), string.line());
        }
        if (match(TokenType.TRUE, TokenType.FALSE)) {
            Token bool = previous();
            return new BooleanLiteralNode(bool.type() == TokenType.TRUE, bool.line());
        }
        if (match(TokenType.IDENTIFIER)) {
            Token identifier = previous();
            VariableNode variable = new VariableNode(identifier.text(), identifier.line());
            if (check(TokenType.LPAREN)) {
                return functionCall(variable);
            }
            return variable;
        }
        if (match(TokenType.LPAREN)) {
            AstNode inner = expression();
            consume(TokenType.RPAREN);
            return inner;
        }
        throw error(peek());
    }

    private FunctionCallNode functionCall(VariableNode name) {
        consume(TokenType.LPAREN);
        List<AstNode> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN);
        return new FunctionCallNode(name, arguments, name.line());
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type) {
        if (check(type)) return advance();
        throw error(peek());
    }

    private ParseAbort error(Token unexpected) {
        if (unexpected.type() == TokenType.END_OF_FILE) {
            diagnostics.reportSyntaxError("Syntax error at end of file", null,
                    unexpected.fileName(), unexpected.line(), unexpected.column());
        } else {
            String message = String.format("Syntax error at line %d, token='%s' (type='%s')",
                    unexpected.line(), displayValue(unexpected), unexpected.type());
            diagnostics.reportSyntaxError(message, unexpected.text(),
                    unexpected.fileName(), unexpected.line(), unexpected.column());
        }
        return new ParseAbort();
    }

    private static String displayValue(Token token) {
        // String tokens show their content, like the value the lexer attached to them.
        return token.value() instanceof String s ? s : token.text();
    }

    /**
     * Unwinds the recursive descent after the syntax error has been reported.
     */
    private static final class ParseAbort extends RuntimeException {
        ParseAbort() {
            super(null, null, false, false);
        }
    }
}
