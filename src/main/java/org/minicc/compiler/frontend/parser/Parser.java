package org.minicc.compiler.frontend.parser;

import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.lexer.Token;
import org.minicc.compiler.frontend.lexer.TokenType;
import org.minicc.compiler.frontend.parser.ast.AssignExprNode;
import org.minicc.compiler.frontend.parser.ast.BinOpNode;
import org.minicc.compiler.frontend.parser.ast.DeclareArrayNode;
import org.minicc.compiler.frontend.parser.ast.DeclareNode;
import org.minicc.compiler.frontend.parser.ast.ExpressionNode;
import org.minicc.compiler.frontend.parser.ast.IncludeNode;
import org.minicc.compiler.frontend.parser.ast.LeafNode;
import org.minicc.compiler.frontend.parser.ast.PrintfNode;
import org.minicc.compiler.frontend.parser.ast.StatementNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser for the C subset. It consumes the tokens produced by
 * the {@link org.minicc.compiler.frontend.lexer.Lexer} and produces a flat list of
 * statement nodes.
 * <p>
 * The parser never throws. Every problem is reported to the {@link DiagnosticsEngine}
 * and every error path leaves the cursor further along than it was, so parsing
 * terminates for any token sequence.
 */
public class Parser {

    private static final String MAIN = "main";
    private static final String PRINTF = "printf";
    /** Maximum parenthesis nesting inside one expression. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final List<StatementNode> statements = new ArrayList<>();
    private int current = 0;
    private int nestingDepth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting syntax errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The statements in source order. Function bodies are flattened into this list.
     */
    public List<StatementNode> parse() {
        while (!isAtEnd()) {
            Token token = peek();
            if (token.type() == TokenType.INCLUDE) {
                statements.add(new IncludeNode(advance()));
            } else if (token.type() == TokenType.KEYWORD && isFunctionAhead()) {
                functionDefinition();
            } else if (token.is(TokenType.KEYWORD, PRINTF)) {
                printfStatement();
            } else {
                statement();
            }
        }
        return List.copyOf(statements);
    }

    private boolean isFunctionAhead() {
        Token next = peekNext();
        return next != null
                && (next.type() == TokenType.ID || next.type() == TokenType.KEYWORD)
                && next.text().equals(MAIN);
    }

    private void functionDefinition() {
        match(TokenType.KEYWORD);
        if (!match(TokenType.KEYWORD)) {
            match(TokenType.ID);
        }
        // The parameter list is always empty and both parentheses are optional.
        match(TokenType.LPAREN);
        match(TokenType.RPAREN);
        if (!match(TokenType.LBRACE)) {
            error("Missing '{' in function");
            return;
        }

        while (!isAtEnd() && !check(TokenType.RBRACE)) {
            if (peek().is(TokenType.KEYWORD, PRINTF)) {
                printfStatement();
            } else {
                statement();
            }
        }

        if (!match(TokenType.RBRACE)) {
            error("Missing '}' in function");
        }
    }

    private void statement() {
        Token type = match(TokenType.KEYWORD) ? previous() : null;
        Token name = match(TokenType.ID) ? previous() : null;
        if (type == null || name == null) {
            error("Invalid declaration");
            skip();
            return;
        }

        if (match(TokenType.LBRACKET)) {
            Token size = match(TokenType.NUM) ? previous() : null;
            if (size == null || !match(TokenType.RBRACKET)) {
                error("Invalid array declaration");
                return;
            }
            statements.add(new DeclareArrayNode(type, name, size));
        } else {
            statements.add(new DeclareNode(type, name));
        }

        if (matchText(TokenType.OP, "=")) {
            Optional<ExpressionNode> expression = expression();
            if (expression.isEmpty()) {
                error("Invalid expression");
                return;
            }
            statements.add(new AssignExprNode(type, name, expression.get()));
        }

        if (!match(TokenType.DELIM)) {
            error("Missing semicolon");
        }
    }

    private void printfStatement() {
        matchText(TokenType.KEYWORD, PRINTF);
        if (!match(TokenType.LPAREN)) {
            error("Expected '('");
            return;
        }
        if (!match(TokenType.STRING)) {
            error("Expected string in printf");
            return;
        }
        Token string = previous();
        if (!match(TokenType.RPAREN)) {
            error("Expected ')' in printf");
            return;
        }
        if (!match(TokenType.DELIM)) {
            error("Missing semicolon after printf");
            return;
        }
        statements.add(new PrintfNode(string));
    }

    /**
     * Parses an arithmetic expression.
     * <p>
     * Once an operator is consumed the chain continues even if an operand is missing.
     * Such an operator is dropped and the operand that is present stands in for it,
     * so {@code 1 + } yields the leaf {@code 1}. The result is empty only if no operand
     * was parsed at all.
     *
     * @return The expression, or empty if nothing could be parsed.
     */
    public Optional<ExpressionNode> expression() {
        return addSub();
    }

    private Optional<ExpressionNode> addSub() {
        Optional<ExpressionNode> node = mulDiv();
        while (matchText(TokenType.OP, "+") || matchText(TokenType.OP, "-")) {
            Token operator = previous();
            node = combine(operator, node, mulDiv());
        }
        return node;
    }

    private Optional<ExpressionNode> mulDiv() {
        Optional<ExpressionNode> node = factor();
        while (matchText(TokenType.OP, "*") || matchText(TokenType.OP, "/")) {
            Token operator = previous();
            node = combine(operator, node, factor());
        }
        return node;
    }

    private Optional<ExpressionNode> factor() {
        if (match(TokenType.NUM, TokenType.ID)) {
            return Optional.of(new LeafNode(previous()));
        }
        if (match(TokenType.LPAREN)) {
            if (nestingDepth >= MAX_NESTING_DEPTH) {
                error("Expression nested too deeply");
                skipToDelimiter();
                return Optional.empty();
            }
            nestingDepth++;
            Optional<ExpressionNode> inner = expression();
            nestingDepth--;
            match(TokenType.RPAREN);
            return inner;
        }
        return Optional.empty();
    }

    private static Optional<ExpressionNode> combine(Token operator, Optional<ExpressionNode> left, Optional<ExpressionNode> right) {
        if (left.isPresent() && right.isPresent()) {
            return Optional.of(new BinOpNode(operator, left.get(), right.get()));
        }
        return left.isPresent() ? left : right;
    }

    private void skipToDelimiter() {
        while (!isAtEnd() && !check(TokenType.DELIM)) {
            skip();
        }
    }

    private void error(String message) {
        diagnostics.reportSyntaxError(message, currentLine());
    }

    private int currentLine() {
        if (!isAtEnd()) return peek().line();
        return tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).line();
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

    private boolean matchText(TokenType type, String text) {
        if (!isAtEnd() && peek().is(type, text)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private void skip() {
        current++;
    }

    private Token peek() {
        return isAtEnd() ? null : tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : null;
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }
}
