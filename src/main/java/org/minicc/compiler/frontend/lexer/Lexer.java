package org.minicc.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * At every position the rules are tried in their declaration order and the first
 * one that matches wins. This is alternation-order precedence, not longest match,
 * which is why keywords are listed before identifiers.
 */
public class Lexer {

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Rule> RULES = List.of(
            new Rule(TokenType.INCLUDE, "#\\s*include\\s*<[^>]+>"),
            new Rule(TokenType.KEYWORD, "\\b(int|float|char|double|long|short|void|return|if|else|for|while|do|printf|scanf|main)\\b"),
            new Rule(TokenType.ID, "\\b[a-zA-Z_]\\w*\\b"),
            new Rule(TokenType.NUM, "\\b\\d+(\\.\\d+)?\\b"),
            new Rule(TokenType.STRING, "\".*?\""),
            new Rule(TokenType.OP, "[=+\\-*/<>!]"),
            new Rule(TokenType.LPAREN, "\\("),
            new Rule(TokenType.RPAREN, "\\)"),
            new Rule(TokenType.LBRACE, "\\{"),
            new Rule(TokenType.RBRACE, "\\}"),
            new Rule(TokenType.LBRACKET, "\\["),
            new Rule(TokenType.RBRACKET, "\\]"),
            new Rule(TokenType.DELIM, "[;,]"),
            new Rule(null, "[ \\t\\n]+")
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, or the error for the first character no rule accepts.
     */
    public LexResult tokenize() {
        while (!isAtEnd()) {
            if (!scanToken()) {
                return new LexResult.Err(new LexicalError(source.codePointAt(current), line, column()));
            }
        }
        return new LexResult.Ok(tokens);
    }

    private boolean scanToken() {
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(source);
            // Transparent bounds let \b look at the character before the region start.
            matcher.region(current, source.length());
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            if (matcher.lookingAt()) {
                String text = matcher.group();
                if (rule.type() != null) {
                    tokens.add(new Token(rule.type(), text, line, column()));
                }
                advance(text);
                return true;
            }
        }
        return false;
    }

    private void advance(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = current + i + 1;
            }
        }
        current += text.length();
    }

    private int column() {
        return current - lineStart + 1;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    /**
     * A single token rule. A rule without a type matches whitespace, which is dropped.
     */
    private record Rule(TokenType type, Pattern pattern) {
        Rule(TokenType type, String regex) {
            this(type, Pattern.compile(regex, FLAGS));
        }
    }
}
