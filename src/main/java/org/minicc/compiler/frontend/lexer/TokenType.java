package org.minicc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Whitespace is consumed by the lexer and has no token type.
 */
public enum TokenType {
    /** A complete {@code #include <...>} line. */
    INCLUDE,
    /** A reserved word such as {@code int} or {@code printf}. */
    KEYWORD,
    /** An identifier, such as a variable name. */
    ID,
    /** An integer or decimal literal. */
    NUM,
    /** A double-quoted string literal, quotes included. */
    STRING,
    /** One of {@code = + - * / < > !}. */
    OP,

    // Single-character tokens.
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    /** A statement delimiter, {@code ;} or {@code ,}. */
    DELIM
}
