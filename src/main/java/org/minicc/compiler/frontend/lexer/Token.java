package org.minicc.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., KEYWORD, ID, NUM).
 * @param text The exact text of the token from the source code.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {
    /**
     * Checks whether this token has the given type and text.
     * @param expectedType The expected token type.
     * @param expectedText The expected token text.
     * @return true if both type and text match.
     */
    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }
}
