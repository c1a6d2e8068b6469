package org.minicc.compiler.frontend.lexer;

/**
 * The fatal error produced when no token rule matches at the current scan position.
 *
 * @param codePoint The offending character as a Unicode code point, so characters
 *                  outside the Basic Multilingual Plane are reported whole.
 * @param line The line on which it was found.
 * @param column The column on which it was found, counted in UTF-16 units.
 */
public record LexicalError(int codePoint, int line, int column) {

    /**
     * @return The offending character as a string.
     */
    public String character() {
        return Character.toString(codePoint);
    }

    /**
     * @return The human-readable message naming the offending character.
     */
    public String message() {
        return "Unexpected character: " + character();
    }

    @Override
    public String toString() {
        return String.format("%s (line %d, column %d)", message(), line, column);
    }
}
