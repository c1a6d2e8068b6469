package org.minicc.node.processes.http.api.analysis.dto;

import org.minicc.compiler.frontend.lexer.Token;

/**
 * A token as exposed over HTTP.
 *
 * @param type  The token type name, e.g. {@code KEYWORD}.
 * @param value The matched text.
 */
public record TokenDto(String type, String value) {

    public static TokenDto from(final Token token) {
        return new TokenDto(token.type().name(), token.text());
    }
}
