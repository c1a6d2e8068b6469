package org.minicc.compiler.frontend.lexer;

import java.util.List;

/**
 * The outcome of a tokenization run: either the complete token sequence or the
 * lexical error that aborted it.
 */
public sealed interface LexResult permits LexResult.Ok, LexResult.Err {

    /**
     * Tokenization succeeded.
     * @param tokens The tokens in source order.
     */
    record Ok(List<Token> tokens) implements LexResult {
        public Ok {
            tokens = List.copyOf(tokens);
        }
    }

    /**
     * Tokenization stopped at an unrecognized character.
     * @param error The error describing the offending character.
     */
    record Err(LexicalError error) implements LexResult {}
}
