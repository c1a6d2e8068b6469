package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a {@code printf("...")} call.
 *
 * @param string The STRING token, quotes included.
 */
public record PrintfNode(Token string) implements StatementNode {
}
