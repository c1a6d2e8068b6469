package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

/**
 * An expression leaf: a numeric literal or an identifier.
 *
 * @param token The NUM or ID token.
 */
public record LeafNode(Token token) implements ExpressionNode {
}
