package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a scalar variable declaration, e.g. {@code int x}.
 *
 * @param type The type keyword token.
 * @param name The variable name token.
 */
public record DeclareNode(Token type, Token name) implements StatementNode {
}
