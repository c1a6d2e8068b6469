package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an array declaration, e.g. {@code int arr[10]}.
 *
 * @param type The type keyword token.
 * @param name The array name token.
 * @param size The NUM token holding the array size.
 */
public record DeclareArrayNode(Token type, Token name, Token size) implements StatementNode {
}
