package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an {@code #include <...>} line, kept verbatim.
 *
 * @param include The INCLUDE token.
 */
public record IncludeNode(Token include) implements StatementNode {
}
