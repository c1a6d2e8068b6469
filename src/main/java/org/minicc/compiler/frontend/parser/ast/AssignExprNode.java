package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents the initializer of a declaration, e.g. the {@code = 5}
 * in {@code int x = 5}. It always follows the declaration node it belongs to.
 *
 * @param type The type keyword token of the declaration.
 * @param name The target variable name token.
 * @param expression The assigned expression.
 */
public record AssignExprNode(Token type, Token name, ExpressionNode expression) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
