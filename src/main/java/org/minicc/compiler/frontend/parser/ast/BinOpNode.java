package org.minicc.compiler.frontend.parser.ast;

import org.minicc.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary arithmetic operation. Chains are left-associative, so the left operand
 * may itself be a {@code BinOpNode} of the same precedence.
 *
 * @param operator The OP token, one of {@code + - * /}.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinOpNode(Token operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
