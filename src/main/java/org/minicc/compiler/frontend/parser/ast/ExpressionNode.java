package org.minicc.compiler.frontend.parser.ast;

/**
 * An arithmetic expression on the right-hand side of an assignment.
 */
public sealed interface ExpressionNode extends AstNode permits LeafNode, BinOpNode {
}
