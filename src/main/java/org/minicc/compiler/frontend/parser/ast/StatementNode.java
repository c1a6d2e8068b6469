package org.minicc.compiler.frontend.parser.ast;

/**
 * A top-level statement produced by the parser.
 */
public sealed interface StatementNode extends AstNode
        permits IncludeNode, DeclareNode, DeclareArrayNode, AssignExprNode, PrintfNode {
}
