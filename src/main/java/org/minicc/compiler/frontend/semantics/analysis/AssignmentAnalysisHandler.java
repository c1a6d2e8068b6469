package org.minicc.compiler.frontend.semantics.analysis;

import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.parser.ast.AssignExprNode;
import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.frontend.semantics.SymbolTable;

/**
 * Handles {@link AssignExprNode}s by checking that the assignment target has been declared.
 */
public class AssignmentAnalysisHandler implements IAnalysisHandler {
    /**
     * {@inheritDoc}
     * <p>
     * The expression operands are not checked.
     */
    @Override
    public void analyze(StatementNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (node instanceof AssignExprNode assign && !symbolTable.isDeclared(assign.name().text())) {
            diagnostics.reportSemanticError("Undeclared variable '" + assign.name().text() + "'", assign.name().line());
        }
    }
}
