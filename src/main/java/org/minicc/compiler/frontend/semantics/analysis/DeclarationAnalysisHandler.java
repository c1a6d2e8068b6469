package org.minicc.compiler.frontend.semantics.analysis;

import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.lexer.Token;
import org.minicc.compiler.frontend.parser.ast.DeclareArrayNode;
import org.minicc.compiler.frontend.parser.ast.DeclareNode;
import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.frontend.semantics.SymbolTable;

/**
 * Handles {@link DeclareNode}s and {@link DeclareArrayNode}s by entering the
 * declared name into the symbol table. Scalars and arrays share one namespace.
 */
public class DeclarationAnalysisHandler implements IAnalysisHandler {
    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(StatementNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Token name;
        if (node instanceof DeclareNode declare) {
            name = declare.name();
        } else if (node instanceof DeclareArrayNode declareArray) {
            name = declareArray.name();
        } else {
            return;
        }

        if (!symbolTable.declare(name.text())) {
            diagnostics.reportSemanticError("'" + name.text() + "' redeclared", name.line());
        }
    }
}
