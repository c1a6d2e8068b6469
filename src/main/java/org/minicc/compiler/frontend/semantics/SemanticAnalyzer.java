package org.minicc.compiler.frontend.semantics;

import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.parser.ast.AssignExprNode;
import org.minicc.compiler.frontend.parser.ast.DeclareArrayNode;
import org.minicc.compiler.frontend.parser.ast.DeclareNode;
import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.frontend.semantics.analysis.AssignmentAnalysisHandler;
import org.minicc.compiler.frontend.semantics.analysis.DeclarationAnalysisHandler;
import org.minicc.compiler.frontend.semantics.analysis.IAnalysisHandler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Performs semantic analysis on the AST: tracks declared names and reports
 * redeclarations and assignments to undeclared variables.
 * It operates in one linear pass and dispatches each statement to the handler
 * registered for its node class. Statements without a handler are ignored.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable = new SymbolTable();
    private final Map<Class<? extends StatementNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer with a fresh symbol table.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        IAnalysisHandler declarations = new DeclarationAnalysisHandler();
        handlers.put(DeclareNode.class, declarations);
        handlers.put(DeclareArrayNode.class, declarations);
        handlers.put(AssignExprNode.class, new AssignmentAnalysisHandler());
    }

    /**
     * Analyzes the given statements in order.
     * <p>
     * Only the target of an assignment is checked. Identifiers used inside the
     * assigned expression are not looked up.
     *
     * @param statements The statements produced by the parser.
     */
    public void analyze(List<StatementNode> statements) {
        for (StatementNode statement : statements) {
            IAnalysisHandler handler = handlers.get(statement.getClass());
            if (handler != null) {
                handler.analyze(statement, symbolTable, diagnostics);
            }
        }
    }

    /**
     * @return The symbol table populated by {@link #analyze(List)}.
     */
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }
}
