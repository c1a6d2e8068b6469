package org.minicc.compiler.frontend.semantics.analysis;

import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of statement node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single statement.
     * @param node The node to analyze.
     * @param symbolTable The symbol table of the current run.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(StatementNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
