package org.minicc.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the diagnostic messages reported during one analysis run.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, analyzer).
 * Instances are not shared between runs.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a syntax error.
     *
     * @param message The error message.
     * @param line    The line number of the error.
     */
    public void reportSyntaxError(String message, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Stage.SYNTAX, message, line));
    }

    /**
     * Reports a semantic error.
     *
     * @param message The error message.
     * @param line    The line number of the error.
     */
    public void reportSemanticError(String message, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Stage.SEMANTIC, message, line));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one diagnostic exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the bare messages of one stage, in reporting order.
     *
     * @param stage The stage to filter by.
     * @return The messages, without the stage prefix.
     */
    public List<String> messages(Diagnostic.Stage stage) {
        return diagnostics.stream()
                .filter(d -> d.stage() == stage)
                .map(Diagnostic::message)
                .collect(Collectors.toList());
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
