package org.minicc.cli.rendering;

import org.minicc.compiler.api.AnalysisResult;
import org.minicc.compiler.diagnostics.Diagnostic;
import org.minicc.compiler.frontend.lexer.Token;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.Function;

/**
 * Renders an analysis result as four plain-text sections, the way the browser UI lays them out.
 * Empty sections read {@code None}.
 */
public final class AnalysisReportRenderer {

    private final PrintWriter out;

    public AnalysisReportRenderer(final PrintWriter out) {
        this.out = out;
    }

    public void render(final AnalysisResult.Success result) {
        section("Tokens", result.tokens(), AnalysisReportRenderer::formatToken);
        section("Syntax Errors", result.syntaxErrors(), message -> Diagnostic.Stage.SYNTAX.label() + ": " + message);
        section("Semantic Errors", result.semanticErrors(), message -> Diagnostic.Stage.SEMANTIC.label() + ": " + message);
        section("Intermediate Code", result.intermediateCode(), Function.identity());
        out.flush();
    }

    static String formatToken(final Token token) {
        return token.type().name() + ": " + token.text();
    }

    private <T> void section(final String title, final List<T> items, final Function<T, String> format) {
        out.println(title + ":");
        if (items.isEmpty()) {
            out.println("None");
        } else {
            items.forEach(item -> out.println(format.apply(item)));
        }
        out.println();
    }
}
