package org.minicc.compiler.api;

import org.minicc.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The result of one analysis run.
 */
public sealed interface AnalysisResult permits AnalysisResult.Success, AnalysisResult.Failure {

    /**
     * All four stages ran. Syntax and semantic problems do not prevent success; they are
     * reported in the error lists.
     *
     * @param tokens The lexer output.
     * @param syntaxErrors The parser messages, in reporting order and without a stage prefix.
     * @param semanticErrors The semantic analyzer messages, in reporting order and without a stage prefix.
     * @param intermediateCode The generated three-address code lines.
     */
    record Success(
            List<Token> tokens,
            List<String> syntaxErrors,
            List<String> semanticErrors,
            List<String> intermediateCode
    ) implements AnalysisResult {
        public Success {
            tokens = List.copyOf(tokens);
            syntaxErrors = List.copyOf(syntaxErrors);
            semanticErrors = List.copyOf(semanticErrors);
            intermediateCode = List.copyOf(intermediateCode);
        }

        /**
         * @return true if either error list is non-empty.
         */
        public boolean hasErrors() {
            return !syntaxErrors.isEmpty() || !semanticErrors.isEmpty();
        }
    }

    /**
     * Lexing failed and no later stage ran.
     *
     * @param error The lexical error message, e.g. {@code Unexpected character: @}.
     */
    record Failure(String error) implements AnalysisResult {}
}
