package org.minicc.compiler.diagnostics;

/**
 * Represents a single diagnostic message that occurs during analysis.
 *
 * @param stage The stage that reported the diagnostic.
 * @param message The diagnostic message.
 * @param line The line number of the issue, or 0 if it was reported at the end of input.
 */
public record Diagnostic(
        Stage stage,
        String message,
        int line
) {
    /**
     * The analysis stage a diagnostic belongs to.
     */
    public enum Stage {
        /** Reported by the parser. */
        SYNTAX("Syntax Error"),
        /** Reported by the semantic analyzer. */
        SEMANTIC("Semantic Error");

        private final String label;

        Stage(String label) {
            this.label = label;
        }

        /**
         * @return The human-readable prefix used when rendering diagnostics of this stage.
         */
        public String label() {
            return label;
        }
    }

    @Override
    public String toString() {
        return stage.label() + ": " + message;
    }
}
