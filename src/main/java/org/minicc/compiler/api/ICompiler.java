package org.minicc.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the analysis pipeline.
 */
public interface ICompiler {

    /**
     * Runs lexing, parsing, semantic analysis and IR generation on the given source.
     *
     * @param source The complete source text.
     * @return A {@link AnalysisResult.Success} with the four result lists, or a
     *         {@link AnalysisResult.Failure} if the source could not be tokenized.
     */
    AnalysisResult analyze(String source);

    /**
     * Analyzes the source code from a file.
     * @param file The path to the source file, read as UTF-8.
     * @return The analysis result.
     * @throws IOException if the file cannot be read.
     */
    default AnalysisResult analyze(Path file) throws IOException {
        return analyze(Files.readString(file, StandardCharsets.UTF_8));
    }
}
