package org.minicc.node.processes.http.api.analysis.dto;

import org.minicc.compiler.api.AnalysisResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response body of a successful analysis.
 *
 * @param tokens           The lexer output.
 * @param syntaxErrors     Parser messages.
 * @param semanticErrors   Semantic analyzer messages.
 * @param intermediateCode Generated three-address code.
 */
public record AnalysisResponseDto(
    List<TokenDto> tokens,
    List<String> syntaxErrors,
    List<String> semanticErrors,
    List<String> intermediateCode
) {
    /**
     * Creates the response from a successful pipeline run.
     *
     * @param success The pipeline result.
     * @return The response DTO.
     */
    public static AnalysisResponseDto from(final AnalysisResult.Success success) {
        return new AnalysisResponseDto(
            success.tokens().stream().map(TokenDto::from).collect(Collectors.toList()),
            success.syntaxErrors(),
            success.semanticErrors(),
            success.intermediateCode()
        );
    }
}
