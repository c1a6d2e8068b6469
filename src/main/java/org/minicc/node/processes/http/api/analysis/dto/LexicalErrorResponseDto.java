package org.minicc.node.processes.http.api.analysis.dto;

/**
 * Response body when the source could not be tokenized.
 *
 * @param error The lexical error message, e.g. {@code Unexpected character: @}.
 */
public record LexicalErrorResponseDto(String error) {}
