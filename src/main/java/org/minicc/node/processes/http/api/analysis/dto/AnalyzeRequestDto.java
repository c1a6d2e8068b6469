package org.minicc.node.processes.http.api.analysis.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Request body of {@code POST /analyze}.
 *
 * @param code The source text; a missing value means empty source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeRequestDto(String code) {

    /**
     * @return The source text, never null.
     */
    public String codeOrEmpty() {
        return code == null ? "" : code;
    }
}
