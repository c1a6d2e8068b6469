package org.minicc.node.processes.http.api.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.minicc.compiler.api.AnalysisResult;
import org.minicc.compiler.api.ICompiler;
import org.minicc.node.processes.http.AbstractController;
import org.minicc.node.processes.http.api.analysis.dto.AnalysisResponseDto;
import org.minicc.node.processes.http.api.analysis.dto.AnalyzeRequestDto;
import org.minicc.node.processes.http.api.analysis.dto.ErrorResponseDto;
import org.minicc.node.processes.http.api.analysis.dto.LexicalErrorResponseDto;
import org.minicc.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes the analysis pipeline over HTTP.
 * <ul>
 *     <li>{@code POST {basePath}/analyze} with {@code {"code": "..."}}</li>
 * </ul>
 * A lexical failure is not an HTTP error: it is answered with 200 and
 * {@code {"error": "..."}}, which the browser UI shows as an alert.
 */
public class AnalysisController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisController.class);
    private static final int DEFAULT_MAX_SOURCE_LENGTH = 65536;

    private final ICompiler compiler;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final int maxSourceLength;

    /**
     * @param registry The service registry; must contain an {@link ICompiler}.
     * @param options  Supports {@code maxSourceLength} (characters, default 65536).
     */
    public AnalysisController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.compiler = registry.get(ICompiler.class);
        this.maxSourceLength = options.hasPath("maxSourceLength")
            ? options.getInt("maxSourceLength")
            : DEFAULT_MAX_SOURCE_LENGTH;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String prefix = basePath.endsWith("/") ? basePath : basePath + "/";
        app.post(prefix + "analyze", this::handleAnalyze);

        app.exception(SourceTooLargeException.class, (e, ctx) -> {
            LOGGER.warn("Rejected request {}: {}", ctx.path(), e.getMessage());
            ctx.status(413).json(ErrorResponseDto.of(413, "Content Too Large", e.getMessage()));
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.warn("Bad request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(),
                HttpStatus.BAD_REQUEST.getMessage(),
                e.getMessage()
            ));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(),
                HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                "An internal server error occurred."
            ));
        });
    }

    void handleAnalyze(final Context ctx) {
        final String source = readSource(ctx.body());
        if (source.length() > maxSourceLength) {
            throw new SourceTooLargeException(source.length(), maxSourceLength);
        }

        final AnalysisResult result = compiler.analyze(source);
        if (result instanceof AnalysisResult.Success success) {
            ctx.status(HttpStatus.OK).json(AnalysisResponseDto.from(success));
        } else {
            final AnalysisResult.Failure failure = (AnalysisResult.Failure) result;
            LOGGER.debug("Lexical error: {}", failure.error());
            ctx.status(HttpStatus.OK).json(new LexicalErrorResponseDto(failure.error()));
        }
    }

    private String readSource(final String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        final AnalyzeRequestDto request;
        try {
            request = objectMapper.readValue(body, AnalyzeRequestDto.class);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            return "";
        }
        return request.codeOrEmpty().replace("\r\n", "\n");
    }
}
