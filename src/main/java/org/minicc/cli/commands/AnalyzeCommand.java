package org.minicc.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.minicc.cli.CommandLineInterface;
import org.minicc.cli.rendering.AnalysisReportRenderer;
import org.minicc.compiler.Compiler;
import org.minicc.compiler.api.AnalysisResult;
import org.minicc.compiler.api.ICompiler;
import org.minicc.node.processes.http.api.analysis.dto.AnalysisResponseDto;
import org.minicc.node.processes.http.api.analysis.dto.LexicalErrorResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "analyze",
    description = "Analyzes a source file and prints its tokens, errors and intermediate code.",
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        "0:Analysis completed without errors",
        "1:Syntax or semantic errors were reported",
        "2:The source could not be tokenized",
        "3:The source could not be read"
    }
)
public class AnalyzeCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_LEXICAL_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
        description = "Source file to analyze; '-' or no argument reads standard input.")
    private String file;

    @Option(names = "--json", description = "Print the result as the JSON document served by the HTTP API.")
    private boolean json;

    private final ICompiler compiler = new Compiler();

    @Override
    public Integer call() throws JsonProcessingException {
        parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();

        final String source;
        try {
            source = readSource().replace("\r\n", "\n");
        } catch (IOException e) {
            LOGGER.debug("Failed to read source", e);
            spec.commandLine().getErr().println("Cannot read " + describeInput() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        final AnalysisResult result = compiler.analyze(source);
        if (result instanceof AnalysisResult.Failure failure) {
            if (json) {
                out.println(new ObjectMapper().writeValueAsString(new LexicalErrorResponseDto(failure.error())));
                out.flush();
            } else {
                spec.commandLine().getErr().println("Lexical Error: " + failure.error());
            }
            return EXIT_LEXICAL_ERROR;
        }

        final AnalysisResult.Success success = (AnalysisResult.Success) result;
        if (json) {
            out.println(new ObjectMapper().writeValueAsString(AnalysisResponseDto.from(success)));
            out.flush();
        } else {
            new AnalysisReportRenderer(out).render(success);
        }
        return success.hasErrors() ? EXIT_DIAGNOSTICS : EXIT_OK;
    }

    private String readSource() throws IOException {
        if (isStdin()) {
            final InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    }

    private boolean isStdin() {
        return file == null || "-".equals(file);
    }

    private String describeInput() {
        return isStdin() ? "standard input" : file;
    }
}
