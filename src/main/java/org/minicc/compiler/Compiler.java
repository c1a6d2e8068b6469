package org.minicc.compiler;

import org.minicc.compiler.api.AnalysisResult;
import org.minicc.compiler.api.ICompiler;
import org.minicc.compiler.diagnostics.Diagnostic;
import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.irgen.IrConverterRegistry;
import org.minicc.compiler.frontend.irgen.IrGenerator;
import org.minicc.compiler.frontend.lexer.LexResult;
import org.minicc.compiler.frontend.lexer.Lexer;
import org.minicc.compiler.frontend.lexer.Token;
import org.minicc.compiler.frontend.parser.Parser;
import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.frontend.semantics.SemanticAnalyzer;
import org.minicc.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main pipeline implementation. It orchestrates one analysis run from source text
 * to three-address code.
 * <p>
 * Every call creates fresh stage instances and a fresh {@link DiagnosticsEngine}, so a
 * single instance holds no mutable state and can be shared between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    /**
     * {@inheritDoc}
     * <p>
     * The semantic and IR phases run even if the parser reported errors; they work on
     * whatever statements were recovered.
     */
    @Override
    public AnalysisResult analyze(String source) {
        // Phase 1: Lexing
        LexResult lexResult = new Lexer(source).tokenize();
        if (lexResult instanceof LexResult.Err err) {
            log.debug("Lexing failed: {}", err.error());
            return new AnalysisResult.Failure(err.error().message());
        }
        List<Token> tokens = ((LexResult.Ok) lexResult).tokens();
        log.debug("Lexed {} tokens", tokens.size());

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, diagnostics);
        List<StatementNode> ast = parser.parse();
        log.debug("Parsed {} statements", ast.size());

        // Phase 3: Semantic Analysis
        new SemanticAnalyzer(diagnostics).analyze(ast);

        // Phase 4: IR Generation
        IrProgram program = new IrGenerator(IrConverterRegistry.initializeWithDefaults()).generate(ast);
        log.debug("Generated {} IR lines", program.lines().size());

        if (diagnostics.hasErrors()) {
            log.debug("Diagnostics:\n{}", diagnostics.summary());
        }

        return new AnalysisResult.Success(
                tokens,
                diagnostics.messages(Diagnostic.Stage.SYNTAX),
                diagnostics.messages(Diagnostic.Stage.SEMANTIC),
                program.lines());
    }
}
