package org.minicc.compiler.frontend;

import org.minicc.compiler.diagnostics.DiagnosticsEngine;
import org.minicc.compiler.frontend.irgen.IrConverterRegistry;
import org.minicc.compiler.frontend.irgen.IrGenerator;
import org.minicc.compiler.frontend.lexer.LexResult;
import org.minicc.compiler.frontend.lexer.Lexer;
import org.minicc.compiler.frontend.lexer.Token;
import org.minicc.compiler.frontend.parser.Parser;
import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.ir.IrProgram;
import org.minicc.junit.extensions.logging.ExpectLog;
import org.minicc.junit.extensions.logging.LogLevel;
import org.minicc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link IrGenerator} and its converter registry.
 */
@ExtendWith(LogWatchExtension.class)
public class IrGeneratorTest {

    private static List<StatementNode> parse(String source) {
        List<Token> tokens = ((LexResult.Ok) new Lexer(source).tokenize()).tokens();
        return new Parser(tokens, new DiagnosticsEngine()).parse();
    }

    private static List<String> generate(String source) {
        return new IrGenerator(IrConverterRegistry.initializeWithDefaults()).generate(parse(source)).lines();
    }

    /**
     * Verifies the lowering of a nested expression into temporaries in post-order.
     */
    @Test
    @Tag("unit")
    void testNestedExpressionIsLoweredPostOrder() {
        // Act
        List<String> ir = generate("int x = 2 + 3 * 4;");

        // Assert
        assertThat(ir).containsExactly(
                "int x",
                "t1 = 3 * 4",
                "t2 = 2 + t1",
                "x = t2");
    }

    @Test
    @Tag("unit")
    void testDeclarationsIncludeAndPrintf() {
        List<String> ir = generate("#include <stdio.h>\nint main() {\n  int arr[10];\n  printf(\"hi\");\n}");

        assertThat(ir).containsExactly(
                "#include <stdio.h>",
                "int arr[10]",
                "print \"hi\"");
    }

    @Test
    @Tag("unit")
    void testLeafAssignmentUsesNoTemporary() {
        assertThat(generate("int x = 5;")).containsExactly("int x", "x = 5");
    }

    @Test
    @Tag("unit")
    void testParenthesizedExpression() {
        assertThat(generate("int x = (a + b) * (c - d);")).containsExactly(
                "int x",
                "t1 = a + b",
                "t2 = c - d",
                "t3 = t1 * t2",
                "x = t3");
    }

    /**
     * Verifies that temporaries keep counting across statements of one run.
     */
    @Test
    @Tag("unit")
    void testTemporariesAreNotReusedWithinRun() {
        assertThat(generate("int x = 1 + 2; int y = x * 3;")).containsExactly(
                "int x",
                "t1 = 1 + 2",
                "x = t1",
                "int y",
                "t2 = x * 3",
                "y = t2");
    }

    /**
     * Verifies that a generator instance starts numbering temporaries at t1 on every call.
     */
    @Test
    @Tag("unit")
    void testTemporaryCounterResetsPerRun() {
        // Arrange
        IrGenerator generator = new IrGenerator(IrConverterRegistry.initializeWithDefaults());
        List<StatementNode> ast = parse("int x = 1 + 2;");

        // Act
        IrProgram first = generator.generate(ast);
        IrProgram second = generator.generate(ast);

        // Assert
        assertThat(second).isEqualTo(first);
        assertThat(second.lines()).contains("t1 = 1 + 2");
    }

    @Test
    @Tag("unit")
    void testUndeclaredOperandIsEmittedVerbatim() {
        assertThat(generate("int y = z + 1;")).containsExactly("int y", "t1 = z + 1", "y = t1");
    }

    /**
     * Verifies that a long left-deep chain is lowered without recursion and keeps
     * allocating temporaries in evaluation order.
     */
    @Test
    @Tag("unit")
    void testLongOperatorChainIsLowered() {
        List<String> ir = generate("int x = 1" + "+1".repeat(30000) + ";");

        assertThat(ir).hasSize(30002);
        assertThat(ir.get(1)).isEqualTo("t1 = 1 + 1");
        assertThat(ir.get(2)).isEqualTo("t2 = t1 + 1");
        assertThat(ir.get(30000)).isEqualTo("t30000 = t29999 + 1");
        assertThat(ir.get(30001)).isEqualTo("x = t30000");
    }

    @Test
    @Tag("unit")
    void testRightNestedOperandsAreLoweredLeftFirst() {
        assertThat(generate("int x = a - (b - (c - d));")).containsExactly(
                "int x",
                "t1 = c - d",
                "t2 = b - t1",
                "t3 = a - t2",
                "x = t3");
    }

    /**
     * Verifies that a node without a registered converter emits nothing and is logged.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No IR converter registered for node type DeclareNode")
    void testUnregisteredNodeFallsBackToDefaultConverter() {
        // Arrange
        IrConverterRegistry registry = IrConverterRegistry.initializeWithDefaults();
        IrConverterRegistry empty = IrConverterRegistry.initialize(registry.defaultConverter());

        // Act
        IrProgram program = new IrGenerator(empty).generate(parse("int x;"));

        // Assert
        assertThat(program.lines()).isEmpty();
    }

    /**
     * Verifies that every statement node type has a converter in the default registry.
     */
    @Test
    @Tag("unit")
    void testEveryStatementTypeHasConverter() {
        IrConverterRegistry registry = IrConverterRegistry.initializeWithDefaults();

        assertThat(Arrays.asList(StatementNode.class.getPermittedSubclasses()))
                .isNotEmpty()
                .allSatisfy(type -> assertThat(registry.get(type.asSubclass(StatementNode.class))).isPresent());
    }
}
