package org.minicc.compiler.frontend.irgen;

import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.minicc.compiler.ir.IrProgram;

import java.util.List;

/**
 * Phase: Generates three-address code from the AST by delegating to converters
 * resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

	private final IrConverterRegistry registry;

	/**
	 * Creates a new IR generator with a prepared registry.
	 *
	 * @param registry The converter registry.
	 */
	public IrGenerator(IrConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Generates the linear program by dispatching each statement to a converter.
	 * Every call uses a fresh {@link IrGenContext}.
	 *
	 * @param ast The statements produced by the parser.
	 * @return The generated program.
	 */
	public IrProgram generate(List<StatementNode> ast) {
		IrGenContext ctx = new IrGenContext();
		for (StatementNode node : ast) {
			registry.resolve(node).convert(node, ctx);
		}
		return ctx.build();
	}
}
