package org.minicc.compiler.frontend.irgen;

import org.minicc.compiler.frontend.parser.ast.StatementNode;

/**
 * Converts a specific statement node type into zero or more IR lines.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete statement node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends StatementNode> {

	/**
	 * Converts the given node into IR and emits results via the provided context.
	 *
	 * @param node The node to convert.
	 * @param ctx  The IR generation context used to emit lines and allocate temporaries.
	 */
	void convert(T node, IrGenContext ctx);
}
