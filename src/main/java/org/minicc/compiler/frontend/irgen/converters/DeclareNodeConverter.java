package org.minicc.compiler.frontend.irgen.converters;

import org.minicc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.minicc.compiler.frontend.irgen.IrGenContext;
import org.minicc.compiler.frontend.parser.ast.DeclareNode;

/**
 * Converts {@link DeclareNode} into {@code <type> <name>}.
 */
public final class DeclareNodeConverter implements IAstNodeToIrConverter<DeclareNode> {

	@Override
	public void convert(DeclareNode node, IrGenContext ctx) {
		ctx.emit(node.type().text() + " " + node.name().text());
	}
}
