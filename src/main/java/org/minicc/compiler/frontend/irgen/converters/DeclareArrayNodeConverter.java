package org.minicc.compiler.frontend.irgen.converters;

import org.minicc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.minicc.compiler.frontend.irgen.IrGenContext;
import org.minicc.compiler.frontend.parser.ast.DeclareArrayNode;

/**
 * Converts {@link DeclareArrayNode} into {@code <type> <name>[<size>]}.
 */
public final class DeclareArrayNodeConverter implements IAstNodeToIrConverter<DeclareArrayNode> {

	@Override
	public void convert(DeclareArrayNode node, IrGenContext ctx) {
		ctx.emit(node.type().text() + " " + node.name().text() + "[" + node.size().text() + "]");
	}
}
