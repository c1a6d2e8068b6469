package org.minicc.compiler.frontend.irgen.converters;

import org.minicc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.minicc.compiler.frontend.irgen.IrGenContext;
import org.minicc.compiler.frontend.parser.ast.IncludeNode;

/**
 * Emits an include line verbatim.
 */
public final class IncludeNodeConverter implements IAstNodeToIrConverter<IncludeNode> {

	@Override
	public void convert(IncludeNode node, IrGenContext ctx) {
		ctx.emit(node.include().text());
	}
}
