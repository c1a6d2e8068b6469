package org.minicc.compiler.frontend.irgen.converters;

import org.minicc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.minicc.compiler.frontend.irgen.IrGenContext;
import org.minicc.compiler.frontend.parser.ast.PrintfNode;

/**
 * Converts {@link PrintfNode} into {@code print "<text>"}, keeping the quotes.
 */
public final class PrintfNodeConverter implements IAstNodeToIrConverter<PrintfNode> {

	@Override
	public void convert(PrintfNode node, IrGenContext ctx) {
		ctx.emit("print " + node.string().text());
	}
}
