package org.minicc.compiler.frontend.irgen;

import org.minicc.compiler.frontend.parser.ast.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default/fallback converter used when no specific converter is registered.
 * It emits nothing and logs a warning.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<StatementNode> {

	private static final Logger log = LoggerFactory.getLogger(DefaultAstNodeToIrConverter.class);

	@Override
	public void convert(StatementNode node, IrGenContext ctx) {
		log.warn("No IR converter registered for node type {}", node.getClass().getSimpleName());
	}
}
