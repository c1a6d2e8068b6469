package org.minicc.compiler.frontend.irgen.converters;

import org.minicc.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.minicc.compiler.frontend.irgen.IrGenContext;
import org.minicc.compiler.frontend.parser.ast.AssignExprNode;
import org.minicc.compiler.frontend.parser.ast.BinOpNode;
import org.minicc.compiler.frontend.parser.ast.ExpressionNode;
import org.minicc.compiler.frontend.parser.ast.LeafNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Converts {@link AssignExprNode} into three-address code.
 * <p>
 * The expression is lowered post-order: a leaf yields its own text and emits nothing,
 * a binary operation lowers both operands, allocates a temporary and emits
 * {@code <temp> = <left> <op> <right>}. The assignment {@code <name> = <value>} comes last.
 * <p>
 * Operator chains produce left-deep trees as long as the source. The traversal keeps
 * its own work stack.
 */
public final class AssignExprNodeConverter implements IAstNodeToIrConverter<AssignExprNode> {

	@Override
	public void convert(AssignExprNode node, IrGenContext ctx) {
		String value = lower(node.expression(), ctx);
		ctx.emit(node.name().text() + " = " + value);
	}

	private String lower(ExpressionNode root, IrGenContext ctx) {
		Deque<Frame> work = new ArrayDeque<>();
		Deque<String> values = new ArrayDeque<>();
		work.push(new Frame(root, false));

		while (!work.isEmpty()) {
			Frame frame = work.pop();
			if (frame.node() instanceof LeafNode leaf) {
				values.push(leaf.token().text());
				continue;
			}
			BinOpNode binOp = (BinOpNode) frame.node();
			if (!frame.operandsDone()) {
				// Left is pushed last so it is lowered first.
				work.push(new Frame(binOp, true));
				work.push(new Frame(binOp.right(), false));
				work.push(new Frame(binOp.left(), false));
			} else {
				String right = values.pop();
				String left = values.pop();
				String temp = ctx.newTemp();
				ctx.emit(temp + " = " + left + " " + binOp.operator().text() + " " + right);
				values.push(temp);
			}
		}
		return values.pop();
	}

	private record Frame(ExpressionNode node, boolean operandsDone) {}
}
