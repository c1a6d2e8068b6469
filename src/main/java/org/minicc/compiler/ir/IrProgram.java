package org.minicc.compiler.ir;

import java.util.List;

/**
 * Linear three-address code. The order of lines is the emission order
 * of the IR generator and is part of the result contract.
 *
 * @param lines The emitted code lines.
 */
public record IrProgram(List<String> lines) {

	public IrProgram {
		lines = List.copyOf(lines);
	}
}
