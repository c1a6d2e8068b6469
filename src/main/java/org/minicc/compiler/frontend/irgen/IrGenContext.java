package org.minicc.compiler.frontend.irgen;

import org.minicc.compiler.ir.IrProgram;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context passed to converters during one IR generation run.
 * It owns the emitted lines and the temporary counter, so temporaries are
 * numbered from {@code t1} again for every run.
 */
public final class IrGenContext {

	private final List<String> out = new ArrayList<>();
	private int tempCounter = 0;

	/**
	 * Emits a new line of code.
	 * @param line The line to append.
	 */
	public void emit(String line) {
		out.add(line);
	}

	/**
	 * Allocates a fresh temporary name. Names are never reused within a run.
	 * @return The next temporary, {@code t1}, {@code t2}, ...
	 */
	public String newTemp() {
		tempCounter++;
		return "t" + tempCounter;
	}

	/**
	 * @return The program built from the lines emitted so far.
	 */
	public IrProgram build() {
		return new IrProgram(out);
	}
}
