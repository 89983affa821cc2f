package org.metricshub.dagalloc.intermediate;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DagAlloc
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered three-address code produced for one DAG, with the parallel list of
 * allocation steps (one per instruction, in emission order).
 * <p>
 * The value of the whole expression is held by {@link #getResult()} once the
 * last instruction has run. For an expression made of a single leaf there are
 * no instructions and the result is that leaf.
 */
public class InstructionList {

	private final List<Instruction> queue = new ArrayList<Instruction>();

	private final List<String> steps = new ArrayList<String>();

	private Operand result;

	/**
	 * Appends an instruction and the step describing it.
	 *
	 * @param instruction the instruction
	 * @param step human-readable description of the allocation decision
	 */
	public void add(Instruction instruction, String step) {
		queue.add(instruction);
		steps.add(step);
	}

	public int size() {
		return queue.size();
	}

	public boolean isEmpty() {
		return queue.isEmpty();
	}

	public Instruction get(int index) {
		return queue.get(index);
	}

	/**
	 * @return unmodifiable view of the instructions
	 */
	public List<Instruction> getInstructions() {
		return Collections.unmodifiableList(queue);
	}

	/**
	 * @return unmodifiable view of the steps
	 */
	public List<String> getSteps() {
		return Collections.unmodifiableList(steps);
	}

	/**
	 * @return the instructions in their textual form
	 */
	public List<String> toStrings() {
		List<String> code = new ArrayList<String>(queue.size());
		for (Instruction instruction : queue) {
			code.add(instruction.toString());
		}
		return code;
	}

	/**
	 * @return where the value of the expression ends up
	 */
	public Operand getResult() {
		return result;
	}

	public void setResult(Operand result) {
		this.result = result;
	}

	/**
	 * Prints the instructions, one per line, to the specified stream.
	 *
	 * @param ps the stream
	 */
	public void dump(PrintStream ps) {
		for (int i = 0; i < queue.size(); i++) {
			ps.println(i + " : " + queue.get(i) + "    ; " + steps.get(i));
		}
		ps.println("result in " + result);
	}
}
