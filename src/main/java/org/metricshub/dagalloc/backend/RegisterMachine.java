package org.metricshub.dagalloc.backend;

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

import java.util.HashMap;
import java.util.Map;
import org.metricshub.dagalloc.intermediate.Instruction;
import org.metricshub.dagalloc.intermediate.InstructionList;
import org.metricshub.dagalloc.intermediate.Operand;

/**
 * Executes three-address code on a machine with as many registers as the code
 * names. Variables are read from the bindings supplied by the caller, which
 * play the part of memory.
 * <p>
 * Each instruction reads both operands before writing its destination, so an
 * instruction may overwrite one of its own source registers.
 */
public class RegisterMachine {

	private final Map<String, Double> memory;

	private final Map<String, Double> registers = new HashMap<String, Double>();

	/**
	 * @param variables variable bindings
	 */
	public RegisterMachine(Map<String, Double> variables) {
		this.memory = new HashMap<String, Double>(variables);
	}

	/**
	 * Runs the code and returns the value of the expression.
	 *
	 * @param code the instructions
	 * @return the value left in the result location
	 * @throws IllegalArgumentException when a variable is not bound
	 * @throws IllegalStateException when a register is read before being written
	 */
	public double execute(InstructionList code) {
		registers.clear();
		for (int i = 0; i < code.size(); i++) {
			Instruction instruction = code.get(i);
			double x = read(instruction.getLeft());
			double value;
			if (instruction.getRight() == null) {
				value = instruction.getOpcode().apply(x);
			} else {
				value = instruction.getOpcode().apply(x, read(instruction.getRight()));
			}
			registers.put(instruction.getDestination(), value);
		}
		if (code.getResult() == null) {
			throw new IllegalStateException("Code has no result location");
		}
		return read(code.getResult());
	}

	/**
	 * @param register register name
	 * @return the value last written to the register, or {@code null}
	 */
	public Double getRegister(String register) {
		return registers.get(register);
	}

	private double read(Operand operand) {
		if (operand.isRegister()) {
			Double value = registers.get(operand.getRegister());
			if (value == null) {
				throw new IllegalStateException("Register " + operand.getRegister() + " read before being written");
			}
			return value;
		}
		if (operand.isConstant()) {
			return Double.parseDouble(operand.getLeafText());
		}
		Double value = memory.get(operand.getLeafText());
		if (value == null) {
			throw new IllegalArgumentException("Variable '" + operand.getLeafText() + "' is not bound");
		}
		return value;
	}
}
