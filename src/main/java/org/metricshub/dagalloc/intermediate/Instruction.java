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

import java.util.Objects;

/**
 * A single three-address instruction: one operator, one or two source
 * operands and a destination register.
 * <p>
 * Printed as <code>Rd = Ra op Rb</code>, <code>Rd = a op Rb</code>,
 * <code>Rd = Ra op value</code> or <code>Rd = -Ra</code>.
 *
 * @see InstructionList
 */
public final class Instruction {

	private final String destination;
	private final Opcode opcode;
	private final Operand left;
	private final Operand right;
	private final int nodeId;

	/**
	 * @param destination register receiving the result
	 * @param opcode operator
	 * @param left first (or sole) operand
	 * @param right second operand, {@code null} for a unary operator
	 * @param nodeId id of the DAG node this instruction computes
	 */
	public Instruction(String destination, Opcode opcode, Operand left, Operand right, int nodeId) {
		this.destination = Objects.requireNonNull(destination);
		this.opcode = Objects.requireNonNull(opcode);
		this.left = Objects.requireNonNull(left);
		if ((right == null) != (opcode.arity() == 1)) {
			throw new IllegalArgumentException(opcode + " expects " + opcode.arity() + " operand(s)");
		}
		this.right = right;
		this.nodeId = nodeId;
	}

	public String getDestination() {
		return destination;
	}

	public Opcode getOpcode() {
		return opcode;
	}

	public Operand getLeft() {
		return left;
	}

	/**
	 * @return the second operand, or {@code null} for a unary operator
	 */
	public Operand getRight() {
		return right;
	}

	public int getNodeId() {
		return nodeId;
	}

	@Override
	public String toString() {
		if (right == null) {
			return destination + " = " + opcode.symbol() + left;
		}
		return destination + " = " + left + " " + opcode.symbol() + " " + right;
	}
}
