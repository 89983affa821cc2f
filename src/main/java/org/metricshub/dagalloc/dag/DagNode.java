package org.metricshub.dagalloc.dag;

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

import java.util.Arrays;
import org.metricshub.dagalloc.intermediate.Opcode;

/**
 * A node of a {@link Dag}. Nodes are owned by their arena and refer to their
 * operands by arena index only.
 * <p>
 * {@link #getParentCount()} counts operand references to this node: a node used
 * in both operand slots of the same parent is counted twice, which is what the
 * allocator needs to know when the last use has been consumed.
 */
public final class DagNode {

	private final int id;
	private final NodeKind kind;
	private final Opcode opcode;
	private final String text;
	private final int[] operands;

	private int label;
	private int parentCount;
	private String register;

	DagNode(int id, NodeKind kind, Opcode opcode, String text, int[] operands) {
		this.id = id;
		this.kind = kind;
		this.opcode = opcode;
		this.text = text;
		this.operands = operands.clone();
	}

	/**
	 * @return the arena index of this node
	 */
	public int getId() {
		return id;
	}

	public NodeKind getKind() {
		return kind;
	}

	public boolean isLeaf() {
		return kind.isLeaf();
	}

	/**
	 * @return the operator, or {@code null} for a leaf
	 */
	public Opcode getOpcode() {
		return opcode;
	}

	/**
	 * @return the variable name or constant value, or the operator symbol for an operation
	 */
	public String getText() {
		return text;
	}

	public int getOperandCount() {
		return operands.length;
	}

	/**
	 * @param position operand slot, 0 being the leftmost
	 * @return arena index of the operand
	 */
	public int getOperand(int position) {
		return operands[position];
	}

	public int[] getOperands() {
		return operands.clone();
	}

	/**
	 * @return the Sethi-Ullman label
	 */
	public int getLabel() {
		return label;
	}

	void setLabel(int label) {
		this.label = label;
	}

	public int getParentCount() {
		return parentCount;
	}

	void incrementParentCount() {
		parentCount++;
	}

	void setParentCount(int parentCount) {
		this.parentCount = parentCount;
	}

	/**
	 * @return the register assigned by the code generator, or {@code null}
	 */
	public String getRegister() {
		return register;
	}

	public void setRegister(String register) {
		this.register = register;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append('#').append(id).append(' ').append(kind).append(' ').append(text);
		if (operands.length > 0) {
			sb.append(' ').append(Arrays.toString(operands));
		}
		sb.append(" label=").append(label).append(" parents=").append(parentCount);
		if (register != null) {
			sb.append(" reg=").append(register);
		}
		return sb.toString();
	}
}
