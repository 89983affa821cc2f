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

import org.metricshub.dagalloc.util.DagAllocLogger;
import org.slf4j.Logger;

/**
 * Computes the Sethi-Ullman label of every node of a {@link Dag}: the number of
 * registers needed to evaluate the node's subexpression when the heavier operand
 * is always evaluated first.
 * <p>
 * A leaf costs one register in the leftmost (or sole) operand slot, where it
 * must be resident, and nothing in the right slot, where the instruction reads
 * it from memory. That cost is applied at each use site. The label stored on a
 * leaf is the cost in its first-encountered parent.
 * <p>
 * An operation with operand costs L1 and L2 is labeled <code>max(L1, L2)</code>
 * if they differ and <code>L1 + 1</code> if they are equal. A unary operation
 * takes the cost of its operand. A shared operation node is labeled once and
 * every parent sees that same label.
 */
public class SethiUllmanLabeler {

	private static final Logger LOG = DagAllocLogger.getLogger(SethiUllmanLabeler.class);

	/**
	 * Labels every node in place, in a single pass over the arena.
	 *
	 * @param dag the DAG
	 * @return the same DAG
	 */
	public Dag label(Dag dag) {
		int size = dag.size();
		boolean[] leafLabeled = new boolean[size];

		// arena order is dependency order
		for (int id = 0; id < size; id++) {
			DagNode node = dag.get(id);
			if (node.isLeaf()) {
				continue;
			}
			for (int position = 0; position < node.getOperandCount(); position++) {
				DagNode operand = dag.get(node.getOperand(position));
				if (operand.isLeaf() && !leafLabeled[operand.getId()]) {
					operand.setLabel(leafCost(position));
					leafLabeled[operand.getId()] = true;
				}
			}
			node.setLabel(operationLabel(dag, node));
		}
		DagNode root = dag.getRootNode();
		if (root.isLeaf()) {
			// a lone leaf still has to be loaded to deliver the value
			root.setLabel(1);
		}
		LOG.debug("Labeled {} nodes, root label {}", size, root.getLabel());
		return dag;
	}

	/**
	 * Labels a single operation node whose operands are already labeled. Used
	 * while an arena is still being populated.
	 *
	 * @param dag the DAG
	 * @param id arena index of an operation node
	 * @return the label
	 */
	public int labelNode(Dag dag, int id) {
		DagNode node = dag.get(id);
		if (node.isLeaf()) {
			throw new IllegalArgumentException("#" + id + " is a leaf");
		}
		node.setLabel(operationLabel(dag, node));
		return node.getLabel();
	}

	/**
	 * Label of an operation node from the labels of its operands, which must
	 * already be computed.
	 *
	 * @param dag the DAG
	 * @param node an operation node
	 * @return the label
	 */
	public static int operationLabel(Dag dag, DagNode node) {
		if (node.getOperandCount() == 1) {
			return cost(dag, node.getOperand(0), 0);
		}
		return combine(cost(dag, node.getOperand(0), 0), cost(dag, node.getOperand(1), 1));
	}

	/**
	 * Register cost of using the specified node in the specified operand slot.
	 *
	 * @param dag the DAG
	 * @param operand arena index of the operand
	 * @param position operand slot, 0 being the leftmost
	 * @return the cost
	 */
	public static int cost(Dag dag, int operand, int position) {
		DagNode node = dag.get(operand);
		return node.isLeaf() ? leafCost(position) : node.getLabel();
	}

	/**
	 * @param position operand slot, 0 being the leftmost
	 * @return 1 in the leftmost slot, 0 otherwise
	 */
	public static int leafCost(int position) {
		return position == 0 ? 1 : 0;
	}

	/**
	 * Sethi-Ullman combination of two operand costs.
	 *
	 * @param left cost of the left operand
	 * @param right cost of the right operand
	 * @return the label of the binary node
	 */
	public static int combine(int left, int right) {
		return left == right ? left + 1 : Math.max(left, right);
	}
}
