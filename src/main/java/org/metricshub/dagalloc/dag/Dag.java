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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.dagalloc.intermediate.Opcode;

/**
 * Arena of {@link DagNode}s plus the index of the root node.
 * <p>
 * A node is only ever created from operands already in the arena, so the
 * arena order is a valid bottom-up (dependency) order and the graph cannot
 * contain a cycle. Structural uniqueness is enforced by {@link DagBuilder},
 * the only way to populate an arena.
 */
public class Dag {

	private final List<DagNode> nodes = new ArrayList<DagNode>();

	private int root = -1;

	int add(NodeKind kind, Opcode opcode, String text, int... operands) {
		for (int operand : operands) {
			if (operand < 0 || operand >= nodes.size()) {
				throw new IllegalArgumentException("Operand #" + operand + " is not in the arena");
			}
		}
		int id = nodes.size();
		nodes.add(new DagNode(id, kind, opcode, text, operands));
		for (int operand : operands) {
			nodes.get(operand).incrementParentCount();
		}
		return id;
	}

	public DagNode get(int id) {
		return nodes.get(id);
	}

	public int size() {
		return nodes.size();
	}

	/**
	 * @return unmodifiable view of the arena, in creation order
	 */
	public List<DagNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	/**
	 * @return arena index of the root, or <code>-1</code> while the DAG is being built
	 */
	public int getRoot() {
		return root;
	}

	void setRoot(int root) {
		if (root < 0 || root >= nodes.size()) {
			throw new IllegalArgumentException("Root #" + root + " is not in the arena");
		}
		this.root = root;
	}

	public DagNode getRootNode() {
		return nodes.get(root);
	}

	/**
	 * @return the Sethi-Ullman label of the root
	 */
	public int getRootLabel() {
		return getRootNode().getLabel();
	}

	/**
	 * @return number of operation nodes, which is also the number of instructions
	 *         generated for this DAG
	 */
	public int getOperationCount() {
		int count = 0;
		for (DagNode node : nodes) {
			if (!node.isLeaf()) {
				count++;
			}
		}
		return count;
	}

	/**
	 * Structural copy in a new arena: same ids, operands, labels and parent
	 * counts. Registers are not copied.
	 *
	 * @return the copy
	 */
	public Dag copy() {
		Dag copy = new Dag();
		for (DagNode node : nodes) {
			DagNode clone = new DagNode(node.getId(), node.getKind(), node.getOpcode(), node.getText(), node.getOperands());
			clone.setLabel(node.getLabel());
			clone.setParentCount(node.getParentCount());
			copy.nodes.add(clone);
		}
		copy.root = root;
		return copy;
	}

	/**
	 * Infix rendering of the subexpression rooted at the specified node.
	 *
	 * @param id arena index
	 * @return the subexpression, fully parenthesized
	 */
	public String toExpressionString(int id) {
		DagNode node = nodes.get(id);
		if (node.isLeaf()) {
			return node.getText();
		}
		if (node.getOperandCount() == 1) {
			return "(" + node.getOpcode().symbol() + toExpressionString(node.getOperand(0)) + ")";
		}
		return "("
				+ toExpressionString(node.getOperand(0))
				+ " "
				+ node.getOpcode().symbol()
				+ " "
				+ toExpressionString(node.getOperand(1))
				+ ")";
	}

	@Override
	public String toString() {
		return root < 0 ? "<empty>" : toExpressionString(root);
	}

	/**
	 * Prints the arena, one node per line, to the specified stream.
	 *
	 * @param ps the stream
	 */
	public void dump(PrintStream ps) {
		for (DagNode node : nodes) {
			ps.println((node.getId() == root ? "* " : "  ") + node);
		}
	}
}
