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
import java.util.HashMap;
import java.util.Map;
import org.metricshub.dagalloc.frontend.ExpressionNode;
import org.metricshub.dagalloc.intermediate.Opcode;
import org.metricshub.dagalloc.util.DagAllocLogger;
import org.slf4j.Logger;

/**
 * Populates a {@link Dag} arena, looking every node up by its structural key
 * before inserting it, so that identical subexpressions become one shared node.
 * <p>
 * Leaf key: kind and text. Operation key: opcode and operand ids, the ids being
 * sorted for commutative opcodes. The sorted key is only used for the lookup:
 * a node keeps the operand order of its first occurrence.
 */
public class DagBuilder {

	private static final Logger LOG = DagAllocLogger.getLogger(DagBuilder.class);

	private final Dag dag = new Dag();

	private final Map<String, Integer> nodesByKey = new HashMap<String, Integer>();

	private boolean finished;

	/**
	 * Converts a syntax tree into a DAG with shared common subexpressions.
	 *
	 * @param tree root of the syntax tree
	 * @return the DAG, not yet labeled
	 */
	public static Dag build(ExpressionNode tree) {
		DagBuilder builder = new DagBuilder();
		int root = builder.add(tree);
		Dag dag = builder.finish(root);
		if (LOG.isDebugEnabled()) {
			LOG.debug("Built DAG of {} nodes ({} operations) for {}", dag.size(), dag.getOperationCount(), tree);
		}
		return dag;
	}

	// post-order: operands first, then the node itself
	private int add(ExpressionNode node) {
		if (node instanceof ExpressionNode.Leaf) {
			ExpressionNode.Leaf leaf = (ExpressionNode.Leaf) node;
			return leaf.isConstant() ? constant(leaf.getText()) : variable(leaf.getText());
		} else if (node instanceof ExpressionNode.Unary) {
			ExpressionNode.Unary unary = (ExpressionNode.Unary) node;
			int operand = add(unary.getOperand());
			return operation(unary.getOpcode(), operand);
		} else if (node instanceof ExpressionNode.Binary) {
			ExpressionNode.Binary binary = (ExpressionNode.Binary) node;
			int left = add(binary.getLeft());
			int right = add(binary.getRight());
			return operation(binary.getOpcode(), left, right);
		} else {
			throw new Error("Unhandled syntax tree node: " + node);
		}
	}

	/**
	 * Looks up or inserts a variable leaf.
	 *
	 * @param name variable name
	 * @return arena index
	 */
	public int variable(String name) {
		return intern(NodeKind.VARIABLE, null, name);
	}

	/**
	 * Looks up or inserts a constant leaf.
	 *
	 * @param value canonical spelling of the constant
	 * @return arena index
	 */
	public int constant(String value) {
		return intern(NodeKind.CONSTANT, null, value);
	}

	/**
	 * Looks up or inserts an operation node.
	 *
	 * @param opcode operator
	 * @param operands arena indices of the operands, in evaluation order
	 * @return arena index
	 */
	public int operation(Opcode opcode, int... operands) {
		if (operands.length != opcode.arity()) {
			throw new IllegalArgumentException(opcode + " expects " + opcode.arity() + " operand(s)");
		}
		return intern(NodeKind.OPERATION, opcode, opcode.symbol(), operands);
	}

	/**
	 * Looks an operation node up without inserting it.
	 *
	 * @param opcode operator
	 * @param operands arena indices of the operands
	 * @return arena index, or <code>-1</code> if no such node exists yet
	 */
	public int peek(Opcode opcode, int... operands) {
		Integer id = nodesByKey.get(key(NodeKind.OPERATION, opcode, opcode.symbol(), operands));
		return id == null ? -1 : id;
	}

	/**
	 * @return the arena being populated
	 */
	public Dag getDag() {
		return dag;
	}

	/**
	 * Sets the root and hands the arena over. The builder cannot be used afterwards.
	 *
	 * @param root arena index of the root
	 * @return the DAG
	 */
	public Dag finish(int root) {
		dag.setRoot(root);
		finished = true;
		return dag;
	}

	private int intern(NodeKind kind, Opcode opcode, String text, int... operands) {
		if (finished) {
			throw new IllegalStateException("DAG already finished");
		}
		String key = key(kind, opcode, text, operands);
		Integer existing = nodesByKey.get(key);
		if (existing != null) {
			return existing;
		}
		int id = dag.add(kind, opcode, text, operands);
		nodesByKey.put(key, id);
		return id;
	}

	private static String key(NodeKind kind, Opcode opcode, String text, int... operands) {
		if (kind.isLeaf()) {
			return kind.name() + ':' + text;
		}
		int[] ids = operands.clone();
		if (opcode.isCommutative()) {
			Arrays.sort(ids);
		}
		return opcode.name() + Arrays.toString(ids);
	}
}
