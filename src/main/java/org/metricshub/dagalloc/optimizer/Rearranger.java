package org.metricshub.dagalloc.optimizer;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagBuilder;
import org.metricshub.dagalloc.dag.DagNode;
import org.metricshub.dagalloc.dag.NodeKind;
import org.metricshub.dagalloc.dag.SethiUllmanLabeler;
import org.metricshub.dagalloc.intermediate.Opcode;
import org.metricshub.dagalloc.util.DagAllocLogger;
import org.metricshub.dagalloc.util.DagAllocSettings;
import org.slf4j.Logger;

/**
 * Rewrites a labeled {@link Dag} into an equivalent one that needs fewer
 * registers, using only the commutativity and associativity of
 * <code>+</code> and <code>*</code>.
 * <p>
 * Every operation node is rewritten once, into a fresh arena. For a commutative
 * and associative node, the chain of same-operator nodes below it is flattened
 * into a list of operands. Only nodes with a single parent are flattened, so a
 * shared subexpression stays one node. The operand list is then regrouped
 * into a few candidate shapes:
 * <ol>
 * <li>the original grouping;
 * <li>left-deep, in source order;
 * <li>left-deep, heaviest operands first;
 * <li>balanced, in source order;
 * <li>balanced, heaviest operands first.
 * </ol>
 * At each node of a shape, the operand order that gives the lower label is
 * kept, the source order winning ties. The candidate with the lowest label is
 * built. On equal labels, the one that creates the fewest new nodes wins, and
 * then the earliest in the list above.
 * <p>
 * <code>-</code>, <code>/</code>, <code>^</code> and unary minus are never
 * reordered; only their operands are rewritten.
 * <p>
 * If the result is not strictly cheaper than the input, a copy of the input is
 * returned instead.
 */
public class Rearranger {

	private static final Logger LOG = DagAllocLogger.getLogger(Rearranger.class);

	private final int maxDepth;

	private final SethiUllmanLabeler labeler = new SethiUllmanLabeler();

	/**
	 * Rearranger with the default chain depth.
	 */
	public Rearranger() {
		this(new DagAllocSettings().getRearrangeDepth());
	}

	/**
	 * @param maxDepth how many levels of a same-operator chain are flattened
	 */
	public Rearranger(int maxDepth) {
		if (maxDepth < DagAllocSettings.MIN_REARRANGE_DEPTH) {
			throw new IllegalArgumentException("Chain depth must be at least " + DagAllocSettings.MIN_REARRANGE_DEPTH);
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * Rearranges the specified DAG, which is left untouched.
	 *
	 * @param labeled a labeled DAG
	 * @return a new, labeled DAG computing the same value with a root label no
	 *         greater than the input's
	 */
	public Dag rearrange(Dag labeled) {
		Rewrite rewrite = new Rewrite(labeled);
		int root = rewrite.rewrite(labeled.getRoot());
		Dag result = rewrite.builder.finish(root);
		labeler.label(result);

		if (result.getRootLabel() < labeled.getRootLabel()) {
			LOG.debug(
					"Rearranged: label {} -> {}, {} -> {} nodes",
					labeled.getRootLabel(),
					result.getRootLabel(),
					labeled.size(),
					result.size());
			return result;
		}
		LOG.debug("No cheaper arrangement than label {}, keeping the original", labeled.getRootLabel());
		return labeled.copy();
	}

	/**
	 * Grouping of a flattened operand list: either a leaf naming an operand by
	 * its index in the list, or a binary node.
	 */
	private static final class Shape {

		private final int atom;
		private final Shape left;
		private final Shape right;

		private Shape(int atom, Shape left, Shape right) {
			this.atom = atom;
			this.left = left;
			this.right = right;
		}

		static Shape atom(int index) {
			return new Shape(index, null, null);
		}

		static Shape node(Shape left, Shape right) {
			return new Shape(-1, left, right);
		}

		boolean isAtom() {
			return atom >= 0;
		}
	}

	/**
	 * What a shape would cost if it were built in the new arena.
	 */
	private static final class Estimate {

		/** arena index if the node already exists, -1 otherwise */
		private final int id;
		private final int label;
		private final boolean leaf;
		private final int newNodes;

		private Estimate(int id, int label, boolean leaf, int newNodes) {
			this.id = id;
			this.label = label;
			this.leaf = leaf;
			this.newNodes = newNodes;
		}

		int cost(int position) {
			return leaf ? SethiUllmanLabeler.leafCost(position) : label;
		}
	}

	/**
	 * One rearrangement run: the source DAG, the arena under construction and
	 * the mapping from source nodes to new nodes.
	 */
	private final class Rewrite {

		private final Dag source;
		private final DagBuilder builder = new DagBuilder();
		private final int[] rewritten;

		private Rewrite(Dag source) {
			this.source = source;
			this.rewritten = new int[source.size()];
			Arrays.fill(rewritten, -1);
		}

		int rewrite(int id) {
			if (rewritten[id] >= 0) {
				return rewritten[id];
			}
			DagNode node = source.get(id);
			int result;
			if (node.getKind() == NodeKind.VARIABLE) {
				result = builder.variable(node.getText());
			} else if (node.getKind() == NodeKind.CONSTANT) {
				result = builder.constant(node.getText());
			} else if (node.getOpcode().isAssociative()) {
				result = regroup(node);
			} else {
				int[] operands = new int[node.getOperandCount()];
				for (int position = 0; position < operands.length; position++) {
					operands[position] = rewrite(node.getOperand(position));
				}
				result = builder.operation(node.getOpcode(), operands);
				labeler.labelNode(builder.getDag(), result);
			}
			rewritten[id] = result;
			return result;
		}

		private int regroup(DagNode node) {
			Opcode opcode = node.getOpcode();
			List<Integer> chainOperands = new ArrayList<Integer>();
			Shape original = flatten(node.getId(), opcode, 0, chainOperands);

			// operands are rewritten first, in source order
			int size = chainOperands.size();
			int[] atoms = new int[size];
			for (int i = 0; i < size; i++) {
				atoms[i] = rewrite(chainOperands.get(i));
			}

			List<Shape> candidates = new ArrayList<Shape>();
			candidates.add(original);
			List<Integer> sourceOrder = new ArrayList<Integer>();
			for (int i = 0; i < size; i++) {
				sourceOrder.add(i);
			}
			List<Integer> heaviestFirst = new ArrayList<Integer>(sourceOrder);
			heaviestFirst.sort(Comparator.comparingInt((Integer i) -> atomWeight(atoms[i])).reversed());
			candidates.add(leftDeep(sourceOrder));
			candidates.add(leftDeep(heaviestFirst));
			candidates.add(balanced(sourceOrder, 0, size));
			candidates.add(balanced(heaviestFirst, 0, size));

			Shape best = null;
			Estimate bestEstimate = null;
			for (Shape candidate : candidates) {
				Estimate estimate = estimate(candidate, opcode, atoms);
				if (bestEstimate == null
						|| estimate.label < bestEstimate.label
						|| (estimate.label == bestEstimate.label && estimate.newNodes < bestEstimate.newNodes)) {
					best = candidate;
					bestEstimate = estimate;
				}
			}
			return build(best, opcode, atoms);
		}

		/**
		 * Collects the operands of the chain rooted at <code>id</code>, left to
		 * right, and returns the chain's grouping.
		 */
		private Shape flatten(int id, Opcode opcode, int depth, List<Integer> chainOperands) {
			DagNode node = source.get(id);
			boolean expand = depth == 0
					|| (!node.isLeaf()
							&& node.getOpcode() == opcode
							&& node.getParentCount() == 1
							&& depth <= maxDepth);
			if (!expand) {
				chainOperands.add(id);
				return Shape.atom(chainOperands.size() - 1);
			}
			Shape left = flatten(node.getOperand(0), opcode, depth + 1, chainOperands);
			Shape right = flatten(node.getOperand(1), opcode, depth + 1, chainOperands);
			return Shape.node(left, right);
		}

		private int atomWeight(int id) {
			DagNode node = builder.getDag().get(id);
			return node.isLeaf() ? 0 : node.getLabel();
		}

		private Shape leftDeep(List<Integer> order) {
			Shape shape = Shape.atom(order.get(0));
			for (int i = 1; i < order.size(); i++) {
				shape = Shape.node(shape, Shape.atom(order.get(i)));
			}
			return shape;
		}

		private Shape balanced(List<Integer> order, int from, int to) {
			if (to - from == 1) {
				return Shape.atom(order.get(from));
			}
			int middle = (from + to) / 2;
			return Shape.node(balanced(order, from, middle), balanced(order, middle, to));
		}

		/**
		 * Labels a shape without building it. Nodes that already exist in the new
		 * arena count with their actual label.
		 */
		private Estimate estimate(Shape shape, Opcode opcode, int[] atoms) {
			if (shape.isAtom()) {
				DagNode node = builder.getDag().get(atoms[shape.atom]);
				return new Estimate(node.getId(), node.getLabel(), node.isLeaf(), 0);
			}
			Estimate left = estimate(shape.left, opcode, atoms);
			Estimate right = estimate(shape.right, opcode, atoms);
			boolean swap = isCheaperSwapped(left, right);
			Estimate first = swap ? right : left;
			Estimate second = swap ? left : right;
			int label = SethiUllmanLabeler.combine(first.cost(0), second.cost(1));
			int newNodes = left.newNodes + right.newNodes;
			if (left.id >= 0 && right.id >= 0) {
				int existing = builder.peek(opcode, first.id, second.id);
				if (existing >= 0) {
					return new Estimate(existing, builder.getDag().get(existing).getLabel(), false, newNodes);
				}
			}
			return new Estimate(-1, label, false, newNodes + 1);
		}

		private int build(Shape shape, Opcode opcode, int[] atoms) {
			if (shape.isAtom()) {
				return atoms[shape.atom];
			}
			int left = build(shape.left, opcode, atoms);
			int right = build(shape.right, opcode, atoms);
			Dag dag = builder.getDag();
			Estimate leftEstimate = new Estimate(left, dag.get(left).getLabel(), dag.get(left).isLeaf(), 0);
			Estimate rightEstimate = new Estimate(right, dag.get(right).getLabel(), dag.get(right).isLeaf(), 0);
			int id = isCheaperSwapped(leftEstimate, rightEstimate)
					? builder.operation(opcode, right, left)
					: builder.operation(opcode, left, right);
			labeler.labelNode(dag, id);
			return id;
		}

		private boolean isCheaperSwapped(Estimate left, Estimate right) {
			int inOrder = SethiUllmanLabeler.combine(left.cost(0), right.cost(1));
			int swapped = SethiUllmanLabeler.combine(right.cost(0), left.cost(1));
			return swapped < inOrder;
		}
	}
}
