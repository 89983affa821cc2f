package org.metricshub.dagalloc.report;

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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagNode;

/**
 * Node and edge lists of a {@link Dag}, in the form a graph renderer consumes.
 * <p>
 * Leaves (variables and constants) are in group <code>variable</code>, operations
 * in group <code>operation</code>. An operation node is labeled with its
 * operator, followed by its register on a second line once one is assigned.
 * Edges go from an operand to the node that uses it, once per distinct pair.
 */
public final class GraphView {

	/** Group of variable and constant nodes */
	public static final String GROUP_VARIABLE = "variable";

	/** Group of operation nodes */
	public static final String GROUP_OPERATION = "operation";

	private final List<Node> nodes;
	private final List<Edge> edges;

	private GraphView(List<Node> nodes, List<Edge> edges) {
		this.nodes = Collections.unmodifiableList(nodes);
		this.edges = Collections.unmodifiableList(edges);
	}

	/**
	 * Builds the view of a DAG, with whatever registers are currently assigned
	 * to its nodes.
	 *
	 * @param dag the DAG
	 * @return the view
	 */
	public static GraphView of(Dag dag) {
		List<Node> nodes = new ArrayList<Node>();
		Set<Edge> edges = new LinkedHashSet<Edge>();
		for (DagNode node : dag.getNodes()) {
			if (node.isLeaf()) {
				nodes.add(new Node(node.getId(), node.getText(), GROUP_VARIABLE));
				continue;
			}
			String label = node.getOpcode().symbol();
			if (node.getRegister() != null) {
				label += "\n" + node.getRegister();
			}
			nodes.add(new Node(node.getId(), label, GROUP_OPERATION));
			for (int operand : node.getOperands()) {
				edges.add(new Edge(operand, node.getId()));
			}
		}
		return new GraphView(nodes, new ArrayList<Edge>(edges));
	}

	public List<Node> getNodes() {
		return nodes;
	}

	public List<Edge> getEdges() {
		return edges;
	}

	/**
	 * A displayed node.
	 */
	public static final class Node {

		private final int id;
		private final String label;
		private final String group;

		public Node(int id, String label, String group) {
			this.id = id;
			this.label = label;
			this.group = group;
		}

		public int getId() {
			return id;
		}

		public String getLabel() {
			return label;
		}

		public String getGroup() {
			return group;
		}

		@Override
		public String toString() {
			return id + ":" + label.replace('\n', ' ') + " (" + group + ")";
		}
	}

	/**
	 * A directed edge from an operand to its user.
	 */
	public static final class Edge {

		private final int from;
		private final int to;

		public Edge(int from, int to) {
			this.from = from;
			this.to = to;
		}

		public int getFrom() {
			return from;
		}

		public int getTo() {
			return to;
		}

		@Override
		public boolean equals(Object other) {
			if (!(other instanceof Edge)) {
				return false;
			}
			Edge edge = (Edge) other;
			return from == edge.from && to == edge.to;
		}

		@Override
		public int hashCode() {
			return 31 * from + to;
		}

		@Override
		public String toString() {
			return from + " -> " + to;
		}
	}
}
