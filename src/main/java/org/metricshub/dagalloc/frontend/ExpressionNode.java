package org.metricshub.dagalloc.frontend;

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
import java.math.BigDecimal;
import java.util.Map;
import org.metricshub.dagalloc.intermediate.Opcode;

/**
 * Node of the abstract syntax tree produced by {@link ExpressionParser}.
 * Operand order is the source order.
 */
public abstract class ExpressionNode {

	private final int position;

	protected ExpressionNode(int position) {
		this.position = position;
	}

	/**
	 * @return 0-based offset of the token this node was built from
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * Evaluates this tree with double arithmetic.
	 *
	 * @param variables variable bindings
	 * @return the value
	 * @throws IllegalArgumentException when a variable is not bound
	 */
	public abstract double evaluate(Map<String, Double> variables);

	/**
	 * Prints this tree, one node per line, indented by depth.
	 *
	 * @param ps the stream
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	protected abstract void dump(PrintStream ps, int depth);

	protected static String indent(int depth) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			sb.append("  ");
		}
		return sb.toString();
	}

	/**
	 * A variable reference or a numeric constant.
	 */
	public static final class Leaf extends ExpressionNode {

		private final String text;
		private final boolean constant;

		private Leaf(String text, boolean constant, int position) {
			super(position);
			this.text = text;
			this.constant = constant;
		}

		public static Leaf variable(String name, int position) {
			return new Leaf(name, false, position);
		}

		/**
		 * @param value numeric literal; normalized so that equal values share one spelling
		 * @param position source offset
		 * @return the constant leaf
		 */
		public static Leaf constant(String value, int position) {
			return new Leaf(normalizeNumber(value), true, position);
		}

		public String getText() {
			return text;
		}

		public boolean isConstant() {
			return constant;
		}

		@Override
		public double evaluate(Map<String, Double> variables) {
			if (constant) {
				return Double.parseDouble(text);
			}
			Double value = variables.get(text);
			if (value == null) {
				throw new IllegalArgumentException("Variable '" + text + "' is not bound");
			}
			return value;
		}

		@Override
		protected void dump(PrintStream ps, int depth) {
			ps.println(indent(depth) + (constant ? "Constant " : "Variable ") + text);
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Unary minus applied to something other than a numeric literal.
	 */
	public static final class Unary extends ExpressionNode {

		private final Opcode opcode;
		private final ExpressionNode operand;

		public Unary(Opcode opcode, ExpressionNode operand, int position) {
			super(position);
			if (opcode.arity() != 1) {
				throw new IllegalArgumentException(opcode + " is not a unary operator");
			}
			this.opcode = opcode;
			this.operand = operand;
		}

		public Opcode getOpcode() {
			return opcode;
		}

		public ExpressionNode getOperand() {
			return operand;
		}

		@Override
		public double evaluate(Map<String, Double> variables) {
			return opcode.apply(operand.evaluate(variables));
		}

		@Override
		protected void dump(PrintStream ps, int depth) {
			ps.println(indent(depth) + "Unary " + opcode.symbol());
			operand.dump(ps, depth + 1);
		}

		@Override
		public String toString() {
			return "(" + opcode.symbol() + operand + ")";
		}
	}

	/**
	 * A binary operation; left and right keep their source order.
	 */
	public static final class Binary extends ExpressionNode {

		private final Opcode opcode;
		private final ExpressionNode left;
		private final ExpressionNode right;

		public Binary(Opcode opcode, ExpressionNode left, ExpressionNode right, int position) {
			super(position);
			if (opcode.arity() != 2) {
				throw new IllegalArgumentException(opcode + " is not a binary operator");
			}
			this.opcode = opcode;
			this.left = left;
			this.right = right;
		}

		public Opcode getOpcode() {
			return opcode;
		}

		public ExpressionNode getLeft() {
			return left;
		}

		public ExpressionNode getRight() {
			return right;
		}

		@Override
		public double evaluate(Map<String, Double> variables) {
			return opcode.apply(left.evaluate(variables), right.evaluate(variables));
		}

		@Override
		protected void dump(PrintStream ps, int depth) {
			ps.println(indent(depth) + "Binary " + opcode.symbol());
			left.dump(ps, depth + 1);
			right.dump(ps, depth + 1);
		}

		@Override
		public String toString() {
			return "(" + left + " " + opcode.symbol() + " " + right + ")";
		}
	}

	/**
	 * Canonical spelling of a numeric literal: <code>2</code>, <code>2.0</code>
	 * and <code>02</code> all become <code>2</code>.
	 *
	 * @param value the literal
	 * @return its canonical spelling
	 */
	public static String normalizeNumber(String value) {
		BigDecimal decimal = new BigDecimal(value).stripTrailingZeros();
		if (decimal.signum() == 0) {
			return "0";
		}
		return decimal.toPlainString();
	}
}
