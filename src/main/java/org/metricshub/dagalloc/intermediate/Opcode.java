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

/**
 * Operators of the expression language, as they appear in the syntax tree,
 * in DAG operation nodes and in emitted instructions.
 */
public enum Opcode {
	/**
	 * Addition.
	 * <p>
	 * Commutative and associative: subject to swaps and regrouping.
	 */
	ADD("+", 2, true),
	/**
	 * Subtraction. Never rewritten.
	 */
	SUB("-", 2, false),
	/**
	 * Multiplication.
	 * <p>
	 * Commutative and associative: subject to swaps and regrouping.
	 */
	MUL("*", 2, true),
	/**
	 * Division. Never rewritten.
	 */
	DIV("/", 2, false),
	/**
	 * Exponentiation, right-associative in source. Never rewritten.
	 */
	POW("^", 2, false),
	/**
	 * Arithmetic negation of a single operand.
	 */
	NEG("-", 1, false);

	private final String symbol;
	private final int arity;
	private final boolean commutative;

	Opcode(String symbol, int arity, boolean commutative) {
		this.symbol = symbol;
		this.arity = arity;
		this.commutative = commutative;
	}

	/**
	 * @return the operator as written in source and in instructions
	 */
	public String symbol() {
		return symbol;
	}

	/**
	 * @return number of operands (1 or 2)
	 */
	public int arity() {
		return arity;
	}

	public boolean isCommutative() {
		return commutative;
	}

	/**
	 * All commutative operators here are associative as well.
	 *
	 * @return whether chains of this operator may be re-bracketed
	 */
	public boolean isAssociative() {
		return commutative;
	}

	/**
	 * Human-readable verb used in allocation steps.
	 *
	 * @return the verb, e.g. "add"
	 */
	public String verb() {
		switch (this) {
		case ADD:
			return "add";
		case SUB:
			return "subtract";
		case MUL:
			return "multiply";
		case DIV:
			return "divide";
		case POW:
			return "raise";
		case NEG:
			return "negate";
		default:
			throw new Error("Unhandled opcode: " + this);
		}
	}

	/**
	 * Applies a binary operator.
	 *
	 * @param x left operand
	 * @param y right operand
	 * @return the result
	 */
	public double apply(double x, double y) {
		switch (this) {
		case ADD:
			return x + y;
		case SUB:
			return x - y;
		case MUL:
			return x * y;
		case DIV:
			return x / y;
		case POW:
			return Math.pow(x, y);
		default:
			throw new IllegalStateException(this + " is not a binary operator");
		}
	}

	/**
	 * Applies a unary operator.
	 *
	 * @param x the operand
	 * @return the result
	 */
	public double apply(double x) {
		if (this != NEG) {
			throw new IllegalStateException(this + " is not a unary operator");
		}
		return -x;
	}
}
