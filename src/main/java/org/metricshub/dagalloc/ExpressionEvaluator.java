package org.metricshub.dagalloc;

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

import java.util.Map;
import org.metricshub.dagalloc.frontend.ExpressionNode;
import org.metricshub.dagalloc.frontend.ExpressionParser;
import org.metricshub.dagalloc.intermediate.InstructionList;
import org.metricshub.dagalloc.backend.RegisterMachine;

/**
 * Utility class to evaluate standalone expressions, either directly from their
 * syntax tree or by running generated code.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	/**
	 * Evaluates an expression in double arithmetic.
	 *
	 * @param expression the expression
	 * @param variables variable bindings
	 * @return the value
	 * @throws IllegalArgumentException when a variable is not bound
	 */
	public static double eval(String expression, Map<String, Double> variables) {
		ExpressionNode tree = new ExpressionParser().parse(expression);
		return tree.evaluate(variables);
	}

	/**
	 * Runs generated code on a {@link RegisterMachine}.
	 *
	 * @param code the instructions
	 * @param variables variable bindings
	 * @return the value left in the result location
	 */
	public static double eval(InstructionList code, Map<String, Double> variables) {
		return new RegisterMachine(variables).execute(code);
	}
}
