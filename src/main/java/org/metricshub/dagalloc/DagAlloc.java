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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.dagalloc.backend.CodeGenerator;
import org.metricshub.dagalloc.backend.GeneratedCode;
import org.metricshub.dagalloc.backend.RegisterPool;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagBuilder;
import org.metricshub.dagalloc.dag.SethiUllmanLabeler;
import org.metricshub.dagalloc.frontend.ExpressionNode;
import org.metricshub.dagalloc.frontend.ExpressionParser;
import org.metricshub.dagalloc.optimizer.Rearranger;
import org.metricshub.dagalloc.report.AllocationReport;
import org.metricshub.dagalloc.report.AllocationResult;
import org.metricshub.dagalloc.util.DagAllocLogger;
import org.metricshub.dagalloc.util.DagAllocSettings;
import org.slf4j.Logger;

/**
 * Entry point into the analysis of an arithmetic expression.
 * This entry point is used both as a library and from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Parse the expression, producing a syntax tree.
 * <li>Build the DAG of the tree, sharing identical subexpressions.
 * <li>Label every node with the number of registers it needs.
 * <li>Rearrange the DAG, when enabled, into a cheaper equivalent form.
 * <li>Generate three-address code, with register allocation, for the original
 * DAG and for the rearranged one.
 * </ul>
 * The settings are read when the instance is created; later changes to the
 * settings object do not affect it. An instance holds no state between calls.
 *
 * @see org.metricshub.dagalloc.backend.CodeGenerator
 */
public class DagAlloc {

	private static final Logger LOG = DagAllocLogger.getLogger(DagAlloc.class);

	private final boolean rearrange;

	private final int registerBudget;

	private final int rearrangeDepth;

	private final Map<String, Double> variables;

	/**
	 * Create a new instance with the default settings.
	 */
	public DagAlloc() {
		this(new DagAllocSettings());
	}

	/**
	 * Create a new instance with the specified settings.
	 *
	 * @param settings the settings
	 */
	public DagAlloc(DagAllocSettings settings) {
		this.rearrange = settings.isRearrange();
		this.registerBudget = settings.hasRegisterBudget() ? settings.getRegisterBudget() : RegisterPool.UNBOUNDED;
		this.rearrangeDepth = settings.getRearrangeDepth();
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(settings.getVariables()));
		if (LOG.isDebugEnabled()) {
			LOG.debug("Settings:\n{}", settings.toDescriptionString());
		}
	}

	/**
	 * Parses an expression.
	 *
	 * @param expression the expression
	 * @return its syntax tree
	 * @throws org.metricshub.dagalloc.frontend.ast.ParserException when the
	 *         expression is malformed
	 */
	public ExpressionNode parse(String expression) {
		return new ExpressionParser().parse(expression);
	}

	/**
	 * Parses an expression and returns its labeled DAG.
	 *
	 * @param expression the expression
	 * @return the labeled DAG
	 */
	public Dag buildDag(String expression) {
		Dag dag = DagBuilder.build(parse(expression));
		return new SethiUllmanLabeler().label(dag);
	}

	/**
	 * Runs the whole pipeline on an expression.
	 *
	 * @param expression the expression
	 * @return the report with both halves
	 * @throws org.metricshub.dagalloc.frontend.ast.ParserException when the
	 *         expression is malformed
	 * @throws RegisterBudgetExceededException when either half needs more
	 *         registers than the budget
	 */
	public AllocationReport analyze(String expression) {
		Dag original = buildDag(expression);
		LOG.debug("{}: {} nodes, label {}", expression, original.size(), original.getRootLabel());

		Dag rearranged = rearrange ? new Rearranger(rearrangeDepth).rearrange(original) : original.copy();

		CodeGenerator generator = new CodeGenerator();
		GeneratedCode originalCode = generator.generate(original, registerBudget);
		GeneratedCode rearrangedCode = generator.generate(rearranged, registerBudget);

		return new AllocationReport(
				expression,
				new AllocationResult(original, originalCode),
				new AllocationResult(rearranged, rearrangedCode));
	}

	/**
	 * Runs the code of one half of a report against the variable bindings of
	 * the settings.
	 *
	 * @param result one half of a report
	 * @return the value computed by the code
	 * @throws IllegalArgumentException when a variable is not bound
	 */
	public double evaluate(AllocationResult result) {
		return ExpressionEvaluator.eval(result.getCode().getCode(), variables);
	}

	/**
	 * Evaluates an expression directly against the variable bindings of the
	 * settings.
	 *
	 * @param expression the expression
	 * @return its value
	 * @throws IllegalArgumentException when a variable is not bound
	 */
	public double evaluate(String expression) {
		return ExpressionEvaluator.eval(expression, variables);
	}

	/**
	 * @return the variable bindings taken from the settings
	 */
	public Map<String, Double> getVariables() {
		return variables;
	}
}
