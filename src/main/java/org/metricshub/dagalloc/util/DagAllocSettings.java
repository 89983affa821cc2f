package org.metricshub.dagalloc.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A simple container for the parameters of a single analysis.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking DagAlloc programmatically, from within Java code.
 */
public class DagAllocSettings {

	/** Smallest accepted associative chain depth. */
	public static final int MIN_REARRANGE_DEPTH = 1;

	/** Largest accepted associative chain depth. */
	public static final int MAX_REARRANGE_DEPTH = 32;

	/**
	 * Whether the rearranger runs;
	 * <code>true</code> by default.
	 */
	private boolean rearrange = true;

	/**
	 * Maximum number of registers the allocator may use.
	 * <code>0</code> means unbounded.
	 */
	private int registerBudget = 0;

	/**
	 * How many levels of a same-operator chain the rearranger flattens
	 * before treating the rest as an opaque operand.
	 */
	private int rearrangeDepth = 6;

	/**
	 * Variable bindings used to run the generated code (-v assignments).
	 */
	private Map<String, Double> variables = new LinkedHashMap<String, Double>();

	/**
	 * Locale for the output of numbers
	 * <code>US-English</code> by default.
	 */
	private Locale locale = Locale.US;

	/**
	 * @return one <code>name = value</code> line per parameter
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("rearrange = ").append(isRearrange()).append(newLine);
		desc.append("registerBudget = ").append(registerBudget == 0 ? "unbounded" : registerBudget).append(newLine);
		desc.append("rearrangeDepth = ").append(getRearrangeDepth()).append(newLine);
		desc.append("variables = ").append(getVariables()).append(newLine);
		desc.append("locale = ").append(locale.toLanguageTag()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return whether the rearranger runs
	 */
	public boolean isRearrange() {
		return rearrange;
	}

	/**
	 * @param rearrange whether the rearranger runs
	 */
	public void setRearrange(boolean rearrange) {
		this.rearrange = rearrange;
	}

	/**
	 * Maximum number of registers the allocator may use,
	 * <code>0</code> for an unbounded register supply.
	 *
	 * @return the register budget
	 */
	public int getRegisterBudget() {
		return registerBudget;
	}

	/**
	 * @return whether a register budget was set
	 */
	public boolean hasRegisterBudget() {
		return registerBudget > 0;
	}

	/**
	 * @param registerBudget maximum number of registers, <code>0</code> for unbounded
	 */
	public void setRegisterBudget(int registerBudget) {
		if (registerBudget < 0) {
			throw new IllegalArgumentException("Register budget must not be negative: " + registerBudget);
		}
		this.registerBudget = registerBudget;
	}

	/**
	 * @return the depth to which same-operator chains are flattened
	 */
	public int getRearrangeDepth() {
		return rearrangeDepth;
	}

	/**
	 * @param rearrangeDepth the depth to which same-operator chains are flattened
	 */
	public void setRearrangeDepth(int rearrangeDepth) {
		if (rearrangeDepth < MIN_REARRANGE_DEPTH || rearrangeDepth > MAX_REARRANGE_DEPTH) {
			throw new IllegalArgumentException(
					"Rearrange depth must be between "
							+ MIN_REARRANGE_DEPTH
							+ " and "
							+ MAX_REARRANGE_DEPTH
							+ ": "
							+ rearrangeDepth);
		}
		this.rearrangeDepth = rearrangeDepth;
	}

	/**
	 * Variable bindings applied when running the generated code.
	 *
	 * @return the variables
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Map<String, Double> getVariables() {
		return variables;
	}

	/**
	 * @param variables the variables to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setVariables(Map<String, Double> variables) {
		this.variables = variables;
	}

	/**
	 * Put or replace a variable binding.
	 *
	 * @param name variable name
	 * @param value numeric value
	 */
	public void putVariable(String name, double value) {
		variables.put(name, value);
	}

	/**
	 * @return the locale used to format numbers
	 */
	public Locale getLocale() {
		return locale;
	}

	/**
	 * @param locale the locale used to format numbers
	 */
	public void setLocale(Locale locale) {
		this.locale = locale;
	}
}
