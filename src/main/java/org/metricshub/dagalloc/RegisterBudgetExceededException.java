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

/**
 * Thrown when evaluating an expression needs more registers than the
 * caller-supplied budget. Values are never spilled to memory.
 */
public class RegisterBudgetExceededException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int budget;

	private final int needed;

	/**
	 * @param budget number of registers the caller allows
	 * @param needed number of registers the evaluation requires
	 */
	public RegisterBudgetExceededException(int budget, int needed) {
		super("Register budget exceeded: " + needed + " register(s) needed, " + budget + " available");
		this.budget = budget;
		this.needed = needed;
	}

	public int getBudget() {
		return budget;
	}

	public int getNeeded() {
		return needed;
	}
}
