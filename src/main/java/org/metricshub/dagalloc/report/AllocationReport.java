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

/**
 * Result of analyzing one expression: the allocation of the DAG as parsed, and
 * of its rearranged form.
 */
public final class AllocationReport {

	private final boolean success = true;

	private final String expression;

	private final AllocationResult original;

	private final AllocationResult rearranged;

	public AllocationReport(String expression, AllocationResult original, AllocationResult rearranged) {
		this.expression = expression;
		this.original = original;
		this.rearranged = rearranged;
	}

	public boolean isSuccess() {
		return success;
	}

	public String getExpression() {
		return expression;
	}

	public AllocationResult getOriginal() {
		return original;
	}

	public AllocationResult getRearranged() {
		return rearranged;
	}

	/**
	 * @return how many registers the rearrangement saves, never negative
	 */
	public int getSavedRegisters() {
		return original.getMinRegisters() - rearranged.getMinRegisters();
	}
}
