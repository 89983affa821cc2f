package org.metricshub.dagalloc.backend;

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
 * Span of instructions during which the value of an operation node occupies
 * its register: from the instruction defining it to the instruction holding
 * its last use (both inclusive, 0-based).
 */
public final class LiveRange {

	private final int nodeId;
	private final String register;
	private final int start;
	private final int end;

	public LiveRange(int nodeId, String register, int start, int end) {
		this.nodeId = nodeId;
		this.register = register;
		this.start = start;
		this.end = end;
	}

	public int getNodeId() {
		return nodeId;
	}

	public String getRegister() {
		return register;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/**
	 * @param other another range
	 * @return whether both values are resident at the same time at some instruction
	 */
	public boolean overlaps(LiveRange other) {
		return start < other.end && other.start < end;
	}

	@Override
	public String toString() {
		return "#" + nodeId + " " + register + " [" + start + ", " + end + "]";
	}
}
