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

import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.dagalloc.backend.GeneratedCode;
import org.metricshub.dagalloc.backend.LiveRange;
import org.metricshub.dagalloc.dag.Dag;

/**
 * One half of an {@link AllocationReport}: the graph with its registers, the
 * minimum register count, the code and the allocation steps.
 */
public final class AllocationResult {

	private final GraphView graph;

	@SerializedName("min_registers")
	private final int minRegisters;

	@SerializedName("three_address_code")
	private final List<String> threeAddressCode;

	private final List<String> steps;

	@SerializedName("registers_used")
	private final int registersUsed;

	@SerializedName("live_ranges")
	private final List<LiveRangeView> liveRanges;

	private final transient Dag dag;

	private final transient GeneratedCode code;

	/**
	 * Captures the DAG (with the registers the generator assigned) and its code.
	 *
	 * @param dag the DAG the code was generated from
	 * @param code the generated code
	 */
	public AllocationResult(Dag dag, GeneratedCode code) {
		this.dag = dag;
		this.code = code;
		this.graph = GraphView.of(dag);
		this.minRegisters = code.getMinRegisters();
		this.threeAddressCode = Collections.unmodifiableList(code.getCode().toStrings());
		this.steps = code.getCode().getSteps();
		this.registersUsed = code.getRegistersUsed();
		List<LiveRangeView> ranges = new ArrayList<LiveRangeView>();
		for (LiveRange range : code.getLiveRanges()) {
			ranges.add(new LiveRangeView(range));
		}
		this.liveRanges = Collections.unmodifiableList(ranges);
	}

	public GraphView getGraph() {
		return graph;
	}

	public int getMinRegisters() {
		return minRegisters;
	}

	public List<String> getThreeAddressCode() {
		return threeAddressCode;
	}

	public List<String> getSteps() {
		return steps;
	}

	public int getRegistersUsed() {
		return registersUsed;
	}

	public List<LiveRangeView> getLiveRanges() {
		return liveRanges;
	}

	/**
	 * @return the DAG this half describes
	 */
	public Dag getDag() {
		return dag;
	}

	/**
	 * @return the generated code, with its result location
	 */
	public GeneratedCode getCode() {
		return code;
	}

	/**
	 * Serialized form of a {@link LiveRange}.
	 */
	public static final class LiveRangeView {

		private final int node;
		private final String register;
		private final int start;
		private final int end;

		LiveRangeView(LiveRange range) {
			this.node = range.getNodeId();
			this.register = range.getRegister();
			this.start = range.getStart();
			this.end = range.getEnd();
		}

		public int getNode() {
			return node;
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
	}
}
