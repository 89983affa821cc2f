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

import java.util.Collections;
import java.util.List;
import org.metricshub.dagalloc.intermediate.InstructionList;

/**
 * Output of {@link CodeGenerator#generate}: the instructions with their
 * allocation steps, the register figures and the live ranges.
 */
public final class GeneratedCode {

	private final InstructionList code;
	private final int minRegisters;
	private final int registersUsed;
	private final List<LiveRange> liveRanges;

	GeneratedCode(InstructionList code, int minRegisters, int registersUsed, List<LiveRange> liveRanges) {
		this.code = code;
		this.minRegisters = minRegisters;
		this.registersUsed = registersUsed;
		this.liveRanges = Collections.unmodifiableList(liveRanges);
	}

	public InstructionList getCode() {
		return code;
	}

	/**
	 * @return the root label of the DAG
	 */
	public int getMinRegisters() {
		return minRegisters;
	}

	/**
	 * @return the highest number of registers live at the same time while running the code
	 */
	public int getRegistersUsed() {
		return registersUsed;
	}

	/**
	 * @return one range per operation node, in instruction order
	 */
	public List<LiveRange> getLiveRanges() {
		return liveRanges;
	}
}
