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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.intermediate.InstructionList;

/**
 * Mutable state of one code generation run: the register pool, the number of
 * uses left for every node, and the code emitted so far. One instance per run,
 * passed explicitly through the traversal, so that independent runs never share
 * anything.
 */
final class AllocationState {

	final RegisterPool pool;

	/** remainingUses[id] starts at the node's parent count */
	final int[] remainingUses;

	final boolean[] computed;

	/** index of the defining instruction, per node */
	final int[] definedAt;

	final String[] registers;

	final InstructionList code = new InstructionList();

	final List<LiveRange> liveRanges = new ArrayList<LiveRange>();

	AllocationState(Dag dag, int budget) {
		pool = new RegisterPool(budget);
		int size = dag.size();
		remainingUses = new int[size];
		computed = new boolean[size];
		definedAt = new int[size];
		registers = new String[size];
		for (int id = 0; id < size; id++) {
			remainingUses[id] = dag.get(id).getParentCount();
			definedAt[id] = -1;
		}
	}
}
