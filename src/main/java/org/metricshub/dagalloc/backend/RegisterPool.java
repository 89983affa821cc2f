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
import org.metricshub.dagalloc.RegisterBudgetExceededException;

/**
 * Virtual registers <code>R1, R2, ...</code>. Allocation always hands out the
 * lowest-numbered free register, growing the pool when none is free unless
 * the pool is capped.
 */
public class RegisterPool {

	/** Capacity of an uncapped pool. */
	public static final int UNBOUNDED = 0;

	private final int capacity;

	/** inUse.get(i) is register R(i+1) */
	private final List<Boolean> inUse = new ArrayList<Boolean>();

	private int liveCount;

	private int peak;

	/**
	 * @param capacity maximum number of registers, or {@link #UNBOUNDED}
	 */
	public RegisterPool(int capacity) {
		if (capacity < 0) {
			throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
		}
		this.capacity = capacity;
	}

	/**
	 * Takes the lowest-numbered free register.
	 *
	 * @return the register name
	 * @throws RegisterBudgetExceededException when the pool is capped and full
	 */
	public String allocate() {
		int index = inUse.indexOf(Boolean.FALSE);
		if (index < 0) {
			if (capacity != UNBOUNDED && inUse.size() >= capacity) {
				throw new RegisterBudgetExceededException(capacity, liveCount + 1);
			}
			inUse.add(Boolean.TRUE);
			index = inUse.size() - 1;
		} else {
			inUse.set(index, Boolean.TRUE);
		}
		liveCount++;
		peak = Math.max(peak, liveCount);
		return name(index);
	}

	/**
	 * Returns a register to the pool.
	 *
	 * @param register the register name
	 */
	public void release(String register) {
		int index = indexOf(register);
		if (index >= inUse.size() || !inUse.get(index)) {
			throw new IllegalStateException("Register " + register + " is not allocated");
		}
		inUse.set(index, Boolean.FALSE);
		liveCount--;
	}

	public boolean isAllocated(String register) {
		int index = indexOf(register);
		return index < inUse.size() && inUse.get(index);
	}

	/**
	 * @return number of registers currently allocated
	 */
	public int getLiveCount() {
		return liveCount;
	}

	/**
	 * @return highest number of registers allocated at the same time so far
	 */
	public int getPeak() {
		return peak;
	}

	static String name(int index) {
		return "R" + (index + 1);
	}

	private static int indexOf(String register) {
		if (register == null || register.length() < 2 || register.charAt(0) != 'R') {
			throw new IllegalArgumentException("Not a register: " + register);
		}
		try {
			int number = Integer.parseInt(register.substring(1));
			if (number < 1) {
				throw new IllegalArgumentException("Not a register: " + register);
			}
			return number - 1;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Not a register: " + register, e);
		}
	}
}
