package org.metricshub.dagalloc.frontend.ast;

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
 * Thrown when an expression cannot be parsed. No partial tree is ever produced
 * alongside this exception.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int position;

	private final String reason;

	/**
	 * @param reason what went wrong
	 * @param position 0-based character offset in the expression
	 */
	public ParserException(String reason, int position) {
		super(reason + " at position " + position);
		this.reason = reason;
		this.position = position;
	}

	/**
	 * @return the 0-based character offset where the problem was detected
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * @return the problem, without the position
	 */
	public String getReason() {
		return reason;
	}
}
