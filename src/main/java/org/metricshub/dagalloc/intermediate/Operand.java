package org.metricshub.dagalloc.intermediate;

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

import java.util.Objects;

/**
 * Source operand of an {@link Instruction}: either a register holding an
 * intermediate value, or a leaf (variable or constant) read straight from memory.
 */
public final class Operand {

	private final String register;
	private final String leafText;
	private final boolean constant;

	private Operand(String register, String leafText, boolean constant) {
		this.register = register;
		this.leafText = leafText;
		this.constant = constant;
	}

	public static Operand register(String register) {
		return new Operand(Objects.requireNonNull(register), null, false);
	}

	public static Operand variable(String name) {
		return new Operand(null, Objects.requireNonNull(name), false);
	}

	public static Operand constant(String value) {
		return new Operand(null, Objects.requireNonNull(value), true);
	}

	public boolean isRegister() {
		return register != null;
	}

	public boolean isConstant() {
		return constant;
	}

	public boolean isVariable() {
		return register == null && !constant;
	}

	/**
	 * @return the register name, or {@code null} for a leaf
	 */
	public String getRegister() {
		return register;
	}

	/**
	 * @return the variable name or constant value, or {@code null} for a register
	 */
	public String getLeafText() {
		return leafText;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Operand)) {
			return false;
		}
		Operand other = (Operand) o;
		return constant == other.constant
				&& Objects.equals(register, other.register)
				&& Objects.equals(leafText, other.leafText);
	}

	@Override
	public int hashCode() {
		return Objects.hash(register, leafText, constant);
	}

	@Override
	public String toString() {
		return isRegister() ? register : leafText;
	}
}
