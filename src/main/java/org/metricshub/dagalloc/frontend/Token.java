package org.metricshub.dagalloc.frontend;

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
 * A lexical token of an arithmetic expression.
 */
public final class Token {

	/** Lexer token values. */
	public enum Kind {
		EOF,
		ID,
		NUMBER,

		PLUS,
		MINUS,
		MULT,
		DIVIDE,
		POW,

		OPEN_PAREN,
		CLOSE_PAREN
	}

	private final Kind kind;
	private final String text;
	private final int position;

	public Token(Kind kind, String text, int position) {
		this.kind = kind;
		this.text = text;
		this.position = position;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return 0-based offset of the first character of this token
	 */
	public int getPosition() {
		return position;
	}

	@Override
	public String toString() {
		return kind == Kind.EOF ? "end of input" : kind.name() + " '" + text + "'";
	}
}
