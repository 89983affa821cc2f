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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.dagalloc.frontend.Token.Kind;
import org.metricshub.dagalloc.frontend.ast.LexerException;

/**
 * Splits an expression into {@link Token}s. The list always ends with an
 * {@link Kind#EOF} token positioned right after the last character.
 */
public class ExpressionLexer {

	private final String input;
	private int pos;
	private int c;

	private final StringBuilder text = new StringBuilder();

	public ExpressionLexer(String input) {
		this.input = input == null ? "" : input;
	}

	private void read() {
		text.append((char) c);
		pos++;
		c = pos < input.length() ? input.charAt(pos) : -1;
	}

	/**
	 * Tokenizes the whole input.
	 *
	 * @return the tokens, terminated by {@link Kind#EOF}
	 * @throws LexerException on a character that starts no token
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		pos = 0;
		c = input.isEmpty() ? -1 : input.charAt(0);
		Token token;
		do {
			token = lexer();
			tokens.add(token);
		} while (token.getKind() != Kind.EOF);
		return tokens;
	}

	private Token lexer() {
		// clear whitespace
		while (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
			pos++;
			c = pos < input.length() ? input.charAt(pos) : -1;
		}
		text.setLength(0);
		int start = pos;
		if (c < 0) {
			return new Token(Kind.EOF, "", start);
		}
		if (c == '(') {
			read();
			return token(Kind.OPEN_PAREN, start);
		}
		if (c == ')') {
			read();
			return token(Kind.CLOSE_PAREN, start);
		}
		if (c == '+') {
			read();
			return token(Kind.PLUS, start);
		}
		if (c == '-') {
			read();
			return token(Kind.MINUS, start);
		}
		if (c == '*') {
			read();
			if (c == '*') {
				read();
				return token(Kind.POW, start);
			}
			return token(Kind.MULT, start);
		}
		if (c == '/') {
			read();
			return token(Kind.DIVIDE, start);
		}
		if (c == '^') {
			read();
			return token(Kind.POW, start);
		}
		if (isDigit(c) || c == '.') {
			return number(start);
		}
		if (isLetter(c)) {
			while (isLetter(c) || isDigit(c)) {
				read();
			}
			return token(Kind.ID, start);
		}
		throw new LexerException("Unexpected character '" + (char) c + "'", start);
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
	}

	// NUMBER : digits [ . digits ] | . digits
	private Token number(int start) {
		while (c >= 0 && isDigit(c)) {
			read();
		}
		if (c == '.') {
			read();
			if (c < 0 || !isDigit(c)) {
				throw new LexerException("Malformed number '" + text + "'", start);
			}
			while (c >= 0 && isDigit(c)) {
				read();
			}
		}
		if (c >= 0 && isLetter(c)) {
			throw new LexerException("Malformed number '" + text + (char) c + "'", start);
		}
		return token(Kind.NUMBER, start);
	}

	private Token token(Kind kind, int start) {
		return new Token(kind, text.toString(), start);
	}
}
