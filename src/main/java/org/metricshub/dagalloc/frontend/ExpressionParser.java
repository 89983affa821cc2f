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

import java.math.BigDecimal;
import java.util.List;
import org.metricshub.dagalloc.frontend.Token.Kind;
import org.metricshub.dagalloc.frontend.ast.ParserException;
import org.metricshub.dagalloc.intermediate.Opcode;
import org.metricshub.dagalloc.util.DagAllocLogger;
import org.slf4j.Logger;

/**
 * Converts an arithmetic expression into a syntax tree, which is the input
 * of the DAG builder.
 * <p>
 * Standard precedence: <code>+ -</code> below <code>* /</code> below unary
 * minus below <code>^</code> (also spelled <code>**</code>). The first two
 * levels are left-associative, exponentiation is right-associative.
 * Parentheses override precedence.
 * <p>
 * A parser instance is stateful and must not be shared between threads.
 */
public class ExpressionParser {

	private static final Logger LOG = DagAllocLogger.getLogger(ExpressionParser.class);

	private List<Token> tokens;
	private int tokenIndex;
	private Token token;

	/**
	 * Parse a single arithmetic expression and return the corresponding tree.
	 *
	 * @param expression the expression
	 * @return root of the syntax tree
	 * @throws ParserException upon a syntax error
	 */
	public ExpressionNode parse(String expression) {
		tokens = new ExpressionLexer(expression).tokenize();
		tokenIndex = 0;
		token = tokens.get(0);

		if (token.getKind() == Kind.EOF) {
			throw new ParserException("Empty expression", token.getPosition());
		}
		ExpressionNode root = EXPRESSION();
		if (token.getKind() == Kind.CLOSE_PAREN) {
			throw new ParserException("Unbalanced parentheses: unexpected ')'", token.getPosition());
		}
		if (token.getKind() != Kind.EOF) {
			throw new ParserException("Unexpected trailing input: " + token, token.getPosition());
		}
		LOG.debug("Parsed '{}' into {}", expression, root);
		return root;
	}

	private void lexer() {
		if (tokenIndex + 1 < tokens.size()) {
			tokenIndex++;
		}
		token = tokens.get(tokenIndex);
	}

	// EXPRESSION : TERM [ (+|-) TERM ]...
	ExpressionNode EXPRESSION() {
		ExpressionNode term = TERM();
		while (token.getKind() == Kind.PLUS || token.getKind() == Kind.MINUS) {
			Opcode op = token.getKind() == Kind.PLUS ? Opcode.ADD : Opcode.SUB;
			int position = token.getPosition();
			lexer();
			ExpressionNode nextTerm = TERM();

			// Build the tree in left-associative manner
			term = new ExpressionNode.Binary(op, term, nextTerm, position);
		}
		return term;
	}

	// TERM : UNARY_FACTOR [ (*|/) UNARY_FACTOR ]...
	ExpressionNode TERM() {
		ExpressionNode unaryFactor = UNARY_FACTOR();
		while (token.getKind() == Kind.MULT || token.getKind() == Kind.DIVIDE) {
			Opcode op = token.getKind() == Kind.MULT ? Opcode.MUL : Opcode.DIV;
			int position = token.getPosition();
			lexer();
			ExpressionNode nextUnaryFactor = UNARY_FACTOR();

			// Build the tree in left-associative manner
			unaryFactor = new ExpressionNode.Binary(op, unaryFactor, nextUnaryFactor, position);
		}
		return unaryFactor;
	}

	// UNARY_FACTOR : [ - | + ] UNARY_FACTOR | POWER_FACTOR
	ExpressionNode UNARY_FACTOR() {
		if (token.getKind() == Kind.MINUS) {
			int position = token.getPosition();
			lexer();
			ExpressionNode operand = UNARY_FACTOR();
			if (operand instanceof ExpressionNode.Leaf && ((ExpressionNode.Leaf) operand).isConstant()) {
				// fold -<literal> into a negative constant
				String negated = new BigDecimal(((ExpressionNode.Leaf) operand).getText()).negate().toPlainString();
				return ExpressionNode.Leaf.constant(negated, position);
			}
			return new ExpressionNode.Unary(Opcode.NEG, operand, position);
		} else if (token.getKind() == Kind.PLUS) {
			lexer();
			return UNARY_FACTOR();
		} else {
			return POWER_FACTOR();
		}
	}

	// POWER_FACTOR : FACTOR [ ^ UNARY_FACTOR ]
	ExpressionNode POWER_FACTOR() {
		ExpressionNode factor = FACTOR();
		if (token.getKind() == Kind.POW) {
			int position = token.getPosition();
			lexer();
			ExpressionNode exponent = UNARY_FACTOR();
			return new ExpressionNode.Binary(Opcode.POW, factor, exponent, position);
		}
		return factor;
	}

	// FACTOR : '(' EXPRESSION ')' | ID | NUMBER
	ExpressionNode FACTOR() {
		Token current = token;
		switch (current.getKind()) {
		case OPEN_PAREN: {
			lexer();
			if (token.getKind() == Kind.CLOSE_PAREN) {
				throw new ParserException("Expecting operand. Found: ')'", token.getPosition());
			}
			ExpressionNode inner = EXPRESSION();
			if (token.getKind() != Kind.CLOSE_PAREN) {
				throw new ParserException(
						"Unbalanced parentheses: expecting ')' to close '(' at position "
								+ current.getPosition()
								+ ". Found: "
								+ token,
						token.getPosition());
			}
			lexer();
			return inner;
		}
		case ID:
			lexer();
			return ExpressionNode.Leaf.variable(current.getText(), current.getPosition());
		case NUMBER:
			lexer();
			return ExpressionNode.Leaf.constant(current.getText(), current.getPosition());
		case EOF:
			throw new ParserException("Expecting operand. Found: end of input", current.getPosition());
		default:
			throw new ParserException("Expecting operand. Found: " + current, current.getPosition());
		}
	}
}
