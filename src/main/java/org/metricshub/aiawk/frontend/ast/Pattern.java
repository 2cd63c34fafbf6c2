package org.metricshub.aiawk.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * AiAwk
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
 * The pattern part of a rule.
 */
public final class Pattern {

	/**
	 * Kinds of patterns.
	 */
	public enum Kind {
		/** No pattern: every record matches */
		ALWAYS,
		/** <code>/re/</code>, matched against $0 */
		REGEX,
		/** Any other expression, matches when true */
		EXPRESSION,
		BEGIN,
		END,
		/** <code>p1, p2</code> */
		RANGE
	}

	private static final Pattern ALWAYS_PATTERN = new Pattern(Kind.ALWAYS, null, null);
	private static final Pattern BEGIN_PATTERN = new Pattern(Kind.BEGIN, null, null);
	private static final Pattern END_PATTERN = new Pattern(Kind.END, null, null);

	private final Kind kind;
	private final Expression first;
	private final Expression second;

	private Pattern(Kind kind, Expression first, Expression second) {
		this.kind = kind;
		this.first = first;
		this.second = second;
	}

	public static Pattern always() {
		return ALWAYS_PATTERN;
	}

	public static Pattern begin() {
		return BEGIN_PATTERN;
	}

	public static Pattern end() {
		return END_PATTERN;
	}

	/**
	 * A pattern made of a single expression. A bare regular expression
	 * literal gives a {@link Kind#REGEX} pattern.
	 *
	 * @param expression the pattern expression
	 * @return the pattern
	 */
	public static Pattern of(Expression expression) {
		return new Pattern(expression instanceof RegexLiteral ? Kind.REGEX : Kind.EXPRESSION, expression, null);
	}

	public static Pattern range(Expression start, Expression stop) {
		return new Pattern(Kind.RANGE, start, stop);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the expression of REGEX and EXPRESSION patterns, the start
	 *         condition of a RANGE, null otherwise
	 */
	public Expression getFirst() {
		return first;
	}

	/**
	 * @return the stop condition of a RANGE, null otherwise
	 */
	public Expression getSecond() {
		return second;
	}
}
