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
 * Plain and compound assignment operators.
 */
public enum AssignmentOperator {
	ASSIGN("=", null),
	ADD("+=", BinaryOperator.ADD),
	SUBTRACT("-=", BinaryOperator.SUBTRACT),
	MULTIPLY("*=", BinaryOperator.MULTIPLY),
	DIVIDE("/=", BinaryOperator.DIVIDE),
	MODULO("%=", BinaryOperator.MODULO),
	POWER("^=", BinaryOperator.POWER);

	private final String symbol;
	private final BinaryOperator arithmetic;

	AssignmentOperator(String symbol, BinaryOperator arithmetic) {
		this.symbol = symbol;
		this.arithmetic = arithmetic;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return the arithmetic operator a compound assignment applies, null for
	 *         a plain assignment
	 */
	public BinaryOperator getArithmetic() {
		return arithmetic;
	}
}
