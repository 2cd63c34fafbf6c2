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
 * An expression: something that evaluates to a value.
 */
public abstract class Expression extends AstNode {

	protected Expression(int lineNumber) {
		super(lineNumber);
	}

	/**
	 * Dispatches to the visitor method matching the concrete node type.
	 *
	 * @param visitor the visitor
	 * @param <R> result type of the visitor
	 * @return what the visitor returns
	 */
	public abstract <R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * @return true when the expression can be assigned to (a variable, an
	 *         array element or a field)
	 */
	public boolean isLvalue() {
		return false;
	}
}
