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
 * <code>++x</code>, <code>x++</code>, <code>--x</code> or <code>x--</code>.
 */
public final class IncrementDecrement extends Expression {

	private final Expression target;
	private final boolean increment;
	private final boolean prefix;

	public IncrementDecrement(int lineNumber, Expression target, boolean increment, boolean prefix) {
		super(lineNumber);
		this.target = target;
		this.increment = increment;
		this.prefix = prefix;
	}

	public Expression getTarget() {
		return target;
	}

	public boolean isIncrement() {
		return increment;
	}

	/**
	 * @return true when the new value is the value of the expression
	 */
	public boolean isPrefix() {
		return prefix;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
