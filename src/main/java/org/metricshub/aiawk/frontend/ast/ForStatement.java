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
 * <code>for (init; condition; update) body</code>, each of the three parts
 * being optional (null).
 */
public final class ForStatement extends Statement {

	private final Expression initializer;
	private final Expression condition;
	private final Expression update;
	private final Statement body;

	public ForStatement(int lineNumber, Expression initializer, Expression condition, Expression update, Statement body) {
		super(lineNumber);
		this.initializer = initializer;
		this.condition = condition;
		this.update = update;
		this.body = body;
	}

	public Expression getInitializer() {
		return initializer;
	}

	public Expression getCondition() {
		return condition;
	}

	public Expression getUpdate() {
		return update;
	}

	public Statement getBody() {
		return body;
	}

	@Override
	public void accept(StatementVisitor visitor) {
		visitor.visit(this);
	}
}
