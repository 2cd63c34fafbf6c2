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

import java.util.Collections;
import java.util.List;

/**
 * <code>print</code> and <code>printf</code>, with an optional output
 * redirection.
 */
public final class PrintStatement extends Statement {

	private final boolean formatted;
	private final List<Expression> arguments;
	private final OutputRedirection redirection;
	private final Expression destination;

	/**
	 * @param lineNumber source line
	 * @param formatted true for <code>printf</code>
	 * @param arguments arguments, empty to print $0
	 * @param redirection kind of redirection
	 * @param destination file name expression, null when not redirected
	 */
	public PrintStatement(
			int lineNumber,
			boolean formatted,
			List<Expression> arguments,
			OutputRedirection redirection,
			Expression destination) {
		super(lineNumber);
		this.formatted = formatted;
		this.arguments = Collections.unmodifiableList(arguments);
		this.redirection = redirection;
		this.destination = destination;
	}

	public boolean isFormatted() {
		return formatted;
	}

	public List<Expression> getArguments() {
		return arguments;
	}

	public OutputRedirection getRedirection() {
		return redirection;
	}

	public Expression getDestination() {
		return destination;
	}

	@Override
	public void accept(StatementVisitor visitor) {
		visitor.visit(this);
	}
}
