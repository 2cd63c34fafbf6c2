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
 * <code>delete array[subscripts]</code>, or <code>delete array</code> to
 * remove every element.
 */
public final class DeleteStatement extends Statement {

	private final String arrayName;
	private final List<Expression> subscripts;

	/**
	 * @param lineNumber source line
	 * @param arrayName the array
	 * @param subscripts element subscripts, null to clear the whole array
	 */
	public DeleteStatement(int lineNumber, String arrayName, List<Expression> subscripts) {
		super(lineNumber);
		this.arrayName = arrayName;
		this.subscripts = subscripts == null ? null : Collections.unmodifiableList(subscripts);
	}

	public String getArrayName() {
		return arrayName;
	}

	public List<Expression> getSubscripts() {
		return subscripts;
	}

	@Override
	public void accept(StatementVisitor visitor) {
		visitor.visit(this);
	}
}
