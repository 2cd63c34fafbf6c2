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
 * <code>name[subscript, ...]</code>. Several subscripts are joined with
 * SUBSEP.
 */
public final class ArrayElement extends Expression {

	private final String arrayName;
	private final List<Expression> subscripts;

	public ArrayElement(int lineNumber, String arrayName, List<Expression> subscripts) {
		super(lineNumber);
		this.arrayName = arrayName;
		this.subscripts = Collections.unmodifiableList(subscripts);
	}

	public String getArrayName() {
		return arrayName;
	}

	public List<Expression> getSubscripts() {
		return subscripts;
	}

	@Override
	public boolean isLvalue() {
		return true;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
