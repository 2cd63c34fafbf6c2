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
import java.util.Set;

/**
 * <code>function name(params) { body }</code>
 * <p>
 * The parameters that the body uses as arrays (subscripted, iterated,
 * deleted, passed to <code>split</code>...) are recorded, so that the caller
 * can bind an unset variable to a new array before the call.
 */
public final class FunctionDefinition extends AstNode {

	private final String name;
	private final List<String> parameters;
	private final Set<String> arrayParameters;
	private final Block body;

	public FunctionDefinition(int lineNumber, String name, List<String> parameters, Set<String> arrayParameters, Block body) {
		super(lineNumber);
		this.name = name;
		this.parameters = Collections.unmodifiableList(parameters);
		this.arrayParameters = Collections.unmodifiableSet(arrayParameters);
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public boolean isArrayParameter(String parameter) {
		return arrayParameters.contains(parameter);
	}

	public Set<String> getArrayParameters() {
		return arrayParameters;
	}

	public Block getBody() {
		return body;
	}
}
