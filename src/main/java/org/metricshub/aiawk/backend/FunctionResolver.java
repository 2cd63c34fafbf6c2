package org.metricshub.aiawk.backend;

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

import java.util.Optional;
import org.metricshub.aiawk.ext.ExtensionRegistry;
import org.metricshub.aiawk.ext.ForeignFunction;
import org.metricshub.aiawk.frontend.ast.AwkProgram;
import org.metricshub.aiawk.frontend.ast.FunctionDefinition;
import org.metricshub.aiawk.jrt.AwkNameException;

/**
 * Finds what a function name refers to: first the functions of the
 * program, then the built-in functions, then the foreign functions.
 */
public class FunctionResolver {

	private final AwkProgram program;
	private final ExtensionRegistry registry;

	/**
	 * @param program the program and its function definitions
	 * @param registry the foreign functions
	 */
	public FunctionResolver(AwkProgram program, ExtensionRegistry registry) {
		this.program = program;
		this.registry = registry;
	}

	/**
	 * @param name function name
	 * @return the function
	 * @throws AwkNameException when no function has that name
	 */
	public CallTarget resolve(String name) {
		FunctionDefinition definition = program.getFunction(name);
		if (definition != null) {
			return CallTarget.userDefined(definition);
		}
		BuiltinFunction builtin = BuiltinFunction.forName(name);
		if (builtin != null) {
			return CallTarget.builtin(builtin);
		}
		Optional<ForeignFunction> foreign = registry.resolve(name);
		if (foreign.isPresent()) {
			return CallTarget.foreign(foreign.get());
		}
		throw new AwkNameException("function " + name + " is not defined");
	}
}
