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

import org.metricshub.aiawk.ext.ForeignFunction;
import org.metricshub.aiawk.frontend.ast.FunctionDefinition;

/**
 * What a call site resolves to: a built-in function, a function defined in
 * the program, or a foreign function.
 */
public final class CallTarget {

	/**
	 * Kinds of call targets.
	 */
	public enum Kind {
		BUILTIN,
		USER_DEFINED,
		FOREIGN
	}

	private final Kind kind;
	private final BuiltinFunction builtin;
	private final FunctionDefinition definition;
	private final ForeignFunction foreign;

	private CallTarget(Kind kind, BuiltinFunction builtin, FunctionDefinition definition, ForeignFunction foreign) {
		this.kind = kind;
		this.builtin = builtin;
		this.definition = definition;
		this.foreign = foreign;
	}

	public static CallTarget builtin(BuiltinFunction function) {
		return new CallTarget(Kind.BUILTIN, function, null, null);
	}

	public static CallTarget userDefined(FunctionDefinition definition) {
		return new CallTarget(Kind.USER_DEFINED, null, definition, null);
	}

	public static CallTarget foreign(ForeignFunction function) {
		return new CallTarget(Kind.FOREIGN, null, null, function);
	}

	public Kind getKind() {
		return kind;
	}

	public BuiltinFunction getBuiltin() {
		return builtin;
	}

	public FunctionDefinition getDefinition() {
		return definition;
	}

	public ForeignFunction getForeign() {
		return foreign;
	}
}
