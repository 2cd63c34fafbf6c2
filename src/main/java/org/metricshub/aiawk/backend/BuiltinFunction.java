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

import java.util.HashMap;
import java.util.Map;

/**
 * The functions built into the language, with the number of arguments each
 * one accepts.
 */
public enum BuiltinFunction {
	LENGTH("length", 0, 1),
	SUBSTR("substr", 2, 3),
	INDEX("index", 2, 2),
	SPLIT("split", 2, 3),
	SUB("sub", 2, 3),
	GSUB("gsub", 2, 3),
	MATCH("match", 2, 2),
	SPRINTF("sprintf", 1, Integer.MAX_VALUE),
	TOLOWER("tolower", 1, 1),
	TOUPPER("toupper", 1, 1),
	SIN("sin", 1, 1),
	COS("cos", 1, 1),
	ATAN2("atan2", 2, 2),
	EXP("exp", 1, 1),
	LOG("log", 1, 1),
	SQRT("sqrt", 1, 1),
	INT("int", 1, 1),
	RAND("rand", 0, 0),
	SRAND("srand", 0, 1),
	CLOSE("close", 1, 1),
	ASORT("asort", 1, 1),
	ASORTI("asorti", 1, 1),
	FIELD("field", 1, 1, false);

	private static final Map<String, BuiltinFunction> BY_NAME = new HashMap<String, BuiltinFunction>();

	static {
		for (BuiltinFunction function : values()) {
			BY_NAME.put(function.functionName, function);
		}
	}

	private final String functionName;
	private final int minArguments;
	private final int maxArguments;
	private final boolean reserved;

	BuiltinFunction(String functionName, int minArguments, int maxArguments) {
		this(functionName, minArguments, maxArguments, true);
	}

	BuiltinFunction(String functionName, int minArguments, int maxArguments, boolean reserved) {
		this.functionName = functionName;
		this.minArguments = minArguments;
		this.maxArguments = maxArguments;
		this.reserved = reserved;
	}

	/**
	 * @param name a function name
	 * @return the built-in function with that name, or null
	 */
	public static BuiltinFunction forName(String name) {
		return BY_NAME.get(name);
	}

	/**
	 * Reserved names are keywords of the language. An unreserved built-in
	 * stays usable as a variable or user function name and is only looked
	 * up in call position, after user-defined functions.
	 *
	 * @param name an identifier
	 * @return true when the identifier names a reserved built-in function
	 */
	public static boolean isReserved(String name) {
		BuiltinFunction function = BY_NAME.get(name);
		return function != null && function.reserved;
	}

	public boolean isReserved() {
		return reserved;
	}

	public String getFunctionName() {
		return functionName;
	}

	public int getMinArguments() {
		return minArguments;
	}

	public int getMaxArguments() {
		return maxArguments;
	}

	/**
	 * @param count number of arguments at a call site
	 * @return true when the function accepts that many arguments
	 */
	public boolean acceptsArgumentCount(int count) {
		return count >= minArguments && count <= maxArguments;
	}
}
