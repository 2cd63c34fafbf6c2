package org.metricshub.aiawk.ext;

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

import java.util.Locale;
import org.metricshub.aiawk.jrt.AwkValue;

/**
 * A function implemented outside of the AWK program, called with the
 * evaluated arguments and returning a string.
 */
@FunctionalInterface
public interface ForeignFunction {

	/**
	 * Calls the function.
	 *
	 * @param args evaluated arguments
	 * @return the result, never null
	 * @throws Exception when the call fails
	 */
	String invoke(AwkValue... args) throws Exception;

	/**
	 * Calls the function, turning numbers into strings with the specified
	 * format. Ignores the format by default.
	 *
	 * @param convfmt format used to turn numbers into strings
	 * @param locale locale for number formatting
	 * @param args evaluated arguments
	 * @return the result, never null
	 * @throws Exception when the call fails
	 */
	default String invoke(String convfmt, Locale locale, AwkValue... args) throws Exception {
		return invoke(args);
	}

	/**
	 * Checks that the function can be called with that many arguments.
	 * Accepts any count by default.
	 *
	 * @param argCount number of arguments at the call site
	 * @throws org.metricshub.aiawk.jrt.IllegalAwkArgumentException when the
	 *         count is not accepted
	 */
	default void verifyArgCount(int argCount) {}
}
