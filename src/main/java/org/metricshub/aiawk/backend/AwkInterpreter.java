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

import org.metricshub.aiawk.frontend.ast.AwkProgram;

/**
 * Interpret an AWK program within this JVM.
 *
 * @author Danny Daglas
 */
public interface AwkInterpreter {
	/**
	 * Runs the program: BEGIN rules, then the rules applied to each input
	 * record, then END rules.
	 *
	 * @param program the parsed program
	 * @return the exit status of the program, 0 unless set by <code>exit</code>
	 * @throws org.metricshub.aiawk.jrt.AwkRuntimeException on a fatal error
	 */
	int interpret(AwkProgram program);
}
