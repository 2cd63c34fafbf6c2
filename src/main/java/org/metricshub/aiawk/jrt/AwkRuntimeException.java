package org.metricshub.aiawk.jrt;

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
 * A fatal error raised while a program runs. It is provided
 * to conveniently distinguish between AWK runtime
 * exceptions and other runtime exceptions.
 * <p>
 * Exceptions raised deep in the runtime do not know which source line is
 * being executed; the interpreter stamps the line of the current statement
 * on them with {@link #attachLineNumber(int)} as they propagate.
 *
 * @author Danny Daglas
 */
public class AwkRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private int lineNumber;

	/**
	 * @param msg a {@link java.lang.String} object
	 */
	public AwkRuntimeException(String msg) {
		this(-1, msg);
	}

	/**
	 * @param msg description of the problem
	 * @param cause underlying exception
	 */
	public AwkRuntimeException(String msg, Throwable cause) {
		this(-1, msg, cause);
	}

	/**
	 * @param lineno a int
	 * @param msg a {@link java.lang.String} object
	 */
	public AwkRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	/**
	 * @param lineno offending line, or {@code -1}
	 * @param msg description of the problem
	 * @param cause underlying exception
	 */
	public AwkRuntimeException(int lineno, String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = lineno;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Records the source line, unless one is already known.
	 *
	 * @param lineno line of the statement being executed
	 */
	public void attachLineNumber(int lineno) {
		if (lineNumber < 0) {
			lineNumber = lineno;
		}
	}
}
