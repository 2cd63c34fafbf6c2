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
 * A foreign function failed or did not answer in time.
 * <p>
 * Unlike the other runtime exceptions, this one never aborts a run: the
 * foreign-function boundary logs it and hands the interpreter a sentinel
 * value instead.
 */
public class ForeignCallException extends AwkRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String functionName;

	/**
	 * @param functionName name of the failing function
	 * @param msg description of the problem
	 * @param cause underlying failure, may be {@code null}
	 */
	public ForeignCallException(String functionName, String msg, Throwable cause) {
		super(msg, cause);
		this.functionName = functionName;
	}

	/**
	 * @return name of the failing function
	 */
	public String getFunctionName() {
		return functionName;
	}
}
