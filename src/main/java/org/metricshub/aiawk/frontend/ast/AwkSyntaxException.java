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

/**
 * A program could not be compiled. The position of the offending text is
 * part of the message and also available separately.
 */
public class AwkSyntaxException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;
	private final int column;

	/**
	 * @param msg what is wrong
	 * @param sourceDescription name of the script source
	 * @param lineNumber 1-based line
	 * @param column 1-based column
	 */
	public AwkSyntaxException(String msg, String sourceDescription, int lineNumber, int column) {
		super(msg + " (" + sourceDescription + ": line " + lineNumber + ", column " + column + ")");
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	/**
	 * @return name of the script source
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return 1-based line of the error
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return 1-based column of the error
	 */
	public int getColumn() {
		return column;
	}
}
