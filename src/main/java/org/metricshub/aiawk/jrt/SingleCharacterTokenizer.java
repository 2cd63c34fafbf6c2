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

import java.util.Enumeration;
import java.util.NoSuchElementException;

/**
 * Similar to StringTokenizer, except that tokens are delimited
 * by a single literal character and empty tokens are kept:
 * <code>"a,,b"</code> split on <code>','</code> gives three tokens.
 *
 * @author Danny Daglas
 */
public class SingleCharacterTokenizer implements Enumeration<String> {

	private final String input;
	private final char splitChar;
	private int currentPos = 0;
	private boolean hasMoreTokens;

	/**
	 * Construct a SingleCharacterTokenizer.
	 *
	 * @param input The input string to tokenize.
	 * @param splitChar The character which delineates tokens
	 *        within the input string.
	 */
	public SingleCharacterTokenizer(String input, char splitChar) {
		this.input = input;
		this.splitChar = splitChar;
		hasMoreTokens = !input.isEmpty();
	}

	/** {@inheritDoc} */
	@Override
	public boolean hasMoreElements() {
		return hasMoreTokens;
	}

	/** {@inheritDoc} */
	@Override
	public String nextElement() {
		if (!hasMoreTokens) {
			throw new NoSuchElementException();
		}
		int next = input.indexOf(splitChar, currentPos);
		if (next >= 0) {
			String token = input.substring(currentPos, next);
			currentPos = next + 1;
			return token;
		}

		// We reached the end of the input, return what we have
		String token = input.substring(currentPos);
		currentPos = input.length();
		hasMoreTokens = false;
		return token;
	}
}
