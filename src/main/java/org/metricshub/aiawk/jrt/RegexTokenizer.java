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

import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Similar to StringTokenizer, except that tokens are delimited
 * by a regular expression. Adjacent delimiters produce empty tokens,
 * and so does a delimiter at the start of the input. Empty matches
 * never delimit anything.
 *
 * @author Danny Daglas
 */
public class RegexTokenizer implements Enumeration<String> {

	private final List<String> tokens = new ArrayList<String>();
	private int idx = 0;

	/**
	 * Construct a RegexTokenizer.
	 *
	 * @param input The input string to tokenize.
	 * @param delimiter The regular expression delineating tokens
	 *        within the input string.
	 */
	public RegexTokenizer(String input, Pattern delimiter) {
		if (input.isEmpty()) {
			return;
		}
		Matcher matcher = delimiter.matcher(input);
		int last = 0;
		while (matcher.find()) {
			if (matcher.end() == matcher.start()) {
				continue;
			}
			tokens.add(input.substring(last, matcher.start()));
			last = matcher.end();
		}
		tokens.add(input.substring(last));
	}

	/** {@inheritDoc} */
	@Override
	public boolean hasMoreElements() {
		return idx < tokens.size();
	}

	/** {@inheritDoc} */
	@Override
	public String nextElement() {
		return tokens.get(idx++);
	}
}
