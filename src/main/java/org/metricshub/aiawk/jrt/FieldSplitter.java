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
import java.util.StringTokenizer;

/**
 * Splits text the way AWK splits records into fields, shared by the
 * record engine and the <code>split()</code> function.
 * <ul>
 * <li>a single space (the default) splits on runs of blanks, tabs and
 * newlines, ignoring leading and trailing ones;</li>
 * <li>any other single character is a literal separator;</li>
 * <li>anything longer is a regular expression.</li>
 * </ul>
 * An empty text always yields no field at all.
 */
public final class FieldSplitter {

	private FieldSplitter() {}

	/**
	 * @param text text to split
	 * @param fs field separator
	 * @param newlineSeparates whether a newline also separates fields
	 *        (paragraph mode, when RS is empty)
	 * @param regexCache cache compiling regular expression separators
	 * @return the fields, in order
	 */
	public static List<String> split(String text, String fs, boolean newlineSeparates, RegexCache regexCache) {
		List<String> fields = new ArrayList<String>();
		if (text.isEmpty()) {
			return fields;
		}
		Enumeration<?> tokenizer;
		if (" ".equals(fs)) {
			tokenizer = new StringTokenizer(text, " \t\n");
		} else if (newlineSeparates) {
			String separator = fs.length() == 1 ? quote(fs.charAt(0)) : "(" + fs + ")";
			tokenizer = new RegexTokenizer(text, regexCache.compile(separator + "|\n"));
		} else if (fs.length() == 1) {
			tokenizer = new SingleCharacterTokenizer(text, fs.charAt(0));
		} else if (fs.isEmpty()) {
			// gawk extension: every character is a field
			for (int i = 0; i < text.length(); i++) {
				fields.add(String.valueOf(text.charAt(i)));
			}
			return fields;
		} else {
			tokenizer = new RegexTokenizer(text, regexCache.compile(fs));
		}
		while (tokenizer.hasMoreElements()) {
			fields.add(tokenizer.nextElement().toString());
		}
		return fields;
	}

	private static String quote(char c) {
		return Character.isLetterOrDigit(c) ? String.valueOf(c) : "\\" + c;
	}
}
