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

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles AWK extended regular expressions into {@link Pattern}s,
 * lazily, keeping one compiled pattern per distinct expression text.
 * <p>
 * The translation handles the spots where POSIX ERE and
 * {@code java.util.regex} disagree: POSIX character classes
 * (<code>[:alpha:]</code>), a literal <code>]</code> or <code>[</code>
 * inside a bracket expression, and braces that do not form an interval.
 */
public class RegexCache {

	private static final Map<String, String> POSIX_CLASSES = new HashMap<String, String>();

	static {
		POSIX_CLASSES.put("alpha", "\\p{Alpha}");
		POSIX_CLASSES.put("digit", "\\p{Digit}");
		POSIX_CLASSES.put("alnum", "\\p{Alnum}");
		POSIX_CLASSES.put("upper", "\\p{Upper}");
		POSIX_CLASSES.put("lower", "\\p{Lower}");
		POSIX_CLASSES.put("space", "\\s");
		POSIX_CLASSES.put("blank", " \\t");
		POSIX_CLASSES.put("punct", "\\p{Punct}");
		POSIX_CLASSES.put("print", "\\p{Print}");
		POSIX_CLASSES.put("graph", "\\p{Graph}");
		POSIX_CLASSES.put("cntrl", "\\p{Cntrl}");
		POSIX_CLASSES.put("xdigit", "\\p{XDigit}");
	}

	private final Map<String, Pattern> cache = new HashMap<String, Pattern>();

	/**
	 * Returns the compiled form of an AWK regular expression.
	 *
	 * @param regex regular expression text, as written in the program or
	 *        as computed from a string value
	 * @return the compiled pattern
	 * @throws AwkRuntimeException when the expression is invalid
	 */
	public Pattern compile(String regex) {
		Pattern pattern = cache.get(regex);
		if (pattern == null) {
			try {
				pattern = Pattern.compile(translate(regex));
			} catch (PatternSyntaxException e) {
				throw new AwkRuntimeException("Invalid regular expression /" + regex + "/: " + e.getDescription(), e);
			}
			cache.put(regex, pattern);
		}
		return pattern;
	}

	/**
	 * @return the number of distinct expressions compiled so far
	 */
	public int size() {
		return cache.size();
	}

	/**
	 * Rewrites an ERE into the {@code java.util.regex} dialect.
	 *
	 * @param regex ERE text
	 * @return equivalent Java regular expression
	 */
	static String translate(String regex) {
		StringBuilder out = new StringBuilder(regex.length() + 8);
		int len = regex.length();
		int i = 0;
		while (i < len) {
			char c = regex.charAt(i);
			if (c == '\\' && i + 1 < len) {
				out.append(c).append(regex.charAt(i + 1));
				i += 2;
			} else if (c == '[') {
				i = translateBracket(regex, i, out);
			} else if (c == '{' && !isInterval(regex, i)) {
				out.append("\\{");
				i++;
			} else if (c == '}' && !closesInterval(regex, i)) {
				out.append("\\}");
				i++;
			} else {
				out.append(c);
				i++;
			}
		}
		return out.toString();
	}

	private static int translateBracket(String regex, int start, StringBuilder out) {
		int len = regex.length();
		int i = start + 1;
		StringBuilder body = new StringBuilder();
		boolean negated = false;
		if (i < len && regex.charAt(i) == '^') {
			negated = true;
			i++;
		}
		if (i < len && regex.charAt(i) == ']') {
			body.append("\\]");
			i++;
		}
		while (i < len && regex.charAt(i) != ']') {
			char c = regex.charAt(i);
			if (c == '[' && i + 1 < len && regex.charAt(i + 1) == ':') {
				int end = regex.indexOf(":]", i + 2);
				if (end > 0) {
					String translated = POSIX_CLASSES.get(regex.substring(i + 2, end));
					if (translated != null) {
						body.append(translated);
						i = end + 2;
						continue;
					}
				}
				body.append("\\[");
				i++;
			} else if (c == '[' || c == '&') {
				body.append('\\').append(c);
				i++;
			} else if (c == '\\' && i + 1 < len) {
				body.append(c).append(regex.charAt(i + 1));
				i += 2;
			} else {
				body.append(c);
				i++;
			}
		}
		if (i >= len) {
			// no closing bracket: a literal '['
			out.append("\\[");
			return start + 1;
		}
		out.append('[');
		if (negated) {
			out.append('^');
		}
		out.append(body).append(']');
		return i + 1;
	}

	private static boolean isInterval(String regex, int open) {
		if (open == 0) {
			return false;
		}
		int close = regex.indexOf('}', open);
		if (close < 0) {
			return false;
		}
		return regex.substring(open + 1, close).matches("\\d+(,\\d*)?");
	}

	private static boolean closesInterval(String regex, int close) {
		int open = regex.lastIndexOf('{', close);
		return open >= 0 && isInterval(regex, open) && regex.indexOf('}', open) == close;
	}
}
