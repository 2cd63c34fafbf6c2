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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * An AWK scalar.
 * <p>
 * A value carries a string representation, a numeric representation,
 * or both. Values read from input that look like numbers are flagged as
 * <em>strnum</em>: they compare numerically against numbers and as
 * strings otherwise. The alternate representation is computed lazily
 * and cached; the value itself is immutable.
 * <p>
 * The uninitialized value is both {@code ""} and {@code 0}.
 */
public final class AwkValue {

	private static final int KIND_UNINITIALIZED = 0;
	private static final int KIND_NUMBER = 1;
	private static final int KIND_STRING = 2;
	private static final int KIND_STRNUM = 3;

	/** Default conversion format, used when no session is at hand */
	public static final String DEFAULT_CONVFMT = "%.6g";

	/**
	 * Strict numeric syntax used to detect strnums: optional blanks,
	 * an optional sign, a decimal mantissa and an optional exponent.
	 */
	private static final Pattern NUMERIC_STRING = Pattern
			.compile("[ \\t\\n]*[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?[ \\t\\n]*");

	/** The value of a variable that has never been assigned */
	public static final AwkValue UNINITIALIZED = new AwkValue(KIND_UNINITIALIZED, "", 0);

	/** Numeric one, the result of a true comparison */
	public static final AwkValue ONE = new AwkValue(KIND_NUMBER, null, 1);

	/** Numeric zero, the result of a false comparison */
	public static final AwkValue ZERO = new AwkValue(KIND_NUMBER, null, 0);

	/** The empty string */
	public static final AwkValue EMPTY = new AwkValue(KIND_STRING, "", 0);

	private final int kind;
	private final String string;
	private final double number;

	private boolean numberParsed;
	private double parsedNumber;
	private String formatted;
	private String formattedWith;

	private AwkValue(int kind, String string, double number) {
		this.kind = kind;
		this.string = string;
		this.number = number;
	}

	/**
	 * @param number numeric value
	 * @return a number value
	 */
	public static AwkValue of(double number) {
		if (number == 0 && Double.doubleToRawLongBits(number) == 0L) {
			return ZERO;
		}
		if (number == 1) {
			return ONE;
		}
		return new AwkValue(KIND_NUMBER, null, number);
	}

	/**
	 * @param string string value, never treated as a number in comparisons
	 * @return a string value
	 */
	public static AwkValue of(String string) {
		if (string.isEmpty()) {
			return EMPTY;
		}
		return new AwkValue(KIND_STRING, string, 0);
	}

	/**
	 * @param condition boolean result
	 * @return {@link #ONE} or {@link #ZERO}
	 */
	public static AwkValue of(boolean condition) {
		return condition ? ONE : ZERO;
	}

	/**
	 * Creates a value coming from input data (fields, records, command-line
	 * assignments). When the text looks numeric, the value is a strnum.
	 *
	 * @param text text read from input
	 * @return a string or strnum value
	 */
	public static AwkValue fromInput(String text) {
		if (looksNumeric(text)) {
			return new AwkValue(KIND_STRNUM, text, 0);
		}
		return of(text);
	}

	/**
	 * Whether the specified text is entirely a decimal number, surrounding
	 * blanks allowed.
	 *
	 * @param text text to check
	 * @return {@code true} when the text qualifies as a strnum
	 */
	public static boolean looksNumeric(String text) {
		return !text.isEmpty() && NUMERIC_STRING.matcher(text).matches();
	}

	/**
	 * @return whether this value has never been assigned
	 */
	public boolean isUninitialized() {
		return kind == KIND_UNINITIALIZED;
	}

	/**
	 * @return whether this value is a pure number
	 */
	public boolean isNumber() {
		return kind == KIND_NUMBER;
	}

	/**
	 * @return whether this value came from input and looks numeric
	 */
	public boolean isStrnum() {
		return kind == KIND_STRNUM;
	}

	/**
	 * @return whether comparisons involving this value may be numeric
	 */
	public boolean isNumeric() {
		return kind != KIND_STRING;
	}

	/**
	 * Numeric view of this value. Strings are converted with the
	 * leading-numeric-prefix rule.
	 *
	 * @return the number
	 */
	public double toNumber() {
		if (kind == KIND_NUMBER || kind == KIND_UNINITIALIZED) {
			return number;
		}
		if (!numberParsed) {
			parsedNumber = parseNumericPrefix(string);
			numberParsed = true;
		}
		return parsedNumber;
	}

	/**
	 * String view of this value, numbers being formatted with the specified
	 * conversion format unless they are integral.
	 *
	 * @param convfmt printf-style format for non-integral numbers
	 * @param locale locale for number formatting
	 * @return the string
	 */
	public String toString(String convfmt, Locale locale) {
		if (kind != KIND_NUMBER) {
			return string;
		}
		if (formatted == null || !convfmt.equals(formattedWith)) {
			formatted = formatNumber(number, convfmt, locale);
			formattedWith = convfmt;
		}
		return formatted;
	}

	/**
	 * Truth value: numbers and strnums are true when non-zero, strings
	 * when non-empty, the uninitialized value is false.
	 *
	 * @return the truth value
	 */
	public boolean toBoolean() {
		switch (kind) {
		case KIND_NUMBER:
		case KIND_STRNUM:
			return toNumber() != 0;
		case KIND_STRING:
			return !string.isEmpty();
		default:
			return false;
		}
	}

	/**
	 * Compares two values the AWK way: numerically when both are numeric
	 * (numbers, strnums or uninitialized), as strings otherwise.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @param convfmt format used to turn numbers into strings
	 * @param locale locale for number formatting
	 * @return a negative number, zero or a positive number
	 */
	public static int compare(AwkValue left, AwkValue right, String convfmt, Locale locale) {
		if (left.isNumeric() && right.isNumeric()) {
			return Double.compare(normalizeZero(left.toNumber()), normalizeZero(right.toNumber()));
		}
		return left.toString(convfmt, locale).compareTo(right.toString(convfmt, locale));
	}

	private static double normalizeZero(double d) {
		return d == 0 ? 0.0 : d;
	}

	/**
	 * Parses the longest numeric prefix of the specified string, after
	 * leading blanks. No numeric prefix means zero.
	 *
	 * @param s string to parse
	 * @return the parsed number
	 */
	public static double parseNumericPrefix(String s) {
		int len = s.length();
		int i = 0;
		while (i < len && Character.isWhitespace(s.charAt(i))) {
			i++;
		}
		int start = i;
		if (i < len && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
			i++;
		}
		int digits = 0;
		while (i < len && Character.isDigit(s.charAt(i))) {
			i++;
			digits++;
		}
		if (i < len && s.charAt(i) == '.') {
			i++;
			while (i < len && Character.isDigit(s.charAt(i))) {
				i++;
				digits++;
			}
		}
		if (digits == 0) {
			return 0;
		}
		int end = i;
		if (i < len && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
			int j = i + 1;
			if (j < len && (s.charAt(j) == '+' || s.charAt(j) == '-')) {
				j++;
			}
			if (j < len && Character.isDigit(s.charAt(j))) {
				while (j < len && Character.isDigit(s.charAt(j))) {
					j++;
				}
				end = j;
			}
		}
		try {
			return Double.parseDouble(s.substring(start, end));
		} catch (NumberFormatException e) {
			return 0;
		}
	}

	/**
	 * Formats a number for string context: integral values print as
	 * integers, others go through the specified format.
	 *
	 * @param d number to format
	 * @param format printf-style format such as CONVFMT or OFMT
	 * @param locale locale for the decimal separator
	 * @return the formatted number
	 */
	public static String formatNumber(double d, String format, Locale locale) {
		if (Double.isNaN(d)) {
			return "nan";
		}
		if (Double.isInfinite(d)) {
			return d > 0 ? "inf" : "-inf";
		}
		if (d == Math.rint(d) && Math.abs(d) < 0x1p63) {
			return Long.toString((long) d);
		}
		return SprintfFormatter.format(locale, format, new AwkValue[] { of(d) }, DEFAULT_CONVFMT);
	}

	/**
	 * String view with the default conversion format, for diagnostics.
	 */
	@Override
	public String toString() {
		return toString(DEFAULT_CONVFMT, Locale.US);
	}
}
