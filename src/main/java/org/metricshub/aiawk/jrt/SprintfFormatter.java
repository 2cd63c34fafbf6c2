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
import org.metricshub.printf4j.Printf4J;

/**
 * <code>printf</code> and <code>sprintf</code> over AWK values, formatted
 * with {@link Printf4J}.
 * <p>
 * The format is walked once to give each conversion an argument of the
 * right kind: numeric conversions get the numeric view of the value,
 * <code>%s</code> gets its string view. <code>*</code> widths and
 * precisions are replaced by the value of their argument, and missing
 * arguments are uninitialized values. Each conversion is then rendered by
 * Printf4J.
 */
public final class SprintfFormatter {

	private static final String CONVERSIONS = "diouxXcseEfFgG";

	private SprintfFormatter() {}

	/**
	 * Formats the arguments according to the format string.
	 *
	 * @param locale locale for decimal separators
	 * @param format printf-style format string
	 * @param args arguments consumed by the conversions
	 * @param convfmt format used when a number is printed with <code>%s</code>
	 * @return the formatted string
	 */
	public static String format(Locale locale, String format, AwkValue[] args, String convfmt) {
		StringBuilder out = new StringBuilder();
		int argIdx = 0;
		int len = format.length();
		int i = 0;
		while (i < len) {
			char c = format.charAt(i);
			if (c != '%') {
				out.append(c);
				i++;
				continue;
			}
			int specStart = i;
			i++;
			if (i < len && format.charAt(i) == '%') {
				out.append('%');
				i++;
				continue;
			}
			StringBuilder flags = new StringBuilder();
			while (i < len && "-+ #0".indexOf(format.charAt(i)) >= 0) {
				if (flags.indexOf(String.valueOf(format.charAt(i))) < 0) {
					flags.append(format.charAt(i));
				}
				i++;
			}
			String width;
			if (i < len && format.charAt(i) == '*') {
				long w = (long) arg(args, argIdx++).toNumber();
				if (w < 0) {
					if (flags.indexOf("-") < 0) {
						flags.append('-');
					}
					w = -w;
				}
				width = w == 0 ? "" : Long.toString(w);
				i++;
			} else {
				int start = i;
				while (i < len && Character.isDigit(format.charAt(i))) {
					i++;
				}
				width = format.substring(start, i);
			}
			String precision = null;
			if (i < len && format.charAt(i) == '.') {
				i++;
				if (i < len && format.charAt(i) == '*') {
					long p = (long) arg(args, argIdx++).toNumber();
					precision = p < 0 ? null : Long.toString(p);
					i++;
				} else {
					int start = i;
					while (i < len && Character.isDigit(format.charAt(i))) {
						i++;
					}
					precision = i > start ? String.valueOf(Integer.parseInt(format.substring(start, i))) : "0";
				}
			}
			// length modifiers are accepted and ignored
			while (i < len && "hlLqjzt".indexOf(format.charAt(i)) >= 0) {
				i++;
			}
			if (i >= len || CONVERSIONS.indexOf(format.charAt(i)) < 0) {
				// not a conversion: printed as is
				int end = Math.min(i + 1, len);
				out.append(format, specStart, end);
				i = end;
				continue;
			}
			char conversion = format.charAt(i++);
			out.append(convert(locale, flags.toString(), width, precision, conversion, arg(args, argIdx++), convfmt));
		}
		return out.toString();
	}

	private static AwkValue arg(AwkValue[] args, int idx) {
		return idx < args.length ? args[idx] : AwkValue.UNINITIALIZED;
	}

	private static String convert(
			Locale locale,
			String flags,
			String width,
			String precision,
			char conversion,
			AwkValue value,
			String convfmt) {
		String spec = "%" + flags + width + (precision == null ? "" : "." + precision);
		switch (conversion) {
		case 's':
			return Printf4J.sprintf(locale, spec + 's', value.toString(convfmt, locale));
		case 'c':
			if (value.isNumber()) {
				return Printf4J.sprintf(locale, "%" + flags + width + 'c', Double.valueOf(value.toNumber()));
			}
			String text = value.toString(convfmt, locale);
			if (text.isEmpty()) {
				return pad(locale, flags, width, "");
			}
			return Printf4J.sprintf(locale, "%" + flags + width + 'c', text);
		default:
			break;
		}

		double d = value.toNumber();
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			return pad(locale, flags, width, Double.isNaN(d) ? "nan" : d > 0 ? "inf" : "-inf");
		}
		if (conversion == 'F') {
			conversion = 'f';
		}
		if ((conversion == 'g' || conversion == 'G') && flags.indexOf('#') < 0) {
			String general = Printf4J.sprintf(locale, "%" + flags.replace("0", "").replace("-", "")
					+ (precision == null ? "" : "." + precision) + conversion, Double.valueOf(d));
			return pad(locale, flags, width, trimMantissa(general));
		}
		return Printf4J.sprintf(locale, spec + conversion, Double.valueOf(d));
	}

	/**
	 * Removes the trailing zeros of the mantissa of a number in exponent
	 * notation: <code>1.00000e+20</code> becomes <code>1e+20</code>.
	 */
	private static String trimMantissa(String number) {
		int exponent = number.indexOf('e');
		if (exponent < 0) {
			exponent = number.indexOf('E');
		}
		if (exponent < 0) {
			return number;
		}
		int dot = number.lastIndexOf('.', exponent);
		if (dot < 0) {
			dot = number.lastIndexOf(',', exponent);
		}
		if (dot < 0) {
			return number;
		}
		int end = exponent;
		while (end > dot + 1 && number.charAt(end - 1) == '0') {
			end--;
		}
		if (end == dot + 1) {
			end = dot;
		}
		return number.substring(0, end) + number.substring(exponent);
	}

	private static String pad(Locale locale, String flags, String width, String text) {
		if (width.isEmpty()) {
			return text;
		}
		return Printf4J.sprintf(locale, "%" + (flags.indexOf('-') >= 0 ? "-" : "") + width + 's', text);
	}
}
