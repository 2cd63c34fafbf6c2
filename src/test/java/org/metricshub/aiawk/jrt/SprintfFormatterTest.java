package org.metricshub.aiawk.jrt;

import static org.junit.Assert.*;

import java.util.Locale;
import org.junit.Test;

public class SprintfFormatterTest {

	private static String format(String format, Object... args) {
		AwkValue[] values = new AwkValue[args.length];
		for (int i = 0; i < args.length; i++) {
			values[i] = args[i] instanceof Number ? AwkValue.of(((Number) args[i]).doubleValue()) : AwkValue.of((String) args[i]);
		}
		return SprintfFormatter.format(Locale.US, format, values, AwkValue.DEFAULT_CONVFMT);
	}

	@Test
	public void testIntegers() {
		assertEquals("42", format("%d", 42));
		assertEquals("-3", format("%i", -3.7));
		assertEquals("00042", format("%05d", 42));
		assertEquals("42   |", format("%-5d|", 42));
		assertEquals("+5", format("%+d", 5));
		assertEquals(" 5", format("% d", 5));
		assertEquals("   42", format("%*d", 5, 42));
		assertEquals("007", format("%.3d", 7));
		assertEquals("12", format("%d", "12abc"));
	}

	@Test
	public void testRadix() {
		assertEquals("ff", format("%x", 255));
		assertEquals("FF", format("%X", 255));
		assertEquals("0xff", format("%#x", 255));
		assertEquals("10", format("%o", 8));
		assertEquals("010", format("%#o", 8));
	}

	@Test
	public void testFloatingPoint() {
		assertEquals(" 3.14", format("%5.2f", 3.14159));
		assertEquals("3.141590", format("%f", 3.14159));
		assertEquals("1.234500e+03", format("%e", 1234.5));
		assertEquals("1.2E+03", format("%.1E", 1234.5));
		assertEquals("3.14159", format("%g", 3.14159265));
		assertEquals("1e-05", format("%g", 0.00001));
		assertEquals("1.23457e+08", format("%g", 123456789.5));
		assertEquals("100", format("%g", 100));
		assertEquals("1E-10", format("%G", 1e-10));
		assertEquals("-0002.50", format("%08.2f", -2.5));
	}

	@Test
	public void testStringsAndCharacters() {
		assertEquals("   ab", format("%5s", "ab"));
		assertEquals("ab   |", format("%-5s|", "ab"));
		assertEquals("abc", format("%.3s", "abcdef"));
		assertEquals("A", format("%c", 65));
		assertEquals("h", format("%c", "hello"));
		assertEquals("0.5", format("%s", 0.5));
	}

	@Test
	public void testStarWidthAndPrecision() {
		assertEquals("3.14", format("%.*f", 2, 3.14159));
		assertEquals("7   |", format("%*d|", -4, 7));
		assertEquals("  abc", format("%*.*s", 5, 3, "abcdef"));
	}

	@Test
	public void testConversionsNeedingAdjustment() {
		assertEquals("1.500000", format("%F", 1.5));
		assertEquals("[]", format("[%c]", ""));
		assertEquals("[     1e+20]", format("[%10g]", 1e20));
		assertEquals("[1e+20     ]", format("[%-10g]", 1e20));
		assertEquals("nan inf", format("%d %f", Double.NaN, Double.POSITIVE_INFINITY));
	}

	@Test
	public void testPercentAndMissingArguments() {
		assertEquals("100%", format("%d%%", 100));
		assertEquals("0 ", format("%d %s"));
		assertEquals("value: %", format("value: %"));
		assertEquals("%z", format("%z", 1));
	}
}
