package org.metricshub.aiawk;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Table of expressions printed from a BEGIN action, each compared to the
 * output it must produce.
 */
@RunWith(Parameterized.class)
public class ExpressionPTest {

	@Parameters(name = "{0}")
	public static List<Object[]> expressions() {
		return Arrays.asList(new Object[][] {
				{ "1 + 2 * 3", "7" },
				{ "2 ^ 3 ^ 2", "512" },
				{ "7 % 3", "1" },
				{ "-7 % 3", "-1" },
				{ "1 / 4", "0.25" },
				{ "0.1 + 0.2", "0.3" },
				{ "1e3", "1000" },
				{ "1e17", "100000000000000000" },
				{ "2 ^ 70", "1.18059e+21" },
				{ "int(-3.7)", "-3" },
				{ "\"3x\" + 1", "4" },
				{ "1 \" \" 2", "1 2" },
				{ "length(\"abc\") 1", "31" },
				{ "\"10\" < \"9\"", "1" },
				{ "10 < 9", "0" },
				{ "1 == 1.0", "1" },
				{ "!\"\"", "1" },
				{ "!\"0\"", "0" },
				{ "x++ + ++x", "2" },
				{ "3 > 2 ? \"y\" : \"n\"", "y" },
				{ "\"abc\" ~ /b/", "1" },
				{ "substr(\"hello\", 2)", "ello" },
				{ "sprintf(\"%05.1f\", 3.14159)", "003.1" } });
	}

	/** Expression to print */
	@Parameter(0)
	public String expression;

	/** Expected output line */
	@Parameter(1)
	public String expected;

	@Test
	public void test() throws Exception {
		AwkTestSupport
				.awkTest(expression)
				.script("BEGIN { print (" + expression + ") }")
				.expectLines(expected)
				.runAndAssert();
	}
}
