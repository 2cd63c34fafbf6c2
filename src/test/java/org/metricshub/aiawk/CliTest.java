package org.metricshub.aiawk;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import org.junit.Test;
import org.metricshub.aiawk.util.AwkSettings;

public class CliTest {

	/**
	 * Output of a {@link Main#run} invocation.
	 */
	private static final class MainResult {
		private final int status;
		private final String out;
		private final String err;

		private MainResult(int status, String out, String err) {
			this.status = status;
			this.out = out;
			this.err = err;
		}
	}

	private static MainResult runMain(String stdin, String... args) throws Exception {
		ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
		ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8.name());
		PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8.name());
		int status = Main.run(args, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), out, err);
		out.flush();
		err.flush();
		return new MainResult(
				status,
				outBytes.toString(StandardCharsets.UTF_8.name()),
				errBytes.toString(StandardCharsets.UTF_8.name()));
	}

	@Test
	public void testTabFieldSeparator() throws Exception {
		AwkTestSupport
				.cliTest("-F t")
				.argument("-F", "t")
				.script("{ print $2 }")
				.stdin("a\tb c\n")
				.expectLines("b c")
				.runAndAssert();
	}

	@Test
	public void testAttachedFieldSeparator() throws Exception {
		AwkTestSupport
				.cliTest("-F:")
				.argument("-F:")
				.script("{ print $3 }")
				.stdin("root:x:0:0\n")
				.expectLines("0")
				.runAndAssert();
	}

	@Test
	public void testVariableAssignment() throws Exception {
		AwkTestSupport
				.cliTest("-v")
				.argument("-v", "greeting=hello", "-v", "n=3")
				.script("BEGIN { print greeting, n + 1 }")
				.expectLines("hello 4")
				.runAndAssert();
	}

	@Test
	public void testScriptFiles() throws Exception {
		AwkTestSupport
				.cliTest("-f twice")
				.file("lib.awk", "function twice(x) { return 2 * x }\n")
				.file("main.awk", "{ total += twice($1) }\nEND { print total }\n")
				.argument("-f", "{{lib.awk}}", "-f", "{{main.awk}}")
				.stdin("1\n2\n3\n")
				.expectLines("12")
				.runAndAssert();
	}

	@Test
	public void testOperands() throws Exception {
		AwkTestSupport
				.cliTest("operands")
				.file("data.txt", "1\n2\n")
				.script("{ print prefix $0 }")
				.operand("prefix=>", "{{data.txt}}")
				.expectLines(">1", ">2")
				.runAndAssert();
	}

	@Test
	public void testExitStatus() throws Exception {
		AwkTestSupport
				.cliTest("exit status")
				.script("BEGIN { print \"bye\"; exit 4 }")
				.expectLines("bye")
				.expectExit(4)
				.runAndAssert();
	}

	@Test
	public void testTextAnalysisFunctionsAreAvailable() throws Exception {
		AwkTestSupport
				.cliTest("ai functions")
				.script("{ print ai_sentiment($0) }")
				.stdin("I love it\nthis is awful\n")
				.expectLines("positive", "negative")
				.runAndAssert();
	}

	@Test
	public void testParsedSettings() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-t", "--locale", "fr-FR", "--timeout", "500", "-F:", "{ print }", "a=1", "input.txt" });
		AwkSettings settings = cli.getSettings();
		assertTrue(settings.isUseSortedArrayKeys());
		assertEquals(Locale.FRANCE, settings.getLocale());
		assertEquals(500, settings.getForeignCallTimeout());
		assertEquals(":", settings.getFieldSeparator());
		assertEquals(Arrays.asList("a=1", "input.txt"), settings.getNameValueOrFileNames());
		assertEquals(1, cli.getScriptSources().size());
		assertFalse(cli.isPrintUsage());
	}

	@Test
	public void testDoubleDashEndsOptions() {
		Cli cli = new Cli();
		cli.parse(new String[] { "--", "-1 { print }" });
		assertEquals(1, cli.getScriptSources().size());
	}

	@Test
	public void testUsage() throws Exception {
		MainResult help = runMain("", "-h");
		assertEquals(0, help.status);
		assertTrue(help.out.startsWith("Usage:"));

		MainResult noArgs = runMain("");
		assertEquals(0, noArgs.status);
		assertTrue(noArgs.out.contains("-f filename"));
	}

	@Test
	public void testInvalidArguments() throws Exception {
		MainResult unknown = runMain("", "-x", "BEGIN { }");
		assertEquals(Main.FATAL_ERROR_STATUS, unknown.status);
		assertTrue(unknown.err.contains("Unknown parameter: -x"));
		assertTrue(unknown.err.contains("Failed to parse arguments"));

		assertEquals(Main.FATAL_ERROR_STATUS, runMain("", "-h", "BEGIN { }").status);
		assertEquals(Main.FATAL_ERROR_STATUS, runMain("", "--timeout", "0", "BEGIN { }").status);
		assertEquals(Main.FATAL_ERROR_STATUS, runMain("", "--timeout", "soon", "BEGIN { }").status);
		assertEquals(Main.FATAL_ERROR_STATUS, runMain("", "-v", "1x=2", "BEGIN { }").status);
		assertEquals(Main.FATAL_ERROR_STATUS, runMain("", "-v").status);
		assertEquals(Main.FATAL_ERROR_STATUS, runMain("", "-t").status);
	}

	@Test
	public void testMissingScriptFile() throws Exception {
		MainResult result = runMain("", "-f", "/nonexistent/aiawk/script.awk");
		assertEquals(Main.FATAL_ERROR_STATUS, result.status);
		assertTrue(result.err.contains("Failed to read script"));
	}

	@Test
	public void testRuntimeErrorReportsLine() throws Exception {
		MainResult result = runMain("", "BEGIN {\n  print \"before\"\n  x = 1 / 0\n}");
		assertEquals(Main.FATAL_ERROR_STATUS, result.status);
		assertEquals("before\n", result.out);
		assertTrue(result.err, result.err.startsWith("AwkRuntimeException (line 3): division by zero"));
	}

	@Test
	public void testSyntaxError() throws Exception {
		MainResult result = runMain("", "BEGIN { x = }");
		assertEquals(Main.FATAL_ERROR_STATUS, result.status);
		assertTrue(result.err, result.err.startsWith("ParserException: "));
		assertEquals("", result.out);
	}

	@Test
	public void testMissingInputFile() throws Exception {
		MainResult result = runMain("", "{ print }", "/nonexistent/aiawk/input.txt");
		assertEquals(Main.FATAL_ERROR_STATUS, result.status);
		assertTrue(result.err, result.err.startsWith("AwkInputException"));
	}
}
