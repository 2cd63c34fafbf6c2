package org.metricshub.aiawk;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.metricshub.aiawk.ext.AwkExtension;
import org.metricshub.aiawk.util.AwkSettings;
import org.metricshub.aiawk.util.ScriptSource;

/**
 * Reusable helpers for building and executing AiAwk tests, so that all tests
 * share the same approach for managing temporary files, providing input, and
 * capturing the results of either {@link Awk} or {@link Cli} executions. The
 * class exposes fluent builders ({@link #awkTest(String)} and
 * {@link #cliTest(String)}) that let tests describe their scripts, inputs, and
 * expectations declaratively before executing or asserting the results.
 */
public final class AwkTestSupport {

	private AwkTestSupport() {}

	/**
	 * Creates a builder for a unit test that exercises the {@link Awk} API directly.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static AwkTestBuilder awkTest(String description) {
		return new AwkTestBuilder(description);
	}

	/**
	 * Creates a builder for a unit test that exercises the {@link Cli} entry
	 * point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Captures the outcome of executing a configured test including the raw
	 * output, exit code, and any expectations configured on the builder.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final int exitCode;
		private final String expectedOutput;
		private final List<String> expectedLines;
		private final Integer expectedExitCode;
		private final Class<? extends Throwable> expectedException;
		private final Throwable thrownException;

		TestResult(
				String description,
				String output,
				int exitCode,
				String expectedOutput,
				List<String> expectedLines,
				Integer expectedExitCode,
				Class<? extends Throwable> expectedException,
				Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.exitCode = exitCode;
			this.expectedOutput = expectedOutput;
			this.expectedLines = expectedLines != null ? Collections.unmodifiableList(new ArrayList<>(expectedLines)) : null;
			this.expectedExitCode = expectedExitCode;
			this.expectedException = expectedException;
			this.thrownException = thrownException;
		}

		/**
		 * Returns the captured stdout of the test execution.
		 *
		 * @return the captured output as a UTF-8 string
		 */
		public String output() {
			return output;
		}

		/**
		 * Returns the exit code reported by the execution.
		 *
		 * @return the exit code observed at runtime
		 */
		public int exitCode() {
			return exitCode;
		}

		/**
		 * Returns the exception that was thrown while executing the test.
		 *
		 * @return the thrown exception or {@code null} when execution completed
		 *         normally
		 */
		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Verifies that the captured output, exit code, or thrown exception match
		 * the expectations defined in the builder.
		 */
		public void assertExpected() {
			if (expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				return;
			}
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, normalizeOutputLines(output));
			} else if (expectedOutput != null) {
				assertEquals("Unexpected output for " + description, expectedOutput, output);
			}
			int expectedCode = expectedExitCode != null ? expectedExitCode.intValue() : 0;
			assertEquals("Unexpected exit code for " + description, expectedCode, exitCode);
		}

		private static List<String> normalizeOutputLines(String output) {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/**
	 * Fluent builder for tests that execute {@link Awk} directly.
	 */
	public static final class AwkTestBuilder extends BaseTestBuilder<AwkTestBuilder> {
		private final Map<String, String> preAssignments = new LinkedHashMap<>();
		private final List<AwkExtension> extensions = new ArrayList<>();
		private String fieldSeparator;

		private AwkTestBuilder(String description) {
			super(description);
		}

		/**
		 * Registers a value to pre-assign to a variable before the script is
		 * executed, like <code>-v</code> does.
		 *
		 * @param name the variable name
		 * @param value the value to expose to the script
		 * @return this builder for method chaining
		 */
		public AwkTestBuilder preassign(String name, String value) {
			preAssignments.put(name, value);
			return this;
		}

		/**
		 * @param fs initial value of FS
		 * @return this builder for method chaining
		 */
		public AwkTestBuilder fieldSeparator(String fs) {
			this.fieldSeparator = fs;
			return this;
		}

		/**
		 * Adds extensions that will be loaded when creating the {@link Awk}
		 * instance used by this test.
		 *
		 * @param extensionsParam the extensions to enable
		 * @return this builder for method chaining
		 */
		public AwkTestBuilder withExtensions(AwkExtension... extensionsParam) {
			extensions.addAll(Arrays.asList(extensionsParam));
			return this;
		}

		@Override
		protected ActualResult execute(ExecutionEnvironment env) throws Exception {
			AwkSettings settings = new AwkSettings();
			for (Map.Entry<String, String> entry : preAssignments.entrySet()) {
				settings.putVariable(entry.getKey(), entry.getValue());
			}
			if (fieldSeparator != null) {
				settings.setFieldSeparator(fieldSeparator);
			}
			settings.setInput(env.stdinStream());
			ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(outBytes, true, StandardCharsets.UTF_8.name()));
			for (String operand : env.operands()) {
				settings.addNameValueOrFileName(operand);
			}
			Awk awk = new Awk(extensions);
			int exitCode = 0;
			try {
				awk.invoke(Collections.singletonList(new ScriptSource("test", new StringReader(env.script()))), settings);
			} catch (ExitException ex) {
				exitCode = ex.getCode();
			}
			return new ActualResult(outBytes.toString(StandardCharsets.UTF_8.name()), exitCode);
		}
	}

	/**
	 * Fluent builder for tests that exercise the {@link Cli} entry point.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> argumentSpecs = new ArrayList<>();

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * Adds raw command-line arguments, placed before the script. Path
		 * placeholders are resolved at runtime.
		 *
		 * @param args the arguments to add
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			argumentSpecs.addAll(Arrays.asList(args));
			return this;
		}

		@Override
		protected ActualResult execute(ExecutionEnvironment env) throws Exception {
			ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
			PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8.name());
			Cli cli = new Cli(env.stdinStream(), out);

			List<String> args = new ArrayList<>();
			for (String spec : argumentSpecs) {
				args.add(env.resolve(spec));
			}
			if (env.script() != null) {
				args.add(env.script());
			}
			args.addAll(env.operands());

			int exitCode = 0;
			try {
				cli.parse(args.toArray(new String[0]));
				cli.run();
			} catch (ExitException ex) {
				exitCode = ex.getCode();
			}
			out.flush();
			return new ActualResult(outBytes.toString(StandardCharsets.UTF_8.name()), exitCode);
		}
	}

	/**
	 * Shared implementation for the fluent builders.
	 *
	 * @param <B> the builder type used for fluent chaining
	 */
	private abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected String script;
		protected String stdin;
		protected final Map<String, String> fileContents = new LinkedHashMap<>();
		protected final List<String> operandSpecs = new ArrayList<>();
		protected String expectedOutput;
		protected List<String> expectedLines;
		protected Integer expectedExitCode;
		protected Class<? extends Throwable> expectedException;

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		private B self() {
			return (B) this;
		}

		/**
		 * Sets the AWK script to execute. <code>{{name}}</code> placeholders
		 * are replaced by the path of the file of that name.
		 *
		 * @param script the script contents
		 * @return this builder for method chaining
		 */
		public B script(String script) {
			this.script = script;
			return self();
		}

		/**
		 * Provides data that will be delivered on standard input when the script
		 * runs.
		 *
		 * @param stdin the content to stream into standard input
		 * @return this builder for method chaining
		 */
		public B stdin(String stdin) {
			this.stdin = stdin;
			return self();
		}

		/**
		 * Adds a temporary file to create before the script runs. The file can be
		 * referenced with {@code {{name}}} placeholders.
		 *
		 * @param name the relative path within the temporary directory
		 * @param contents the file contents to write as UTF-8
		 * @return this builder for method chaining
		 */
		public B file(String name, String contents) {
			fileContents.put(name, contents);
			return self();
		}

		/**
		 * Adds operands to pass to the script when it is executed. Placeholders
		 * are resolved at runtime.
		 *
		 * @param operands the operands to add
		 * @return this builder for method chaining
		 */
		public B operand(String... operands) {
			operandSpecs.addAll(Arrays.asList(operands));
			return self();
		}

		/**
		 * Declares the exact output expected from the script.
		 *
		 * @param expected the expected output
		 * @return this builder for method chaining
		 */
		public B expect(String expected) {
			this.expectedOutput = expected;
			this.expectedLines = null;
			return self();
		}

		/**
		 * Declares the expected output using individual lines.
		 *
		 * @param lines the expected output lines
		 * @return this builder for method chaining
		 */
		public B expectLines(String... lines) {
			this.expectedLines = new ArrayList<>(Arrays.asList(lines));
			this.expectedOutput = null;
			return self();
		}

		/**
		 * Declares the expected exit code for the execution.
		 *
		 * @param code the exit code to expect
		 * @return this builder for method chaining
		 */
		public B expectExit(int code) {
			this.expectedExitCode = code;
			return self();
		}

		/**
		 * Declares the exception type that the script is expected to throw.
		 *
		 * @param exceptionClass the expected exception type
		 * @return this builder for method chaining
		 */
		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			this.expectedException = exceptionClass;
			return self();
		}

		/**
		 * Executes the configured test and returns the captured result without
		 * asserting it.
		 *
		 * @return the captured result
		 * @throws Exception when execution fails unexpectedly
		 */
		public TestResult run() throws Exception {
			Path tempDir = Files.createTempDirectory("aiawk-test");
			try {
				Map<String, Path> placeholders = new LinkedHashMap<>();
				for (Map.Entry<String, String> entry : fileContents.entrySet()) {
					Path path = tempDir.resolve(entry.getKey());
					Files.write(path, entry.getValue().getBytes(StandardCharsets.UTF_8));
					placeholders.put(entry.getKey(), path);
				}
				ExecutionEnvironment env = new ExecutionEnvironment(this, placeholders);
				try {
					ActualResult result = execute(env);
					return new TestResult(
							description,
							result.output,
							result.exitCode,
							expectedOutput != null ? env.resolve(expectedOutput) : null,
							expectedLines,
							expectedExitCode,
							expectedException,
							null);
				} catch (Exception ex) {
					if (expectedException != null && expectedException.isInstance(ex)) {
						return new TestResult(description, "", 0, null, null, null, expectedException, ex);
					}
					throw ex;
				}
			} finally {
				deleteRecursively(tempDir);
			}
		}

		/**
		 * Executes the configured test and immediately asserts the recorded
		 * expectations.
		 *
		 * @throws Exception when execution fails unexpectedly
		 */
		public void runAndAssert() throws Exception {
			run().assertExpected();
		}

		protected abstract ActualResult execute(ExecutionEnvironment env) throws Exception;
	}

	private static final class ExecutionEnvironment {
		private final BaseTestBuilder<?> builder;
		private final Map<String, Path> placeholders;

		ExecutionEnvironment(BaseTestBuilder<?> builder, Map<String, Path> placeholders) {
			this.builder = builder;
			this.placeholders = placeholders;
		}

		String resolve(String value) {
			return replacePlaceholders(value, false);
		}

		String script() {
			return builder.script != null ? replacePlaceholders(builder.script, true) : null;
		}

		InputStream stdinStream() {
			String stdin = builder.stdin != null ? resolve(builder.stdin) : "";
			return new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
		}

		List<String> operands() {
			return builder.operandSpecs.stream().map(this::resolve).collect(Collectors.toList());
		}

		private String replacePlaceholders(String value, boolean escapeForScript) {
			String result = value;
			for (Map.Entry<String, Path> entry : placeholders.entrySet()) {
				String replacement = entry.getValue().toString();
				if (escapeForScript) {
					replacement = escapeForAwkString(replacement);
				}
				result = result.replace("{{" + entry.getKey() + "}}", replacement);
			}
			return result;
		}
	}

	private static final class ActualResult {
		final String output;
		final int exitCode;

		ActualResult(String output, int exitCode) {
			this.output = output;
			this.exitCode = exitCode;
		}
	}

	private static void deleteRecursively(Path root) throws IOException {
		if (root == null || !Files.exists(root)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(root)) {
			walk.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
		}
	}

	private static String escapeForAwkString(String value) {
		StringBuilder builder = new StringBuilder(value.length() * 2);
		for (int i = 0; i < value.length(); i++) {
			char ch = value.charAt(i);
			if (ch == '\\' || ch == '"') {
				builder.append('\\');
			}
			builder.append(ch);
		}
		return builder.toString();
	}
}
