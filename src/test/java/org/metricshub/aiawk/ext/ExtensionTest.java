package org.metricshub.aiawk.ext;

import static org.junit.Assert.*;

import java.util.Optional;
import org.junit.Test;
import org.metricshub.aiawk.AwkTestSupport;
import org.metricshub.aiawk.ext.annotations.AwkFunction;
import org.metricshub.aiawk.jrt.AwkTypeException;
import org.metricshub.aiawk.jrt.AwkValue;
import org.metricshub.aiawk.jrt.IllegalAwkArgumentException;
import org.metricshub.aiawk.util.AwkSettings;

/**
 * Tests the integration of {@link AbstractExtension} implementations with
 * the interpreter and the guards of the {@link ExtensionRegistry}.
 */
public class ExtensionTest {

	public static class SampleExtension extends AbstractExtension {

		@AwkFunction("repeat")
		public String repeat(String text, int count) {
			StringBuilder sb = new StringBuilder();
			for (int i = 0; i < count; i++) {
				sb.append(text);
			}
			return sb.toString();
		}

		@AwkFunction("total")
		public double total(double... values) {
			double sum = 0;
			for (double value : values) {
				sum += value;
			}
			return sum;
		}

		@AwkFunction("kind_of")
		public String kindOf(AwkValue value) {
			if (value.isStrnum()) {
				return "strnum";
			}
			return value.isNumber() ? "number" : "string";
		}

		@AwkFunction("nothing")
		public String nothing() {
			return null;
		}
	}

	public static class DuplicateNameExtension extends AbstractExtension {

		@AwkFunction("same")
		public String first() {
			return "1";
		}

		@AwkFunction("same")
		public String second() {
			return "2";
		}
	}

	public static class UnsupportedTypeExtension extends AbstractExtension {

		@AwkFunction("flag")
		public String flag(boolean value) {
			return String.valueOf(value);
		}
	}

	@Test
	public void testNumbersPassedAsStringsFollowConvfmt() throws Exception {
		AwkTestSupport
				.awkTest("numbers passed as strings follow CONVFMT")
				.script("BEGIN { x = 3.14159; print repeat(x, 1); CONVFMT = \"%.2f\"; print repeat(x, 1), total(0.123456) }")
				.withExtensions(new SampleExtension())
				.expectLines("3.14159", "3.14 0.12")
				.runAndAssert();
	}

	@Test
	public void testExtensionInvocation() throws Exception {
		AwkTestSupport
				.awkTest("extension invocation")
				.script("BEGIN { printf repeat(\"ab\", 3) }")
				.withExtensions(new SampleExtension())
				.expect("ababab")
				.runAndAssert();
	}

	@Test
	public void testVarArgs() throws Exception {
		AwkTestSupport
				.awkTest("var args")
				.script("BEGIN { print total(1, 2.5, 3); print total() }")
				.withExtensions(new SampleExtension())
				.expectLines("6.5", "0")
				.runAndAssert();
	}

	@Test
	public void testValuesArePassedAsIs() throws Exception {
		AwkTestSupport
				.awkTest("raw values")
				.script("{ print kind_of($1), kind_of($1 + 0), kind_of($1 \"\") }")
				.withExtensions(new SampleExtension())
				.stdin("10\n")
				.expectLines("strnum number string")
				.runAndAssert();
	}

	@Test
	public void testResultIsNumericWhenItLooksNumeric() throws Exception {
		AwkTestSupport
				.awkTest("numeric result")
				.script("BEGIN { x = repeat(\"1\", 2); if (x > 9) print \"numeric\"; print nothing() \"|\" }")
				.withExtensions(new SampleExtension())
				.expectLines("numeric", "|")
				.runAndAssert();
	}

	@Test
	public void testArgumentCountIsChecked() throws Exception {
		AwkTestSupport
				.awkTest("argument count")
				.script("BEGIN { print repeat(\"a\") }")
				.withExtensions(new SampleExtension())
				.expectThrow(IllegalAwkArgumentException.class)
				.runAndAssert();
	}

	@Test
	public void testArraysCannotBePassed() throws Exception {
		AwkTestSupport
				.awkTest("array argument")
				.script("BEGIN { a[1] = 1; print repeat(a, 2) }")
				.withExtensions(new SampleExtension())
				.expectThrow(AwkTypeException.class)
				.runAndAssert();
	}

	@Test
	public void testProgramFunctionsComeFirst() throws Exception {
		AwkTestSupport
				.awkTest("program function shadows extension")
				.script("function repeat(s, n) { return \"mine\" }\nBEGIN { print repeat(\"a\", 2) }")
				.withExtensions(new SampleExtension())
				.expectLines("mine")
				.runAndAssert();
	}

	@Test
	public void testAnnotationScanning() {
		SampleExtension extension = new SampleExtension();
		assertEquals(4, extension.getFunctions().size());
		ExtensionFunction total = extension.getFunctions().get("total");
		assertTrue(total.isVarArgs());
		assertEquals(0, total.getArity());
		assertEquals(2, extension.getFunctions().get("repeat").getArity());
		assertEquals("SampleExtension", extension.getExtensionName());

		assertThrows(IllegalStateException.class, () -> new DuplicateNameExtension().getFunctions());
		assertThrows(IllegalStateException.class, () -> new UnsupportedTypeExtension().getFunctions());
	}

	@Test
	public void testDuplicateRegistration() {
		ExtensionRegistry registry = new ExtensionRegistry();
		SampleExtension extension = new SampleExtension();
		registry.register(extension);
		registry.register(extension);
		assertEquals(4, registry.getFunctions().size());
		assertThrows(IllegalStateException.class, () -> registry.register(new SampleExtension()));
		assertThrows(IllegalArgumentException.class, () -> registry.register("", args -> ""));
	}

	@Test
	public void testUnknownFunction() {
		assertFalse(new ExtensionRegistry().resolve("missing").isPresent());
	}

	@Test
	public void testFailingCallYieldsEmptyString() throws Exception {
		ExtensionRegistry registry = new ExtensionRegistry();
		registry.register("broken", args -> {
			throw new IllegalStateException("service down");
		});
		try {
			Optional<ForeignFunction> broken = registry.resolve("broken");
			assertTrue(broken.isPresent());
			assertEquals(ExtensionRegistry.FAILED_CALL_RESULT, broken.get().invoke(AwkValue.of("x")));
		} finally {
			registry.shutdown();
		}
	}

	@Test
	public void testSlowCallTimesOut() throws Exception {
		ExtensionRegistry registry = new ExtensionRegistry();
		registry.setCallTimeout(100);
		registry.register("slow", args -> {
			Thread.sleep(10000);
			return "late";
		});
		registry.register("fast", args -> "on time");
		try {
			long start = System.currentTimeMillis();
			assertEquals("", registry.resolve("slow").get().invoke());
			assertTrue(System.currentTimeMillis() - start < 5000);
			// a fresh worker serves the next calls
			assertEquals("on time", registry.resolve("fast").get().invoke());
		} finally {
			registry.shutdown();
		}
	}

	@Test
	public void testTimeoutMustBePositive() {
		ExtensionRegistry registry = new ExtensionRegistry();
		assertThrows(IllegalArgumentException.class, () -> registry.setCallTimeout(0));
		assertEquals(AwkSettings.DEFAULT_FOREIGN_CALL_TIMEOUT, registry.getCallTimeout());
	}
}
