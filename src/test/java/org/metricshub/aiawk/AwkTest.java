package org.metricshub.aiawk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.aiawk.AwkTestSupport.TestResult;
import org.metricshub.aiawk.ext.AbstractExtension;
import org.metricshub.aiawk.ext.TextAnalysisExtension;
import org.metricshub.aiawk.ext.annotations.AwkFunction;
import org.metricshub.aiawk.frontend.ast.ParserException;
import org.metricshub.aiawk.jrt.AwkInputException;
import org.metricshub.aiawk.jrt.AwkNameException;
import org.metricshub.aiawk.jrt.AwkRuntimeException;
import org.metricshub.aiawk.jrt.AwkTypeException;

/**
 * End-to-end tests of the interpreter through the {@link Awk} API.
 */
public class AwkTest {

	/**
	 * Extension whose only function always fails.
	 */
	public static class FailingExtension extends AbstractExtension {
		@AwkFunction("always_fails")
		public String alwaysFails(String text) {
			throw new IllegalStateException("service unavailable for " + text);
		}
	}

	@Test
	public void testSumOfSecondField() throws Exception {
		AwkTestSupport
				.awkTest("sum of field(2)")
				.script("{ s += field(2) } END { print s }")
				.stdin("1 2 3\n4 5 6\n")
				.expect("7\n")
				.runAndAssert();
	}

	@Test
	public void testCommaSeparatedFields() throws Exception {
		AwkTestSupport
				.awkTest("first and third comma-separated fields")
				.script("{ print field(1), field(3) }")
				.fieldSeparator(",")
				.stdin("a,b,c\n")
				.expect("a c\n")
				.runAndAssert();
	}

	@Test
	public void testRulesRunInOrder() throws Exception {
		AwkTestSupport
				.awkTest("rules run in source order")
				.script("/a/ { print \"A\" }\n/b/ { print \"B\" }\n/c/ { print \"C\" }")
				.stdin("ac\n")
				.expectLines("A", "C")
				.runAndAssert();
	}

	@Test
	public void testNextSkipsRemainingRules() throws Exception {
		AwkTestSupport
				.awkTest("next skips the following rules for this record only")
				.script("/b/ { print \"B\"; next }\n/c/ { print \"C\" }")
				.stdin("bc\nc\n")
				.expectLines("B", "C")
				.runAndAssert();
	}

	@Test
	public void testFailingForeignFunctionYieldsEmptyResult() throws Exception {
		AwkTestSupport
				.awkTest("failing foreign function")
				.script("{ print NR \":\" always_fails($0) \":\" }")
				.withExtensions(new FailingExtension())
				.stdin("x\ny\n")
				.expectLines("1::", "2::")
				.runAndAssert();
	}

	@Test
	public void testUnknownFunction() throws Exception {
		AwkTestSupport
				.awkTest("call to an undefined function")
				.script("BEGIN { print nothing_here(1) }")
				.expectThrow(AwkNameException.class)
				.runAndAssert();
	}

	@Test
	public void testTextAnalysisFunctions() throws Exception {
		AwkTestSupport
				.awkTest("sentiment of each line")
				.script("{ print ai_sentiment($0) }")
				.withExtensions(new TextAnalysisExtension())
				.stdin("I love this\nthis is awful\nok\n")
				.expectLines("positive", "negative", "neutral")
				.runAndAssert();
	}

	@Test
	public void testForeignResultIsNumericString() throws Exception {
		AwkTestSupport
				.awkTest("foreign result compared as a number")
				.script("BEGIN { n = ai_math_word_problem(\"15 apples minus 7\"); print (n == 8), n + 1 }")
				.withExtensions(new TextAnalysisExtension())
				.expectLines("1 9")
				.runAndAssert();
	}

	@Test
	public void testUninitializedValues() throws Exception {
		AwkTestSupport
				.awkTest("uninitialized variable is 0 and empty")
				.script("BEGIN { print x + 0, length(x), (x == 0), (x == \"\") }")
				.expectLines("0 0 1 1")
				.runAndAssert();
	}

	@Test
	public void testStrnumComparison() throws Exception {
		AwkTestSupport
				.awkTest("fields that look numeric compare as numbers")
				.script("{ print ($1 > $2), ($1 == 0), (\"10\" > \"9\") }")
				.stdin("10 9\n")
				.expectLines("1 0 0")
				.runAndAssert();
	}

	@Test
	public void testStrnumAgainstStringConstant() throws Exception {
		AwkTestSupport
				.awkTest("strnum against string constant")
				.script("{ print ($1 == 0), ($1 == \"0\") }")
				.stdin("0.0\n")
				.expectLines("1 0")
				.runAndAssert();
	}

	@Test
	public void testAssignFieldRebuildsRecord() throws Exception {
		AwkTestSupport
				.awkTest("assigning a field rebuilds $0")
				.script("{ $2 = \"X\"; print; print NF }")
				.stdin("a b c\n")
				.expectLines("a X c", "3")
				.runAndAssert();
	}

	@Test
	public void testAssignFieldBeyondNF() throws Exception {
		AwkTestSupport
				.awkTest("assigning past NF extends the record")
				.script("BEGIN { OFS = \"-\" } { $5 = \"e\"; print; print NF }")
				.stdin("a b c\n")
				.expectLines("a-b-c--e", "5")
				.runAndAssert();
	}

	@Test
	public void testAssignNF() throws Exception {
		AwkTestSupport
				.awkTest("assigning NF truncates the record")
				.script("{ NF = 2; print }")
				.stdin("a b c d\n")
				.expectLines("a b")
				.runAndAssert();
	}

	@Test
	public void testArrayIterationOrder() throws Exception {
		AwkTestSupport
				.awkTest("for-in visits keys in insertion order")
				.script("BEGIN { a[\"x\"] = 1; a[\"y\"] = 2; a[\"z\"] = 3; for (k in a) print k, a[k] }")
				.expectLines("x 1", "y 2", "z 3")
				.runAndAssert();
	}

	@Test
	public void testInDoesNotCreateElement() throws Exception {
		AwkTestSupport
				.awkTest("membership test does not create the element")
				.script("BEGIN { if (\"k\" in a) print \"yes\"; print length(a); x = a[\"k\"]; print length(a), (\"k\" in a) }")
				.expectLines("0", "1 1")
				.runAndAssert();
	}

	@Test
	public void testMultiDimensionalSubscript() throws Exception {
		AwkTestSupport
				.awkTest("multiple subscripts joined with SUBSEP")
				.script("BEGIN { a[1, 2] = \"v\"; if ((1, 2) in a) print a[1, 2]; for (k in a) print (k == 1 SUBSEP 2) }")
				.expectLines("v", "1")
				.runAndAssert();
	}

	@Test
	public void testDelete() throws Exception {
		AwkTestSupport
				.awkTest("delete one element, then the whole array")
				.script("BEGIN { a[1]; a[2]; delete a[1]; print length(a); delete a; print length(a) }")
				.expectLines("1", "0")
				.runAndAssert();
	}

	@Test
	public void testRecursiveFunction() throws Exception {
		AwkTestSupport
				.awkTest("recursive user function")
				.script("function fact(n) { return n <= 1 ? 1 : n * fact(n - 1) }\nBEGIN { print fact(5) }")
				.expectLines("120")
				.runAndAssert();
	}

	@Test
	public void testArrayParameterByReference() throws Exception {
		AwkTestSupport
				.awkTest("arrays are passed by reference")
				.script("function fill(arr) { arr[\"a\"] = 1 }\nBEGIN { fill(x); print x[\"a\"]; fill(y); print length(y) }")
				.expectLines("1", "1")
				.runAndAssert();
	}

	@Test
	public void testScalarParameterByValue() throws Exception {
		AwkTestSupport
				.awkTest("scalars are passed by value")
				.script("function inc(v) { v++; return v }\nBEGIN { y = 1; print inc(y), y }")
				.expectLines("2 1")
				.runAndAssert();
	}

	@Test
	public void testExtraParametersAreLocals() throws Exception {
		AwkTestSupport
				.awkTest("extra parameters are local variables")
				.script("function f(a,   tmp) { tmp = a * 2; return tmp }\nBEGIN { tmp = \"g\"; print f(3), tmp }")
				.expectLines("6 g")
				.runAndAssert();
	}

	@Test
	public void testTooManyArguments() throws Exception {
		AwkTestSupport
				.awkTest("more arguments than parameters")
				.script("function f(a) { return a }\nBEGIN { print f(1, 2) }")
				.expectThrow(AwkNameException.class)
				.runAndAssert();
	}

	@Test
	public void testFunctionWithoutReturnValue() throws Exception {
		AwkTestSupport
				.awkTest("function without return yields an uninitialized value")
				.script("function noop() { }\nBEGIN { x = noop(); print length(x), x + 0 }")
				.expectLines("0 0")
				.runAndAssert();
	}

	@Test
	public void testGsub() throws Exception {
		AwkTestSupport
				.awkTest("gsub on a variable")
				.script("BEGIN { s = \"hello world\"; n = gsub(/o/, \"0\", s); print n, s }")
				.expectLines("2 hell0 w0rld")
				.runAndAssert();
	}

	@Test
	public void testSubWithMatchedText() throws Exception {
		AwkTestSupport
				.awkTest("sub with & and \\\\&")
				.script("BEGIN { s = \"abc\"; sub(/b/, \"[&]\", s); print s; t = \"abc\"; sub(/b/, \"\\\\&\", t); print t }")
				.expectLines("a[b]c", "a&c")
				.runAndAssert();
	}

	@Test
	public void testGsubOnRecord() throws Exception {
		AwkTestSupport
				.awkTest("gsub on $0 resplits the fields")
				.script("{ gsub(/a/, \"A\"); print; print $3 }")
				.stdin("a b a\n")
				.expectLines("A b A", "A")
				.runAndAssert();
	}

	@Test
	public void testGsubEmptyMatches() throws Exception {
		AwkTestSupport
				.awkTest("gsub with a regex matching the empty string")
				.script("BEGIN { s = \"abc\"; gsub(/x*/, \"-\", s); print s; t = \"xxa\"; gsub(/x*/, \"-\", t); print t }")
				.expectLines("-a-b-c-", "-a-")
				.runAndAssert();
	}

	@Test
	public void testSubstr() throws Exception {
		AwkTestSupport
				.awkTest("substr clamps to the string")
				.script("BEGIN { print substr(\"hello\", 2, 3), substr(\"hello\", 0), substr(\"hello\", -1, 3), \"[\" substr(\"hello\", 9) \"]\" }")
				.expectLines("ell hello h []")
				.runAndAssert();
	}

	@Test
	public void testStringFunctions() throws Exception {
		AwkTestSupport
				.awkTest("index, length, toupper and tolower")
				.script("BEGIN { print index(\"foobar\", \"bar\"), index(\"foo\", \"z\"), length(\"abc\"), toupper(\"aBc\"), tolower(\"AbC\") }")
				.expectLines("4 0 3 ABC abc")
				.runAndAssert();
	}

	@Test
	public void testSplit() throws Exception {
		AwkTestSupport
				.awkTest("split into an array")
				.script("BEGIN { n = split(\"a:b:c\", parts, \":\"); print n, parts[1], parts[3]; m = split(\"  x  y \", w); print m, w[2] }")
				.expectLines("3 a c", "2 y")
				.runAndAssert();
	}

	@Test
	public void testMatch() throws Exception {
		AwkTestSupport
				.awkTest("match sets RSTART and RLENGTH")
				.script("BEGIN { print match(\"foobar\", /ob/), RSTART, RLENGTH; print match(\"foo\", /z/), RSTART, RLENGTH }")
				.expectLines("3 3 2", "0 0 -1")
				.runAndAssert();
	}

	@Test
	public void testPrintf() throws Exception {
		AwkTestSupport
				.awkTest("printf and sprintf")
				.script("BEGIN { printf \"%s=%d %.2f\\n\", \"x\", 42, 3.14159; s = sprintf(\"[%5s|%-3s]\", \"ab\", \"c\"); print s }")
				.expectLines("x=42 3.14", "[   ab|c  ]")
				.runAndAssert();
	}

	@Test
	public void testNumberOutput() throws Exception {
		AwkTestSupport
				.awkTest("integers print without decimals, others with OFMT")
				.script("BEGIN { print 1 / 4, 10 / 2, 2 ^ 10, int(-3.7), 7 % 3 }")
				.expectLines("0.25 5 1024 -3 1")
				.runAndAssert();
	}

	@Test
	public void testConcatenationPrecedence() throws Exception {
		AwkTestSupport
				.awkTest("concatenation binds looser than addition")
				.script("BEGIN { print 1 \" \" 2 + 3 }")
				.expectLines("1 5")
				.runAndAssert();
	}

	@Test
	public void testRangePattern() throws Exception {
		AwkTestSupport
				.awkTest("range pattern")
				.script("$1 == 2, $1 == 4")
				.stdin("1\n2\n3\n4\n5\n")
				.expectLines("2", "3", "4")
				.runAndAssert();
	}

	@Test
	public void testDynamicRegex() throws Exception {
		AwkTestSupport
				.awkTest("regular expression from a string")
				.script("BEGIN { re = \"^a.c$\" } $0 ~ re { print \"yes\" } $0 !~ re { print \"no\" }")
				.stdin("abc\nabd\n")
				.expectLines("yes", "no")
				.runAndAssert();
	}

	@Test
	public void testLoops() throws Exception {
		AwkTestSupport
				.awkTest("while, do-while, for with break and continue")
				.script("BEGIN {\n"
						+ "  while (i < 10) { i++; if (i == 3) continue; if (i == 5) break; s = s i }\n"
						+ "  do { j++ } while (j < 3)\n"
						+ "  for (k = 0; k < 3; k++) t = t k\n"
						+ "  print s, j, t\n"
						+ "}")
				.expectLines("124 3 012")
				.runAndAssert();
	}

	@Test
	public void testGetlineFromFile() throws Exception {
		AwkTestSupport
				.awkTest("getline var < file")
				.file("data.txt", "l1\nl2\n")
				.script("BEGIN { while ((getline line < \"{{data.txt}}\") > 0) n++; print n, line }")
				.expectLines("2 l2")
				.runAndAssert();
	}

	@Test
	public void testGetlineMissingFile() throws Exception {
		AwkTestSupport
				.awkTest("getline from a missing file returns -1")
				.script("BEGIN { print (getline line < \"/nonexistent/aiawk/file\") }")
				.expectLines("-1")
				.runAndAssert();
	}

	@Test
	public void testPlainGetline() throws Exception {
		AwkTestSupport
				.awkTest("getline reads the next record")
				.script("NR == 1 { getline; print \"after:\" $0 }\n{ print NR \": \" $0 }")
				.stdin("a\nb\nc\n")
				.expectLines("after:b", "2: b", "3: c")
				.runAndAssert();
	}

	@Test
	public void testOutputRedirection() throws Exception {
		AwkTestSupport
				.awkTest("print to a file, close it and read it back")
				.file("out.txt", "")
				.script("BEGIN { print \"x\" > \"{{out.txt}}\"; print \"y\" >> \"{{out.txt}}\"; close(\"{{out.txt}}\");"
						+ " while ((getline l < \"{{out.txt}}\") > 0) print \"read\", l }")
				.expectLines("read x", "read y")
				.runAndAssert();
	}

	@Test
	public void testFilesAndOperandAssignments() throws Exception {
		AwkTestSupport
				.awkTest("NR, FNR and name=value operands")
				.file("f1", "a\nb\n")
				.file("f2", "c\n")
				.script("{ print v, $0, NR, FNR }")
				.operand("v=one", "{{f1}}", "v=two", "{{f2}}")
				.expectLines("one a 1 1", "one b 2 2", "two c 3 1")
				.runAndAssert();
	}

	@Test
	public void testArgvAndEnviron() throws Exception {
		AwkTestSupport
				.awkTest("ARGV, ARGC and ENVIRON")
				.script("BEGIN { print ARGC, ARGV[0], ARGV[1]; print length(ENVIRON), (\"AIAWK_NOT_SET_ANYWHERE\" in ENVIRON) }")
				.operand("n=5")
				.expectLines("2 awk n=5", System.getenv().size() + " 0")
				.runAndAssert();
	}

	@Test
	public void testMissingInputFile() throws Exception {
		AwkTestSupport
				.awkTest("missing input file")
				.script("{ print }")
				.operand("/nonexistent/aiawk/input")
				.expectThrow(AwkInputException.class)
				.runAndAssert();
	}

	@Test
	public void testPreassignedVariable() throws Exception {
		AwkTestSupport
				.awkTest("-v assignment")
				.script("BEGIN { print n + 1, s }")
				.preassign("n", "5")
				.preassign("s", "a\\tb")
				.expectLines("6 a\tb")
				.runAndAssert();
	}

	@Test
	public void testExitStatus() throws Exception {
		AwkTestSupport
				.awkTest("exit in a rule still runs END")
				.script("{ print; exit 3 } END { print \"end\" }")
				.stdin("a\nb\n")
				.expectLines("a", "end")
				.expectExit(3)
				.runAndAssert();
	}

	@Test
	public void testExitInBegin() throws Exception {
		AwkTestSupport
				.awkTest("exit in BEGIN skips the input")
				.script("BEGIN { print \"b\"; exit } { print \"never\" } END { print \"e\" }")
				.stdin("x\n")
				.expectLines("b", "e")
				.runAndAssert();
	}

	@Test
	public void testDivisionByZero() throws Exception {
		TestResult result = AwkTestSupport
				.awkTest("division by zero")
				.script("BEGIN {\n x = 0\n print 1 / x\n}")
				.expectThrow(AwkRuntimeException.class)
				.run();
		result.assertExpected();
		assertEquals(3, ((AwkRuntimeException) result.thrownException()).getLineNumber());
	}

	@Test
	public void testScalarUsedAsArray() throws Exception {
		AwkTestSupport
				.awkTest("scalar used as an array")
				.script("BEGIN { x = 1; x[1] = 2 }")
				.expectThrow(AwkNameException.class)
				.runAndAssert();
	}

	@Test
	public void testArrayUsedAsScalar() throws Exception {
		AwkTestSupport
				.awkTest("array used as a scalar")
				.script("BEGIN { a[1] = 1; print a + 1 }")
				.expectThrow(AwkTypeException.class)
				.runAndAssert();
	}

	@Test
	public void testSplitIntoScalar() throws Exception {
		AwkTestSupport
				.awkTest("split into a scalar")
				.script("BEGIN { s = 1; split(\"a b\", s) }")
				.expectThrow(AwkTypeException.class)
				.runAndAssert();
	}

	@Test
	public void testFieldAsVariableName() throws Exception {
		AwkTestSupport
				.awkTest("field used as a variable")
				.script("{ field = $1; print field }")
				.stdin("a b\n")
				.expect("a\n")
				.runAndAssert();
	}

	@Test
	public void testUserFunctionNamedField() throws Exception {
		AwkTestSupport
				.awkTest("user function named field")
				.script("function field(x) { return \"f\" x }\n{ print field(1) }")
				.stdin("a b\n")
				.expect("f1\n")
				.runAndAssert();
	}

	@Test
	public void testFieldWithTooManyArguments() throws Exception {
		AwkTestSupport
				.awkTest("field with two arguments")
				.script("{ print field(1, 2) }")
				.stdin("a b\n")
				.expectThrow(AwkNameException.class)
				.runAndAssert();
	}

	@Test
	public void testIndexOfEmptyString() throws Exception {
		AwkTestSupport
				.awkTest("index of the empty string")
				.script("BEGIN { print index(\"abc\", \"\"), index(\"\", \"\") }")
				.expectLines("0 0")
				.runAndAssert();
	}

	@Test
	public void testSplitOnSingleSpaceRegex() throws Exception {
		AwkTestSupport
				.awkTest("split on a single-space regex")
				.script("BEGIN { n = split(\"a  b\", parts, / /); print n, parts[1], \"[\" parts[2] \"]\", parts[3] }")
				.expectLines("3 a [] b")
				.runAndAssert();
	}

	@Test
	public void testAsort() throws Exception {
		AwkTestSupport
				.awkTest("asort sorts the values")
				.script("BEGIN { a[\"x\"] = \"pear\"; a[\"y\"] = 10; a[\"z\"] = 9; a[\"w\"] = \"apple\"\n"
						+ "n = asort(a); print n; for (i = 1; i <= n; i++) print i, a[i]; if (!(\"x\" in a)) print \"renumbered\" }")
				.expectLines("4", "1 9", "2 10", "3 apple", "4 pear", "renumbered")
				.runAndAssert();
	}

	@Test
	public void testAsorti() throws Exception {
		AwkTestSupport
				.awkTest("asorti sorts the subscripts")
				.script("BEGIN { a[\"b\"] = 1; a[10] = 2; a[\"a\"] = 3; a[2] = 4\n"
						+ "n = asorti(a); print n; for (i = 1; i <= n; i++) print i, a[i] }")
				.expectLines("4", "1 2", "2 10", "3 a", "4 b")
				.runAndAssert();
	}

	@Test
	public void testAsortOfScalar() throws Exception {
		AwkTestSupport
				.awkTest("asort of a scalar")
				.script("BEGIN { s = 1; asort(s) }")
				.expectThrow(AwkTypeException.class)
				.runAndAssert();
	}

	@Test
	public void testSyntaxError() throws Exception {
		TestResult result = AwkTestSupport
				.awkTest("syntax error")
				.script("BEGIN { print ( }")
				.expectThrow(ParserException.class)
				.run();
		result.assertExpected();
		assertTrue(result.thrownException().getMessage().contains("line 1"));
	}

	@Test
	public void testRunConvenience() throws Exception {
		assertEquals("b\n", new Awk().run("{ print $2 }", "a b c\n"));
	}

	@Test(expected = ExitException.class)
	public void testRunNonZeroExit() throws Exception {
		new Awk().run("BEGIN { exit 1 }", "");
	}
}
