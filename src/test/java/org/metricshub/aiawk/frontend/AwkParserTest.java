package org.metricshub.aiawk.frontend;

import static org.junit.Assert.*;

import java.util.List;
import org.junit.Test;
import org.metricshub.aiawk.frontend.ast.Assignment;
import org.metricshub.aiawk.frontend.ast.AwkProgram;
import org.metricshub.aiawk.frontend.ast.BinaryExpression;
import org.metricshub.aiawk.frontend.ast.BinaryOperator;
import org.metricshub.aiawk.frontend.ast.ExpressionStatement;
import org.metricshub.aiawk.frontend.ast.FunctionDefinition;
import org.metricshub.aiawk.frontend.ast.GetlineExpression;
import org.metricshub.aiawk.frontend.ast.InExpression;
import org.metricshub.aiawk.frontend.ast.OutputRedirection;
import org.metricshub.aiawk.frontend.ast.ParserException;
import org.metricshub.aiawk.frontend.ast.Pattern;
import org.metricshub.aiawk.frontend.ast.PrintStatement;
import org.metricshub.aiawk.frontend.ast.Rule;
import org.metricshub.aiawk.frontend.ast.Statement;
import org.metricshub.aiawk.frontend.ast.StringLiteral;
import org.metricshub.aiawk.frontend.ast.VariableReference;

public class AwkParserTest {

	private static AwkProgram parse(String script) {
		return new AwkParser(new AwkLexer(script, "test")).parse();
	}

	private static Statement firstStatement(String script) {
		return parse(script).getRules().get(0).getAction().getStatements().get(0);
	}

	private static void assertRejected(String script, String messagePart) {
		ParserException e = assertThrows(ParserException.class, () -> parse(script));
		assertTrue(e.getMessage(), e.getMessage().contains(messagePart));
	}

	@Test
	public void testRuleKinds() {
		AwkProgram program = parse("BEGIN { x = 1 }\n/foo/ { print }\nNR > 1\nNR == 2, NR == 4 { print }\nEND { print x }");
		List<Rule> rules = program.getRules();
		assertEquals(5, rules.size());
		assertEquals(Pattern.Kind.BEGIN, rules.get(0).getPattern().getKind());
		assertEquals(Pattern.Kind.REGEX, rules.get(1).getPattern().getKind());
		assertEquals(Pattern.Kind.EXPRESSION, rules.get(2).getPattern().getKind());
		assertNull(rules.get(2).getAction());
		assertEquals(Pattern.Kind.RANGE, rules.get(3).getPattern().getKind());
		assertNotNull(rules.get(3).getPattern().getSecond());
		assertEquals(Pattern.Kind.END, rules.get(4).getPattern().getKind());

		assertEquals(1, program.getBeginRules().size());
		assertEquals(3, program.getMainRules().size());
		assertEquals(1, program.getEndRules().size());
		assertEquals(4, rules.get(3).getLineNumber());
	}

	@Test
	public void testActionWithoutPattern() {
		Rule rule = parse("{ print $1 }").getRules().get(0);
		assertEquals(Pattern.Kind.ALWAYS, rule.getPattern().getKind());
		assertEquals(1, rule.getAction().getStatements().size());
	}

	@Test
	public void testFunctionDefinition() {
		AwkProgram program = parse("function fill(a, n,   i) {\n  for (i = 1; i <= n; i++) a[i] = i\n  return n\n}\nBEGIN { fill(arr, 3) }");
		FunctionDefinition function = program.getFunction("fill");
		assertNotNull(function);
		assertEquals(3, function.getParameters().size());
		assertTrue(function.isArrayParameter("a"));
		assertFalse(function.isArrayParameter("n"));
		assertFalse(function.isArrayParameter("i"));
		assertEquals(1, program.getRules().size());
	}

	@Test
	public void testPrecedence() {
		Assignment assignment = (Assignment) ((ExpressionStatement) firstStatement("BEGIN { x = 1 + 2 * 3 }")).getExpression();
		assertEquals("x", ((VariableReference) assignment.getTarget()).getName());
		BinaryExpression sum = (BinaryExpression) assignment.getValue();
		assertEquals(BinaryOperator.ADD, sum.getOperator());
		assertEquals(BinaryOperator.MULTIPLY, ((BinaryExpression) sum.getRight()).getOperator());
	}

	@Test
	public void testConcatenationBindsLooserThanAddition() {
		Assignment assignment = (Assignment) ((ExpressionStatement) firstStatement("BEGIN { x = 1 \" \" 2 + 3 }")).getExpression();
		BinaryExpression concat = (BinaryExpression) assignment.getValue();
		assertEquals(BinaryOperator.CONCATENATE, concat.getOperator());
		assertEquals(BinaryOperator.ADD, ((BinaryExpression) concat.getRight()).getOperator());
	}

	@Test
	public void testPowerIsRightAssociative() {
		Assignment assignment = (Assignment) ((ExpressionStatement) firstStatement("BEGIN { x = 2 ^ 3 ^ 2 }")).getExpression();
		BinaryExpression power = (BinaryExpression) assignment.getValue();
		assertEquals(BinaryOperator.POWER, power.getOperator());
		assertEquals(BinaryOperator.POWER, ((BinaryExpression) power.getRight()).getOperator());
	}

	@Test
	public void testMultiDimensionalIn() {
		ExpressionStatement statement = (ExpressionStatement) firstStatement("BEGIN { (1, 2) in a }");
		InExpression in = (InExpression) statement.getExpression();
		assertEquals("a", in.getArrayName());
		assertEquals(2, in.getSubscripts().size());
	}

	@Test
	public void testPrintRedirection() {
		PrintStatement print = (PrintStatement) firstStatement("{ print $1, $2 > \"out.txt\" }");
		assertFalse(print.isFormatted());
		assertEquals(2, print.getArguments().size());
		assertEquals(OutputRedirection.WRITE, print.getRedirection());
		assertEquals("out.txt", ((StringLiteral) print.getDestination()).getValue());

		PrintStatement printf = (PrintStatement) firstStatement("{ printf(\"%s\\n\", $1) >> \"log\" }");
		assertTrue(printf.isFormatted());
		assertEquals(2, printf.getArguments().size());
		assertEquals(OutputRedirection.APPEND, printf.getRedirection());
	}

	@Test
	public void testGreaterThanInsideParenthesesIsComparison() {
		PrintStatement print = (PrintStatement) firstStatement("{ print (1 > 2) }");
		assertEquals(OutputRedirection.NONE, print.getRedirection());
		assertEquals(BinaryOperator.GREATER_THAN, ((BinaryExpression) print.getArguments().get(0)).getOperator());
	}

	@Test
	public void testGetlineFromFile() {
		ExpressionStatement statement = (ExpressionStatement) firstStatement("{ getline line < \"data.txt\" }");
		GetlineExpression getline = (GetlineExpression) statement.getExpression();
		assertEquals("line", ((VariableReference) getline.getTarget()).getName());
		assertEquals("data.txt", ((StringLiteral) getline.getFile()).getValue());
	}

	@Test
	public void testElseOnNextLine() {
		assertNotNull(parse("{ if ($1)\n  print \"a\"\nelse\n  print \"b\" }"));
	}

	@Test
	public void testSemicolonsAndNewlinesSeparateRules() {
		assertEquals(3, parse("BEGIN { a = 1 }; { print }\n\n\nEND { print a };").getRules().size());
	}

	@Test
	public void testNextOutsideMainRules() {
		assertRejected("BEGIN { next }", "next used in BEGIN");
		assertRejected("END { next }", "next used in END");
	}

	@Test
	public void testReturnOutsideFunction() {
		assertRejected("{ return 1 }", "return used outside of a function");
	}

	@Test
	public void testBreakAndContinueOutsideLoop() {
		assertRejected("{ break }", "break used outside of a loop");
		assertRejected("{ if (1) continue }", "continue used outside of a loop");
	}

	@Test
	public void testDuplicateFunction() {
		assertRejected("function f() { }\nfunction f() { }", "function f already defined");
	}

	@Test
	public void testFunctionParameters() {
		assertRejected("function f(a, a) { }", "multiply defined parameter a");
		assertRejected("function f(f) { }", "cannot use its own name");
		assertRejected("function length() { }", "cannot redefine built-in function length");
	}

	@Test
	public void testBuiltinArity() {
		assertRejected("BEGIN { x = substr(\"abc\") }", "substr() does not accept 1 argument(s)");
		assertRejected("BEGIN { x = rand(1) }", "rand() does not accept 1 argument(s)");
	}

	@Test
	public void testSplitNeedsArrayName() {
		assertRejected("BEGIN { split(\"a b\", $1) }", "second argument must be an array name");
	}

	@Test
	public void testPipesAreRejected() {
		assertRejected("{ print $1 | \"sort\" }", "Pipes");
	}

	@Test
	public void testAssignmentToNonLvalue() {
		assertRejected("BEGIN { 1 = 2 }", "non-lvalue");
	}

	@Test
	public void testBeginWithoutAction() {
		assertRejected("BEGIN\n", "BEGIN blocks must have an action part");
	}

	@Test
	public void testErrorPosition() {
		ParserException e = assertThrows(ParserException.class, () -> parse("BEGIN {\n  x = \n}"));
		assertEquals(3, e.getLineNumber());
		assertEquals("test", e.getSourceDescription());
		assertTrue(e.getMessage().contains("line 3"));
	}
}
