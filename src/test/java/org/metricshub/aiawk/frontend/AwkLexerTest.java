package org.metricshub.aiawk.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.aiawk.frontend.ast.LexerException;

public class AwkLexerTest {

	private static List<Token> tokens(String script) {
		return new AwkLexer(script, "test").tokenize();
	}

	private static List<TokenType> types(String script) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : tokens(script)) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testSimpleRule() {
		assertEquals(
				Arrays.asList(
						TokenType.KW_BEGIN,
						TokenType.OPEN_BRACE,
						TokenType.NAME,
						TokenType.EQUALS,
						TokenType.NUMBER,
						TokenType.CLOSE_BRACE,
						TokenType.EOF),
				types("BEGIN { x = 1 }"));
	}

	@Test
	public void testSlashAfterOperandIsDivision() {
		assertEquals(
				Arrays.asList(TokenType.NAME, TokenType.DIVIDE, TokenType.NUMBER, TokenType.DIV_EQ, TokenType.NAME, TokenType.EOF),
				types("a / 2 /= b"));
	}

	@Test
	public void testSlashElsewhereStartsRegex() {
		List<Token> tokens = tokens("$0 ~ /a\\/b[/]c/");
		assertEquals(TokenType.MATCHES, tokens.get(2).getType());
		assertEquals(TokenType.ERE, tokens.get(3).getType());
		assertEquals("a/b[/]c", tokens.get(3).getText());
		assertEquals(TokenType.EOF, tokens.get(4).getType());
	}

	@Test
	public void testStringEscapes() {
		Token token = tokens("\"a\\tb\\\"c\\\\\\101\\x42\\q\"").get(0);
		assertEquals(TokenType.STRING, token.getType());
		assertEquals("a\tb\"c\\ABq", token.getText());
	}

	@Test
	public void testNewlinesAndCommentsCollapse() {
		assertEquals(
				Arrays.asList(TokenType.NAME, TokenType.NEWLINE, TokenType.NAME, TokenType.EOF),
				types("x # trailing\n\n   # comment only\n\ny"));
	}

	@Test
	public void testLineContinuation() {
		assertEquals(Arrays.asList(TokenType.NAME, TokenType.PLUS, TokenType.NAME, TokenType.EOF), types("a + \\\nb"));
	}

	@Test
	public void testIdentifierClassification() {
		assertEquals(
				Arrays.asList(
						TokenType.FUNC_NAME,
						TokenType.OPEN_PAREN,
						TokenType.CLOSE_PAREN,
						TokenType.NAME,
						TokenType.OPEN_PAREN,
						TokenType.CLOSE_PAREN,
						TokenType.BUILTIN_FUNC_NAME,
						TokenType.KW_GETLINE,
						TokenType.KW_FUNCTION,
						TokenType.EOF),
				types("ai_sentiment() foo () length getline func"));
	}

	@Test
	public void testOperators() {
		assertEquals(
				Arrays.asList(
						TokenType.INC,
						TokenType.DEC,
						TokenType.POW,
						TokenType.POW,
						TokenType.POW_EQ,
						TokenType.NOT_MATCHES,
						TokenType.NE,
						TokenType.APPEND,
						TokenType.GE,
						TokenType.AND,
						TokenType.OR,
						TokenType.PIPE,
						TokenType.EOF),
				types("++ -- ^ ** ^= !~ != >> >= && || |"));
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = tokens("1.5e3 .25 10e");
		assertEquals("1.5e3", tokens.get(0).getText());
		assertEquals(".25", tokens.get(1).getText());
		assertEquals("10", tokens.get(2).getText());
		assertEquals(TokenType.NAME, tokens.get(3).getType());
		assertEquals("e", tokens.get(3).getText());
	}

	@Test
	public void testPositions() {
		List<Token> tokens = tokens("BEGIN {\n  print x\n}");
		Token print = tokens.get(3);
		assertEquals(TokenType.KW_PRINT, print.getType());
		assertEquals(2, print.getLine());
		assertEquals(3, print.getColumn());
		assertEquals("test", print.getSource());
	}

	@Test
	public void testFragmentsRestartLineNumbers() {
		AwkLexer lexer = new AwkLexer(Arrays.asList("a.awk", "b.awk"), Arrays.asList("BEGIN { x = 1 }", "END { print x }"));
		Token end = null;
		for (Token token : lexer) {
			if (token.getType() == TokenType.KW_END) {
				end = token;
			}
		}
		assertNotNull(end);
		assertEquals(1, end.getLine());
		assertEquals(1, end.getColumn());
		assertEquals("b.awk", end.getSource());
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> tokens("BEGIN { print \"abc\n}"));
		assertEquals(1, e.getLineNumber());
		assertTrue(e.getMessage().contains("Unterminated string"));
	}

	@Test
	public void testUnterminatedRegex() {
		assertThrows(LexerException.class, () -> tokens("/abc"));
	}

	@Test
	public void testSingleAmpersand() {
		assertThrows(LexerException.class, () -> tokens("a & b"));
	}

	@Test
	public void testInvalidCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> tokens("x = 1\ny = @"));
		assertEquals(2, e.getLineNumber());
		assertEquals(5, e.getColumn());
	}
}
