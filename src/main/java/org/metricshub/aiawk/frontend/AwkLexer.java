package org.metricshub.aiawk.frontend;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.metricshub.aiawk.backend.BuiltinFunction;
import org.metricshub.aiawk.frontend.ast.LexerException;
import org.metricshub.aiawk.util.ScriptSource;

/**
 * Turns program text into tokens.
 * <p>
 * The lexer is an {@link Iterable}: each call to {@link #iterator()} scans
 * the program again from the start, and tokens are produced one at a time
 * as they are requested. The last token is always {@link TokenType#EOF}.
 * <p>
 * A program may be made of several fragments (several <code>-f</code>
 * files). They are scanned as one text with a newline between fragments,
 * and token positions are relative to the fragment they come from.
 * <p>
 * Whether a slash starts a regular expression or is a division depends on
 * the previous token: after something that ends an operand (a name, a
 * literal, a closing parenthesis or bracket...) it is a division.
 */
public class AwkLexer implements Iterable<Token> {

	/**
	 * Contains a mapping of AWK keywords to their token values.
	 * <p>
	 * <strong>Note:</strong> built-in function names are not keywords,
	 * they are listed by {@link BuiltinFunction}. Unreserved built-ins
	 * lex as ordinary names.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		// special keywords
		KEYWORDS.put("function", TokenType.KW_FUNCTION);
		KEYWORDS.put("func", TokenType.KW_FUNCTION);
		KEYWORDS.put("BEGIN", TokenType.KW_BEGIN);
		KEYWORDS.put("END", TokenType.KW_END);
		KEYWORDS.put("in", TokenType.KW_IN);

		// statements
		KEYWORDS.put("if", TokenType.KW_IF);
		KEYWORDS.put("else", TokenType.KW_ELSE);
		KEYWORDS.put("while", TokenType.KW_WHILE);
		KEYWORDS.put("for", TokenType.KW_FOR);
		KEYWORDS.put("do", TokenType.KW_DO);
		KEYWORDS.put("return", TokenType.KW_RETURN);
		KEYWORDS.put("exit", TokenType.KW_EXIT);
		KEYWORDS.put("next", TokenType.KW_NEXT);
		KEYWORDS.put("continue", TokenType.KW_CONTINUE);
		KEYWORDS.put("delete", TokenType.KW_DELETE);
		KEYWORDS.put("break", TokenType.KW_BREAK);

		// special-form functions
		KEYWORDS.put("print", TokenType.KW_PRINT);
		KEYWORDS.put("printf", TokenType.KW_PRINTF);
		KEYWORDS.put("getline", TokenType.KW_GETLINE);
	}

	/** Tokens after which a slash means division */
	private static final Set<TokenType> OPERAND_END = EnumSet
			.of(
					TokenType.NAME,
					TokenType.NUMBER,
					TokenType.STRING,
					TokenType.ERE,
					TokenType.BUILTIN_FUNC_NAME,
					TokenType.CLOSE_PAREN,
					TokenType.CLOSE_BRACKET,
					TokenType.DOLLAR,
					TokenType.INC,
					TokenType.DEC);

	private final String text;
	private final List<Integer> fragmentStarts = new ArrayList<Integer>();
	private final List<String> fragmentDescriptions = new ArrayList<String>();

	/**
	 * Creates a lexer over a single program text.
	 *
	 * @param source program text
	 * @param description name of the source, used in error messages
	 */
	public AwkLexer(String source, String description) {
		this.text = source;
		fragmentStarts.add(0);
		fragmentDescriptions.add(description);
	}

	/**
	 * Creates a lexer over program fragments, concatenated in order with a
	 * newline between consecutive fragments.
	 *
	 * @param descriptions name of each fragment
	 * @param fragments text of each fragment
	 */
	public AwkLexer(List<String> descriptions, List<String> fragments) {
		if (fragments.isEmpty() || fragments.size() != descriptions.size()) {
			throw new IllegalArgumentException("Expected one description per program fragment");
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < fragments.size(); i++) {
			if (i > 0) {
				sb.append('\n');
			}
			fragmentStarts.add(sb.length());
			fragmentDescriptions.add(descriptions.get(i));
			sb.append(fragments.get(i));
		}
		this.text = sb.toString();
	}

	/**
	 * Reads every script source and creates a lexer over their contents.
	 *
	 * @param sources script sources, in order
	 * @return the lexer
	 * @throws IOException when a source cannot be read
	 */
	public static AwkLexer fromSources(List<ScriptSource> sources) throws IOException {
		if (sources == null || sources.isEmpty()) {
			throw new IOException("No script sources supplied");
		}
		List<String> descriptions = new ArrayList<String>();
		List<String> fragments = new ArrayList<String>();
		for (ScriptSource source : sources) {
			descriptions.add(source.getDescription());
			fragments.add(source.readFully());
		}
		return new AwkLexer(descriptions, fragments);
	}

	/**
	 * Convenience: all the tokens of the program, EOF included.
	 *
	 * @return the token list
	 * @throws LexerException on a malformed token
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		for (Token token : this) {
			tokens.add(token);
		}
		return tokens;
	}

	/**
	 * Starts a new scan of the program.
	 *
	 * @return a lazy iterator over the tokens
	 */
	@Override
	public Iterator<Token> iterator() {
		return new Scanner();
	}

	/**
	 * Name of the source fragment containing the specified offset.
	 *
	 * @param offset character offset in the concatenated text
	 * @return the description of the fragment
	 */
	String describe(int offset) {
		return fragmentDescriptions.get(fragmentIndex(offset));
	}

	private int fragmentIndex(int offset) {
		int idx = 0;
		for (int i = 1; i < fragmentStarts.size(); i++) {
			if (fragmentStarts.get(i) <= offset) {
				idx = i;
			}
		}
		return idx;
	}

	/**
	 * One pass over the program text.
	 */
	private final class Scanner implements Iterator<Token> {

		private int pos;
		private int line = 1;
		private int column = 1;
		private int nextFragment = 1;
		private TokenType previous;
		private boolean finished;

		private int tokenOffset;
		private int tokenLine;
		private int tokenColumn;

		@Override
		public boolean hasNext() {
			return !finished;
		}

		@Override
		public Token next() {
			if (finished) {
				throw new NoSuchElementException();
			}
			Token token = scan();
			if (token.getType() == TokenType.EOF) {
				finished = true;
			}
			previous = token.getType();
			return token;
		}

		private int peek() {
			return pos < text.length() ? text.charAt(pos) : -1;
		}

		private int peek(int ahead) {
			return pos + ahead < text.length() ? text.charAt(pos + ahead) : -1;
		}

		private char read() {
			char c = text.charAt(pos++);
			if (c == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
			if (nextFragment < fragmentStarts.size() && pos == fragmentStarts.get(nextFragment)) {
				nextFragment++;
				line = 1;
				column = 1;
			}
			return c;
		}

		private LexerException lexerException(String msg) {
			return new LexerException(msg, describe(tokenOffset), tokenLine, tokenColumn);
		}

		private Token token(TokenType type, String value) {
			return new Token(type, value, tokenLine, tokenColumn, describe(tokenOffset));
		}

		private void skipBlanksAndComments() {
			while (pos < text.length()) {
				int c = peek();
				if (c == ' ' || c == '\t' || c == '\r') {
					read();
				} else if (c == '\\' && (peek(1) == '\n' || (peek(1) == '\r' && peek(2) == '\n'))) {
					// line continuation
					read();
					while (peek() != '\n') {
						read();
					}
					read();
				} else if (c == '#') {
					while (pos < text.length() && peek() != '\n') {
						read();
					}
				} else {
					return;
				}
			}
		}

		private Token scan() {
			skipBlanksAndComments();
			tokenOffset = pos;
			tokenLine = line;
			tokenColumn = column;
			if (pos >= text.length()) {
				return token(TokenType.EOF, "");
			}
			char c = read();
			switch (c) {
			case '\n':
				// a run of blank or comment-only lines is a single terminator
				while (true) {
					skipBlanksAndComments();
					if (peek() != '\n') {
						break;
					}
					read();
				}
				return token(TokenType.NEWLINE, "\n");
			case ';':
				return token(TokenType.SEMICOLON, ";");
			case ',':
				return token(TokenType.COMMA, ",");
			case '(':
				return token(TokenType.OPEN_PAREN, "(");
			case ')':
				return token(TokenType.CLOSE_PAREN, ")");
			case '{':
				return token(TokenType.OPEN_BRACE, "{");
			case '}':
				return token(TokenType.CLOSE_BRACE, "}");
			case '[':
				return token(TokenType.OPEN_BRACKET, "[");
			case ']':
				return token(TokenType.CLOSE_BRACKET, "]");
			case '$':
				return token(TokenType.DOLLAR, "$");
			case '~':
				return token(TokenType.MATCHES, "~");
			case '?':
				return token(TokenType.QUESTION_MARK, "?");
			case ':':
				return token(TokenType.COLON, ":");
			case '&':
				if (peek() == '&') {
					read();
					return token(TokenType.AND, "&&");
				}
				throw lexerException("use && for logical and");
			case '|':
				if (peek() == '|') {
					read();
					return token(TokenType.OR, "||");
				}
				return token(TokenType.PIPE, "|");
			case '=':
				return twoChar('=', TokenType.EQ, "==", TokenType.EQUALS, "=");
			case '!':
				if (peek() == '=') {
					read();
					return token(TokenType.NE, "!=");
				}
				if (peek() == '~') {
					read();
					return token(TokenType.NOT_MATCHES, "!~");
				}
				return token(TokenType.NOT, "!");
			case '<':
				return twoChar('=', TokenType.LE, "<=", TokenType.LT, "<");
			case '>':
				if (peek() == '>') {
					read();
					return token(TokenType.APPEND, ">>");
				}
				return twoChar('=', TokenType.GE, ">=", TokenType.GT, ">");
			case '+':
				if (peek() == '+') {
					read();
					return token(TokenType.INC, "++");
				}
				return twoChar('=', TokenType.PLUS_EQ, "+=", TokenType.PLUS, "+");
			case '-':
				if (peek() == '-') {
					read();
					return token(TokenType.DEC, "--");
				}
				return twoChar('=', TokenType.MINUS_EQ, "-=", TokenType.MINUS, "-");
			case '*':
				if (peek() == '*') {
					read();
					return twoChar('=', TokenType.POW_EQ, "**=", TokenType.POW, "**");
				}
				return twoChar('=', TokenType.MULT_EQ, "*=", TokenType.MULT, "*");
			case '%':
				return twoChar('=', TokenType.MOD_EQ, "%=", TokenType.MOD, "%");
			case '^':
				return twoChar('=', TokenType.POW_EQ, "^=", TokenType.POW, "^");
			case '/':
				if (previous != null && OPERAND_END.contains(previous)) {
					return twoChar('=', TokenType.DIV_EQ, "/=", TokenType.DIVIDE, "/");
				}
				return token(TokenType.ERE, readRegexp());
			case '"':
				return token(TokenType.STRING, readString());
			default:
				break;
			}
			if (Character.isDigit(c) || (c == '.' && peek() >= 0 && Character.isDigit(peek()))) {
				return token(TokenType.NUMBER, readNumber(c));
			}
			if (Character.isLetter(c) || c == '_') {
				return identifier(c);
			}
			throw lexerException("Invalid character (" + (int) c + "): " + c);
		}

		private Token twoChar(char second, TokenType ifPresent, String presentText, TokenType otherwise, String otherText) {
			if (peek() == second) {
				read();
				return token(ifPresent, presentText);
			}
			return token(otherwise, otherText);
		}

		private Token identifier(char first) {
			StringBuilder sb = new StringBuilder().append(first);
			while (peek() >= 0 && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
				sb.append(read());
			}
			String name = sb.toString();
			TokenType keyword = KEYWORDS.get(name);
			if (keyword != null) {
				return token(keyword, name);
			}
			if (BuiltinFunction.isReserved(name)) {
				return token(TokenType.BUILTIN_FUNC_NAME, name);
			}
			if (peek() == '(') {
				return token(TokenType.FUNC_NAME, name);
			}
			return token(TokenType.NAME, name);
		}

		private String readNumber(char first) {
			StringBuilder sb = new StringBuilder().append(first);
			boolean seenDot = first == '.';
			while (peek() >= 0) {
				int c = peek();
				if (Character.isDigit(c)) {
					sb.append(read());
				} else if (c == '.' && !seenDot) {
					seenDot = true;
					sb.append(read());
				} else {
					break;
				}
			}
			int e = peek();
			if (e == 'e' || e == 'E') {
				int sign = peek(1);
				int digitAt = sign == '+' || sign == '-' ? 2 : 1;
				int digit = peek(digitAt);
				if (digit >= 0 && Character.isDigit(digit)) {
					for (int i = 0; i < digitAt; i++) {
						sb.append(read());
					}
					while (peek() >= 0 && Character.isDigit(peek())) {
						sb.append(read());
					}
				}
			}
			return sb.toString();
		}

		/**
		 * Reads the string and handle all escape codes.
		 */
		private String readString() {
			StringBuilder string = new StringBuilder();
			while (true) {
				int c = peek();
				if (c < 0 || c == '\n') {
					throw lexerException("Unterminated string: \"" + string);
				}
				read();
				if (c == '"') {
					return string.toString();
				}
				if (c != '\\') {
					string.append((char) c);
					continue;
				}
				c = peek();
				if (c < 0) {
					throw lexerException("Unterminated string: \"" + string);
				}
				read();
				switch (c) {
				case '\n':
					// continuation inside a string
					break;
				case 'n':
					string.append('\n');
					break;
				case 't':
					string.append('\t');
					break;
				case 'r':
					string.append('\r');
					break;
				case 'a':
					string.append('\007');
					break; // BEL 0x07
				case 'b':
					string.append('\010');
					break; // BS 0x08
				case 'f':
					string.append('\014');
					break; // FF 0x0C
				case 'v':
					string.append('\013');
					break; // VT 0x0B
				case '0':
				case '1':
				case '2':
				case '3':
				case '4':
				case '5':
				case '6':
				case '7': {
					// Octal notation: \N \NN \NNN
					int octalChar = c - '0';
					for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
						octalChar = (octalChar << 3) + read() - '0';
					}
					string.append((char) octalChar);
					break;
				}
				case 'x': {
					// Hexadecimal notation: \xN \xNN
					int hexChar = 0;
					int digits = 0;
					while (digits < 2 && Character.digit(peek(), 16) >= 0) {
						hexChar = (hexChar << 4) + Character.digit(read(), 16);
						digits++;
					}
					if (digits == 0) {
						string.append('x');
					} else {
						string.append((char) hexChar);
					}
					break;
				}
				case '/':
					string.append('/');
					break;
				case '"':
					string.append('"');
					break;
				case '\\':
					string.append('\\');
					break;
				default:
					string.append((char) c);
					break;
				}
			}
		}

		/**
		 * Reads the regular expression (between slashes '/') and handle '\/'.
		 */
		private String readRegexp() {
			StringBuilder regexp = new StringBuilder();
			boolean inBracket = false;
			while (true) {
				int c = peek();
				if (c < 0 || c == '\n') {
					throw lexerException("Unterminated regular expression: /" + regexp);
				}
				read();
				if (c == '/' && !inBracket) {
					return regexp.toString();
				}
				if (c == '\\') {
					int next = peek();
					if (next < 0 || next == '\n') {
						throw lexerException("Unterminated regular expression: /" + regexp);
					}
					read();
					if (next != '/') {
						regexp.append('\\');
					}
					regexp.append((char) next);
					continue;
				}
				if (c == '[' && !inBracket) {
					inBracket = true;
					regexp.append('[');
					// a leading ']' (possibly after '^') is part of the bracket expression
					if (peek() == '^') {
						regexp.append(read());
					}
					if (peek() == ']') {
						regexp.append(read());
					}
					continue;
				}
				if (c == ']' && inBracket) {
					inBracket = false;
				}
				regexp.append((char) c);
			}
		}
	}
}
