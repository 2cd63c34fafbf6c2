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

/**
 * Kinds of lexical tokens.
 * <p>
 * Keywords are prefixed with <code>KW_</code>. Built-in function names get
 * their own kind so that the parser can accept <code>length</code> without
 * parentheses, and identifiers immediately followed by an opening
 * parenthesis are {@link #FUNC_NAME}s (user or foreign function calls).
 */
public enum TokenType {
	EOF,
	NEWLINE,
	SEMICOLON,

	NAME,
	FUNC_NAME,
	BUILTIN_FUNC_NAME,
	NUMBER,
	STRING,
	ERE,

	EQUALS,
	PLUS_EQ,
	MINUS_EQ,
	MULT_EQ,
	DIV_EQ,
	MOD_EQ,
	POW_EQ,

	QUESTION_MARK,
	COLON,
	OR,
	AND,
	NOT,
	MATCHES,
	NOT_MATCHES,

	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,
	APPEND,
	PIPE,

	PLUS,
	MINUS,
	MULT,
	DIVIDE,
	MOD,
	POW,
	INC,
	DEC,
	DOLLAR,
	COMMA,

	OPEN_PAREN,
	CLOSE_PAREN,
	OPEN_BRACE,
	CLOSE_BRACE,
	OPEN_BRACKET,
	CLOSE_BRACKET,

	KW_FUNCTION,
	KW_BEGIN,
	KW_END,
	KW_IN,
	KW_IF,
	KW_ELSE,
	KW_WHILE,
	KW_FOR,
	KW_DO,
	KW_RETURN,
	KW_EXIT,
	KW_NEXT,
	KW_CONTINUE,
	KW_DELETE,
	KW_BREAK,
	KW_PRINT,
	KW_PRINTF,
	KW_GETLINE
}
