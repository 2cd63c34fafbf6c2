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
 * A lexical token: its kind, its text and where it starts in the source.
 * <p>
 * For strings and regular expressions, the text is the decoded content,
 * without delimiters (escape sequences of strings already interpreted).
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final int line;
	private final int column;
	private final String source;

	/**
	 * @param type kind of token
	 * @param text token text
	 * @param line 1-based line
	 * @param column 1-based column
	 */
	public Token(TokenType type, String text, int line, int column) {
		this(type, text, line, column, null);
	}

	/**
	 * @param type kind of token
	 * @param text token text
	 * @param line 1-based line
	 * @param column 1-based column
	 * @param source description of the script source the token comes from
	 */
	public Token(TokenType type, String text, int line, int column, String source) {
		this.type = type;
		this.text = text;
		this.line = line;
		this.column = column;
		this.source = source;
	}

	/**
	 * @return description of the script source, may be null
	 */
	public String getSource() {
		return source;
	}

	/**
	 * @return the kind of token
	 */
	public TokenType getType() {
		return type;
	}

	/**
	 * @return the token text
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the 1-based line where the token starts
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return the 1-based column where the token starts
	 */
	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return type.name() + "(" + text.replace("\n", "\\n") + ")@" + line + ":" + column;
	}
}
