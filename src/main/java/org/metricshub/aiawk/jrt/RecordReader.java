package org.metricshub.aiawk.jrt;

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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Reads records from a character stream, delimited by the record
 * separator (RS).
 * <ul>
 * <li>RS of one character: records end at each occurrence of it (a newline
 * by default);</li>
 * <li>RS empty: paragraph mode, records are separated by one or more blank
 * lines, and leading newlines are skipped;</li>
 * <li>longer RS values: only the first character is used.</li>
 * </ul>
 * The last record is returned even without a trailing separator.
 * RS is passed on each call so that a change made by the program applies
 * to the next record.
 */
public class RecordReader implements Closeable {

	private final BufferedReader reader;
	private int lookahead = -2;

	/**
	 * @param reader the underlying character stream
	 */
	public RecordReader(Reader reader) {
		this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
	}

	/**
	 * Reads the next record.
	 *
	 * @param rs the current record separator
	 * @return the record text, or {@code null} at end of input
	 * @throws IOException when reading fails
	 */
	public String readRecord(String rs) throws IOException {
		if (rs.isEmpty()) {
			return readParagraph();
		}
		char separator = rs.charAt(0);
		StringBuilder sb = new StringBuilder();
		int c = read();
		if (c < 0) {
			return null;
		}
		while (c >= 0 && c != separator) {
			sb.append((char) c);
			c = read();
		}
		return sb.toString();
	}

	private String readParagraph() throws IOException {
		int c = read();
		while (c == '\n') {
			c = read();
		}
		if (c < 0) {
			return null;
		}
		StringBuilder sb = new StringBuilder();
		while (c >= 0) {
			if (c == '\n') {
				int next = read();
				if (next == '\n' || next < 0) {
					// blank line (or end of input): swallow the whole run of newlines
					while (next == '\n') {
						next = read();
					}
					unread(next);
					break;
				}
				sb.append('\n');
				c = next;
				continue;
			}
			sb.append((char) c);
			c = read();
		}
		return sb.toString();
	}

	private int read() throws IOException {
		if (lookahead != -2) {
			int c = lookahead;
			lookahead = -2;
			return c;
		}
		return reader.read();
	}

	private void unread(int c) {
		lookahead = c;
	}

	/** {@inheritDoc} */
	@Override
	public void close() throws IOException {
		reader.close();
	}
}
