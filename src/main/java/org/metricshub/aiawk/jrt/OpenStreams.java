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

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.aiawk.util.AwkLogger;
import org.slf4j.Logger;

/**
 * Files opened by <code>print &gt; file</code>, <code>print &gt;&gt; file</code>
 * and <code>getline &lt; file</code>, keyed by the name used in the
 * program. A file stays open until <code>close(name)</code> or the end of
 * the run.
 */
public class OpenStreams {

	private static final Logger LOG = AwkLogger.getLogger(OpenStreams.class);

	private final Map<String, PrintWriter> outputs = new LinkedHashMap<String, PrintWriter>();
	private final Map<String, RecordReader> inputs = new LinkedHashMap<String, RecordReader>();

	/**
	 * Returns the writer for an output file, opening it on first use.
	 *
	 * @param name file name
	 * @param append whether an unopened file is appended to rather than
	 *        truncated
	 * @return the writer
	 * @throws AwkInputException when the file cannot be opened
	 */
	public PrintWriter output(String name, boolean append) {
		PrintWriter writer = outputs.get(name);
		if (writer == null) {
			try {
				writer = new PrintWriter(
						new OutputStreamWriter(new FileOutputStream(name, append), StandardCharsets.UTF_8));
			} catch (FileNotFoundException e) {
				throw new AwkInputException("Cannot open \"" + name + "\" for output", e);
			}
			LOG.debug("Opened output file {} (append={})", name, append);
			outputs.put(name, writer);
		}
		return writer;
	}

	/**
	 * Returns the record reader for an input file, opening it on first use.
	 *
	 * @param name file name
	 * @return the reader, or {@code null} when the file cannot be opened
	 */
	public RecordReader input(String name) {
		RecordReader reader = inputs.get(name);
		if (reader == null) {
			try {
				reader = new RecordReader(
						new InputStreamReader(Files.newInputStream(Paths.get(name)), StandardCharsets.UTF_8));
			} catch (IOException e) {
				LOG.debug("Cannot open {} for getline: {}", name, e.getMessage());
				return null;
			}
			inputs.put(name, reader);
		}
		return reader;
	}

	/**
	 * Closes a file opened by the program.
	 *
	 * @param name file name
	 * @return 0 on success, -1 when no such file is open
	 */
	public int close(String name) {
		int result = -1;
		PrintWriter writer = outputs.remove(name);
		if (writer != null) {
			writer.close();
			result = 0;
		}
		RecordReader reader = inputs.remove(name);
		if (reader != null) {
			try {
				reader.close();
				result = 0;
			} catch (IOException e) {
				LOG.warn("Failed to close {}: {}", name, e.getMessage());
			}
		}
		return result;
	}

	/**
	 * Closes every file still open.
	 */
	public void closeAll() {
		for (String name : new ArrayList<String>(outputs.keySet())) {
			close(name);
		}
		for (String name : new ArrayList<String>(inputs.keySet())) {
			close(name);
		}
	}
}
