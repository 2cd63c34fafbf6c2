package org.metricshub.aiawk.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A simple container for the parameters of a single AWK invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking AiAwk programmatically, from within Java code.
 *
 * @author Danny Daglas
 */
public class AwkSettings {

	/** Default bound on a single foreign function call, in milliseconds */
	public static final long DEFAULT_FOREIGN_CALL_TIMEOUT = 10000L;

	/**
	 * Where input is read from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Contains variable assignments which are applied prior to
	 * executing the script (-v assignments), in order.
	 */
	private Map<String, String> variables = new LinkedHashMap<String, String>();

	/**
	 * Contains name=value or filename entries.
	 * Order is important, which is why name=value and filenames
	 * are listed in the same List container.
	 */
	private List<String> nameValueOrFileNames = new ArrayList<String>();

	/**
	 * Initial Field Separator (FS) value.
	 * <code>null</code> means the default FS value.
	 */
	private String fieldSeparator = null;

	/**
	 * Whether to maintain array keys in sorted order;
	 * <code>false</code> (insertion order) by default.
	 */
	private boolean useSortedArrayKeys = false;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Locale for the output of numbers
	 * <code>US-English</code> by default.
	 */
	private Locale locale = Locale.US;

	/**
	 * Default value for RS, when not set specifically by the AWK script
	 */
	private String defaultRS = "\n";

	/**
	 * Default value for ORS, when not set specifically by the AWK script
	 */
	private String defaultORS = "\n";

	/**
	 * Maximum duration of one foreign function call, in milliseconds.
	 */
	private long foreignCallTimeout = DEFAULT_FOREIGN_CALL_TIMEOUT;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("variables = ").append(getVariables()).append(newLine);
		desc.append("nameValueOrFileNames = ").append(getNameValueOrFileNames()).append(newLine);
		desc.append("fieldSeparator = ").append(getFieldSeparator()).append(newLine);
		desc.append("useSortedArrayKeys = ").append(isUseSortedArrayKeys()).append(newLine);
		desc.append("foreignCallTimeout = ").append(getForeignCallTimeout()).append(newLine);

		return desc.toString();
	}

	/**
	 * Where input is read from.
	 * By default, this is {@link java.lang.System#in}.
	 *
	 * @return the input
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the stream is shared with the interpreter on purpose")
	public InputStream getInput() {
		return input;
	}

	/**
	 * @param input the input to set
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the stream is shared with the interpreter on purpose")
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * Contains variable assignments which are applied prior to
	 * executing the script (-v assignments). Values are raw text:
	 * they become strnums when they look numeric.
	 *
	 * @return the variables
	 */
	public Map<String, String> getVariables() {
		return new LinkedHashMap<String, String>(variables);
	}

	/**
	 * @param variables the variables to set
	 */
	public void setVariables(Map<String, String> variables) {
		this.variables = new LinkedHashMap<String, String>(variables);
	}

	/**
	 * Put or replace a variable entry.
	 *
	 * @param name Variable name
	 * @param value Variable value, as text
	 */
	public void putVariable(String name, String value) {
		variables.put(name, value);
	}

	/**
	 * Contains name=value or filename entries.
	 * Order is important, which is why name=value and filenames
	 * are listed in the same List container.
	 *
	 * @return the nameValueOrFileNames
	 */
	public List<String> getNameValueOrFileNames() {
		return new ArrayList<String>(nameValueOrFileNames);
	}

	/**
	 * Add a name=value or filename entry.
	 *
	 * @param entry entry to add
	 */
	public void addNameValueOrFileName(String entry) {
		nameValueOrFileNames.add(entry);
	}

	/**
	 * Initial Field Separator (FS) value.
	 * <code>null</code> means the default FS value.
	 *
	 * @return the fieldSeparator
	 */
	public String getFieldSeparator() {
		return fieldSeparator;
	}

	/**
	 * @param fieldSeparator the fieldSeparator to set
	 */
	public void setFieldSeparator(String fieldSeparator) {
		this.fieldSeparator = fieldSeparator;
	}

	/**
	 * @return the useSortedArrayKeys
	 */
	public boolean isUseSortedArrayKeys() {
		return useSortedArrayKeys;
	}

	/**
	 * @param useSortedArrayKeys the useSortedArrayKeys to set
	 */
	public void setUseSortedArrayKeys(boolean useSortedArrayKeys) {
		this.useSortedArrayKeys = useSortedArrayKeys;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 *
	 * @return the outputStream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the stream is shared with the interpreter on purpose")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the outputStream to set
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the stream is shared with the interpreter on purpose")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	/**
	 * @return the locale used to format numbers
	 */
	public Locale getLocale() {
		return locale;
	}

	/**
	 * @param pLocale the locale used to format numbers
	 */
	public void setLocale(Locale pLocale) {
		locale = pLocale;
	}

	/**
	 * @return the initial record separator
	 */
	public String getDefaultRS() {
		return defaultRS;
	}

	/**
	 * @param rs the initial record separator
	 */
	public void setDefaultRS(String rs) {
		defaultRS = rs;
	}

	/**
	 * @return the initial output record separator
	 */
	public String getDefaultORS() {
		return defaultORS;
	}

	/**
	 * @param ors the initial output record separator
	 */
	public void setDefaultORS(String ors) {
		defaultORS = ors;
	}

	/**
	 * @return maximum duration of one foreign function call, in milliseconds
	 */
	public long getForeignCallTimeout() {
		return foreignCallTimeout;
	}

	/**
	 * @param timeoutMillis maximum duration of one foreign function call,
	 *        in milliseconds
	 */
	public void setForeignCallTimeout(long timeoutMillis) {
		if (timeoutMillis <= 0) {
			throw new IllegalArgumentException("Foreign call timeout must be positive: " + timeoutMillis);
		}
		this.foreignCallTimeout = timeoutMillis;
	}
}
