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

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.aiawk.util.AwkLogger;
import org.metricshub.aiawk.util.AwkSettings;
import org.slf4j.Logger;

/**
 * The state of one AWK run: global variables (including the built-in ones),
 * the current record, the input sources and the output streams.
 * <p>
 * One session is created per run and handed to the interpreter, which
 * reads and writes everything through it. Built-in variables are ordinary
 * entries with hooks: assigning <code>NF</code> rebuilds the record,
 * assigning <code>FS</code> changes how the next record is split,
 * assigning <code>RS</code> changes how the next record is read, and so on.
 * <p>
 * Input comes from the <code>ARGV</code> operands: file names are read in
 * order (<code>-</code> meaning standard input), <code>name=value</code>
 * operands assign a variable when they are reached, and standard input is
 * read when no file operand is given. <code>FNR</code> restarts at each
 * file, <code>NR</code> never does.
 */
public class AwkSession {

	private static final Logger LOG = AwkLogger.getLogger(AwkSession.class);

	private static final Pattern ASSIGNMENT = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)", Pattern.DOTALL);

	private final Map<String, Object> globals = new HashMap<String, Object>();
	private final RegexCache regexCache = new RegexCache();
	private final Record record = new Record(regexCache);
	private final OpenStreams openStreams = new OpenStreams();
	private final AwkSettings settings;
	private final Locale locale;
	private final PrintStream output;
	private final boolean sortedArrayKeys;

	private long nr;
	private long fnr;
	private String convfmt = AwkValue.DEFAULT_CONVFMT;
	private String ofmt = AwkValue.DEFAULT_CONVFMT;
	private String ors;
	private String rs;
	private String subsep = "\034";

	private int argvIndex = 1;
	private boolean fileOperandSeen;
	private RecordReader currentInput;
	private boolean currentInputIsFile;

	private Random random = new Random(0);
	private double seed;

	/**
	 * Creates the session of a run.
	 *
	 * @param settings input, output and initial variables of the run
	 */
	public AwkSession(AwkSettings settings) {
		this.settings = settings;
		this.locale = settings.getLocale();
		this.output = settings.getOutputStream();
		this.sortedArrayKeys = settings.isUseSortedArrayKeys();
		this.ors = settings.getDefaultORS();
		this.rs = settings.getDefaultRS();
		record.setConversion(convfmt, locale);
		record.setParagraphMode(rs.isEmpty());

		globals.put("FS", AwkValue.of(" "));
		globals.put("OFS", AwkValue.of(" "));
		globals.put("ORS", AwkValue.of(ors));
		globals.put("RS", AwkValue.of(rs));
		globals.put("SUBSEP", AwkValue.of(subsep));
		globals.put("CONVFMT", AwkValue.of(convfmt));
		globals.put("OFMT", AwkValue.of(ofmt));
		globals.put("RSTART", AwkValue.ZERO);
		globals.put("RLENGTH", AwkValue.of(-1));
		globals.put("FILENAME", AwkValue.EMPTY);

		AssocArray argv = newArray();
		argv.put("0", AwkValue.of("awk"));
		List<String> operands = settings.getNameValueOrFileNames();
		for (int i = 0; i < operands.size(); i++) {
			argv.put(String.valueOf(i + 1), AwkValue.fromInput(operands.get(i)));
		}
		globals.put("ARGV", argv);
		globals.put("ARGC", AwkValue.of(operands.size() + 1));

		AssocArray environ = newArray();
		for (Map.Entry<String, String> entry : System.getenv().entrySet()) {
			environ.put(entry.getKey(), AwkValue.fromInput(entry.getValue()));
		}
		globals.put("ENVIRON", environ);

		if (settings.getFieldSeparator() != null) {
			setVariable("FS", AwkValue.of(processEscapes(settings.getFieldSeparator())));
		}
		for (Map.Entry<String, String> entry : settings.getVariables().entrySet()) {
			setVariable(entry.getKey(), AwkValue.fromInput(processEscapes(entry.getValue())));
		}
	}

	/**
	 * @return a new, empty array honoring the key ordering setting
	 */
	public AssocArray newArray() {
		return new AssocArray(sortedArrayKeys);
	}

	// VARIABLES

	/**
	 * Reads a global scalar variable.
	 *
	 * @param name variable name
	 * @return its value, uninitialized when never assigned
	 * @throws AwkTypeException when the name denotes an array
	 */
	public AwkValue getVariable(String name) {
		if ("NF".equals(name)) {
			return AwkValue.of(record.getNF());
		}
		if ("NR".equals(name)) {
			return AwkValue.of(nr);
		}
		if ("FNR".equals(name)) {
			return AwkValue.of(fnr);
		}
		Object binding = globals.get(name);
		if (binding == null) {
			return AwkValue.UNINITIALIZED;
		}
		if (binding instanceof AssocArray) {
			throw new AwkTypeException("Attempt to use array " + name + " in a scalar context");
		}
		return (AwkValue) binding;
	}

	/**
	 * Assigns a global scalar variable, running the hook of built-in
	 * variables.
	 *
	 * @param name variable name
	 * @param value new value
	 * @throws AwkNameException when the name denotes an array
	 */
	public void setVariable(String name, AwkValue value) {
		if (globals.get(name) instanceof AssocArray) {
			throw new AwkNameException("Cannot assign to " + name + ": it is an array name");
		}
		switch (name) {
		case "NF":
			record.setNF((int) value.toNumber());
			return;
		case "NR":
			nr = (long) value.toNumber();
			return;
		case "FNR":
			fnr = (long) value.toNumber();
			return;
		case "FS":
			record.setFieldSeparator(toStr(value));
			break;
		case "OFS":
			record.setOutputFieldSeparator(toStr(value));
			break;
		case "ORS":
			ors = toStr(value);
			break;
		case "RS":
			rs = toStr(value);
			record.setParagraphMode(rs.isEmpty());
			break;
		case "SUBSEP":
			subsep = toStr(value);
			break;
		case "CONVFMT":
			convfmt = toStr(value);
			record.setConversion(convfmt, locale);
			break;
		case "OFMT":
			ofmt = toStr(value);
			break;
		default:
			break;
		}
		globals.put(name, value);
	}

	/**
	 * Returns the global array with the specified name, creating it when the
	 * name is still unused.
	 *
	 * @param name array name
	 * @return the array
	 * @throws AwkNameException when the name denotes a scalar
	 */
	public AssocArray getArray(String name) {
		Object binding = globals.get(name);
		if (binding instanceof AssocArray) {
			return (AssocArray) binding;
		}
		if (binding != null || "NF".equals(name) || "NR".equals(name) || "FNR".equals(name)) {
			throw new AwkNameException("Cannot use scalar " + name + " as an array");
		}
		AssocArray array = newArray();
		globals.put(name, array);
		return array;
	}

	/**
	 * @param name global name
	 * @return whether the name is bound to an array
	 */
	public boolean isArray(String name) {
		return globals.get(name) instanceof AssocArray;
	}

	// CONVERSIONS

	/**
	 * @param value a value
	 * @return its string form, numbers formatted with CONVFMT
	 */
	public String toStr(AwkValue value) {
		return value.toString(convfmt, locale);
	}

	/**
	 * @param value a value to print
	 * @return its output form, numbers formatted with OFMT
	 */
	public String toOutputStr(AwkValue value) {
		return value.isNumber() ? value.toString(ofmt, locale) : value.toString(convfmt, locale);
	}

	/**
	 * Builds an array subscript, joining multiple indices with SUBSEP.
	 *
	 * @param indices evaluated indices
	 * @return the subscript
	 */
	public String subscript(List<AwkValue> indices) {
		if (indices.size() == 1) {
			return toStr(indices.get(0));
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < indices.size(); i++) {
			if (i > 0) {
				sb.append(subsep);
			}
			sb.append(toStr(indices.get(i)));
		}
		return sb.toString();
	}

	/**
	 * Compares two values with the current CONVFMT.
	 *
	 * @param left left operand
	 * @param right right operand
	 * @return a negative number, zero or a positive number
	 */
	public int compare(AwkValue left, AwkValue right) {
		return AwkValue.compare(left, right, convfmt, locale);
	}

	/**
	 * @param regex AWK regular expression
	 * @return the compiled pattern, cached by text
	 */
	public Pattern regex(String regex) {
		return regexCache.compile(regex);
	}

	/**
	 * @return the regular expression cache of this run
	 */
	public RegexCache getRegexCache() {
		return regexCache;
	}

	/**
	 * @return CONVFMT
	 */
	public String getConvfmt() {
		return convfmt;
	}

	/**
	 * @return the locale used for number formatting
	 */
	public Locale getLocale() {
		return locale;
	}

	// RECORD

	/**
	 * @return the record and field engine
	 */
	public Record getRecord() {
		return record;
	}

	/**
	 * @param index field number
	 * @return the field value
	 */
	public AwkValue getField(int index) {
		return record.getField(index);
	}

	/**
	 * @param index field number
	 * @param value new value
	 */
	public void setField(int index, AwkValue value) {
		record.setField(index, value);
	}

	// INPUT

	/**
	 * Reads the next record from the main input, advancing through the
	 * operands as needed, and counts it in NR and FNR.
	 *
	 * @return the record text, or {@code null} when all input is consumed
	 * @throws AwkInputException when an input file cannot be opened or read
	 */
	public String nextMainRecord() {
		while (true) {
			if (currentInput == null && !openNextInput()) {
				return null;
			}
			String text;
			try {
				text = currentInput.readRecord(rs);
			} catch (IOException e) {
				AwkInputException failure = new AwkInputException("Failed to read " + describeInput() + ": " + e.getMessage(), e);
				try {
					closeCurrentInput();
				} catch (AwkInputException closeFailure) {
					failure.addSuppressed(closeFailure);
				}
				throw failure;
			}
			if (text != null) {
				nr++;
				fnr++;
				return text;
			}
			closeCurrentInput();
		}
	}

	/**
	 * Closes the current main input, unless it is the standard input, which
	 * belongs to the caller.
	 *
	 * @throws AwkInputException when the file cannot be closed
	 */
	private void closeCurrentInput() {
		RecordReader reader = currentInput;
		boolean owned = currentInputIsFile;
		currentInput = null;
		currentInputIsFile = false;
		if (reader == null || !owned) {
			return;
		}
		try {
			reader.close();
		} catch (IOException e) {
			throw new AwkInputException("Failed to close " + describeInput() + ": " + e.getMessage(), e);
		}
	}

	private boolean openNextInput() {
		AssocArray argv = getArray("ARGV");
		int argc = (int) getVariable("ARGC").toNumber();
		while (argvIndex < argc) {
			String key = String.valueOf(argvIndex++);
			if (!argv.isIn(key)) {
				continue;
			}
			String operand = toStr(argv.get(key));
			if (operand.isEmpty()) {
				continue;
			}
			Matcher assignment = ASSIGNMENT.matcher(operand);
			if (assignment.matches()) {
				setVariable(assignment.group(1), AwkValue.fromInput(processEscapes(assignment.group(2))));
				continue;
			}
			fileOperandSeen = true;
			fnr = 0;
			globals.put("FILENAME", AwkValue.of(operand));
			if ("-".equals(operand)) {
				currentInput = stdin();
			} else {
				try {
					currentInput = new RecordReader(Files.newBufferedReader(Paths.get(operand), StandardCharsets.UTF_8));
					currentInputIsFile = true;
				} catch (IOException e) {
					throw new AwkInputException("Cannot open file " + operand + " for reading", e);
				}
			}
			LOG.debug("Reading records from {}", operand);
			return true;
		}
		if (!fileOperandSeen) {
			fileOperandSeen = true;
			fnr = 0;
			currentInput = stdin();
			return true;
		}
		return false;
	}

	private RecordReader stdin() {
		return new RecordReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
	}

	private String describeInput() {
		String fileName = toStr(getVariable("FILENAME"));
		return fileName.isEmpty() ? "standard input" : fileName;
	}

	/**
	 * Reads the next record of a file for <code>getline &lt; file</code>.
	 *
	 * @param fileName file name
	 * @return the record text, {@code null} at end of file
	 * @throws IOException when the file cannot be opened or read
	 */
	public String nextFileRecord(String fileName) throws IOException {
		RecordReader reader = openStreams.input(fileName);
		if (reader == null) {
			throw new IOException("Cannot open " + fileName);
		}
		return reader.readRecord(rs);
	}

	// OUTPUT

	/**
	 * Writes text to the main output or to a redirection target.
	 *
	 * @param text text to write, separators included
	 * @param fileName redirection target, {@code null} for the main output
	 * @param append whether an unopened target is appended to
	 */
	public void write(String text, String fileName, boolean append) {
		if (fileName == null) {
			output.print(text);
		} else {
			PrintWriter writer = openStreams.output(fileName, append);
			writer.print(text);
		}
	}

	/**
	 * @return ORS
	 */
	public String getOrs() {
		return ors;
	}

	/**
	 * @return OFS
	 */
	public String getOfs() {
		return toStr(getVariable("OFS"));
	}

	/**
	 * Closes a file opened by the program.
	 *
	 * @param fileName file name
	 * @return 0 on success, -1 otherwise
	 */
	public int close(String fileName) {
		return openStreams.close(fileName);
	}

	/**
	 * Flushes the main output and closes every file opened by the program,
	 * the current input file included.
	 */
	public void finish() {
		output.flush();
		openStreams.closeAll();
		try {
			closeCurrentInput();
		} catch (AwkInputException e) {
			LOG.warn(e.getMessage());
		}
	}

	// NUMBERS

	/**
	 * @return the next pseudo-random number, in [0, 1)
	 */
	public double rand() {
		return random.nextDouble();
	}

	/**
	 * Reseeds the random number generator.
	 *
	 * @param newSeed new seed
	 * @return the previous seed
	 */
	public double srand(double newSeed) {
		double previous = seed;
		seed = newSeed;
		random = new Random(Double.doubleToLongBits(newSeed));
		return previous;
	}

	// RSTART / RLENGTH

	/**
	 * Sets the variables describing the last <code>match()</code>.
	 *
	 * @param start 1-based start, 0 when nothing matched
	 * @param length match length, -1 when nothing matched
	 */
	public void setMatch(int start, int length) {
		globals.put("RSTART", AwkValue.of(start));
		globals.put("RLENGTH", AwkValue.of(length));
	}

	/**
	 * Interprets the escape sequences of a command-line assignment value.
	 *
	 * @param text raw value
	 * @return the value with escapes replaced
	 */
	public static String processEscapes(String text) {
		if (text.indexOf('\\') < 0) {
			return text;
		}
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c != '\\' || i + 1 >= text.length()) {
				sb.append(c);
				continue;
			}
			char next = text.charAt(++i);
			switch (next) {
			case 'n':
				sb.append('\n');
				break;
			case 't':
				sb.append('\t');
				break;
			case 'r':
				sb.append('\r');
				break;
			case '\\':
				sb.append('\\');
				break;
			case '"':
				sb.append('"');
				break;
			case '/':
				sb.append('/');
				break;
			default:
				sb.append('\\').append(next);
				break;
			}
		}
		return sb.toString();
	}
}
