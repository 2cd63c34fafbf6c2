package org.metricshub.aiawk;

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.metricshub.aiawk.backend.Evaluator;
import org.metricshub.aiawk.ext.AwkExtension;
import org.metricshub.aiawk.ext.ExtensionRegistry;
import org.metricshub.aiawk.frontend.AwkLexer;
import org.metricshub.aiawk.frontend.AwkParser;
import org.metricshub.aiawk.frontend.ast.AwkProgram;
import org.metricshub.aiawk.jrt.AwkSession;
import org.metricshub.aiawk.util.AwkLogger;
import org.metricshub.aiawk.util.AwkSettings;
import org.metricshub.aiawk.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of an AWK script.
 * This entry point is used both when AiAwk is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute a script is as follows:
 * <ul>
 * <li>Split the script into tokens and parse them, producing the syntax tree
 * of the program ({@link #compile(List)}).
 * <li>Walk the syntax tree with an {@link Evaluator}, against a fresh
 * {@link AwkSession} built from the {@link AwkSettings}.
 * </ul>
 * The engine does not enable any extension automatically. Extensions are
 * provided to the constructors and their functions can then be called from
 * the scripts like any other function.
 *
 * @author Danny Daglas
 */
public class Awk {

	private static final Logger LOG = AwkLogger.getLogger(Awk.class);

	private final List<AwkExtension> extensions;

	/**
	 * Create a new instance of Awk without extensions
	 */
	public Awk() {
		this(Collections.<AwkExtension>emptyList());
	}

	/**
	 * Create a new instance of Awk with the specified extension instances.
	 *
	 * @param extensions extension instances
	 */
	public Awk(AwkExtension... extensions) {
		this(Arrays.asList(extensions));
	}

	/**
	 * Create a new instance of Awk with the specified extension instances.
	 *
	 * @param extensions extension instances
	 */
	public Awk(Collection<? extends AwkExtension> extensions) {
		for (AwkExtension extension : extensions) {
			if (extension == null) {
				throw new IllegalArgumentException("Extension instance must not be null");
			}
		}
		this.extensions = Collections.unmodifiableList(new ArrayList<AwkExtension>(extensions));
	}

	/**
	 * Parses a script.
	 *
	 * @param script text of the program
	 * @return the parsed program
	 * @throws org.metricshub.aiawk.frontend.ast.AwkSyntaxException when the
	 *         script is not valid
	 */
	public AwkProgram compile(String script) {
		return new AwkParser(new AwkLexer(script, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT)).parse();
	}

	/**
	 * Parses the concatenation of several script fragments, in order.
	 *
	 * @param scripts the script fragments
	 * @return the parsed program
	 * @throws IOException when a fragment cannot be read
	 * @throws org.metricshub.aiawk.frontend.ast.AwkSyntaxException when the
	 *         script is not valid
	 */
	public AwkProgram compile(List<ScriptSource> scripts) throws IOException {
		return new AwkParser(AwkLexer.fromSources(scripts)).parse();
	}

	/**
	 * Compiles and runs a script with the specified settings.
	 *
	 * @param script text of the program
	 * @param settings This tells AWK what to do (where to get input from,
	 *        where to write it to, which variables to set, ...)
	 * @throws ExitException if the program ends with a non-zero exit status
	 */
	public void invoke(String script, AwkSettings settings) throws ExitException {
		invoke(compile(script), settings);
	}

	/**
	 * Compiles and runs the specified script fragments.
	 *
	 * @param scripts script fragments, concatenated in order
	 * @param settings runtime settings
	 * @throws IOException if a fragment cannot be read
	 * @throws ExitException if the program ends with a non-zero exit status
	 */
	public void invoke(List<ScriptSource> scripts, AwkSettings settings) throws IOException, ExitException {
		invoke(compile(scripts), settings);
	}

	/**
	 * Runs a parsed program with the specified settings.
	 *
	 * @param program parsed program
	 * @param settings runtime settings
	 * @throws ExitException if the program ends with a non-zero exit status
	 */
	public void invoke(AwkProgram program, AwkSettings settings) throws ExitException {
		int code = execute(program, settings);
		if (code != 0) {
			throw new ExitException(code, "The AWK script requested an exit");
		}
	}

	/**
	 * Runs a parsed program and returns its exit status.
	 *
	 * @param program parsed program
	 * @param settings runtime settings
	 * @return the exit status set by the <code>exit</code> statement, 0 by
	 *         default
	 * @throws org.metricshub.aiawk.jrt.AwkRuntimeException on a fatal error
	 */
	public int execute(AwkProgram program, AwkSettings settings) {
		ExtensionRegistry registry = new ExtensionRegistry();
		for (AwkExtension extension : extensions) {
			registry.register(extension);
		}
		registry.setCallTimeout(settings.getForeignCallTimeout());
		LOG.debug("Running with settings: {}", settings.toDescriptionString());
		try {
			return new Evaluator(new AwkSession(settings), registry).interpret(program);
		} finally {
			registry.shutdown();
		}
	}

	/**
	 * Executes the specified AWK script against the given input and returns the
	 * printed output as a {@link String}.
	 *
	 * @param script AWK script to execute
	 * @param input text to process
	 * @return result of the execution as a String
	 * @throws ExitException if the script terminates with a non-zero exit code
	 */
	public String run(String script, String input) throws ExitException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		run(script, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	/**
	 * Executes the specified AWK script against the provided input stream and
	 * writes the result to the given {@link OutputStream}.
	 *
	 * @param script AWK script to execute
	 * @param input stream to process
	 * @param output destination for the printed output
	 * @throws ExitException if the script terminates with a non-zero exit code
	 */
	public void run(String script, InputStream input, OutputStream output) throws ExitException {
		AwkSettings settings = new AwkSettings();
		settings.setInput(input);
		PrintStream printStream = new PrintStream(output, false, StandardCharsets.UTF_8);
		settings.setOutputStream(printStream);
		try {
			invoke(script, settings);
		} finally {
			printStream.flush();
		}
	}
}
