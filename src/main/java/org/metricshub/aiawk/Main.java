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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.aiawk.frontend.ast.AwkSyntaxException;
import org.metricshub.aiawk.jrt.AwkRuntimeException;

/**
 * Entry point into the parsing and execution of an AWK script, when AiAwk
 * is executed as a stand-alone application.
 * If you want to use AiAwk as a library, please use {@link Awk}.
 * <p>
 * The process exits with the status set by the script, or with
 * {@value #FATAL_ERROR_STATUS} when the arguments are wrong or when the
 * script fails.
 *
 * @author Danny Daglas
 */
public final class Main {

	/** Exit status of a run that failed */
	public static final int FATAL_ERROR_STATUS = 2;

	private Main() {}

	/**
	 * Runs the command line with the specified streams.
	 *
	 * @param args command-line arguments
	 * @param in standard input of the script
	 * @param out standard output of the script
	 * @param err where errors are reported
	 * @return the exit status
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(in, out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (ExitException e) {
			return e.getCode();
		} catch (AwkRuntimeException e) {
			out.flush();
			if (e.getLineNumber() >= 0) {
				err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return FATAL_ERROR_STATUS;
		} catch (AwkSyntaxException e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return FATAL_ERROR_STATUS;
		} catch (IllegalArgumentException e) {
			err.printf("%s\n", e.getMessage());
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return FATAL_ERROR_STATUS;
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return FATAL_ERROR_STATUS;
		}
	}

	/**
	 * The entry point to AiAwk for the VM.
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		System.exit(run(args, System.in, System.out, System.err));
	}
}
