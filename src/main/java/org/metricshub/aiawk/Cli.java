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
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.aiawk.ext.TextAnalysisExtension;
import org.metricshub.aiawk.util.AwkSettings;
import org.metricshub.aiawk.util.ScriptFileSource;
import org.metricshub.aiawk.util.ScriptSource;

/**
 * Command-line interface for AiAwk.
 * <p>
 * The natural-language functions of {@link TextAnalysisExtension} are always
 * available to the scripts run from the command line.
 */
public final class Cli {

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)", Pattern.DOTALL);

	private final AwkSettings settings = new AwkSettings();
	private final PrintStream out;

	private final List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which program input is read
	 * @param out stream where program output is written
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the streams are owned by the caller")
	public Cli(InputStream in, PrintStream out) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link AwkSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "settings are meant to be adjusted before run()")
	public AwkSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the list of script sources specified on the command line.
	 *
	 * @return copy of the script sources list
	 */
	public List<ScriptSource> getScriptSources() {
		return new ArrayList<ScriptSource>(scriptSources);
	}

	/**
	 * @return whether the usage screen was requested
	 */
	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException when the arguments are not valid
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-' || arg.equals("-")) {
				// end of options: the script or the first operand
				break;
			} else if (arg.equals("--")) {
				++argIdx;
				break;
			} else if (arg.equals("-v")) {
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				checkParameterHasArgument(args, argIdx);
				scriptSources.add(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-F")) {
				checkParameterHasArgument(args, argIdx);
				settings.setFieldSeparator(fieldSeparator(args[++argIdx]));
			} else if (arg.startsWith("-F")) {
				settings.setFieldSeparator(fieldSeparator(arg.substring(2)));
			} else if (arg.equals("-t")) {
				settings.setUseSortedArrayKeys(true);
			} else if (arg.equals("--locale")) {
				checkParameterHasArgument(args, argIdx);
				settings.setLocale(Locale.forLanguageTag(args[++argIdx]));
			} else if (arg.equals("--timeout")) {
				checkParameterHasArgument(args, argIdx);
				settings.setForeignCallTimeout(timeout(args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSources.isEmpty()) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Awk script not provided.");
			}
			scriptSources.add(ScriptSource.fromString(args[argIdx++]));
		} else {
			for (ScriptSource scriptSource : scriptSources) {
				checkReadable(scriptSource);
			}
		}

		while (argIdx < args.length) {
			settings.addNameValueOrFileName(args[argIdx++]);
		}
	}

	/**
	 * <code>-F t</code> is a tab, as in other AWK implementations.
	 */
	private static String fieldSeparator(String value) {
		return "t".equals(value) ? "\t" : value;
	}

	private static long timeout(String value) {
		try {
			long timeout = Long.parseLong(value);
			if (timeout <= 0) {
				throw new IllegalArgumentException("--timeout must be a positive number of milliseconds: " + value);
			}
			return timeout;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("--timeout must be a number of milliseconds: " + value, e);
		}
	}

	private static void checkReadable(ScriptSource scriptSource) {
		try (Reader reader = scriptSource.getReader()) {
			reader.ready();
		} catch (IOException ex) {
			throw new IllegalArgumentException(
					"Failed to read script '" + scriptSource.getDescription() + "': " + ex.getMessage(),
					ex);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void addVariable(AwkSettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException(
					"keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		settings.putVariable(m.group(1), m.group(2));
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if a script file cannot be read
	 * @throws ExitException if the script ends with a non-zero exit status
	 */
	public void run() throws IOException, ExitException {
		if (printUsage) {
			usage(out);
			return;
		}
		Awk awk = new Awk(new TextAnalysisExtension());
		awk.invoke(scriptSources, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar aiawk.jar"
								+ " [-F fs_val]"
								+ " [-f script-filename]..."
								+ " [--locale locale]"
								+ " [--timeout millis]"
								+ " [-t]"
								+ " [-v name=val]..."
								+ " [script]"
								+ " [name=val | input_filename]...");
		dest.println();
		dest.println(" -F fs_val = Use fs_val for FS (t means a tab).");
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -v name=val = Initial awk variable assignments.");
		dest.println();
		dest.println(" -t = (extension) Maintain array keys in sorted order.");
		dest.println(" --locale Locale = (extension) Specify a locale to be used instead of US-English");
		dest.println(" --timeout millis = (extension) Maximum duration of an ai_* function call.");
		dest.println();
		dest.println(" -h or -? = (extension) This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}
}
