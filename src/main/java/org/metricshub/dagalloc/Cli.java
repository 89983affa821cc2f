package org.metricshub.dagalloc;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DagAlloc
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.dagalloc.dag.DagNode;
import org.metricshub.dagalloc.dag.NodeKind;
import org.metricshub.dagalloc.frontend.ast.ParserException;
import org.metricshub.dagalloc.report.AllocationReport;
import org.metricshub.dagalloc.report.AllocationResult;
import org.metricshub.dagalloc.report.JsonReportWriter;
import org.metricshub.dagalloc.report.TextReportWriter;
import org.metricshub.dagalloc.util.DagAllocSettings;

/**
 * Command-line interface for DagAlloc.
 */
public final class Cli {

	/**
	 * Expression analyzed by <code>--example</code>: the fragment
	 * <code>c = a + b; d = a * c; e = b + d; f = c - e</code> written as a
	 * single expression for <code>f</code>.
	 */
	public static final String EXAMPLE_EXPRESSION = "(a + b) - (b + a * (a + b))";

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "dagalloc.jar";
		}
		JAR_NAME = myName;
	}

	private final DagAllocSettings settings = new DagAllocSettings();
	private final PrintStream out;
	private final PrintStream err;

	private final List<String> expressions = new ArrayList<String>();

	private boolean json;
	private boolean dumpSyntaxTree;
	private boolean dumpDag;
	private boolean printUsage;
	private int failures;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. The input stream is
	 * unused but kept for API symmetry with typical Java main methods.
	 *
	 * @param in stream from which input could be read
	 * @param out stream where reports are written
	 * @param err stream where error messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(@SuppressWarnings("unused") InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link DagAllocSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DagAllocSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the expressions to analyze, in order.
	 *
	 * @return defensive copy of the expression list
	 */
	public List<String> getExpressions() {
		return new ArrayList<String>(expressions);
	}

	public boolean isJson() {
		return json;
	}

	/**
	 * @return how many expressions failed during the last {@link #run()}
	 */
	public int getFailures() {
		return failures;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		boolean fromFile = false;
		boolean example = false;

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-' || arg.length() == 1) {
				// end of options
				break;
			} else if (arg.equals("--")) {
				++argIdx;
				break;
			} else if (arg.equals("-v")) {
				// -v name=val : bind a variable for running the generated code
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : one expression per line
				checkParameterHasArgument(args, argIdx);
				expressions.addAll(readExpressions(args[++argIdx]));
				fromFile = true;
			} else if (arg.equals("-r") || arg.equals("--registers")) {
				// -r budget : maximum number of registers
				checkParameterHasArgument(args, argIdx);
				settings.setRegisterBudget(parseInteger(arg, args[++argIdx]));
			} else if (arg.equals("-d") || arg.equals("--depth")) {
				// -d depth : chain depth of the rearranger
				checkParameterHasArgument(args, argIdx);
				settings.setRearrangeDepth(parseInteger(arg, args[++argIdx]));
			} else if (arg.equals("--no-rearrange")) {
				settings.setRearrange(false);
			} else if (arg.equals("--json")) {
				json = true;
			} else if (arg.equals("--dump-ast")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--dump-dag")) {
				dumpDag = true;
			} else if (arg.equals("--example")) {
				expressions.add(EXAMPLE_EXPRESSION);
				example = true;
			} else if (arg.equals("--locale")) {
				// --locale Locale : specify locale
				checkParameterHasArgument(args, argIdx);
				settings.setLocale(Locale.forLanguageTag(args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else if (arg.startsWith("--")) {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			} else {
				// not an option: the expression starts with a unary minus
				break;
			}
			++argIdx;
		}

		if (fromFile && example) {
			throw new IllegalArgumentException("-f and --example cannot be combined.");
		}
		if (!fromFile && !example) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Expression not provided.");
			}
			StringBuilder expression = new StringBuilder(args[argIdx++]);
			// unquoted expressions arrive split on blanks
			while (argIdx < args.length) {
				expression.append(' ').append(args[argIdx++]);
			}
			expressions.add(expression.toString());
		} else if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
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

	private static int parseInteger(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got \"" + value + "\"", e);
		}
	}

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)");

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void addVariable(DagAllocSettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException(
					"keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		String name = m.group(1);
		String valueString = m.group(2);
		double value;
		try {
			value = Double.parseDouble(valueString);
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Value of variable " + name + " is not a number: \"" + valueString + "\"", nfe);
		}
		settings.putVariable(name, value);
	}

	/**
	 * Reads the expressions of a file, one per line, skipping blank lines and
	 * lines starting with <code>#</code>.
	 *
	 * @param fileName the file
	 * @return the expressions
	 */
	static List<String> readExpressions(String fileName) {
		List<String> lines;
		try {
			lines = Files.readAllLines(new File(fileName).toPath(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read expressions '" + fileName + "': " + ex.getMessage(), ex);
		}
		List<String> result = new ArrayList<String>();
		for (String line : lines) {
			String trimmed = line.trim();
			if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
				result.add(trimmed);
			}
		}
		return result;
	}

	/**
	 * Analyzes every expression given on the command line. An expression that
	 * fails does not stop the others: the failure is reported and counted.
	 */
	public void run() {
		failures = 0;
		if (printUsage) {
			usage(out);
			return;
		}
		DagAlloc dagAlloc = new DagAlloc(settings);
		JsonReportWriter jsonWriter = new JsonReportWriter();
		TextReportWriter textWriter = new TextReportWriter();
		boolean first = true;

		for (String expression : expressions) {
			if (!first && !json) {
				out.println();
			}
			first = false;
			try {
				if (dumpSyntaxTree) {
					dagAlloc.parse(expression).dump(out);
				}
				AllocationReport report = dagAlloc.analyze(expression);
				if (dumpDag) {
					out.println("Original DAG:");
					report.getOriginal().getDag().dump(out);
					out.println("Rearranged DAG:");
					report.getRearranged().getDag().dump(out);
				}
				if (dumpSyntaxTree || dumpDag) {
					// dumping only
					continue;
				}
				if (json) {
					jsonWriter.writeReport(report, out);
				} else {
					textWriter.write(report, out);
					printValues(dagAlloc, report);
				}
			} catch (ParserException | RegisterBudgetExceededException e) {
				failures++;
				if (json) {
					jsonWriter.writeFailure(e.getMessage(), out);
				} else {
					err.printf("%s: %s: %s%n", expression, e.getClass().getSimpleName(), e.getMessage());
				}
			}
		}
	}

	/**
	 * Prints the value of the expression, computed by running each half's code
	 * and by direct evaluation, when all its variables are bound.
	 */
	private void printValues(DagAlloc dagAlloc, AllocationReport report) {
		for (DagNode node : report.getOriginal().getDag().getNodes()) {
			if (node.getKind() == NodeKind.VARIABLE && !dagAlloc.getVariables().containsKey(node.getText())) {
				return;
			}
		}
		AllocationResult original = report.getOriginal();
		AllocationResult rearranged = report.getRearranged();
		Locale locale = settings.getLocale();
		out.println(String.format(locale, "Value (original code) = %s", formatValue(locale, dagAlloc.evaluate(original))));
		out.println(String.format(locale, "Value (rearranged code) = %s", formatValue(locale, dagAlloc.evaluate(rearranged))));
		out
				.println(
						String
								.format(
										locale,
										"Value (direct evaluation) = %s",
										formatValue(locale, dagAlloc.evaluate(report.getExpression()))));
	}

	static String formatValue(Locale locale, double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return String.format(locale, "%d", (long) value);
		}
		return String.format(locale, "%.6g", value);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-r budget]" +
								" [-d depth]" +
								" [--no-rearrange]" +
								" [--json]" +
								" [--dump-ast]" +
								" [--dump-dag]" +
								" [--locale locale]" +
								" [-v name=val]..." +
								" [-f filename | --example | expression]");
		dest.println();
		dest.println(" -r budget = Fail when more than budget registers are needed (default: unbounded).");
		dest.println(" -d depth = Flatten + and * chains up to depth levels when rearranging (default: 6).");
		dest.println(" --no-rearrange = Report the original DAG in both halves.");
		dest.println(" --json = Print the reports as JSON.");
		dest.println(" --dump-ast = Print the syntax tree instead of the report.");
		dest.println(" --dump-dag = Print the labeled DAGs instead of the report.");
		dest.println(" --locale Locale = Specify a locale to be used instead of US-English");
		dest.println(" -v name=val = Bind a variable; the generated code is run once all variables are bound.");
		dest.println(" -f filename = Analyze each line of filename (blank lines and # comments are skipped).");
		dest.println(" --example = Analyze " + EXAMPLE_EXPRESSION);
		dest.println(" -- = End of options; an expression starting with a minus sign may also be given directly.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
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

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream
	 * @param os output stream for the reports
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
