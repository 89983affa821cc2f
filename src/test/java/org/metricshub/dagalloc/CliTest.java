package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import org.junit.Test;

public class CliTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private Cli run(String... args) {
		return Cli
				.create(
						args,
						new ByteArrayInputStream(new byte[0]),
						new PrintStream(out, true, StandardCharsets.UTF_8),
						new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String output() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String errors() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testUsage() {
		run("-h");
		assertTrue(output().startsWith("Usage:"));
	}

	@Test
	public void testNoArgumentPrintsUsage() {
		run();
		assertTrue(output().contains("--no-rearrange"));
	}

	@Test
	public void testTextReport() {
		Cli cli = run("a + b * (c + d) - e");
		assertEquals(0, cli.getFailures());
		String output = output();
		assertTrue(output, output.contains("Original: 2 register(s) needed"));
		assertTrue(output, output.contains("Rearranged: 1 register(s) needed"));
		assertTrue(output, output.contains("R1 = c + d"));
		assertTrue(output, output.contains("Rearranging saves 1 register(s)"));
		assertFalse(output, output.contains("Value"));
	}

	@Test
	public void testExpressionSplitOverArguments() {
		Cli cli = run("--json", "a", "+", "b");
		assertEquals(Arrays.asList("a + b"), cli.getExpressions());
		assertTrue(output().contains("\"success\": true"));
	}

	@Test
	public void testJsonExample() {
		run("--json", "--example");
		String output = output();
		assertTrue(output, output.contains("\"expression\": \"" + Cli.EXAMPLE_EXPRESSION + "\""));
		assertTrue(output, output.contains("\"three_address_code\""));
		assertTrue(output, output.contains("\"min_registers\": 2"));
	}

	@Test
	public void testParseFailure() {
		Cli cli = run("--json", "a + (b");
		assertEquals(1, cli.getFailures());
		String output = output();
		assertTrue(output, output.contains("\"success\": false"));
		assertTrue(output, output.contains("at position 6"));

		out.reset();
		cli = run("a +");
		assertEquals(1, cli.getFailures());
		assertEquals("", output());
		assertTrue(errors(), errors().contains("ParserException"));
	}

	@Test
	public void testBudget() {
		Cli cli = run("--json", "-r", "1", "(a + b) * (c + d)");
		assertEquals(1, cli.getFailures());
		assertTrue(output().contains("Register budget exceeded"));
		assertEquals(1, cli.getSettings().getRegisterBudget());
	}

	@Test
	public void testValues() {
		run("-v", "a=3", "-v", "b=4", "-v", "c=0.5", "a * b + c");
		String output = output();
		assertTrue(output, output.contains("Value (original code) = 12.5000"));
		assertTrue(output, output.contains("Value (rearranged code) = 12.5000"));
		assertTrue(output, output.contains("Value (direct evaluation) = 12.5000"));
	}

	@Test
	public void testIntegralValue() {
		assertEquals("7", Cli.formatValue(Locale.US, 7.0));
		assertEquals("-2", Cli.formatValue(Locale.US, -2.0));
		assertEquals("0.250000", Cli.formatValue(Locale.US, 0.25));
	}

	@Test
	public void testExpressionFile() throws IOException {
		Path file = Files.createTempFile("dagalloc", ".txt");
		try {
			Files
					.write(
							file,
							Arrays.asList("# two expressions and an error", "a + b", "", "(a + b) * (a + b)", "a +"),
							StandardCharsets.UTF_8);
			Cli cli = run("--json", "-f", file.toString());
			assertEquals(Arrays.asList("a + b", "(a + b) * (a + b)", "a +"), cli.getExpressions());
			assertEquals(1, cli.getFailures());
			String output = output();
			assertTrue(output, output.contains("\"expression\": \"a + b\""));
			assertTrue(output, output.contains("\"expression\": \"(a + b) * (a + b)\""));
			assertTrue(output, output.contains("\"success\": false"));
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void testDumps() {
		run("--dump-ast", "--dump-dag", "a - b");
		String output = output();
		assertTrue(output, output.contains("Binary -"));
		assertTrue(output, output.contains("Original DAG:"));
		assertTrue(output, output.contains("Rearranged DAG:"));
		assertFalse(output, output.contains("register(s) needed"));
	}

	@Test
	public void testNoRearrangeAndDepth() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "--no-rearrange", "-d", "3", "a" });
		assertFalse(cli.getSettings().isRearrange());
		assertEquals(3, cli.getSettings().getRearrangeDepth());
	}

	@Test
	public void testNegativeExpression() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "-2", "*", "a" });
		assertEquals(Arrays.asList("-2 * a"), cli.getExpressions());
	}

	@Test
	public void testExpressionStartingWithUnaryMinus() {
		Cli cli = run("-(a + b) * c");
		assertEquals(Arrays.asList("-(a + b) * c"), cli.getExpressions());
		assertEquals(0, cli.getFailures());
		String output = output();
		assertTrue(output, output.contains("Original: 1 register(s) needed"));
		assertTrue(output, output.contains("R1 = -R1"));

		cli = Cli.parseCommandLineArguments(new String[] { "-r", "2", "-a", "*", "b" });
		assertEquals(2, cli.getSettings().getRegisterBudget());
		assertEquals(Arrays.asList("-a * b"), cli.getExpressions());

		cli = Cli.parseCommandLineArguments(new String[] { "--", "-v" });
		assertEquals(Arrays.asList("-v"), cli.getExpressions());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-r" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-r", "x", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-r", "-1", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-d", "0", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-v", "a", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-v", "a=x", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--bogus", "a" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--json" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-h", "a" }));
		assertThrows(
				IllegalArgumentException.class,
				() -> Cli.parseCommandLineArguments(new String[] { "-f", "/nonexistent/dagalloc/file" }));
	}
}
