package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.dagalloc.backend.CodeGenerator;
import org.metricshub.dagalloc.backend.GeneratedCode;
import org.metricshub.dagalloc.backend.LiveRange;
import org.metricshub.dagalloc.backend.RegisterMachine;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagBuilder;
import org.metricshub.dagalloc.dag.SethiUllmanLabeler;
import org.metricshub.dagalloc.frontend.ExpressionParser;

public class CodeGeneratorTest {

	private static Dag labeled(String expression) {
		return new SethiUllmanLabeler().label(DagBuilder.build(new ExpressionParser().parse(expression)));
	}

	private static GeneratedCode generate(String expression) {
		return new CodeGenerator().generate(labeled(expression));
	}

	@Test
	public void testSingleOperation() {
		GeneratedCode code = generate("a + b");
		assertEquals(Arrays.asList("R1 = a + b"), code.getCode().toStrings());
		assertEquals(1, code.getMinRegisters());
		assertEquals(1, code.getRegistersUsed());
		String step = code.getCode().getSteps().get(0);
		assertTrue(step, step.contains("load a into R1"));
		assertTrue(step, step.contains("read b from memory"));
	}

	@Test
	public void testHeavierOperandFirst() {
		GeneratedCode code = generate("a + b * (c + d) - e");
		assertEquals(
				Arrays.asList("R1 = c + d", "R2 = b * R1", "R1 = a + R2", "R1 = R1 - e"),
				code.getCode().toStrings());
		assertEquals(2, code.getMinRegisters());
		assertEquals(2, code.getRegistersUsed());
	}

	@Test
	public void testSharedNodeComputedOnce() {
		GeneratedCode code = generate("(a + b) * (a + b)");
		assertEquals(Arrays.asList("R1 = a + b", "R1 = R1 * R1"), code.getCode().toStrings());
		assertEquals(2, code.getMinRegisters());
		assertEquals(1, code.getRegistersUsed());
		String step = code.getCode().getSteps().get(1);
		assertTrue(step, step.contains("free R1"));
		assertTrue(step, step.contains("reuse R1"));
	}

	@Test
	public void testSharedNodeKeptLive() {
		GeneratedCode code = generate("(a + b) - c * (a + b)");
		List<String> steps = code.getCode().getSteps();
		assertEquals(3, steps.size());
		assertTrue(steps.get(1), steps.get(1).contains("keep R1 live (1 more use(s))"));
		assertTrue(steps.get(2), steps.get(2).contains("free R1"));
	}

	@Test
	public void testUnaryMinus() {
		GeneratedCode code = generate("-(a * b)");
		assertEquals(Arrays.asList("R1 = a * b", "R1 = -R1"), code.getCode().toStrings());
		code = generate("-a");
		assertEquals(Arrays.asList("R1 = -a"), code.getCode().toStrings());
	}

	@Test
	public void testLeafRoot() {
		GeneratedCode code = generate("x");
		assertTrue(code.getCode().isEmpty());
		assertEquals(1, code.getMinRegisters());
		assertEquals("x", code.getCode().getResult().toString());
		assertTrue(code.getLiveRanges().isEmpty());
	}

	@Test
	public void testOneInstructionAndStepPerOperation() {
		String[] expressions = {
				"a * b + c * d - e / f",
				"(a + b) * (a + b) * (a + b)",
				"x ^ 2 + y ^ 2",
				"-(a - b) * -(c - d)" };
		for (String expression : expressions) {
			Dag dag = labeled(expression);
			GeneratedCode code = new CodeGenerator().generate(dag);
			assertEquals(expression, dag.getOperationCount(), code.getCode().size());
			assertEquals(expression, dag.getOperationCount(), code.getCode().getSteps().size());
		}
	}

	@Test
	public void testBudget() {
		Dag dag = labeled("a + b * (c + d) - e");
		assertEquals(4, new CodeGenerator().generate(dag, 2).getCode().size());

		RegisterBudgetExceededException e = assertThrows(
				RegisterBudgetExceededException.class,
				() -> new CodeGenerator().generate(dag, 1));
		assertEquals(1, e.getBudget());
		assertEquals(2, e.getNeeded());
	}

	@Test
	public void testSharedNodeRaisesPeakAboveLabel() {
		// a + b stays live across the whole product until its second use
		String expression = "(a+b) * (((p+q)*(r+s)) * ((t+u)*(v+w))) + ((e+f)*(g+h)) * (a+b)";
		GeneratedCode code = generate(expression);
		assertEquals(3, code.getMinRegisters());
		assertEquals(4, code.getRegistersUsed());
		assertTrue(code.getCode().toStrings().toString(), code.getCode().toStrings().contains("R4 = g + h"));

		Dag dag = labeled(expression);
		RegisterBudgetExceededException e = assertThrows(
				RegisterBudgetExceededException.class,
				() -> new CodeGenerator().generate(dag, 3));
		assertEquals(3, e.getBudget());
		assertEquals(4, e.getNeeded());

		assertEquals(4, new CodeGenerator().generate(dag, 4).getRegistersUsed());
	}

	@Test
	public void testRegistersAssignedOnNodes() {
		Dag dag = labeled("a * b + c");
		new CodeGenerator().generate(dag);
		assertEquals("R1", dag.getRootNode().getRegister());
		assertNull(dag.get(0).getRegister());
	}

	@Test
	public void testLiveRangesOfOneRegisterDoNotOverlap() {
		GeneratedCode code = generate("(a + b) * (c - d) + (e + f) * (g - h) - (a + b)");
		List<LiveRange> ranges = code.getLiveRanges();
		assertFalse(ranges.isEmpty());
		for (LiveRange first : ranges) {
			assertTrue(first.toString(), first.getStart() <= first.getEnd());
			for (LiveRange second : ranges) {
				if (first != second && first.getRegister().equals(second.getRegister())) {
					assertFalse(first + " overlaps " + second, first.overlaps(second));
				}
			}
		}
	}

	@Test
	public void testGeneratedCodeComputesTheExpression() {
		String expression = "(a + b) * (c - d) / (a + b) + c ^ 2 - -d";
		Dag dag = labeled(expression);
		GeneratedCode code = new CodeGenerator().generate(dag);
		double[][] assignments = { { 1, 2, 3, 4 }, { -5, 7, 0.5, 2 }, { 10, 3, -2, 8 } };
		for (double[] values : assignments) {
			Map<String, Double> variables = new HashMap<String, Double>();
			variables.put("a", values[0]);
			variables.put("b", values[1]);
			variables.put("c", values[2]);
			variables.put("d", values[3]);
			double expected = ExpressionEvaluator.eval(expression, variables);
			assertEquals(expected, new RegisterMachine(variables).execute(code.getCode()), 1e-9);
		}
	}
}
