package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.dagalloc.backend.CodeGenerator;
import org.metricshub.dagalloc.backend.GeneratedCode;
import org.metricshub.dagalloc.backend.RegisterMachine;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagBuilder;
import org.metricshub.dagalloc.dag.DagNode;
import org.metricshub.dagalloc.dag.SethiUllmanLabeler;
import org.metricshub.dagalloc.frontend.ExpressionParser;
import org.metricshub.dagalloc.intermediate.Opcode;
import org.metricshub.dagalloc.optimizer.Rearranger;

public class RearrangerTest {

	private static final String[] EXPRESSIONS = {
			"a + b * (c + d) - e",
			"a + b + c + d + e * f",
			"a * (b * (c * (d + e)))",
			"(a + b) - (b + a * (a + b))",
			"(a + b) * (a + b) + c",
			"a - b * c",
			"(a + b) * (c + d) - (e + f) * (g + h)",
			"a / (b + c * (d - e))",
			"-(a + (b + (c + d)))",
			"x ^ (y + z * w)",
			"a + (b + (c + (d + (e + (f + (g + h))))))" };

	private static Dag labeled(String expression) {
		return new SethiUllmanLabeler().label(DagBuilder.build(new ExpressionParser().parse(expression)));
	}

	@Test
	public void testCommutingSavesARegister() {
		Dag original = labeled("a + b * (c + d) - e");
		Dag rearranged = new Rearranger().rearrange(original);
		assertEquals(2, original.getRootLabel());
		assertEquals(1, rearranged.getRootLabel());

		GeneratedCode code = new CodeGenerator().generate(rearranged);
		assertEquals(4, code.getCode().size());
		assertEquals(1, code.getRegistersUsed());
		assertEquals(Opcode.SUB, rearranged.getRootNode().getOpcode());
	}

	@Test
	public void testRegroupingLongChain() {
		Dag original = labeled("a + b + c + d + e * f");
		assertEquals(2, original.getRootLabel());
		Dag rearranged = new Rearranger().rearrange(original);
		assertEquals(1, rearranged.getRootLabel());
		assertEquals(original.getOperationCount(), rearranged.getOperationCount());
	}

	@Test
	public void testRightDeepChainBecomesCheaper() {
		Dag original = labeled("a + (b + (c + (d + (e + (f + (g + h))))))");
		assertEquals(2, original.getRootLabel());
		assertEquals(1, new Rearranger().rearrange(original).getRootLabel());
	}

	@Test
	public void testNeverWorse() {
		for (String expression : EXPRESSIONS) {
			Dag original = labeled(expression);
			Dag rearranged = new Rearranger().rearrange(original);
			assertTrue(expression, rearranged.getRootLabel() <= original.getRootLabel());
		}
	}

	@Test
	public void testInputIsUntouched() {
		Dag original = labeled("a + b * (c + d) - e");
		String before = original.toString();
		new Rearranger().rearrange(original);
		assertEquals(before, original.toString());
		assertEquals(2, original.getRootLabel());
	}

	@Test
	public void testNoGainKeepsACopy() {
		Dag original = labeled("a - b * c");
		Dag rearranged = new Rearranger().rearrange(original);
		assertNotSame(original, rearranged);
		assertEquals(original.toString(), rearranged.toString());
		assertEquals(2, rearranged.getRootLabel());
	}

	@Test
	public void testIdempotent() {
		for (String expression : EXPRESSIONS) {
			Dag once = new Rearranger().rearrange(labeled(expression));
			Dag twice = new Rearranger().rearrange(once);
			assertEquals(expression, once.getRootLabel(), twice.getRootLabel());
			assertEquals(expression, once.getOperationCount(), twice.getOperationCount());
		}
	}

	@Test
	public void testSharedSubexpressionStaysShared() {
		Dag rearranged = new Rearranger().rearrange(labeled("(a + b) * c + (a + b) * d"));
		int sums = 0;
		for (DagNode node : rearranged.getNodes()) {
			if (node.getOpcode() == Opcode.ADD && rearranged.get(node.getOperand(0)).isLeaf()
					&& rearranged.get(node.getOperand(1)).isLeaf()) {
				sums++;
				assertEquals(2, node.getParentCount());
			}
		}
		assertEquals(1, sums);
	}

	@Test
	public void testSubtractionIsNotReordered() {
		Dag rearranged = new Rearranger().rearrange(labeled("(a + b * c) - d / (e - f)"));
		DagNode root = rearranged.getRootNode();
		assertEquals(Opcode.SUB, root.getOpcode());
		assertEquals(Opcode.ADD, rearranged.get(root.getOperand(0)).getOpcode());
		assertEquals(Opcode.DIV, rearranged.get(root.getOperand(1)).getOpcode());
	}

	@Test
	public void testSameValue() {
		double[][] assignments = { { 1, 2, 3, 4 }, { -3, 5, 7, 2 }, { 8, -1, 4, 6 } };
		for (String expression : EXPRESSIONS) {
			Dag original = labeled(expression);
			Dag rearranged = new Rearranger().rearrange(original);
			GeneratedCode originalCode = new CodeGenerator().generate(original);
			GeneratedCode rearrangedCode = new CodeGenerator().generate(rearranged);
			for (double[] values : assignments) {
				Map<String, Double> variables = bind(values);
				double expected = ExpressionEvaluator.eval(expression, variables);
				assertEquals(expression, expected, new RegisterMachine(variables).execute(originalCode.getCode()), 1e-6);
				assertEquals(expression, expected, new RegisterMachine(variables).execute(rearrangedCode.getCode()), 1e-6);
			}
		}
	}

	@Test
	public void testDepthIsValidated() {
		assertThrows(IllegalArgumentException.class, () -> new Rearranger(0));
		Dag original = labeled("a + b + c + d + e * f");
		assertTrue(new Rearranger(1).rearrange(original).getRootLabel() <= original.getRootLabel());
	}

	private static Map<String, Double> bind(double[] values) {
		Map<String, Double> variables = new HashMap<String, Double>();
		String[] names = { "a", "b", "c", "d", "e", "f", "g", "h", "w", "x", "y", "z" };
		for (int i = 0; i < names.length; i++) {
			// small integers keep reassociated sums and products exact
			variables.put(names[i], values[i % values.length] + i / values.length);
		}
		return variables;
	}
}
