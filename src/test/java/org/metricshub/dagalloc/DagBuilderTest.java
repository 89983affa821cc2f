package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagBuilder;
import org.metricshub.dagalloc.dag.DagNode;
import org.metricshub.dagalloc.dag.NodeKind;
import org.metricshub.dagalloc.frontend.ExpressionParser;
import org.metricshub.dagalloc.intermediate.Opcode;

public class DagBuilderTest {

	private static Dag build(String expression) {
		return DagBuilder.build(new ExpressionParser().parse(expression));
	}

	@Test
	public void testCommonSubexpressionIsShared() {
		Dag dag = build("(a + b) * (a + b)");
		assertEquals(4, dag.size());
		assertEquals(2, dag.getOperationCount());

		DagNode root = dag.getRootNode();
		assertEquals(Opcode.MUL, root.getOpcode());
		assertEquals(root.getOperand(0), root.getOperand(1));

		DagNode sum = dag.get(root.getOperand(0));
		assertEquals(Opcode.ADD, sum.getOpcode());
		assertEquals(2, sum.getParentCount());
		assertEquals(0, root.getParentCount());
	}

	@Test
	public void testCommutativeOperandsShareOneNode() {
		Dag dag = build("(a + b) * (b + a)");
		assertEquals(4, dag.size());
		assertEquals(2, dag.get(dag.getRootNode().getOperand(0)).getParentCount());

		// the first spelling wins
		assertEquals("((a + b) * (a + b))", dag.toString());
	}

	@Test
	public void testNonCommutativeOperandsAreDistinct() {
		Dag dag = build("(a - b) * (b - a)");
		assertEquals(5, dag.size());
		assertEquals(3, dag.getOperationCount());
	}

	@Test
	public void testLeavesAreShared() {
		Dag dag = build("2 * a + 2.0 * a");
		assertEquals(4, dag.size());
		assertEquals(NodeKind.CONSTANT, dag.get(0).getKind());
		assertEquals("2", dag.get(0).getText());
		assertEquals(NodeKind.VARIABLE, dag.get(1).getKind());
	}

	@Test
	public void testArenaOrderIsDependencyOrder() {
		Dag dag = build("a * (b - c) + (b - c) / d");
		for (DagNode node : dag.getNodes()) {
			for (int operand : node.getOperands()) {
				assertTrue(node + " refers to a later node", operand < node.getId());
			}
		}
		assertEquals(dag.size() - 1, dag.getRoot());
	}

	@Test
	public void testUnaryMinus() {
		Dag dag = build("-(a + b)");
		assertEquals(4, dag.size());
		assertEquals(Opcode.NEG, dag.getRootNode().getOpcode());
		assertEquals(1, dag.getRootNode().getOperandCount());

		// a negative literal is a constant, not an operation
		dag = build("-3");
		assertEquals(1, dag.size());
		assertEquals("-3", dag.getRootNode().getText());
	}

	@Test
	public void testSingleLeaf() {
		Dag dag = build("x");
		assertEquals(1, dag.size());
		assertEquals(0, dag.getOperationCount());
		assertTrue(dag.getRootNode().isLeaf());
	}

	@Test
	public void testExplicitConstruction() {
		DagBuilder builder = new DagBuilder();
		int a = builder.variable("a");
		int b = builder.variable("b");
		assertEquals(-1, builder.peek(Opcode.ADD, a, b));
		int sum = builder.operation(Opcode.ADD, a, b);
		assertEquals(sum, builder.peek(Opcode.ADD, b, a));
		assertEquals(-1, builder.peek(Opcode.SUB, b, a));
		assertEquals(a, builder.variable("a"));
		assertEquals(sum, builder.operation(Opcode.ADD, b, a));

		Dag dag = builder.finish(sum);
		assertEquals(3, dag.size());
		assertThrows(IllegalStateException.class, () -> builder.variable("c"));
	}

	@Test
	public void testArityIsChecked() {
		DagBuilder builder = new DagBuilder();
		int a = builder.variable("a");
		assertThrows(IllegalArgumentException.class, () -> builder.operation(Opcode.ADD, a));
		assertThrows(IllegalArgumentException.class, () -> builder.operation(Opcode.NEG, a, a));
	}

	@Test
	public void testCopy() {
		Dag dag = build("(a + b) * (a + b)");
		Dag copy = dag.copy();
		assertNotSame(dag, copy);
		assertEquals(dag.size(), copy.size());
		assertEquals(dag.toString(), copy.toString());
		assertEquals(2, copy.get(copy.getRootNode().getOperand(0)).getParentCount());
	}
}
