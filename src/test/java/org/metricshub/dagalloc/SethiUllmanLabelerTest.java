package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import java.util.Random;
import org.junit.Test;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagBuilder;
import org.metricshub.dagalloc.dag.SethiUllmanLabeler;
import org.metricshub.dagalloc.frontend.ExpressionNode;
import org.metricshub.dagalloc.frontend.ExpressionParser;

public class SethiUllmanLabelerTest {

	private static int label(String expression) {
		return labeled(expression).getRootLabel();
	}

	private static Dag labeled(String expression) {
		Dag dag = DagBuilder.build(new ExpressionParser().parse(expression));
		return new SethiUllmanLabeler().label(dag);
	}

	@Test
	public void testSimpleLabels() {
		assertEquals(1, label("a"));
		assertEquals(1, label("a + b"));
		assertEquals(1, label("a + b + c"));
		assertEquals(2, label("a + (b + c)"));
		assertEquals(2, label("(a + b) * (c + d)"));
		assertEquals(3, label("(a + b) * (c + d) - (e + f) * (g + h)"));
	}

	@Test
	public void testMixedExpression() {
		assertEquals(2, label("a + b * (c + d) - e"));
	}

	@Test
	public void testUnaryTakesItsOperandCost() {
		assertEquals(1, label("-a"));
		assertEquals(2, label("-((a + b) * (c + d))"));
		assertEquals(2, label("a + -b"));
	}

	@Test
	public void testSharedNodeLabeledOnce() {
		Dag dag = labeled("(a + b) * (a + b)");
		assertEquals(1, dag.get(dag.getRootNode().getOperand(0)).getLabel());
		assertEquals(2, dag.getRootLabel());
	}

	@Test
	public void testLeafLabelsFollowFirstParent() {
		Dag dag = labeled("a - b");
		assertEquals(1, dag.get(0).getLabel());
		assertEquals(0, dag.get(1).getLabel());
	}

	@Test
	public void testCombine() {
		assertEquals(2, SethiUllmanLabeler.combine(1, 1));
		assertEquals(2, SethiUllmanLabeler.combine(2, 1));
		assertEquals(3, SethiUllmanLabeler.combine(1, 3));
		assertEquals(1, SethiUllmanLabeler.combine(1, 0));
	}

	@Test
	public void testLabelMatchesExhaustiveSearch() {
		Random random = new Random(20251017L);
		for (int i = 0; i < 500; i++) {
			int leaves = 1 + random.nextInt(6);
			String expression = randomTree(random, leaves, new int[] { 0 });
			ExpressionNode tree = new ExpressionParser().parse(expression);
			int expected = tree instanceof ExpressionNode.Leaf ? 1 : bruteForce(tree);
			assertEquals(expression, expected, label(expression));
		}
	}

	/**
	 * Random expression with distinct variables, so that no operation node is
	 * shared.
	 */
	private static String randomTree(Random random, int leaves, int[] next) {
		if (leaves == 1) {
			String leaf = "v" + next[0]++;
			return random.nextInt(5) == 0 ? "(-" + leaf + ")" : leaf;
		}
		int left = 1 + random.nextInt(leaves - 1);
		String[] operators = { "+", "-", "*", "/" };
		String result = "("
				+ randomTree(random, left, next)
				+ " "
				+ operators[random.nextInt(operators.length)]
				+ " "
				+ randomTree(random, leaves - left, next)
				+ ")";
		return random.nextInt(6) == 0 ? "(-" + result + ")" : result;
	}

	/**
	 * Peak register count over the best evaluation order, found by trying
	 * both orders at every node. A leaf in the leftmost slot is loaded into
	 * the destination when the instruction runs; a leaf in the right slot is
	 * read from memory.
	 */
	private static int bruteForce(ExpressionNode node) {
		if (node instanceof ExpressionNode.Leaf) {
			return 0;
		}
		if (node instanceof ExpressionNode.Unary) {
			ExpressionNode operand = ((ExpressionNode.Unary) node).getOperand();
			if (operand instanceof ExpressionNode.Leaf) {
				return 1;
			}
			return Math.max(bruteForce(operand), 1);
		}
		ExpressionNode.Binary binary = (ExpressionNode.Binary) node;
		ExpressionNode left = binary.getLeft();
		ExpressionNode right = binary.getRight();
		int needLeft = bruteForce(left);
		int needRight = bruteForce(right);
		int heldLeft = held(left);
		int heldRight = held(right);

		int emit;
		if (left instanceof ExpressionNode.Leaf) {
			emit = 1 + heldRight;
		} else {
			emit = Math.max(1, heldLeft + heldRight);
		}
		int leftFirst = Math.max(needLeft, heldLeft + needRight);
		int rightFirst = Math.max(needRight, heldRight + needLeft);
		return Math.max(emit, Math.min(leftFirst, rightFirst));
	}

	private static int held(ExpressionNode node) {
		return node instanceof ExpressionNode.Leaf ? 0 : 1;
	}
}
