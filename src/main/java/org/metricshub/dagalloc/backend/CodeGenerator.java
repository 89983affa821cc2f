package org.metricshub.dagalloc.backend;

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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.dagalloc.RegisterBudgetExceededException;
import org.metricshub.dagalloc.dag.Dag;
import org.metricshub.dagalloc.dag.DagNode;
import org.metricshub.dagalloc.dag.NodeKind;
import org.metricshub.dagalloc.dag.SethiUllmanLabeler;
import org.metricshub.dagalloc.intermediate.Instruction;
import org.metricshub.dagalloc.intermediate.Operand;
import org.metricshub.dagalloc.util.DagAllocLogger;
import org.slf4j.Logger;

/**
 * Walks a labeled {@link Dag} from its root and emits one three-address
 * instruction per operation node, allocating and releasing virtual registers.
 * <p>
 * Evaluation order: at every node the operand with the larger cost is evaluated
 * first (left first on ties), which is the order the Sethi-Ullman label assumes.
 * An operation node is evaluated once; later uses read its register.
 * <p>
 * Register decisions for an instruction:
 * <ul>
 * <li>a leaf in the leftmost (or sole) slot must be resident, so the
 * destination register is taken before any operand is released and the leaf
 * is loaded into it as part of the instruction;
 * <li>otherwise, operands whose last use this is are released first and the
 * lowest free register becomes the destination;
 * <li>a leaf in the right slot is read straight from memory.
 * </ul>
 * The generator assigns {@link DagNode#setRegister registers} on the DAG it is
 * given, so a DAG must not be handed to two runs at the same time.
 */
public class CodeGenerator {

	private static final Logger LOG = DagAllocLogger.getLogger(CodeGenerator.class);

	/**
	 * Generates code with an unbounded register supply.
	 *
	 * @param dag a labeled DAG
	 * @return the code
	 */
	public GeneratedCode generate(Dag dag) {
		return generate(dag, RegisterPool.UNBOUNDED);
	}

	/**
	 * Generates code with at most <code>budget</code> registers.
	 *
	 * @param dag a labeled DAG
	 * @param budget register budget, or {@link RegisterPool#UNBOUNDED}
	 * @return the code
	 * @throws RegisterBudgetExceededException when the budget is too small
	 */
	public GeneratedCode generate(Dag dag, int budget) {
		int minRegisters = dag.getRootLabel();
		if (budget != RegisterPool.UNBOUNDED && minRegisters > budget) {
			throw new RegisterBudgetExceededException(budget, minRegisters);
		}
		for (DagNode node : dag.getNodes()) {
			node.setRegister(null);
		}

		AllocationState state = new AllocationState(dag, budget);
		int root = dag.getRoot();
		evaluate(state, dag, root);

		DagNode rootNode = dag.get(root);
		if (rootNode.isLeaf()) {
			state.code.setResult(leafOperand(rootNode));
		} else {
			state.code.setResult(Operand.register(state.registers[root]));
			state.liveRanges.add(new LiveRange(root, state.registers[root], state.definedAt[root], state.code.size() - 1));
		}
		state.liveRanges.sort(Comparator.comparingInt(LiveRange::getStart));

		LOG.debug(
				"Generated {} instructions, label {}, {} register(s) used",
				state.code.size(),
				minRegisters,
				state.pool.getPeak());
		return new GeneratedCode(state.code, minRegisters, state.pool.getPeak(), state.liveRanges);
	}

	private void evaluate(AllocationState state, Dag dag, int id) {
		DagNode node = dag.get(id);
		if (node.isLeaf() || state.computed[id]) {
			return;
		}
		if (node.getOperandCount() == 2) {
			int leftCost = SethiUllmanLabeler.cost(dag, node.getOperand(0), 0);
			int rightCost = SethiUllmanLabeler.cost(dag, node.getOperand(1), 1);
			if (rightCost > leftCost) {
				evaluate(state, dag, node.getOperand(1));
				evaluate(state, dag, node.getOperand(0));
			} else {
				evaluate(state, dag, node.getOperand(0));
				evaluate(state, dag, node.getOperand(1));
			}
		} else {
			evaluate(state, dag, node.getOperand(0));
		}
		emit(state, dag, node);
	}

	private void emit(AllocationState state, Dag dag, DagNode node) {
		int index = state.code.size();
		List<String> actions = new ArrayList<String>();
		Operand[] operands = new Operand[node.getOperandCount()];

		String destination = null;
		DagNode first = dag.get(node.getOperand(0));
		if (first.isLeaf()) {
			destination = state.pool.allocate();
			actions.add("load " + first.getText() + " into " + destination);
		}

		// how many times each operand node is used by this instruction
		Map<Integer, Integer> uses = new LinkedHashMap<Integer, Integer>();
		for (int position = 0; position < operands.length; position++) {
			DagNode operand = dag.get(node.getOperand(position));
			if (operand.isLeaf()) {
				operands[position] = leafOperand(operand);
				if (position > 0) {
					actions.add("read " + operand.getText() + " from memory");
				}
			} else {
				operands[position] = Operand.register(state.registers[operand.getId()]);
			}
			uses.merge(operand.getId(), 1, Integer::sum);
		}

		for (Map.Entry<Integer, Integer> entry : uses.entrySet()) {
			int operandId = entry.getKey();
			state.remainingUses[operandId] -= entry.getValue();
			if (dag.get(operandId).isLeaf()) {
				continue;
			}
			String register = state.registers[operandId];
			if (state.remainingUses[operandId] == 0) {
				state.pool.release(register);
				state.liveRanges.add(new LiveRange(operandId, register, state.definedAt[operandId], index));
				actions.add("free " + register);
			} else {
				actions.add("keep " + register + " live (" + state.remainingUses[operandId] + " more use(s))");
			}
		}

		if (destination == null) {
			destination = state.pool.allocate();
			boolean reused = actions.contains("free " + destination);
			actions.add((reused ? "reuse " : "allocate ") + destination + " for the result");
		}

		state.registers[node.getId()] = destination;
		state.computed[node.getId()] = true;
		state.definedAt[node.getId()] = index;
		node.setRegister(destination);

		Instruction instruction = new Instruction(
				destination,
				node.getOpcode(),
				operands[0],
				operands.length > 1 ? operands[1] : null,
				node.getId());
		String step = "Compute "
				+ dag.toExpressionString(node.getId())
				+ " into "
				+ destination
				+ ": "
				+ String.join(", ", actions);
		state.code.add(instruction, step);
	}

	private static Operand leafOperand(DagNode leaf) {
		return leaf.getKind() == NodeKind.CONSTANT ? Operand.constant(leaf.getText()) : Operand.variable(leaf.getText());
	}
}
