package org.metricshub.dagalloc.report;

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

import java.io.PrintStream;
import java.util.List;

/**
 * Human-readable rendering of a report, as printed by the command line.
 */
public class TextReportWriter {

	/**
	 * Prints both halves of the report.
	 *
	 * @param report the report
	 * @param out where to print
	 */
	public void write(AllocationReport report, PrintStream out) {
		out.println("Expression: " + report.getExpression());
		out.println();
		writeHalf("Original", report.getOriginal(), out);
		out.println();
		writeHalf("Rearranged", report.getRearranged(), out);
		out.println();
		if (report.getSavedRegisters() > 0) {
			out.println("Rearranging saves " + report.getSavedRegisters() + " register(s)");
		} else {
			out.println("Rearranging saves no register");
		}
	}

	private void writeHalf(String title, AllocationResult result, PrintStream out) {
		out.println(title + ": " + result.getMinRegisters() + " register(s) needed, "
				+ result.getRegistersUsed() + " used");
		List<String> code = result.getThreeAddressCode();
		List<String> steps = result.getSteps();
		if (code.isEmpty()) {
			out.println("  (no instruction)");
		}
		for (int i = 0; i < code.size(); i++) {
			out.printf("  %3d  %-20s ; %s%n", i, code.get(i), steps.get(i));
		}
	}
}
