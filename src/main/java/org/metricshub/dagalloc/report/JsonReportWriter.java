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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.io.PrintStream;

/**
 * Serializes reports, and failures, as JSON.
 * <p>
 * A success carries <code>success</code>, <code>expression</code>,
 * <code>original</code> and <code>rearranged</code>. A failure is
 * <code>{"success": false, "error": "..."}</code>.
 */
public class JsonReportWriter {

	private final Gson gson;

	/**
	 * Writer producing indented JSON.
	 */
	public JsonReportWriter() {
		this(true);
	}

	/**
	 * @param pretty whether to indent the output
	 */
	public JsonReportWriter(boolean pretty) {
		GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
		if (pretty) {
			builder.setPrettyPrinting();
		}
		gson = builder.create();
	}

	/**
	 * @param report a successful analysis
	 * @return its JSON form
	 */
	public String toJson(AllocationReport report) {
		return gson.toJson(report);
	}

	/**
	 * @param message what went wrong
	 * @return the JSON form of a failure
	 */
	public String failureToJson(String message) {
		JsonObject failure = new JsonObject();
		failure.addProperty("success", false);
		failure.addProperty("error", message);
		return gson.toJson(failure);
	}

	/**
	 * Prints the JSON form of a report, followed by a new line.
	 *
	 * @param report a successful analysis
	 * @param out where to print
	 */
	public void writeReport(AllocationReport report, PrintStream out) {
		out.println(toJson(report));
	}

	/**
	 * Prints the JSON form of a failure, followed by a new line.
	 *
	 * @param message what went wrong
	 * @param out where to print
	 */
	public void writeFailure(String message, PrintStream out) {
		out.println(failureToJson(message));
	}
}
