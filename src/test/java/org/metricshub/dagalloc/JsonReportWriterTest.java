package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;
import org.metricshub.dagalloc.report.AllocationReport;
import org.metricshub.dagalloc.report.JsonReportWriter;

public class JsonReportWriterTest {

	@Test
	public void testReportSchema() {
		AllocationReport report = new DagAlloc().analyze("a + b * (c + d) - e");
		JsonObject json = JsonParser.parseString(new JsonReportWriter().toJson(report)).getAsJsonObject();

		assertTrue(json.get("success").getAsBoolean());
		assertEquals("a + b * (c + d) - e", json.get("expression").getAsString());

		for (String half : new String[] { "original", "rearranged" }) {
			JsonObject result = json.getAsJsonObject(half);
			assertNotNull(half, result);
			JsonObject graph = result.getAsJsonObject("graph");
			assertEquals(9, graph.getAsJsonArray("nodes").size());
			assertEquals(8, graph.getAsJsonArray("edges").size());
			JsonObject node = graph.getAsJsonArray("nodes").get(0).getAsJsonObject();
			assertTrue(node.has("id"));
			assertTrue(node.has("label"));
			assertTrue(node.has("group"));
			JsonObject edge = graph.getAsJsonArray("edges").get(0).getAsJsonObject();
			assertTrue(edge.has("from"));
			assertTrue(edge.has("to"));

			assertEquals(4, result.getAsJsonArray("three_address_code").size());
			assertEquals(4, result.getAsJsonArray("steps").size());
			assertTrue(result.has("min_registers"));
			assertTrue(result.has("registers_used"));
			JsonArray ranges = result.getAsJsonArray("live_ranges");
			assertEquals(4, ranges.size());
			JsonObject range = ranges.get(0).getAsJsonObject();
			assertTrue(range.has("node"));
			assertTrue(range.has("register"));
			assertTrue(range.has("start"));
			assertTrue(range.has("end"));

			// internal objects stay out of the output
			assertFalse(result.has("dag"));
			assertFalse(result.has("code"));
		}
		assertEquals(2, json.getAsJsonObject("original").get("min_registers").getAsInt());
		assertEquals(1, json.getAsJsonObject("rearranged").get("min_registers").getAsInt());
		assertEquals("R1 = c + d", json.getAsJsonObject("original").getAsJsonArray("three_address_code").get(0).getAsString());
	}

	@Test
	public void testOperatorLabelKeepsNewLine() {
		AllocationReport report = new DagAlloc().analyze("a + b");
		JsonObject json = JsonParser.parseString(new JsonReportWriter(false).toJson(report)).getAsJsonObject();
		JsonObject sum = json
				.getAsJsonObject("original")
				.getAsJsonObject("graph")
				.getAsJsonArray("nodes")
				.get(2)
				.getAsJsonObject();
		assertEquals("+\nR1", sum.get("label").getAsString());
		assertEquals("operation", sum.get("group").getAsString());
	}

	@Test
	public void testFailure() {
		String text = new JsonReportWriter().failureToJson("Empty expression at position 0");
		JsonObject json = JsonParser.parseString(text).getAsJsonObject();
		assertFalse(json.get("success").getAsBoolean());
		assertEquals("Empty expression at position 0", json.get("error").getAsString());
		assertEquals(2, json.size());
	}
}
