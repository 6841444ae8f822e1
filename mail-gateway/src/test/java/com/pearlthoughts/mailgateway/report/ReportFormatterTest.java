package com.pearlthoughts.mailgateway.report;

import com.pearlthoughts.mailgateway.model.ReportData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportFormatterTest {

    private ReportFormatter formatter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC);
        formatter = new ReportFormatter(clock);
    }

    @Test
    void testFormat_HeaderAndFooter() {
        String html = formatter.format("Backup", "prod-cluster", Map.of(), null);

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<h1>Backup Report</h1>"));
        assertTrue(html.contains("Cluster: prod-cluster"));
        assertTrue(html.contains("Generated: 2026-10-19 08:30:00 Z"));
        assertTrue(html.contains("This is an automated report from prod-cluster"));
    }

    @Test
    void testFormat_MetricsInIterationOrder() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("CPU", "72%");
        metrics.put("Memory", "8 GB");
        metrics.put("Nodes", 3);

        String html = formatter.format("Health", "c1", metrics, null);

        int cpu = html.indexOf("<div class=\"metric-name\">CPU</div>");
        int memory = html.indexOf("<div class=\"metric-name\">Memory</div>");
        int nodes = html.indexOf("<div class=\"metric-name\">Nodes</div>");
        assertTrue(cpu > 0 && cpu < memory && memory < nodes);
        assertTrue(html.contains("<div class=\"metric-value\">72%</div>"));
        assertTrue(html.contains("<div class=\"metric-value\">3</div>"));
    }

    @Test
    void testFormat_NoDetailsSectionWhenEmpty() {
        assertFalse(formatter.format("Health", "c1", Map.of("a", "b"), List.of()).contains("<table>"));
        assertFalse(formatter.format("Health", "c1", Map.of("a", "b"), null).contains("<h2>Details</h2>"));
    }

    @Test
    void testFormat_DetailsTable() {
        Map<String, Object> row1 = new LinkedHashMap<>();
        row1.put("node", "n1");
        row1.put("status", "up");
        Map<String, Object> row2 = new LinkedHashMap<>();
        row2.put("node", "n2");
        row2.put("status", "down");

        String html = formatter.format("Health", "c1", Map.of(), List.of(row1, row2));

        assertTrue(html.contains("<tr><th>node</th><th>status</th></tr>"));
        assertTrue(html.contains("<tr><td>n1</td><td>up</td></tr>"));
        assertTrue(html.contains("<tr><td>n2</td><td>down</td></tr>"));
    }

    @Test
    void testFormat_HeterogeneousRowsKeepEveryRow() {
        Map<String, Object> row1 = new LinkedHashMap<>();
        row1.put("node", "n1");
        row1.put("status", "up");
        Map<String, Object> row2 = new LinkedHashMap<>();
        row2.put("host", "h2");
        row2.put("latency", "12ms");
        row2.put("zone", "eu-1");
        Map<String, Object> row3 = new LinkedHashMap<>();
        row3.put("node", "n3");

        String html = formatter.format("Health", "c1", Map.of(), List.of(row1, row2, row3));

        assertEquals(2, count(html, "<th>"));
        assertEquals(4, count(html, "<tr>"));
        assertTrue(html.contains("<tr><td>h2</td><td>12ms</td><td>eu-1</td></tr>"));
        assertTrue(html.contains("<tr><td>n3</td></tr>"));
    }

    @Test
    void testFormat_ValuesEmbeddedVerbatim() {
        String html = formatter.format("Health", "c1", Map.of("note", "<b>bold</b>"), null);

        assertTrue(html.contains("<div class=\"metric-value\"><b>bold</b></div>"));
    }

    @Test
    void testFormat_FromReportData() {
        ReportData data = new ReportData(Map.of("Uptime", "99.9%"), null, null);

        String html = formatter.format("SLA", "edge", data);

        assertTrue(html.contains("<div class=\"metric-name\">Uptime</div>"));
        assertTrue(html.contains("<h1>SLA Report</h1>"));
    }

    @Test
    void testFormat_IsDeterministicForFixedClock() {
        Map<String, Object> metrics = Map.of("a", "1");
        assertEquals(formatter.format("T", "c", metrics, null), formatter.format("T", "c", metrics, null));
    }

    private static int count(String text, String token) {
        Matcher matcher = Pattern.compile(Pattern.quote(token)).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
