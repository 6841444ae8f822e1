package com.pearlthoughts.mailgateway.report;

import com.pearlthoughts.mailgateway.model.ReportData;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Renders report metrics and detail rows into a self-contained HTML document.
 *
 * <p>Values are embedded as given; callers that need escaping sanitize before calling.
 * The details table takes its header row from the keys of the first row, and every row
 * emits its own values in its own iteration order, so rows with different key sets end
 * up misaligned rather than dropped.
 */
@Component
public class ReportFormatter {

    static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private static final String STYLE =
            "body { font-family: Arial, sans-serif; line-height: 1.6; color: #333; }\n" +
            ".header { background: #4CAF50; color: white; padding: 20px; text-align: center; }\n" +
            ".content { padding: 20px; }\n" +
            ".metric { background: #f4f4f4; padding: 10px; margin: 10px 0; border-left: 4px solid #4CAF50; }\n" +
            ".metric-name { font-weight: bold; color: #555; }\n" +
            ".metric-value { font-size: 1.2em; color: #4CAF50; }\n" +
            "table { width: 100%; border-collapse: collapse; margin: 20px 0; }\n" +
            "th, td { padding: 12px; text-align: left; border-bottom: 1px solid #ddd; }\n" +
            "th { background-color: #4CAF50; color: white; }\n" +
            ".footer { text-align: center; padding: 20px; color: #777; font-size: 0.9em; }\n";

    private final Clock clock;

    public ReportFormatter(Clock clock) {
        this.clock = clock;
    }

    public String format(String reportType, String clusterName, ReportData data) {
        return format(reportType, clusterName,
                data != null ? data.getMetrics() : null,
                data != null ? data.getDetails() : null);
    }

    public String format(String reportType, String clusterName, Map<String, ?> metrics,
                         List<? extends Map<String, ?>> details) {
        StringBuilder html = new StringBuilder(2048);
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<style>\n")
                .append(STYLE)
                .append("</style>\n</head>\n<body>\n");

        appendHeader(html, reportType, clusterName);

        html.append("<div class=\"content\">\n");
        appendMetrics(html, metrics);
        if (details != null && !details.isEmpty()) {
            appendDetails(html, details);
        }
        html.append("</div>\n");

        html.append("<div class=\"footer\">\n")
                .append("  <p>This is an automated report from ").append(clusterName).append("</p>\n")
                .append("</div>\n</body>\n</html>\n");
        return html.toString();
    }

    private void appendHeader(StringBuilder html, String reportType, String clusterName) {
        String generatedAt = GENERATED_AT.format(ZonedDateTime.now(clock));
        html.append("<div class=\"header\">\n")
                .append("  <h1>").append(reportType).append(" Report</h1>\n")
                .append("  <p>Cluster: ").append(clusterName).append("</p>\n")
                .append("  <p>Generated: ").append(generatedAt).append("</p>\n")
                .append("</div>\n");
    }

    private void appendMetrics(StringBuilder html, Map<String, ?> metrics) {
        if (metrics == null) {
            return;
        }
        for (Map.Entry<String, ?> metric : metrics.entrySet()) {
            html.append("<div class=\"metric\">\n")
                    .append("  <div class=\"metric-name\">").append(metric.getKey()).append("</div>\n")
                    .append("  <div class=\"metric-value\">").append(metric.getValue()).append("</div>\n")
                    .append("</div>\n");
        }
    }

    private void appendDetails(StringBuilder html, List<? extends Map<String, ?>> details) {
        html.append("<h2>Details</h2>\n<table>\n<thead>\n<tr>");
        Map<String, ?> first = details.get(0);
        if (first != null) {
            for (String column : first.keySet()) {
                html.append("<th>").append(column).append("</th>");
            }
        }
        html.append("</tr>\n</thead>\n<tbody>\n");

        for (Map<String, ?> row : details) {
            html.append("<tr>");
            if (row != null) {
                for (Object value : row.values()) {
                    html.append("<td>").append(value).append("</td>");
                }
            }
            html.append("</tr>\n");
        }
        html.append("</tbody>\n</table>\n");
    }
}
