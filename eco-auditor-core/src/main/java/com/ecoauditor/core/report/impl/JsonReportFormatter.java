package com.ecoauditor.core.report.impl;

import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Severity;
import com.ecoauditor.core.report.AuditReport;
import com.ecoauditor.core.report.ReportFormatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Machine-readable report.
 *
 * <p><b>Shape:</b>
 * <pre>{@code
 * {
 *   "passed" : false,
 *   "complete" : true,
 *   "status" : "FAIL",
 *   "summary" : { "blocking" : 1, "warning" : 0, "info" : 0 },
 *   "rules" : [ "completeness", ... ],
 *   "findings" : {
 *     "blocking" : [ { "category" : "metadata", "subject" : "mirror-gate", "message" : "...", "remediation" : "..." } ],
 *     "warning" : [ ],
 *     "info" : [ ]
 *   }
 * }
 * }</pre>
 * Keys keep this order and lines end with {@code \n} on every platform.
 */
public class JsonReportFormatter implements ReportFormatter {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer;

    public JsonReportFormatter() {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n"));
        this.writer = mapper.writer(printer);
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String format(AuditReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("passed", report.passed());
        root.put("complete", report.complete());
        root.put("status", report.status());

        ObjectNode summary = root.putObject("summary");
        report.summary().forEach((severity, count) -> summary.put(severity.wireName(), count));

        ArrayNode rules = root.putArray("rules");
        report.rules().forEach(rules::add);

        ObjectNode findings = root.putObject("findings");
        for (Severity severity : Severity.values()) {
            ArrayNode group = findings.putArray(severity.wireName());
            for (Finding finding : report.findings(severity)) {
                ObjectNode node = group.addObject();
                node.put("category", finding.category().wireName());
                node.put("subject", finding.subject());
                node.put("message", finding.message());
                finding.remediationHint().ifPresent(hint -> node.put("remediation", hint));
            }
        }

        try {
            return writer.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit report", e);
        }
    }
}
