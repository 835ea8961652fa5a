package com.ecoauditor.core.report.impl;

import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.report.AuditReport;
import com.ecoauditor.core.report.ReportBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportFormatterTest {

    private final JsonReportFormatter formatter = new JsonReportFormatter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void format_writesSummaryAndGroupedFindings() throws Exception {
        // Given
        AuditReport report = new ReportBuilder()
            .addFinding(Finding.blocking(Category.DEPENDENCY, "gate", "Unresolved dependency 'x' (direct)")
                .withRemediation("Add 'x' to the index or remove it from the dependencies"))
            .addFinding(Finding.info(Category.STALENESS, "old", "No update for 120 days"))
            .build();

        // When
        JsonNode json = mapper.readTree(formatter.format(report));

        // Then
        assertThat(json.get("passed").asBoolean()).isFalse();
        assertThat(json.get("complete").asBoolean()).isTrue();
        assertThat(json.get("status").asText()).isEqualTo("FAIL");
        assertThat(json.at("/summary/blocking").asInt()).isEqualTo(1);
        assertThat(json.at("/summary/warning").asInt()).isZero();
        assertThat(json.at("/findings/blocking/0/subject").asText()).isEqualTo("gate");
        assertThat(json.at("/findings/blocking/0/category").asText()).isEqualTo("dependency");
        assertThat(json.at("/findings/blocking/0/remediation").asText()).startsWith("Add 'x'");
        assertThat(json.at("/findings/info/0").has("remediation")).isFalse();
        assertThat(json.at("/findings/warning").isArray()).isTrue();
    }

    @Test
    void format_sameFindingsInAnyOrder_isByteIdentical() {
        // Given
        Finding a = Finding.warning(Category.LINK, "core", "Dead link https://a (HTTP 404)");
        Finding b = Finding.warning(Category.LINK, "gate", "Dead link https://b (timeout)");
        Finding c = Finding.blocking(Category.METADATA, "gate", "Invalid layer 'x'");

        // When
        String first = formatter.format(new ReportBuilder().addFindings(List.of(a, b, c)).build());
        String second = formatter.format(new ReportBuilder().addFindings(List.of(c, b, a)).build());

        // Then
        assertThat(first).isEqualTo(second).endsWith("\n");
    }
}
