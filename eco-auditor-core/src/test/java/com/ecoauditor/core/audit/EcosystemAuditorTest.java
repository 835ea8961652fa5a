package com.ecoauditor.core.audit;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.loader.MalformedMetadataException;
import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Severity;
import com.ecoauditor.core.report.AuditReport;
import com.ecoauditor.core.report.impl.JsonReportFormatter;
import com.ecoauditor.core.rule.RuleEngine;
import com.ecoauditor.core.util.CancellationSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end audits of index files.
 */
class EcosystemAuditorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T08:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private EcosystemAuditor auditor;

    @BeforeEach
    void setUp() {
        auditor = new EcosystemAuditor(AuditConfig.defaults(), new RuleEngine(), CLOCK,
            settings -> {
                throw new AssertionError("no link should be probed");
            });
    }

    @Test
    void audit_wellFormedFixture_passesWithoutFindings() throws URISyntaxException {
        // Given
        Path index = Path.of(getClass().getResource("/fixtures/ecosystem-index.json").toURI());

        // When
        AuditReport report = auditor.audit(index, null, CancellationSignal.create());

        // Then
        assertThat(report.findings()).isEmpty();
        assertThat(report.status()).isEqualTo(AuditReport.STATUS_PASS);
        assertThat(report.complete()).isTrue();
        assertThat(report.rules()).contains("completeness", "dependency-validity", "cycle-freedom", "staleness");
    }

    @Test
    void audit_repeatedRuns_produceIdenticalReports() throws IOException {
        // Given
        Path index = writeIndex("""
            {"total_repos": 5, "repos": [
              {"name": "a", "layer": "runtime", "status": "beta", "short_description": "A",
               "dependencies": ["b", "ghost"], "tags": [], "license": "MIT", "spec_version": "1.0"},
              {"name": "b", "layer": "runtime", "status": "beta", "short_description": "B",
               "dependencies": ["a"], "tags": [], "spec_version": "1.0"},
              {"name": "c", "layer": "legacy", "status": "stable", "short_description": "C",
               "dependencies": [], "tags": [], "license": "MIT"}
            ]}
            """);
        JsonReportFormatter formatter = new JsonReportFormatter();

        // When
        String first = formatter.format(auditor.audit(index, null, CancellationSignal.create()));
        String second = formatter.format(auditor.audit(index, null, CancellationSignal.create()));

        // Then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void audit_mergesLoaderAndRuleFindings() throws IOException {
        // Given
        Path index = writeIndex("""
            {"repos": [
              {"name": "a", "layer": "runtime", "status": "beta", "short_description": "A",
               "dependencies": ["b"], "tags": [], "spec_version": "1.0"},
              {"name": "b", "layer": "runtime", "status": "beta", "short_description": "B",
               "dependencies": ["a"], "tags": [], "license": "MIT", "spec_version": "1.0"}
            ]}
            """);

        // When
        AuditReport report = auditor.audit(index, null, CancellationSignal.create());

        // Then
        assertThat(report.passed()).isFalse();
        assertThat(report.findings(Severity.BLOCKING))
            .extracting(Finding::category, Finding::subject)
            .containsExactly(
                tuple(Category.METADATA, "a"),
                tuple(Category.DEPENDENCY, "a, b")
            );
    }

    @Test
    void audit_cancelledBeforeStart_isIncompleteButKeepsLoaderFindings() throws IOException {
        // Given
        Path index = writeIndex("""
            {"repos": [{"name": "a", "layer": "runtime", "status": "beta", "short_description": "A",
               "dependencies": [], "tags": [], "spec_version": "1.0"}]}
            """);
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        // When
        AuditReport report = auditor.audit(index, null, signal);

        // Then
        assertThat(report.complete()).isFalse();
        assertThat(report.rules()).isEmpty();
        assertThat(report.findings()).singleElement()
            .satisfies(finding -> assertThat(finding.message()).isEqualTo("Missing required field: license"));
    }

    @Test
    void audit_malformedIndex_throws() throws IOException {
        // Given
        Path index = writeIndex("{ not json");

        // When / Then
        assertThatThrownBy(() -> auditor.audit(index, null, CancellationSignal.create()))
            .isInstanceOf(MalformedMetadataException.class);
    }

    private Path writeIndex(String content) throws IOException {
        Path index = tempDir.resolve("ecosystem-index.json");
        Files.writeString(index, content);
        return index;
    }
}
