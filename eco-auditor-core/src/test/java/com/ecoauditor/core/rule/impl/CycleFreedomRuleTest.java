package com.ecoauditor.core.rule.impl;

import com.ecoauditor.core.model.EdgeType;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Severity;
import com.ecoauditor.core.model.Status;
import com.ecoauditor.core.rule.AuditContext;
import com.ecoauditor.core.rule.RuleResult;
import com.ecoauditor.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CycleFreedomRuleTest extends RuleTestBase {

    private final CycleFreedomRule rule = new CycleFreedomRule();

    @Test
    void evaluate_directCycle_reportsSingleBlockingFinding() {
        // Given
        AuditContext context = contextFor(
            validRecord("A").dependsOn("B").build(),
            validRecord("B").dependsOn("C").build(),
            validRecord("C").dependsOn("A").build()
        );

        // When
        RuleResult result = rule.evaluate(context);

        // Then
        assertThat(result.findings()).singleElement()
            .satisfies(finding -> {
                assertThat(finding.severity()).isEqualTo(Severity.BLOCKING);
                assertThat(finding.subject()).isEqualTo("A, B, C");
                assertThat(finding.message()).isEqualTo("Direct dependency cycle: A -> B -> C -> A");
            });
    }

    @Test
    void evaluate_overlappingDirectCycles_reportsOneBlockingFindingPerMemberSet() {
        // Given
        AuditContext context = contextFor(
            validRecord("Z").dependsOn("B", "C").build(),
            validRecord("B").dependsOn("C").build(),
            validRecord("C").dependsOn("Z").build()
        );

        // When
        RuleResult result = rule.evaluate(context);

        // Then
        assertThat(findings(result, Severity.BLOCKING))
            .extracting(Finding::subject)
            .containsExactlyInAnyOrder("B, C, Z", "C, Z");
    }

    @Test
    void evaluate_sameLoopOverConceptualEdges_isNotBlocking() {
        // Given
        AuditContext context = contextFor(
            validRecord("A").dependsOn("B", EdgeType.CONCEPTUAL).build(),
            validRecord("B").dependsOn("C", EdgeType.CONCEPTUAL).build(),
            validRecord("C").dependsOn("A", EdgeType.CONCEPTUAL).build()
        );

        // When
        RuleResult result = rule.evaluate(context);

        // Then
        assertThat(findings(result, Severity.BLOCKING)).isEmpty();
        assertThat(findings(result, Severity.WARNING)).singleElement()
            .satisfies(finding -> assertThat(finding.message()).startsWith("Non-direct dependency cycle"));
    }

    @Test
    void evaluate_mixedCycle_isWarning() {
        // Given
        AuditContext context = contextFor(
            validRecord("A").dependsOn("B").build(),
            validRecord("B").dependsOn("A", EdgeType.TEST).build()
        );

        // When
        RuleResult result = rule.evaluate(context);

        // Then
        assertThat(result.findings()).singleElement()
            .satisfies(finding -> assertThat(finding.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void evaluate_directCycleThroughDeprecatedRepository_isDowngradedToWarning() {
        // Given
        AuditContext context = contextFor(
            validRecord("legacy").status(Status.DEPRECATED).dependsOn("core").build(),
            validRecord("core").dependsOn("legacy").build()
        );

        // When
        RuleResult result = rule.evaluate(context);

        // Then
        assertThat(result.findings()).singleElement()
            .satisfies(finding -> {
                assertThat(finding.severity()).isEqualTo(Severity.WARNING);
                assertThat(finding.message()).contains("through deprecated legacy");
            });
    }

    @Test
    void evaluate_acyclicGraph_producesNoFindings() {
        // Given
        AuditContext context = contextFor(
            validRecord("core").build(),
            validRecord("gate").dependsOn("core").build(),
            validRecord("studio").dependsOn("gate", "core").build()
        );

        // When
        RuleResult result = rule.evaluate(context);

        // Then
        assertThat(result.findings()).isEmpty();
    }
}
