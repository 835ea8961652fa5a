package com.ecoauditor.core.config;

import com.ecoauditor.core.config.AuditConfig.RuleSelection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AuditConfigTest {

    @Test
    void defaults_enablesAllRules() {
        AuditConfig config = AuditConfig.defaults();

        assertThat(config.rules().isEnabled("completeness")).isTrue();
        assertThat(config.rules().isEnabled("link-liveness")).isTrue();
        assertThat(config.terminology()).isEmpty();
        assertThat(config.bestEffortHosts()).isEmpty();
    }

    @Test
    void isEnabled_withGroups_selectsOnlyGroupMembers() {
        // Given
        RuleSelection selection = RuleSelection.groups(List.of("graph"));

        // Then
        assertThat(selection.isEnabled("dependency-validity")).isTrue();
        assertThat(selection.isEnabled("cycle-freedom")).isTrue();
        assertThat(selection.isEnabled("completeness")).isFalse();
        assertThat(selection.isEnabled("link-liveness")).isFalse();
    }

    @Test
    void isEnabled_withEnabledIds_selectsOnlyListedRules() {
        // Given
        RuleSelection selection = new RuleSelection(List.of("staleness"), null, null);

        // Then
        assertThat(selection.isEnabled("staleness")).isTrue();
        assertThat(selection.isEnabled("completeness")).isFalse();
    }

    @Test
    void isEnabled_groupsTakePrecedenceOverEnabledIds() {
        // Given
        RuleSelection selection = new RuleSelection(List.of("staleness"), List.of("links"), null);

        // Then
        assertThat(selection.isEnabled("link-liveness")).isTrue();
        assertThat(selection.isEnabled("staleness")).isFalse();
    }

    @Test
    void without_excludesRuleAndKeepsEverythingElse() {
        // Given
        RuleSelection selection = RuleSelection.all().without("link-liveness");

        // Then
        assertThat(selection.isEnabled("link-liveness")).isFalse();
        assertThat(selection.isEnabled("completeness")).isTrue();
        assertThat(selection.isEnabled("staleness")).isTrue();
    }

    @Test
    void without_combinedWithGroups_excludesFromGroup() {
        // Given
        RuleSelection selection = RuleSelection.groups(List.of("metadata")).without("terminology");

        // Then
        assertThat(selection.isEnabled("completeness")).isTrue();
        assertThat(selection.isEnabled("terminology")).isFalse();
    }

    @Test
    void withRules_keepsOtherSettings() {
        // Given
        AuditConfig config = new AuditConfig(3, 1000, 0, 0, 5000L, 10, Set.of("example.org"), 2, 80, null, null, null, null);

        // When
        AuditConfig restricted = config.withRules(RuleSelection.groups(RuleGroups.OFFLINE));

        // Then
        assertThat(restricted.concurrency()).isEqualTo(3);
        assertThat(restricted.retries()).isZero();
        assertThat(restricted.shortDescriptionMaxLength()).isEqualTo(80);
        assertThat(restricted.rules().isEnabled("link-liveness")).isFalse();
        assertThat(restricted.rules().isEnabled("staleness")).isTrue();
    }

    @Test
    void isBestEffortHost_matchesHostAndSubdomains() {
        // Given
        AuditConfig config = new AuditConfig(null, null, null, null, null, null,
            Set.of("Example.ORG"), null, null, null, null, null, null);

        // Then
        assertThat(config.isBestEffortHost("example.org")).isTrue();
        assertThat(config.isBestEffortHost("status.example.org")).isTrue();
        assertThat(config.isBestEffortHost("example.org.evil.net")).isFalse();
        assertThat(config.isBestEffortHost("notexample.org")).isFalse();
        assertThat(config.isBestEffortHost(null)).isFalse();
    }
}
