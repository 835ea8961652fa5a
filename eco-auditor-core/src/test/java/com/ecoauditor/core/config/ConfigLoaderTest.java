package com.ecoauditor.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        // Given
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, """
            concurrency: 4
            timeout_ms: 2000
            retries: 1
            retry_backoff_ms: 100
            probe_budget_ms: 30000
            staleness_threshold_days: 30
            central_threshold: 5
            best_effort_hosts:
              - Status.Example.org
            rules:
              groups:
                - metadata
              disabled:
                - terminology
            terminology:
              - pattern: "Active\\\\s+MirrorOS"
                advice: "Write 'ActiveMirrorOS'"
            """);

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.timeoutMs()).isEqualTo(2000);
        assertThat(config.retries()).isEqualTo(1);
        assertThat(config.retryBackoffMs()).isEqualTo(100);
        assertThat(config.probeBudgetMs()).isEqualTo(30_000L);
        assertThat(config.stalenessThresholdDays()).isEqualTo(30);
        assertThat(config.centralThreshold()).isEqualTo(5);
        assertThat(config.bestEffortHosts()).containsExactly("status.example.org");
        assertThat(config.rules().groups()).containsExactly("metadata");
        assertThat(config.rules().isEnabled("completeness")).isTrue();
        assertThat(config.rules().isEnabled("terminology")).isFalse();
        assertThat(config.rules().isEnabled("cycle-freedom")).isFalse();
        assertThat(config.terminology()).hasSize(1);
        assertThat(config.terminology().get(0).pattern()).isEqualTo("Active\\s+MirrorOS");
    }

    @Test
    void load_nullPath_returnsDefaults() {
        // When
        AuditConfig config = ConfigLoader.load(null);

        // Then
        assertThat(config).isEqualTo(AuditConfig.defaults());
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        // Given
        Path nonExistent = tempDir.resolve("missing.yaml");

        // When
        AuditConfig config = ConfigLoader.load(nonExistent);

        // Then
        assertThat(config.concurrency()).isEqualTo(AuditConfig.DEFAULT_CONCURRENCY);
        assertThat(config.rules().isEnabled("link-liveness")).isTrue();
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        // Given
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, "concurrency: [unclosed\n  - : :");

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config).isEqualTo(AuditConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        // Given
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, "");

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config).isEqualTo(AuditConfig.defaults());
    }

    @Test
    void load_outOfRangeValues_fallBackToDefaults() throws IOException {
        // Given
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, """
            concurrency: 0
            retries: -1
            timeout_ms: -5
            unknown_option: true
            """);

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.concurrency()).isEqualTo(AuditConfig.DEFAULT_CONCURRENCY);
        assertThat(config.retries()).isEqualTo(AuditConfig.DEFAULT_RETRIES);
        assertThat(config.timeoutMs()).isEqualTo(AuditConfig.DEFAULT_TIMEOUT_MS);
    }

    @Test
    void load_relativeFileEntries_areResolvedAgainstConfigDirectory() throws IOException {
        // Given
        Path configDir = Files.createDirectories(tempDir.resolve("conf"));
        Files.writeString(configDir.resolve("wording.yaml"), """
            - pattern: "mirror os"
              advice: "Write 'MirrorOS'"
            """);
        Path configFile = configDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, """
            overrides_dir: ../repos
            terminology_file: wording.yaml
            terminology:
              - pattern: "legacy gate"
                advice: "Write 'mirror-gate'"
            """);

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.overridesDirectory()).hasValue(tempDir.resolve("repos").toAbsolutePath().normalize());
        assertThat(config.terminologyFile()).isEqualTo(configDir.resolve("wording.yaml").toAbsolutePath().normalize().toString());
        assertThat(config.terminology())
            .extracting(AuditConfig.TerminologyEntry::pattern)
            .containsExactly("legacy gate", "mirror os");
    }

    @Test
    void load_missingTerminologyFile_keepsInlineEntries() throws IOException {
        // Given
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, """
            terminology_file: absent.yaml
            terminology:
              - pattern: "legacy gate"
            """);

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.terminology()).singleElement()
            .satisfies(entry -> assertThat(entry.pattern()).isEqualTo("legacy gate"));
    }

    @Test
    void load_malformedTerminologyFile_keepsRestOfConfig() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("wording.yaml"), "pattern: [unclosed");
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, """
            timeout_ms: 1500
            terminology_file: wording.yaml
            """);

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.timeoutMs()).isEqualTo(1500);
        assertThat(config.terminology()).isEmpty();
    }

    @Test
    void load_budgetShorterThanTimeout_isKeptAsConfigured() throws IOException {
        // Given
        Path configFile = tempDir.resolve("ecoauditor.yaml");
        Files.writeString(configFile, """
            timeout_ms: 5000
            probe_budget_ms: 1000
            """);

        // When
        AuditConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.probeBudgetMs()).isEqualTo(1_000L);
        assertThat(config.timeoutMs()).isEqualTo(5_000);
    }

    @Test
    void locate_configNextToIndex_isFoundBeforeWorkingDirectory() throws IOException {
        // Given
        Path index = Files.writeString(tempDir.resolve("ecosystem-index.json"), "{}");
        Path configFile = Files.writeString(tempDir.resolve("ecoauditor.yml"), "retries: 0\n");

        // When
        AuditConfig config = ConfigLoader.loadFor(null, index);

        // Then
        assertThat(ConfigLoader.locate(index)).hasValue(configFile.toAbsolutePath());
        assertThat(config.retries()).isZero();
    }

    @Test
    void loadFor_explicitPath_winsOverConfigNextToIndex() throws IOException {
        // Given
        Path index = Files.writeString(tempDir.resolve("ecosystem-index.json"), "{}");
        Files.writeString(tempDir.resolve("ecoauditor.yaml"), "retries: 0\n");
        Path explicit = Files.writeString(tempDir.resolve("strict.yaml"), "retries: 4\n");

        // When
        AuditConfig config = ConfigLoader.loadFor(explicit, index);

        // Then
        assertThat(config.retries()).isEqualTo(4);
    }
}
