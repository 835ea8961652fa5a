package com.ecoauditor.core.rule;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.config.AuditConfig.RuleSelection;
import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.rule.base.AbstractAuditRule;
import com.ecoauditor.core.util.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest extends RuleTestBase {

    private final List<String> executed = new ArrayList<>();

    @Test
    void run_executesRulesInPriorityOrder() {
        // Given
        RuleEngine engine = new RuleEngine(List.of(
            new RecordingRule("late", 50, null),
            new RecordingRule("early", 10, null),
            new RecordingRule("also-early", 10, null)
        ));

        // When
        RuleEngineResult result = engine.run(contextFor(validRecord("core").build()));

        // Then
        assertThat(executed).containsExactly("also-early", "early", "late");
        assertThat(result.executedRules()).containsExactly("also-early", "early", "late");
        assertThat(result.complete()).isTrue();
    }

    @Test
    void run_crashingRule_becomesBlockingFindingAndOtherRulesStillRun() {
        // Given
        RuleEngine engine = new RuleEngine(List.of(
            new RecordingRule("broken", 10, new IllegalStateException("boom")),
            new RecordingRule("healthy", 20, null)
        ));

        // When
        RuleEngineResult result = engine.run(contextFor(validRecord("core").build()));

        // Then
        assertThat(executed).containsExactly("broken", "healthy");
        assertThat(result.findings()).singleElement()
            .satisfies(finding -> {
                assertThat(finding.isBlocking()).isTrue();
                assertThat(finding.subject()).isEqualTo("broken");
                assertThat(finding.category()).isEqualTo(Category.METADATA);
                assertThat(finding.message()).isEqualTo("Rule failed to run: IllegalStateException: boom");
            });
    }

    @Test
    void run_cancelledBeforeStart_skipsAllRulesAndIsIncomplete() {
        // Given
        RuleEngine engine = new RuleEngine(List.of(new RecordingRule("only", 10, null)));
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        EcosystemIndex index = EcosystemIndex.of(List.of(validRecord("core").build()));

        // When
        RuleEngineResult result = engine.run(contextFor(index, AuditConfig.defaults(), null, signal));

        // Then
        assertThat(executed).isEmpty();
        assertThat(result.complete()).isFalse();
    }

    @Test
    void run_respectsRuleSelection() {
        // Given
        RuleEngine engine = new RuleEngine(List.of(
            new RecordingRule("completeness", 10, null),
            new RecordingRule("link-liveness", 100, null)
        ));
        AuditConfig config = AuditConfig.defaults().withRules(RuleSelection.all().without("link-liveness"));

        // When
        engine.run(contextFor(config, validRecord("core").build()));

        // Then
        assertThat(executed).containsExactly("completeness");
    }

    @Test
    void run_emptyIndex_skipsNonApplicableRules() {
        // Given
        RuleEngine engine = new RuleEngine(List.of(new RecordingRule("only", 10, null)));

        // When
        RuleEngineResult result = engine.run(contextFor());

        // Then
        assertThat(executed).isEmpty();
        assertThat(result.results()).isEmpty();
        assertThat(result.complete()).isTrue();
    }

    @Test
    void selectRules_unknownIdsAreIgnored() {
        // Given
        RuleEngine engine = new RuleEngine(List.of(new RecordingRule("completeness", 10, null)));
        AuditConfig config = AuditConfig.defaults()
            .withRules(new RuleSelection(List.of("completeness", "does-not-exist"), null, null));

        // When
        List<AuditRule> selected = engine.selectRules(config);

        // Then
        assertThat(selected).extracting(AuditRule::getId).containsExactly("completeness");
    }

    private final class RecordingRule extends AbstractAuditRule {
        private final String id;
        private final int priority;
        private final RuntimeException failure;

        RecordingRule(String id, int priority, RuntimeException failure) {
            this.id = id;
            this.priority = priority;
            this.failure = failure;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDisplayName() {
            return "Recording " + id;
        }

        @Override
        public Category getCategory() {
            return Category.METADATA;
        }

        @Override
        public int getPriority() {
            return priority;
        }

        @Override
        public RuleResult evaluate(AuditContext context) {
            executed.add(id);
            if (failure != null) {
                throw failure;
            }
            return result(List.<Finding>of());
        }
    }
}
