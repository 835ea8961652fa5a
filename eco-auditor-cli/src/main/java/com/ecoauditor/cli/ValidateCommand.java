package com.ecoauditor.cli;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.config.AuditConfig.RuleSelection;
import com.ecoauditor.core.config.RuleGroups;
import picocli.CommandLine.Command;

/**
 * Command to validate the index offline: metadata, graph and statistics rules, no network.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ecoauditor validate ecosystem-index.json --overrides repos/
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate the ecosystem index without network access",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends AbstractAuditCommand {

    @Override
    protected AuditConfig configure(AuditConfig config) {
        return config.withRules(RuleSelection.groups(RuleGroups.OFFLINE));
    }
}
