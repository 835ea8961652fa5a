package com.ecoauditor.cli;

import com.ecoauditor.core.config.RuleGroups;
import com.ecoauditor.core.generator.GraphGenerator;
import com.ecoauditor.core.renderer.OutputRenderer;
import com.ecoauditor.core.report.ReportFormatter;
import com.ecoauditor.core.rule.AuditRule;
import com.ecoauditor.core.rule.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available rules, graph generators, report formatters or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays their
 * capabilities.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ecoauditor list
 * ecoauditor list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available rules, generators, formatters or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: rules, generators, formatters or renderers (default: ${DEFAULT-VALUE})",
        defaultValue = "rules"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "rules", "rule" -> listRules();
            case "generators", "generator" -> listGenerators();
            case "formatters", "formatter" -> listFormatters();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: rules, generators, formatters or renderers", type);
                yield ExitCodes.ERROR;
            }
        };
    }

    private int listRules() {
        System.out.println("Available Rules:");
        System.out.println();

        List<AuditRule> rules = RuleEngine.discoverRules();
        for (AuditRule rule : rules) {
            String group = RuleGroups.groupOf(rule.getId());
            System.out.printf("  • %s (ID: %s)%n", rule.getDisplayName(), rule.getId());
            System.out.printf("    Category: %s, Group: %s%s%n", rule.getCategory().wireName(),
                group != null ? group : "-", rule.requiresNetwork() ? ", network" : "");
            System.out.printf("    Priority: %d%n", rule.getPriority());
            System.out.println();
        }

        if (rules.isEmpty()) {
            System.out.println("  No rules found.");
        }
        return ExitCodes.PASSED;
    }

    private int listGenerators() {
        System.out.println("Available Graph Generators:");
        System.out.println();

        boolean found = false;
        for (GraphGenerator generator : ServiceLoader.load(GraphGenerator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No generators found.");
        }
        return ExitCodes.PASSED;
    }

    private int listFormatters() {
        System.out.println("Available Report Formatters:");
        System.out.println();

        boolean found = false;
        for (ReportFormatter formatter : ServiceLoader.load(ReportFormatter.class)) {
            found = true;
            System.out.printf("  • %s (.%s)%n", formatter.getId(), formatter.getFileExtension());
        }

        if (!found) {
            System.out.println("  No formatters found.");
        }
        return ExitCodes.PASSED;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return ExitCodes.PASSED;
    }
}
