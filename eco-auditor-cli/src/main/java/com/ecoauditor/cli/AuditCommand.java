package com.ecoauditor.cli;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.config.AuditConfig.RuleSelection;
import com.ecoauditor.core.config.RuleGroups;
import com.ecoauditor.core.rule.impl.LinkLivenessRule;
import com.ecoauditor.core.util.CancellationSignal;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Command to run the full audit, link probing included.
 *
 * <p>Ctrl-C cancels the run: in-flight probes are aborted, the partial report is still
 * printed, and the process exits with {@link ExitCodes#INCOMPLETE}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Full audit
 * ecoauditor audit ecosystem-index.json
 *
 * # Only the link check, as JSON
 * ecoauditor audit ecosystem-index.json --only links -f json
 *
 * # Everything except the link check
 * ecoauditor audit ecosystem-index.json --skip-links
 * }</pre>
 */
@Command(
    name = "audit",
    description = "Audit the ecosystem index (metadata, graph, statistics and links)",
    mixinStandardHelpOptions = true
)
public class AuditCommand extends AbstractAuditCommand {

    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    @Option(names = "--only", description = "Run only these rule groups: metadata, graph, links, stats (repeatable)")
    private List<String> onlyGroups = new ArrayList<>();

    @Option(names = "--skip-links", description = "Do not probe external links")
    private boolean skipLinks;

    private final CancellationSignal signal = CancellationSignal.create();

    @Override
    protected AuditConfig configure(AuditConfig config) {
        for (String group : onlyGroups) {
            if (!RuleGroups.isValidGroup(group)) {
                throw new IllegalArgumentException("Unknown rule group '" + group + "'; valid groups: "
                    + new TreeSet<>(RuleGroups.GROUPS.keySet()));
            }
        }
        RuleSelection selection = onlyGroups.isEmpty() ? config.rules() : RuleSelection.groups(onlyGroups);
        if (skipLinks) {
            selection = selection.without(LinkLivenessRule.ID);
        }
        return config.withRules(selection);
    }

    @Override
    protected CancellationSignal cancellation() {
        return signal;
    }

    @Override
    public Integer call() {
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger exitCode = new AtomicInteger(ExitCodes.INCOMPLETE);
        Thread hook = new Thread(() -> {
            log.warn("Interrupted; cancelling audit and printing the partial report");
            signal.cancel();
            try {
                if (done.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    Runtime.getRuntime().halt(exitCode.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "audit-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            int code = super.call();
            exitCode.set(code);
            return code;
        } finally {
            done.countDown();
            removeHook(hook);
        }
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress; cancellation hook stays registered");
        }
    }
}
