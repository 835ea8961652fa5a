package com.ecoauditor.cli;

import com.ecoauditor.core.audit.EcosystemAuditor;
import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.config.ConfigLoader;
import com.ecoauditor.core.loader.MalformedMetadataException;
import com.ecoauditor.core.renderer.GeneratedFile;
import com.ecoauditor.core.renderer.GeneratedOutput;
import com.ecoauditor.core.renderer.OutputRenderer;
import com.ecoauditor.core.renderer.RenderContext;
import com.ecoauditor.core.renderer.impl.ConsoleRenderer;
import com.ecoauditor.core.renderer.impl.FileSystemRenderer;
import com.ecoauditor.core.report.AuditReport;
import com.ecoauditor.core.report.ReportFormatter;
import com.ecoauditor.core.util.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Shared pipeline of the {@code audit} and {@code validate} commands: load configuration,
 * audit the index, format the report and deliver it to the console or a file.
 */
public abstract class AbstractAuditCommand implements Callable<Integer> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Parameters(index = "0", description = "Ecosystem index file (JSON, or YAML for *.yml/*.yaml)")
    protected Path indexFile;

    @Option(names = "--overrides", description = "Directory of per-repository metadata overrides (default: overrides_dir from the configuration)")
    protected Path overridesDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ecoauditor.yaml next to the index or in the working directory)")
    protected Path configPath;

    @Option(names = {"-f", "--format"}, description = "Report format: text or json (default: ${DEFAULT-VALUE})",
        defaultValue = "text")
    protected String format;

    @Option(names = {"-o", "--output"}, description = "Write the report to this file instead of the console")
    protected Path outputFile;

    private final ConsoleRenderer consoleRenderer;

    protected AbstractAuditCommand() {
        this(new ConsoleRenderer());
    }

    protected AbstractAuditCommand(ConsoleRenderer consoleRenderer) {
        this.consoleRenderer = consoleRenderer;
    }

    /**
     * Applies the command's rule selection to the loaded configuration.
     *
     * @param config loaded configuration
     * @return configuration to audit with
     */
    protected abstract AuditConfig configure(AuditConfig config);

    /**
     * Returns the cancellation signal of the run.
     *
     * @return cancellation signal
     */
    protected CancellationSignal cancellation() {
        return CancellationSignal.create();
    }

    /**
     * Builds the auditor; overridable for tests.
     *
     * @param config configuration
     * @return auditor
     */
    protected EcosystemAuditor createAuditor(AuditConfig config) {
        return new EcosystemAuditor(config);
    }

    @Override
    public Integer call() {
        Optional<ReportFormatter> formatter = ReportFormatter.find(format);
        if (formatter.isEmpty()) {
            System.err.println("✗ Unknown report format: " + format + " (use text or json)");
            return ExitCodes.ERROR;
        }

        try {
            AuditConfig config = configure(loadConfiguration());
            log.info("Auditing {} (rules: {})", indexFile.toAbsolutePath(), describeSelection(config));

            Path overrides = overridesDir != null ? overridesDir : config.overridesDirectory().orElse(null);
            AuditReport report = createAuditor(config).audit(indexFile, overrides, cancellation());
            deliver(formatter.get(), report);
            return ExitCodes.of(report);
        } catch (MalformedMetadataException e) {
            log.debug("Malformed input", e);
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (IllegalArgumentException e) {
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (RuntimeException e) {
            log.error("Audit failed", e);
            System.err.println("✗ Audit failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    private AuditConfig loadConfiguration() {
        return ConfigLoader.loadFor(configPath, indexFile);
    }

    private void deliver(ReportFormatter formatter, AuditReport report) {
        String content = formatter.format(report);
        OutputRenderer renderer;
        RenderContext context;
        String fileName;
        if (outputFile != null) {
            Path absolute = outputFile.toAbsolutePath();
            renderer = new FileSystemRenderer();
            context = RenderContext.of(absolute.getParent().toString());
            fileName = absolute.getFileName().toString();
        } else {
            renderer = consoleRenderer;
            context = RenderContext.of(".");
            fileName = "audit-report." + formatter.getFileExtension();
        }
        GeneratedFile file = new GeneratedFile(fileName, content,
            GeneratedFile.contentTypeFor(formatter.getFileExtension()));
        renderer.render(GeneratedOutput.of(file), context);
        if (outputFile != null) {
            System.err.println("✓ Report written to " + outputFile + " (" + report.status() + ")");
        }
    }

    private static String describeSelection(AuditConfig config) {
        AuditConfig.RuleSelection rules = config.rules();
        if (!rules.groups().isEmpty()) {
            return "groups " + rules.groups();
        }
        return rules.enabled().isEmpty() ? "all" : rules.enabled().toString();
    }
}
