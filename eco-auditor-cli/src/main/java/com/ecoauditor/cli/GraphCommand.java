package com.ecoauditor.cli;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.config.ConfigLoader;
import com.ecoauditor.core.generator.GeneratedGraph;
import com.ecoauditor.core.generator.GraphGenerator;
import com.ecoauditor.core.graph.EcosystemGraph;
import com.ecoauditor.core.graph.GraphBuilder;
import com.ecoauditor.core.loader.LoadResult;
import com.ecoauditor.core.loader.MalformedMetadataException;
import com.ecoauditor.core.loader.MetadataLoader;
import com.ecoauditor.core.renderer.GeneratedFile;
import com.ecoauditor.core.renderer.GeneratedOutput;
import com.ecoauditor.core.renderer.OutputRenderer;
import com.ecoauditor.core.renderer.RenderContext;
import com.ecoauditor.core.renderer.impl.ConsoleRenderer;
import com.ecoauditor.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to describe the dependency graph for external visualisation.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Mermaid to stdout
 * ecoauditor graph ecosystem-index.json
 *
 * # JSON written to docs/ecosystem-graph.json
 * ecoauditor graph ecosystem-index.json --format json -o docs
 * }</pre>
 */
@Command(
    name = "graph",
    description = "Describe the ecosystem dependency graph (Mermaid or JSON)",
    mixinStandardHelpOptions = true
)
public class GraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GraphCommand.class);

    @Parameters(index = "0", description = "Ecosystem index file (JSON, or YAML for *.yml/*.yaml)")
    private Path indexFile;

    @Option(names = "--overrides", description = "Directory of per-repository metadata overrides")
    private Path overridesDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configPath;

    @Option(names = {"-f", "--format"}, description = "Output format: mermaid or json (default: ${DEFAULT-VALUE})",
        defaultValue = "mermaid")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Output directory; prints to the console when omitted")
    private Path outputDir;

    @Override
    public Integer call() {
        Optional<GraphGenerator> generator = GraphGenerator.find(format);
        if (generator.isEmpty()) {
            System.err.println("✗ Unknown graph format: " + format + " (use mermaid or json)");
            return ExitCodes.ERROR;
        }

        try {
            AuditConfig config = ConfigLoader.loadFor(configPath, indexFile);
            Path overrides = overridesDir != null ? overridesDir : config.overridesDirectory().orElse(null);
            LoadResult loaded = new MetadataLoader(config.shortDescriptionMaxLength()).load(indexFile, overrides);
            if (!loaded.findings().isEmpty()) {
                log.warn("Index has {} metadata findings; run 'ecoauditor validate' for details",
                    loaded.findings().size());
            }

            EcosystemGraph graph = new GraphBuilder().build(loaded.index());
            GeneratedGraph description = generator.get().generate(graph, config);
            log.info("Generated {} with {}", description.fileName(), generator.get().getDisplayName());

            GeneratedFile file = new GeneratedFile(description.fileName(), description.content(),
                GeneratedFile.contentTypeFor(description.fileExtension()));
            OutputRenderer renderer = outputDir != null ? new FileSystemRenderer() : new ConsoleRenderer();
            renderer.render(GeneratedOutput.of(file), RenderContext.of(outputDir != null ? outputDir.toString() : "."));

            if (outputDir != null) {
                System.err.println("✓ Wrote " + outputDir.resolve(description.fileName()));
            }
            return ExitCodes.PASSED;
        } catch (MalformedMetadataException e) {
            log.debug("Malformed input", e);
            System.err.println("✗ " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (RuntimeException e) {
            log.error("Graph generation failed", e);
            System.err.println("✗ Graph generation failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
