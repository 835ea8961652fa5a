package com.ecoauditor.core.generator;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.graph.EcosystemGraph;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Interface for generators that describe the ecosystem graph in a textual format for
 * external visualisation tools.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * GraphGenerator generator = GraphGenerator.find("mermaid").orElseThrow();
 * GeneratedGraph description = generator.generate(graph, config);
 * // description.fileName() == "ecosystem-graph.mmd"
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.ecoauditor.core.generator.GraphGenerator}
 *
 * @see GeneratedGraph
 */
public interface GraphGenerator {

    /**
     * Returns unique identifier for this generator, as used by {@code graph --format}.
     * Should be lowercase (e.g., "mermaid", "json").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated descriptions, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Describes the graph.
     *
     * <p>An empty graph yields a valid, empty description.
     *
     * @param graph ecosystem graph
     * @param config audit configuration, used for the central-node threshold
     * @return generated description
     */
    GeneratedGraph generate(EcosystemGraph graph, AuditConfig config);

    /**
     * Finds a generator by id.
     *
     * @param id generator id
     * @return generator, or empty when none is registered under that id
     */
    static Optional<GraphGenerator> find(String id) {
        for (GraphGenerator generator : ServiceLoader.load(GraphGenerator.class)) {
            if (generator.getId().equalsIgnoreCase(id)) {
                return Optional.of(generator);
            }
        }
        return Optional.empty();
    }
}
