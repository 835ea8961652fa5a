package com.ecoauditor.core.generator.impl;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.generator.GeneratedGraph;
import com.ecoauditor.core.generator.GraphGenerator;
import com.ecoauditor.core.graph.DependencyCycle;
import com.ecoauditor.core.graph.EcosystemGraph;
import com.ecoauditor.core.graph.UnresolvedDependency;
import com.ecoauditor.core.model.DependencyEdge;
import com.ecoauditor.core.model.Layer;
import com.ecoauditor.core.model.RepositoryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Generates a JSON description of the ecosystem graph.
 *
 * <p>Top-level keys: {@code nodes} (name, layer, status, reverse_dependencies, depth or null,
 * central, deprecated), {@code edges} (source, target, type), {@code layers} (count and
 * members per layer), {@code unresolved} and {@code cycles}. Arrays are in name order.
 */
public class JsonGraphGenerator implements GraphGenerator {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer;

    public JsonGraphGenerator() {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n"));
        this.writer = mapper.writer(printer);
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Graph Generator";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public GeneratedGraph generate(EcosystemGraph graph, AuditConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ObjectNode root = mapper.createObjectNode();
        root.put("total_repos", graph.size());

        ArrayNode nodes = root.putArray("nodes");
        for (RepositoryRecord record : graph.records().values()) {
            ObjectNode node = nodes.addObject();
            node.put("name", record.name());
            node.put("layer", record.layer() != null ? record.layer().wireName() : null);
            node.put("status", record.status() != null ? record.status().wireName() : null);
            node.put("reverse_dependencies", graph.reverseDependencyCount(record.name()));
            OptionalInt depth = graph.topologicalDepth(record.name());
            if (depth.isPresent()) {
                node.put("depth", depth.getAsInt());
            } else {
                node.putNull("depth");
            }
            node.put("central", graph.isCentral(record.name(), config.centralThreshold()));
            node.put("deprecated", record.isDeprecated());
        }

        ArrayNode edges = root.putArray("edges");
        for (DependencyEdge edge : graph.edges()) {
            edges.addObject()
                .put("source", edge.source())
                .put("target", edge.target())
                .put("type", edge.type().wireName());
        }

        ObjectNode layers = root.putObject("layers");
        for (Map.Entry<Layer, List<String>> entry : graph.membersByLayer().entrySet()) {
            ObjectNode layer = layers.putObject(entry.getKey().wireName());
            layer.put("count", entry.getValue().size());
            ArrayNode members = layer.putArray("members");
            entry.getValue().forEach(members::add);
        }

        ArrayNode unresolved = root.putArray("unresolved");
        for (UnresolvedDependency dependency : graph.unresolvedDependencies()) {
            unresolved.addObject()
                .put("source", dependency.source())
                .put("target", dependency.target())
                .put("type", dependency.type().wireName());
        }

        ObjectNode cycles = root.putObject("cycles");
        appendCycles(cycles.putArray("direct"), graph.directCycles());
        appendCycles(cycles.putArray("non_direct"), graph.nonDirectCycles());

        try {
            return new GeneratedGraph(GeneratedGraph.DEFAULT_NAME, writer.writeValueAsString(root) + "\n",
                getFileExtension());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ecosystem graph", e);
        }
    }

    private void appendCycles(ArrayNode target, List<DependencyCycle> cycles) {
        for (DependencyCycle cycle : cycles) {
            ArrayNode path = target.addArray();
            cycle.path().forEach(path::add);
        }
    }
}
