package com.ecoauditor.core.generator.impl;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.generator.GeneratedGraph;
import com.ecoauditor.core.generator.GraphGenerator;
import com.ecoauditor.core.graph.EcosystemGraph;
import com.ecoauditor.core.model.DependencyEdge;
import com.ecoauditor.core.model.Layer;
import com.ecoauditor.core.model.RepositoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Generates a Mermaid flowchart of the ecosystem.
 *
 * <p>Repositories are grouped into one subgraph per layer, in layer order, and colour-coded
 * by layer. Repositories without a valid layer are drawn outside the subgraphs. Direct
 * dependencies are solid arrows; conceptual, test and example dependencies are dotted arrows
 * labelled with their type. Central repositories get a thick border.
 *
 * <p><b>Example output:</b>
 * <pre>
 * graph TB
 *     subgraph layer_PROTOCOL["protocol"]
 *         MirrorDNA["MirrorDNA"]
 *     end
 *     subgraph layer_RUNTIME["runtime"]
 *         MirrorBrain["MirrorBrain"]
 *     end
 *     MirrorBrain --&gt; MirrorDNA
 * </pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid flowcharts</a>
 */
public class MermaidGraphGenerator implements GraphGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGraphGenerator.class);

    private static final String INDENT = "    ";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    private static final Map<Layer, String> LAYER_COLORS = new EnumMap<>(Map.of(
        Layer.PROTOCOL, "#3B82F6",
        Layer.LANGUAGE, "#22C55E",
        Layer.RUNTIME, "#A855F7",
        Layer.APPLICATION, "#F97316",
        Layer.INFRASTRUCTURE, "#14B8A6",
        Layer.RESEARCH, "#EAB308"
    ));

    @Override
    public String getId() {
        return "mermaid";
    }

    @Override
    public String getDisplayName() {
        return "Mermaid Graph Generator";
    }

    @Override
    public String getFileExtension() {
        return "mmd";
    }

    @Override
    public GeneratedGraph generate(EcosystemGraph graph, AuditConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Map<String, String> nodeIds = assignNodeIds(graph);
        StringBuilder sb = new StringBuilder("graph TB\n");

        appendLayerSubgraphs(sb, graph, nodeIds);
        graph.records().values().stream()
            .filter(record -> record.layer() == null)
            .forEach(record -> appendNode(sb, INDENT, record, nodeIds));
        appendEdges(sb, graph, nodeIds);
        appendStyles(sb, graph, config, nodeIds);

        log.debug("Generated Mermaid graph with {} nodes and {} edges", graph.size(), graph.edges().size());
        return new GeneratedGraph(GeneratedGraph.DEFAULT_NAME, sb.toString(), getFileExtension());
    }

    private void appendLayerSubgraphs(StringBuilder sb, EcosystemGraph graph, Map<String, String> nodeIds) {
        for (Map.Entry<Layer, List<String>> entry : graph.membersByLayer().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            Layer layer = entry.getKey();
            sb.append(INDENT).append("subgraph ").append(subgraphId(layer))
                .append("[\"").append(layer.wireName()).append("\"]\n");
            for (String name : entry.getValue()) {
                appendNode(sb, INDENT + INDENT, graph.records().get(name), nodeIds);
            }
            sb.append(INDENT).append("end\n");
        }
    }

    private void appendNode(StringBuilder sb, String indent, RepositoryRecord record, Map<String, String> nodeIds) {
        String label = escape(record.name()) + (record.isDeprecated() ? " (deprecated)" : "");
        sb.append(indent).append(nodeIds.get(record.name())).append("[\"").append(label).append("\"]\n");
    }

    private void appendEdges(StringBuilder sb, EcosystemGraph graph, Map<String, String> nodeIds) {
        for (DependencyEdge edge : graph.edges()) {
            sb.append(INDENT).append(nodeIds.get(edge.source()));
            if (edge.isDirect()) {
                sb.append(" --> ");
            } else {
                sb.append(" -.->|").append(edge.type().wireName()).append("| ");
            }
            sb.append(nodeIds.get(edge.target())).append('\n');
        }
    }

    private void appendStyles(StringBuilder sb, EcosystemGraph graph, AuditConfig config, Map<String, String> nodeIds) {
        Map<Layer, List<String>> members = graph.membersByLayer();
        for (Map.Entry<Layer, List<String>> entry : members.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            String className = entry.getKey().wireName();
            sb.append(INDENT).append("classDef ").append(className)
                .append(" fill:").append(LAYER_COLORS.get(entry.getKey())).append(",color:#FFFFFF\n");
            sb.append(INDENT).append("class ")
                .append(String.join(",", entry.getValue().stream().map(nodeIds::get).toList()))
                .append(' ').append(className).append('\n');
        }

        List<String> central = graph.records().keySet().stream()
            .filter(name -> graph.isCentral(name, config.centralThreshold()))
            .map(nodeIds::get)
            .toList();
        if (!central.isEmpty()) {
            sb.append(INDENT).append("classDef central stroke:#111827,stroke-width:3px\n");
            sb.append(INDENT).append("class ").append(String.join(",", central)).append(" central\n");
        }
    }

    /**
     * Maps repository names to unique Mermaid node ids. Names are visited in sorted order so
     * collisions after sanitizing are resolved the same way on every run. Subgraph ids are
     * reserved first.
     */
    private Map<String, String> assignNodeIds(EcosystemGraph graph) {
        Map<String, String> ids = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Layer layer : Layer.values()) {
            used.add(subgraphId(layer));
        }
        for (String name : graph.records().keySet()) {
            String base = sanitizeId(name);
            String id = base;
            int suffix = 2;
            while (!used.add(id)) {
                id = base + "_" + suffix++;
            }
            ids.put(name, id);
        }
        return ids;
    }

    private static String subgraphId(Layer layer) {
        return "layer_" + layer.name();
    }

    private String sanitizeId(String name) {
        String id = name.replaceAll(ID_SANITIZATION_PATTERN, "_");
        // Mermaid reserves "end" and ids must not start with a digit.
        if (id.toLowerCase(Locale.ROOT).equals("end") || Character.isDigit(id.charAt(0))) {
            id = "n_" + id;
        }
        return id;
    }

    private String escape(String text) {
        return text.replace("\"", "'").replace("\n", " ");
    }
}
