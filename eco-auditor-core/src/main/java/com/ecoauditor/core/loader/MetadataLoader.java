package com.ecoauditor.core.loader;

import com.ecoauditor.core.config.AuditConfig;
import com.ecoauditor.core.model.Category;
import com.ecoauditor.core.model.DeclaredDependency;
import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.model.EdgeType;
import com.ecoauditor.core.model.Finding;
import com.ecoauditor.core.model.Layer;
import com.ecoauditor.core.model.RepositoryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Parses the canonical ecosystem index and per-repository overrides into an
 * {@link EcosystemIndex}.
 *
 * <p>The index is a JSON or YAML document (chosen by file extension) whose root object holds
 * either a {@code repos} array of descriptors or a {@code repositories} object mapping
 * names to descriptors. Published statistics are read from {@code total_repos} and
 * {@code layers.<layer>.count}.
 *
 * <p>Record-level problems (missing required fields, wrong field types, overly long
 * descriptions, duplicate names, unrecognized fields) become findings so that one bad
 * record never aborts an audit. Only structurally unparsable input raises
 * {@link MalformedMetadataException}.
 *
 * <p><b>Overrides:</b> an optional directory containing {@code <repo>/metadata.yml} or
 * {@code <repo>.yml} files. Fields of an override replace the same fields of the index
 * descriptor.
 */
public class MetadataLoader {

    private static final Logger log = LoggerFactory.getLogger(MetadataLoader.class);

    /**
     * Fields every descriptor must supply.
     */
    public static final List<String> REQUIRED_FIELDS = List.of(
        "name", "layer", "status", "short_description", "dependencies", "tags", "license"
    );

    private static final Set<String> OPTIONAL_FIELDS = Set.of(
        "long_description", "spec_version", "url", "health_endpoint", "links",
        "last_updated", "deprecated", "repo_count"
    );

    // Written by the index generator; recognized so they are not reported as unknown.
    private static final Set<String> GENERATED_FIELDS = Set.of(
        "local_path", "has_metadata", "has_readme", "is_ecosystem", "visibility",
        "reverse_dependencies"
    );

    private static final String OVERRIDE_FILE_NAME = "metadata.yml";

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final int shortDescriptionMaxLength;

    public MetadataLoader() {
        this(AuditConfig.DEFAULT_SHORT_DESCRIPTION_MAX_LENGTH);
    }

    /**
     * Creates a loader with a custom short description limit.
     *
     * @param shortDescriptionMaxLength maximum length before a warning is recorded
     */
    public MetadataLoader(int shortDescriptionMaxLength) {
        this.shortDescriptionMaxLength = shortDescriptionMaxLength;
    }

    /**
     * Loads an index file without overrides.
     *
     * @param indexFile index file (JSON, or YAML when named {@code *.yml}/{@code *.yaml})
     * @return loaded index with record-level findings
     * @throws MalformedMetadataException if the file cannot be read or parsed
     */
    public LoadResult load(Path indexFile) {
        return load(indexFile, null);
    }

    /**
     * Loads an index file and applies per-repository overrides.
     *
     * @param indexFile index file
     * @param overridesDir directory of override files, or null
     * @return loaded index with record-level findings
     * @throws MalformedMetadataException if any input cannot be read or parsed
     */
    public LoadResult load(Path indexFile, Path overridesDir) {
        log.debug("Loading ecosystem index from: {}", indexFile);
        String source = indexFile.toString();
        JsonNode root = readTree(indexFile, source);
        Map<String, ObjectNode> overrides = overridesDir == null ? Map.of() : loadOverrides(overridesDir);
        LoadResult result = parse(root, source, overrides);
        log.info("Loaded {} repositories from {} ({} findings)",
            result.index().size(), indexFile, result.findings().size());
        return result;
    }

    /**
     * Parses index content held in memory.
     *
     * @param content document text
     * @param yaml true for YAML, false for JSON
     * @param source name used in error messages
     * @return loaded index with record-level findings
     * @throws MalformedMetadataException if the content cannot be parsed
     */
    public LoadResult parse(String content, boolean yaml, String source) {
        JsonNode root;
        try {
            root = (yaml ? yamlMapper : jsonMapper).readTree(content);
        } catch (JsonProcessingException e) {
            throw new MalformedMetadataException(source, null, "not a well-formed document: " + e.getOriginalMessage(), e);
        }
        return parse(root, source, Map.of());
    }

    private LoadResult parse(JsonNode root, String source, Map<String, ObjectNode> overrides) {
        if (root == null || !root.isObject()) {
            throw new MalformedMetadataException(source, null, "index root must be an object");
        }

        List<Finding> findings = new ArrayList<>();
        List<Descriptor> descriptors = collectDescriptors(root, source);
        Map<String, ObjectNode> pendingOverrides = new TreeMap<>(overrides);

        Map<String, RepositoryRecord> records = new TreeMap<>();
        int position = 0;
        for (Descriptor entry : descriptors) {
            position++;
            ObjectNode descriptor = entry.node();
            String name = textOrNull(descriptor.get("name"));
            if (name == null && entry.key() != null && !entry.key().isBlank()) {
                name = entry.key();
                descriptor = descriptor.deepCopy();
                descriptor.put("name", name);
            }
            if (name == null) {
                findings.add(Finding.blocking(Category.METADATA, "#" + position, "Missing required field: name")
                    .withRemediation("Give every descriptor a unique 'name'"));
                continue;
            }

            ObjectNode override = pendingOverrides.remove(name);
            if (override != null) {
                descriptor = descriptor.deepCopy();
                descriptor.setAll(override);
                descriptor.put("name", name);
                log.debug("Applied metadata override for {}", name);
            }

            if (descriptor.has("is_ecosystem") && !descriptor.get("is_ecosystem").asBoolean(true)) {
                log.debug("Skipping {}: not part of the ecosystem", name);
                continue;
            }

            if (records.containsKey(name)) {
                findings.add(Finding.blocking(Category.METADATA, name,
                    "Duplicate repository name; first declaration kept"));
                continue;
            }
            records.put(name, parseRecord(name, descriptor, findings));
        }

        pendingOverrides.keySet().forEach(name -> findings.add(Finding.warning(Category.METADATA, name,
            "Metadata override for a repository that is not in the index; ignored")));

        EcosystemIndex index = new EcosystemIndex(
            textOrNull(root.get("version")),
            records,
            intOrNull(root.get("total_repos")),
            declaredLayerCounts(root.get("layers"))
        );
        return new LoadResult(index, findings);
    }

    private List<Descriptor> collectDescriptors(JsonNode root, String source) {
        List<Descriptor> descriptors = new ArrayList<>();
        JsonNode repos = root.get("repos");
        JsonNode repositories = root.get("repositories");

        if (repos != null && !repos.isNull()) {
            if (!repos.isArray()) {
                throw new MalformedMetadataException(source, null, "'repos' must be an array of descriptors");
            }
            int position = 0;
            for (JsonNode node : repos) {
                position++;
                if (!node.isObject()) {
                    throw new MalformedMetadataException(source, "#" + position, "descriptor must be an object");
                }
                descriptors.add(new Descriptor(null, (ObjectNode) node));
            }
        } else if (repositories != null && !repositories.isNull()) {
            if (!repositories.isObject()) {
                throw new MalformedMetadataException(source, null, "'repositories' must map names to descriptors");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = repositories.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isObject()) {
                    throw new MalformedMetadataException(source, field.getKey(), "descriptor must be an object");
                }
                descriptors.add(new Descriptor(field.getKey(), (ObjectNode) field.getValue()));
            }
        } else {
            throw new MalformedMetadataException(source, null, "index must contain 'repos' or 'repositories'");
        }
        return descriptors;
    }

    private RepositoryRecord parseRecord(String name, ObjectNode node, List<Finding> findings) {
        RepositoryRecord.Builder builder = RepositoryRecord.builder(name);

        for (String field : REQUIRED_FIELDS) {
            if (!isPresent(node, field)) {
                findings.add(Finding.blocking(Category.METADATA, name, "Missing required field: " + field)
                    .withRemediation("Add '" + field + "' to the repository descriptor"));
            }
        }
        if (!isPresent(node, "spec_version")) {
            findings.add(Finding.warning(Category.METADATA, name, "Missing field: spec_version"));
        }

        if (isPresent(node, "layer")) {
            builder.declaredLayer(node.get("layer").asText());
        }
        if (isPresent(node, "status")) {
            builder.declaredStatus(node.get("status").asText());
        }

        String shortDescription = textOrNull(node.get("short_description"));
        if (shortDescription != null) {
            shortDescription = shortDescription.strip();
            if (shortDescription.length() > shortDescriptionMaxLength) {
                findings.add(Finding.warning(Category.METADATA, name, String.format(
                    "short_description exceeds %d chars (%d chars)",
                    shortDescriptionMaxLength, shortDescription.length())));
            }
        }
        builder.shortDescription(shortDescription)
            .longDescription(textOrNull(node.get("long_description")))
            .license(textOrNull(node.get("license")))
            .specVersion(textOrNull(node.get("spec_version")))
            .url(textOrNull(node.get("url")))
            .healthEndpoint(textOrNull(node.get("health_endpoint")))
            .deprecated(node.path("deprecated").asBoolean(false))
            .declaredRepoCount(intOrNull(node.get("repo_count")));

        parseDependencies(name, node.get("dependencies"), builder, findings);
        stringList(name, "tags", node.get("tags"), findings).forEach(builder::tags);
        stringList(name, "links", node.get("links"), findings).forEach(builder::link);
        builder.lastUpdated(parseDate(name, node.get("last_updated"), findings));

        Iterator<String> fieldNames = node.fieldNames();
        while (fieldNames.hasNext()) {
            String field = fieldNames.next();
            if (!REQUIRED_FIELDS.contains(field) && !OPTIONAL_FIELDS.contains(field) && !GENERATED_FIELDS.contains(field)) {
                findings.add(Finding.info(Category.METADATA, name, "Unrecognized field '" + field + "' ignored"));
            }
        }

        return builder.build();
    }

    private void parseDependencies(String name, JsonNode node, RepositoryRecord.Builder builder, List<Finding> findings) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isArray()) {
            findings.add(Finding.blocking(Category.METADATA, name, "dependencies must be a list"));
            return;
        }
        for (JsonNode entry : node) {
            if (entry.isTextual() && !entry.asText().isBlank()) {
                builder.dependency(DeclaredDependency.direct(entry.asText().trim()));
            } else if (entry.isObject() && textOrNull(entry.get("name")) != null) {
                String dependency = textOrNull(entry.get("name"));
                String declaredType = textOrNull(entry.get("type"));
                EdgeType type = EdgeType.DIRECT;
                if (declaredType != null) {
                    type = EdgeType.fromWireName(declaredType).orElse(null);
                    if (type == null) {
                        findings.add(Finding.blocking(Category.DEPENDENCY, name, String.format(
                            "Invalid dependency type '%s' for '%s'. Must be one of: direct, conceptual, test, example",
                            declaredType, dependency)));
                        type = EdgeType.DIRECT;
                    }
                }
                builder.dependency(new DeclaredDependency(dependency, type));
            } else {
                findings.add(Finding.blocking(Category.DEPENDENCY, name, "Invalid dependency entry: " + entry));
            }
        }
    }

    private List<String> stringList(String name, String field, JsonNode node, List<Finding> findings) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            findings.add(Finding.blocking(Category.METADATA, name, field + " must be a list"));
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode entry : node) {
            if (entry.isValueNode() && !entry.asText().isBlank()) {
                values.add(entry.asText().trim());
            }
        }
        return values;
    }

    private LocalDate parseDate(String name, JsonNode node, List<Finding> findings) {
        String value = textOrNull(node);
        if (value == null) {
            return null;
        }
        try {
            return value.length() <= 10 ? LocalDate.parse(value) : OffsetDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException e) {
            findings.add(Finding.warning(Category.METADATA, name, "Unparsable last_updated '" + value + "' ignored"));
            return null;
        }
    }

    private Map<Layer, Integer> declaredLayerCounts(JsonNode layers) {
        if (layers == null || !layers.isObject()) {
            return Map.of();
        }
        Map<Layer, Integer> counts = new EnumMap<>(Layer.class);
        Iterator<Map.Entry<String, JsonNode>> fields = layers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Layer layer = Layer.fromWireName(field.getKey()).orElse(null);
            JsonNode value = field.getValue();
            Integer count = value.isObject() ? intOrNull(value.get("count")) : intOrNull(value);
            if (layer == null || count == null) {
                log.debug("Ignoring layer summary entry: {}", field.getKey());
                continue;
            }
            counts.put(layer, count);
        }
        return counts;
    }

    private Map<String, ObjectNode> loadOverrides(Path overridesDir) {
        if (!Files.isDirectory(overridesDir)) {
            throw new MalformedMetadataException(overridesDir.toString(), null, "overrides path is not a directory");
        }
        Map<String, ObjectNode> overrides = new TreeMap<>();
        try (Stream<Path> entries = Files.list(overridesDir)) {
            for (Path entry : entries.sorted().toList()) {
                Path file;
                String defaultName;
                if (Files.isDirectory(entry)) {
                    file = entry.resolve(OVERRIDE_FILE_NAME);
                    defaultName = entry.getFileName().toString();
                    if (!Files.isRegularFile(file)) {
                        continue;
                    }
                } else if (isYaml(entry)) {
                    file = entry;
                    String fileName = entry.getFileName().toString();
                    defaultName = fileName.substring(0, fileName.lastIndexOf('.'));
                } else {
                    continue;
                }
                JsonNode override = readTree(file, file.toString());
                if (!override.isObject()) {
                    throw new MalformedMetadataException(file.toString(), defaultName, "override must be an object");
                }
                String name = textOrNull(override.get("name"));
                overrides.put(name != null ? name : defaultName, (ObjectNode) override);
            }
        } catch (IOException e) {
            throw new MalformedMetadataException(overridesDir.toString(), null, "cannot list overrides: " + e.getMessage(), e);
        }
        log.debug("Loaded {} metadata overrides from {}", overrides.size(), overridesDir);
        return overrides;
    }

    private JsonNode readTree(Path file, String source) {
        try {
            String content = Files.readString(file);
            JsonNode root = (isYaml(file) ? yamlMapper : jsonMapper).readTree(content);
            if (root == null || root.isMissingNode()) {
                throw new MalformedMetadataException(source, null, "document is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedMetadataException(source, null, "not a well-formed document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedMetadataException(source, null, "cannot read file: " + e.getMessage(), e);
        }
    }

    private static boolean isYaml(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml");
    }

    private static boolean isPresent(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        return !value.isTextual() || !value.asText().isBlank();
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static Integer intOrNull(JsonNode node) {
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            return null;
        }
        return node.intValue();
    }

    /**
     * One descriptor in declaration order, with its map key when the index uses the
     * {@code repositories} form.
     */
    private record Descriptor(String key, ObjectNode node) {
    }
}
