package com.ecoauditor.core.config;

import com.ecoauditor.core.config.AuditConfig.TerminologyEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Utility for loading audit configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code ecoauditor.yaml} into an {@link AuditConfig} record.
 * A missing, unreadable or invalid file never aborts a run: {@link AuditConfig#defaults()}
 * is returned instead and the problem is logged.
 *
 * <p>Relative {@code overrides_dir} and {@code terminology_file} entries are resolved against
 * the directory of the configuration file. The entries of the terminology file are appended
 * to the inline {@code terminology} list.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AuditConfig config = ConfigLoader.loadFor(null, Paths.get("ecosystem-index.json"));
 *
 * Path overrides = config.overridesDirectory().orElse(null);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<List<TerminologyEntry>> TERMINOLOGY_LIST = new TypeReference<>() {};

    /**
     * File names looked up when no configuration file is given.
     */
    public static final List<String> DEFAULT_FILE_NAMES = List.of("ecoauditor.yaml", "ecoauditor.yml");

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads the configuration for an index: the explicit file when given, otherwise the first
     * default file found next to the index or in the working directory, otherwise defaults.
     *
     * @param configPath explicit configuration file, may be null
     * @param indexFile ecosystem index being audited, may be null
     * @return loaded configuration
     */
    public static AuditConfig loadFor(Path configPath, Path indexFile) {
        if (configPath != null) {
            return load(configPath);
        }
        Optional<Path> located = locate(indexFile);
        if (located.isEmpty()) {
            log.debug("No configuration file found; using defaults");
            return AuditConfig.defaults();
        }
        return load(located.get());
    }

    /**
     * Finds a default configuration file.
     *
     * @param indexFile ecosystem index being audited, may be null
     * @return configuration file next to the index, or in the working directory
     */
    public static Optional<Path> locate(Path indexFile) {
        List<Path> directories = new ArrayList<>();
        if (indexFile != null) {
            Path parent = indexFile.toAbsolutePath().getParent();
            if (parent != null) {
                directories.add(parent);
            }
        }
        directories.add(Path.of("").toAbsolutePath());

        for (Path directory : directories) {
            for (String fileName : DEFAULT_FILE_NAMES) {
                Path candidate = directory.resolve(fileName);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code ecoauditor.yaml}, may be null
     * @return loaded configuration or defaults if unavailable
     */
    public static AuditConfig load(Path configPath) {
        if (configPath == null) {
            return AuditConfig.defaults();
        }

        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        AuditConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), AuditConfig.class);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AuditConfig.defaults();
        }
        if (config == null) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return AuditConfig.defaults();
        }

        Path baseDir = configPath.toAbsolutePath().getParent();
        AuditConfig resolved = resolveFiles(config, baseDir);
        checkTimeLimits(resolved);
        log.info("Loaded configuration from: {}", configPath);
        return resolved;
    }

    private static AuditConfig resolveFiles(AuditConfig config, Path baseDir) {
        String overridesDir = config.overridesDir() != null
            ? resolve(baseDir, config.overridesDir()).toString()
            : null;
        if (overridesDir != null && !Files.isDirectory(Path.of(overridesDir))) {
            log.warn("Configured overrides_dir does not exist: {}", overridesDir);
        }

        List<TerminologyEntry> terminology = new ArrayList<>(config.terminology());
        String terminologyFile = null;
        if (config.terminologyFile() != null) {
            Path file = resolve(baseDir, config.terminologyFile());
            terminologyFile = file.toString();
            terminology.addAll(readTerminology(file));
        }
        return config.withResolvedFiles(terminology, terminologyFile, overridesDir);
    }

    private static List<TerminologyEntry> readTerminology(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Terminology file not found: {}. Only inline terminology is checked.", file);
            return List.of();
        }
        try {
            List<TerminologyEntry> entries = YAML_MAPPER.readValue(file.toFile(), TERMINOLOGY_LIST);
            if (entries == null) {
                return List.of();
            }
            log.debug("Loaded {} terminology entries from {}", entries.size(), file);
            return entries;
        } catch (IOException e) {
            log.warn("Failed to parse terminology file: {}. Only inline terminology is checked. Error: {}",
                file, e.getMessage());
            return List.of();
        }
    }

    private static void checkTimeLimits(AuditConfig config) {
        if (config.probeBudgetMs() < config.timeoutMs()) {
            log.warn("probe_budget_ms ({}) is shorter than timeout_ms ({}); slow links will be abandoned "
                + "instead of timing out", config.probeBudgetMs(), config.timeoutMs());
        }
    }

    private static Path resolve(Path baseDir, String location) {
        Path path = Path.of(location);
        if (path.isAbsolute() || baseDir == null) {
            return path.normalize();
        }
        return baseDir.resolve(path).normalize();
    }
}
