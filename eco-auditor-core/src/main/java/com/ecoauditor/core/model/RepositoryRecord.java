package com.ecoauditor.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed descriptor of one repository of the ecosystem.
 *
 * <p>{@code layer} and {@code status} are null when the descriptor omits them or declares a
 * value outside the closed enumeration; the raw declared strings are kept in
 * {@code declaredLayer} / {@code declaredStatus} so the completeness rule can report the
 * offending value.
 *
 * @param name unique repository name (primary key)
 * @param layer architectural layer, or null
 * @param declaredLayer layer exactly as written, or null when absent
 * @param status maturity status, or null
 * @param declaredStatus status exactly as written, or null when absent
 * @param shortDescription one-line description, or null
 * @param longDescription free-form description (Markdown), or null
 * @param dependencies declared dependencies in declaration order
 * @param tags tags in declaration order
 * @param license license identifier, or null
 * @param specVersion metadata spec version, or null
 * @param url repository home URL, or null
 * @param healthEndpoint health check URL, or null
 * @param links additional cross-links
 * @param lastUpdated last content or status change, or null when no signal is available
 * @param deprecated explicit deprecation flag
 * @param declaredRepoCount repository count published by this repository, or null
 */
public record RepositoryRecord(
    String name,
    Layer layer,
    String declaredLayer,
    Status status,
    String declaredStatus,
    String shortDescription,
    String longDescription,
    List<DeclaredDependency> dependencies,
    Set<String> tags,
    String license,
    String specVersion,
    String url,
    String healthEndpoint,
    List<String> links,
    LocalDate lastUpdated,
    boolean deprecated,
    Integer declaredRepoCount
) {
    /**
     * Compact constructor with validation.
     */
    public RepositoryRecord {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        links = links == null ? List.of() : List.copyOf(links);
    }

    /**
     * Returns true when the repository is flagged or declared as deprecated.
     *
     * @return whether the repository is expected to be phased out
     */
    public boolean isDeprecated() {
        return deprecated || status == Status.DEPRECATED;
    }

    /**
     * Returns names of dependencies of the given type, in declaration order.
     *
     * @param type edge type to select
     * @return dependency names
     */
    public List<String> dependencyNames(EdgeType type) {
        return dependencies.stream()
            .filter(dependency -> dependency.type() == type)
            .map(DeclaredDependency::name)
            .toList();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder, mainly used by the loader and by tests.
     */
    public static final class Builder {
        private final String name;
        private Layer layer;
        private String declaredLayer;
        private Status status;
        private String declaredStatus;
        private String shortDescription;
        private String longDescription;
        private final List<DeclaredDependency> dependencies = new ArrayList<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private String license;
        private String specVersion;
        private String url;
        private String healthEndpoint;
        private final List<String> links = new ArrayList<>();
        private LocalDate lastUpdated;
        private boolean deprecated;
        private Integer declaredRepoCount;

        private Builder(String name) {
            this.name = name;
        }

        public Builder layer(Layer value) {
            this.layer = value;
            this.declaredLayer = value == null ? null : value.wireName();
            return this;
        }

        public Builder declaredLayer(String value) {
            this.declaredLayer = value;
            this.layer = Layer.fromWireName(value).orElse(null);
            return this;
        }

        public Builder status(Status value) {
            this.status = value;
            this.declaredStatus = value == null ? null : value.wireName();
            return this;
        }

        public Builder declaredStatus(String value) {
            this.declaredStatus = value;
            this.status = Status.fromWireName(value).orElse(null);
            return this;
        }

        public Builder shortDescription(String value) {
            this.shortDescription = value;
            return this;
        }

        public Builder longDescription(String value) {
            this.longDescription = value;
            return this;
        }

        public Builder dependsOn(String... names) {
            for (String dependency : names) {
                dependencies.add(DeclaredDependency.direct(dependency));
            }
            return this;
        }

        public Builder dependsOn(String dependency, EdgeType type) {
            dependencies.add(new DeclaredDependency(dependency, type));
            return this;
        }

        public Builder dependency(DeclaredDependency dependency) {
            dependencies.add(dependency);
            return this;
        }

        public Builder tags(String... values) {
            tags.addAll(List.of(values));
            return this;
        }

        public Builder license(String value) {
            this.license = value;
            return this;
        }

        public Builder specVersion(String value) {
            this.specVersion = value;
            return this;
        }

        public Builder url(String value) {
            this.url = value;
            return this;
        }

        public Builder healthEndpoint(String value) {
            this.healthEndpoint = value;
            return this;
        }

        public Builder link(String value) {
            links.add(value);
            return this;
        }

        public Builder lastUpdated(LocalDate value) {
            this.lastUpdated = value;
            return this;
        }

        public Builder deprecated(boolean value) {
            this.deprecated = value;
            return this;
        }

        public Builder declaredRepoCount(Integer value) {
            this.declaredRepoCount = value;
            return this;
        }

        public RepositoryRecord build() {
            return new RepositoryRecord(
                name, layer, declaredLayer, status, declaredStatus,
                shortDescription, longDescription, dependencies, tags,
                license, specVersion, url, healthEndpoint, links,
                lastUpdated, deprecated, declaredRepoCount
            );
        }
    }
}
