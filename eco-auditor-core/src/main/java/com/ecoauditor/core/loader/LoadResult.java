package com.ecoauditor.core.loader;

import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.model.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Output of the metadata loader.
 *
 * @param index loaded ecosystem index
 * @param findings problems found in individual records while loading
 */
public record LoadResult(EcosystemIndex index, List<Finding> findings) {

    public LoadResult {
        Objects.requireNonNull(index, "index must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
