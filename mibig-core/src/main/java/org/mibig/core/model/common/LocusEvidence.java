package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evidence that a locus encodes the cluster.
 *
 * @param method one of {@link #VALID_METHODS}
 * @param references supporting citations
 */
public record LocusEvidence(String method, List<Citation> references) implements Evidence {

    public static final Set<String> VALID_METHODS = Set.of(
        "Homology-based prediction",
        "Correlation of genomic and metabolomic data",
        "Gene expression correlated with compound production",
        "Knock-out studies",
        "Enzymatic assays",
        "Heterologous expression",
        "In vitro expression"
    );

    public LocusEvidence {
        Objects.requireNonNull(method, "method must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public Set<String> validMethods() {
        return VALID_METHODS;
    }

    public static LocusEvidence fromJson(JsonNode node) {
        return Evidence.read(node, "LocusEvidence", LocusEvidence::new);
    }
}
