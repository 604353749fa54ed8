package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evidence that a set of genes forms an operon.
 *
 * @param method one of {@link #VALID_METHODS}
 * @param references supporting citations
 */
public record OperonEvidence(String method, List<Citation> references) implements Evidence {

    public static final Set<String> VALID_METHODS = Set.of(
        SEQUENCE_BASED_PREDICTION,
        "RACE",
        "ChIPseq",
        "RNAseq",
        "rt-PCR"
    );

    public OperonEvidence {
        Objects.requireNonNull(method, "method must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public Set<String> validMethods() {
        return VALID_METHODS;
    }

    public static OperonEvidence fromJson(JsonNode node) {
        return Evidence.read(node, "OperonEvidence", OperonEvidence::new);
    }
}
