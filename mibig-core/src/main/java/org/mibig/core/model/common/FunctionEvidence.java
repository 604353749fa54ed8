package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evidence for the function of a gene product.
 *
 * @param method one of {@link #VALID_METHODS}
 * @param references supporting citations
 */
public record FunctionEvidence(String method, List<Citation> references) implements Evidence {

    public static final Set<String> VALID_METHODS = Set.of(
        "Other in vivo study",
        "Heterologous expression",
        "Knock-out",
        "Activity assay"
    );

    public FunctionEvidence {
        Objects.requireNonNull(method, "method must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public Set<String> validMethods() {
        return VALID_METHODS;
    }

    public static FunctionEvidence fromJson(JsonNode node) {
        return Evidence.read(node, "FunctionEvidence", FunctionEvidence::new);
    }
}
