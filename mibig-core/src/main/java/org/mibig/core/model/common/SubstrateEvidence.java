package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evidence for the substrate specificity of a domain.
 *
 * @param method one of {@link #VALID_METHODS}
 * @param references supporting citations
 */
public record SubstrateEvidence(String method, List<Citation> references) implements Evidence {

    public static final Set<String> VALID_METHODS = Set.of(
        "Activity assay",
        "ACVS assay",
        "ATP-PPi exchange assay",
        "Enzyme-coupled assay",
        "Feeding study",
        "Heterologous expression",
        "Homology",
        "HPLC",
        "In-vitro experiments",
        "Knock-out studies",
        "Mass spectrometry",
        "NMR",
        "Radio labelling",
        SEQUENCE_BASED_PREDICTION,
        "Steady-state kinetics",
        "Structure-based inference",
        "X-ray crystallography"
    );

    public SubstrateEvidence {
        Objects.requireNonNull(method, "method must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public Set<String> validMethods() {
        return VALID_METHODS;
    }

    public static SubstrateEvidence fromJson(JsonNode node) {
        return Evidence.read(node, "SubstrateEvidence", SubstrateEvidence::new);
    }
}
