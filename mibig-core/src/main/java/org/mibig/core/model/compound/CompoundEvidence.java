package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Evidence;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * How a compound structure was elucidated.
 *
 * @param method one of {@link #VALID_METHODS}
 * @param references supporting citations
 */
public record CompoundEvidence(String method, List<Citation> references) implements Evidence {

    public static final Set<String> VALID_METHODS = Set.of(
        "NMR",
        "Mass spectrometry",
        "MS/MS",
        "X-ray cristallography",
        "Chemical derivatisation",
        "Total synthesis"
    );

    public CompoundEvidence {
        Objects.requireNonNull(method, "method must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public Set<String> validMethods() {
        return VALID_METHODS;
    }

    public static CompoundEvidence fromJson(JsonNode node) {
        return Evidence.read(node, "CompoundEvidence", CompoundEvidence::new);
    }
}
