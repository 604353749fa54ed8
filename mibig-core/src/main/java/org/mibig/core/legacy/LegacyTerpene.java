package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terpene sub-object of a v3 cluster.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyTerpene(
    @JsonProperty("carbon_count_subclass") String carbonCountSubclass,
    @JsonProperty("prenyltransferases") List<String> prenyltransferases,
    @JsonProperty("structural_subclass") String structuralSubclass,
    @JsonProperty("terpene_precursor") String precursor,
    @JsonProperty("terpene_synth_cycl") List<String> synthases
) {
    public LegacyTerpene {
        prenyltransferases = prenyltransferases == null ? List.of() : List.copyOf(prenyltransferases);
        synthases = synthases == null ? List.of() : List.copyOf(synthases);
    }
}
