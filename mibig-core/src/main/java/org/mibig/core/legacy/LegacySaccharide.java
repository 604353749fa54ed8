package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Saccharide sub-object of a v3 cluster.
 *
 * @param glycosyltransferases glycosyltransferases
 * @param subclass subclass, optional
 * @param sugarSubclusters groups of genes making one sugar
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacySaccharide(
    @JsonProperty("glycosyltransferases") List<Glycosyltransferase> glycosyltransferases,
    @JsonProperty("subclass") String subclass,
    @JsonProperty("sugar_subclusters") List<List<String>> sugarSubclusters
) {
    public LegacySaccharide {
        glycosyltransferases = glycosyltransferases == null ? List.of() : List.copyOf(glycosyltransferases);
        sugarSubclusters = sugarSubclusters == null ? List.of() : List.copyOf(sugarSubclusters);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Glycosyltransferase(
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("gene_id") String geneId,
        @JsonProperty("specificity") String specificity
    ) {
        public Glycosyltransferase {
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
        }
    }
}
