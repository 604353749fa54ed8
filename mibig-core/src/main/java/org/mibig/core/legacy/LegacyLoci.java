package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Locus of the cluster on its nucleotide record.
 *
 * @param accession nucleotide accession
 * @param completeness {@code complete}, {@code incomplete} or {@code Unknown}
 * @param startCoord 1-based start, optional
 * @param endCoord end, optional
 * @param mixsCompliant MIxS flag, optional
 * @param evidence evidence methods for the locus boundaries, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyLoci(
    @JsonProperty("accession") String accession,
    @JsonProperty("completeness") String completeness,
    @JsonProperty("start_coord") Integer startCoord,
    @JsonProperty("end_coord") Integer endCoord,
    @JsonProperty("mixs_compliant") Boolean mixsCompliant,
    @JsonProperty("evidence") List<String> evidence
) {
    public LegacyLoci {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
