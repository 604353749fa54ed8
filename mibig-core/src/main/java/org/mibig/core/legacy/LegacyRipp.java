package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * RiPP sub-object of a v3 cluster.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyRipp(
    @JsonProperty("cyclic") Boolean cyclic,
    @JsonProperty("peptidases") List<String> peptidases,
    @JsonProperty("precursor_genes") List<PrecursorGene> precursorGenes,
    @JsonProperty("subclass") String subclass
) {
    public LegacyRipp {
        peptidases = peptidases == null ? List.of() : List.copyOf(peptidases);
        precursorGenes = precursorGenes == null ? List.of() : List.copyOf(precursorGenes);
    }

    /**
     * Precursor peptide gene. {@code core_sequence} is a list on the wire although every known
     * record holds a single sequence.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PrecursorGene(
        @JsonProperty("gene_id") String geneId,
        @JsonProperty("core_sequence") List<String> coreSequence,
        @JsonProperty("cleavage_recogn_site") List<String> cleavageRecognitionSites,
        @JsonProperty("crosslinks") List<Crosslink> crosslinks,
        @JsonProperty("follower_sequence") String followerSequence,
        @JsonProperty("leader_sequence") String leaderSequence,
        @JsonProperty("recognition_motif") String recognitionMotif
    ) {
        public PrecursorGene {
            coreSequence = coreSequence == null ? List.of() : List.copyOf(coreSequence);
            cleavageRecognitionSites = cleavageRecognitionSites == null ? List.of() : List.copyOf(cleavageRecognitionSites);
            crosslinks = crosslinks == null ? List.of() : List.copyOf(crosslinks);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Crosslink(
        @JsonProperty("crosslink_type") String type,
        @JsonProperty("first_AA") Integer firstPosition,
        @JsonProperty("second_AA") Integer secondPosition
    ) {}
}
