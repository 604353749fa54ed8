package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * NRP sub-object of a v3 cluster.
 *
 * @param cyclic whether the product is cyclic
 * @param lipidMoiety lipid moiety, optional
 * @param nrpsGenes NRPS genes with their modules
 * @param releaseTypes release types
 * @param subclass subclass, optional
 * @param thioesterases thioesterases
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyNrp(
    @JsonProperty("cyclic") Boolean cyclic,
    @JsonProperty("lipid_moiety") String lipidMoiety,
    @JsonProperty("nrps_genes") List<NrpsGene> nrpsGenes,
    @JsonProperty("release_type") List<String> releaseTypes,
    @JsonProperty("subclass") String subclass,
    @JsonProperty("thioesterases") List<LegacyThioesterase> thioesterases
) {
    public LegacyNrp {
        nrpsGenes = nrpsGenes == null ? List.of() : List.copyOf(nrpsGenes);
        releaseTypes = releaseTypes == null ? List.of() : List.copyOf(releaseTypes);
        thioesterases = thioesterases == null ? List.of() : List.copyOf(thioesterases);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NrpsGene(
        @JsonProperty("gene_id") String geneId,
        @JsonProperty("modules") List<NrpsModule> modules
    ) {
        public NrpsGene {
            modules = modules == null ? List.of() : List.copyOf(modules);
        }
    }

    /**
     * One NRPS module.
     *
     * @param specificity adenylation specificity, optional
     * @param active whether the module is active
     * @param condensationType condensation domain subtype, optional
     * @param comments free text
     * @param modificationDomains modification domain names
     * @param moduleNumber module name, optional
     * @param nonCanonical non-canonical behaviour, optional
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NrpsModule(
        @JsonProperty("a_substr_spec") Specificity specificity,
        @JsonProperty("active") Boolean active,
        @JsonProperty("c_dom_subtype") String condensationType,
        @JsonProperty("comments") String comments,
        @JsonProperty("modification_domains") List<String> modificationDomains,
        @JsonProperty("module_number") String moduleNumber,
        @JsonProperty("non_canonical") LegacyNonCanonical nonCanonical
    ) {
        public NrpsModule {
            modificationDomains = modificationDomains == null ? List.of() : List.copyOf(modificationDomains);
        }

        public boolean isActive() {
            return active == null || active;
        }
    }

    /**
     * Adenylation domain specificity. Substrates are split into proteinogenic and
     * non-proteinogenic names.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Specificity(
        @JsonProperty("aa_subcluster") List<String> subcluster,
        @JsonProperty("epimerized") Boolean epimerized,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("nonproteinogenic") List<String> nonProteinogenic,
        @JsonProperty("proteinogenic") List<String> proteinogenic,
        @JsonProperty("publications") List<String> publications
    ) {
        public Specificity {
            subcluster = subcluster == null ? List.of() : List.copyOf(subcluster);
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
            nonProteinogenic = nonProteinogenic == null ? List.of() : List.copyOf(nonProteinogenic);
            proteinogenic = proteinogenic == null ? List.of() : List.copyOf(proteinogenic);
            publications = publications == null ? List.of() : List.copyOf(publications);
        }

        public boolean isEpimerized() {
            return Boolean.TRUE.equals(epimerized);
        }
    }
}
