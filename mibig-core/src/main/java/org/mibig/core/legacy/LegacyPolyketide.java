package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Polyketide sub-object of a v3 cluster.
 *
 * @param cyclases cyclase genes
 * @param cyclic whether the product is cyclic
 * @param ketideLength number of ketide units, optional
 * @param releaseTypes release types
 * @param starterUnit starter units
 * @param subclasses subclasses, e.g. {@code Modular type I}
 * @param synthases synthases
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyPolyketide(
    @JsonProperty("cyclases") List<String> cyclases,
    @JsonProperty("cyclic") Boolean cyclic,
    @JsonProperty("ketide_length") Integer ketideLength,
    @JsonProperty("release_type") List<String> releaseTypes,
    @JsonProperty("starter_unit") List<String> starterUnit,
    @JsonProperty("subclasses") List<String> subclasses,
    @JsonProperty("synthases") List<Synthase> synthases
) {
    public LegacyPolyketide {
        cyclases = cyclases == null ? List.of() : List.copyOf(cyclases);
        releaseTypes = releaseTypes == null ? List.of() : List.copyOf(releaseTypes);
        starterUnit = starterUnit == null ? List.of() : List.copyOf(starterUnit);
        subclasses = subclasses == null ? List.of() : List.copyOf(subclasses);
        synthases = synthases == null ? List.of() : List.copyOf(synthases);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Synthase(
        @JsonProperty("genes") List<String> genes,
        @JsonProperty("iterative") Iterative iterative,
        @JsonProperty("modules") List<PksModule> modules,
        @JsonProperty("pufa_modification_domains") List<String> pufaModificationDomains,
        @JsonProperty("subclass") List<String> subclasses,
        @JsonProperty("thioesterases") List<LegacyThioesterase> thioesterases,
        @JsonProperty("trans_at") TransAt transAt
    ) {
        public Synthase {
            genes = genes == null ? List.of() : List.copyOf(genes);
            modules = modules == null ? List.of() : List.copyOf(modules);
            pufaModificationDomains = pufaModificationDomains == null ? List.of() : List.copyOf(pufaModificationDomains);
            subclasses = subclasses == null ? List.of() : List.copyOf(subclasses);
            thioesterases = thioesterases == null ? List.of() : List.copyOf(thioesterases);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Iterative(
        @JsonProperty("cyclization_type") String cyclizationType,
        @JsonProperty("subtype") String subtype,
        @JsonProperty("evidence") String evidence,
        @JsonProperty("genes") List<String> genes
    ) {}

    /**
     * One PKS module. Core and tailoring domains share the free-text {@code domains} list.
     *
     * @param atSpecificities acyltransferase substrates
     * @param comments free text
     * @param domains domain names
     * @param evidence evidence for the AT specificity, optional
     * @param genes genes the module spans
     * @param krStereochem {@code L-OH}, {@code D-OH}, {@code Inactive} or {@code Unknown}
     * @param moduleNumber module name
     * @param nonCanonical non-canonical behaviour, optional
     * @param modificationDomains additional modification domain names
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PksModule(
        @JsonProperty("at_specificities") List<String> atSpecificities,
        @JsonProperty("comments") String comments,
        @JsonProperty("domains") List<String> domains,
        @JsonProperty("evidence") String evidence,
        @JsonProperty("genes") List<String> genes,
        @JsonProperty("kr_stereochem") String krStereochem,
        @JsonProperty("module_number") String moduleNumber,
        @JsonProperty("non_canonical") LegacyNonCanonical nonCanonical,
        @JsonProperty("pks_mod_doms") List<String> modificationDomains
    ) {
        public PksModule {
            atSpecificities = atSpecificities == null ? List.of() : List.copyOf(atSpecificities);
            domains = domains == null ? List.of() : List.copyOf(domains);
            genes = genes == null ? List.of() : List.copyOf(genes);
            modificationDomains = modificationDomains == null ? List.of() : List.copyOf(modificationDomains);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransAt(@JsonProperty("genes") List<String> genes) {}
}
