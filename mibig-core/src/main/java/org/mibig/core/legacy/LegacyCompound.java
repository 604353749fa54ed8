package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Compound produced by a v3 cluster.
 *
 * @param activities chemical activities
 * @param moieties chemical moieties
 * @param structure SMILES, optional
 * @param synonyms alternative names
 * @param targets molecular targets
 * @param name compound name
 * @param databaseIds {@code db:id} cross references
 * @param evidence structure evidence
 * @param massSpecIonType ion type, optional
 * @param molecularMass mass, optional
 * @param molecularFormula formula, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyCompound(
    @JsonProperty("chem_acts") List<String> activities,
    @JsonProperty("chem_moieties") List<Moiety> moieties,
    @JsonProperty("chem_struct") String structure,
    @JsonProperty("chem_synonyms") List<String> synonyms,
    @JsonProperty("chem_targets") List<Target> targets,
    @JsonProperty("compound") String name,
    @JsonProperty("database_id") List<String> databaseIds,
    @JsonProperty("evidence") List<String> evidence,
    @JsonProperty("mass_spec_ion_type") String massSpecIonType,
    @JsonProperty("mol_mass") Double molecularMass,
    @JsonProperty("molecular_formula") String molecularFormula
) {
    public LegacyCompound {
        activities = activities == null ? List.of() : List.copyOf(activities);
        moieties = moieties == null ? List.of() : List.copyOf(moieties);
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        targets = targets == null ? List.of() : List.copyOf(targets);
        databaseIds = databaseIds == null ? List.of() : List.copyOf(databaseIds);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Moiety(
        @JsonProperty("moiety") String moiety,
        @JsonProperty("subcluster") List<String> subcluster
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Target(
        @JsonProperty("publications") List<String> publications,
        @JsonProperty("target") String target
    ) {}
}
