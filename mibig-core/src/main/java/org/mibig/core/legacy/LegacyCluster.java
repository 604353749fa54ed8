package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.mibig.core.error.LegacyFormatException;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The {@code cluster} object of a v3 document.
 *
 * <p>Each biosynthetic class may come with its own sub-object ({@code nrp}, {@code polyketide},
 * ...). Those are optional even when the class is listed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyCluster(
    @JsonProperty("biosyn_class") List<String> biosyntheticClasses,
    @JsonProperty("mibig_accession") String accession,
    @JsonProperty("compounds") List<LegacyCompound> compounds,
    @JsonProperty("publications") List<String> publications,
    @JsonProperty("organism_name") String organismName,
    @JsonProperty("ncbi_tax_id") String ncbiTaxId,
    @JsonProperty("minimal") Boolean minimal,
    @JsonProperty("status") String status,
    @JsonProperty("retirement_reasons") List<String> retirementReasons,
    @JsonProperty("see_also") List<String> seeAlso,
    @JsonProperty("loci") LegacyLoci loci,
    @JsonProperty("genes") LegacyGenes genes,
    @JsonProperty("alkaloid") LegacySubclass alkaloid,
    @JsonProperty("nrp") LegacyNrp nrp,
    @JsonProperty("other") LegacySubclass other,
    @JsonProperty("polyketide") LegacyPolyketide polyketide,
    @JsonProperty("ripp") LegacyRipp ripp,
    @JsonProperty("saccharide") LegacySaccharide saccharide,
    @JsonProperty("terpene") LegacyTerpene terpene
) {
    public static final Set<String> BIOSYNTHETIC_CLASSES =
        Set.of("Alkaloid", "NRP", "Other", "Polyketide", "RiPP", "Saccharide", "Terpene");

    private static final Pattern ACCESSION = Pattern.compile("^BGC\\d{7}$");

    public LegacyCluster {
        if (biosyntheticClasses == null || biosyntheticClasses.isEmpty()) {
            throw new LegacyFormatException("Missing 'biosyn_class'");
        }
        for (String biosyntheticClass : biosyntheticClasses) {
            if (!BIOSYNTHETIC_CLASSES.contains(biosyntheticClass)) {
                throw new LegacyFormatException("Unknown biosynthetic class '" + biosyntheticClass + "'");
            }
        }
        if (accession == null || !ACCESSION.matcher(accession).matches()) {
            throw new LegacyFormatException("Invalid accession '" + accession + "'");
        }
        biosyntheticClasses = List.copyOf(biosyntheticClasses);
        compounds = compounds == null ? List.of() : List.copyOf(compounds);
        publications = publications == null ? List.of() : List.copyOf(publications);
        retirementReasons = retirementReasons == null ? List.of() : List.copyOf(retirementReasons);
        seeAlso = seeAlso == null ? List.of() : List.copyOf(seeAlso);
        if (status == null) {
            status = "active";
        }
    }
}
