package org.mibig.core.migration;

import org.mibig.core.legacy.LegacyNonCanonical;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.NcaEvidence;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.model.domain.AdenylationSubstrate;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainInfo;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.model.module.Iterations;
import org.mibig.core.model.module.NonCanonicalActivity;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conversions shared by several migrators.
 */
final class LegacyConversions {

    /** v3 amino acid names that differ from the current substrate table. */
    static final Map<String, String> AMINO_ACID_ALIASES = Map.of(
        "glutamate", "glutamic acid",
        "aspartate", "aspartic acid"
    );

    private LegacyConversions() {
        // Utility class
    }

    static List<GeneId> geneIds(List<String> ids) {
        return ids.stream().map(GeneId::new).toList();
    }

    static List<Citation> citations(List<String> publications) {
        return publications.stream().map(Citation::fromText).toList();
    }

    /**
     * Domains migrated from v3 carry no coordinates.
     */
    static Domain domain(DomainType type, GeneId gene, DomainInfo info) {
        return new Domain(type, gene, Location.UNKNOWN, info);
    }

    static String normalizedAminoAcid(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return AMINO_ACID_ALIASES.getOrDefault(lower, lower);
    }

    static boolean isProteinogenic(String name) {
        return AdenylationSubstrate.PROTEINOGENIC_SUBSTRATES.containsKey(normalizedAminoAcid(name));
    }

    /**
     * Builds an adenylation substrate. Proteinogenic names are normalized to the substrate table.
     */
    static AdenylationSubstrate adenylationSubstrate(String name, boolean proteinogenic, String structure) {
        String resolved = proteinogenic ? normalizedAminoAcid(name) : name;
        Smiles smiles = structure == null || structure.isBlank() ? null : new Smiles(structure);
        return new AdenylationSubstrate(resolved, proteinogenic, smiles);
    }

    /**
     * Converts non-canonical module behaviour. An iterated module gets an unspecified
     * iteration count.
     */
    static NonCanonicalActivity nonCanonical(LegacyNonCanonical legacy) {
        if (legacy == null) {
            return null;
        }
        Iterations iterations = Boolean.TRUE.equals(legacy.iterated()) ? Iterations.UNSPECIFIED : null;
        return new NonCanonicalActivity(
            EvidenceFilter.convert(legacy.evidence(), NcaEvidence::new),
            iterations,
            legacy.nonElongating(),
            legacy.skipped());
    }
}
