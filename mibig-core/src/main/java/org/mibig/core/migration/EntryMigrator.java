package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyCluster;
import org.mibig.core.legacy.LegacyEntry;
import org.mibig.core.legacy.LegacyLoci;
import org.mibig.core.model.biosynthesis.Biosynthesis;
import org.mibig.core.model.biosynthesis.Operon;
import org.mibig.core.model.changelog.ChangeLog;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.LocusEvidence;
import org.mibig.core.model.compound.Compound;
import org.mibig.core.model.entry.CompletenessLevel;
import org.mibig.core.model.entry.Locus;
import org.mibig.core.model.entry.MibigEntry;
import org.mibig.core.model.entry.StatusLevel;
import org.mibig.core.model.entry.Taxonomy;
import org.mibig.core.model.gene.Genes;
import org.mibig.core.validation.QualityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Migrates a MIBiG v3 entry to the current schema.
 *
 * <p>Migration is a single forward pass with no I/O. The result is built without validation and
 * is marked {@link QualityLevel#QUESTIONABLE}: imported entries stay questionable until curated.
 * Callers validate it with {@code entry.context(record).check(entry)}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LegacyEntry legacy = LegacyReader.read(Path.of("BGC0000001.json"));
 * MibigEntry entry = new EntryMigrator().migrate(legacy);
 * }</pre>
 */
public class EntryMigrator {

    private static final Logger log = LoggerFactory.getLogger(EntryMigrator.class);

    public static final Map<String, CompletenessLevel> COMPLETENESS_MAPPING = Map.of(
        "complete", CompletenessLevel.COMPLETE,
        "incomplete", CompletenessLevel.PARTIAL,
        "Unknown", CompletenessLevel.UNKNOWN
    );

    private final ChangelogMigrator changelogMigrator;
    private final BiosynthesisMigrator biosynthesisMigrator;
    private final GeneMigrator geneMigrator;
    private final CompoundMigrator compoundMigrator;

    public EntryMigrator() {
        this(new ChangelogMigrator(), new BiosynthesisMigrator(), new GeneMigrator(), new CompoundMigrator());
    }

    public EntryMigrator(
        ChangelogMigrator changelogMigrator,
        BiosynthesisMigrator biosynthesisMigrator,
        GeneMigrator geneMigrator,
        CompoundMigrator compoundMigrator
    ) {
        this.changelogMigrator = changelogMigrator;
        this.biosynthesisMigrator = biosynthesisMigrator;
        this.geneMigrator = geneMigrator;
        this.compoundMigrator = compoundMigrator;
    }

    /**
     * @param legacy decoded v3 entry
     * @return the migrated entry, not yet validated
     * @throws MigrationException if any part of the entry cannot be migrated
     */
    public MibigEntry migrate(LegacyEntry legacy) {
        LegacyCluster cluster = legacy.cluster();
        log.info("Migrating {}", cluster.accession());

        ChangeLog changelog = changelogMigrator.migrate(legacy.changelog());
        StatusLevel status = status(cluster.status());

        if (cluster.loci() == null) {
            throw new MigrationException("Entry " + cluster.accession() + " has no loci");
        }
        CompletenessLevel completeness = COMPLETENESS_MAPPING.get(cluster.loci().completeness());
        if (completeness == null) {
            throw new MigrationException("Unknown completeness '" + cluster.loci().completeness() + "'");
        }

        List<Operon> operons = geneMigrator.migrateOperons(cluster.genes());
        Biosynthesis biosynthesis = biosynthesisMigrator.migrate(cluster, operons);
        Genes genes = geneMigrator.migrate(cluster.genes());
        List<Compound> compounds = compoundMigrator.migrate(cluster.compounds());

        List<String> retirementReasons = status == StatusLevel.RETIRED ? cluster.retirementReasons() : List.of();

        MibigEntry entry = new MibigEntry(
            cluster.accession(),
            changelog.releases().size() + 1,
            changelog,
            QualityLevel.QUESTIONABLE,
            status,
            completeness,
            List.of(locus(cluster.loci())),
            biosynthesis,
            compounds,
            taxonomy(cluster),
            genes,
            retirementReasons,
            cluster.seeAlso(),
            legacy.comments());
        log.debug("Migrated {}: {} classes, {} modules, {} compounds", entry.accession(),
            biosynthesis.classes().size(), biosynthesis.modules().size(), compounds.size());
        return entry;
    }

    /**
     * Missing coordinates become 0.
     */
    static Locus locus(LegacyLoci loci) {
        int start = loci.startCoord() == null ? 0 : loci.startCoord();
        int end = loci.endCoord() == null ? 0 : loci.endCoord();
        return new Locus(
            loci.accession(),
            new Location(start, end),
            EvidenceFilter.convert(loci.evidence(), LocusEvidence::new));
    }

    private static Taxonomy taxonomy(LegacyCluster cluster) {
        try {
            return new Taxonomy(cluster.organismName(), Integer.parseInt(cluster.ncbiTaxId()));
        } catch (NumberFormatException e) {
            throw new MigrationException("Invalid NCBI taxonomy id '" + cluster.ncbiTaxId() + "'");
        }
    }

    private static StatusLevel status(String value) {
        return Arrays.stream(StatusLevel.values())
            .filter(level -> level.value().equals(value))
            .findFirst()
            .orElseThrow(() -> new MigrationException("Unknown status '" + value + "'"));
    }
}
