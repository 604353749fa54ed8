package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyCluster;
import org.mibig.core.legacy.LegacyRipp;
import org.mibig.core.legacy.LegacySaccharide;
import org.mibig.core.legacy.LegacySubclass;
import org.mibig.core.legacy.LegacyTerpene;
import org.mibig.core.model.biosynthesis.Biosynthesis;
import org.mibig.core.model.biosynthesis.Operon;
import org.mibig.core.model.biosynthesis.classes.BiosynthesisClass;
import org.mibig.core.model.biosynthesis.classes.Crosslink;
import org.mibig.core.model.biosynthesis.classes.Glycosyltransferase;
import org.mibig.core.model.biosynthesis.classes.OtherClass;
import org.mibig.core.model.biosynthesis.classes.Precursor;
import org.mibig.core.model.biosynthesis.classes.Ribosomal;
import org.mibig.core.model.biosynthesis.classes.Saccharide;
import org.mibig.core.model.biosynthesis.classes.Subcluster;
import org.mibig.core.model.biosynthesis.classes.SynthesisType;
import org.mibig.core.model.biosynthesis.classes.Terpene;
import org.mibig.core.model.common.GTEvidence;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.module.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Migrates the biosynthetic classes of a v3 cluster and collects the modules they define.
 *
 * <p>Alkaloids are no longer a class of their own and become {@code other}.
 */
public class BiosynthesisMigrator {

    private static final Logger log = LoggerFactory.getLogger(BiosynthesisMigrator.class);

    public static final Map<String, SynthesisType> CLASS_MAPPING = Map.of(
        "NRP", SynthesisType.NRPS,
        "Polyketide", SynthesisType.PKS,
        "RiPP", SynthesisType.RIBOSOMAL,
        "Saccharide", SynthesisType.SACCHARIDE,
        "Terpene", SynthesisType.TERPENE,
        "Other", SynthesisType.OTHER
    );

    public static final String ALKALOID = "Alkaloid";
    public static final String ALKALOID_DETAILS = "converted from 'Alkaloid'";
    public static final String NO_DETAILS = "converted from v3 without extra details";

    private final NrpsMigrator nrpsMigrator;
    private final PksMigrator pksMigrator;

    public BiosynthesisMigrator() {
        this(new NrpsMigrator(), new PksMigrator());
    }

    public BiosynthesisMigrator(NrpsMigrator nrpsMigrator, PksMigrator pksMigrator) {
        this.nrpsMigrator = nrpsMigrator;
        this.pksMigrator = pksMigrator;
    }

    /**
     * Migrates every listed class, in order.
     *
     * @param cluster v3 cluster
     * @param operons operons migrated from the gene section
     * @throws MigrationException for an unknown class name or unsupported class content
     */
    public Biosynthesis migrate(LegacyCluster cluster, List<Operon> operons) {
        List<BiosynthesisClass> classes = new ArrayList<>();
        List<Module> modules = new ArrayList<>();
        String otherSubclass = null;
        String otherDetails = null;

        for (String legacyClass : cluster.biosyntheticClasses()) {
            SynthesisType type = CLASS_MAPPING.get(legacyClass);
            if (type == null) {
                if (!ALKALOID.equals(legacyClass)) {
                    throw new MigrationException("Unknown biosynthetic class '" + legacyClass + "'");
                }
                type = SynthesisType.OTHER;
                otherSubclass = OtherClass.OTHER;
                otherDetails = ALKALOID_DETAILS;
            }

            ClassMigration migration = switch (type) {
                case NRPS -> nrpsMigrator.migrate(cluster.nrp());
                case PKS -> pksMigrator.migrate(cluster.polyketide());
                case RIBOSOMAL -> ClassMigration.of(ribosomal(cluster.ripp()));
                case SACCHARIDE -> ClassMigration.of(saccharide(cluster.saccharide()));
                case TERPENE -> ClassMigration.of(terpene(cluster.terpene()));
                case OTHER -> ClassMigration.of(other(cluster.other(), otherSubclass, otherDetails));
            };
            log.debug("Migrated class {} as {}", legacyClass, type.value());
            classes.add(new BiosynthesisClass(type, migration.info()));
            modules.addAll(migration.modules());
        }

        return new Biosynthesis(classes, modules, operons, List.of());
    }

    static OtherClass other(LegacySubclass other, String fallbackSubclass, String fallbackDetails) {
        if (other != null) {
            String subclass = other.subclass() == null ? "unknown" : other.subclass().toLowerCase(Locale.ROOT);
            if ("unknown".equals(subclass) || OtherClass.OTHER.equals(subclass)) {
                return new OtherClass(OtherClass.OTHER, NO_DETAILS);
            }
            return new OtherClass(subclass, null);
        }
        if (fallbackSubclass != null) {
            return new OtherClass(fallbackSubclass, fallbackDetails);
        }
        return new OtherClass(OtherClass.OTHER, NO_DETAILS);
    }

    /**
     * Glycosyltransferase specificity cannot be derived from v3 data; every migrated
     * glycosyltransferase carries {@link Glycosyltransferase#UNMIGRATED_SPECIFICITY}.
     */
    static Saccharide saccharide(LegacySaccharide saccharide) {
        if (saccharide == null) {
            return new Saccharide(null, List.of(), List.of());
        }
        List<Glycosyltransferase> glycosyltransferases = new ArrayList<>();
        for (LegacySaccharide.Glycosyltransferase legacy : saccharide.glycosyltransferases()) {
            glycosyltransferases.add(new Glycosyltransferase(
                new GeneId(legacy.geneId()),
                EvidenceFilter.convert(legacy.evidence(), GTEvidence::new),
                Glycosyltransferase.UNMIGRATED_SPECIFICITY));
        }
        List<Subcluster> subclusters = new ArrayList<>();
        for (List<String> genes : saccharide.sugarSubclusters()) {
            subclusters.add(new Subcluster(LegacyConversions.geneIds(genes), List.of()));
        }
        return new Saccharide(saccharide.subclass(), glycosyltransferases, subclusters);
    }

    static Terpene terpene(LegacyTerpene terpene) {
        if (terpene == null) {
            return new Terpene("Unknown", List.of(), List.of(), null);
        }
        return new Terpene(
            terpene.carbonCountSubclass(),
            LegacyConversions.geneIds(terpene.prenyltransferases()),
            LegacyConversions.geneIds(terpene.synthases()),
            terpene.precursor());
    }

    /**
     * A v3 subclass naming a known RiPP type becomes that type; anything else is unmodified.
     * The leader cleavage site is placed at the end of the leader sequence.
     */
    static Ribosomal ribosomal(LegacyRipp ripp) {
        if (ripp == null) {
            return new Ribosomal(Ribosomal.RIPP, List.of(), null, null, List.of());
        }

        String subclass;
        String rippType;
        if (ripp.subclass() != null && Ribosomal.VALID_RIPP_TYPES.contains(ripp.subclass())) {
            subclass = Ribosomal.RIPP;
            rippType = ripp.subclass();
        } else {
            subclass = Ribosomal.UNMODIFIED;
            rippType = null;
        }

        List<Precursor> precursors = new ArrayList<>();
        for (LegacyRipp.PrecursorGene legacy : ripp.precursorGenes()) {
            precursors.add(precursor(legacy));
        }

        return new Ribosomal(subclass, precursors, rippType, null, LegacyConversions.geneIds(ripp.peptidases()));
    }

    private static Precursor precursor(LegacyRipp.PrecursorGene legacy) {
        if (legacy.coreSequence().size() != 1) {
            throw new MigrationException(String.format(
                "Precursor %s has %d core sequences, expected exactly one",
                legacy.geneId(), legacy.coreSequence().size()));
        }

        List<Crosslink> crosslinks = new ArrayList<>();
        for (LegacyRipp.Crosslink crosslink : legacy.crosslinks()) {
            if (crosslink.firstPosition() == null || crosslink.secondPosition() == null) {
                throw new MigrationException("Crosslink on precursor " + legacy.geneId() + " lacks a residue position");
            }
            crosslinks.add(new Crosslink(crosslink.firstPosition(), crosslink.secondPosition(), crosslink.type(), null));
        }

        Location leaderCleavage = null;
        String leader = legacy.leaderSequence();
        if (leader != null && !leader.isEmpty()) {
            leaderCleavage = new Location(leader.length() - 1, leader.length());
        }

        return new Precursor(
            new GeneId(legacy.geneId()),
            legacy.coreSequence().get(0),
            leaderCleavage,
            null,
            crosslinks,
            legacy.recognitionMotif());
    }
}
