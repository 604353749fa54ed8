package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.legacy.LegacyCluster;
import org.mibig.core.legacy.LegacyReader;
import org.mibig.core.model.biosynthesis.Biosynthesis;
import org.mibig.core.model.biosynthesis.classes.BiosynthesisClass;
import org.mibig.core.model.biosynthesis.classes.Glycosyltransferase;
import org.mibig.core.model.biosynthesis.classes.OtherClass;
import org.mibig.core.model.biosynthesis.classes.Precursor;
import org.mibig.core.model.biosynthesis.classes.Ribosomal;
import org.mibig.core.model.biosynthesis.classes.Saccharide;
import org.mibig.core.model.biosynthesis.classes.SynthesisType;
import org.mibig.core.model.biosynthesis.classes.Terpene;
import org.mibig.core.model.common.Location;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BiosynthesisMigrator}.
 */
class BiosynthesisMigratorTest {

    private final BiosynthesisMigrator migrator = new BiosynthesisMigrator();

    @Test
    void migrate_alkaloidWithoutOtherObject_becomesOther() {
        Biosynthesis biosynthesis = migrator.migrate(cluster("[\"Alkaloid\"]", ""), List.of());

        assertThat(biosynthesis.classes()).containsExactly(new BiosynthesisClass(
            SynthesisType.OTHER, new OtherClass("other", "converted from 'Alkaloid'")));
    }

    @Test
    void migrate_otherWithKnownSubclass_keepsLowercasedSubclass() {
        Biosynthesis biosynthesis = migrator.migrate(
            cluster("[\"Other\"]", ", \"other\": {\"subclass\": \"Aminocoumarin\"}"), List.of());

        assertThat(biosynthesis.classes().get(0).extraInfo()).isEqualTo(new OtherClass("aminocoumarin", null));
    }

    @Test
    void migrate_otherWithUnknownSubclass_getsDefaultDetails() {
        Biosynthesis biosynthesis = migrator.migrate(
            cluster("[\"Other\"]", ", \"other\": {\"subclass\": \"Unknown\"}"), List.of());

        assertThat(biosynthesis.classes().get(0).extraInfo())
            .isEqualTo(new OtherClass(OtherClass.OTHER, BiosynthesisMigrator.NO_DETAILS));
    }

    @Test
    void migrate_multipleClasses_keepsOrder() {
        Biosynthesis biosynthesis = migrator.migrate(cluster("[\"Polyketide\", \"NRP\", \"Terpene\"]", ""), List.of());

        assertThat(biosynthesis.classes()).extracting(BiosynthesisClass::type)
            .containsExactly(SynthesisType.PKS, SynthesisType.NRPS, SynthesisType.TERPENE);
        assertThat(biosynthesis.classes().get(2).extraInfo()).isInstanceOf(Terpene.class);
    }

    @Test
    void ribosomal_knownSubclass_becomesRippType() {
        LegacyCluster cluster = cluster("[\"RiPP\"]", """
            , "ripp": {
                "subclass": "Lanthipeptide",
                "peptidases": ["nisP"],
                "precursor_genes": [
                  {
                    "gene_id": "nisA",
                    "core_sequence": ["ITSISLCTPGCKTGALMGCNMKTATCHCSIHVSK"],
                    "leader_sequence": "MSTKDFNLDLVSVSKKDSGASPR",
                    "crosslinks": [{"crosslink_type": "lanthionine", "first_AA": 3, "second_AA": 7}]
                  }
                ]
              }
            """);

        Ribosomal ribosomal = BiosynthesisMigrator.ribosomal(cluster.ripp());

        assertThat(ribosomal.subclass()).isEqualTo(Ribosomal.RIPP);
        assertThat(ribosomal.rippType()).isEqualTo("Lanthipeptide");
        Precursor precursor = ribosomal.precursors().get(0);
        assertThat(precursor.coreSequence()).isEqualTo("ITSISLCTPGCKTGALMGCNMKTATCHCSIHVSK");
        assertThat(precursor.leaderCleavageLocation()).isEqualTo(new Location(22, 23));
        assertThat(precursor.crosslinks()).singleElement()
            .satisfies(crosslink -> assertThat(crosslink.from()).isEqualTo(3));
    }

    @Test
    void ribosomal_unknownSubclass_isUnmodified() {
        LegacyCluster cluster = cluster("[\"RiPP\"]", ", \"ripp\": {\"subclass\": \"Thiopeptide-like\"}");

        Ribosomal ribosomal = BiosynthesisMigrator.ribosomal(cluster.ripp());

        assertThat(ribosomal.subclass()).isEqualTo(Ribosomal.UNMODIFIED);
        assertThat(ribosomal.rippType()).isNull();
    }

    @Test
    void ribosomal_twoCoreSequences_throws() {
        LegacyCluster cluster = cluster("[\"RiPP\"]",
            ", \"ripp\": {\"precursor_genes\": [{\"gene_id\": \"nisA\", \"core_sequence\": [\"AA\", \"BB\"]}]}");

        assertThatThrownBy(() -> BiosynthesisMigrator.ribosomal(cluster.ripp()))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("2 core sequences");
    }

    @Test
    void ribosomal_crosslinkWithoutPosition_throws() {
        LegacyCluster cluster = cluster("[\"RiPP\"]", """
            , "ripp": {"precursor_genes": [{"gene_id": "nisA", "core_sequence": ["ITS"],
                "crosslinks": [{"crosslink_type": "lanthionine", "first_AA": 3}]}]}
            """);

        assertThatThrownBy(() -> BiosynthesisMigrator.ribosomal(cluster.ripp()))
            .isInstanceOf(MigrationException.class);
    }

    @Test
    void saccharide_glycosyltransferases_carryPlaceholderSpecificity() {
        LegacyCluster cluster = cluster("[\"Saccharide\"]", """
            , "saccharide": {
                "glycosyltransferases": [
                  {"gene_id": "desVII", "evidence": ["Sequence-based prediction", "Knock-out construct"], "specificity": "desosamine"}
                ],
                "sugar_subclusters": [["desI", "desII"]]
              }
            """);

        Saccharide saccharide = BiosynthesisMigrator.saccharide(cluster.saccharide());

        Glycosyltransferase gt = saccharide.glycosyltransferases().get(0);
        assertThat(gt.specificity()).isEqualTo(Glycosyltransferase.UNMIGRATED_SPECIFICITY);
        assertThat(gt.evidence()).extracting(evidence -> evidence.method()).containsExactly("Knock-out construct");
        assertThat(saccharide.subclusters()).singleElement()
            .satisfies(subcluster -> assertThat(subcluster.genes()).hasSize(2));
    }

    @Test
    void saccharide_placeholderSpecificity_failsAboveQuestionable() {
        LegacyCluster cluster = cluster("[\"Saccharide\"]", """
            , "saccharide": {"glycosyltransferases": [{"gene_id": "desVII", "evidence": []}]}
            """);

        Glycosyltransferase gt = BiosynthesisMigrator.saccharide(cluster.saccharide()).glycosyltransferases().get(0);

        assertThat(gt.validate(ValidationContext.of(QualityLevel.QUESTIONABLE)))
            .extracting(ValidationErrorInfo::field)
            .doesNotContain("Glycosyltransferase.specificity");
        assertThat(gt.validate(ValidationContext.of(QualityLevel.HIGH)))
            .extracting(ValidationErrorInfo::field)
            .contains("Glycosyltransferase.specificity");
    }

    private static LegacyCluster cluster(String classes, String extra) {
        return LegacyReader.read("""
            {"cluster": {"biosyn_class": %s, "mibig_accession": "BGC0000005"%s}, "changelog": []}
            """.formatted(classes, extra)).cluster();
    }
}
