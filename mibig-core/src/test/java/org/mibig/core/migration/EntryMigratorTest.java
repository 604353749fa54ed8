package org.mibig.core.migration;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyEntry;
import org.mibig.core.legacy.LegacyReader;
import org.mibig.core.model.biosynthesis.classes.SynthesisType;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.LocusEvidence;
import org.mibig.core.model.common.SubmitterID;
import org.mibig.core.model.compound.CompoundRef;
import org.mibig.core.model.entry.CompletenessLevel;
import org.mibig.core.model.entry.MibigEntry;
import org.mibig.core.model.entry.StatusLevel;
import org.mibig.core.validation.QualityLevel;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link EntryMigrator}.
 */
class EntryMigratorTest {

    private final EntryMigrator migrator = new EntryMigrator();

    @Test
    void migrate_legacyFixture_producesValidEntry() throws URISyntaxException {
        MibigEntry entry = migrator.migrate(fixture());

        assertThat(entry.accession()).isEqualTo("BGC0000055");
        assertThat(entry.quality()).isEqualTo(QualityLevel.QUESTIONABLE);
        assertThat(entry.status()).isEqualTo(StatusLevel.ACTIVE);
        assertThat(entry.completeness()).isEqualTo(CompletenessLevel.COMPLETE);
        assertThat(entry.version()).isEqualTo(3);
        assertThat(entry.taxonomy().name()).isEqualTo("Saccharopolyspora erythraea NRRL 2338");
        assertThat(entry.taxonomy().ncbiTaxId()).isEqualTo(405948);

        assertThat(entry.validate(entry.context(null))).isEmpty();
    }

    @Test
    void migrate_legacyFixture_convertsChangelog() throws URISyntaxException {
        MibigEntry entry = migrator.migrate(fixture());

        assertThat(entry.changelog().releases()).hasSize(2);
        assertThat(entry.changelog().releases().get(1).entries()).singleElement().satisfies(change -> {
            assertThat(change.comment()).isEqualTo("Added compound structure");
            assertThat(change.contributors()).containsExactly(new SubmitterID("BBBBBBBBBBBBBBBBBBBBBBBB"));
            assertThat(change.reviewers()).containsExactly(new SubmitterID("CCCCCCCCCCCCCCCCCCCCCCCC"));
        });
    }

    @Test
    void migrate_legacyFixture_convertsLocusAndBiosynthesis() throws URISyntaxException {
        MibigEntry entry = migrator.migrate(fixture());

        assertThat(entry.loci()).singleElement().satisfies(locus -> {
            assertThat(locus.accession()).isEqualTo("AM420293.1");
            assertThat(locus.location()).isEqualTo(new Location(1, 56000));
            assertThat(locus.evidence()).extracting(LocusEvidence::method).containsExactly("Knock-out studies");
        });
        assertThat(entry.biosynthesis().classes()).singleElement()
            .satisfies(biosynthesisClass -> assertThat(biosynthesisClass.type()).isEqualTo(SynthesisType.PKS));
        assertThat(entry.biosynthesis().modules()).singleElement()
            .satisfies(module -> assertThat(module.name()).isEqualTo("1"));
        assertThat(entry.biosynthesis().operons()).singleElement()
            .satisfies(operon -> assertThat(operon.evidence()).hasSize(1));
        assertThat(entry.genes().annotations()).singleElement()
            .satisfies(annotation -> assertThat(annotation.aliases()).hasSize(1));
    }

    @Test
    void migrate_legacyFixture_convertsCompound() throws URISyntaxException {
        MibigEntry entry = migrator.migrate(fixture());

        assertThat(entry.compounds()).singleElement().satisfies(compound -> {
            assertThat(compound.name()).isEqualTo("erythromycin A");
            assertThat(compound.databases()).containsExactly(new CompoundRef("pubchem", "12560"));
            assertThat(compound.mass()).isEqualTo(733.46);
        });
    }

    @Test
    void migrate_legacyFixture_survivesJsonRoundTrip() throws URISyntaxException {
        MibigEntry entry = migrator.migrate(fixture());

        JsonNode written = entry.toJson();

        assertThat(MibigEntry.decode(written)).isEqualTo(entry);
    }

    @Test
    void migrate_unknownStatus_throws() {
        LegacyEntry legacy = LegacyReader.read(minimal("\"status\": \"withdrawn\","));

        assertThatThrownBy(() -> migrator.migrate(legacy))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("withdrawn");
    }

    @Test
    void migrate_retiredEntry_keepsRetirementReasons() {
        LegacyEntry legacy = LegacyReader.read(minimal(
            "\"status\": \"retired\", \"retirement_reasons\": [\"Duplicate of BGC0000001\"],"));

        MibigEntry entry = migrator.migrate(legacy);

        assertThat(entry.status()).isEqualTo(StatusLevel.RETIRED);
        assertThat(entry.retirementReasons()).containsExactly("Duplicate of BGC0000001");
    }

    @Test
    void migrate_unknownCompleteness_throws() {
        LegacyEntry legacy = LegacyReader.read(minimal("").replace("\"complete\"", "\"mostly\""));

        assertThatThrownBy(() -> migrator.migrate(legacy))
            .isInstanceOf(MigrationException.class)
            .hasMessage("Unknown completeness 'mostly'");
    }

    @Test
    void migrate_nonNumericTaxonomyId_throws() {
        LegacyEntry legacy = LegacyReader.read(minimal("").replace("\"536\"", "\"n/a\""));

        assertThatThrownBy(() -> migrator.migrate(legacy))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("n/a");
    }

    @Test
    void locus_missingCoordinates_defaultToZero() {
        LegacyEntry legacy = LegacyReader.read(minimal("").replace("\"start_coord\": 1, \"end_coord\": 20000,", ""));

        assertThat(EntryMigrator.locus(legacy.cluster().loci()).location()).isEqualTo(new Location(0, 0));
    }

    private LegacyEntry fixture() throws URISyntaxException {
        return LegacyReader.read(Path.of(getClass().getResource("/legacy/BGC0000055.json").toURI()));
    }

    private static String minimal(String extra) {
        return """
            {
              "changelog": [{"comments": ["Submitted"], "contributors": ["AAAAAAAAAAAAAAAAAAAAAAAA"], "version": "1.0"}],
              "cluster": {
                %s
                "biosyn_class": ["Other"],
                "mibig_accession": "BGC0000001",
                "loci": {"accession": "JF752342.1", "completeness": "complete", "start_coord": 1, "end_coord": 20000},
                "ncbi_tax_id": "536",
                "organism_name": "Chromobacterium violaceum"
              }
            }
            """.formatted(extra);
    }
}
