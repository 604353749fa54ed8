package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyNrp;
import org.mibig.core.legacy.LegacyReader;
import org.mibig.core.model.biosynthesis.classes.Nrps;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.domain.Adenylation;
import org.mibig.core.model.domain.AdenylationSubstrate;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.model.domain.Methyltransferase;
import org.mibig.core.model.module.Module;
import org.mibig.core.model.module.ModuleType;
import org.mibig.core.model.module.NrpsTypeI;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NrpsMigrator}.
 */
class NrpsMigratorTest {

    private final NrpsMigrator migrator = new NrpsMigrator();

    @Test
    void migrate_moduleSpanningTwoGenes_isMergedByName() {
        ClassMigration migration = migrator.migrate(nrp("""
            {
              "nrps_genes": [
                {
                  "gene_id": "tycA",
                  "modules": [
                    {
                      "module_number": "1",
                      "c_dom_subtype": "Starter",
                      "a_substr_spec": {"proteinogenic": ["Glutamate"], "evidence": ["Activity assay"], "epimerized": true},
                      "modification_domains": ["N-methylation"]
                    }
                  ]
                },
                {
                  "gene_id": "tycB",
                  "modules": [
                    {"module_number": "1"}
                  ]
                }
              ],
              "release_type": ["Hydrolysis", "Unknown"],
              "thioesterases": [{"gene": "tycC", "thioesterase_type": "Type I"}]
            }
            """));

        assertThat(migration.modules()).singleElement().satisfies(module -> {
            assertThat(module.type()).isEqualTo(ModuleType.NRPS_TYPE1);
            assertThat(module.name()).isEqualTo("1");
            assertThat(module.genes()).extracting(GeneId::value).containsExactly("tycA", "tycB");
            assertThat(module.validate(ValidationContext.of(QualityLevel.QUESTIONABLE))).isEmpty();
        });

        NrpsTypeI info = (NrpsTypeI) migration.modules().get(0).extraInfo();
        assertThat(info.cDomain()).isNotNull();
        assertThat(info.modificationDomains()).extracting(Domain::type)
            .containsExactly(DomainType.EPIMERASE, DomainType.METHYLTRANSFERASE);
        Adenylation adenylation = (Adenylation) info.aDomain().extraInfo();
        assertThat(adenylation.substrates()).singleElement().satisfies(substrate -> {
            assertThat(substrate.name()).isEqualTo("glutamic acid");
            assertThat(substrate.proteinogenic()).isTrue();
            assertThat(substrate.structure()).isNotNull();
        });
        assertThat(adenylation.evidence()).singleElement()
            .satisfies(evidence -> assertThat(evidence.method()).isEqualTo("Activity assay"));

        Nrps nrps = (Nrps) migration.info();
        assertThat(nrps.releaseTypes()).extracting(release -> release.name()).containsExactly("Hydrolysis");
        assertThat(nrps.thioesterases()).singleElement()
            .satisfies(domain -> assertThat(domain.type()).isEqualTo(DomainType.THIOESTERASE));
    }

    @Test
    void migrate_moduleWithoutSpecificity_isSkipped() {
        ClassMigration migration = migrator.migrate(nrp("""
            {
              "nrps_genes": [
                {
                  "gene_id": "tycA",
                  "modules": [
                    {"module_number": "1"},
                    {"a_substr_spec": {"nonproteinogenic": ["ornithine"]}},
                    {"a_substr_spec": {"proteinogenic": ["Valine"]}}
                  ]
                }
              ]
            }
            """));

        assertThat(migration.modules()).extracting(Module::name).containsExactly("Unk01", "Unk02");
        Adenylation first = (Adenylation) migration.modules().get(0).domains().get(0).extraInfo();
        assertThat(first.substrates()).extracting(AdenylationSubstrate::proteinogenic).containsExactly(false);
    }

    @Test
    void migrate_unsupportedModification_throws() {
        assertThatThrownBy(() -> migrator.migrate(nrp("""
            {
              "nrps_genes": [
                {"gene_id": "tycA", "modules": [{"a_substr_spec": {"proteinogenic": ["Valine"]}, "modification_domains": ["Halogenation"]}]}
              ]
            }
            """)))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("Halogenation");
    }

    @Test
    void migrate_noNrpObject_isEmptyTypeI() {
        ClassMigration migration = migrator.migrate(null);

        assertThat(((Nrps) migration.info()).subclass()).isEqualTo(NrpsMigrator.DEFAULT_SUBCLASS);
        assertThat(migration.modules()).isEmpty();
    }

    @Test
    void methylation_prefixSelectsSubtype() {
        assertThat(NrpsMigrator.methylation("Methylation")).isEqualTo(new Methyltransferase(null, null));
        assertThat(NrpsMigrator.methylation("O-methylation")).isEqualTo(new Methyltransferase("O", null));
        assertThat(NrpsMigrator.methylation("S-methylation"))
            .isEqualTo(new Methyltransferase(Methyltransferase.OTHER, "S-methylation"));
    }

    private static LegacyNrp nrp(String json) {
        return LegacyReader.read("""
            {"cluster": {"biosyn_class": ["NRP"], "mibig_accession": "BGC0000004", "nrp": %s}, "changelog": []}
            """.formatted(json)).cluster().nrp();
    }
}
