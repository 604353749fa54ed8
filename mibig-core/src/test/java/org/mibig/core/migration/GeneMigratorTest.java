package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyGenes;
import org.mibig.core.legacy.LegacyReader;
import org.mibig.core.model.biosynthesis.Operon;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.NovelGeneId;
import org.mibig.core.model.domain.Adenylation;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.model.gene.Annotation;
import org.mibig.core.model.gene.GeneFunction;
import org.mibig.core.model.gene.Genes;
import org.mibig.core.model.gene.TailoringFunction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeneMigrator} and {@link EvidenceFilter}.
 */
class GeneMigratorTest {

    private final GeneMigrator migrator = new GeneMigrator();

    @Test
    void migrateOperons_predictionOnly_hasNoEvidence() {
        List<Operon> operons = migrator.migrateOperons(genes("""
            {"operons": [{"genes": ["eryAI", "eryAII"], "evidence": ["Sequence-based prediction"]}]}
            """));

        assertThat(operons).singleElement().satisfies(operon -> {
            assertThat(operon.evidence()).isEmpty();
            assertThat(operon.genes()).hasSize(2);
        });
    }

    @Test
    void migrateOperons_mixedMethods_keepsExperimentalOnes() {
        List<Operon> operons = migrator.migrateOperons(genes("""
            {"operons": [{"genes": ["eryAI"], "evidence": ["RACE", "Sequence-based prediction", "rt-PCR"]}]}
            """));

        assertThat(operons.get(0).evidence()).extracting(org.mibig.core.model.common.OperonEvidence::method)
            .containsExactly("RACE", "rt-PCR");
    }

    @Test
    void migrate_noGeneSection_returnsNull() {
        assertThat(migrator.migrate(null)).isNull();
        assertThat(migrator.migrateOperons(null)).isEmpty();
    }

    @Test
    void migrate_annotation_splitsAliasesAndMapsFunctions() {
        Genes genes = migrator.migrate(genes("""
            {
              "annotations": [
                {
                  "id": "eryAI",
                  "name": "eryAI/DEBS1/orf3",
                  "product": "polyketide synthase",
                  "publications": ["pubmed:17369815"],
                  "functions": [
                    {"category": "Scaffold biosynthesis", "evidence": ["Knock-out", "Sequence-based prediction"]},
                    {"category": "Other", "evidence": []},
                    {"category": "Glycosylation", "evidence": []}
                  ],
                  "tailoring": ["Hydroxylation", "Weird chemistry"],
                  "mut_pheno": "abolished production"
                }
              ]
            }
            """));

        Annotation annotation = genes.annotations().get(0);
        assertThat(annotation.name()).isEqualTo(new NovelGeneId("eryAI"));
        assertThat(annotation.aliases()).containsExactly(new NovelGeneId("DEBS1"), new NovelGeneId("orf3"));
        assertThat(annotation.functions()).extracting(GeneFunction::function)
            .containsExactly("Scaffold biosynthesis", GeneFunction.OTHER, GeneFunction.OTHER);
        assertThat(annotation.functions()).extracting(GeneFunction::details)
            .containsExactly(null, GeneMigrator.NO_DETAILS, "Glycosylation");
        assertThat(annotation.functions().get(0).evidence()).hasSize(1);
        assertThat(annotation.tailoringFunctions()).extracting(TailoringFunction::function)
            .containsExactly("Hydroxylation", TailoringFunction.OTHER);
        assertThat(annotation.mutationPhenotype().phenotype()).isEqualTo("abolished production");
        assertThat(annotation.mutationPhenotype().references()).containsExactly(Citation.parse("pubmed:17369815"));
    }

    @Test
    void migrate_adenylationDomain_becomesDomainOnGene() {
        Genes genes = migrator.migrate(genes("""
            {
              "annotations": [
                {
                  "id": "tycA",
                  "domains": [
                    {
                      "name": "AMP-binding",
                      "location": {"begin": 200, "end": 600},
                      "substrates": [{"name": "Phenylalanine", "evidence": ["Activity assay"]}]
                    }
                  ]
                }
              ]
            }
            """));

        Domain domain = genes.annotations().get(0).domains().get(0);
        assertThat(domain.type()).isEqualTo(DomainType.AMP_BINDING);
        assertThat(domain.location()).isEqualTo(new Location(200, 600));
        Adenylation adenylation = (Adenylation) domain.extraInfo();
        assertThat(adenylation.substrates()).singleElement()
            .satisfies(substrate -> assertThat(substrate.name()).isEqualTo("phenylalanine"));
    }

    @Test
    void migrate_unsupportedDomain_throws() {
        assertThatThrownBy(() -> migrator.migrate(genes("""
            {"annotations": [{"id": "tycA", "domains": [{"name": "Condensation"}]}]}
            """)))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("Condensation");
    }

    @Test
    void migrate_extraGeneWithoutLocation_throws() {
        assertThatThrownBy(() -> migrator.migrate(genes("""
            {"extra_genes": [{"id": "orfX", "translation": "MKV"}]}
            """)))
            .isInstanceOf(MigrationException.class)
            .hasMessageContaining("orfX");
    }

    @Test
    void migrate_extraGene_becomesAddition() {
        Genes genes = migrator.migrate(genes("""
            {"extra_genes": [{"id": "orfX", "translation": "MKV",
              "location": {"strand": -1, "exons": [{"start": 100, "end": 400}]}}]}
            """));

        assertThat(genes.toAdd()).singleElement().satisfies(addition -> {
            assertThat(addition.id()).isEqualTo(new NovelGeneId("orfX"));
            assertThat(addition.location().strand()).isEqualTo(-1);
            assertThat(addition.location().exons()).containsExactly(new Location(100, 400));
        });
    }

    @Test
    void convert_dropsNullAndPredictionMethods() {
        List<String> methods = new java.util.ArrayList<>(List.of("RACE", EvidenceFilter.SEQUENCE_BASED_PREDICTION));
        methods.add(null);

        assertThat(EvidenceFilter.convert(methods, (method, references) -> method)).containsExactly("RACE");
        assertThat(EvidenceFilter.convert(null, (method, references) -> method)).isEmpty();
    }

    private static LegacyGenes genes(String json) {
        return LegacyReader.read("""
            {"cluster": {"biosyn_class": ["NRP"], "mibig_accession": "BGC0000006", "genes": %s}, "changelog": []}
            """.formatted(json)).cluster().genes();
    }
}
