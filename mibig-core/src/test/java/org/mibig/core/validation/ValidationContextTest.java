package org.mibig.core.validation;

import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.domain.Activity;
import org.mibig.core.model.domain.Acyltransferase;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.sequence.InMemorySequenceRecord;
import org.mibig.core.sequence.SequenceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ValidationContext} and tier-gated validation.
 */
class ValidationContextTest {

    private static final SequenceRecord RECORD = InMemorySequenceRecord.builder("AM420293.1", 56000)
        .organism("Saccharopolyspora erythraea NRRL 2338", 405948)
        .cds("SACE_0721", "eryAI", "CAM00062.1", 3491)
        .build();

    @Test
    void isRelaxed_onlyAtQuestionable() {
        assertThat(ValidationContext.of(QualityLevel.QUESTIONABLE).isRelaxed()).isTrue();
        assertThat(ValidationContext.of(QualityLevel.LOW).isRelaxed()).isFalse();
        assertThat(ValidationContext.full().isRelaxed()).isFalse();
    }

    @Test
    void fromValue_unknownTier_throws() {
        assertThatThrownBy(() -> QualityLevel.fromValue("excellent"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("excellent");
    }

    @Test
    void check_inactiveDomainWithoutEvidence_failsAtEveryTier() {
        Acyltransferase inactive = new Acyltransferase(null, List.of(), List.of(), Activity.INACTIVE);

        assertThatThrownBy(() -> ValidationContext.of(QualityLevel.QUESTIONABLE).check(inactive))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Inactive domains require evidence");
        assertThatThrownBy(() -> ValidationContext.of(QualityLevel.MEDIUM).check(inactive))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Inactive domains require evidence");
    }

    @Test
    void check_reportsEveryViolation() {
        Location reversed = new Location(10, 5);

        assertThatThrownBy(() -> ValidationContext.full().check(new Location(-10, -20)))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getErrors()).hasSize(2));
        assertThat(reversed.validate(ValidationContext.of(QualityLevel.QUESTIONABLE))).hasSize(1);
    }

    @Test
    void cds_resolvesLocusTagGeneNameAndProteinId() {
        ValidationContext context = ValidationContext.full().withRecord(RECORD);

        assertThat(context.cds("SACE_0721")).isPresent();
        assertThat(context.cds("eryAI")).isPresent();
        assertThat(context.cds("CAM00062.1")).isPresent();
        assertThat(context.cds("eryB")).isEmpty();
        assertThat(ValidationContext.full().cds("eryAI")).isEmpty();
    }

    @Test
    void validate_geneMissingFromRecord_reportsGeneId() {
        GeneId gene = new GeneId("eryB");

        assertThat(gene.validate(ValidationContext.full())).isEmpty();
        assertThat(gene.validate(ValidationContext.full().withRecord(RECORD)))
            .singleElement()
            .satisfies(error -> assertThat(error.message()).contains("not found in record AM420293.1"));
    }

    @Test
    void validate_domainBeyondTranslation_reportsLocation() {
        Domain domain = new Domain(DomainType.ACYLTRANSFERASE, new GeneId("eryAI"), new Location(3400, 3600),
            new Acyltransferase("cis-AT", List.of(), List.of(), Activity.UNSPECIFIED));

        List<ValidationErrorInfo> errors = domain.validate(ValidationContext.full().withRecord(RECORD));

        assertThat(errors).singleElement()
            .satisfies(error -> assertThat(error.message()).contains("exceeds translation length 3491"));
    }
}
