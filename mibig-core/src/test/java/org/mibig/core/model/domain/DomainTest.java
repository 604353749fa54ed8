package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.MibigJson;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Domain} and its payloads.
 */
class DomainTest {

    private static final ValidationContext HIGH = ValidationContext.of(QualityLevel.HIGH);
    private static final ValidationContext QUESTIONABLE = ValidationContext.of(QualityLevel.QUESTIONABLE);

    private static final List<SubstrateEvidence> HPLC =
        List.of(new SubstrateEvidence("HPLC", List.of(Citation.of("pubmed", "1"))));

    // ==================== Adenylation ====================

    @Test
    void validate_inactiveAdenylationWithSubstrates_reportsSubstrates() {
        Adenylation adenylation = new Adenylation(
            List.of(new AdenylationSubstrate("alanine", true, null)), HPLC, List.of(), Activity.INACTIVE);

        assertThat(fields(adenylation.validate(HIGH))).containsExactly("Adenylation.substrates");
    }

    @Test
    void validate_inactiveAdenylationWithoutEvidence_failsAtEveryTier() {
        Adenylation adenylation = new Adenylation(List.of(), List.of(), List.of(), Activity.INACTIVE);

        assertThat(fields(adenylation.validate(HIGH))).containsExactly("Adenylation.evidence");
        assertThat(fields(adenylation.validate(QUESTIONABLE))).containsExactly("Adenylation.evidence");
    }

    @Test
    void validate_inactiveAdenylationWithEvidenceOnly_isValid() {
        Adenylation adenylation = new Adenylation(List.of(), HPLC, List.of(), Activity.INACTIVE);

        assertThat(adenylation.validate(HIGH)).isEmpty();
    }

    @Test
    void validate_activeAdenylationWithSubstrates_isValid() {
        Adenylation adenylation = new Adenylation(
            List.of(new AdenylationSubstrate("valine", true, null)), HPLC, List.of(), Activity.ACTIVE);

        assertThat(adenylation.validate(HIGH)).isEmpty();
    }

    @Test
    void validate_adenylationSubstratesWithoutEvidence_failsAboveQuestionable() {
        Adenylation adenylation = new Adenylation(
            List.of(new AdenylationSubstrate("valine", true, null)), List.of(), List.of(), Activity.UNSPECIFIED);

        assertThat(fields(adenylation.validate(HIGH))).containsExactly("Adenylation.evidence");
        assertThat(adenylation.validate(QUESTIONABLE)).isEmpty();
    }

    // ==================== Acyltransferase ====================

    @Test
    void validate_inactiveAcyltransferaseWithSubstrates_reportsSubstrates() {
        Acyltransferase acyltransferase = new Acyltransferase(
            "cis-AT", List.of(new ATSubstrate("malonyl-CoA", null, null)), HPLC, Activity.INACTIVE);

        assertThat(fields(acyltransferase.validate(HIGH))).containsExactly("Acyltransferase.substrates");
    }

    @Test
    void validate_acyltransferaseUnknownSubtype_reportsSubtype() {
        Acyltransferase acyltransferase = new Acyltransferase("hybrid-AT", List.of(), List.of(), Activity.ACTIVE);

        assertThat(fields(acyltransferase.validate(HIGH))).containsExactly("Acyltransferase.subtype");
    }

    // ==================== AdenylationSubstrate ====================

    @Test
    void constructor_proteinogenicWithoutStructure_fillsStructure() {
        AdenylationSubstrate substrate = new AdenylationSubstrate("Alanine", true, null);

        assertThat(substrate.structure()).isEqualTo(new Smiles("NC(C)C(=O)O"));
        assertThat(substrate.validate(HIGH)).isEmpty();
    }

    @Test
    void constructor_explicitStructure_isKept() {
        AdenylationSubstrate substrate = new AdenylationSubstrate("alanine", true, new Smiles("C[C@H](N)C(=O)O"));

        assertThat(substrate.structure()).isEqualTo(new Smiles("C[C@H](N)C(=O)O"));
    }

    @Test
    void validate_unknownProteinogenicName_reportsName() {
        AdenylationSubstrate substrate = new AdenylationSubstrate("ornithine", true, null);

        assertThat(substrate.structure()).isNull();
        assertThat(substrate.validate(HIGH)).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("AdenylationSubstrate.name");
            assertThat(error.message()).contains("ornithine");
        });
    }

    @Test
    void validate_nonProteinogenicName_isValid() {
        assertThat(new AdenylationSubstrate("ornithine", false, null).validate(HIGH)).isEmpty();
    }

    // ==================== Activity ====================

    @Test
    void fromJson_inactiveFlag_survivesRoundTrip() throws IOException {
        Domain domain = Domain.fromJson(json("""
            {"type": "adenylation", "gene": "tycA", "location": {"from": 10, "to": 400},
             "inactive": true, "evidence": [{"method": "HPLC", "references": ["pubmed:1"]}]}
            """));

        assertThat(((Adenylation) domain.extraInfo()).activity()).isEqualTo(Activity.INACTIVE);
        ObjectNode written = domain.toJson();
        assertThat(written.get("inactive").asBoolean()).isTrue();
        assertThat(written.has("active")).isFalse();
        assertThat(Domain.fromJson(written)).isEqualTo(domain);
    }

    @Test
    void fromJson_activeFlag_survivesRoundTrip() throws IOException {
        Domain domain = Domain.fromJson(json("""
            {"type": "ketosynthase", "gene": "eryAI", "location": {"from": 10, "to": 400}, "active": false}
            """));

        assertThat(((Ketosynthase) domain.extraInfo()).activity()).isEqualTo(Activity.INACTIVE);
        ObjectNode written = domain.toJson();
        assertThat(written.get("active").asBoolean()).isFalse();
        assertThat(written.has("inactive")).isFalse();
        assertThat(Domain.fromJson(written)).isEqualTo(domain);
    }

    @Test
    void toJson_unspecifiedActivity_omitsFlag() {
        Domain domain = new Domain(DomainType.KETOSYNTHASE, new GeneId("eryAI"), new Location(10, 400),
            new Ketosynthase(Activity.UNSPECIFIED, List.of()));

        assertThat(domain.toJson().has("active")).isFalse();
    }

    @Test
    void flags_mapOntoTriState() {
        assertThat(Activity.fromActiveFlag(null)).isEqualTo(Activity.UNSPECIFIED);
        assertThat(Activity.fromInactiveFlag(false)).isEqualTo(Activity.ACTIVE);
        assertThat(Activity.INACTIVE.activeFlag()).isFalse();
        assertThat(Activity.UNSPECIFIED.inactiveFlag()).isNull();
    }

    @Test
    void fromJson_unknownType_throws() {
        assertThatThrownBy(() -> Domain.fromJson(json("""
            {"type": "frobnicase", "gene": "eryAI", "location": {"from": 10, "to": 400}}
            """)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("frobnicase");
    }

    // ==================== Condensation ====================

    @Test
    void validate_condensationSubtypeWithoutReferences_failsAboveQuestionable() {
        Condensation condensation = Condensation.of("LCL");

        assertThat(fields(condensation.validate(HIGH))).containsExactly("Condensation.references");
        assertThat(condensation.validate(QUESTIONABLE)).isEmpty();
    }

    @Test
    void validate_condensationWithoutSubtype_needsNoReferences() {
        assertThat(Condensation.of(null).validate(HIGH)).isEmpty();
    }

    @Test
    void validate_condensationUnknownSubtype_reportsSubtype() {
        Condensation condensation = new Condensation("Triple", List.of(Citation.of("pubmed", "1")), List.of(), List.of());

        assertThat(fields(condensation.validate(HIGH))).containsExactly("Condensation.subtype");
    }

    // ==================== Vocabularies ====================

    @Test
    void validate_carrierSubtypes() {
        assertThat(Carrier.of("ACP", null).validate(HIGH)).isEmpty();
        assertThat(Carrier.of("PCP", true).validate(HIGH)).isEmpty();
        assertThat(fields(Carrier.of("PKS", null).validate(HIGH))).containsExactly("Carrier.subtype");
    }

    @Test
    void validate_methyltransferaseSubtypes() {
        assertThat(new Methyltransferase("N", null).validate(HIGH)).isEmpty();
        assertThat(new Methyltransferase(Methyltransferase.OTHER, "S-methylation").validate(HIGH)).isEmpty();
        assertThat(fields(new Methyltransferase("S", null).validate(HIGH))).containsExactly("Methyltransferase.subtype");
    }

    @Test
    void validate_methyltransferaseOtherWithoutDetails_reportsDetails() {
        assertThat(fields(new Methyltransferase(Methyltransferase.OTHER, " ").validate(HIGH)))
            .containsExactly("Methyltransferase.details");
    }

    @Test
    void validate_thioesteraseSubtypes() {
        assertThat(new Thioesterase("Type II").validate(HIGH)).isEmpty();
        assertThat(fields(new Thioesterase("Type III").validate(HIGH))).containsExactly("Thioesterase.subtype");
    }

    @Test
    void validate_otherDomainRequiresSubtype() {
        assertThat(OtherDomain.named("FkbH").validate(HIGH)).isEmpty();
        assertThat(fields(OtherDomain.named("").validate(HIGH))).containsExactly("OtherDomain.subtype");
    }

    private static List<String> fields(List<ValidationErrorInfo> errors) {
        return errors.stream().map(ValidationErrorInfo::field).toList();
    }

    private static JsonNode json(String text) throws IOException {
        return MibigJson.readTree(text);
    }
}
