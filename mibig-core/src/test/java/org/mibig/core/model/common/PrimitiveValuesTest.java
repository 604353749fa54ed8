package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the small value types shared across the model.
 */
class PrimitiveValuesTest {

    private static final ValidationContext HIGH = ValidationContext.of(QualityLevel.HIGH);
    private static final ValidationContext QUESTIONABLE = ValidationContext.of(QualityLevel.QUESTIONABLE);

    // ==================== Location ====================

    @Test
    void location_usesFromAndToOnTheWire() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("from", 12);
        node.put("to", 340);

        Location location = Location.fromJson(node);

        assertThat(location).isEqualTo(new Location(12, 340));
        assertThat(location.toJson()).isEqualTo(node);
    }

    @Test
    void location_startAfterEnd_isInvalidAtEveryTier() {
        Location location = new Location(50, 10);

        assertThat(location.validate(HIGH)).extracting(ValidationErrorInfo::message)
            .containsExactly("Start 50 is after end 10");
        assertThat(location.validate(QUESTIONABLE)).hasSize(1);
    }

    @Test
    void location_unknown_isOnlyAcceptedWhenRelaxed() {
        assertThat(Location.UNKNOWN.validate(QUESTIONABLE)).isEmpty();
        assertThat(Location.UNKNOWN.validate(HIGH)).extracting(ValidationErrorInfo::field)
            .containsExactly("Location");
    }

    // ==================== Gene identifiers ====================

    @Test
    void geneId_withoutRecord_checksSyntaxOnly() {
        assertThat(new GeneId("AEK75490.1").validate(HIGH)).isEmpty();
        assertThat(new GeneId("tyc A").validate(HIGH)).extracting(ValidationErrorInfo::field)
            .containsExactly("GeneId");
        assertThat(new GeneId(null).value()).isEmpty();
    }

    @Test
    void novelGeneId_invalidCharacters_areRejected() {
        assertThat(new NovelGeneId("orf_12-b").validate(HIGH)).isEmpty();
        assertThat(new NovelGeneId("orf/12").validate(HIGH)).extracting(ValidationErrorInfo::message)
            .containsExactly("Invalid characters in gene identifier 'orf/12'");
        assertThat(new NovelGeneId("").validate(HIGH)).extracting(ValidationErrorInfo::message)
            .containsExactly("Gene identifier must not be empty");
    }

    // ==================== SubmitterID ====================

    @Test
    void submitterId_system_isValid() {
        assertThat(SubmitterID.SYSTEM.validate(HIGH)).isEmpty();
        assertThat(SubmitterID.SYSTEM.isSystem()).isTrue();
        assertThat(SubmitterID.of("AbCdEfGhIjKlMnOpQrStUvWx").isSystem()).isFalse();
    }

    @Test
    void submitterId_wrongLengthAndCharacters_reportsBoth() {
        assertThat(new SubmitterID("abc-def").validate(HIGH)).extracting(ValidationErrorInfo::message)
            .containsExactly("invalid length", "invalid characters");
        assertThatThrownBy(() -> SubmitterID.of("short"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("invalid length");
    }

    // ==================== ReleaseVersion ====================

    @Test
    void releaseVersion_numberedAndNext_areValid() {
        assertThat(ReleaseVersion.of("3.1").isNext()).isFalse();
        assertThat(ReleaseVersion.NEXT.isNext()).isTrue();
        assertThat(ReleaseVersion.NEXT.validate(HIGH)).isEmpty();
    }

    @Test
    void releaseVersion_malformed_isRejected() {
        assertThat(new ReleaseVersion("v3").validate(HIGH)).extracting(ValidationErrorInfo::field)
            .containsExactly("ReleaseVersion");
        assertThatThrownBy(() -> ReleaseVersion.of("3."))
            .isInstanceOf(ValidationException.class);
    }

    // ==================== Smiles ====================

    @Test
    void smiles_isStrippedAndChecked() {
        assertThat(new Smiles("  CC(=O)O \n").value()).isEqualTo("CC(=O)O");
        assertThat(Smiles.of("C[C@H](N)C(=O)O").validate(HIGH)).isEmpty();
    }

    @Test
    void smiles_invalidCharacters_areRejected() {
        assertThat(new Smiles("CC O!").validate(HIGH)).extracting(ValidationErrorInfo::field)
            .containsExactly("Smiles");
        assertThatThrownBy(() -> Smiles.of(""))
            .isInstanceOf(ValidationException.class);
    }
}
