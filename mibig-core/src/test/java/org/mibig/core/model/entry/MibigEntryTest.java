package org.mibig.core.model.entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.MibigJson;
import org.mibig.core.sequence.InMemorySequenceRecord;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MibigEntry}.
 */
class MibigEntryTest {

    private ObjectNode document;

    @BeforeEach
    void loadDocument() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/entries/BGC0000001.json")) {
            document = (ObjectNode) MibigJson.mapper().readTree(in);
        }
    }

    @Test
    void decode_validHighQualityEntry_returnsEntry() {
        MibigEntry entry = MibigEntry.decode(document);

        assertThat(entry.accession()).isEqualTo("BGC0000001");
        assertThat(entry.quality()).isEqualTo(QualityLevel.HIGH);
        assertThat(entry.status()).isEqualTo(StatusLevel.ACTIVE);
        assertThat(entry.completeness()).isEqualTo(CompletenessLevel.COMPLETE);
        assertThat(entry.loci()).singleElement()
            .satisfies(locus -> assertThat(locus.accession()).isEqualTo("JF752342.1"));
        assertThat(entry.compounds()).singleElement()
            .satisfies(compound -> assertThat(compound.name()).isEqualTo("violacein"));
        assertThat(entry.genes()).isNull();
    }

    @Test
    void toJson_decodedEntry_decodesToEqualEntry() {
        MibigEntry entry = MibigEntry.decode(document);

        JsonNode written = entry.toJson();

        assertThat(MibigEntry.fromJson(written)).isEqualTo(entry);
        assertThat(written.has("genes")).isFalse();
        assertThat(written.has("comment")).isFalse();
    }

    @Test
    void decode_missingReferencesAtHigh_reportsEveryViolation() {
        removeReferences();

        assertThatThrownBy(() -> MibigEntry.decode(document))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getErrors())
                .extracting(ValidationErrorInfo::field)
                .containsExactlyInAnyOrder("LocusEvidence.references", "CompoundEvidence.references"));
    }

    @Test
    void decode_missingReferencesAtQuestionable_isValid() {
        removeReferences();
        document.put("quality", "questionable");

        MibigEntry entry = MibigEntry.decode(document);

        assertThat(entry.quality()).isEqualTo(QualityLevel.QUESTIONABLE);
        assertThat(entry.context(null).isRelaxed()).isTrue();
    }

    @Test
    void validate_retiredWithoutReasons_reportsRetirementReasons() {
        document.put("status", "retired");
        MibigEntry entry = MibigEntry.fromJson(document);

        assertThat(entry.validate(ValidationContext.full()))
            .extracting(ValidationErrorInfo::field)
            .containsExactly("MibigEntry.retirement_reasons");
    }

    @Test
    void validate_versionAheadOfChangelog_reportsVersion() {
        document.put("version", 5);
        MibigEntry entry = MibigEntry.fromJson(document);

        assertThat(entry.validate(ValidationContext.full()))
            .extracting(ValidationErrorInfo::field)
            .containsExactly("MibigEntry.version");
        assertThatThrownBy(() -> MibigEntry.decode(document))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("does not follow the changelog's 1 release(s)");
    }

    @Test
    void decode_recordWithOtherAccession_reportsMismatch() {
        var record = InMemorySequenceRecord.builder("CP000001.1", 50000)
            .organism("Chromobacterium violaceum", 536)
            .build();

        assertThatThrownBy(() -> MibigEntry.decode(document, record))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Accession mismatch: JF752342.1 != CP000001.1");
    }

    @Test
    void fromJson_unknownClassTag_throws() {
        ((ObjectNode) document.get("biosynthesis").get("classes").get(0)).put("class", "alkaloid");

        assertThatThrownBy(() -> MibigEntry.fromJson(document))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Unknown class 'alkaloid'");
    }

    @Test
    void fromJson_unknownQuality_throws() {
        document.put("quality", "excellent");

        assertThatThrownBy(() -> MibigEntry.fromJson(document))
            .isInstanceOf(ValidationException.class);
    }

    private void removeReferences() {
        ArrayNode locusEvidence = (ArrayNode) document.get("loci").get(0).get("evidence");
        ((ObjectNode) locusEvidence.get(0)).remove("references");
        ArrayNode compoundEvidence = (ArrayNode) document.get("compounds").get(0).get("evidence");
        ((ObjectNode) compoundEvidence.get(0)).remove("references");
    }
}
