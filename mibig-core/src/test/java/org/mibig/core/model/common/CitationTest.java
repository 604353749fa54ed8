package org.mibig.core.model.common;

import org.mibig.core.error.ValidationException;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.ValidationContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Citation}.
 */
class CitationTest {

    @Test
    void parse_validPubmed_returnsCitation() {
        Citation citation = Citation.parse("pubmed:12345");

        assertThat(citation.database()).isEqualTo("pubmed");
        assertThat(citation.value()).isEqualTo("12345");
        assertThat(citation).hasToString("pubmed:12345");
    }

    @Test
    void parse_doiWithColonInValue_splitsAtFirstColon() {
        Citation citation = Citation.parse("doi:10.1016/j.chembiol.2011.01.007");

        assertThat(citation.database()).isEqualTo("doi");
        assertThat(citation.value()).isEqualTo("10.1016/j.chembiol.2011.01.007");
    }

    @Test
    void of_nonNumericPubmed_throwsWithDatabaseInMessage() {
        assertThatThrownBy(() -> Citation.of("pubmed", "abc"))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getErrors())
                .singleElement()
                .satisfies(error -> assertThat(error.message()).matches("Invalid .* for database 'pubmed'")));
    }

    @Test
    void of_unknownDatabase_throws() {
        assertThatThrownBy(() -> Citation.of("arxiv", "2101.00001"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid database type 'arxiv'");
    }

    @Test
    void parse_missingColon_throws() {
        assertThatThrownBy(() -> Citation.parse("12345"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("database:value");
    }

    @Test
    void fromText_invalidValue_doesNotValidate() {
        Citation citation = Citation.fromText("pubmed:abc");

        assertThat(citation.validate(ValidationContext.full())).hasSize(1);
    }

    @Test
    void equals_sameDatabaseAndValue_areEqual() {
        assertThat(Citation.parse("pubmed:1")).isEqualTo(new Citation("pubmed", "1"));
        assertThat(Citation.parse("pubmed:1")).hasSameHashCodeAs(new Citation("pubmed", "1"));
    }

    @Test
    void compareTo_ordersByDatabaseThenValue() {
        List<Citation> sorted = List.of(
                Citation.parse("pubmed:2"), Citation.parse("doi:10.1000/x1"), Citation.parse("pubmed:1"))
            .stream()
            .sorted()
            .toList();

        assertThat(sorted).extracting(Citation::toString)
            .containsExactly("doi:10.1000/x1", "pubmed:1", "pubmed:2");
    }

    @Test
    void validateRequired_emptyAtQuestionable_isAllowed() {
        assertThat(Citation.validateRequired(List.of(), "Evidence.references",
            ValidationContext.of(QualityLevel.QUESTIONABLE))).isEmpty();
    }

    @Test
    void validateRequired_emptyAtHigh_reportsField() {
        assertThat(Citation.validateRequired(List.of(), "Evidence.references",
            ValidationContext.of(QualityLevel.HIGH)))
            .singleElement()
            .satisfies(error -> assertThat(error.field()).isEqualTo("Evidence.references"));
    }
}
