package org.mibig.core.model.biosynthesis;

import org.mibig.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathStepsTest {

    @Test
    void parse_stagesAndItems_splitsAndStrips() {
        PathSteps steps = PathSteps.parse("[M1] >  tycD,tycE > [M3]");

        assertThat(steps.stages()).containsExactly(List.of("[M1]"), List.of("tycD", "tycE"), List.of("[M3]"));
        assertThat(steps.format()).isEqualTo("[M1] > tycD, tycE > [M3]");
    }

    @Test
    void moduleReferences_returnsBracketedNamesInOrder() {
        PathSteps steps = PathSteps.parse("[M1] > tycD, [M2] > [M3]");

        assertThat(steps.moduleReferences()).containsExactly("M1", "M2", "M3");
    }

    @Test
    void moduleReferences_emptyBrackets_areNotReferences() {
        assertThat(PathSteps.parse("[] > tycD").moduleReferences()).isEmpty();
    }

    @Test
    void parse_arrowSeparator_throws() {
        assertThatThrownBy(() -> PathSteps.parse("[M1] -> [M2]"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Unsupported stage separator '->'");
    }

    @Test
    void parse_slashSeparator_throws() {
        assertThatThrownBy(() -> PathSteps.parse("tycD/tycE"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Unsupported item separator '/'");
    }

    @Test
    void parse_emptyItem_throws() {
        assertThatThrownBy(() -> PathSteps.parse("[M1] > , tycE"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Empty step");
        assertThatThrownBy(() -> PathSteps.parse("[M1] >"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Empty step");
    }
}
