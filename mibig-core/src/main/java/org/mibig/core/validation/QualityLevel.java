package org.mibig.core.validation;

import org.mibig.core.error.ValidationException;

import java.util.Arrays;

/**
 * Curation quality tier of an entry, ordered from least to most trusted.
 *
 * <p>The tier gates validation strictness: at {@link #QUESTIONABLE} many normally mandatory
 * evidence, citation and coordinate requirements are relaxed so that unreviewed imported data
 * can be represented.
 */
public enum QualityLevel {
    /** Imported or unreviewed data. */
    QUESTIONABLE("questionable"),

    /** Reviewed, minimal supporting evidence. */
    LOW("low"),

    /** Reviewed, reasonable supporting evidence. */
    MEDIUM("medium"),

    /** Reviewed, comprehensive supporting evidence. */
    HIGH("high");

    private final String value;

    QualityLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Looks up a tier by its wire value.
     *
     * @param value wire value, e.g. {@code "questionable"}
     * @return matching tier
     * @throws ValidationException if the value names no tier
     */
    public static QualityLevel fromValue(String value) {
        return Arrays.stream(values())
            .filter(level -> level.value.equals(value))
            .findFirst()
            .orElseThrow(() -> ValidationException.of("quality", "Invalid quality level: " + value));
    }
}
