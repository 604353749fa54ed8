package org.mibig.core.model.entry;

import org.mibig.core.error.ValidationException;

import java.util.Arrays;

/**
 * Whether the entry's loci cover the whole gene cluster.
 */
public enum CompletenessLevel {
    UNKNOWN("unknown"),
    PARTIAL("partial"),
    COMPLETE("complete");

    private final String value;

    CompletenessLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static CompletenessLevel fromValue(String value) {
        return Arrays.stream(values())
            .filter(level -> level.value.equals(value))
            .findFirst()
            .orElseThrow(() -> ValidationException.of("MibigEntry.completeness", "Invalid completeness: " + value));
    }
}
