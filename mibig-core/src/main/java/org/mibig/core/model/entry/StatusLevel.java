package org.mibig.core.model.entry;

import org.mibig.core.error.ValidationException;

import java.util.Arrays;

/**
 * Publication status of an entry.
 */
public enum StatusLevel {
    PENDING("pending"),
    EMBARGOED("embargoed"),
    ACTIVE("active"),
    RETIRED("retired");

    private final String value;

    StatusLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static StatusLevel fromValue(String value) {
        return Arrays.stream(values())
            .filter(level -> level.value.equals(value))
            .findFirst()
            .orElseThrow(() -> ValidationException.of("MibigEntry.status", "Invalid status: " + value));
    }
}
