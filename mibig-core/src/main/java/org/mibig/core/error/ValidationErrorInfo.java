package org.mibig.core.error;

import java.util.Objects;

/**
 * A single validation violation.
 *
 * @param field dotted path of the offending field, e.g. {@code Acyltransferase.evidence}
 * @param message human readable description of the violation
 */
public record ValidationErrorInfo(String field, String message) {

    public ValidationErrorInfo {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
