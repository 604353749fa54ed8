package org.mibig.core.model.module;

import org.mibig.core.error.ValidationErrorInfo;

import java.util.List;

/**
 * How often a module is iterated. A missing value (null field) means the module is not
 * iterated at all; this type covers the two remaining states.
 *
 * <p>On the wire an unspecified count is the integer {@value #UNSPECIFIED_WIRE_VALUE}.
 *
 * @param count fixed iteration count, or {@value #UNSPECIFIED_WIRE_VALUE} when unknown
 */
public record Iterations(int count) {

    public static final int UNSPECIFIED_WIRE_VALUE = -1;

    /** Iterated an unknown number of times. */
    public static final Iterations UNSPECIFIED = new Iterations(UNSPECIFIED_WIRE_VALUE);

    public static Iterations fixed(int count) {
        return new Iterations(count);
    }

    public boolean isUnspecified() {
        return count == UNSPECIFIED_WIRE_VALUE;
    }

    public List<ValidationErrorInfo> validate(String field) {
        if (isUnspecified() || count >= 1) {
            return List.of();
        }
        return List.of(new ValidationErrorInfo(field, "Must be greater than 0 or " + UNSPECIFIED_WIRE_VALUE));
    }

    /**
     * Reads the wire form.
     *
     * @param value wire integer, may be null
     * @return null when absent
     */
    public static Iterations fromWire(Integer value) {
        if (value == null) {
            return null;
        }
        return value == UNSPECIFIED_WIRE_VALUE ? UNSPECIFIED : new Iterations(value);
    }
}
