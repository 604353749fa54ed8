package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.json.JsonFields;

/**
 * Tri-state catalytic activity of a domain.
 *
 * <p>Some payloads put {@code "active"} on the wire, others its inverse {@code "inactive"}.
 * Both map onto this enum; an absent flag is {@link #UNSPECIFIED}.
 */
public enum Activity {
    /** Known to be catalytically active. */
    ACTIVE,

    /** Known to be inactive. */
    INACTIVE,

    /** Not stated. */
    UNSPECIFIED;

    public static Activity fromActiveFlag(Boolean active) {
        if (active == null) {
            return UNSPECIFIED;
        }
        return active ? ACTIVE : INACTIVE;
    }

    public static Activity fromInactiveFlag(Boolean inactive) {
        if (inactive == null) {
            return UNSPECIFIED;
        }
        return inactive ? INACTIVE : ACTIVE;
    }

    /**
     * @return {@code true}/{@code false}, or null when unspecified
     */
    public Boolean activeFlag() {
        return this == UNSPECIFIED ? null : this == ACTIVE;
    }

    public Boolean inactiveFlag() {
        return this == UNSPECIFIED ? null : this == INACTIVE;
    }

    static Activity readActive(JsonNode node, String path) {
        return fromActiveFlag(JsonFields.optionalBool(node, "active", path));
    }

    static Activity readInactive(JsonNode node, String path) {
        return fromInactiveFlag(JsonFields.optionalBool(node, "inactive", path));
    }

    void writeActive(ObjectNode node) {
        JsonFields.putIfPresent(node, "active", activeFlag());
    }

    void writeInactive(ObjectNode node) {
        JsonFields.putIfPresent(node, "inactive", inactiveFlag());
    }

    static Activity orUnspecified(Activity activity) {
        return activity == null ? UNSPECIFIED : activity;
    }
}
