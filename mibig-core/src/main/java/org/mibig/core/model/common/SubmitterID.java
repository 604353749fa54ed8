package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Opaque identifier of a curator: exactly 24 alphanumeric characters.
 *
 * @param value the identifier
 */
public record SubmitterID(String value) implements Validatable {

    /** Identifier used for entries attributed to the system itself. */
    public static final SubmitterID SYSTEM = new SubmitterID("AAAAAAAAAAAAAAAAAAAAAAAA");

    private static final int LENGTH = 24;
    private static final Pattern ALPHANUMERIC = Pattern.compile("^[A-Za-z0-9]*$");

    public SubmitterID {
        if (value == null) {
            value = "";
        }
    }

    public static SubmitterID of(String value) {
        return ValidationContext.full().check(new SubmitterID(value));
    }

    public boolean isSystem() {
        return equals(SYSTEM);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (value.length() != LENGTH) {
            errors.add(new ValidationErrorInfo("SubmitterID", "invalid length"));
        }
        if (!ALPHANUMERIC.matcher(value).matches()) {
            errors.add(new ValidationErrorInfo("SubmitterID", "invalid characters"));
        }
        return errors;
    }

    public static SubmitterID fromJson(JsonNode node) {
        return new SubmitterID(JsonFields.asText(node, "SubmitterID"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
