package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Version of a data release: dotted digits such as {@code 3.1}, or {@code next} for the
 * upcoming, not yet dated release.
 *
 * @param value version text
 */
public record ReleaseVersion(String value) implements Validatable {

    public static final ReleaseVersion NEXT = new ReleaseVersion("next");

    private static final Pattern NUMBERED = Pattern.compile("^\\d+(\\.\\d+)*$");

    public ReleaseVersion {
        if (value == null) {
            value = "";
        }
    }

    public static ReleaseVersion of(String value) {
        return ValidationContext.full().check(new ReleaseVersion(value));
    }

    public boolean isNext() {
        return NEXT.value.equals(value);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        if (isNext() || NUMBERED.matcher(value).matches()) {
            return List.of();
        }
        return List.of(new ValidationErrorInfo("ReleaseVersion", "invalid version '" + value + "'"));
    }

    public static ReleaseVersion fromJson(JsonNode node) {
        return new ReleaseVersion(JsonFields.asText(node, "ReleaseVersion"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
