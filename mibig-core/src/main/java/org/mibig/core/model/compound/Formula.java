package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Molecular formula in Hill-like notation, e.g. {@code C66H87N13O13}.
 *
 * @param value formula as written
 */
public record Formula(String value) implements Validatable {

    private static final Pattern PART = Pattern.compile("([A-Z][a-z]?)([0-9]*)");
    private static final Pattern WHOLE = Pattern.compile("^(?:[A-Z][a-z]?[0-9]*)+$");

    /**
     * Splits the formula into atom counts. A missing count means one atom.
     *
     * @return parts in written order
     */
    public List<FormulaPart> parts() {
        List<FormulaPart> parts = new ArrayList<>();
        Matcher matcher = PART.matcher(value);
        while (matcher.find()) {
            String count = matcher.group(2);
            parts.add(new FormulaPart(matcher.group(1), count.isEmpty() ? 1 : Integer.parseInt(count)));
        }
        return parts;
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        if (value == null || !WHOLE.matcher(value).matches()) {
            return List.of(new ValidationErrorInfo("Compound.formula", "Invalid formula '" + value + "'"));
        }
        List<ValidationErrorInfo> errors = new ArrayList<>();
        parts().forEach(part -> errors.addAll(part.validate()));
        return errors;
    }

    public static Formula fromJson(JsonNode node) {
        return new Formula(JsonFields.asText(node, "Formula"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }
}
