package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A chemical structure in SMILES notation. Only the character set is checked.
 *
 * @param value SMILES string, surrounding whitespace removed
 */
public record Smiles(String value) implements Validatable {

    private static final Pattern VALID_SMILES = Pattern.compile("^[\\[\\]()A-Za-z0-9@+\\-=#$:.%/\\\\*~&]+$");

    public Smiles {
        value = value == null ? "" : value.strip();
    }

    public static Smiles of(String value) {
        return ValidationContext.full().check(new Smiles(value));
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        if (!VALID_SMILES.matcher(value).matches()) {
            return List.of(new ValidationErrorInfo("Smiles", "Invalid SMILES '" + value + "'"));
        }
        return List.of();
    }

    public static Smiles fromJson(JsonNode node) {
        return new Smiles(JsonFields.asText(node, "Smiles"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
