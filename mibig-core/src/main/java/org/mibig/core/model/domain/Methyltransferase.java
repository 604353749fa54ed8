package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Methyltransferase (MT) payload.
 *
 * @param subtype methylated atom: {@code C}, {@code N}, {@code O} or {@code other}
 * @param details free text, required for {@code other}
 */
public record Methyltransferase(String subtype, String details) implements DomainInfo {

    public static final String OTHER = "other";

    public static final Set<String> VALID_SUBTYPES = Set.of("C", "N", "O", OTHER);

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(
            DomainInfo.checkSubtype("Methyltransferase", subtype, VALID_SUBTYPES));
        if (OTHER.equals(subtype) && (details == null || details.isBlank())) {
            errors.add(new ValidationErrorInfo("Methyltransferase.details", "Missing required details for subtype 'other'"));
        }
        return errors;
    }

    public static Methyltransferase fromJson(JsonNode node) {
        return new Methyltransferase(
            JsonFields.optionalText(node, "subtype", "Methyltransferase"),
            JsonFields.optionalText(node, "details", "Methyltransferase"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        JsonFields.putIfPresent(node, "details", details);
        return node;
    }
}
