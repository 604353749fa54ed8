package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Payload of classes outside NRPS, PKS, ribosomal, saccharide and terpene.
 *
 * @param subclass one of {@link #VALID_SUBCLASSES}
 * @param details free text, required for subclass "other"
 */
public record OtherClass(String subclass, String details) implements ClassInfo {

    public static final String OTHER = "other";

    public static final Set<String> VALID_SUBCLASSES = Set.of(
        "aminocoumarin", "butyrolactone", "cyclitol", "ectoine", "fatty acid", "flavin", "indole",
        "non-nrp beta-lactam", "non-nrp siderophore", "nucleoside", OTHER, "pbde", "phenazine",
        "phosphonate", "shikimate-derived", "trna-derived"
    );

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subclass == null || !VALID_SUBCLASSES.contains(subclass)) {
            errors.add(new ValidationErrorInfo("Other.subclass", "Invalid subclass '" + subclass + "'"));
        }
        if (OTHER.equals(subclass) && (details == null || details.isBlank())) {
            errors.add(new ValidationErrorInfo("Other.details", "Missing details for subclass 'other'"));
        }
        return errors;
    }

    public static OtherClass fromJson(JsonNode node) {
        return new OtherClass(
            JsonFields.text(node, "subclass", "Other"),
            JsonFields.optionalText(node, "details", "Other"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("subclass", subclass);
        JsonFields.putIfPresent(node, "details", details);
        return node;
    }
}
