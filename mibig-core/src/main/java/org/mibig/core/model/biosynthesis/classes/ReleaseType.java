package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * How the product is released from an assembly line.
 *
 * @param name one of {@link #VALID_NAMES}
 * @param details free text, required for "Other"
 * @param references supporting citations
 */
public record ReleaseType(String name, String details, List<Citation> references) implements Validatable {

    public static final Set<String> VALID_NAMES = Set.of(
        "Claisen condensation",
        "Hydrolysis",
        "Macrolactamization",
        "Macrolactonization",
        "None",
        "Other",
        "Reductive release"
    );

    public ReleaseType {
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || !VALID_NAMES.contains(name)) {
            errors.add(new ValidationErrorInfo("ReleaseType.name", "Invalid release type '" + name + "'"));
        }
        if ("Other".equals(name) && (details == null || details.isBlank())) {
            errors.add(new ValidationErrorInfo("ReleaseType.details",
                "Details must be provided for 'Other' release types"));
        }
        errors.addAll(Citation.validateRequired(references, "ReleaseType.references", context));
        return errors;
    }

    public static ReleaseType fromJson(JsonNode node) {
        JsonFields.object(node, "ReleaseType");
        return new ReleaseType(
            JsonFields.text(node, "name", "ReleaseType"),
            JsonFields.optionalText(node, "details", "ReleaseType"),
            JsonFields.list(node, "references", "ReleaseType", Citation::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        JsonFields.putIfPresent(node, "details", details);
        JsonFields.putList(node, "references", references, Citation::toJson);
        return node;
    }
}
