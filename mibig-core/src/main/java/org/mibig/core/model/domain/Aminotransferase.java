package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Aminotransferase payload. An inactive aminotransferase must cite its source.
 *
 * @param activity catalytic activity, {@code inactive} on the wire
 * @param references supporting citations
 */
public record Aminotransferase(Activity activity, List<Citation> references) implements DomainInfo {

    public Aminotransferase {
        activity = Activity.orUnspecified(activity);
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        if (activity == Activity.INACTIVE) {
            return Citation.validateRequired(references, "Aminotransferase.references", context);
        }
        return Citation.validateAll(references, context);
    }

    public static Aminotransferase fromJson(JsonNode node) {
        return new Aminotransferase(
            Activity.readInactive(node, "Aminotransferase"),
            JsonFields.list(node, "references", "Aminotransferase", Citation::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeInactive(node);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
