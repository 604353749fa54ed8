package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Epimerase (E) payload: converts the loaded L-amino acid or ketide to its D-form.
 *
 * @param activity catalytic activity
 * @param references supporting citations
 */
public record Epimerase(Activity activity, List<Citation> references) implements DomainInfo {

    public Epimerase {
        activity = Activity.orUnspecified(activity);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Epimerase active() {
        return new Epimerase(Activity.ACTIVE, List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return Citation.validateAll(references, context);
    }

    public static Epimerase fromJson(JsonNode node) {
        return new Epimerase(
            Activity.readActive(node, "Epimerase"),
            JsonFields.list(node, "references", "Epimerase", Citation::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeActive(node);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
