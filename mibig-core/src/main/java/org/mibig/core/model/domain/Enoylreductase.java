package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Enoylreductase (ER) payload.
 *
 * @param activity catalytic activity
 * @param references supporting citations
 */
public record Enoylreductase(Activity activity, List<Citation> references) implements DomainInfo {

    public Enoylreductase {
        activity = Activity.orUnspecified(activity);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Enoylreductase active() {
        return new Enoylreductase(Activity.ACTIVE, List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return Citation.validateAll(references, context);
    }

    public static Enoylreductase fromJson(JsonNode node) {
        return new Enoylreductase(
            Activity.readActive(node, "Enoylreductase"),
            JsonFields.list(node, "references", "Enoylreductase", Citation::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeActive(node);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
