package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Dehydratase (DH) payload.
 *
 * @param activity catalytic activity
 * @param references supporting citations
 */
public record Dehydratase(Activity activity, List<Citation> references) implements DomainInfo {

    public Dehydratase {
        activity = Activity.orUnspecified(activity);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Dehydratase active() {
        return new Dehydratase(Activity.ACTIVE, List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return Citation.validateAll(references, context);
    }

    public static Dehydratase fromJson(JsonNode node) {
        return new Dehydratase(
            Activity.readActive(node, "Dehydratase"),
            JsonFields.list(node, "references", "Dehydratase", Citation::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeActive(node);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
