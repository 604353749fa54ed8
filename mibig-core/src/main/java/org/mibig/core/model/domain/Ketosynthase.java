package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Ketosynthase (KS) payload: catalyses the Claisen condensation of a PKS module.
 *
 * @param activity catalytic activity
 * @param references supporting citations
 */
public record Ketosynthase(Activity activity, List<Citation> references) implements DomainInfo {

    public Ketosynthase {
        activity = Activity.orUnspecified(activity);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Ketosynthase active() {
        return new Ketosynthase(Activity.ACTIVE, List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return Citation.validateAll(references, context);
    }

    public static Ketosynthase fromJson(JsonNode node) {
        return new Ketosynthase(
            Activity.readActive(node, "Ketosynthase"),
            JsonFields.list(node, "references", "Ketosynthase", Citation::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeActive(node);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
