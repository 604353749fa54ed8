package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Thioreductase (R) payload: reductive release of the product.
 *
 * @param activity catalytic activity
 */
public record Thioreductase(Activity activity) implements DomainInfo {

    public Thioreductase {
        activity = Activity.orUnspecified(activity);
    }

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return List.of();
    }

    public static Thioreductase fromJson(JsonNode node) {
        return new Thioreductase(Activity.readActive(node, "Thioreductase"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeActive(node);
        return node;
    }
}
