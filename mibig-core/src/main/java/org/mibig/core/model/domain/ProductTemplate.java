package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Product template (PT) payload of iterative type I PKS.
 *
 * @param activity catalytic activity
 */
public record ProductTemplate(Activity activity) implements DomainInfo {

    public ProductTemplate {
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

    public static ProductTemplate fromJson(JsonNode node) {
        return new ProductTemplate(Activity.readActive(node, "ProductTemplate"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeActive(node);
        return node;
    }
}
