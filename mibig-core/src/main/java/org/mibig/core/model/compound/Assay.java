package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Activity measurement of a compound.
 *
 * @param concentration measured concentration, e.g. {@code "2 µg/ml"}
 * @param target assay target
 */
public record Assay(String concentration, String target) implements Validatable {

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (concentration == null || concentration.isBlank()) {
            errors.add(new ValidationErrorInfo("Assay.concentration", "Missing concentration"));
        }
        if (target == null || target.isBlank()) {
            errors.add(new ValidationErrorInfo("Assay.target", "Missing target"));
        }
        return errors;
    }

    public static Assay fromJson(JsonNode node) {
        JsonFields.object(node, "Assay");
        return new Assay(
            JsonFields.text(node, "concentration", "Assay"),
            JsonFields.text(node, "target", "Assay"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("concentration", concentration);
        node.put("target", target);
        return node;
    }
}
