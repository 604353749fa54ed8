package org.mibig.core.model.biosynthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Product of a biosynthetic path.
 *
 * @param name product name
 * @param structure literal structure, may be null
 * @param comment free text, may be null
 */
public record Product(String name, Smiles structure, String comment) implements Validatable {

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationErrorInfo("Product.name", "Missing name"));
        }
        if (structure != null) {
            errors.addAll(structure.validate(context));
        }
        return errors;
    }

    public static Product fromJson(JsonNode node) {
        JsonFields.object(node, "Product");
        return new Product(
            JsonFields.text(node, "name", "Product"),
            JsonFields.has(node, "structure") ? Smiles.fromJson(node.get("structure")) : null,
            JsonFields.optionalText(node, "comment", "Product"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        if (structure != null) {
            node.set("structure", structure.toJson());
        }
        JsonFields.putIfPresent(node, "comment", comment);
        return node;
    }
}
