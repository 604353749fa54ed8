package org.mibig.core.model.domain;

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
 * Substrate of a domain without a dedicated substrate vocabulary.
 *
 * @param name substrate name
 * @param structure optional structure
 */
public record DomainSubstrate(String name, Smiles structure) implements Substrate, Validatable {

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationErrorInfo("Substrate.name", "Missing name"));
        }
        if (structure != null) {
            errors.addAll(structure.validate(context));
        }
        return errors;
    }

    public static DomainSubstrate fromJson(JsonNode node) {
        JsonFields.object(node, "Substrate");
        return new DomainSubstrate(
            JsonFields.text(node, "name", "Substrate"),
            JsonFields.has(node, "structure") ? Smiles.fromJson(node.get("structure")) : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        if (structure != null) {
            node.set("structure", structure.toJson());
        }
        return node;
    }
}
