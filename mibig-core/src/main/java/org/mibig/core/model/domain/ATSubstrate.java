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
import java.util.Set;

/**
 * Extender unit loaded by an acyltransferase.
 *
 * <p>Names outside the fixed list are recorded as {@code other} with the original text in
 * {@code details}; such substrates also need a structure above the questionable tier.
 *
 * @param name one of {@link #VALID_NAMES}
 * @param details free text, required for {@code other}
 * @param structure optional structure
 */
public record ATSubstrate(String name, String details, Smiles structure) implements Substrate, Validatable {

    public static final String OTHER = "other";

    public static final Set<String> VALID_NAMES = Set.of(
        "acetyl-CoA",
        "malonyl-CoA",
        "methylmalonyl-CoA",
        "ethylmalonyl-CoA",
        "methoxymalonyl-CoA",
        OTHER
    );

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || !VALID_NAMES.contains(name)) {
            errors.add(new ValidationErrorInfo("ATSubstrate.name", "Invalid substrate name: " + name));
        }
        if (OTHER.equals(name)) {
            if (details == null || details.isBlank()) {
                errors.add(new ValidationErrorInfo("ATSubstrate.details", "Details are required for 'other' substrates"));
            }
            if (structure == null && !context.isRelaxed()) {
                errors.add(new ValidationErrorInfo("ATSubstrate.structure", "A structure is required for 'other' substrates"));
            }
        }
        if (structure != null) {
            errors.addAll(structure.validate(context));
        }
        return errors;
    }

    public static ATSubstrate fromJson(JsonNode node) {
        JsonFields.object(node, "ATSubstrate");
        return new ATSubstrate(
            JsonFields.text(node, "name", "ATSubstrate"),
            JsonFields.optionalText(node, "details", "ATSubstrate"),
            JsonFields.has(node, "structure") ? Smiles.fromJson(node.get("structure")) : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        JsonFields.putIfPresent(node, "details", details);
        if (structure != null) {
            node.set("structure", structure.toJson());
        }
        return node;
    }
}
