package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A building block incorporated by a module or used as a PKS starter unit.
 *
 * @param name monomer name, restricted to {@link #VALID_NAME}
 * @param structure monomer structure
 * @param references supporting citations
 */
public record Monomer(String name, Smiles structure, List<Citation> references) implements Validatable {

    /** Allowed characters of compound and monomer names. */
    public static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Zα-ωΑ-Ω0-9\\[\\]'()/&,. +-]+$");

    public Monomer {
        Objects.requireNonNull(structure, "structure must not be null");
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            errors.add(new ValidationErrorInfo("Monomer.name", "Invalid name '" + name + "'"));
        }
        errors.addAll(structure.validate(context));
        errors.addAll(Citation.validateAll(references, context));
        return errors;
    }

    public static Monomer fromJson(JsonNode node) {
        JsonFields.object(node, "Monomer");
        return new Monomer(
            JsonFields.text(node, "name", "Monomer"),
            Smiles.fromJson(JsonFields.required(node, "structure", "Monomer")),
            JsonFields.list(node, "references", "Monomer", Citation::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        node.set("structure", structure.toJson());
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
