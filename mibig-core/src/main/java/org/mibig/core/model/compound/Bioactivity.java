package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Biological activity observed, or tested and not observed, for a compound.
 *
 * @param name activity name
 * @param observed whether the activity was observed
 * @param references supporting citations
 * @param assays measurements
 */
public record Bioactivity(String name, boolean observed, List<Citation> references, List<Assay> assays)
    implements Validatable {

    public Bioactivity {
        references = references == null ? List.of() : List.copyOf(references);
        assays = assays == null ? List.of() : List.copyOf(assays);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationErrorInfo("Bioactivity.name", "Missing name"));
        }
        errors.addAll(Citation.validateRequired(references, "Bioactivity.references", context));
        errors.addAll(Validatable.validateAll(assays, context));
        return errors;
    }

    public static Bioactivity fromJson(JsonNode node) {
        JsonFields.object(node, "Bioactivity");
        return new Bioactivity(
            JsonFields.text(node, "name", "Bioactivity"),
            JsonFields.bool(node, "observed", "Bioactivity"),
            JsonFields.list(node, "references", "Bioactivity", Citation::fromJson),
            JsonFields.list(node, "assays", "Bioactivity", Assay::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        node.put("observed", observed);
        JsonFields.putList(node, "references", references, Citation::toJson);
        JsonFields.putListIfNotEmpty(node, "assays", assays, Assay::toJson);
        return node;
    }
}
