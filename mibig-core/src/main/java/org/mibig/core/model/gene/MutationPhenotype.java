package org.mibig.core.model.gene;

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
 * Observed phenotype of a gene mutant.
 *
 * @param phenotype short phenotype description
 * @param details free text, may be null
 * @param references supporting citations
 */
public record MutationPhenotype(String phenotype, String details, List<Citation> references) implements Validatable {

    public MutationPhenotype {
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (phenotype == null || phenotype.isBlank()) {
            errors.add(new ValidationErrorInfo("MutationPhenotype.phenotype", "Phenotype must be provided"));
        }
        errors.addAll(Citation.validateRequired(references, "MutationPhenotype.references", context));
        return errors;
    }

    public static MutationPhenotype fromJson(JsonNode node) {
        JsonFields.object(node, "MutationPhenotype");
        return new MutationPhenotype(
            JsonFields.text(node, "phenotype", "MutationPhenotype"),
            JsonFields.optionalText(node, "details", "MutationPhenotype"),
            JsonFields.list(node, "references", "MutationPhenotype", Citation::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("phenotype", phenotype);
        JsonFields.putList(node, "references", references, Citation::toJson);
        JsonFields.putIfPresent(node, "details", details);
        return node;
    }
}
