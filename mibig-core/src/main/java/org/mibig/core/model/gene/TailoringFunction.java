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
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tailoring reaction catalyzed by a gene product.
 *
 * @param function one of {@link #VALID_FUNCTIONS}
 * @param references supporting citations
 * @param dbReference MITE accession such as {@code mite:MITE0000001}, may be null
 * @param details free text, may be null
 */
public record TailoringFunction(
    String function,
    List<Citation> references,
    String dbReference,
    String details
) implements Validatable {

    public static final String OTHER = "Other";

    public static final Set<String> VALID_FUNCTIONS = Set.of(
        "Acetylation", "Acylation", "Amination", "Biaryl bond formation", "Carboxylation",
        "Cyclization", "Deamination", "Decarboxylation", "Dehydration", "Dehydrogenation",
        "Demethylation", "Dioxygenation", "Epimerization", "FADH2 supply for chlorination",
        "Glycosylation", "Halogenation", "Heterocyclization", "Hydrolysis", "Hydroxylation",
        "Lasso macrolactam formation", "Methylation", "Monooxygenation", "Oxidation",
        "Phosphorylation", "Prenylation", "Reduction", "Sulfation", OTHER
    );

    private static final Pattern DB_REFERENCE = Pattern.compile("^mite:MITE\\d{7}$");

    public TailoringFunction {
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (function == null || !VALID_FUNCTIONS.contains(function)) {
            errors.add(new ValidationErrorInfo("TailoringFunction.function",
                "Invalid tailoring function '" + function + "'"));
        }
        errors.addAll(Citation.validateRequired(references, "TailoringFunction.references", context));
        if (dbReference != null && !DB_REFERENCE.matcher(dbReference).matches()) {
            errors.add(new ValidationErrorInfo("TailoringFunction.db_reference",
                "Invalid database reference '" + dbReference + "'"));
        }
        return errors;
    }

    public static TailoringFunction fromJson(JsonNode node) {
        JsonFields.object(node, "TailoringFunction");
        return new TailoringFunction(
            JsonFields.text(node, "function", "TailoringFunction"),
            JsonFields.list(node, "references", "TailoringFunction", Citation::fromJson),
            JsonFields.optionalText(node, "db_reference", "TailoringFunction"),
            JsonFields.optionalText(node, "details", "TailoringFunction"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("function", function);
        JsonFields.putList(node, "references", references, Citation::toJson);
        JsonFields.putIfPresent(node, "db_reference", dbReference);
        JsonFields.putIfPresent(node, "details", details);
        return node;
    }
}
