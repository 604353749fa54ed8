package org.mibig.core.model.gene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Evidence;
import org.mibig.core.model.common.FunctionEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Role of a gene in the cluster.
 *
 * <p>Wire form nests name and details: {@code {"function": {"name": "Other", "details": ...},
 * "evidence": [...]}}.
 *
 * @param function one of {@link #VALID_FUNCTIONS}
 * @param details free text, required for "Other"
 * @param evidence supporting evidence
 * @param mutationPhenotype mutant phenotype, may be null
 */
public record GeneFunction(
    String function,
    String details,
    List<FunctionEvidence> evidence,
    MutationPhenotype mutationPhenotype
) implements Validatable {

    public static final String OTHER = "Other";

    public static final Set<String> VALID_FUNCTIONS = Set.of(
        "Activation / processing",
        "Maturation",
        "Precursor",
        "Precursor biosynthesis",
        "Regulation",
        "Resistance/immunity",
        "Scaffold biosynthesis",
        "Tailoring",
        "Transport",
        OTHER
    );

    public GeneFunction {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (function == null || !VALID_FUNCTIONS.contains(function)) {
            errors.add(new ValidationErrorInfo("GeneFunction.function", "Invalid function '" + function + "'"));
        }
        if (OTHER.equals(function) && (details == null || details.isBlank())) {
            errors.add(new ValidationErrorInfo("GeneFunction.details", "Details must be provided for 'Other' function"));
        }
        if (mutationPhenotype != null) {
            errors.addAll(mutationPhenotype.validate(context));
        }
        errors.addAll(Validatable.validateAll(evidence, context));
        return errors;
    }

    public List<Citation> references() {
        List<Citation> references = new ArrayList<>(Evidence.referencesOf(evidence));
        if (mutationPhenotype != null) {
            references.addAll(mutationPhenotype.references());
        }
        return references.stream().distinct().sorted().toList();
    }

    public static GeneFunction fromJson(JsonNode node) {
        JsonFields.object(node, "GeneFunction");
        JsonNode function = JsonFields.object(JsonFields.required(node, "function", "GeneFunction"), "GeneFunction.function");
        return new GeneFunction(
            JsonFields.text(function, "name", "GeneFunction.function"),
            JsonFields.optionalText(function, "details", "GeneFunction.function"),
            JsonFields.requiredList(node, "evidence", "GeneFunction", FunctionEvidence::fromJson),
            JsonFields.has(node, "mutation_phenotype") ? MutationPhenotype.fromJson(node.get("mutation_phenotype")) : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ObjectNode functionNode = node.putObject("function");
        functionNode.put("name", function);
        JsonFields.putIfPresent(functionNode, "details", details);
        JsonFields.putList(node, "evidence", evidence, FunctionEvidence::toJson);
        if (mutationPhenotype != null) {
            node.set("mutation_phenotype", mutationPhenotype.toJson());
        }
        return node;
    }
}
