package org.mibig.core.model.gene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.NovelGeneId;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Curated metadata for one gene.
 *
 * @param id annotated gene
 * @param name preferred gene name, may be null
 * @param aliases alternative names
 * @param product gene product, may be null
 * @param functions roles in the cluster
 * @param tailoringFunctions tailoring reactions
 * @param domains catalytic domains of the product
 * @param mutationPhenotype mutant phenotype, may be null
 * @param comment free text, may be null
 */
public record Annotation(
    GeneId id,
    NovelGeneId name,
    List<NovelGeneId> aliases,
    String product,
    List<GeneFunction> functions,
    List<TailoringFunction> tailoringFunctions,
    List<Domain> domains,
    MutationPhenotype mutationPhenotype,
    String comment
) implements Validatable {

    public Annotation {
        Objects.requireNonNull(id, "id must not be null");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        functions = functions == null ? List.of() : List.copyOf(functions);
        tailoringFunctions = tailoringFunctions == null ? List.of() : List.copyOf(tailoringFunctions);
        domains = domains == null ? List.of() : List.copyOf(domains);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(id.validate(context));
        if (name != null) {
            errors.addAll(name.validate(context));
        }
        errors.addAll(Validatable.validateAll(aliases, context));
        errors.addAll(Validatable.validateAll(functions, context));
        errors.addAll(Validatable.validateAll(tailoringFunctions, context));
        errors.addAll(Validatable.validateAll(domains, context));
        if (mutationPhenotype != null) {
            errors.addAll(mutationPhenotype.validate(context));
        }
        return errors;
    }

    public static Annotation fromJson(JsonNode node) {
        JsonFields.object(node, "Annotation");
        return new Annotation(
            GeneId.fromJson(JsonFields.required(node, "id", "Annotation")),
            JsonFields.has(node, "name") ? NovelGeneId.fromJson(node.get("name")) : null,
            JsonFields.list(node, "aliases", "Annotation", NovelGeneId::fromJson),
            JsonFields.optionalText(node, "product", "Annotation"),
            JsonFields.list(node, "functions", "Annotation", GeneFunction::fromJson),
            JsonFields.list(node, "tailoring_functions", "Annotation", TailoringFunction::fromJson),
            JsonFields.list(node, "domains", "Annotation", Domain::fromJson),
            JsonFields.has(node, "mutation_phenotype") ? MutationPhenotype.fromJson(node.get("mutation_phenotype")) : null,
            JsonFields.optionalText(node, "comment", "Annotation"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("id", id.toJson());
        if (name != null) {
            node.set("name", name.toJson());
        }
        JsonFields.putListIfNotEmpty(node, "aliases", aliases, NovelGeneId::toJson);
        JsonFields.putIfPresent(node, "product", product);
        JsonFields.putListIfNotEmpty(node, "functions", functions, GeneFunction::toJson);
        JsonFields.putListIfNotEmpty(node, "tailoring_functions", tailoringFunctions, TailoringFunction::toJson);
        JsonFields.putListIfNotEmpty(node, "domains", domains, Domain::toJson);
        if (mutationPhenotype != null) {
            node.set("mutation_phenotype", mutationPhenotype.toJson());
        }
        JsonFields.putIfPresent(node, "comment", comment);
        return node;
    }
}
