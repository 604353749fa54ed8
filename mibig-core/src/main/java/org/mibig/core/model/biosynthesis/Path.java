package org.mibig.core.model.biosynthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A biosynthetic route through the cluster's genes and modules.
 *
 * @param products what the route produces, at least one
 * @param steps ordered stages
 * @param references supporting citations
 * @param isSubcluster whether the route is carried out by a subcluster
 * @param producesPrecursor whether the products are precursors of the final compound
 */
public record Path(
    List<Product> products,
    PathSteps steps,
    List<Citation> references,
    boolean isSubcluster,
    boolean producesPrecursor
) implements Validatable {

    public Path {
        Objects.requireNonNull(steps, "steps must not be null");
        products = products == null ? List.of() : List.copyOf(products);
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (products.isEmpty()) {
            errors.add(new ValidationErrorInfo("Path.products", "Missing products"));
        }
        errors.addAll(Validatable.validateAll(products, context));
        errors.addAll(Citation.validateRequired(references, "Path.references", context));
        return errors;
    }

    public static Path fromJson(JsonNode node) {
        JsonFields.object(node, "Path");
        return new Path(
            JsonFields.requiredList(node, "products", "Path", Product::fromJson),
            PathSteps.fromJson(JsonFields.required(node, "steps", "Path")),
            JsonFields.list(node, "references", "Path", Citation::fromJson),
            JsonFields.bool(node, "isSubcluster", "Path"),
            JsonFields.bool(node, "producesPrecursor", "Path"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "products", products, Product::toJson);
        node.put("steps", steps.format());
        JsonFields.putList(node, "references", references, Citation::toJson);
        node.put("isSubcluster", isSubcluster);
        node.put("producesPrecursor", producesPrecursor);
        return node;
    }
}
