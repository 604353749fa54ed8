package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * A {@code (method, references)} pair backing some annotation.
 *
 * <p>Each implementation owns a closed vocabulary of methods. References are required above
 * the questionable tier, except for {@value #SEQUENCE_BASED_PREDICTION}, which needs none.
 *
 * <p>Wire form is {@code {"method": ..., "references": [...]}}, with {@code references} omitted
 * when empty.
 */
public interface Evidence extends Validatable {

    /** The one method that is a prediction rather than an experiment. */
    String SEQUENCE_BASED_PREDICTION = "Sequence-based prediction";

    String method();

    List<Citation> references();

    /**
     * @return closed method vocabulary of this evidence kind
     */
    Set<String> validMethods();

    default boolean isPrediction() {
        return SEQUENCE_BASED_PREDICTION.equals(method());
    }

    @Override
    default List<ValidationErrorInfo> validate(ValidationContext context) {
        String kind = getClass().getSimpleName();
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (!validMethods().contains(method())) {
            errors.add(new ValidationErrorInfo(kind + ".method", "Invalid method '" + method() + "'"));
        }
        if (isPrediction()) {
            errors.addAll(Citation.validateAll(references(), context));
        } else {
            errors.addAll(Citation.validateRequired(references(), kind + ".references", context));
        }
        return errors;
    }

    default ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("method", method());
        JsonFields.putListIfNotEmpty(node, "references", references(), Citation::toJson);
        return node;
    }

    /**
     * Decodes the shared wire form.
     *
     * @param node evidence object
     * @param path entity path for error reporting
     * @param factory record constructor of the concrete evidence kind
     * @param <E> evidence kind
     * @return decoded evidence, not yet validated
     */
    static <E extends Evidence> E read(JsonNode node, String path, BiFunction<String, List<Citation>, E> factory) {
        JsonFields.object(node, path);
        return factory.apply(
            JsonFields.text(node, "method", path),
            JsonFields.list(node, "references", path, Citation::fromJson));
    }

    /**
     * Collects the references of a list of evidence.
     */
    static List<Citation> referencesOf(List<? extends Evidence> evidence) {
        List<Citation> references = new ArrayList<>();
        evidence.forEach(item -> references.addAll(item.references()));
        return references;
    }
}
