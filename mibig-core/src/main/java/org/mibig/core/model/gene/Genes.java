package org.mibig.core.model.gene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Gene-level corrections and annotations relative to the reference record.
 *
 * @param toAdd genes absent from the record
 * @param toDelete record genes outside the cluster
 * @param annotations per-gene metadata
 */
public record Genes(List<Addition> toAdd, List<Deletion> toDelete, List<Annotation> annotations) implements Validatable {

    public Genes {
        toAdd = toAdd == null ? List.of() : List.copyOf(toAdd);
        toDelete = toDelete == null ? List.of() : List.copyOf(toDelete);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public boolean isEmpty() {
        return toAdd.isEmpty() && toDelete.isEmpty() && annotations.isEmpty();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(Validatable.validateAll(toAdd, context));
        errors.addAll(Validatable.validateAll(toDelete, context));
        errors.addAll(Validatable.validateAll(annotations, context));
        return errors;
    }

    public static Genes fromJson(JsonNode node) {
        JsonFields.object(node, "Genes");
        return new Genes(
            JsonFields.list(node, "to_add", "Genes", Addition::fromJson),
            JsonFields.list(node, "to_delete", "Genes", Deletion::fromJson),
            JsonFields.list(node, "annotations", "Genes", Annotation::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putListIfNotEmpty(node, "to_add", toAdd, Addition::toJson);
        JsonFields.putListIfNotEmpty(node, "to_delete", toDelete, Deletion::toJson);
        JsonFields.putListIfNotEmpty(node, "annotations", annotations, Annotation::toJson);
        return node;
    }
}
