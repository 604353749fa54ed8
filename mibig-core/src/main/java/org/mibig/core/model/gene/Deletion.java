package org.mibig.core.model.gene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reference-record gene that is not part of the cluster.
 *
 * @param id removed gene
 * @param reason why the gene is removed
 */
public record Deletion(GeneId id, String reason) implements Validatable {

    public Deletion {
        Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(id.validate(context));
        if (reason == null || reason.isBlank()) {
            errors.add(new ValidationErrorInfo("Genes.Deletion.reason", "Reason must be provided"));
        }
        return errors;
    }

    public static Deletion fromJson(JsonNode node) {
        JsonFields.object(node, "Deletion");
        return new Deletion(
            GeneId.fromJson(JsonFields.required(node, "id", "Deletion")),
            JsonFields.text(node, "reason", "Deletion"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("id", id.toJson());
        node.put("reason", reason);
        return node;
    }
}
