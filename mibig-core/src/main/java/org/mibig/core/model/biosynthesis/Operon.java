package org.mibig.core.model.biosynthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Evidence;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.OperonEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Co-transcribed genes.
 *
 * @param genes operon members
 * @param evidence supporting evidence, empty for migrated predictions
 */
public record Operon(List<GeneId> genes, List<OperonEvidence> evidence) implements Validatable {

    public Operon {
        genes = genes == null ? List.of() : List.copyOf(genes);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (genes.isEmpty()) {
            errors.add(new ValidationErrorInfo("Operon.genes", "Operons require at least one gene"));
        }
        errors.addAll(Validatable.validateAll(genes, context));
        errors.addAll(Validatable.validateAll(evidence, context));
        return errors;
    }

    public List<Citation> references() {
        return Evidence.referencesOf(evidence);
    }

    public static Operon fromJson(JsonNode node) {
        JsonFields.object(node, "Operon");
        return new Operon(
            JsonFields.requiredList(node, "genes", "Operon", GeneId::fromJson),
            JsonFields.list(node, "evidence", "Operon", OperonEvidence::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "genes", genes, GeneId::toJson);
        JsonFields.putList(node, "evidence", evidence, OperonEvidence::toJson);
        return node;
    }
}
