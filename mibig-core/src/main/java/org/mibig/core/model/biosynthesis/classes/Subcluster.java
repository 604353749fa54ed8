package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Genes of a saccharide subcluster.
 *
 * @param genes member genes
 * @param references supporting citations
 */
public record Subcluster(List<GeneId> genes, List<Citation> references) implements Validatable {

    public Subcluster {
        genes = genes == null ? List.of() : List.copyOf(genes);
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(Validatable.validateAll(genes, context));
        errors.addAll(Citation.validateRequired(references, "Subcluster.references", context));
        return errors;
    }

    public static Subcluster fromJson(JsonNode node) {
        JsonFields.object(node, "Subcluster");
        return new Subcluster(
            JsonFields.requiredList(node, "genes", "Subcluster", GeneId::fromJson),
            JsonFields.list(node, "references", "Subcluster", Citation::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "genes", genes, GeneId::toJson);
        JsonFields.putList(node, "references", references, Citation::toJson);
        return node;
    }
}
