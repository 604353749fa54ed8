package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Michael-branching payload.
 *
 * @param references supporting citations
 */
public record Branching(List<Citation> references) implements DomainInfo {

    public Branching {
        references = references == null ? List.of() : List.copyOf(references);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return Citation.validateAll(references, context);
    }

    public static Branching fromJson(JsonNode node) {
        return new Branching(JsonFields.list(node, "references", "Branching", Citation::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        return node;
    }
}
