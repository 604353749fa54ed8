package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.ValidationContext;

import java.util.List;
import java.util.Set;

/**
 * Thioesterase (TE) payload.
 *
 * @param subtype {@code Type I} or {@code Type II}, optional
 */
public record Thioesterase(String subtype) implements DomainInfo {

    public static final Set<String> VALID_SUBTYPES = Set.of("Type I", "Type II");

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return DomainInfo.checkSubtype("Thioesterase", subtype, VALID_SUBTYPES);
    }

    public static Thioesterase fromJson(JsonNode node) {
        return new Thioesterase(JsonFields.optionalText(node, "subtype", "Thioesterase"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        return node;
    }
}
