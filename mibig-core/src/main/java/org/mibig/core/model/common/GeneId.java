package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Identifier of a gene that must exist in the reference record.
 *
 * <p>Syntax rules are those of {@link NovelGeneId}. When the validation context carries a
 * sequence record, the identifier must also resolve to one of its coding sequences.
 *
 * @param value locus tag, gene name or protein id
 */
public record GeneId(String value) implements Validatable, Comparable<GeneId> {

    public GeneId {
        if (value == null) {
            value = "";
        }
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = NovelGeneId.checkSyntax(value, "GeneId");
        if (errors.isEmpty() && context.record() != null && context.cds(value).isEmpty()) {
            return List.of(new ValidationErrorInfo("GeneId",
                "Gene '" + value + "' not found in record " + context.record().id()));
        }
        return errors;
    }

    public static GeneId fromJson(JsonNode node) {
        return new GeneId(JsonFields.asText(node, "GeneId"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }

    @Override
    public int compareTo(GeneId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
