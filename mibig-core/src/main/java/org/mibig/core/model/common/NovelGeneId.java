package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Identifier of a gene that does not need to exist in the reference record, e.g. a newly
 * proposed gene name or an alias.
 *
 * @param value the identifier text
 */
public record NovelGeneId(String value) implements Validatable, Comparable<NovelGeneId> {

    /** Characters never allowed in a gene identifier. */
    static final Pattern INVALID_CHARS = Pattern.compile("[!?,;:=+*&^%$#@ \\t\\n\\r\\\\/\\[\\]{}()<>|~`'\"]");

    public NovelGeneId {
        if (value == null) {
            value = "";
        }
    }

    /**
     * Checks identifier syntax shared by {@link NovelGeneId} and {@link GeneId}.
     *
     * @param value identifier text
     * @param field field reported in violations
     * @return syntax violations
     */
    static List<ValidationErrorInfo> checkSyntax(String value, String field) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (value.isEmpty()) {
            errors.add(new ValidationErrorInfo(field, "Gene identifier must not be empty"));
        } else if (INVALID_CHARS.matcher(value).find()) {
            errors.add(new ValidationErrorInfo(field, "Invalid characters in gene identifier '" + value + "'"));
        }
        return errors;
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return checkSyntax(value, "NovelGeneId");
    }

    public static NovelGeneId fromJson(JsonNode node) {
        return new NovelGeneId(JsonFields.asText(node, "NovelGeneId"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }

    @Override
    public int compareTo(NovelGeneId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
