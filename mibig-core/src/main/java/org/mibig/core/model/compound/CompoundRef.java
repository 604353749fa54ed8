package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cross-reference to a compound database, written {@code "database:identifier"}.
 *
 * @param database one of the keys of {@link #DATABASE_PATTERNS}
 * @param identifier database-specific identifier
 */
public record CompoundRef(String database, String identifier) implements Validatable, Comparable<CompoundRef> {

    /** Identifier syntax per database. */
    public static final Map<String, Pattern> DATABASE_PATTERNS = Map.of(
        "pubchem", Pattern.compile("^\\d+$"),
        "chebi", Pattern.compile("^\\d+$"),
        "chembl", Pattern.compile("^CHEMBL\\d+$"),
        "chemspider", Pattern.compile("^\\d+$"),
        "npatlas", Pattern.compile("^NPA\\d+$"),
        "lotus", Pattern.compile("^Q\\d+$"),
        "gnps", Pattern.compile("^MSV\\d+$"),
        "cyanometdb", Pattern.compile("^CyanoMetDB_\\d{4}$")
    );

    /**
     * Splits a {@code database:identifier} string at the first colon.
     *
     * @throws ValidationException when there is no colon
     */
    public static CompoundRef parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            throw ValidationException.of("CompoundRef", "Expected 'database:identifier', got '" + text + "'");
        }
        return new CompoundRef(text.substring(0, colon), text.substring(colon + 1));
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        Pattern pattern = DATABASE_PATTERNS.get(database);
        if (pattern == null) {
            return List.of(new ValidationErrorInfo("CompoundRef.database", "Invalid database '" + database + "'"));
        }
        if (identifier == null || !pattern.matcher(identifier).matches()) {
            return List.of(new ValidationErrorInfo("CompoundRef.identifier",
                "Invalid identifier '" + identifier + "' for database '" + database + "'"));
        }
        return List.of();
    }

    public static CompoundRef fromJson(JsonNode node) {
        return parse(JsonFields.asText(node, "CompoundRef"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(toString());
    }

    @Override
    public int compareTo(CompoundRef other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return database + ":" + identifier;
    }
}
