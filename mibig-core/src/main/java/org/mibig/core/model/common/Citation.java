package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A literature or web reference, encoded as {@code "database:value"}.
 *
 * <p>Citations compare by value; two citations with the same database and value are equal.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Citation pubmed = Citation.parse("pubmed:12345");
 * Citation doi = Citation.of("doi", "10.1016/j.chembiol.2011.01.007");
 * }</pre>
 *
 * @param database one of {@code pubmed}, {@code doi}, {@code patent}, {@code url}
 * @param value database-specific identifier
 */
public record Citation(String database, String value) implements Validatable, Comparable<Citation> {

    private static final Map<String, Pattern> VALID_PATTERNS = Map.of(
        "pubmed", Pattern.compile("^(\\d+)$"),
        "doi", Pattern.compile("^10\\.\\d{4,9}/[-._;()/:a-zA-Z0-9]+$"),
        "patent", Pattern.compile("^(.+)$"),
        "url", Pattern.compile("^https?://(www\\.)?[-a-zA-Z0-9@:%._+~#=]{2,256}\\.[a-z]{2,6}\\b([-a-zA-Z0-9@:%_+.~#?&/=]*)$")
    );

    private static final Comparator<Citation> ORDER =
        Comparator.comparing(Citation::database).thenComparing(Citation::value);

    public Citation {
        if (database == null) {
            database = "";
        }
        if (value == null) {
            value = "";
        }
    }

    /**
     * Creates and validates a citation.
     *
     * @throws ValidationException if the database is unknown or the value does not match it
     */
    public static Citation of(String database, String value) {
        return ValidationContext.full().check(new Citation(database, value));
    }

    /**
     * Parses and validates a {@code "database:value"} string.
     *
     * @throws ValidationException if the text is malformed or invalid
     */
    public static Citation parse(String text) {
        return ValidationContext.full().check(fromText(text));
    }

    /**
     * Splits a {@code "database:value"} string without validating it.
     */
    public static Citation fromText(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            throw ValidationException.of("Citation", "Expected 'database:value', got '" + text + "'");
        }
        return new Citation(text.substring(0, colon), text.substring(colon + 1));
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        Pattern pattern = VALID_PATTERNS.get(database);
        if (pattern == null) {
            return List.of(new ValidationErrorInfo("Citation", "Invalid database type '" + database + "'"));
        }
        if (!pattern.matcher(value).matches()) {
            return List.of(new ValidationErrorInfo("Citation",
                "Invalid value '" + value + "' for database '" + database + "'"));
        }
        return List.of();
    }

    /**
     * Validates every citation of an optional reference list.
     */
    public static List<ValidationErrorInfo> validateAll(List<Citation> references, ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        for (Citation citation : references) {
            errors.addAll(citation.validate(context));
        }
        return errors;
    }

    /**
     * Validates a reference list that must be non-empty above the questionable tier.
     *
     * @param references citations to check
     * @param field field reported when the list is empty
     * @param context validation context
     * @return violations
     */
    public static List<ValidationErrorInfo> validateRequired(List<Citation> references, String field,
                                                             ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (references.isEmpty() && !context.isRelaxed()) {
            errors.add(new ValidationErrorInfo(field, "At least one reference is required"));
        }
        errors.addAll(validateAll(references, context));
        return errors;
    }

    public static Citation fromJson(JsonNode node) {
        return fromText(JsonFields.asText(node, "Citation"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(toString());
    }

    @Override
    public int compareTo(Citation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return database + ":" + value;
    }
}
