package org.mibig.core.model.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.sequence.CodingSequence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Integer interval {@code [begin, end)} over a nucleotide sequence or a translation.
 *
 * <p>Wire form is {@code {"from": begin, "to": end}}.
 *
 * @param begin start position
 * @param end end position
 */
public record Location(int begin, int end) implements Validatable {

    /** Placeholder for positions that could not be recovered from imported data. */
    public static final Location UNKNOWN = new Location(-1, -1);

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return validate(context, null);
    }

    /**
     * Validates the interval against an optional coding sequence.
     *
     * @param context validation context
     * @param cds CDS whose translation bounds the interval, may be null
     * @return violations
     */
    public List<ValidationErrorInfo> validate(ValidationContext context, CodingSequence cds) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (begin > end) {
            errors.add(new ValidationErrorInfo("Location", "Start " + begin + " is after end " + end));
        }
        if (!context.isRelaxed() && (begin < 0 || end < 0)) {
            errors.add(new ValidationErrorInfo("Location", "Negative coordinates [" + begin + ", " + end + ")"));
        }
        if (cds != null && end > cds.translationLength()) {
            errors.add(new ValidationErrorInfo("Location",
                "End " + end + " exceeds translation length " + cds.translationLength()));
        }
        return errors;
    }

    public static Location fromJson(JsonNode node) {
        JsonFields.object(node, "Location");
        return new Location(
            JsonFields.integer(node, "from", "Location"),
            JsonFields.integer(node, "to", "Location"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("from", begin);
        node.put("to", end);
        return node;
    }
}
