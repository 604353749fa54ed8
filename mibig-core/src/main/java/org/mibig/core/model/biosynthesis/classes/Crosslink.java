package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.sequence.CodingSequence;

import java.util.ArrayList;
import java.util.List;

/**
 * Covalent link between two residues of a precursor peptide.
 *
 * @param from first residue, 0-based
 * @param to second residue, after {@code from}
 * @param type link type, may be null
 * @param details free text, may be null
 */
public record Crosslink(int from, int to, String type, String details) {

    /**
     * Validates residue positions against the precursor's translation.
     *
     * @param cds precursor CDS, may be null
     * @return violations
     */
    public List<ValidationErrorInfo> validate(CodingSequence cds) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (from < 0) {
            errors.add(new ValidationErrorInfo("RippCrosslink.from", "From must be greater than or equal to 0"));
        }
        if (to < 0) {
            errors.add(new ValidationErrorInfo("RippCrosslink.to", "To must be greater than or equal to 0"));
        }
        if (from >= to) {
            errors.add(new ValidationErrorInfo("RippCrosslink.from", "From must be less than to"));
        }
        if (cds != null) {
            if (from >= cds.translationLength()) {
                errors.add(new ValidationErrorInfo("RippCrosslink.from",
                    "From must be less than the length of the CDS"));
            }
            if (to > cds.translationLength()) {
                errors.add(new ValidationErrorInfo("RippCrosslink.to",
                    "To must be less than or equal to the length of the CDS"));
            }
        }
        return errors;
    }

    public static Crosslink fromJson(JsonNode node) {
        JsonFields.object(node, "RippCrosslink");
        return new Crosslink(
            JsonFields.integer(node, "from", "RippCrosslink"),
            JsonFields.integer(node, "to", "RippCrosslink"),
            JsonFields.optionalText(node, "type", "RippCrosslink"),
            JsonFields.optionalText(node, "details", "RippCrosslink"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("from", from);
        node.put("to", to);
        JsonFields.putIfPresent(node, "type", type);
        JsonFields.putIfPresent(node, "details", details);
        return node;
    }
}
