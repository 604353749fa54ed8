package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.NcaEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Module behavior deviating from the colinearity rule.
 *
 * @param evidence supporting evidence
 * @param iterations iteration count, null when the module is not iterated
 * @param nonElongating whether the module loads without elongating, may be null
 * @param skipped whether the module is skipped, may be null
 */
public record NonCanonicalActivity(
    List<NcaEvidence> evidence,
    Iterations iterations,
    Boolean nonElongating,
    Boolean skipped
) implements Validatable {

    public NonCanonicalActivity {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(Validatable.validateAll(evidence, context));
        if (iterations != null) {
            errors.addAll(iterations.validate("NonCanonicalActivity.iterations"));
        }
        return errors;
    }

    public static NonCanonicalActivity fromJson(JsonNode node) {
        JsonFields.object(node, "NonCanonicalActivity");
        return new NonCanonicalActivity(
            JsonFields.requiredList(node, "evidence", "NonCanonicalActivity", NcaEvidence::fromJson),
            Iterations.fromWire(JsonFields.optionalInteger(node, "iterations", "NonCanonicalActivity")),
            JsonFields.optionalBool(node, "nonElongating", "NonCanonicalActivity"),
            JsonFields.optionalBool(node, "skipped", "NonCanonicalActivity"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "evidence", evidence, NcaEvidence::toJson);
        if (iterations != null) {
            node.put("iterations", iterations.count());
        }
        JsonFields.putIfPresent(node, "nonElongating", nonElongating);
        JsonFields.putIfPresent(node, "skipped", skipped);
        return node;
    }
}
