package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Ketoreductase (KR) payload.
 *
 * <p>Wire flag {@code inactive} is the inverse of {@link #activity()}. Above the questionable
 * tier a KR annotation must carry evidence.
 *
 * @param activity catalytic activity
 * @param stereochemistry KR type, one of {@link #VALID_STEREOCHEMISTRY}
 * @param evidence supporting evidence
 */
public record Ketoreductase(Activity activity, String stereochemistry, List<SubstrateEvidence> evidence)
    implements DomainInfo {

    public static final Set<String> VALID_STEREOCHEMISTRY = Set.of("A", "B", "A1", "A2", "B1", "B2", "C1", "C2");

    public Ketoreductase {
        activity = Activity.orUnspecified(activity);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (stereochemistry != null && !VALID_STEREOCHEMISTRY.contains(stereochemistry)) {
            errors.add(new ValidationErrorInfo("Ketoreductase.stereochemistry",
                "Invalid stereochemistry: " + stereochemistry));
        }
        if (evidence.isEmpty() && !context.isRelaxed()) {
            errors.add(new ValidationErrorInfo("Ketoreductase.evidence", "Missing evidence"));
        }
        errors.addAll(Validatable.validateAll(evidence, context));
        return errors;
    }

    public static Ketoreductase fromJson(JsonNode node) {
        return new Ketoreductase(
            Activity.readInactive(node, "Ketoreductase"),
            JsonFields.optionalText(node, "stereochemistry", "Ketoreductase"),
            JsonFields.list(node, "evidence", "Ketoreductase", SubstrateEvidence::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        activity.writeInactive(node);
        JsonFields.putIfPresent(node, "stereochemistry", stereochemistry);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        return node;
    }
}
