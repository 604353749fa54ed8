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
 * Acyltransferase (AT) payload: selects and loads the extender unit of a PKS module.
 *
 * <p>Wire flag {@code inactive} is the inverse of {@link #activity()}.
 *
 * @param subtype {@code cis-AT} or {@code trans-AT}, optional
 * @param substrates extender units
 * @param evidence evidence for the substrate specificity
 * @param activity catalytic activity
 */
public record Acyltransferase(
    String subtype,
    List<ATSubstrate> substrates,
    List<SubstrateEvidence> evidence,
    Activity activity
) implements DomainInfo {

    public static final Set<String> VALID_SUBTYPES = Set.of("cis-AT", "trans-AT");

    public Acyltransferase {
        substrates = substrates == null ? List.of() : List.copyOf(substrates);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        activity = Activity.orUnspecified(activity);
    }

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(DomainInfo.checkSubtype("Acyltransferase", subtype, VALID_SUBTYPES));
        errors.addAll(DomainInfo.checkSubstrateEvidence("Acyltransferase", substrates, evidence, context));
        if (activity == Activity.INACTIVE) {
            if (!substrates.isEmpty()) {
                errors.add(new ValidationErrorInfo("Acyltransferase.substrates", "Inactive domains cannot have substrates"));
            }
            if (evidence.isEmpty()) {
                errors.add(new ValidationErrorInfo("Acyltransferase.evidence", "Inactive domains require evidence"));
            }
        }
        errors.addAll(Validatable.validateAll(substrates, context));
        errors.addAll(Validatable.validateAll(evidence, context));
        return errors;
    }

    public static Acyltransferase fromJson(JsonNode node) {
        return new Acyltransferase(
            JsonFields.optionalText(node, "subtype", "Acyltransferase"),
            JsonFields.list(node, "substrates", "Acyltransferase", ATSubstrate::fromJson),
            JsonFields.list(node, "evidence", "Acyltransferase", SubstrateEvidence::fromJson),
            Activity.readInactive(node, "Acyltransferase"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        JsonFields.putListIfNotEmpty(node, "substrates", substrates, ATSubstrate::toJson);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        activity.writeInactive(node);
        return node;
    }
}
