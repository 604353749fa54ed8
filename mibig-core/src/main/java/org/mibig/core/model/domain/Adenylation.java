package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Adenylation (A) payload: selects and activates the amino acid of an NRPS module.
 *
 * <p>Shared by the {@code adenylation} and legacy {@code amp-binding} domain tags. Wire flag
 * {@code inactive} is the inverse of {@link #activity()}.
 *
 * @param substrates activated substrates
 * @param evidence evidence for the specificity
 * @param precursorBiosynthesis genes producing non-proteinogenic substrates
 * @param activity catalytic activity
 */
public record Adenylation(
    List<AdenylationSubstrate> substrates,
    List<SubstrateEvidence> evidence,
    List<GeneId> precursorBiosynthesis,
    Activity activity
) implements DomainInfo {

    public Adenylation {
        substrates = substrates == null ? List.of() : List.copyOf(substrates);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        precursorBiosynthesis = precursorBiosynthesis == null ? List.of() : List.copyOf(precursorBiosynthesis);
        activity = Activity.orUnspecified(activity);
    }

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(DomainInfo.checkSubstrateEvidence("Adenylation", substrates, evidence, context));
        if (activity == Activity.INACTIVE) {
            if (!substrates.isEmpty()) {
                errors.add(new ValidationErrorInfo("Adenylation.substrates", "Inactive domains cannot have substrates"));
            }
            if (evidence.isEmpty()) {
                errors.add(new ValidationErrorInfo("Adenylation.evidence", "Inactive domains require evidence"));
            }
        }
        errors.addAll(Validatable.validateAll(substrates, context));
        errors.addAll(Validatable.validateAll(evidence, context));
        errors.addAll(Validatable.validateAll(precursorBiosynthesis, context));
        return errors;
    }

    public static Adenylation fromJson(JsonNode node) {
        return new Adenylation(
            JsonFields.list(node, "substrates", "Adenylation", AdenylationSubstrate::fromJson),
            JsonFields.list(node, "evidence", "Adenylation", SubstrateEvidence::fromJson),
            JsonFields.list(node, "precursor_biosynthesis", "Adenylation", GeneId::fromJson),
            Activity.readInactive(node, "Adenylation"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putListIfNotEmpty(node, "substrates", substrates, AdenylationSubstrate::toJson);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        JsonFields.putListIfNotEmpty(node, "precursor_biosynthesis", precursorBiosynthesis, GeneId::toJson);
        activity.writeInactive(node);
        return node;
    }
}
