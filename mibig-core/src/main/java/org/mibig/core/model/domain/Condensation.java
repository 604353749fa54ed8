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
 * Condensation (C) payload. A stated subtype must be backed by references.
 *
 * @param subtype one of {@link #VALID_SUBTYPES}, optional
 * @param references citations for the subtype
 * @param evidence substrate evidence
 * @param substrates condensed substrates
 */
public record Condensation(
    String subtype,
    List<Citation> references,
    List<SubstrateEvidence> evidence,
    List<DomainSubstrate> substrates
) implements DomainInfo {

    public static final Set<String> VALID_SUBTYPES = Set.of(
        "Dual", "Starter", "LCL", "DCL", "Ester bond-forming", "Heterocyclization");

    public Condensation {
        references = references == null ? List.of() : List.copyOf(references);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        substrates = substrates == null ? List.of() : List.copyOf(substrates);
    }

    public static Condensation of(String subtype) {
        return new Condensation(subtype, List.of(), List.of(), List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(DomainInfo.checkSubtype("Condensation", subtype, VALID_SUBTYPES));
        if (subtype != null && !subtype.isEmpty()) {
            errors.addAll(Citation.validateRequired(references, "Condensation.references", context));
        } else {
            errors.addAll(Citation.validateAll(references, context));
        }
        errors.addAll(Validatable.validateAll(evidence, context));
        errors.addAll(Validatable.validateAll(substrates, context));
        errors.addAll(DomainInfo.checkSubstrateEvidence("Condensation", substrates, evidence, context));
        return errors;
    }

    public static Condensation fromJson(JsonNode node) {
        return new Condensation(
            JsonFields.optionalText(node, "subtype", "Condensation"),
            JsonFields.list(node, "references", "Condensation", Citation::fromJson),
            JsonFields.list(node, "evidence", "Condensation", SubstrateEvidence::fromJson),
            JsonFields.list(node, "substrates", "Condensation", DomainSubstrate::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        JsonFields.putListIfNotEmpty(node, "substrates", substrates, DomainSubstrate::toJson);
        return node;
    }
}
