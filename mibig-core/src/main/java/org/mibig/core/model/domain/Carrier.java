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
 * Carrier payload: acyl (ACP) or peptidyl (PCP) carrier protein.
 *
 * @param subtype {@code ACP} or {@code PCP}, optional
 * @param betaBranching whether the carrier takes part in beta-branching, optional
 * @param references supporting citations
 * @param evidence substrate evidence
 * @param substrates carried substrates
 */
public record Carrier(
    String subtype,
    Boolean betaBranching,
    List<Citation> references,
    List<SubstrateEvidence> evidence,
    List<DomainSubstrate> substrates
) implements DomainInfo {

    public static final Set<String> VALID_SUBTYPES = Set.of("ACP", "PCP");

    public Carrier {
        references = references == null ? List.of() : List.copyOf(references);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        substrates = substrates == null ? List.of() : List.copyOf(substrates);
    }

    /**
     * Creates a carrier with no references or substrates.
     */
    public static Carrier of(String subtype, Boolean betaBranching) {
        return new Carrier(subtype, betaBranching, List.of(), List.of(), List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(DomainInfo.checkSubtype("Carrier", subtype, VALID_SUBTYPES));
        errors.addAll(Citation.validateAll(references, context));
        errors.addAll(Validatable.validateAll(evidence, context));
        errors.addAll(Validatable.validateAll(substrates, context));
        errors.addAll(DomainInfo.checkSubstrateEvidence("Carrier", substrates, evidence, context));
        return errors;
    }

    public static Carrier fromJson(JsonNode node) {
        return new Carrier(
            JsonFields.optionalText(node, "subtype", "Carrier"),
            JsonFields.optionalBool(node, "beta_branching", "Carrier"),
            JsonFields.list(node, "references", "Carrier", Citation::fromJson),
            JsonFields.list(node, "evidence", "Carrier", SubstrateEvidence::fromJson),
            JsonFields.list(node, "substrates", "Carrier", DomainSubstrate::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        JsonFields.putIfPresent(node, "beta_branching", betaBranching);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        JsonFields.putListIfNotEmpty(node, "substrates", substrates, DomainSubstrate::toJson);
        return node;
    }
}
