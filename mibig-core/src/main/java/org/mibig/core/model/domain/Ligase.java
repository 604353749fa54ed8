package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Ligase payload, e.g. a CoA-ligase. Substrates are given as structures only.
 *
 * @param substrateStructures structures of the ligated substrates
 * @param evidence evidence for the specificity
 */
public record Ligase(List<Smiles> substrateStructures, List<SubstrateEvidence> evidence) implements DomainInfo {

    public Ligase {
        substrateStructures = substrateStructures == null ? List.of() : List.copyOf(substrateStructures);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public List<Citation> references() {
        return List.of();
    }

    @Override
    public List<DomainSubstrate> substrates() {
        return substrateStructures.stream()
            .map(smiles -> new DomainSubstrate(smiles.value(), smiles))
            .toList();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(DomainInfo.checkSubstrateEvidence("Ligase", substrateStructures, evidence, context));
        errors.addAll(Validatable.validateAll(substrateStructures, context));
        errors.addAll(Validatable.validateAll(evidence, context));
        return errors;
    }

    public static Ligase fromJson(JsonNode node) {
        return new Ligase(
            JsonFields.list(node, "substrates", "Ligase", Smiles::fromJson),
            JsonFields.list(node, "evidence", "Ligase", SubstrateEvidence::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putListIfNotEmpty(node, "substrates", substrateStructures, Smiles::toJson);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        return node;
    }
}
