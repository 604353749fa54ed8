package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Iterative PKS module: the modular shape used a fixed number of times.
 *
 * @param atDomain acyltransferase domain
 * @param ksDomain ketosynthase domain
 * @param carriers carrier (ACP) domains
 * @param modificationDomains tailoring domains
 * @param iterations number of rounds, at least 1
 */
public record PksIterative(
    Domain atDomain,
    Domain ksDomain,
    List<Domain> carriers,
    List<Domain> modificationDomains,
    int iterations
) implements ModuleInfo {

    public PksIterative {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return ModuleInfo.present(ksDomain, atDomain);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(ModuleInfo.checkSlot("at_domain", atDomain, true, DomainType.ACYLTRANSFERASE));
        errors.addAll(ModuleInfo.checkSlot("ks_domain", ksDomain, true, DomainType.KETOSYNTHASE));
        if (iterations < 1) {
            errors.add(new ValidationErrorInfo("PksIterative.iterations", "Must be greater than 0"));
        }
        errors.addAll(ModuleInfo.checkDomains("PksIterative", this, context));
        return errors;
    }

    public static PksIterative fromJson(JsonNode node) {
        return new PksIterative(
            ModuleInfo.readSlot(node, "at_domain", "PksIterative"),
            ModuleInfo.readSlot(node, "ks_domain", "PksIterative"),
            ModuleInfo.readCarriers(node, "PksIterative"),
            ModuleInfo.readModificationDomains(node, "PksIterative"),
            JsonFields.integer(node, "iterations", "PksIterative"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeSlot(node, "at_domain", atDomain);
        ModuleInfo.writeSlot(node, "ks_domain", ksDomain);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        node.put("iterations", iterations);
        return node;
    }
}
