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
 * Loading module of a cis-AT modular PKS: acyltransferase without ketosynthase.
 *
 * @param atDomain acyltransferase domain
 * @param carriers carrier (ACP) domains
 * @param modificationDomains tailoring domains
 */
public record PksModularStarter(Domain atDomain, List<Domain> carriers, List<Domain> modificationDomains)
    implements ModuleInfo {

    public PksModularStarter {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return ModuleInfo.present(atDomain);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(
            ModuleInfo.checkSlot("at_domain", atDomain, true, DomainType.ACYLTRANSFERASE));
        errors.addAll(ModuleInfo.checkDomains("PksModularStarter", this, context));
        return errors;
    }

    public static PksModularStarter fromJson(JsonNode node) {
        return new PksModularStarter(
            ModuleInfo.readSlot(node, "at_domain", "PksModularStarter"),
            ModuleInfo.readCarriers(node, "PksModularStarter"),
            ModuleInfo.readModificationDomains(node, "PksModularStarter"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeSlot(node, "at_domain", atDomain);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
