package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.validation.ValidationContext;

import java.util.List;

/**
 * Loading module of a trans-AT PKS; it has no core domains of its own.
 *
 * @param carriers carrier (ACP) domains
 * @param modificationDomains tailoring domains
 */
public record PksTransAtStarter(List<Domain> carriers, List<Domain> modificationDomains) implements ModuleInfo {

    public PksTransAtStarter {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        return ModuleInfo.checkDomains("PksTransAtStarter", this, context);
    }

    public static PksTransAtStarter fromJson(JsonNode node) {
        return new PksTransAtStarter(
            ModuleInfo.readCarriers(node, "PksTransAtStarter"),
            ModuleInfo.readModificationDomains(node, "PksTransAtStarter"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
