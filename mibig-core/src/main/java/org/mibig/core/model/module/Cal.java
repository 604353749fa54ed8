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
 * Module loading a starter unit through a CoA-ligase (CAL) domain.
 *
 * @param calDomain the CoA-ligase domain, {@code cal} on the wire
 * @param carriers carrier domains
 * @param modificationDomains tailoring domains
 */
public record Cal(Domain calDomain, List<Domain> carriers, List<Domain> modificationDomains) implements ModuleInfo {

    public Cal {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return ModuleInfo.present(calDomain);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(
            ModuleInfo.checkSlot("cal", calDomain, true, DomainType.LIGASE));
        errors.addAll(ModuleInfo.checkDomains("Cal", this, context));
        return errors;
    }

    public static Cal fromJson(JsonNode node) {
        return new Cal(
            ModuleInfo.readSlot(node, "cal", "Cal"),
            ModuleInfo.readCarriers(node, "Cal"),
            ModuleInfo.readModificationDomains(node, "Cal"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeSlot(node, "cal", calDomain);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
