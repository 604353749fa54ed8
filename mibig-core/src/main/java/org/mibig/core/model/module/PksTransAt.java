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
 * Trans-AT PKS elongation module: ketosynthase only, the AT acts in trans.
 *
 * @param ksDomain ketosynthase domain
 * @param carriers carrier (ACP) domains
 * @param modificationDomains tailoring domains
 */
public record PksTransAt(Domain ksDomain, List<Domain> carriers, List<Domain> modificationDomains)
    implements ModuleInfo {

    public PksTransAt {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return ModuleInfo.present(ksDomain);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(
            ModuleInfo.checkSlot("ks_domain", ksDomain, true, DomainType.KETOSYNTHASE));
        errors.addAll(ModuleInfo.checkDomains("PksTransAt", this, context));
        return errors;
    }

    public static PksTransAt fromJson(JsonNode node) {
        return new PksTransAt(
            ModuleInfo.readSlot(node, "ks_domain", "PksTransAt"),
            ModuleInfo.readCarriers(node, "PksTransAt"),
            ModuleInfo.readModificationDomains(node, "PksTransAt"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeSlot(node, "ks_domain", ksDomain);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
