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
 * Cis-AT modular PKS elongation module: the trans-AT shape plus a mandatory acyltransferase.
 *
 * @param atDomain acyltransferase domain
 * @param ksDomain ketosynthase domain
 * @param carriers carrier (ACP) domains
 * @param modificationDomains tailoring domains, e.g. KR, DH, ER
 */
public record PksModular(Domain atDomain, Domain ksDomain, List<Domain> carriers, List<Domain> modificationDomains)
    implements ModuleInfo {

    public PksModular {
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
        errors.addAll(ModuleInfo.checkDomains("PksModular", this, context));
        return errors;
    }

    public static PksModular fromJson(JsonNode node) {
        return new PksModular(
            ModuleInfo.readSlot(node, "at_domain", "PksModular"),
            ModuleInfo.readSlot(node, "ks_domain", "PksModular"),
            ModuleInfo.readCarriers(node, "PksModular"),
            ModuleInfo.readModificationDomains(node, "PksModular"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeSlot(node, "at_domain", atDomain);
        ModuleInfo.writeSlot(node, "ks_domain", ksDomain);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
