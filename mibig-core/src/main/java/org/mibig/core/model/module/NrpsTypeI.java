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
 * Canonical NRPS elongation module: adenylation plus optional condensation domain.
 *
 * @param aDomain adenylation domain
 * @param cDomain condensation domain, absent for starter modules
 * @param carriers carrier (PCP) domains
 * @param modificationDomains tailoring domains, e.g. epimerase or methyltransferase
 */
public record NrpsTypeI(Domain aDomain, Domain cDomain, List<Domain> carriers, List<Domain> modificationDomains)
    implements ModuleInfo {

    public NrpsTypeI {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return ModuleInfo.present(cDomain, aDomain);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        errors.addAll(ModuleInfo.checkSlot("a_domain", aDomain, true, DomainType.ADENYLATION, DomainType.AMP_BINDING));
        errors.addAll(ModuleInfo.checkSlot("c_domain", cDomain, false, DomainType.CONDENSATION));
        errors.addAll(ModuleInfo.checkDomains("NrpsTypeI", this, context));
        return errors;
    }

    public static NrpsTypeI fromJson(JsonNode node) {
        return new NrpsTypeI(
            ModuleInfo.readSlot(node, "a_domain", "NrpsTypeI"),
            ModuleInfo.readSlot(node, "c_domain", "NrpsTypeI"),
            ModuleInfo.readCarriers(node, "NrpsTypeI"),
            ModuleInfo.readModificationDomains(node, "NrpsTypeI"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        ModuleInfo.writeSlot(node, "a_domain", aDomain);
        ModuleInfo.writeSlot(node, "c_domain", cDomain);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
