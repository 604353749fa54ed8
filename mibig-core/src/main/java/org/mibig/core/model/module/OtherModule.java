package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Module of an architecture outside the catalog. Its domains are listed without core slots.
 *
 * @param subtype free-text architecture name, mandatory
 * @param carriers carrier domains
 * @param modificationDomains all other domains
 */
public record OtherModule(String subtype, List<Domain> carriers, List<Domain> modificationDomains)
    implements ModuleInfo {

    public OtherModule {
        carriers = ModuleInfo.copy(carriers);
        modificationDomains = ModuleInfo.copy(modificationDomains);
    }

    @Override
    public List<Domain> coreDomains() {
        return List.of();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subtype == null || subtype.isBlank()) {
            errors.add(new ValidationErrorInfo("OtherModule.subtype", "Missing subtype"));
        }
        errors.addAll(ModuleInfo.checkDomains("OtherModule", this, context));
        return errors;
    }

    public static OtherModule fromJson(JsonNode node) {
        return new OtherModule(
            JsonFields.optionalText(node, "subtype", "OtherModule"),
            ModuleInfo.readCarriers(node, "OtherModule"),
            ModuleInfo.readModificationDomains(node, "OtherModule"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        ModuleInfo.writeOptionalDomains(node, carriers, modificationDomains);
        return node;
    }
}
