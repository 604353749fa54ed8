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

/**
 * Payload for domains outside the named catalog. The subtype names the domain and is mandatory.
 *
 * @param subtype free-text domain name, e.g. {@code Sulfotransferase}
 * @param activity catalytic activity, {@code active} on the wire
 * @param references supporting citations
 * @param evidence substrate evidence
 * @param substrates substrates
 */
public record OtherDomain(
    String subtype,
    Activity activity,
    List<Citation> references,
    List<SubstrateEvidence> evidence,
    List<DomainSubstrate> substrates
) implements DomainInfo {

    public OtherDomain {
        activity = Activity.orUnspecified(activity);
        references = references == null ? List.of() : List.copyOf(references);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        substrates = substrates == null ? List.of() : List.copyOf(substrates);
    }

    public static OtherDomain named(String subtype) {
        return new OtherDomain(subtype, Activity.UNSPECIFIED, List.of(), List.of(), List.of());
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subtype == null || subtype.isBlank()) {
            errors.add(new ValidationErrorInfo("OtherDomain.subtype", "Missing subtype"));
        }
        errors.addAll(Citation.validateAll(references, context));
        errors.addAll(Validatable.validateAll(evidence, context));
        errors.addAll(Validatable.validateAll(substrates, context));
        errors.addAll(DomainInfo.checkSubstrateEvidence("OtherDomain", substrates, evidence, context));
        return errors;
    }

    public static OtherDomain fromJson(JsonNode node) {
        return new OtherDomain(
            JsonFields.optionalText(node, "subtype", "OtherDomain"),
            Activity.readActive(node, "OtherDomain"),
            JsonFields.list(node, "references", "OtherDomain", Citation::fromJson),
            JsonFields.list(node, "evidence", "OtherDomain", SubstrateEvidence::fromJson),
            JsonFields.list(node, "substrates", "OtherDomain", DomainSubstrate::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subtype", subtype);
        activity.writeActive(node);
        JsonFields.putListIfNotEmpty(node, "references", references, Citation::toJson);
        JsonFields.putListIfNotEmpty(node, "evidence", evidence, SubstrateEvidence::toJson);
        JsonFields.putListIfNotEmpty(node, "substrates", substrates, DomainSubstrate::toJson);
        return node;
    }
}
