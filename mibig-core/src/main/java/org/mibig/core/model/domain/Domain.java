package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A catalytic domain on a gene product.
 *
 * <p>Wire form is the payload's fields flattened next to the common ones:
 * <pre>{@code
 * {"type": "ketoreductase", "gene": "eryAI", "location": {"from": 1640, "to": 1820},
 *  "stereochemistry": "B1", "evidence": [...]}
 * }</pre>
 *
 * @param type domain kind, fixes the payload type
 * @param gene gene carrying the domain
 * @param location position on the translation
 * @param extraInfo type-specific payload
 */
public record Domain(DomainType type, GeneId gene, Location location, DomainInfo extraInfo) implements Validatable {

    public Domain {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(gene, "gene must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(extraInfo, "extraInfo must not be null");
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(gene.validate(context));
        errors.addAll(location.validate(context, context.cds(gene.value()).orElse(null)));
        if (!type.payloadType().isInstance(extraInfo)) {
            errors.add(new ValidationErrorInfo("Domain.extra_info",
                "Payload " + extraInfo.getClass().getSimpleName() + " does not match domain type " + type.value()));
        }
        errors.addAll(extraInfo.validate(context));
        return errors;
    }

    public List<Citation> references() {
        return extraInfo.allReferences();
    }

    public List<SubstrateEvidence> evidence() {
        return extraInfo.evidence();
    }

    public List<? extends Substrate> substrates() {
        return extraInfo.substrates();
    }

    public static Domain fromJson(JsonNode node) {
        JsonFields.object(node, "Domain");
        DomainType type = DomainType.fromValue(JsonFields.text(node, "type", "Domain"));
        return new Domain(
            type,
            GeneId.fromJson(JsonFields.required(node, "gene", "Domain")),
            Location.fromJson(JsonFields.required(node, "location", "Domain")),
            type.readPayload(node));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("type", type.value());
        node.set("gene", gene.toJson());
        node.set("location", location.toJson());
        JsonFields.merge(node, extraInfo.toJson());
        return node;
    }
}
