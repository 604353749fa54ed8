package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.List;
import java.util.Objects;

/**
 * One biosynthetic class of a cluster, tagged by {@link SynthesisType}.
 *
 * <p>At the questionable tier the payload is not validated at all, so freshly migrated legacy
 * data passes regardless of its vocabulary.
 *
 * @param type class tag, fixes the payload type
 * @param extraInfo class-specific payload
 */
public record BiosynthesisClass(SynthesisType type, ClassInfo extraInfo) implements Validatable {

    public BiosynthesisClass {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(extraInfo, "extraInfo must not be null");
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        if (!type.payloadType().isInstance(extraInfo)) {
            return List.of(new ValidationErrorInfo("BiosynthesisClass.extra_info",
                "Payload " + extraInfo.getClass().getSimpleName() + " does not match class " + type.value()));
        }
        if (context.isRelaxed()) {
            return List.of();
        }
        return extraInfo.validate(context);
    }

    public List<Citation> references() {
        return extraInfo.references();
    }

    public static BiosynthesisClass fromJson(JsonNode node) {
        JsonFields.object(node, "BiosynthesisClass");
        SynthesisType type = SynthesisType.fromValue(JsonFields.text(node, "class", "BiosynthesisClass"));
        return new BiosynthesisClass(type, type.readPayload(node));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("class", type.value());
        JsonFields.merge(node, extraInfo.toJson());
        return node;
    }
}
