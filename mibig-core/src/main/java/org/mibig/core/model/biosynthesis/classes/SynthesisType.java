package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationException;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Closed catalog of biosynthetic classes. Wire values keep their historical casing.
 */
public enum SynthesisType {
    NRPS("NRPS", Nrps.class, Nrps::fromJson),
    PKS("PKS", Pks.class, Pks::fromJson),
    RIBOSOMAL("ribosomal", Ribosomal.class, Ribosomal::fromJson),
    SACCHARIDE("saccharide", Saccharide.class, Saccharide::fromJson),
    TERPENE("TERPENE", Terpene.class, Terpene::fromJson),
    OTHER("OTHER", OtherClass.class, OtherClass::fromJson);

    private final String value;
    private final Class<? extends ClassInfo> payloadType;
    private final Function<JsonNode, ClassInfo> reader;

    SynthesisType(String value, Class<? extends ClassInfo> payloadType, Function<JsonNode, ClassInfo> reader) {
        this.value = value;
        this.payloadType = payloadType;
        this.reader = reader;
    }

    public String value() {
        return value;
    }

    public Class<? extends ClassInfo> payloadType() {
        return payloadType;
    }

    public ClassInfo readPayload(JsonNode node) {
        return reader.apply(node);
    }

    public static SynthesisType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst()
            .orElseThrow(() -> ValidationException.of("BiosynthesisClass.class", "Unknown class '" + value + "'"));
    }
}
